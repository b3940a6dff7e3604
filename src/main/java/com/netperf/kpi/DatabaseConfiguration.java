/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netperf.kpi;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Connection parameters for the KPI store.
 * <p>
 * Instances are resolved once at the call boundary, either explicitly via {@link #builder()} or from environment
 * variables via {@link #fromEnvironment()}:
 * <table>
 *   <caption>Recognized environment variables</caption>
 *   <tr><th>Variable</th><th>Default</th></tr>
 *   <tr><td>{@code DB_HOST}</td><td>{@value #DEFAULT_HOST}</td></tr>
 *   <tr><td>{@code DB_PORT}</td><td>{@value #DEFAULT_PORT}</td></tr>
 *   <tr><td>{@code DB_USER}</td><td>{@value #DEFAULT_USER}</td></tr>
 *   <tr><td>{@code DB_PASSWORD}</td><td>{@value #DEFAULT_PASSWORD}</td></tr>
 *   <tr><td>{@code DB_NAME}</td><td>{@value #DEFAULT_DATABASE_NAME}</td></tr>
 *   <tr><td>{@code DB_CONNECT_TIMEOUT_SECONDS}</td><td>10</td></tr>
 *   <tr><td>{@code DB_STATEMENT_TIMEOUT_SECONDS}</td><td>30</td></tr>
 * </table>
 * Unset or blank variables fall back to their defaults.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DatabaseConfiguration {
	@NonNull
	public static final String HOST_VARIABLE = "DB_HOST";
	@NonNull
	public static final String PORT_VARIABLE = "DB_PORT";
	@NonNull
	public static final String USER_VARIABLE = "DB_USER";
	@NonNull
	public static final String PASSWORD_VARIABLE = "DB_PASSWORD";
	@NonNull
	public static final String DATABASE_NAME_VARIABLE = "DB_NAME";
	@NonNull
	public static final String CONNECT_TIMEOUT_VARIABLE = "DB_CONNECT_TIMEOUT_SECONDS";
	@NonNull
	public static final String STATEMENT_TIMEOUT_VARIABLE = "DB_STATEMENT_TIMEOUT_SECONDS";

	@NonNull
	public static final String DEFAULT_HOST = "127.0.0.1";
	public static final int DEFAULT_PORT = 5432;
	@NonNull
	public static final String DEFAULT_USER = "postgres";
	@NonNull
	public static final String DEFAULT_PASSWORD = "pass";
	@NonNull
	public static final String DEFAULT_DATABASE_NAME = "netperf";
	@NonNull
	public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	@NonNull
	public static final Duration DEFAULT_STATEMENT_TIMEOUT = Duration.ofSeconds(30);

	@NonNull
	private final String host;
	private final int port;
	@NonNull
	private final String user;
	@NonNull
	private final String password;
	@NonNull
	private final String databaseName;
	@NonNull
	private final Duration connectTimeout;
	@NonNull
	private final Duration statementTimeout;

	private DatabaseConfiguration(@NonNull Builder builder) {
		requireNonNull(builder);

		this.host = builder.host == null ? DEFAULT_HOST : builder.host;
		this.port = builder.port == null ? DEFAULT_PORT : builder.port;
		this.user = builder.user == null ? DEFAULT_USER : builder.user;
		this.password = builder.password == null ? DEFAULT_PASSWORD : builder.password;
		this.databaseName = builder.databaseName == null ? DEFAULT_DATABASE_NAME : builder.databaseName;
		this.connectTimeout = builder.connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : builder.connectTimeout;
		this.statementTimeout = builder.statementTimeout == null ? DEFAULT_STATEMENT_TIMEOUT : builder.statementTimeout;

		if (this.port < 1 || this.port > 65535)
			throw new IllegalArgumentException(format("Illegal port %d", this.port));
		if (this.connectTimeout.isNegative())
			throw new IllegalArgumentException("Connect timeout must not be negative");
		if (this.statementTimeout.isNegative())
			throw new IllegalArgumentException("Statement timeout must not be negative");
	}

	/**
	 * Acquires a builder whose unset values fall back to the documented defaults.
	 *
	 * @return a {@link DatabaseConfiguration} builder
	 */
	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Resolves a configuration from the process environment.
	 *
	 * @return the resolved configuration
	 * @throws IllegalArgumentException if a numeric variable is present but malformed
	 */
	@NonNull
	public static DatabaseConfiguration fromEnvironment() {
		return fromEnvironment(System.getenv());
	}

	/**
	 * Resolves a configuration from the given variables, which take the same names as the process environment.
	 *
	 * @param environment the variables to resolve from
	 * @return the resolved configuration
	 * @throws IllegalArgumentException if a numeric variable is present but malformed
	 */
	@NonNull
	public static DatabaseConfiguration fromEnvironment(@NonNull Map<String, String> environment) {
		requireNonNull(environment);

		Integer connectTimeoutSeconds = integerValue(environment, CONNECT_TIMEOUT_VARIABLE);
		Integer statementTimeoutSeconds = integerValue(environment, STATEMENT_TIMEOUT_VARIABLE);

		return builder()
				.host(stringValue(environment, HOST_VARIABLE))
				.port(integerValue(environment, PORT_VARIABLE))
				.user(stringValue(environment, USER_VARIABLE))
				.password(untrimmedStringValue(environment, PASSWORD_VARIABLE))
				.databaseName(stringValue(environment, DATABASE_NAME_VARIABLE))
				.connectTimeout(connectTimeoutSeconds == null ? null : Duration.ofSeconds(connectTimeoutSeconds))
				.statementTimeout(statementTimeoutSeconds == null ? null : Duration.ofSeconds(statementTimeoutSeconds))
				.build();
	}

	@Nullable
	private static String stringValue(@NonNull Map<String, String> environment,
																		@NonNull String name) {
		String value = environment.get(name);
		return value == null || value.trim().length() == 0 ? null : value.trim();
	}

	// Passwords may legitimately start or end with whitespace
	@Nullable
	private static String untrimmedStringValue(@NonNull Map<String, String> environment,
																						 @NonNull String name) {
		String value = environment.get(name);
		return value == null || value.trim().length() == 0 ? null : value;
	}

	@Nullable
	private static Integer integerValue(@NonNull Map<String, String> environment,
																			@NonNull String name) {
		String value = stringValue(environment, name);

		if (value == null)
			return null;

		try {
			return Integer.valueOf(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(format("Environment variable %s must be an integer but was '%s'", name, value), e);
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(getHost(), getPort(), getUser(), getPassword(), getDatabaseName(), getConnectTimeout(), getStatementTimeout());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DatabaseConfiguration))
			return false;

		DatabaseConfiguration databaseConfiguration = (DatabaseConfiguration) object;

		return Objects.equals(databaseConfiguration.getHost(), getHost())
				&& databaseConfiguration.getPort() == getPort()
				&& Objects.equals(databaseConfiguration.getUser(), getUser())
				&& Objects.equals(databaseConfiguration.getPassword(), getPassword())
				&& Objects.equals(databaseConfiguration.getDatabaseName(), getDatabaseName())
				&& Objects.equals(databaseConfiguration.getConnectTimeout(), getConnectTimeout())
				&& Objects.equals(databaseConfiguration.getStatementTimeout(), getStatementTimeout());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(7);

		components.add(format("host=%s", getHost()));
		components.add(format("port=%d", getPort()));
		components.add(format("user=%s", getUser()));
		// Never log the password
		components.add("password=***");
		components.add(format("databaseName=%s", getDatabaseName()));
		components.add(format("connectTimeout=%s", getConnectTimeout()));
		components.add(format("statementTimeout=%s", getStatementTimeout()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	public int getPort() {
		return this.port;
	}

	@NonNull
	public String getUser() {
		return this.user;
	}

	@NonNull
	public String getPassword() {
		return this.password;
	}

	@NonNull
	public String getDatabaseName() {
		return this.databaseName;
	}

	@NonNull
	public Duration getConnectTimeout() {
		return this.connectTimeout;
	}

	@NonNull
	public Duration getStatementTimeout() {
		return this.statementTimeout;
	}

	/**
	 * Builder used to construct instances of {@link DatabaseConfiguration}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private String host;
		@Nullable
		private Integer port;
		@Nullable
		private String user;
		@Nullable
		private String password;
		@Nullable
		private String databaseName;
		@Nullable
		private Duration connectTimeout;
		@Nullable
		private Duration statementTimeout;

		private Builder() {
			// Use the factory method
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		@NonNull
		public Builder user(@Nullable String user) {
			this.user = user;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		@NonNull
		public Builder databaseName(@Nullable String databaseName) {
			this.databaseName = databaseName;
			return this;
		}

		@NonNull
		public Builder connectTimeout(@Nullable Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		@NonNull
		public Builder statementTimeout(@Nullable Duration statementTimeout) {
			this.statementTimeout = statementTimeout;
			return this;
		}

		@NonNull
		public DatabaseConfiguration build() {
			return new DatabaseConfiguration(this);
		}
	}
}
