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
import org.postgresql.ds.PGSimpleDataSource;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Opens one physical connection per retrieval and hands it out as a {@link ScopedConnection}.
 * <p>
 * No pooling is performed here. If pooling is desired, supply a pooling {@link DataSource} to
 * {@link #withDataSource(DataSource)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ConnectionManager {
	@NonNull
	private static final String APPLICATION_NAME = "netperf-kpi";

	@NonNull
	private final DataSource dataSource;
	@Nullable
	private final DatabaseConfiguration databaseConfiguration;
	@NonNull
	private final Logger logger;

	private ConnectionManager(@NonNull DataSource dataSource,
														@Nullable DatabaseConfiguration databaseConfiguration) {
		this.dataSource = requireNonNull(dataSource);
		this.databaseConfiguration = databaseConfiguration;
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Creates a connection manager for the PostgreSQL server described by {@code databaseConfiguration}.
	 *
	 * @param databaseConfiguration connection parameters
	 * @return a connection manager
	 */
	@NonNull
	public static ConnectionManager forConfiguration(@NonNull DatabaseConfiguration databaseConfiguration) {
		requireNonNull(databaseConfiguration);

		PGSimpleDataSource dataSource = new PGSimpleDataSource();
		dataSource.setServerNames(new String[]{databaseConfiguration.getHost()});
		dataSource.setPortNumbers(new int[]{databaseConfiguration.getPort()});
		dataSource.setDatabaseName(databaseConfiguration.getDatabaseName());
		dataSource.setUser(databaseConfiguration.getUser());
		dataSource.setPassword(databaseConfiguration.getPassword());
		dataSource.setConnectTimeout(connectTimeoutSeconds(databaseConfiguration.getConnectTimeout()));
		dataSource.setApplicationName(APPLICATION_NAME);

		return new ConnectionManager(dataSource, databaseConfiguration);
	}

	// The driver has one-second granularity; 0 means no limit
	private static int connectTimeoutSeconds(@NonNull Duration connectTimeout) {
		requireNonNull(connectTimeout);

		long seconds = connectTimeout.toSeconds();

		if (seconds == 0 && !connectTimeout.isZero())
			seconds = 1;

		return (int) Math.min(seconds, Integer.MAX_VALUE);
	}

	/**
	 * Creates a connection manager which acquires connections from an arbitrary {@link DataSource}.
	 *
	 * @param dataSource the connection factory
	 * @return a connection manager
	 */
	@NonNull
	public static ConnectionManager withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new ConnectionManager(dataSource, null);
	}

	/**
	 * Opens a new physical connection.
	 * <p>
	 * The caller owns the returned scope and must close it, ideally via try-with-resources.
	 *
	 * @return the scoped connection
	 * @throws ConnectionException if the store cannot be reached or authenticated
	 */
	@NonNull
	public ScopedConnection acquire() {
		Connection connection;

		try {
			connection = getDataSource().getConnection();
		} catch (SQLException | RuntimeException e) {
			throw new ConnectionException(format("Unable to acquire database connection%s", describeTarget()), e);
		}

		if (connection == null)
			throw new ConnectionException(format("No database connection was provided%s", describeTarget()), null);

		logger.log(FINE, () -> format("Opened database connection%s", describeTarget()));

		return new ScopedConnection(connection);
	}

	@NonNull
	private String describeTarget() {
		DatabaseConfiguration databaseConfiguration = getDatabaseConfiguration().orElse(null);

		if (databaseConfiguration == null)
			return "";

		return format(" to %s:%d/%s", databaseConfiguration.getHost(), databaseConfiguration.getPort(),
				databaseConfiguration.getDatabaseName());
	}

	@NonNull
	public Optional<DatabaseConfiguration> getDatabaseConfiguration() {
		return Optional.ofNullable(this.databaseConfiguration);
	}

	@NonNull
	DataSource getDataSource() {
		return this.dataSource;
	}
}
