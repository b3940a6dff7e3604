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

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Identifies different types of databases, which allows for special platform-specific handling of array-valued filters.
 *
 * @since 1.0.0
 */
public enum DatabaseType {
	/**
	 * A database which requires no special handling: {@code column = ANY(?)} with a {@code VARCHAR} array.
	 */
	GENERIC("VARCHAR", "%s = ANY(?)", "CAST(%s AS VARCHAR(255))"),
	/**
	 * A PostgreSQL database: {@code column = ANY(?)} with a {@code text} array.
	 */
	POSTGRESQL("text", "%s = ANY(?)", "CAST(%s AS TEXT)"),
	/**
	 * An HSQLDB database, which expresses array membership as {@code column IN (UNNEST(?))}.
	 */
	HSQLDB("VARCHAR", "%s IN (UNNEST(?))", "CAST(%s AS VARCHAR(255))");

	@NonNull
	private final String arrayBaseTypeName;
	@NonNull
	private final String arrayMembershipTemplate;
	@NonNull
	private final String textCastTemplate;

	DatabaseType(@NonNull String arrayBaseTypeName,
							 @NonNull String arrayMembershipTemplate,
							 @NonNull String textCastTemplate) {
		this.arrayBaseTypeName = requireNonNull(arrayBaseTypeName);
		this.arrayMembershipTemplate = requireNonNull(arrayMembershipTemplate);
		this.textCastTemplate = requireNonNull(textCastTemplate);
	}

	/**
	 * Determines the type of database to which the given {@code connection} is connected.
	 *
	 * @param connection an open connection
	 * @return the type of database
	 * @throws SQLException if database metadata cannot be read
	 */
	@NonNull
	public static DatabaseType fromConnection(@NonNull Connection connection) throws SQLException {
		requireNonNull(connection);

		DatabaseMetaData databaseMetaData = connection.getMetaData();
		String databaseProductName = databaseMetaData.getDatabaseProductName();
		String url = databaseMetaData.getURL();
		String driverName = databaseMetaData.getDriverName();

		// All of our checks are against databases with English names
		String databaseProductNameLowercase = databaseProductName == null ? "" : databaseProductName.toLowerCase(Locale.ENGLISH);
		String urlLowercase = url == null ? "" : url.toLowerCase(Locale.ENGLISH);
		String driverNameLowercase = driverName == null ? "" : driverName.toLowerCase(Locale.ENGLISH);

		if (databaseProductNameLowercase.startsWith("hsql") || urlLowercase.startsWith("jdbc:hsqldb:"))
			return DatabaseType.HSQLDB;

		// Strict match for PostgreSQL
		if (databaseProductNameLowercase.contains("postgresql") || databaseProductNameLowercase.equals("postgres"))  // some proxies shorten it
			return DatabaseType.POSTGRESQL;

		// Fallbacks if product name is absent/weird but we're clearly using the PG driver/URL
		if (urlLowercase.startsWith("jdbc:postgresql:") || driverNameLowercase.contains("postgresql"))
			return DatabaseType.POSTGRESQL;

		return DatabaseType.GENERIC;
	}

	/**
	 * Builds the predicate which tests {@code column} for membership in a single array-valued parameter.
	 *
	 * @param column the column to test, already validated as a SQL identifier
	 * @return the predicate, containing exactly one {@code ?} placeholder
	 */
	@NonNull
	public String arrayMembershipPredicate(@NonNull String column) {
		requireNonNull(column);
		return format(this.arrayMembershipTemplate, column);
	}

	/**
	 * Like {@link #arrayMembershipPredicate(String)}, but compares the column's text form, for columns which may be
	 * numeric (e.g. integer cell IDs) while the array holds strings.
	 *
	 * @param column the column to test, already validated as a SQL identifier
	 * @return the predicate, containing exactly one {@code ?} placeholder
	 */
	@NonNull
	public String textArrayMembershipPredicate(@NonNull String column) {
		requireNonNull(column);
		return arrayMembershipPredicate(format(this.textCastTemplate, column));
	}

	/**
	 * The element type name passed to {@link Connection#createArrayOf(String, Object[])} for string-valued arrays.
	 *
	 * @return the element type name
	 */
	@NonNull
	public String getArrayBaseTypeName() {
		return this.arrayBaseTypeName;
	}
}
