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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.time.LocalDateTime;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link ResultSetMapper}.
 * <p>
 * Timestamps are read as {@link LocalDateTime} so the stored wall-clock value passes through untouched; cell IDs may be
 * stored as text or as integers.
 * <p>
 * Timestamp, KPI identifier and value are required. Network element, cell ID and host may be {@code NULL}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultSetMapper implements ResultSetMapper {
	static final int TIMESTAMP_COLUMN_INDEX = 1;
	static final int KPI_COLUMN_INDEX = 2;
	static final int VALUE_COLUMN_INDEX = 3;
	static final int NETWORK_ELEMENT_COLUMN_INDEX = 4;
	static final int CELL_ID_COLUMN_INDEX = 5;
	static final int HOST_COLUMN_INDEX = 6;

	@NonNull
	@Override
	public KpiMeasurement map(@NonNull StatementContext statementContext,
														@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(resultSet);

		LocalDateTime timestamp = readTimestamp(resultSet);
		String kpiIdentifier = requiredValue(resultSet.getString(KPI_COLUMN_INDEX), "KPI identifier", resultSet);
		Double value = readValue(resultSet);
		String networkElement = resultSet.getString(NETWORK_ELEMENT_COLUMN_INDEX);
		String cellId = readAsText(resultSet, CELL_ID_COLUMN_INDEX);
		String host = readAsText(resultSet, HOST_COLUMN_INDEX);

		return KpiMeasurement.of(timestamp, kpiIdentifier, value, networkElement, cellId, host);
	}

	@NonNull
	protected LocalDateTime readTimestamp(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);

		LocalDateTime localDateTime = tryGet(resultSet, TIMESTAMP_COLUMN_INDEX, LocalDateTime.class);

		if (localDateTime != null)
			return localDateTime;

		// Older drivers: fall back to java.sql.Timestamp, which carries the same wall-clock value
		Timestamp timestamp = resultSet.getTimestamp(TIMESTAMP_COLUMN_INDEX);
		return requiredValue(timestamp, "timestamp", resultSet).toLocalDateTime();
	}

	@NonNull
	protected Double readValue(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);

		Object rawValue = requiredValue(resultSet.getObject(VALUE_COLUMN_INDEX), "value", resultSet);

		if (rawValue instanceof Number number)
			return number.doubleValue();

		throw new MappingException(format("Expected a numeric value in row %d but found %s",
				resultSet.getRow(), rawValue.getClass().getName()));
	}

	@Nullable
	protected String readAsText(@NonNull ResultSet resultSet,
															int columnIndex) throws SQLException {
		requireNonNull(resultSet);

		Object rawValue = resultSet.getObject(columnIndex);
		return rawValue == null ? null : rawValue.toString().trim();
	}

	@NonNull
	protected <T> T requiredValue(@Nullable T value,
																@NonNull String description,
																@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(description);
		requireNonNull(resultSet);

		if (value == null)
			throw new MappingException(format("Unexpected NULL %s in row %d", description, resultSet.getRow()));

		return value;
	}

	/**
	 * Try JDBC 4.2 getObject; return null if unsupported.
	 */
	@Nullable
	protected static <T> T tryGet(@NonNull ResultSet resultSet,
																int columnIndex,
																@NonNull Class<T> type) throws SQLException {
		try {
			return resultSet.getObject(columnIndex, type);
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return null;
		}
	}
}
