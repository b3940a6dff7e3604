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

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Contract for mapping the current {@link ResultSet} row of a KPI query to a {@link KpiMeasurement}.
 * <p>
 * Rows follow the projection documented on {@link KpiQueryBuilder}: timestamp, KPI identifier, value, network element,
 * cell ID and host, at column indices 1 through 6.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 * Or, implement your own: <pre>{@code  ResultSetMapper myImpl = (statementContext, resultSet) -> {
 *   // read the projected columns from resultSet
 *   return KpiMeasurement.of(...);
 * };}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultSetMapper {
	/**
	 * Maps the current row of {@code resultSet}.
	 *
	 * @param statementContext the statement which produced {@code resultSet}
	 * @param resultSet provides raw row data to pull from
	 * @return the measurement for this row
	 * @throws SQLException     if the driver fails to read a column
	 * @throws MappingException if the row does not have the expected shape, e.g. a required column is {@code NULL}
	 */
	@NonNull
	KpiMeasurement map(@NonNull StatementContext statementContext,
										 @NonNull ResultSet resultSet) throws SQLException;

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ResultSetMapper withDefaultConfiguration() {
		return new DefaultResultSetMapper();
	}
}
