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

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Contract for binding parameters to SQL prepared statements.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface PreparedStatementBinder {
	/**
	 * Binds a single parameter to a SQL prepared statement.
	 *
	 * @param statementContext  current SQL context
	 * @param preparedStatement the prepared statement to bind to
	 * @param parameterIndex    1-based index of the parameter to bind
	 * @param parameter         the parameter to bind at the given index
	 * @throws SQLException if an error occurs during binding
	 */
	void bindParameter(@NonNull StatementContext statementContext,
										 @NonNull PreparedStatement preparedStatement,
										 @NonNull Integer parameterIndex,
										 @NonNull Object parameter) throws SQLException;

	/**
	 * Binds every parameter of the context's statement, in placeholder order.
	 *
	 * @param statementContext  current SQL context
	 * @param preparedStatement the prepared statement to bind to
	 * @throws SQLException if an error occurs during binding
	 */
	default void bindParameters(@NonNull StatementContext statementContext,
															@NonNull PreparedStatement preparedStatement) throws SQLException {
		int parameterIndex = 1;

		for (Object parameter : statementContext.getStatement().getParameters())
			bindParameter(statementContext, preparedStatement, parameterIndex++, parameter);
	}

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static PreparedStatementBinder withDefaultConfiguration() {
		return new DefaultPreparedStatementBinder();
	}
}
