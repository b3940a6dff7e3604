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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link PreparedStatementBinder}.
 * <p>
 * {@link LocalDateTime} values are bound as zone-less SQL timestamps and {@link ArrayParameter} values as SQL arrays
 * whose element type comes from the context's {@link DatabaseType}. Anything else is handed to the driver as-is.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultPreparedStatementBinder implements PreparedStatementBinder {
	@Override
	public void bindParameter(@NonNull StatementContext statementContext,
														@NonNull PreparedStatement preparedStatement,
														@NonNull Integer parameterIndex,
														@NonNull Object parameter) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(parameter);

		if (parameter instanceof LocalDateTime localDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
				preparedStatement.setTimestamp(parameterIndex, Timestamp.valueOf(localDateTime));

			return;
		}

		if (parameter instanceof ArrayParameter arrayParameter) {
			Array array = preparedStatement.getConnection().createArrayOf(
					statementContext.getDatabaseType().getArrayBaseTypeName(), arrayParameter.getElements().toArray());
			// Released once the statement has run
			statementContext.addCleanupOperation(array::free);
			preparedStatement.setArray(parameterIndex, array);
			return;
		}

		preparedStatement.setObject(parameterIndex, parameter);
	}

	/**
	 * Try JDBC 4.2 setObject with an explicit SQL type; return false if unsupported.
	 */
	protected boolean trySetObject(@NonNull PreparedStatement preparedStatement,
																 @NonNull Integer parameterIndex,
																 @NonNull Object value,
																 int sqlType) throws SQLException {
		try {
			preparedStatement.setObject(parameterIndex, value, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}
}
