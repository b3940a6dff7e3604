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
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * A physical {@link Connection} owned by exactly one retrieval, acquired via {@link ConnectionManager#acquire()}.
 * <p>
 * The underlying connection is closed the first time {@link #close()} is called; subsequent calls are no-ops.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ScopedConnection implements AutoCloseable {
	@NonNull
	private final Connection connection;
	@NonNull
	private final AtomicBoolean closed;
	@NonNull
	private final Logger logger;

	ScopedConnection(@NonNull Connection connection) {
		this.connection = requireNonNull(connection);
		this.closed = new AtomicBoolean(false);
		this.logger = Logger.getLogger(ScopedConnection.class.getName());
	}

	/**
	 * Gets the connection for use within this scope.
	 *
	 * @return the connection
	 * @throws IllegalStateException if this scope has already been closed
	 */
	@NonNull
	public Connection getConnection() {
		if (isClosed())
			throw new IllegalStateException(format("%s has already been closed", getClass().getSimpleName()));

		return this.connection;
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed.get();
	}

	/**
	 * Releases the underlying connection.
	 *
	 * @throws DatabaseException if the driver fails to close the connection
	 */
	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true))
			return;

		try {
			this.connection.close();
			logger.log(FINE, "Closed database connection");
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}
}
