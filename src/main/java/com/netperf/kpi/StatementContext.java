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
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that represents a SQL statement about to run against a particular kind of database.
 * <p>
 * Also carries the JDBC resources created while binding (e.g. {@link java.sql.Array} instances) that must be released
 * once the statement has run.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementContext {
	@NonNull
	private final Statement statement;
	@NonNull
	private final DatabaseType databaseType;
	@NonNull
	private final Queue<AutoCloseable> cleanupOperations;

	private StatementContext(@NonNull Statement statement,
													 @NonNull DatabaseType databaseType) {
		this.statement = requireNonNull(statement);
		this.databaseType = requireNonNull(databaseType);
		this.cleanupOperations = new ConcurrentLinkedQueue<>();
	}

	@NonNull
	public static StatementContext of(@NonNull Statement statement,
																		@NonNull DatabaseType databaseType) {
		requireNonNull(statement);
		requireNonNull(databaseType);

		return new StatementContext(statement, databaseType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatement(), getDatabaseType());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementContext))
			return false;

		StatementContext statementContext = (StatementContext) object;

		return Objects.equals(statementContext.getStatement(), getStatement())
				&& Objects.equals(statementContext.getDatabaseType(), getDatabaseType());
	}

	@Override
	public String toString() {
		return format("%s{statement=%s, databaseType=%s}", getClass().getSimpleName(), getStatement(), getDatabaseType().name());
	}

	@NonNull
	public Statement getStatement() {
		return this.statement;
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	/**
	 * Registers a resource to be closed after the statement has run, whether or not it succeeded.
	 *
	 * @param cleanupOperation the resource to close
	 */
	public void addCleanupOperation(@NonNull AutoCloseable cleanupOperation) {
		requireNonNull(cleanupOperation);
		this.cleanupOperations.add(cleanupOperation);
	}

	@NonNull
	Queue<AutoCloseable> getCleanupOperations() {
		return this.cleanupOperations;
	}
}
