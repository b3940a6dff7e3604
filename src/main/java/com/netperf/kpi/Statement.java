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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Represents a SQL statement, an identifier for it, and its positional parameters in placeholder order.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Statement {
	@NonNull
	private final Object id;
	@NonNull
	private final String sql;
	@NonNull
	private final List<Object> parameters;

	private Statement(@NonNull Object id,
										@NonNull String sql,
										@NonNull List<Object> parameters) {
		requireNonNull(id);
		requireNonNull(sql);
		requireNonNull(parameters);

		this.id = id;
		this.sql = sql;
		this.parameters = Collections.unmodifiableList(parameters);
	}

	/**
	 * Factory method for providing {@link Statement} instances.
	 *
	 * @param id         the statement's identifier
	 * @param sql        the SQL being identified
	 * @param parameters the values bound to the SQL's {@code ?} placeholders, in order
	 * @return a statement instance
	 */
	@NonNull
	public static Statement of(@NonNull Object id,
														 @NonNull String sql,
														 @NonNull List<Object> parameters) {
		requireNonNull(id);
		requireNonNull(sql);
		requireNonNull(parameters);

		return new Statement(id, sql, List.copyOf(parameters));
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getSql(), getParameters());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Statement))
			return false;

		Statement statement = (Statement) object;

		return Objects.equals(statement.getId(), getId())
				&& Objects.equals(statement.getSql(), getSql())
				&& Objects.equals(statement.getParameters(), getParameters());
	}

	@Override
	@NonNull
	public String toString() {
		// Strip out newlines for more compact SQL representation
		return format("%s{id=%s, sql=%s, parameters=%s}", getClass().getSimpleName(),
				getId(), getSql().replaceAll("\n+", " ").trim(), getParameters());
	}

	@NonNull
	public Object getId() {
		return this.id;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public List<Object> getParameters() {
		return this.parameters;
	}
}
