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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Builds the parameterized SQL for a {@link KpiQueryRequest}.
 * <p>
 * The projection is always, in order: timestamp, KPI identifier, value, network element, cell ID and host. The base
 * predicate restricts the time range (inclusive) and the KPI identifiers; entity, cell and host filters follow in
 * that order when present, and rows are ordered by ascending timestamp.
 * <p>
 * Clauses and their parameters are accumulated pairwise, so placeholder position and parameter position always
 * agree. Request values only ever travel as parameters; the SQL text holds keywords, placeholders and the
 * identifiers of the {@link KpiTableSchema}.
 * <p>
 * With the default schema on PostgreSQL a fully-filtered statement looks like:
 * <pre>{@code SELECT datetime, peg_name, value, ne, cellid, host FROM summary
 * WHERE datetime BETWEEN ? AND ? AND peg_name = ANY(?) AND ne = ANY(?) AND CAST(cellid AS TEXT) = ANY(?) AND host = ANY(?)
 * ORDER BY datetime ASC}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class KpiQueryBuilder {
	@NonNull
	public static final String STATEMENT_ID = "kpi-data";

	@NonNull
	private final KpiTableSchema kpiTableSchema;
	@NonNull
	private final DatabaseType databaseType;

	private KpiQueryBuilder(@NonNull KpiTableSchema kpiTableSchema,
													@NonNull DatabaseType databaseType) {
		this.kpiTableSchema = requireNonNull(kpiTableSchema);
		this.databaseType = requireNonNull(databaseType);
	}

	/**
	 * Creates a builder which targets {@code kpiTableSchema} using the SQL flavor of {@code databaseType}.
	 *
	 * @param kpiTableSchema names of the measurement table and its columns
	 * @param databaseType   controls how array membership is expressed
	 * @return a query builder
	 */
	@NonNull
	public static KpiQueryBuilder forSchema(@NonNull KpiTableSchema kpiTableSchema,
																					@NonNull DatabaseType databaseType) {
		requireNonNull(kpiTableSchema);
		requireNonNull(databaseType);

		return new KpiQueryBuilder(kpiTableSchema, databaseType);
	}

	/**
	 * Builds the statement for {@code kpiQueryRequest}.
	 *
	 * @param kpiQueryRequest what to retrieve
	 * @return the SQL and its positional parameters
	 */
	@NonNull
	public Statement build(@NonNull KpiQueryRequest kpiQueryRequest) {
		requireNonNull(kpiQueryRequest);

		KpiTableSchema schema = getKpiTableSchema();
		List<Clause> clauses = new ArrayList<>(6);

		clauses.add(new Clause(format("%s BETWEEN ? AND ?", schema.getTimestampColumn()),
				List.<Object>of(kpiQueryRequest.getStart(), kpiQueryRequest.getEnd())));
		clauses.add(membershipClause(schema.getKpiColumn(), kpiQueryRequest.getKpiIdentifiers()));

		kpiQueryRequest.getEntityFilter().ifPresent(entityFilter ->
				clauses.add(membershipClause(schema.getNetworkElementColumn(), entityFilter)));
		// Cell IDs are commonly stored as integers; compare their text form
		kpiQueryRequest.getCellFilter().ifPresent(cellFilter ->
				clauses.add(new Clause(getDatabaseType().textArrayMembershipPredicate(schema.getCellIdColumn()),
						List.<Object>of(Parameters.arrayOf(cellFilter)))));
		kpiQueryRequest.getHostFilter().ifPresent(hostFilter ->
				clauses.add(membershipClause(schema.getHostColumn(), hostFilter)));

		List<Object> parameters = new ArrayList<>();

		for (Clause clause : clauses)
			parameters.addAll(clause.getParameters());

		String sql = format("SELECT %s, %s, %s, %s, %s, %s FROM %s WHERE %s ORDER BY %s ASC",
				schema.getTimestampColumn(),
				schema.getKpiColumn(),
				schema.getValueColumn(),
				schema.getNetworkElementColumn(),
				schema.getCellIdColumn(),
				schema.getHostColumn(),
				schema.getTableName(),
				clauses.stream().map(Clause::getFragment).collect(Collectors.joining(" AND ")),
				schema.getTimestampColumn());

		return Statement.of(STATEMENT_ID, sql, parameters);
	}

	@NonNull
	private Clause membershipClause(@NonNull String column,
																	@NonNull Collection<String> values) {
		requireNonNull(column);
		requireNonNull(values);

		return new Clause(getDatabaseType().arrayMembershipPredicate(column), List.<Object>of(Parameters.arrayOf(values)));
	}

	@Override
	public int hashCode() {
		return Objects.hash(getKpiTableSchema(), getDatabaseType());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof KpiQueryBuilder))
			return false;

		KpiQueryBuilder kpiQueryBuilder = (KpiQueryBuilder) object;

		return Objects.equals(kpiQueryBuilder.getKpiTableSchema(), getKpiTableSchema())
				&& Objects.equals(kpiQueryBuilder.getDatabaseType(), getDatabaseType());
	}

	@Override
	public String toString() {
		return format("%s{kpiTableSchema=%s, databaseType=%s}", getClass().getSimpleName(), getKpiTableSchema(), getDatabaseType().name());
	}

	@NonNull
	public KpiTableSchema getKpiTableSchema() {
		return this.kpiTableSchema;
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	/**
	 * A SQL predicate fragment and the parameters for its placeholders.
	 */
	@ThreadSafe
	private static final class Clause {
		@NonNull
		private final String fragment;
		@NonNull
		private final List<Object> parameters;

		private Clause(@NonNull String fragment,
									 @NonNull List<Object> parameters) {
			this.fragment = requireNonNull(fragment);
			this.parameters = requireNonNull(parameters);
		}

		@NonNull
		String getFragment() {
			return this.fragment;
		}

		@NonNull
		List<Object> getParameters() {
			return this.parameters;
		}
	}
}
