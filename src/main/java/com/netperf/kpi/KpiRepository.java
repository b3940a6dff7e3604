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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Retrieves KPI time series and groups them by KPI identifier.
 * <p>
 * Each retrieval opens its own connection and closes it exactly once before returning. Failures are split in two:
 * <ul>
 *   <li>If no connection can be acquired, a {@link ConnectionException} is thrown to the caller.</li>
 *   <li>Any failure after the connection is acquired (preparing, binding, executing, reading or mapping) is logged and
 *   absorbed: the result is {@link KpiQueryResult.Status#DEGRADED} with an empty list for every requested
 *   identifier.</li>
 * </ul>
 * <p>
 * Instances hold no per-request state and may be shared across threads.
 * <p>
 * Typical use:
 * <pre>{@code KpiRepository kpiRepository = KpiRepository.forConfiguration(DatabaseConfiguration.fromEnvironment()).build();
 * Map<String, List<KpiMeasurement>> measurementsByKpi = kpiRepository.queryKpiData(start, end,
 *     List.of("availability", "throughput"), List.of("NE1"), null);}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public class KpiRepository {
	@NonNull
	public static final Duration DEFAULT_STATEMENT_TIMEOUT = DatabaseConfiguration.DEFAULT_STATEMENT_TIMEOUT;

	@NonNull
	private final ConnectionManager connectionManager;
	@NonNull
	private final KpiTableSchema kpiTableSchema;
	@NonNull
	private final AtomicReference<DatabaseType> databaseType;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@NonNull
	private final PreparedStatementCustomizer preparedStatementCustomizer;
	@NonNull
	private final ResultSetMapper resultSetMapper;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Duration statementTimeout;
	@NonNull
	private final Logger logger;

	protected KpiRepository(@NonNull Builder builder) {
		requireNonNull(builder);

		this.connectionManager = requireNonNull(builder.connectionManager);
		this.kpiTableSchema = builder.kpiTableSchema == null ? KpiTableSchema.defaultSchema() : builder.kpiTableSchema;
		this.databaseType = new AtomicReference<>(builder.databaseType);
		this.preparedStatementBinder = builder.preparedStatementBinder == null ? PreparedStatementBinder.withDefaultConfiguration() : builder.preparedStatementBinder;
		this.preparedStatementCustomizer = builder.preparedStatementCustomizer == null ? PreparedStatementCustomizer.none() : builder.preparedStatementCustomizer;
		this.resultSetMapper = builder.resultSetMapper == null ? ResultSetMapper.withDefaultConfiguration() : builder.resultSetMapper;
		this.statementLogger = builder.statementLogger == null ? StatementLogger.disabled() : builder.statementLogger;
		this.statementTimeout = builder.statementTimeout == null ? DEFAULT_STATEMENT_TIMEOUT : builder.statementTimeout;
		this.logger = Logger.getLogger(getClass().getName());

		if (this.statementTimeout.isNegative())
			throw new IllegalArgumentException(format("Statement timeout must not be negative (was %s)", this.statementTimeout));
	}

	/**
	 * Provides a {@link KpiRepository} builder which connects to the PostgreSQL server described by
	 * {@code databaseConfiguration} and uses its statement timeout.
	 *
	 * @param databaseConfiguration connection parameters
	 * @return a {@link KpiRepository} builder
	 */
	@NonNull
	public static Builder forConfiguration(@NonNull DatabaseConfiguration databaseConfiguration) {
		requireNonNull(databaseConfiguration);

		return new Builder(ConnectionManager.forConfiguration(databaseConfiguration))
				.databaseType(DatabaseType.POSTGRESQL)
				.statementTimeout(databaseConfiguration.getStatementTimeout());
	}

	/**
	 * Provides a {@link KpiRepository} builder for the given {@link ConnectionManager}.
	 *
	 * @param connectionManager source of connections
	 * @return a {@link KpiRepository} builder
	 */
	@NonNull
	public static Builder withConnectionManager(@NonNull ConnectionManager connectionManager) {
		requireNonNull(connectionManager);
		return new Builder(connectionManager);
	}

	/**
	 * Retrieves measurements for {@code kpiIdentifiers} in {@code [start, end]}, grouped by KPI identifier.
	 * <p>
	 * The returned mapping has exactly one key per distinct requested identifier, in request order, each mapped to a
	 * possibly-empty list in ascending timestamp order. If the query fails after a connection was acquired, every list
	 * is empty; use {@link #query(KpiQueryRequest)} to tell that case apart from "no data".
	 *
	 * @param start          inclusive lower bound
	 * @param end            inclusive upper bound
	 * @param kpiIdentifiers KPI identifiers to retrieve, at least one
	 * @param entityFilter   network elements to restrict to, or {@code null} for all
	 * @param cellFilter     cells to restrict to, or {@code null} for all
	 * @return measurements grouped by KPI identifier
	 * @throws ConnectionException      if no database connection could be acquired
	 * @throws IllegalArgumentException if no KPI identifier is supplied or {@code start} is after {@code end}
	 */
	@NonNull
	public Map<String, List<KpiMeasurement>> queryKpiData(@NonNull LocalDateTime start,
																												@NonNull LocalDateTime end,
																												@NonNull Collection<String> kpiIdentifiers,
																												@Nullable Collection<String> entityFilter,
																												@Nullable Collection<String> cellFilter) {
		requireNonNull(start);
		requireNonNull(end);
		requireNonNull(kpiIdentifiers);

		KpiQueryRequest kpiQueryRequest = KpiQueryRequest.withTimeRange(start, end)
				.kpiIdentifiers(kpiIdentifiers)
				.entityFilter(entityFilter)
				.cellFilter(cellFilter)
				.build();

		return query(kpiQueryRequest).getMeasurementsByKpi();
	}

	/**
	 * Retrieves the measurements described by {@code kpiQueryRequest}.
	 *
	 * @param kpiQueryRequest what to retrieve
	 * @return the grouped measurements and whether the query completed
	 * @throws ConnectionException if no database connection could be acquired
	 */
	@NonNull
	public KpiQueryResult query(@NonNull KpiQueryRequest kpiQueryRequest) {
		requireNonNull(kpiQueryRequest);

		logger.log(FINE, () -> format("Retrieving %d KPI[s] for %s", kpiQueryRequest.getKpiIdentifiers().size(), kpiQueryRequest));

		long startTime = nanoTime();

		// Connection failures propagate
		ScopedConnection scopedConnection = getConnectionManager().acquire();

		Duration connectionAcquisitionDuration = Duration.ofNanos(nanoTime() - startTime);
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultSetMappingDuration = null;
		Integer rowCount = null;
		StatementContext statementContext = null;
		QueryExecutionException failure = null;
		Map<String, List<KpiMeasurement>> measurementsByKpi = KpiQueryResult.emptyMeasurementsByKpi(kpiQueryRequest);

		try {
			Connection connection = scopedConnection.getConnection();
			DatabaseType databaseType = resolveDatabaseType(connection);
			Statement statement = KpiQueryBuilder.forSchema(getKpiTableSchema(), databaseType).build(kpiQueryRequest);
			statementContext = StatementContext.of(statement, databaseType);
			startTime = nanoTime();

			try (PreparedStatement preparedStatement = connection.prepareStatement(statement.getSql())) {
				applyStatementTimeout(preparedStatement);
				getPreparedStatementBinder().bindParameters(statementContext, preparedStatement);
				getPreparedStatementCustomizer().customize(statementContext, preparedStatement);
				preparationDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();

				try (ResultSet resultSet = preparedStatement.executeQuery()) {
					executionDuration = Duration.ofNanos(nanoTime() - startTime);
					startTime = nanoTime();

					int rowsRead = 0;

					while (resultSet.next()) {
						KpiMeasurement kpiMeasurement = getResultSetMapper().map(statementContext, resultSet);
						List<KpiMeasurement> kpiMeasurements = measurementsByKpi.get(kpiMeasurement.getKpiIdentifier());

						// Rows for identifiers we did not ask for are dropped
						if (kpiMeasurements != null)
							kpiMeasurements.add(kpiMeasurement);

						++rowsRead;
					}

					resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
					rowCount = rowsRead;
				}
			}
		} catch (QueryExecutionException e) {
			failure = e;
		} catch (SQLException | RuntimeException e) {
			failure = new QueryExecutionException(format("Unable to execute KPI query for %s", kpiQueryRequest), e);
		} finally {
			if (statementContext != null) {
				try {
					closeStatementContextResources(statementContext);
				} catch (Exception cleanupException) {
					failure = recordCleanupFailure(failure, cleanupException, "Unable to release statement resources");
				}
			}

			try {
				scopedConnection.close();
			} catch (RuntimeException cleanupException) {
				failure = recordCleanupFailure(failure, cleanupException, "Unable to close database connection");
			}

			if (statementContext != null) {
				StatementLog statementLog = StatementLog.withStatementContext(statementContext)
						.connectionAcquisitionDuration(connectionAcquisitionDuration)
						.preparationDuration(preparationDuration)
						.executionDuration(executionDuration)
						.resultSetMappingDuration(resultSetMappingDuration)
						.rowCount(rowCount)
						.exception(failure)
						.build();

				try {
					getStatementLogger().log(statementLog);
				} catch (RuntimeException cleanupException) {
					failure = recordCleanupFailure(failure, cleanupException, "Statement logger failed");
				}
			}
		}

		if (failure != null) {
			logger.log(WARNING, format("KPI query failed, returning no data for %s%s", kpiQueryRequest,
					statementContext == null ? "" : format("\nSQL: %s\nParameters: %s", statementContext.getStatement().getSql(),
							statementContext.getStatement().getParameters())), failure);
			return KpiQueryResult.degraded(kpiQueryRequest, failure);
		}

		KpiQueryResult kpiQueryResult = KpiQueryResult.complete(measurementsByKpi);
		logger.log(FINE, () -> format("Retrieved %s", kpiQueryResult));

		return kpiQueryResult;
	}

	/**
	 * Cleanup failures never change the outcome: they ride along on an existing failure or are logged.
	 */
	@Nullable
	private QueryExecutionException recordCleanupFailure(@Nullable QueryExecutionException failure,
																											 @NonNull Exception cleanupException,
																											 @NonNull String description) {
		requireNonNull(cleanupException);
		requireNonNull(description);

		if (failure != null)
			failure.addSuppressed(cleanupException);
		else
			logger.log(WARNING, description, cleanupException);

		return failure;
	}

	/**
	 * Drains and closes everything registered via {@link StatementContext#addCleanupOperation(AutoCloseable)}.
	 * Every resource gets a close attempt; the first failure is thrown with later ones suppressed.
	 */
	static void closeStatementContextResources(@NonNull StatementContext statementContext) throws Exception {
		requireNonNull(statementContext);

		Exception cleanupException = null;
		AutoCloseable cleanupOperation;

		while ((cleanupOperation = statementContext.getCleanupOperations().poll()) != null) {
			try {
				cleanupOperation.close();
			} catch (Exception e) {
				if (cleanupException == null)
					cleanupException = e;
				else
					cleanupException.addSuppressed(e);
			}
		}

		if (cleanupException != null)
			throw cleanupException;
	}

	protected void applyStatementTimeout(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		long seconds = getStatementTimeout().toSeconds();

		// JDBC has one-second granularity; 0 means no limit
		if (seconds == 0 && !getStatementTimeout().isZero())
			seconds = 1;

		if (seconds > 0)
			preparedStatement.setQueryTimeout((int) Math.min(seconds, Integer.MAX_VALUE));
	}

	@NonNull
	protected DatabaseType resolveDatabaseType(@NonNull Connection connection) throws SQLException {
		requireNonNull(connection);

		DatabaseType databaseType = this.databaseType.get();

		// If we don't know it, detect it and store it
		if (databaseType == null) {
			databaseType = DatabaseType.fromConnection(connection);
			this.databaseType.compareAndSet(null, databaseType);
		}

		return databaseType;
	}

	@NonNull
	protected ConnectionManager getConnectionManager() {
		return this.connectionManager;
	}

	@NonNull
	public KpiTableSchema getKpiTableSchema() {
		return this.kpiTableSchema;
	}

	@NonNull
	protected PreparedStatementBinder getPreparedStatementBinder() {
		return this.preparedStatementBinder;
	}

	@NonNull
	protected PreparedStatementCustomizer getPreparedStatementCustomizer() {
		return this.preparedStatementCustomizer;
	}

	@NonNull
	protected ResultSetMapper getResultSetMapper() {
		return this.resultSetMapper;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	public Duration getStatementTimeout() {
		return this.statementTimeout;
	}

	/**
	 * Builder used to construct instances of {@link KpiRepository}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final ConnectionManager connectionManager;
		@Nullable
		private KpiTableSchema kpiTableSchema;
		@Nullable
		private DatabaseType databaseType;
		@Nullable
		private PreparedStatementBinder preparedStatementBinder;
		@Nullable
		private PreparedStatementCustomizer preparedStatementCustomizer;
		@Nullable
		private ResultSetMapper resultSetMapper;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private Duration statementTimeout;

		private Builder(@NonNull ConnectionManager connectionManager) {
			this.connectionManager = requireNonNull(connectionManager);
		}

		@NonNull
		public Builder kpiTableSchema(@Nullable KpiTableSchema kpiTableSchema) {
			this.kpiTableSchema = kpiTableSchema;
			return this;
		}

		/**
		 * Overrides automatic database type detection.
		 *
		 * @param databaseType the database type to use (null to detect it from the first connection)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder databaseType(@Nullable DatabaseType databaseType) {
			this.databaseType = databaseType;
			return this;
		}

		@NonNull
		public Builder preparedStatementBinder(@Nullable PreparedStatementBinder preparedStatementBinder) {
			this.preparedStatementBinder = preparedStatementBinder;
			return this;
		}

		@NonNull
		public Builder preparedStatementCustomizer(@Nullable PreparedStatementCustomizer preparedStatementCustomizer) {
			this.preparedStatementCustomizer = preparedStatementCustomizer;
			return this;
		}

		@NonNull
		public Builder resultSetMapper(@Nullable ResultSetMapper resultSetMapper) {
			this.resultSetMapper = resultSetMapper;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		/**
		 * Sets the per-statement timeout; {@link Duration#ZERO} disables it.
		 *
		 * @param statementTimeout the timeout (null for the default of 30 seconds)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder statementTimeout(@Nullable Duration statementTimeout) {
			this.statementTimeout = statementTimeout;
			return this;
		}

		@NonNull
		public KpiRepository build() {
			return new KpiRepository(this);
		}
	}
}
