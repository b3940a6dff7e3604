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

import com.netperf.kpi.TestDatabases.CloseCountingDataSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.netperf.kpi.TestDatabases.TEST_SCHEMA;
import static com.netperf.kpi.TestDatabases.closeCounting;
import static com.netperf.kpi.TestDatabases.createInMemoryDataSource;
import static com.netperf.kpi.TestDatabases.createKpiTable;
import static com.netperf.kpi.TestDatabases.insertMeasurement;
import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class KpiRepositoryTests {
	private static final LocalDateTime START = LocalDateTime.parse("2025-01-01T00:00:00");
	private static final LocalDateTime END = LocalDateTime.parse("2025-01-01T23:59:59");

	@Test
	public void testEveryRequestedKpiIsPresentInTimestampOrder() {
		DataSource dataSource = createScenarioDataSource("scenario_no_filters");
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers(List.of("availability", "throughput"))
				.build());

		Assertions.assertEquals(KpiQueryResult.Status.COMPLETE, kpiQueryResult.getStatus());
		Assertions.assertFalse(kpiQueryResult.getFailure().isPresent());

		Map<String, List<KpiMeasurement>> measurementsByKpi = kpiQueryResult.getMeasurementsByKpi();

		Assertions.assertEquals(List.of("availability", "throughput"), new ArrayList<>(measurementsByKpi.keySet()),
				"Keys should be exactly the requested KPIs, in request order");
		Assertions.assertEquals(List.of("2025-01-01T08:00:00", "2025-01-01T09:00:00", "2025-01-01T10:00:00"),
				timestamps(measurementsByKpi.get("availability")));
		Assertions.assertTrue(measurementsByKpi.get("throughput").isEmpty(), "KPI without rows should map to an empty list");
	}

	@Test
	public void testMeasurementFieldsAreDerivedFromRow() {
		DataSource dataSource = createScenarioDataSource("measurement_fields");
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		KpiMeasurement kpiMeasurement = kpiRepository.queryKpiData(START, END, List.of("availability"), null, null)
				.get("availability").get(0);

		Assertions.assertEquals("2025-01-01T08:00:00", kpiMeasurement.getTimestamp());
		Assertions.assertEquals("availability", kpiMeasurement.getKpiIdentifier());
		Assertions.assertEquals(99.5, kpiMeasurement.getValue(), 0.0001);
		Assertions.assertEquals("NE1", kpiMeasurement.getNetworkElement().orElse(null));
		Assertions.assertEquals("100", kpiMeasurement.getCellId().orElse(null));
		Assertions.assertEquals("NE1#100", kpiMeasurement.getEntityId().orElse(null));
		Assertions.assertEquals("2025-01-01", kpiMeasurement.getDate());
		Assertions.assertEquals(8, kpiMeasurement.getHour());
		Assertions.assertEquals("10.0.0.1", kpiMeasurement.getHost().orElse(null));
	}

	@Test
	public void testEntityFilter() {
		DataSource dataSource = createScenarioDataSource("scenario_entity_filter");
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		Map<String, List<KpiMeasurement>> measurementsByKpi = kpiRepository.queryKpiData(START, END,
				List.of("availability", "throughput"), List.of("NE1"), null);

		List<KpiMeasurement> availability = measurementsByKpi.get("availability");

		Assertions.assertEquals(2, availability.size());
		Assertions.assertTrue(availability.stream().allMatch(kpiMeasurement -> "NE1".equals(kpiMeasurement.getNetworkElement().orElse(null))));
		Assertions.assertTrue(measurementsByKpi.get("throughput").isEmpty());
	}

	@Test
	public void testCellFilter() {
		DataSource dataSource = createScenarioDataSource("cell_filter");
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		List<KpiMeasurement> availability = kpiRepository.queryKpiData(START, END,
				List.of("availability"), null, List.of("200")).get("availability");

		Assertions.assertEquals(1, availability.size());
		Assertions.assertEquals("NE2#200", availability.get(0).getEntityId().orElse(null));
	}

	@Test
	public void testEntityAndCellFiltersCombine() {
		DataSource dataSource = createScenarioDataSource("entity_and_cell_filter");
		insertMeasurement(dataSource, "2025-01-01T11:00:00", "availability", 97.0, "NE1", "102", "10.0.0.1");
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		List<KpiMeasurement> availability = kpiRepository.queryKpiData(START, END,
				List.of("availability"), List.of("NE1"), List.of("102", "200")).get("availability");

		Assertions.assertEquals(List.of("NE1#102"), availability.stream()
				.map(kpiMeasurement -> kpiMeasurement.getEntityId().orElse(null))
				.collect(Collectors.toList()));
	}

	@Test
	public void testCellFilterMatchesIntegerCellIds() {
		DataSource dataSource = createInMemoryDataSource("integer_cell_ids");
		TestDatabases.execute(dataSource, """
				CREATE TABLE kpi_summary (
				  measured_at TIMESTAMP NOT NULL,
				  peg_name VARCHAR(64) NOT NULL,
				  kpi_value DOUBLE,
				  ne VARCHAR(32) NOT NULL,
				  cellid INTEGER NOT NULL,
				  host VARCHAR(64)
				)
				""");
		TestDatabases.execute(dataSource, "INSERT INTO kpi_summary VALUES (TIMESTAMP '2025-01-01 08:00:00', 'availability', 1.0, 'NE1', 8418, NULL)");
		TestDatabases.execute(dataSource, "INSERT INTO kpi_summary VALUES (TIMESTAMP '2025-01-01 09:00:00', 'availability', 2.0, 'NE1', 8419, NULL)");

		KpiRepository kpiRepository = createKpiRepository(dataSource);

		List<KpiMeasurement> availability = kpiRepository.queryKpiData(START, END,
				List.of("availability"), null, List.of("8419")).get("availability");

		Assertions.assertEquals(1, availability.size());
		Assertions.assertEquals("NE1#8419", availability.get(0).getEntityId().orElse(null));
	}

	@Test
	public void testRowsWithoutNetworkElementOrCellAreKept() {
		DataSource dataSource = createInMemoryDataSource("missing_entity_columns");
		createKpiTable(dataSource);
		insertMeasurement(dataSource, "2025-01-01T08:00:00", "availability", 99.0, "NE1", "100", null);
		insertMeasurement(dataSource, "2025-01-01T09:00:00", "availability", 98.0, "NE1", null, null);
		insertMeasurement(dataSource, "2025-01-01T10:00:00", "throughput", 50.0, null, "200", null);
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers(List.of("availability", "throughput"))
				.build());

		Assertions.assertEquals(KpiQueryResult.Status.COMPLETE, kpiQueryResult.getStatus());

		List<KpiMeasurement> availability = kpiQueryResult.getMeasurementsByKpi().get("availability");
		List<KpiMeasurement> throughput = kpiQueryResult.getMeasurementsByKpi().get("throughput");

		Assertions.assertEquals(2, availability.size());
		Assertions.assertEquals("NE1#100", availability.get(0).getEntityId().orElse(null));
		Assertions.assertEquals("NE1", availability.get(1).getNetworkElement().orElse(null));
		Assertions.assertFalse(availability.get(1).getEntityId().isPresent(), "Row without a cell ID has no entity ID");
		Assertions.assertEquals(1, throughput.size());
		Assertions.assertEquals("200", throughput.get(0).getCellId().orElse(null));
		Assertions.assertFalse(throughput.get(0).getEntityId().isPresent());
	}

	@Test
	public void testHostFilter() {
		DataSource dataSource = createScenarioDataSource("host_filter");
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers("availability")
				.hostFilter(List.of("10.0.0.2"))
				.build());

		List<KpiMeasurement> availability = kpiQueryResult.getMeasurementsByKpi().get("availability");

		Assertions.assertEquals(1, availability.size());
		Assertions.assertEquals("10.0.0.2", availability.get(0).getHost().orElse(null));
	}

	@Test
	public void testTimeRangeIsInclusive() {
		DataSource dataSource = createInMemoryDataSource("time_range_inclusive");
		createKpiTable(dataSource);
		insertMeasurement(dataSource, "2024-12-31T23:59:59", "availability", 1.0, "NE1", "100", null);
		insertMeasurement(dataSource, "2025-01-01T00:00:00", "availability", 2.0, "NE1", "100", null);
		insertMeasurement(dataSource, "2025-01-01T23:59:59", "availability", 3.0, "NE1", "100", null);
		insertMeasurement(dataSource, "2025-01-02T00:00:00", "availability", 4.0, "NE1", "100", null);

		KpiRepository kpiRepository = createKpiRepository(dataSource);

		List<KpiMeasurement> availability = kpiRepository.queryKpiData(START, END,
				List.of("availability"), null, null).get("availability");

		Assertions.assertEquals(List.of(2.0, 3.0), availability.stream()
				.map(KpiMeasurement::getValue)
				.collect(Collectors.toList()));
		Assertions.assertFalse(availability.get(1).getHost().isPresent(), "NULL host should map to an empty Optional");
	}

	@Test
	public void testMeasurementsAreGroupedUnderTheirOwnKpi() {
		DataSource dataSource = createInMemoryDataSource("grouping");
		createKpiTable(dataSource);
		insertMeasurement(dataSource, "2025-01-01T03:00:00", "throughput", 30.0, "NE1", "100", null);
		insertMeasurement(dataSource, "2025-01-01T01:00:00", "availability", 10.0, "NE1", "100", null);
		insertMeasurement(dataSource, "2025-01-01T02:00:00", "throughput", 20.0, "NE2", "200", null);
		insertMeasurement(dataSource, "2025-01-01T04:00:00", "availability", 40.0, "NE2", "200", null);
		insertMeasurement(dataSource, "2025-01-01T05:00:00", "latency", 50.0, "NE2", "200", null);

		KpiRepository kpiRepository = createKpiRepository(dataSource);

		Map<String, List<KpiMeasurement>> measurementsByKpi = kpiRepository.queryKpiData(START, END,
				List.of("throughput", "availability"), null, null);

		Assertions.assertEquals(Set.of("throughput", "availability"), measurementsByKpi.keySet());

		for (Map.Entry<String, List<KpiMeasurement>> entry : measurementsByKpi.entrySet())
			Assertions.assertTrue(entry.getValue().stream().allMatch(kpiMeasurement -> entry.getKey().equals(kpiMeasurement.getKpiIdentifier())),
					"Measurement grouped under a foreign KPI");

		Assertions.assertEquals(List.of(20.0, 30.0), values(measurementsByKpi.get("throughput")));
		Assertions.assertEquals(List.of(10.0, 40.0), values(measurementsByKpi.get("availability")));
	}

	@Test
	public void testRowsForUnrequestedKpisAreDropped() {
		DataSource dataSource = createScenarioDataSource("unrequested_rows");
		AtomicInteger rowsMapped = new AtomicInteger();

		// Rename every row to a KPI nobody asked for
		ResultSetMapper renamingResultSetMapper = (statementContext, resultSet) -> {
			rowsMapped.incrementAndGet();
			KpiMeasurement kpiMeasurement = ResultSetMapper.withDefaultConfiguration().map(statementContext, resultSet);
			return KpiMeasurement.of(LocalDateTime.parse(kpiMeasurement.getTimestamp()), "unexpected", kpiMeasurement.getValue(),
					kpiMeasurement.getNetworkElement().orElse(null), kpiMeasurement.getCellId().orElse(null), null);
		};

		KpiRepository kpiRepository = KpiRepository.withConnectionManager(ConnectionManager.withDataSource(dataSource))
				.kpiTableSchema(TEST_SCHEMA)
				.resultSetMapper(renamingResultSetMapper)
				.build();

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers("availability")
				.build());

		Assertions.assertEquals(3, rowsMapped.get());
		Assertions.assertEquals(KpiQueryResult.Status.COMPLETE, kpiQueryResult.getStatus());
		Assertions.assertEquals(Set.of("availability"), kpiQueryResult.getMeasurementsByKpi().keySet());
		Assertions.assertTrue(kpiQueryResult.getMeasurementsByKpi().get("availability").isEmpty());
	}

	@Test
	public void testFilterValuesAreNeverInterpretedAsSql() {
		DataSource dataSource = createScenarioDataSource("injection");
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers(List.of("availability"))
				.entityFilter(List.of("NE1' OR '1'='1", "x'); DROP TABLE kpi_summary; --"))
				.build());

		Assertions.assertEquals(KpiQueryResult.Status.COMPLETE, kpiQueryResult.getStatus());
		Assertions.assertTrue(kpiQueryResult.getMeasurementsByKpi().get("availability").isEmpty());

		// Table is still there
		Assertions.assertEquals(3, kpiRepository.queryKpiData(START, END, List.of("availability"), null, null)
				.get("availability").size());
	}

	@Test
	public void testQueryFailureReturnsEmptyMappingForEveryKpi() {
		// No table, so the statement fails after the connection is acquired
		CloseCountingDataSource dataSource = closeCounting(createInMemoryDataSource("missing_table"));
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers(List.of("availability", "throughput"))
				.build());

		Assertions.assertEquals(KpiQueryResult.Status.DEGRADED, kpiQueryResult.getStatus());
		Assertions.assertTrue(kpiQueryResult.isDegraded());
		Assertions.assertEquals(List.of("availability", "throughput"), new ArrayList<>(kpiQueryResult.getMeasurementsByKpi().keySet()));
		Assertions.assertTrue(kpiQueryResult.getMeasurementsByKpi().values().stream().allMatch(List::isEmpty));

		QueryExecutionException failure = kpiQueryResult.getFailure().orElseThrow();
		Assertions.assertTrue(failure.getCause() instanceof SQLException, "Driver failure should be the cause");
		Assertions.assertTrue(failure.getSqlState().isPresent(), "SQL state should be extracted from the driver failure");

		Assertions.assertEquals(1, dataSource.getConnectionsOpened());
		Assertions.assertEquals(1, dataSource.getPhysicalCloses(), "Connection should be closed exactly once on failure");
	}

	@Test
	public void testQueryKpiDataNeverThrowsForQueryFailures() {
		KpiRepository kpiRepository = createKpiRepository(createInMemoryDataSource("missing_table_convenience"));

		Map<String, List<KpiMeasurement>> measurementsByKpi = Assertions.assertDoesNotThrow(() ->
				kpiRepository.queryKpiData(START, END, List.of("availability", "throughput"), List.of("NE1"), List.of("100")));

		Assertions.assertEquals(Set.of("availability", "throughput"), measurementsByKpi.keySet());
		Assertions.assertTrue(measurementsByKpi.values().stream().allMatch(List::isEmpty));
	}

	@Test
	public void testMappingFailureDiscardsPartialResults() {
		DataSource dataSource = createScenarioDataSource("mapping_failure");
		insertMeasurement(dataSource, "2025-01-01T12:00:00", "availability", null, "NE1", "100", null);
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers("availability")
				.build());

		Assertions.assertTrue(kpiQueryResult.isDegraded());
		Assertions.assertTrue(kpiQueryResult.getFailure().orElseThrow() instanceof MappingException);
		Assertions.assertTrue(kpiQueryResult.getMeasurementsByKpi().get("availability").isEmpty(),
				"Rows mapped before the failure should not leak into a degraded result");
	}

	@Test
	public void testConnectionFailurePropagates() {
		KpiRepository kpiRepository = KpiRepository.withConnectionManager(ConnectionManager.withDataSource(TestDatabases.unreachableDataSource()))
				.kpiTableSchema(TEST_SCHEMA)
				.build();

		ConnectionException connectionException = Assertions.assertThrows(ConnectionException.class, () ->
				kpiRepository.queryKpiData(START, END, List.of("availability"), null, null));

		Assertions.assertEquals("08001", connectionException.getSqlState().orElse(null));
	}

	@Test
	public void testConnectionClosedExactlyOnceOnSuccess() {
		CloseCountingDataSource dataSource = closeCounting(createScenarioDataSource("close_once"));
		KpiRepository kpiRepository = createKpiRepository(dataSource);

		kpiRepository.queryKpiData(START, END, List.of("availability"), null, null);
		kpiRepository.queryKpiData(START, END, List.of("throughput"), null, null);

		Assertions.assertEquals(2, dataSource.getConnectionsOpened(), "Each retrieval should open its own connection");
		Assertions.assertEquals(2, dataSource.getPhysicalCloses());
	}

	@Test
	public void testStatementLoggerReceivesDiagnostics() {
		DataSource dataSource = createScenarioDataSource("statement_logger");
		List<StatementLog> statementLogs = new ArrayList<>();

		KpiRepository kpiRepository = KpiRepository.withConnectionManager(ConnectionManager.withDataSource(dataSource))
				.kpiTableSchema(TEST_SCHEMA)
				.statementLogger(statementLogs::add)
				.build();

		kpiRepository.queryKpiData(START, END, List.of("availability"), List.of("NE1"), null);

		Assertions.assertEquals(1, statementLogs.size());

		StatementLog statementLog = statementLogs.get(0);

		Assertions.assertEquals(DatabaseType.HSQLDB, statementLog.getStatementContext().getDatabaseType(),
				"Database type should be detected from the connection");
		Assertions.assertTrue(statementLog.getStatementContext().getStatement().getSql().endsWith("ORDER BY measured_at ASC"));
		Assertions.assertEquals(2, statementLog.getRowCount().orElse(null));
		Assertions.assertTrue(statementLog.getConnectionAcquisitionDuration().isPresent());
		Assertions.assertTrue(statementLog.getExecutionDuration().isPresent());
		Assertions.assertFalse(statementLog.getException().isPresent());
	}

	@Test
	public void testStatementLoggerFailureDoesNotChangeOutcome() {
		DataSource dataSource = createScenarioDataSource("statement_logger_failure");
		RuntimeException loggerFailure = new RuntimeException("logger failed");

		KpiRepository kpiRepository = KpiRepository.withConnectionManager(ConnectionManager.withDataSource(dataSource))
				.kpiTableSchema(TEST_SCHEMA)
				.statementLogger((statementLog) -> {
					throw loggerFailure;
				})
				.build();

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers("availability")
				.build());

		Assertions.assertEquals(KpiQueryResult.Status.COMPLETE, kpiQueryResult.getStatus());
		Assertions.assertEquals(3, kpiQueryResult.getMeasurementsByKpi().get("availability").size());
	}

	@Test
	public void testStatementLoggerFailureSuppressedWhenQueryFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");

		KpiRepository kpiRepository = KpiRepository.withConnectionManager(ConnectionManager.withDataSource(createInMemoryDataSource("statement_logger_suppressed")))
				.kpiTableSchema(TEST_SCHEMA)
				.statementLogger((statementLog) -> {
					throw loggerFailure;
				})
				.build();

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers("availability")
				.build());

		QueryExecutionException failure = kpiQueryResult.getFailure().orElseThrow();

		Assertions.assertTrue(
				Arrays.stream(failure.getSuppressed()).anyMatch(suppressed -> "logger failed".equals(suppressed.getMessage())),
				"Expected statement logger failure to be suppressed");
	}

	@Test
	public void testStatementTimeoutIsApplied() {
		DataSource dataSource = createScenarioDataSource("statement_timeout");
		AtomicReference<Integer> queryTimeout = new AtomicReference<>();

		KpiRepository kpiRepository = KpiRepository.withConnectionManager(ConnectionManager.withDataSource(dataSource))
				.kpiTableSchema(TEST_SCHEMA)
				.statementTimeout(Duration.ofSeconds(5))
				.preparedStatementCustomizer((statementContext, preparedStatement) -> queryTimeout.set(preparedStatement.getQueryTimeout()))
				.build();

		kpiRepository.queryKpiData(START, END, List.of("availability"), null, null);

		Assertions.assertEquals(5, queryTimeout.get());
	}

	@Test
	public void testBoundArraysAreReleasedAfterQuery() {
		DataSource dataSource = createScenarioDataSource("array_release");
		AtomicReference<StatementContext> boundStatementContext = new AtomicReference<>();
		AtomicInteger cleanupOperationsAfterBinding = new AtomicInteger();

		KpiRepository kpiRepository = KpiRepository.withConnectionManager(ConnectionManager.withDataSource(dataSource))
				.kpiTableSchema(TEST_SCHEMA)
				.preparedStatementCustomizer((statementContext, preparedStatement) -> {
					boundStatementContext.set(statementContext);
					cleanupOperationsAfterBinding.set(statementContext.getCleanupOperations().size());
				})
				.build();

		kpiRepository.queryKpiData(START, END, List.of("availability", "throughput"), List.of("NE1"), List.of("100"));

		// KPI, entity and cell arrays
		Assertions.assertEquals(3, cleanupOperationsAfterBinding.get());
		Assertions.assertTrue(boundStatementContext.get().getCleanupOperations().isEmpty(),
				"Bound arrays should be released once the query has run");
	}

	@Test
	public void testReleaseFailureDoesNotDegradeResult() {
		DataSource dataSource = createScenarioDataSource("release_failure");
		AtomicInteger releaseAttempts = new AtomicInteger();

		KpiRepository kpiRepository = KpiRepository.withConnectionManager(ConnectionManager.withDataSource(dataSource))
				.kpiTableSchema(TEST_SCHEMA)
				.preparedStatementCustomizer((statementContext, preparedStatement) -> {
					statementContext.addCleanupOperation(() -> {
						releaseAttempts.incrementAndGet();
						throw new SQLException("free failed");
					});
					statementContext.addCleanupOperation(releaseAttempts::incrementAndGet);
				})
				.build();

		KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest.withTimeRange(START, END)
				.kpiIdentifiers("availability")
				.build());

		Assertions.assertEquals(KpiQueryResult.Status.COMPLETE, kpiQueryResult.getStatus());
		Assertions.assertFalse(kpiQueryResult.getMeasurementsByKpi().get("availability").isEmpty());
		Assertions.assertEquals(2, releaseAttempts.get(), "Every registered resource should get a release attempt");
	}

	@Test
	public void testDefaultStatementTimeout() {
		KpiRepository kpiRepository = createKpiRepository(createInMemoryDataSource("default_statement_timeout"));
		Assertions.assertEquals(Duration.ofSeconds(30), kpiRepository.getStatementTimeout());
	}

	@Test
	public void testForConfigurationUsesConfiguredStatementTimeout() {
		KpiRepository kpiRepository = KpiRepository.forConfiguration(DatabaseConfiguration.builder()
						.statementTimeout(Duration.ofSeconds(7))
						.build())
				.build();

		Assertions.assertEquals(Duration.ofSeconds(7), kpiRepository.getStatementTimeout());
	}

	@Test
	public void testConcurrentRetrievalsAreIndependent() throws InterruptedException {
		CloseCountingDataSource dataSource = closeCounting(createScenarioDataSource("concurrent"));
		KpiRepository kpiRepository = createKpiRepository(dataSource);
		int threadCount = 8;
		List<Thread> threads = new ArrayList<>(threadCount);
		AtomicInteger successes = new AtomicInteger();

		for (int i = 0; i < threadCount; i++) {
			String networkElement = i % 2 == 0 ? "NE1" : "NE2";
			int expectedCount = i % 2 == 0 ? 2 : 1;

			threads.add(new Thread(() -> {
				List<KpiMeasurement> availability = kpiRepository.queryKpiData(START, END,
						List.of("availability"), List.of(networkElement), null).get("availability");

				if (availability.size() == expectedCount)
					successes.incrementAndGet();
			}));
		}

		for (Thread thread : threads)
			thread.start();

		for (Thread thread : threads)
			thread.join();

		Assertions.assertEquals(threadCount, successes.get());
		Assertions.assertEquals(threadCount, dataSource.getConnectionsOpened());
		Assertions.assertEquals(threadCount, dataSource.getPhysicalCloses());
	}

	/**
	 * Three availability rows (two on NE1), inserted out of timestamp order, and no throughput rows.
	 */
	protected DataSource createScenarioDataSource(String databaseName) {
		requireNonNull(databaseName);

		DataSource dataSource = createInMemoryDataSource(databaseName);
		createKpiTable(dataSource);
		insertMeasurement(dataSource, "2025-01-01T10:00:00", "availability", 98.0, "NE1", "101", "10.0.0.1");
		insertMeasurement(dataSource, "2025-01-01T08:00:00", "availability", 99.5, "NE1", "100", "10.0.0.1");
		insertMeasurement(dataSource, "2025-01-01T09:00:00", "availability", 99.0, "NE2", "200", "10.0.0.2");

		return dataSource;
	}

	protected KpiRepository createKpiRepository(DataSource dataSource) {
		requireNonNull(dataSource);

		return KpiRepository.withConnectionManager(ConnectionManager.withDataSource(dataSource))
				.kpiTableSchema(TEST_SCHEMA)
				.build();
	}

	protected List<String> timestamps(List<KpiMeasurement> kpiMeasurements) {
		return kpiMeasurements.stream().map(KpiMeasurement::getTimestamp).collect(Collectors.toList());
	}

	protected List<Double> values(List<KpiMeasurement> kpiMeasurements) {
		return kpiMeasurements.stream().map(KpiMeasurement::getValue).collect(Collectors.toList());
	}
}
