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


/**
 * Retrieval of KPI time series from a relational measurement table, grouped by KPI identifier.
 *
 * <pre>
 * // Connection parameters come from DB_HOST, DB_PORT, DB_USER, DB_PASSWORD and DB_NAME
 * KpiRepository kpiRepository = KpiRepository.forConfiguration(DatabaseConfiguration.fromEnvironment())
 *   .statementLogger(new DefaultStatementLogger())
 *   .build();
 *
 * // Every requested KPI is a key, even with no data; lists are in ascending timestamp order
 * Map&lt;String, List&lt;KpiMeasurement&gt;&gt; measurementsByKpi = kpiRepository.queryKpiData(
 *   LocalDateTime.parse("2025-01-01T00:00:00"), LocalDateTime.parse("2025-01-01T23:59:59"),
 *   List.of("availability", "throughput"), List.of("NE1"), null);
 *
 * // Distinguish "no data" from "query failed"
 * KpiQueryResult kpiQueryResult = kpiRepository.query(KpiQueryRequest
 *   .withTimeRange(start, end)
 *   .kpiIdentifiers("availability, throughput")
 *   .hostFilter(List.of("10.0.0.1"))
 *   .build());
 *
 * if (kpiQueryResult.isDegraded())
 *   ...</pre>
 *
 * @since 1.0.0
 */
package com.netperf.kpi;
