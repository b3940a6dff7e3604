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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class KpiTableSchemaTests {
	@Test
	public void testDefaultSchema() {
		KpiTableSchema kpiTableSchema = KpiTableSchema.defaultSchema();

		Assertions.assertEquals("summary", kpiTableSchema.getTableName());
		Assertions.assertEquals("datetime", kpiTableSchema.getTimestampColumn());
		Assertions.assertEquals("peg_name", kpiTableSchema.getKpiColumn());
		Assertions.assertEquals("value", kpiTableSchema.getValueColumn());
		Assertions.assertEquals("ne", kpiTableSchema.getNetworkElementColumn());
		Assertions.assertEquals("cellid", kpiTableSchema.getCellIdColumn());
		Assertions.assertEquals("host", kpiTableSchema.getHostColumn());
	}

	@Test
	public void testSchemaQualifiedTableName() {
		KpiTableSchema kpiTableSchema = KpiTableSchema.builder().tableName("metrics.summary").build();
		Assertions.assertEquals("metrics.summary", kpiTableSchema.getTableName());
	}

	@Test
	public void testIllegalIdentifiersAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				KpiTableSchema.builder().tableName("summary; DROP TABLE summary").build());
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				KpiTableSchema.builder().kpiColumn("peg_name --").build());
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				KpiTableSchema.builder().cellIdColumn("1cell").build());
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				KpiTableSchema.builder().timestampColumn("a.b").build());
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				KpiTableSchema.builder().hostColumn("").build());
	}
}
