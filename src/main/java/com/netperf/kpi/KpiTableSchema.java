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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Names of the measurement table and its columns.
 * <p>
 * These are the only values which appear verbatim in generated SQL, so each one must be a plain SQL identifier
 * (the table may be schema-qualified, e.g. {@code metrics.summary}).
 * <p>
 * Defaults match the {@code summary} table: {@code datetime}, {@code peg_name}, {@code value}, {@code ne},
 * {@code cellid} and {@code host}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class KpiTableSchema {
	@NonNull
	private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
	@NonNull
	private static final Pattern QUALIFIED_IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
	@NonNull
	private static final KpiTableSchema DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = builder().build();
	}

	@NonNull
	private final String tableName;
	@NonNull
	private final String timestampColumn;
	@NonNull
	private final String kpiColumn;
	@NonNull
	private final String valueColumn;
	@NonNull
	private final String networkElementColumn;
	@NonNull
	private final String cellIdColumn;
	@NonNull
	private final String hostColumn;

	private KpiTableSchema(@NonNull Builder builder) {
		requireNonNull(builder);

		this.tableName = validateIdentifier(builder.tableName, QUALIFIED_IDENTIFIER_PATTERN, "table name");
		this.timestampColumn = validateIdentifier(builder.timestampColumn, IDENTIFIER_PATTERN, "timestamp column");
		this.kpiColumn = validateIdentifier(builder.kpiColumn, IDENTIFIER_PATTERN, "KPI column");
		this.valueColumn = validateIdentifier(builder.valueColumn, IDENTIFIER_PATTERN, "value column");
		this.networkElementColumn = validateIdentifier(builder.networkElementColumn, IDENTIFIER_PATTERN, "network element column");
		this.cellIdColumn = validateIdentifier(builder.cellIdColumn, IDENTIFIER_PATTERN, "cell ID column");
		this.hostColumn = validateIdentifier(builder.hostColumn, IDENTIFIER_PATTERN, "host column");
	}

	@NonNull
	public static KpiTableSchema defaultSchema() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	private static String validateIdentifier(@NonNull String identifier,
																					 @NonNull Pattern pattern,
																					 @NonNull String description) {
		requireNonNull(identifier, description);

		if (!pattern.matcher(identifier).matches())
			throw new IllegalArgumentException(format("Illegal %s '%s'", description, identifier));

		return identifier;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTableName(), getTimestampColumn(), getKpiColumn(), getValueColumn(),
				getNetworkElementColumn(), getCellIdColumn(), getHostColumn());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof KpiTableSchema))
			return false;

		KpiTableSchema kpiTableSchema = (KpiTableSchema) object;

		return Objects.equals(kpiTableSchema.getTableName(), getTableName())
				&& Objects.equals(kpiTableSchema.getTimestampColumn(), getTimestampColumn())
				&& Objects.equals(kpiTableSchema.getKpiColumn(), getKpiColumn())
				&& Objects.equals(kpiTableSchema.getValueColumn(), getValueColumn())
				&& Objects.equals(kpiTableSchema.getNetworkElementColumn(), getNetworkElementColumn())
				&& Objects.equals(kpiTableSchema.getCellIdColumn(), getCellIdColumn())
				&& Objects.equals(kpiTableSchema.getHostColumn(), getHostColumn());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{tableName=%s, timestampColumn=%s, kpiColumn=%s, valueColumn=%s, networkElementColumn=%s, cellIdColumn=%s, hostColumn=%s}",
				getClass().getSimpleName(), getTableName(), getTimestampColumn(), getKpiColumn(), getValueColumn(),
				getNetworkElementColumn(), getCellIdColumn(), getHostColumn());
	}

	@NonNull
	public String getTableName() {
		return this.tableName;
	}

	@NonNull
	public String getTimestampColumn() {
		return this.timestampColumn;
	}

	@NonNull
	public String getKpiColumn() {
		return this.kpiColumn;
	}

	@NonNull
	public String getValueColumn() {
		return this.valueColumn;
	}

	@NonNull
	public String getNetworkElementColumn() {
		return this.networkElementColumn;
	}

	@NonNull
	public String getCellIdColumn() {
		return this.cellIdColumn;
	}

	@NonNull
	public String getHostColumn() {
		return this.hostColumn;
	}

	/**
	 * Builder used to construct instances of {@link KpiTableSchema}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private String tableName;
		@NonNull
		private String timestampColumn;
		@NonNull
		private String kpiColumn;
		@NonNull
		private String valueColumn;
		@NonNull
		private String networkElementColumn;
		@NonNull
		private String cellIdColumn;
		@NonNull
		private String hostColumn;

		private Builder() {
			this.tableName = "summary";
			this.timestampColumn = "datetime";
			this.kpiColumn = "peg_name";
			this.valueColumn = "value";
			this.networkElementColumn = "ne";
			this.cellIdColumn = "cellid";
			this.hostColumn = "host";
		}

		@NonNull
		public Builder tableName(@NonNull String tableName) {
			this.tableName = requireNonNull(tableName);
			return this;
		}

		@NonNull
		public Builder timestampColumn(@NonNull String timestampColumn) {
			this.timestampColumn = requireNonNull(timestampColumn);
			return this;
		}

		@NonNull
		public Builder kpiColumn(@NonNull String kpiColumn) {
			this.kpiColumn = requireNonNull(kpiColumn);
			return this;
		}

		@NonNull
		public Builder valueColumn(@NonNull String valueColumn) {
			this.valueColumn = requireNonNull(valueColumn);
			return this;
		}

		@NonNull
		public Builder networkElementColumn(@NonNull String networkElementColumn) {
			this.networkElementColumn = requireNonNull(networkElementColumn);
			return this;
		}

		@NonNull
		public Builder cellIdColumn(@NonNull String cellIdColumn) {
			this.cellIdColumn = requireNonNull(cellIdColumn);
			return this;
		}

		@NonNull
		public Builder hostColumn(@NonNull String hostColumn) {
			this.hostColumn = requireNonNull(hostColumn);
			return this;
		}

		@NonNull
		public KpiTableSchema build() {
			return new KpiTableSchema(this);
		}
	}
}
