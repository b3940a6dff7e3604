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

import javax.annotation.concurrent.ThreadSafe;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One time-stamped KPI value for a network element/cell pair.
 * <p>
 * {@link #getTimestamp()} is ISO-8601 local date-time text (e.g. {@code 2025-01-01T08:00:00}) carrying whatever wall-clock
 * value the store holds; {@link #getDate()} and {@link #getHour()} are derived from it, and {@link #getEntityId()}
 * is {@code <networkElement>#<cellId>}.
 * <p>
 * The network element and cell ID columns are nullable in the store. A row missing either one has no entity ID.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class KpiMeasurement {
	@NonNull
	public static final String ENTITY_ID_SEPARATOR = "#";

	@NonNull
	private final String timestamp;
	@Nullable
	private final String entityId;
	@NonNull
	private final String kpiIdentifier;
	@NonNull
	private final Double value;
	@Nullable
	private final String networkElement;
	@Nullable
	private final String cellId;
	@Nullable
	private final String host;
	@NonNull
	private final String date;
	@NonNull
	private final Integer hour;

	private KpiMeasurement(@NonNull LocalDateTime timestamp,
												 @NonNull String kpiIdentifier,
												 @NonNull Double value,
												 @Nullable String networkElement,
												 @Nullable String cellId,
												 @Nullable String host) {
		requireNonNull(timestamp);
		requireNonNull(kpiIdentifier);
		requireNonNull(value);

		this.timestamp = timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
		this.entityId = networkElement == null || cellId == null ? null : format("%s%s%s", networkElement, ENTITY_ID_SEPARATOR, cellId);
		this.kpiIdentifier = kpiIdentifier;
		this.value = value;
		this.networkElement = networkElement;
		this.cellId = cellId;
		this.host = host;
		this.date = timestamp.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
		this.hour = timestamp.getHour();
	}

	/**
	 * Factory method for providing {@link KpiMeasurement} instances; derived fields are computed from the raw ones.
	 *
	 * @param timestamp      when the value was measured, as stored (no zone conversion is applied)
	 * @param kpiIdentifier  the measurement name
	 * @param value          the measured value
	 * @param networkElement the network element identifier, if known
	 * @param cellId         the cell identifier, if known
	 * @param host           the reporting host, if known
	 * @return a measurement
	 */
	@NonNull
	public static KpiMeasurement of(@NonNull LocalDateTime timestamp,
																	@NonNull String kpiIdentifier,
																	@NonNull Double value,
																	@Nullable String networkElement,
																	@Nullable String cellId,
																	@Nullable String host) {
		return new KpiMeasurement(timestamp, kpiIdentifier, value, networkElement, cellId, host);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTimestamp(), getKpiIdentifier(), getValue(), getNetworkElement(), getCellId(), getHost());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof KpiMeasurement))
			return false;

		KpiMeasurement kpiMeasurement = (KpiMeasurement) object;

		return Objects.equals(kpiMeasurement.getTimestamp(), getTimestamp())
				&& Objects.equals(kpiMeasurement.getKpiIdentifier(), getKpiIdentifier())
				&& Objects.equals(kpiMeasurement.getValue(), getValue())
				&& Objects.equals(kpiMeasurement.getNetworkElement(), getNetworkElement())
				&& Objects.equals(kpiMeasurement.getCellId(), getCellId())
				&& Objects.equals(kpiMeasurement.getHost(), getHost());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{timestamp=%s, kpiIdentifier=%s, entityId=%s, value=%s%s}", getClass().getSimpleName(),
				getTimestamp(), getKpiIdentifier(), getEntityId().orElse(null), getValue(),
				getHost().map(host -> format(", host=%s", host)).orElse(""));
	}

	@NonNull
	public String getTimestamp() {
		return this.timestamp;
	}

	/**
	 * @return {@code <networkElement>#<cellId>}, if both are known
	 */
	@NonNull
	public Optional<String> getEntityId() {
		return Optional.ofNullable(this.entityId);
	}

	@NonNull
	public String getKpiIdentifier() {
		return this.kpiIdentifier;
	}

	@NonNull
	public Double getValue() {
		return this.value;
	}

	@NonNull
	public Optional<String> getNetworkElement() {
		return Optional.ofNullable(this.networkElement);
	}

	@NonNull
	public Optional<String> getCellId() {
		return Optional.ofNullable(this.cellId);
	}

	@NonNull
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	/**
	 * @return the calendar day of {@link #getTimestamp()}, formatted {@code yyyy-MM-dd}
	 */
	@NonNull
	public String getDate() {
		return this.date;
	}

	/**
	 * @return the hour of day of {@link #getTimestamp()}, 0-23
	 */
	@NonNull
	public Integer getHour() {
		return this.hour;
	}
}
