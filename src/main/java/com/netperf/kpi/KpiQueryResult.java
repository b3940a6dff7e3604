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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Outcome of a KPI retrieval: measurements grouped by KPI identifier, plus whether the query completed.
 * <p>
 * Every requested identifier is a key of {@link #getMeasurementsByKpi()}, in request order, and each list is in
 * ascending timestamp order. A {@link Status#DEGRADED} result has an empty list for every key and carries the
 * failure which caused it.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class KpiQueryResult {
	/**
	 * Whether the query ran to completion.
	 */
	public enum Status {
		COMPLETE,
		DEGRADED
	}

	@NonNull
	private final Map<String, List<KpiMeasurement>> measurementsByKpi;
	@NonNull
	private final Status status;
	@Nullable
	private final QueryExecutionException failure;

	private KpiQueryResult(@NonNull Map<String, List<KpiMeasurement>> measurementsByKpi,
												 @NonNull Status status,
												 @Nullable QueryExecutionException failure) {
		requireNonNull(measurementsByKpi);
		requireNonNull(status);

		Map<String, List<KpiMeasurement>> copy = new LinkedHashMap<>(measurementsByKpi.size());

		for (Map.Entry<String, List<KpiMeasurement>> entry : measurementsByKpi.entrySet())
			copy.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));

		this.measurementsByKpi = Collections.unmodifiableMap(copy);
		this.status = status;
		this.failure = failure;
	}

	@NonNull
	static KpiQueryResult complete(@NonNull Map<String, List<KpiMeasurement>> measurementsByKpi) {
		return new KpiQueryResult(measurementsByKpi, Status.COMPLETE, null);
	}

	@NonNull
	static KpiQueryResult degraded(@NonNull KpiQueryRequest kpiQueryRequest,
																 @NonNull QueryExecutionException failure) {
		requireNonNull(kpiQueryRequest);
		requireNonNull(failure);

		return new KpiQueryResult(emptyMeasurementsByKpi(kpiQueryRequest), Status.DEGRADED, failure);
	}

	/**
	 * One empty, mutable list per requested identifier, in request order.
	 */
	@NonNull
	static Map<String, List<KpiMeasurement>> emptyMeasurementsByKpi(@NonNull KpiQueryRequest kpiQueryRequest) {
		requireNonNull(kpiQueryRequest);

		Map<String, List<KpiMeasurement>> measurementsByKpi = new LinkedHashMap<>(kpiQueryRequest.getKpiIdentifiers().size());

		for (String kpiIdentifier : kpiQueryRequest.getKpiIdentifiers())
			measurementsByKpi.put(kpiIdentifier, new ArrayList<>());

		return measurementsByKpi;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getMeasurementsByKpi(), getStatus(), getFailure());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof KpiQueryResult))
			return false;

		KpiQueryResult kpiQueryResult = (KpiQueryResult) object;

		return Objects.equals(kpiQueryResult.getMeasurementsByKpi(), getMeasurementsByKpi())
				&& Objects.equals(kpiQueryResult.getStatus(), getStatus())
				&& Objects.equals(kpiQueryResult.getFailure(), getFailure());
	}

	@Override
	public String toString() {
		String counts = getMeasurementsByKpi().entrySet().stream()
				.map(entry -> format("%s=%d", entry.getKey(), entry.getValue().size()))
				.collect(Collectors.joining(", "));

		return format("%s{status=%s, measurementCounts={%s}%s}", getClass().getSimpleName(), getStatus().name(), counts,
				getFailure().map(failure -> format(", failure=%s", failure)).orElse(""));
	}

	/**
	 * Measurements grouped by KPI identifier.
	 *
	 * @return an unmodifiable mapping whose key set equals the requested identifiers
	 */
	@NonNull
	public Map<String, List<KpiMeasurement>> getMeasurementsByKpi() {
		return this.measurementsByKpi;
	}

	@NonNull
	public Status getStatus() {
		return this.status;
	}

	@NonNull
	public Boolean isDegraded() {
		return getStatus() == Status.DEGRADED;
	}

	/**
	 * The failure which was absorbed to produce a {@link Status#DEGRADED} result.
	 *
	 * @return the failure, if the result is degraded
	 */
	@NonNull
	public Optional<QueryExecutionException> getFailure() {
		return Optional.ofNullable(this.failure);
	}
}
