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
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes which KPI measurements to retrieve.
 * <p>
 * Bounds are inclusive and zone-less: they are compared as-is against the store's timestamp column.
 * <p>
 * All identifier and filter values are trimmed and blank values are discarded; duplicates collapse while
 * first-seen order is kept. A filter which ends up empty is treated as absent.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class KpiQueryRequest {
	@NonNull
	private final LocalDateTime start;
	@NonNull
	private final LocalDateTime end;
	@NonNull
	private final Set<String> kpiIdentifiers;
	@Nullable
	private final Set<String> entityFilter;
	@Nullable
	private final Set<String> cellFilter;
	@Nullable
	private final Set<String> hostFilter;

	private KpiQueryRequest(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.start.isAfter(builder.end))
			throw new IllegalArgumentException(format("Start of the time range (%s) is after its end (%s)", builder.start, builder.end));

		Set<String> kpiIdentifiers = normalize(builder.kpiIdentifiers);

		if (kpiIdentifiers.isEmpty())
			throw new IllegalArgumentException("At least one KPI identifier is required");

		this.start = builder.start;
		this.end = builder.end;
		this.kpiIdentifiers = kpiIdentifiers;
		this.entityFilter = emptyToNull(normalize(builder.entityFilter));
		this.cellFilter = emptyToNull(normalize(builder.cellFilter));
		this.hostFilter = emptyToNull(normalize(builder.hostFilter));
	}

	/**
	 * Acquires a builder for a request covering {@code [start, end]}.
	 *
	 * @param start inclusive lower bound
	 * @param end   inclusive upper bound
	 * @return a {@link KpiQueryRequest} builder
	 */
	@NonNull
	public static Builder withTimeRange(@NonNull LocalDateTime start,
																			@NonNull LocalDateTime end) {
		requireNonNull(start);
		requireNonNull(end);

		return new Builder(start, end);
	}

	@NonNull
	private static Set<String> normalize(@Nullable Collection<String> values) {
		if (values == null)
			return Set.of();

		Set<String> normalized = new LinkedHashSet<>(values.size());

		for (String value : values) {
			if (value == null)
				continue;

			String trimmed = value.trim();

			if (trimmed.length() > 0)
				normalized.add(trimmed);
		}

		return Collections.unmodifiableSet(normalized);
	}

	@Nullable
	private static Set<String> emptyToNull(@NonNull Set<String> values) {
		return values.isEmpty() ? null : values;
	}

	@NonNull
	private static List<String> splitCommaSeparated(@Nullable String commaSeparatedValues) {
		if (commaSeparatedValues == null)
			return List.of();

		return Arrays.asList(commaSeparatedValues.split(","));
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStart(), getEnd(), getKpiIdentifiers(), getEntityFilter(), getCellFilter(), getHostFilter());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof KpiQueryRequest))
			return false;

		KpiQueryRequest kpiQueryRequest = (KpiQueryRequest) object;

		return Objects.equals(kpiQueryRequest.getStart(), getStart())
				&& Objects.equals(kpiQueryRequest.getEnd(), getEnd())
				&& Objects.equals(kpiQueryRequest.getKpiIdentifiers(), getKpiIdentifiers())
				&& Objects.equals(kpiQueryRequest.getEntityFilter(), getEntityFilter())
				&& Objects.equals(kpiQueryRequest.getCellFilter(), getCellFilter())
				&& Objects.equals(kpiQueryRequest.getHostFilter(), getHostFilter());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(6);

		components.add(format("start=%s", getStart()));
		components.add(format("end=%s", getEnd()));
		components.add(format("kpiIdentifiers=%s", getKpiIdentifiers()));

		getEntityFilter().ifPresent(entityFilter -> components.add(format("entityFilter=%s", entityFilter)));
		getCellFilter().ifPresent(cellFilter -> components.add(format("cellFilter=%s", cellFilter)));
		getHostFilter().ifPresent(hostFilter -> components.add(format("hostFilter=%s", hostFilter)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public LocalDateTime getStart() {
		return this.start;
	}

	@NonNull
	public LocalDateTime getEnd() {
		return this.end;
	}

	/**
	 * The KPI identifiers to retrieve, in the order the result mapping will present them.
	 *
	 * @return a non-empty, unmodifiable set
	 */
	@NonNull
	public Set<String> getKpiIdentifiers() {
		return this.kpiIdentifiers;
	}

	@NonNull
	public Optional<Set<String>> getEntityFilter() {
		return Optional.ofNullable(this.entityFilter);
	}

	@NonNull
	public Optional<Set<String>> getCellFilter() {
		return Optional.ofNullable(this.cellFilter);
	}

	@NonNull
	public Optional<Set<String>> getHostFilter() {
		return Optional.ofNullable(this.hostFilter);
	}

	/**
	 * Builder used to construct instances of {@link KpiQueryRequest}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final LocalDateTime start;
		@NonNull
		private final LocalDateTime end;
		@Nullable
		private Collection<String> kpiIdentifiers;
		@Nullable
		private Collection<String> entityFilter;
		@Nullable
		private Collection<String> cellFilter;
		@Nullable
		private Collection<String> hostFilter;

		private Builder(@NonNull LocalDateTime start,
										@NonNull LocalDateTime end) {
			this.start = requireNonNull(start);
			this.end = requireNonNull(end);
		}

		@NonNull
		public Builder kpiIdentifiers(@Nullable Collection<String> kpiIdentifiers) {
			this.kpiIdentifiers = kpiIdentifiers;
			return this;
		}

		/**
		 * Sets KPI identifiers from a comma-separated list, e.g. {@code "availability, throughput"}.
		 *
		 * @param commaSeparatedKpiIdentifiers the identifiers
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder kpiIdentifiers(@Nullable String commaSeparatedKpiIdentifiers) {
			return kpiIdentifiers(splitCommaSeparated(commaSeparatedKpiIdentifiers));
		}

		@NonNull
		public Builder entityFilter(@Nullable Collection<String> entityFilter) {
			this.entityFilter = entityFilter;
			return this;
		}

		@NonNull
		public Builder entityFilter(@Nullable String commaSeparatedEntityFilter) {
			return entityFilter(splitCommaSeparated(commaSeparatedEntityFilter));
		}

		@NonNull
		public Builder cellFilter(@Nullable Collection<String> cellFilter) {
			this.cellFilter = cellFilter;
			return this;
		}

		@NonNull
		public Builder cellFilter(@Nullable String commaSeparatedCellFilter) {
			return cellFilter(splitCommaSeparated(commaSeparatedCellFilter));
		}

		@NonNull
		public Builder hostFilter(@Nullable Collection<String> hostFilter) {
			this.hostFilter = hostFilter;
			return this;
		}

		@NonNull
		public Builder hostFilter(@Nullable String commaSeparatedHostFilter) {
			return hostFilter(splitCommaSeparated(commaSeparatedHostFilter));
		}

		/**
		 * Builds the request.
		 *
		 * @return the request
		 * @throws IllegalArgumentException if no KPI identifier remains after normalization, or if the time range is inverted
		 */
		@NonNull
		public KpiQueryRequest build() {
			return new KpiQueryRequest(this);
		}
	}
}
