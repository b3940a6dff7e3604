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
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fluent interface for acquiring instances of specialized parameter types.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Parameters {
	private Parameters() {
		// Non-instantiable
	}

	/**
	 * Acquires a SQL ARRAY parameter for a {@link Collection} of strings.
	 * <p>
	 * Iteration order of {@code elements} is preserved.
	 *
	 * @param elements the elements used to populate the SQL ARRAY
	 * @return a SQL ARRAY parameter for the given elements
	 */
	@NonNull
	public static ArrayParameter arrayOf(@NonNull Collection<String> elements) {
		requireNonNull(elements);
		return new DefaultArrayParameter(elements);
	}

	/**
	 * Default package-private implementation of {@link ArrayParameter}.
	 *
	 * @since 1.0.0
	 */
	@ThreadSafe
	static class DefaultArrayParameter implements ArrayParameter {
		@NonNull
		private final List<String> elements;

		DefaultArrayParameter(@NonNull Collection<String> elements) {
			requireNonNull(elements);
			// Always perform a defensive copy
			this.elements = List.copyOf(elements);
		}

		@NonNull
		@Override
		public List<String> getElements() {
			return this.elements;
		}

		@Override
		public int hashCode() {
			return Objects.hash(getElements());
		}

		@Override
		public boolean equals(Object object) {
			if (this == object)
				return true;

			if (!(object instanceof DefaultArrayParameter))
				return false;

			return Objects.equals(((DefaultArrayParameter) object).getElements(), getElements());
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s%s", ArrayParameter.class.getSimpleName(), getElements());
		}
	}
}
