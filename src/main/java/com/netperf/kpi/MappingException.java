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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when a result row cannot be turned into a {@link KpiMeasurement}, e.g. an unexpected {@code NULL}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class MappingException extends QueryExecutionException {
	public MappingException(@Nullable String message) {
		super(message, null);
	}

	public MappingException(@Nullable String message,
													@Nullable Throwable cause) {
		super(message, cause);
	}
}
