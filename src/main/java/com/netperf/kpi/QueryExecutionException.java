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
 * Thrown when a statement fails after a connection was successfully obtained: bad SQL, binding failures,
 * timeouts, driver errors while iterating rows, and row-mapping problems (see {@link MappingException}).
 * <p>
 * {@link KpiRepository} absorbs these and reports them through {@link KpiQueryResult#getFailure()}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class QueryExecutionException extends DatabaseException {
	public QueryExecutionException(@Nullable String message,
																 @Nullable Throwable cause) {
		super(message, cause);
	}
}
