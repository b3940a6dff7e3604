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
 * Thrown when a connection to the KPI store cannot be opened (unreachable host, bad credentials, unknown database...).
 * <p>
 * Unlike {@link QueryExecutionException}, this is never absorbed by {@link KpiRepository}: callers receive it as-is.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ConnectionException extends DatabaseException {
	public ConnectionException(@Nullable String message,
														 @Nullable Throwable cause) {
		super(message, cause);
	}
}
