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
import java.util.List;

/**
 * Encapsulates {@link java.sql.PreparedStatement} parameter data meant to be bound to a formal
 * <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.sql/java/sql/Array.html" target="_blank">{@code java.sql.Array}</a>
 * type by {@link PreparedStatementBinder}.
 * <p>
 * This is how KPI identifier, entity, cell and host filters travel to the database: as a single array-valued
 * parameter, never as SQL text. The element type name is chosen at binding time from the {@link DatabaseType}.
 * <p>
 * Standard instances may be constructed via {@link Parameters#arrayOf(java.util.Collection)}.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface ArrayParameter {
	/**
	 * Gets the elements of this SQL ARRAY.
	 *
	 * @return the elements of this SQL ARRAY, in order
	 */
	@NonNull
	List<String> getElements();
}
