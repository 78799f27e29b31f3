/*
 * Copyright 2026 The NanoORM Authors.
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

package com.nanoorm;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when no {@link SchemaProbe} could discover the columns of a table.
 * <p>
 * The last probe's failure is the cause; failures of earlier probes are attached via {@link #getSuppressed()}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class SchemaUnavailableException extends DatabaseException {
	@NonNull
	private final String table;

	public SchemaUnavailableException(@NonNull String table,
																		@Nullable Throwable cause) {
		super(format("Unable to discover the columns of table '%s'", requireNonNull(table)), cause);
		this.table = table;
	}

	/**
	 * @return the table whose schema could not be discovered
	 */
	@NonNull
	public String getTable() {
		return this.table;
	}
}
