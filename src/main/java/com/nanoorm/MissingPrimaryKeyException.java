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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when an update or single-row delete is attempted on a {@link Record} whose primary key has no value.
 * <p>
 * Raised before any statement reaches the database.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class MissingPrimaryKeyException extends IllegalStateException {
	@NonNull
	private final String table;
	@NonNull
	private final String primaryKeyName;

	public MissingPrimaryKeyException(@NonNull String operation,
																		@NonNull String table,
																		@NonNull String primaryKeyName) {
		super(format("Cannot %s a row of table '%s' without a value for primary key '%s'",
				requireNonNull(operation), requireNonNull(table), requireNonNull(primaryKeyName)));
		this.table = table;
		this.primaryKeyName = primaryKeyName;
	}

	@NonNull
	public String getTable() {
		return this.table;
	}

	@NonNull
	public String getPrimaryKeyName() {
		return this.primaryKeyName;
	}
}
