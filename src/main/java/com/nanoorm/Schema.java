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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The column names of one table, in table order, as discovered by a {@link SchemaProbe}.
 * <p>
 * Only names are kept; types, nullability and defaults are not.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Schema {
	@NonNull
	private final String table;
	@NonNull
	private final List<String> columnNames;
	@NonNull
	private final Set<String> columnNameSet;

	private Schema(@NonNull String table,
								 @NonNull List<String> columnNames) {
		requireNonNull(table);
		requireNonNull(columnNames);

		this.columnNameSet = new LinkedHashSet<>(columnNames);
		this.table = table;
		this.columnNames = List.copyOf(new ArrayList<>(this.columnNameSet));
	}

	/**
	 * Creates a schema; duplicate column names are collapsed, keeping the first occurrence.
	 *
	 * @param table       the table name
	 * @param columnNames the table's column names, in table order
	 * @return the schema
	 */
	@NonNull
	public static Schema of(@NonNull String table,
													@NonNull List<@NonNull String> columnNames) {
		requireNonNull(table);
		requireNonNull(columnNames);

		for (String columnName : columnNames)
			requireNonNull(columnName, "Column names must not be null");

		return new Schema(table, columnNames);
	}

	public boolean hasColumn(@NonNull String columnName) {
		requireNonNull(columnName);
		return this.columnNameSet.contains(columnName);
	}

	@NonNull
	public String getTable() {
		return this.table;
	}

	@NonNull
	public List<@NonNull String> getColumnNames() {
		return this.columnNames;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Schema))
			return false;

		Schema schema = (Schema) object;

		return Objects.equals(schema.getTable(), getTable())
				&& Objects.equals(schema.getColumnNames(), getColumnNames());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTable(), getColumnNames());
	}

	@Override
	public String toString() {
		return format("%s{table=%s, columnNames=%s}", getClass().getSimpleName(), getTable(), getColumnNames());
	}
}
