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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fluent builder for SQL statements.
 * <p>
 * Obtain instances via {@link Database#query(String)}.
 * Positional parameters via {@code ?} are not supported; use named parameters (e.g. {@code :id}) and {@link #bind(String, Object)}.
 * <p>
 * Rows come back as ordered column-label-to-value maps, exactly as produced by the database's {@link ResultSetMapper}.
 * <pre>{@code
 * // Query returning one row
 * Optional<Map<String, Object>> user = database.query("SELECT * FROM users WHERE id = :id")
 *   .bind("id", 42)
 *   .fetchObject();
 *
 * // Query returning multiple rows
 * List<Map<String, Object>> users = database.query("SELECT * FROM users WHERE status = :status")
 *   .bind("status", "active")
 *   .fetchList();
 *
 * // DML with no result
 * long rowsAffected = database.query("UPDATE users SET status = :status WHERE id = :id")
 *   .bind("id", 42)
 *   .bind("status", "inactive")
 *   .execute();
 *
 * // INSERT that reports the key the database generated
 * Optional<Object> id = database.query("INSERT INTO users (name) VALUES (:name)")
 *   .bind("name", "Jane")
 *   .executeForGeneratedKey();
 * }</pre>
 * <p>
 * Implementations of this interface are intended for use by a single thread.
 *
 * @see Database#query(String)
 * @since 1.0.0
 */
@NotThreadSafe
public interface Query {
	/**
	 * Binds a named parameter to a value.
	 *
	 * @param name  the parameter name (without the leading {@code :})
	 * @param value the value to bind (may be {@code null})
	 * @return this builder, for chaining
	 * @throws IllegalArgumentException if the SQL has no parameter with this name
	 */
	@NonNull
	Query bind(@NonNull String name,
						 @Nullable Object value);

	/**
	 * Binds all entries from the given map as named parameters.
	 *
	 * @param parameters map of parameter names to values
	 * @return this builder, for chaining
	 */
	@NonNull
	Query bindAll(@NonNull Map<@NonNull String, @Nullable Object> parameters);

	/**
	 * Associates an identifier with this query for logging/diagnostics.
	 * <p>
	 * If not called, a default ID will be generated.
	 *
	 * @param id the identifier
	 * @return this builder, for chaining
	 */
	@NonNull
	Query id(@Nullable Object id);

	/**
	 * Executes the query and returns a single row.
	 *
	 * @return the single row, or empty if no rows
	 * @throws DatabaseException if more than one row is returned
	 */
	@NonNull
	Optional<Map<@NonNull String, @Nullable Object>> fetchObject();

	/**
	 * Executes the query and returns all rows as a list.
	 *
	 * @return list of rows (empty if no rows)
	 */
	@NonNull
	List<@NonNull Map<@NonNull String, @Nullable Object>> fetchList();

	/**
	 * Executes a DML statement (INSERT, UPDATE, DELETE) with no resultset.
	 *
	 * @return the number of rows affected
	 */
	@NonNull
	Long execute();

	/**
	 * Executes an {@code INSERT}, asking the driver for the key the database generated for the new row.
	 * <p>
	 * If the driver reports several generated columns, the first one is returned.
	 * Prefer {@link #executeForGeneratedKey(String)} when the key column is known.
	 *
	 * @return the generated key, or empty if the driver reported none
	 */
	@NonNull
	Optional<Object> executeForGeneratedKey();

	/**
	 * Executes an {@code INSERT}, asking the driver for the value the database generated for {@code keyColumnName}.
	 * <p>
	 * Some drivers report every column of the new row (PostgreSQL's {@code RETURNING *}), so the key is picked out by
	 * its normalized label. A lone generated column is taken as the key whatever its label
	 * (e.g. SQLite's {@code last_insert_rowid()}).
	 *
	 * @param keyColumnName the generated column, e.g. the primary key
	 * @return the generated key, or empty if the driver reported none
	 */
	@NonNull
	Optional<Object> executeForGeneratedKey(@NonNull String keyColumnName);
}
