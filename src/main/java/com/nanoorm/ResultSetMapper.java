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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;

/**
 * Contract for mapping the current {@link ResultSet} row to an ordered column-label-to-value map.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 * Or, implement your own: <pre>{@code  ResultSetMapper myImpl = (statementContext, resultSet) -> {
 *   Map<String, Object> row = new LinkedHashMap<>();
 *   // TODO: pull data from resultSet into row
 *   return row;
 * };}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultSetMapper {
	/**
	 * Maps the current row of {@code resultSet}.
	 * <p>
	 * Iteration order of the returned map must follow column order.
	 *
	 * @param statementContext current SQL context
	 * @param resultSet        provides raw row data to pull from, already positioned on a row
	 * @return the row, keyed by (normalized) column label
	 * @throws SQLException if an error occurs during mapping
	 */
	@NonNull
	Map<@NonNull String, @Nullable Object> map(@NonNull StatementContext statementContext,
																						 @NonNull ResultSet resultSet) throws SQLException;

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ResultSetMapper withDefaultConfiguration() {
		return new DefaultResultSetMapper();
	}
}
