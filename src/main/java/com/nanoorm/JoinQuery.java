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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An immutable chain of joins from a {@link Record}'s table, created by {@link Record#addJoin(String, String, String)}.
 * <p>
 * Each {@code addJoin} returns a new {@code JoinQuery}; the receiver is unchanged, so a chain can be shared and
 * extended in different directions.
 * <pre>{@code
 * List<Map<String, Object>> rows = orders
 *   .addJoin("users", "user_id", "id", JoinType.INNER, List.of("name"))
 *   .addJoin("products", "product_id", "id", JoinType.LEFT, List.of("title"))
 *   .fetchWithJoins(Map.of("orders.status", "shipped"));
 * // each row carries the orders columns plus j0_name and j1_title
 * }</pre>
 * Rows are returned as plain maps rather than records, since their columns span several tables.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class JoinQuery {
	@NonNull
	private final Database database;
	@NonNull
	private final SqlRenderer sqlRenderer;
	@NonNull
	private final List<JoinDescriptor> joins;

	JoinQuery(@NonNull Database database,
						@NonNull SqlRenderer sqlRenderer,
						@NonNull List<@NonNull JoinDescriptor> joins) {
		requireNonNull(database);
		requireNonNull(sqlRenderer);
		requireNonNull(joins);

		this.database = database;
		this.sqlRenderer = sqlRenderer;
		this.joins = List.copyOf(joins);
	}

	/**
	 * Adds an {@code INNER} join selecting every column of {@code table}.
	 */
	@NonNull
	public JoinQuery addJoin(@NonNull String table,
													 @NonNull String localKey,
													 @NonNull String foreignKey) {
		return addJoin(table, localKey, foreignKey, JoinType.INNER, JoinDescriptor.ALL_FIELDS);
	}

	/**
	 * Adds a join of the named type ({@code "inner"}, {@code "LEFT"}, ...) selecting every column of {@code table}.
	 */
	@NonNull
	public JoinQuery addJoin(@NonNull String table,
													 @NonNull String localKey,
													 @NonNull String foreignKey,
													 @NonNull String joinType) {
		return addJoin(table, localKey, foreignKey, JoinType.fromName(joinType), JoinDescriptor.ALL_FIELDS);
	}

	@NonNull
	public JoinQuery addJoin(@NonNull String table,
													 @NonNull String localKey,
													 @NonNull String foreignKey,
													 @NonNull String joinType,
													 @NonNull List<@NonNull String> selectedFields) {
		return addJoin(table, localKey, foreignKey, JoinType.fromName(joinType), selectedFields);
	}

	/**
	 * Adds a join.
	 *
	 * @param table          the table to join
	 * @param localKey       column of the record's table in the join predicate
	 * @param foreignKey     column of {@code table} in the join predicate
	 * @param joinType       the kind of join
	 * @param selectedFields columns of {@code table} to select, or {@link JoinDescriptor#ALL_FIELDS}
	 * @return a new chain ending with this join
	 * @throws IllegalArgumentException if any identifier is invalid or no fields are selected
	 */
	@NonNull
	public JoinQuery addJoin(@NonNull String table,
													 @NonNull String localKey,
													 @NonNull String foreignKey,
													 @NonNull JoinType joinType,
													 @NonNull List<@NonNull String> selectedFields) {
		requireNonNull(joinType);
		requireNonNull(selectedFields);

		List<JoinDescriptor> joins = new ArrayList<>(getJoins().size() + 1);
		joins.addAll(getJoins());
		joins.add(new JoinDescriptor(getJoins().size(), table, localKey, foreignKey, joinType, selectedFields));

		return new JoinQuery(this.database, this.sqlRenderer, joins);
	}

	/**
	 * Renders this chain's SELECT without running it.
	 *
	 * @param conditions equality conditions, conjoined with {@code AND}
	 * @return the statement
	 */
	@NonNull
	public ParameterizedSql toSql(@NonNull Map<@NonNull String, @Nullable Object> conditions) {
		requireNonNull(conditions);
		return this.sqlRenderer.select(getJoins(), conditions, null, null);
	}

	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> fetchWithJoins() {
		return fetchWithJoins(Map.of());
	}

	/**
	 * Runs the joined SELECT.
	 *
	 * @param conditions equality conditions, conjoined with {@code AND}; qualify fields shared by several tables
	 * @return raw rows
	 */
	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> fetchWithJoins(@NonNull Map<@NonNull String, @Nullable Object> conditions) {
		requireNonNull(conditions);
		return toSql(conditions).toQuery(this.database).fetchList();
	}

	@NonNull
	public List<@NonNull JoinDescriptor> getJoins() {
		return this.joins;
	}

	@Override
	public String toString() {
		return format("%s{table=%s, joins=%s}", getClass().getSimpleName(), this.sqlRenderer.getTable(), getJoins());
	}
}
