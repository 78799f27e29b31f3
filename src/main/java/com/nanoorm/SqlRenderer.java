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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Renders the statements a {@link Record} issues against its table.
 * <p>
 * Rendering is pure: no statement is executed here. Identifiers are validated and interpolated; values are never
 * interpolated, only bound through {@code :name} placeholders.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SqlRenderer {
	@NonNull
	private final Schema schema;
	@NonNull
	private final String table;
	@NonNull
	private final String primaryKeyName;
	@NonNull
	private final List<String> selectedColumns;

	private SqlRenderer(@NonNull Schema schema,
											@NonNull String primaryKeyName) {
		requireNonNull(schema);

		this.schema = schema;
		this.table = Identifiers.requireQualifiedIdentifier(schema.getTable(), "table");
		this.primaryKeyName = Identifiers.requireIdentifier(primaryKeyName, "primary key");
		this.selectedColumns = List.copyOf(schema.getColumnNames());

		for (String selectedColumn : this.selectedColumns)
			Identifiers.requireIdentifier(selectedColumn, "column");
	}

	@NonNull
	public static SqlRenderer forSchema(@NonNull Schema schema,
																			@NonNull String primaryKeyName) {
		requireNonNull(schema);
		requireNonNull(primaryKeyName);

		return new SqlRenderer(schema, primaryKeyName);
	}

	/**
	 * {@code SELECT * FROM <table> WHERE <pk> = :<pk> LIMIT 1}.
	 */
	@NonNull
	public ParameterizedSql selectById(@Nullable Object id) {
		String parameterName = Identifiers.parameterNameFor(getPrimaryKeyName());

		return new ParameterizedSql(format("SELECT * FROM %s WHERE %s = :%s LIMIT 1", getTable(), getPrimaryKeyName(), parameterName),
				singletonParameter(parameterName, id));
	}

	/**
	 * {@code SELECT * FROM <table> WHERE <field> = :<field> [LIMIT n]}.
	 */
	@NonNull
	public ParameterizedSql selectBy(@NonNull String field,
																	 @Nullable Object value,
																	 @Nullable Integer limit) {
		Identifiers.requireQualifiedIdentifier(field, "condition field");

		String parameterName = Identifiers.parameterNameFor(field);
		StringBuilder sql = new StringBuilder(format("SELECT * FROM %s WHERE %s = :%s", getTable(), field, parameterName));
		appendLimit(sql, limit);

		return new ParameterizedSql(sql.toString(), singletonParameter(parameterName, value));
	}

	/**
	 * A SELECT of every known column, qualified by table name, plus the columns of any joins.
	 *
	 * @param joins      joins to expand, in chain order
	 * @param conditions equality conditions, conjoined with {@code AND} in iteration order
	 * @param orderBy    {@code column [ASC|DESC]} list, or {@code null}/blank for none
	 * @param limit      maximum rows, or {@code null} for no limit
	 * @return the statement
	 * @throws IllegalArgumentException if an identifier or the ordering is invalid, or the limit is negative
	 */
	@NonNull
	public ParameterizedSql select(@NonNull List<@NonNull JoinDescriptor> joins,
																 @NonNull Map<@NonNull String, @Nullable Object> conditions,
																 @Nullable String orderBy,
																 @Nullable Integer limit) {
		requireNonNull(joins);
		requireNonNull(conditions);

		List<String> selectList = new ArrayList<>(getSelectedColumns().size() + joins.size());

		if (getSelectedColumns().isEmpty())
			selectList.add(format("%s.*", getTable()));

		for (String column : getSelectedColumns())
			selectList.add(format("%s.%s", getTable(), column));

		StringBuilder joinClauses = new StringBuilder();

		for (JoinDescriptor join : joins) {
			String alias = join.getAlias();

			for (String field : join.getSelectedFields()) {
				if (JoinDescriptor.WILDCARD.equals(field))
					selectList.add(format("%s.*", alias));
				else
					selectList.add(format("%s.%s AS %s_%s", alias, field, alias, field));
			}

			joinClauses.append(format(" %s %s AS %s ON %s.%s = %s.%s", join.getJoinType().toSql(), join.getTargetTable(), alias,
					getTable(), join.getLocalKey(), alias, join.getForeignKey()));
		}

		StringBuilder sql = new StringBuilder(format("SELECT %s FROM %s", String.join(", ", selectList), getTable()));
		sql.append(joinClauses);

		Map<String, Object> parameters = appendWhere(sql, conditions);

		if (orderBy != null && !orderBy.isBlank())
			sql.append(" ORDER BY ").append(Identifiers.requireOrderBy(orderBy));

		appendLimit(sql, limit);

		return new ParameterizedSql(sql.toString(), parameters);
	}

	/**
	 * An INSERT of every stored field except the primary key, which is always left to the database.
	 * <p>
	 * With nothing to send, renders {@code INSERT INTO <table> DEFAULT VALUES}.
	 */
	@NonNull
	public ParameterizedSql insert(@NonNull Map<@NonNull String, @Nullable Object> values) {
		requireNonNull(values);

		List<String> columns = new ArrayList<>(values.size());
		List<String> placeholders = new ArrayList<>(values.size());
		Map<String, Object> parameters = new LinkedHashMap<>();

		for (Map.Entry<String, Object> entry : values.entrySet()) {
			String column = entry.getKey();

			if (column.equals(getPrimaryKeyName()))
				continue;

			Identifiers.requireIdentifier(column, "column");
			String parameterName = uniqueParameterName(column, parameters);

			columns.add(column);
			placeholders.add(format(":%s", parameterName));
			parameters.put(parameterName, entry.getValue());
		}

		if (columns.isEmpty())
			return new ParameterizedSql(format("INSERT INTO %s DEFAULT VALUES", getTable()), parameters);

		return new ParameterizedSql(format("INSERT INTO %s (%s) VALUES (%s)", getTable(),
				String.join(", ", columns), String.join(", ", placeholders)), parameters);
	}

	/**
	 * An UPDATE of every stored table column except the primary key, matched on the primary key.
	 * <p>
	 * Stored values that are not columns of the table (e.g. computed columns picked up during hydration) are skipped.
	 *
	 * @param values the record's stored values
	 * @return the statement, or empty if there is nothing to set
	 * @throws MissingPrimaryKeyException if the primary key has no value
	 */
	@NonNull
	public Optional<ParameterizedSql> update(@NonNull Map<@NonNull String, @Nullable Object> values) {
		requireNonNull(values);

		Object id = values.get(getPrimaryKeyName());

		if (id == null)
			throw new MissingPrimaryKeyException("update", getTable(), getPrimaryKeyName());

		List<String> assignments = new ArrayList<>(values.size());
		Map<String, Object> parameters = new LinkedHashMap<>();

		// Reserved first so a column can never take the WHERE clause's name
		String primaryKeyParameterName = Identifiers.parameterNameFor(getPrimaryKeyName());
		parameters.put(primaryKeyParameterName, id);

		for (Map.Entry<String, Object> entry : values.entrySet()) {
			String column = entry.getKey();

			if (column.equals(getPrimaryKeyName()) || !getSchema().hasColumn(column))
				continue;

			String parameterName = uniqueParameterName(column, parameters);

			assignments.add(format("%s = :%s", column, parameterName));
			parameters.put(parameterName, entry.getValue());
		}

		if (assignments.isEmpty())
			return Optional.empty();

		return Optional.of(new ParameterizedSql(format("UPDATE %s SET %s WHERE %s = :%s", getTable(),
				String.join(", ", assignments), getPrimaryKeyName(), primaryKeyParameterName), parameters));
	}

	/**
	 * {@code DELETE FROM <table> WHERE <pk> = :<pk>}.
	 *
	 * @throws MissingPrimaryKeyException if {@code id} is null
	 */
	@NonNull
	public ParameterizedSql deleteById(@Nullable Object id) {
		if (id == null)
			throw new MissingPrimaryKeyException("delete", getTable(), getPrimaryKeyName());

		String parameterName = Identifiers.parameterNameFor(getPrimaryKeyName());

		return new ParameterizedSql(format("DELETE FROM %s WHERE %s = :%s", getTable(), getPrimaryKeyName(), parameterName),
				singletonParameter(parameterName, id));
	}

	/**
	 * {@code DELETE FROM <table> WHERE ...} for a non-empty set of equality conditions.
	 *
	 * @throws EmptyConditionException if {@code conditions} is empty
	 */
	@NonNull
	public ParameterizedSql deleteWhere(@NonNull Map<@NonNull String, @Nullable Object> conditions) {
		requireNonNull(conditions);

		if (conditions.isEmpty())
			throw new EmptyConditionException(getTable());

		StringBuilder sql = new StringBuilder(format("DELETE FROM %s", getTable()));
		Map<String, Object> parameters = appendWhere(sql, conditions);

		return new ParameterizedSql(sql.toString(), parameters);
	}

	@NonNull
	private Map<String, Object> appendWhere(@NonNull StringBuilder sql,
																					@NonNull Map<String, Object> conditions) {
		requireNonNull(sql);
		requireNonNull(conditions);

		Map<String, Object> parameters = new LinkedHashMap<>();

		if (conditions.isEmpty())
			return parameters;

		List<String> predicates = new ArrayList<>(conditions.size());

		for (Map.Entry<String, Object> condition : conditions.entrySet()) {
			String field = Identifiers.requireQualifiedIdentifier(condition.getKey(), "condition field");
			String parameterName = Identifiers.parameterNameFor(field);

			if (parameters.containsKey(parameterName))
				throw new IllegalArgumentException(format("Conditions %s share the parameter name '%s'", conditions.keySet(), parameterName));

			predicates.add(format("%s = :%s", field, parameterName));
			parameters.put(parameterName, condition.getValue());
		}

		sql.append(" WHERE ").append(String.join(" AND ", predicates));
		return parameters;
	}

	private void appendLimit(@NonNull StringBuilder sql,
													 @Nullable Integer limit) {
		requireNonNull(sql);

		if (limit == null)
			return;

		if (limit < 0)
			throw new IllegalArgumentException(format("Limit must be >= 0 but was %d", limit));

		sql.append(" LIMIT ").append(limit);
	}

	/**
	 * The parameter name for {@code column}, suffixed ({@code _2}, {@code _3}, ...) if another column in the same
	 * statement already maps to it, as {@code a$b} and {@code a_b} both do.
	 */
	@NonNull
	private static String uniqueParameterName(@NonNull String column,
																						@NonNull Map<String, Object> parameters) {
		requireNonNull(column);
		requireNonNull(parameters);

		String parameterName = Identifiers.parameterNameFor(column);

		if (!parameters.containsKey(parameterName))
			return parameterName;

		for (int suffix = 2; ; ++suffix) {
			String candidate = format("%s_%d", parameterName, suffix);

			if (!parameters.containsKey(candidate))
				return candidate;
		}
	}

	@NonNull
	private static Map<String, Object> singletonParameter(@NonNull String name,
																											 @Nullable Object value) {
		Map<String, Object> parameters = new LinkedHashMap<>(2);
		parameters.put(name, value);
		return parameters;
	}

	@NonNull
	public Schema getSchema() {
		return this.schema;
	}

	@NonNull
	public String getTable() {
		return this.table;
	}

	@NonNull
	public String getPrimaryKeyName() {
		return this.primaryKeyName;
	}

	@NonNull
	public List<@NonNull String> getSelectedColumns() {
		return this.selectedColumns;
	}
}
