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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL text split around its {@code :name} placeholders.
 * <p>
 * Placeholders inside quoted strings, quoted identifiers and comments are left alone, as is the {@code ::} cast
 * operator. A parameter name is a letter or underscore followed by letters, digits or underscores.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class NamedParameterSql {
	@NonNull
	private final String sql;
	@NonNull
	private final List<String> sqlFragments;
	@NonNull
	private final List<String> parameterNames;
	@NonNull
	private final Set<String> distinctParameterNames;

	private NamedParameterSql(@NonNull String sql,
														@NonNull List<String> sqlFragments,
														@NonNull List<String> parameterNames) {
		requireNonNull(sql);
		requireNonNull(sqlFragments);
		requireNonNull(parameterNames);

		this.sql = sql;
		this.sqlFragments = List.copyOf(sqlFragments);
		this.parameterNames = List.copyOf(parameterNames);
		this.distinctParameterNames = Set.copyOf(new LinkedHashSet<>(parameterNames));
	}

	@NonNull
	static NamedParameterSql parse(@NonNull String sql) {
		requireNonNull(sql);

		List<String> sqlFragments = new ArrayList<>();
		List<String> parameterNames = new ArrayList<>();
		StringBuilder sqlFragment = new StringBuilder(sql.length());
		int length = sql.length();
		int i = 0;

		while (i < length) {
			char c = sql.charAt(i);

			// Quoted text: '...', "..." and `...`, with doubled-quote escapes
			if (c == '\'' || c == '"' || c == '`') {
				int end = endOfQuoted(sql, i, c);
				sqlFragment.append(sql, i, end);
				i = end;
				continue;
			}

			if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
				int end = sql.indexOf('\n', i);
				end = end == -1 ? length : end + 1;
				sqlFragment.append(sql, i, end);
				i = end;
				continue;
			}

			if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
				int end = sql.indexOf("*/", i + 2);
				end = end == -1 ? length : end + 2;
				sqlFragment.append(sql, i, end);
				i = end;
				continue;
			}

			if (c == '?')
				throw new IllegalArgumentException(format("Positional parameters ('?') are not supported. Use named parameters (e.g. ':id') and %s#bind. SQL: %s",
						Query.class.getSimpleName(), sql));

			if (c == ':' && i + 1 < length && sql.charAt(i + 1) == ':') {
				sqlFragment.append("::");
				i += 2;
				continue;
			}

			if (c == ':' && i + 1 < length && isParameterNameStart(sql.charAt(i + 1))) {
				int end = i + 2;

				while (end < length && isParameterNamePart(sql.charAt(end)))
					++end;

				parameterNames.add(sql.substring(i + 1, end));
				sqlFragments.add(sqlFragment.toString());
				sqlFragment.setLength(0);
				i = end;
				continue;
			}

			sqlFragment.append(c);
			++i;
		}

		sqlFragments.add(sqlFragment.toString());

		return new NamedParameterSql(sql, sqlFragments, parameterNames);
	}

	/**
	 * Rewrites the SQL with JDBC {@code ?} placeholders and lines up the bound values with them.
	 *
	 * @param bindings values keyed by parameter name
	 * @return the JDBC SQL and its positional parameters
	 * @throws IllegalArgumentException if any parameter in the SQL is unbound
	 */
	@NonNull
	JdbcSql toJdbcSql(@NonNull Map<String, Object> bindings) {
		requireNonNull(bindings);

		if (getParameterNames().isEmpty())
			return new JdbcSql(getSql(), List.of());

		StringBuilder jdbcSql = new StringBuilder(getSql().length());
		List<Object> parameters = new ArrayList<>(getParameterNames().size());
		Set<String> missingParameterNames = new LinkedHashSet<>();

		for (int i = 0; i < getParameterNames().size(); ++i) {
			String parameterName = getParameterNames().get(i);
			jdbcSql.append(this.sqlFragments.get(i)).append('?');

			if (bindings.containsKey(parameterName))
				parameters.add(bindings.get(parameterName));
			else
				missingParameterNames.add(parameterName);
		}

		jdbcSql.append(this.sqlFragments.get(this.sqlFragments.size() - 1));

		if (missingParameterNames.size() > 0)
			throw new IllegalArgumentException(format("Missing required named parameters %s for SQL: %s", missingParameterNames, getSql()));

		return new JdbcSql(jdbcSql.toString(), parameters);
	}

	@NonNull
	String getSql() {
		return this.sql;
	}

	@NonNull
	List<String> getParameterNames() {
		return this.parameterNames;
	}

	@NonNull
	Set<String> getDistinctParameterNames() {
		return this.distinctParameterNames;
	}

	private static int endOfQuoted(@NonNull String sql,
																 int openingIndex,
																 char quote) {
		int i = openingIndex + 1;

		while (i < sql.length()) {
			if (sql.charAt(i) == quote) {
				if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
					i += 2;
					continue;
				}

				return i + 1;
			}

			++i;
		}

		// Unterminated; let the driver report it
		return sql.length();
	}

	private static boolean isParameterNameStart(char c) {
		return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isParameterNamePart(char c) {
		return isParameterNameStart(c) || (c >= '0' && c <= '9');
	}

	/**
	 * SQL ready for {@link java.sql.Connection#prepareStatement(String)}.
	 */
	static final class JdbcSql {
		@NonNull
		private final String sql;
		@NonNull
		private final List<@Nullable Object> parameters;

		private JdbcSql(@NonNull String sql,
										@NonNull List<@Nullable Object> parameters) {
			this.sql = requireNonNull(sql);
			this.parameters = requireNonNull(parameters);
		}

		@NonNull
		String getSql() {
			return this.sql;
		}

		@NonNull
		List<@Nullable Object> getParameters() {
			return this.parameters;
		}
	}
}
