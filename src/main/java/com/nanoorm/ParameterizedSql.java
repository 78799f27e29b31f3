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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL text with {@code :name} placeholders, paired with the values to bind to them.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ParameterizedSql {
	@NonNull
	private final String sql;
	@NonNull
	private final Map<String, Object> parameters;

	ParameterizedSql(@NonNull String sql,
									 @NonNull Map<@NonNull String, @Nullable Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		this.sql = sql;
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
	}

	/**
	 * Prepares this statement against {@code database}, with every parameter bound.
	 *
	 * @param database the database to run against
	 * @return the ready-to-execute query
	 */
	@NonNull
	public Query toQuery(@NonNull Database database) {
		requireNonNull(database);
		return database.query(getSql()).bindAll(getParameters());
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * @return parameter values keyed by name (without the leading colon), in placeholder order
	 */
	@NonNull
	public Map<@NonNull String, @Nullable Object> getParameters() {
		return this.parameters;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ParameterizedSql))
			return false;

		ParameterizedSql parameterizedSql = (ParameterizedSql) object;

		return Objects.equals(parameterizedSql.getSql(), getSql())
				&& Objects.equals(parameterizedSql.getParameters(), getParameters());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameters());
	}

	@Override
	public String toString() {
		return format("%s{sql=%s, parameters=%s}", getClass().getSimpleName(), getSql(), getParameters());
	}
}
