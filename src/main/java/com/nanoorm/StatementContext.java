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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that represents one SQL statement as it is about to be executed.
 * <p>
 * {@link #getSql()} is the statement as written, with {@code :name} placeholders; {@link #getJdbcSql()} is the
 * same statement rewritten with JDBC {@code ?} placeholders, and {@link #getParameters()} are the values bound to
 * them, in order.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class StatementContext {
	@NonNull
	private final Object id;
	@NonNull
	private final String sql;
	@NonNull
	private final String jdbcSql;
	@NonNull
	private final List<Object> parameters;
	@NonNull
	private final IdentifierCase identifierCase;

	protected StatementContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.id = builder.id;
		this.sql = builder.sql;
		this.jdbcSql = builder.jdbcSql == null ? builder.sql : builder.jdbcSql;
		this.parameters = builder.parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.identifierCase = builder.identifierCase;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getSql(), getJdbcSql(), getParameters(), getIdentifierCase());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementContext))
			return false;

		StatementContext statementContext = (StatementContext) object;

		return Objects.equals(statementContext.getId(), getId())
				&& Objects.equals(statementContext.getSql(), getSql())
				&& Objects.equals(statementContext.getJdbcSql(), getJdbcSql())
				&& Objects.equals(statementContext.getParameters(), getParameters())
				&& Objects.equals(statementContext.getIdentifierCase(), getIdentifierCase());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(4);

		components.add(format("id=%s", getId()));
		// Strip out newlines for more compact SQL representation
		components.add(format("sql=%s", getSql().replaceAll("\n+", " ").trim()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		components.add(format("identifierCase=%s", getIdentifierCase().name()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public Object getId() {
		return this.id;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public String getJdbcSql() {
		return this.jdbcSql;
	}

	@NonNull
	public List<Object> getParameters() {
		return this.parameters;
	}

	@NonNull
	public IdentifierCase getIdentifierCase() {
		return this.identifierCase;
	}

	@NonNull
	public static Builder with(@NonNull Object id,
														 @NonNull String sql,
														 @NonNull Database database) {
		requireNonNull(id);
		requireNonNull(sql);
		requireNonNull(database);

		return new Builder(id, sql, database);
	}

	/**
	 * Builder used to construct instances of {@link StatementContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Object id;
		@NonNull
		private final String sql;
		@NonNull
		private final IdentifierCase identifierCase;
		@Nullable
		private String jdbcSql;
		@Nullable
		private List<Object> parameters;

		private Builder(@NonNull Object id,
										@NonNull String sql,
										@NonNull Database database) {
			requireNonNull(id);
			requireNonNull(sql);
			requireNonNull(database);

			this.id = id;
			this.sql = sql;
			this.identifierCase = database.getIdentifierCase();
		}

		@NonNull
		public Builder jdbcSql(@Nullable String jdbcSql) {
			this.jdbcSql = jdbcSql;
			return this;
		}

		@NonNull
		public Builder parameters(@Nullable List<Object> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public StatementContext build() {
			return new StatementContext(this);
		}
	}
}
