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

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Contract for binding parameters to SQL prepared statements.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 * Or, implement your own: <pre>{@code  PreparedStatementBinder myImpl = (statementContext, preparedStatement, parameterIndex, parameter) -> {
 *   preparedStatement.setObject(parameterIndex, parameter);
 * };}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface PreparedStatementBinder {
	/**
	 * Binds a single parameter to a SQL prepared statement.
	 * <p>
	 * This function is only invoked when {@code parameter} is non-null; {@code null}s are bound by {@link Database}.
	 *
	 * @param statementContext  current SQL context
	 * @param preparedStatement the prepared statement to bind to
	 * @param parameterIndex    the 1-based index of the parameter we are binding
	 * @param parameter         the parameter we are binding to the {@link PreparedStatement}
	 * @throws SQLException if an error occurs during binding
	 */
	void bindParameter(@NonNull StatementContext statementContext,
										 @NonNull PreparedStatement preparedStatement,
										 @NonNull Integer parameterIndex,
										 @NonNull Object parameter) throws SQLException;

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static PreparedStatementBinder withDefaultConfiguration() {
		return new DefaultPreparedStatementBinder();
	}
}
