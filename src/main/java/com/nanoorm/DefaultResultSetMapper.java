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
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link ResultSetMapper}.
 * <p>
 * Values are taken exactly as the driver returns them from {@link ResultSet#getObject(int)}; only column labels are
 * normalized, per {@link StatementContext#getIdentifierCase()}.
 * <p>
 * When two columns share a label (e.g. {@code SELECT a.*, b.*}), the later column wins.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultSetMapper implements ResultSetMapper {
	@NonNull
	@Override
	public Map<@NonNull String, @Nullable Object> map(@NonNull StatementContext statementContext,
																										@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(resultSet);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		int columnCount = resultSetMetaData.getColumnCount();
		Map<String, Object> row = new LinkedHashMap<>(Math.max(16, columnCount * 2));

		for (int i = 1; i <= columnCount; ++i) {
			String label = normalizeColumnLabel(statementContext, resultSetMetaData.getColumnLabel(i));

			// Keep the latest column's position as well as its value
			row.remove(label);
			row.put(label, resultSet.getObject(i));
		}

		return row;
	}

	@NonNull
	protected String normalizeColumnLabel(@NonNull StatementContext statementContext,
																				@NonNull String columnLabel) {
		requireNonNull(statementContext);
		requireNonNull(columnLabel);

		return statementContext.getIdentifierCase().normalize(columnLabel);
	}
}
