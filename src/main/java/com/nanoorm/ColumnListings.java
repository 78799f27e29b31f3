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
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Reads column names out of the rows returned by a dialect's table-description statement.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class ColumnListings {
	private ColumnListings() {
		// Non-instantiable
	}

	/**
	 * Collects the value under {@code columnLabel} from each row, in row order.
	 * <p>
	 * The label is matched ignoring case, since drivers differ in how they report it ({@code Field}, {@code FIELD}).
	 * Rows without a value for it are skipped. Values are normalized by {@code identifierCase}.
	 *
	 * @param identifierCase how the database reports identifiers
	 * @param rows           e.g. the result of {@code DESCRIBE users}
	 * @param columnLabel    the label holding the column name, e.g. {@code Field} or {@code name}
	 * @return the column names
	 */
	@NonNull
	static List<String> columnNames(@NonNull IdentifierCase identifierCase,
																	@NonNull List<Map<String, Object>> rows,
																	@NonNull String columnLabel) {
		requireNonNull(identifierCase);
		requireNonNull(rows);
		requireNonNull(columnLabel);

		List<String> columnNames = new ArrayList<>(rows.size());

		for (Map<String, Object> row : rows) {
			for (Map.Entry<String, Object> entry : row.entrySet()) {
				if (entry.getKey().equalsIgnoreCase(columnLabel) && entry.getValue() != null) {
					columnNames.add(identifierCase.normalize(entry.getValue().toString()));
					break;
				}
			}
		}

		return columnNames;
	}
}
