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

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * Callback for {@link Database#readDatabaseMetaData(DatabaseMetaDataReader)}.
 * <p>
 * The {@link Connection} behind the metadata is also handed over, since some metadata calls
 * (e.g. {@link DatabaseMetaData#getColumns(String, String, String, String)}) want the connection's current catalog
 * and schema. It is closed as soon as the reader returns.
 *
 * @param <T> the type of value the reader produces
 * @since 1.0.0
 */
@FunctionalInterface
public interface DatabaseMetaDataReader<T> {
	/**
	 * Examines JDBC metadata for the database.
	 *
	 * @param connection       the borrowed connection; do not close it
	 * @param databaseMetaData JDBC metadata for this database
	 * @return whatever the reader computed
	 * @throws SQLException if an error occurs while examining metadata
	 */
	T read(@NonNull Connection connection,
				 @NonNull DatabaseMetaData databaseMetaData) throws SQLException;
}
