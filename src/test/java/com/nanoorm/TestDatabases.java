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

import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Shared fixtures: in-memory HSQLDB data sources, DDL execution, and a statement logger that records what ran.
 *
 * @since 1.0.0
 */
final class TestDatabases {
	private TestDatabases() {}

	@NonNull
	static DataSource createInMemoryDataSource(@NonNull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}

	@NonNull
	static Long execute(@NonNull Database database,
											@NonNull String sql) {
		requireNonNull(database);
		requireNonNull(sql);

		return database.query(sql).execute();
	}

	/**
	 * Creates {@code users}, {@code products} and {@code orders} tables.
	 */
	static void createShopSchema(@NonNull Database database) {
		requireNonNull(database);

		execute(database, "CREATE TABLE users (id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, name VARCHAR(255), email VARCHAR(255), status VARCHAR(32))");
		execute(database, "CREATE TABLE products (id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, title VARCHAR(255))");
		execute(database, "CREATE TABLE orders (id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, user_id INTEGER, product_id INTEGER, status VARCHAR(32))");
	}

	/**
	 * Keeps every {@link StatementLog} it receives.
	 */
	static final class RecordingStatementLogger implements StatementLogger {
		@NonNull
		private final List<StatementLog> statementLogs = new ArrayList<>();

		@Override
		public synchronized void log(@NonNull StatementLog statementLog) {
			requireNonNull(statementLog);
			this.statementLogs.add(statementLog);
		}

		synchronized int count() {
			return this.statementLogs.size();
		}

		synchronized void reset() {
			this.statementLogs.clear();
		}

		@NonNull
		synchronized List<String> sql() {
			List<String> sql = new ArrayList<>(this.statementLogs.size());

			for (StatementLog statementLog : this.statementLogs)
				sql.add(statementLog.getStatementContext().getSql());

			return sql;
		}

		@NonNull
		synchronized List<StatementLog> statementLogs() {
			return List.copyOf(this.statementLogs);
		}
	}
}
