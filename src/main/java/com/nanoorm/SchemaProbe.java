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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One strategy for discovering the ordered column names of a table.
 * <p>
 * A probe fails by throwing {@link DatabaseException} or by returning an empty list; {@link SchemaIntrospector}
 * then moves on to its next probe.
 * <p>
 * Three database-backed strategies are provided, plus {@link #fixed(String...)} for callers that already know
 * the columns:
 * <ul>
 *   <li>{@link #describeTable()}: MySQL/MariaDB {@code DESCRIBE <table>}</li>
 *   <li>{@link #pragmaTableInfo()}: SQLite {@code PRAGMA table_info(<table>)}</li>
 *   <li>{@link #databaseMetaData()}: JDBC {@link DatabaseMetaData#getColumns(String, String, String, String)}, for
 *   everything else</li>
 * </ul>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SchemaProbe {
	/**
	 * Discovers the column names of {@code table}.
	 *
	 * @param database the database to examine
	 * @param table    the (already validated) table name
	 * @return column names in table order, or an empty list if this probe found nothing
	 * @throws DatabaseException if this probe's statement failed
	 */
	@NonNull
	List<@NonNull String> describe(@NonNull Database database,
																 @NonNull String table);

	/**
	 * MySQL-style {@code DESCRIBE <table>}, reading the {@code Field} column of each row.
	 *
	 * @return the probe
	 */
	@NonNull
	static SchemaProbe describeTable() {
		return (database, table) -> ColumnListings.columnNames(database.getIdentifierCase(),
				database.query(format("DESCRIBE %s", Identifiers.requireQualifiedIdentifier(table, "table"))).fetchList(), "Field");
	}

	/**
	 * SQLite-style {@code PRAGMA table_info(<table>)}, reading the {@code name} column of each row.
	 *
	 * @return the probe
	 */
	@NonNull
	static SchemaProbe pragmaTableInfo() {
		return (database, table) -> ColumnListings.columnNames(database.getIdentifierCase(),
				database.query(format("PRAGMA table_info(%s)", Identifiers.requireQualifiedIdentifier(table, "table"))).fetchList(), "name");
	}

	/**
	 * Portable JDBC metadata lookup.
	 * <p>
	 * The table name is matched in the case the database stores unquoted identifiers in. An unqualified table is
	 * looked up in the connection's current schema first, then in any schema.
	 *
	 * @return the probe
	 */
	@NonNull
	static SchemaProbe databaseMetaData() {
		return (database, table) -> {
			Identifiers.requireQualifiedIdentifier(table, "table");

			List<String> columnNames = database.readDatabaseMetaData((connection, databaseMetaData) -> {
				int separatorIndex = table.lastIndexOf('.');
				String tableName = storedCase(databaseMetaData, separatorIndex == -1 ? table : table.substring(separatorIndex + 1));
				List<String> schemaNames = new ArrayList<>(2);

				if (separatorIndex == -1) {
					String currentSchema = currentSchema(connection);

					if (currentSchema != null)
						schemaNames.add(currentSchema);

					schemaNames.add(null);
				} else {
					schemaNames.add(storedCase(databaseMetaData, table.substring(0, separatorIndex)));
				}

				for (String schemaName : schemaNames) {
					List<String> found = readColumns(databaseMetaData, schemaName, tableName);

					if (found.size() > 0)
						return found;
				}

				return List.of();
			});

			List<String> normalizedColumnNames = new ArrayList<>(columnNames.size());

			for (String columnName : columnNames)
				normalizedColumnNames.add(database.getIdentifierCase().normalize(columnName));

			return normalizedColumnNames;
		};
	}

	/**
	 * A probe that always reports the given columns without touching the database.
	 *
	 * @param columnNames the column names to report
	 * @return the probe
	 */
	@NonNull
	static SchemaProbe fixed(@NonNull String... columnNames) {
		requireNonNull(columnNames);

		List<String> fixedColumnNames = List.copyOf(Arrays.asList(columnNames));
		return (database, table) -> fixedColumnNames;
	}

	@NonNull
	private static String storedCase(@NonNull DatabaseMetaData databaseMetaData,
																	 @NonNull String identifier) throws SQLException {
		if (databaseMetaData.storesUpperCaseIdentifiers())
			return identifier.toUpperCase(Locale.ENGLISH);

		if (databaseMetaData.storesLowerCaseIdentifiers())
			return identifier.toLowerCase(Locale.ENGLISH);

		return identifier;
	}

	private static String currentSchema(@NonNull Connection connection) throws SQLException {
		try {
			return connection.getSchema();
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			// Pre-JDBC 4.1 driver; fall through to an unrestricted lookup
			return null;
		}
	}

	@NonNull
	private static List<String> readColumns(@NonNull DatabaseMetaData databaseMetaData,
																					String schemaName,
																					@NonNull String tableName) throws SQLException {
		String searchStringEscape = databaseMetaData.getSearchStringEscape();
		Map<Integer, String> columnNamesByPosition = new TreeMap<>();

		try (ResultSet resultSet = databaseMetaData.getColumns(null,
				schemaName == null ? null : escapePattern(schemaName, searchStringEscape),
				escapePattern(tableName, searchStringEscape), "%")) {
			while (resultSet.next())
				columnNamesByPosition.putIfAbsent(resultSet.getInt("ORDINAL_POSITION"), resultSet.getString("COLUMN_NAME"));
		}

		Set<String> columnNames = new LinkedHashSet<>(columnNamesByPosition.values());
		return new ArrayList<>(columnNames);
	}

	@NonNull
	private static String escapePattern(@NonNull String name,
																			String searchStringEscape) {
		if (searchStringEscape == null || searchStringEscape.isEmpty())
			return name;

		return name.replace("_", searchStringEscape + "_").replace("%", searchStringEscape + "%");
	}
}
