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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;

import static com.nanoorm.TestDatabases.createInMemoryDataSource;
import static com.nanoorm.TestDatabases.execute;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class DatabaseTests {
	@Test
	public void testRowsAreKeyedByNormalizedColumnLabel() {
		Database db = Database.withDataSource(createInMemoryDataSource("testRowsAreKeyedByNormalizedColumnLabel")).build();

		Assertions.assertEquals(IdentifierCase.FOLD_UPPER_CASE, db.getIdentifierCase(), "HSQLDB stores upper-case identifiers");

		execute(db, "CREATE TABLE employee (employee_id INTEGER, name VARCHAR(255))");
		execute(db, "INSERT INTO employee VALUES (1, 'Employee One')");
		execute(db, "INSERT INTO employee VALUES (2, 'Employee Two')");

		List<Map<String, Object>> rows = db.query("SELECT * FROM employee ORDER BY employee_id").fetchList();

		Assertions.assertEquals(2, rows.size(), "Wrong number of employees");
		Assertions.assertEquals(List.of("employee_id", "name"), List.copyOf(rows.get(0).keySet()), "Labels should be lower-cased, in column order");
		Assertions.assertEquals("Employee One", rows.get(0).get("name"));
	}

	@Test
	public void testAsReportedKeepsDriverLabels() {
		Database db = Database.withDataSource(createInMemoryDataSource("testAsReportedKeepsDriverLabels"))
				.identifierCase(IdentifierCase.AS_REPORTED)
				.build();

		Map<String, Object> row = db.query("SELECT x AS total FROM (VALUES (0)) AS t(x)").fetchObject().orElseThrow();

		Assertions.assertTrue(row.containsKey("TOTAL"), "Expected the label exactly as HSQLDB reports it");
	}

	@Test
	public void testFetchObject() {
		Database db = Database.withDataSource(createInMemoryDataSource("testFetchObject")).build();

		execute(db, "CREATE TABLE t (id INTEGER, label VARCHAR(32))");
		execute(db, "INSERT INTO t VALUES (1, 'one')");
		execute(db, "INSERT INTO t VALUES (2, 'two')");

		Optional<Map<String, Object>> row = db.query("SELECT * FROM t WHERE id = :id").bind("id", 2).fetchObject();
		Assertions.assertEquals("two", row.orElseThrow().get("label"));

		Assertions.assertTrue(db.query("SELECT * FROM t WHERE id = :id").bind("id", 3).fetchObject().isEmpty(),
				"No row should be an empty result, not an error");

		Assertions.assertThrows(DatabaseException.class, () -> db.query("SELECT * FROM t").fetchObject(),
				"More than one row should be rejected");
	}

	@Test
	public void testLaterDuplicateLabelWins() {
		Database db = Database.withDataSource(createInMemoryDataSource("testLaterDuplicateLabelWins")).build();

		Map<String, Object> row = db.query("SELECT 1 AS x, 2 AS x FROM (VALUES (0)) AS t(y)").fetchObject().orElseThrow();

		Assertions.assertEquals(1, row.size());
		Assertions.assertEquals(2, ((Number) row.get("x")).intValue());
	}

	@Test
	public void testQueryRejectsPositionalParameters() {
		Database db = Database.withDataSource(createInMemoryDataSource("testQueryRejectsPositionalParameters")).build();

		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
				() -> db.query("SELECT * FROM employee WHERE employee_id=?"));
		Assertions.assertTrue(e.getMessage().contains("Positional"),
				"Expected a helpful error message mentioning positional parameters");
	}

	@Test
	public void testQueryAllowsQuestionMarkInStringLiteral() {
		Database db = Database.withDataSource(createInMemoryDataSource("testQueryAllowsQuestionMarkInStringLiteral")).build();

		Map<String, Object> row = db.query("SELECT '?:notParam' AS q FROM (VALUES (0)) AS t(x)").fetchObject().orElseThrow();
		Assertions.assertEquals("?:notParam", row.get("q"));
	}

	@Test
	public void testQueryBindRejectsUnknownParameterName() {
		Database db = Database.withDataSource(createInMemoryDataSource("testQueryBindRejectsUnknownParameterName")).build();

		Assertions.assertThrows(IllegalArgumentException.class, () ->
				db.query("SELECT :id FROM (VALUES (0)) AS t(x)")
						.bind("nope", 1));
	}

	@Test
	public void testQueryRejectsUnboundParameterBeforeExecuting() {
		TestDatabases.RecordingStatementLogger statementLogger = new TestDatabases.RecordingStatementLogger();
		Database db = Database.withDataSource(createInMemoryDataSource("testQueryRejectsUnboundParameterBeforeExecuting"))
				.statementLogger(statementLogger)
				.build();

		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () ->
				db.query("SELECT * FROM t WHERE a = :a AND b = :b").bind("a", 1).fetchList());

		Assertions.assertTrue(e.getMessage().contains("[b]"), "Expected the missing parameter to be named");
		Assertions.assertEquals(0, statementLogger.count(), "Nothing should have reached the database");
	}

	@Test
	public void testNamedParameterParsing() {
		NamedParameterSql parsed = NamedParameterSql.parse("SELECT a::text, ':skipped', \"col:x\" -- :comment\n"
				+ "FROM t /* :block */ WHERE b = :b AND c = :c_2 OR b = :b");

		Assertions.assertEquals(List.of("b", "c_2", "b"), parsed.getParameterNames());

		NamedParameterSql.JdbcSql jdbcSql = parsed.toJdbcSql(Map.of("b", 1, "c_2", "two"));

		Assertions.assertEquals("SELECT a::text, ':skipped', \"col:x\" -- :comment\n"
				+ "FROM t /* :block */ WHERE b = ? AND c = ? OR b = ?", jdbcSql.getSql());
		Assertions.assertEquals(Arrays.asList(1, "two", 1), jdbcSql.getParameters());
	}

	@Test
	public void testNullParametersAreBound() {
		Database db = Database.withDataSource(createInMemoryDataSource("testNullParametersAreBound")).build();

		execute(db, "CREATE TABLE t (id INTEGER, note VARCHAR(32))");

		db.query("INSERT INTO t (id, note) VALUES (:id, :note)")
				.bind("id", 1)
				.bind("note", null)
				.execute();

		Map<String, Object> row = db.query("SELECT * FROM t").fetchObject().orElseThrow();

		Assertions.assertTrue(row.containsKey("note"));
		Assertions.assertNull(row.get("note"));
	}

	@Test
	public void testExecuteReturnsRowCount() {
		Database db = Database.withDataSource(createInMemoryDataSource("testExecuteReturnsRowCount")).build();

		execute(db, "CREATE TABLE t (id INTEGER, status VARCHAR(32))");
		execute(db, "INSERT INTO t VALUES (1, 'a')");
		execute(db, "INSERT INTO t VALUES (2, 'a')");
		execute(db, "INSERT INTO t VALUES (3, 'b')");

		Long updated = db.query("UPDATE t SET status = :to WHERE status = :from")
				.bind("to", "c")
				.bind("from", "a")
				.execute();

		Assertions.assertEquals(2L, updated);
	}

	@Test
	public void testExecuteForGeneratedKey() {
		Database db = Database.withDataSource(createInMemoryDataSource("testExecuteForGeneratedKey")).build();

		execute(db, "CREATE TABLE t (id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, label VARCHAR(32))");

		Object first = db.query("INSERT INTO t (label) VALUES (:label)").bind("label", "one").executeForGeneratedKey().orElseThrow();
		Object second = db.query("INSERT INTO t (label) VALUES (:label)").bind("label", "two").executeForGeneratedKey().orElseThrow();

		Assertions.assertNotEquals(first, second, "Each insert should generate its own key");
		Assertions.assertEquals("two", db.query("SELECT label FROM t WHERE id = :id").bind("id", second).fetchObject().orElseThrow().get("label"));
	}

	@Test
	public void testExecuteForGeneratedKeyByColumnName() {
		Database db = Database.withDataSource(createInMemoryDataSource("testExecuteForGeneratedKeyByColumnName")).build();

		execute(db, "CREATE TABLE late_keys (label VARCHAR(255), id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY)");

		Object id = db.query("INSERT INTO late_keys (label) VALUES (:label)").bind("label", "one").executeForGeneratedKey("id").orElseThrow();

		Assertions.assertTrue(id instanceof Integer, "Key column value expected, not the label");
		Assertions.assertEquals("one", db.query("SELECT label FROM late_keys WHERE id = :id").bind("id", id).fetchObject().orElseThrow().get("label"));
	}

	@Test
	public void testGeneratedKeyIsPickedByLabel() throws SQLException {
		DataSource dataSource = createInMemoryDataSource("testGeneratedKeyIsPickedByLabel");

		// Shaped like a driver that reports the whole new row, key last
		try (Connection connection = dataSource.getConnection();
				 Statement statement = connection.createStatement();
				 ResultSet resultSet = statement.executeQuery("SELECT 'Jane' AS name, 7 AS id FROM (VALUES (0)) AS t(x)")) {
			Assertions.assertTrue(resultSet.next());

			Assertions.assertEquals(Optional.of(7), Database.readGeneratedKey(resultSet, IdentifierCase.FOLD_UPPER_CASE, "id"));
			Assertions.assertEquals(Optional.of(7), Database.readGeneratedKey(resultSet, IdentifierCase.AS_REPORTED, "id"));
			Assertions.assertEquals(Optional.of("Jane"), Database.readGeneratedKey(resultSet, IdentifierCase.FOLD_UPPER_CASE, null),
					"Without a key name the first column is the key");
			Assertions.assertEquals(Optional.empty(), Database.readGeneratedKey(resultSet, IdentifierCase.FOLD_UPPER_CASE, "uuid"));
		}

		try (Connection connection = dataSource.getConnection();
				 Statement statement = connection.createStatement();
				 ResultSet resultSet = statement.executeQuery("SELECT 11 AS rowid_value FROM (VALUES (0)) AS t(x)")) {
			Assertions.assertTrue(resultSet.next());
			Assertions.assertEquals(Optional.of(11), Database.readGeneratedKey(resultSet, IdentifierCase.FOLD_UPPER_CASE, "id"),
					"A lone generated column is the key whatever its label");
		}
	}

	@Test
	public void testStatementLogs() {
		TestDatabases.RecordingStatementLogger statementLogger = new TestDatabases.RecordingStatementLogger();
		Database db = Database.withDataSource(createInMemoryDataSource("testStatementLogs"))
				.statementLogger(statementLogger)
				.build();

		execute(db, "CREATE TABLE t (id INTEGER)");
		execute(db, "INSERT INTO t VALUES (1)");
		db.query("SELECT * FROM t WHERE id = :id").id("lookup").bind("id", 1).fetchList();

		StatementLog statementLog = statementLogger.statementLogs().get(2);

		Assertions.assertEquals("lookup", statementLog.getStatementContext().getId());
		Assertions.assertEquals("SELECT * FROM t WHERE id = ?", statementLog.getStatementContext().getJdbcSql());
		Assertions.assertEquals(List.of(1), statementLog.getStatementContext().getParameters());
		Assertions.assertEquals(Optional.of(1L), statementLog.getRowCount());
		Assertions.assertTrue(statementLog.getException().isEmpty());

		Assertions.assertThrows(DatabaseException.class, () -> db.query("SELECT * FROM missing_table").fetchList());
		Assertions.assertTrue(statementLogger.statementLogs().get(3).getException().isPresent(), "Failures should be logged too");
	}

	@Test
	public void testDefaultStatementLoggerFormat() {
		Database db = Database.withDataSource(createInMemoryDataSource("testDefaultStatementLoggerFormat"))
				.identifierCase(IdentifierCase.AS_REPORTED)
				.build();

		StatementContext statementContext = StatementContext.with("id-1", "UPDATE users SET name = :name WHERE id = :id", db)
				.jdbcSql("UPDATE users SET name = ? WHERE id = ?")
				.parameters(Arrays.asList("Jane", 7))
				.build();

		String formatted = new DefaultStatementLogger("com.nanoorm.test", Level.FINE).formatStatementLog(
				StatementLog.withStatementContext(statementContext).rowCount(1L).build());

		Assertions.assertTrue(formatted.startsWith("UPDATE users SET name = :name WHERE id = :id"), formatted);
		Assertions.assertTrue(formatted.contains("Parameters: 'Jane', 7"), formatted);
		Assertions.assertTrue(formatted.contains("1 row[s]"), formatted);
	}

	@Test
	public void testStatementLoggerExceptionSuppressedWhenOperationFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		StatementLogger statementLogger = (statementLog) -> {
			throw loggerFailure;
		};

		Database db = Database.withDataSource(createInMemoryDataSource("testStatementLoggerExceptionSuppressedWhenOperationFails"))
				.statementLogger(statementLogger)
				.build();

		DatabaseException ex = Assertions.assertThrows(DatabaseException.class,
				() -> db.query("SELECT * FROM missing_table").fetchList());

		Assertions.assertTrue(
				Arrays.stream(ex.getSuppressed()).anyMatch(suppressed -> "logger failed".equals(suppressed.getMessage())),
				"Expected statement logger failure to be suppressed");
		Assertions.assertTrue(ex.getSqlState().isPresent(), "Expected the driver's SQL state to be exposed");
	}

	@Test
	public void testReadDatabaseMetaData() {
		Database db = Database.withDataSource(createInMemoryDataSource("testReadDatabaseMetaData")).build();

		String productName = db.readDatabaseMetaData((connection, databaseMetaData) -> databaseMetaData.getDatabaseProductName());

		Assertions.assertTrue(productName.contains("HSQL"), productName);
	}

	@Test
	public void testIdentifierCaseNormalization() {
		Assertions.assertEquals("name", IdentifierCase.FOLD_UPPER_CASE.normalize("NAME"));
		Assertions.assertEquals("j0_name", IdentifierCase.FOLD_UPPER_CASE.normalize("J0_NAME"));
		Assertions.assertEquals("firstName", IdentifierCase.FOLD_UPPER_CASE.normalize("firstName"), "Quoted mixed-case identifiers are untouched");
		Assertions.assertEquals("NAME", IdentifierCase.AS_REPORTED.normalize("NAME"));
	}
}
