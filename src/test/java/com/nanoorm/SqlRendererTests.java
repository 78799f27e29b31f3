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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statement rendering, without a database.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class SqlRendererTests {
	private final SqlRenderer users = SqlRenderer.forSchema(Schema.of("users", List.of("id", "name", "email", "status")), "id");

	@Test
	public void testSelectById() {
		ParameterizedSql sql = users.selectById(7);

		Assertions.assertEquals("SELECT * FROM users WHERE id = :id LIMIT 1", sql.getSql());
		Assertions.assertEquals(Map.of("id", 7), sql.getParameters());
	}

	@Test
	public void testSelectBy() {
		Assertions.assertEquals("SELECT * FROM users WHERE status = :status", users.selectBy("status", "inactive", null).getSql());
		Assertions.assertEquals("SELECT * FROM users WHERE status = :status LIMIT 3", users.selectBy("status", "inactive", 3).getSql());
		Assertions.assertEquals(Map.of("status", "inactive"), users.selectBy("status", "inactive", 3).getParameters());
	}

	@Test
	public void testSelectListsKnownFieldsQualifiedByTable() {
		Assertions.assertEquals("SELECT users.id, users.name, users.email, users.status FROM users",
				users.select(List.of(), Map.of(), null, null).getSql());
	}

	@Test
	public void testSelectWithConditionsOrderAndLimit() {
		Map<String, Object> conditions = new LinkedHashMap<>();
		conditions.put("status", "active");
		conditions.put("name", "Jane");

		ParameterizedSql sql = users.select(List.of(), conditions, "name   desc,id", 5);

		Assertions.assertEquals("SELECT users.id, users.name, users.email, users.status FROM users "
				+ "WHERE status = :status AND name = :name ORDER BY name DESC, id LIMIT 5", sql.getSql());
		Assertions.assertEquals(List.of("status", "name"), List.copyOf(sql.getParameters().keySet()), "Conditions keep caller order");
	}

	@Test
	public void testBlankOrderByIsIgnored() {
		Assertions.assertEquals("SELECT users.id, users.name, users.email, users.status FROM users",
				users.select(List.of(), Map.of(), "  ", null).getSql());
	}

	@Test
	public void testQualifiedConditionFieldBindsUnderscoredName() {
		ParameterizedSql sql = users.select(List.of(), Map.of("users.status", "active"), null, null);

		Assertions.assertTrue(sql.getSql().endsWith("WHERE users.status = :users_status"), sql.getSql());
		Assertions.assertEquals(Map.of("users_status", "active"), sql.getParameters());
	}

	@Test
	public void testConditionsSharingParameterNameAreRejected() {
		Map<String, Object> conditions = new LinkedHashMap<>();
		conditions.put("users.status", "a");
		conditions.put("users_status", "b");

		Assertions.assertThrows(IllegalArgumentException.class, () -> users.select(List.of(), conditions, null, null));
	}

	@Test
	public void testOrderByInjectionIsRejected() {
		for (String orderBy : List.of("name; DROP TABLE users", "id DESC, (SELECT 1)", "name DESC NULLS FIRST", "1", "name,", "name -- comment"))
			Assertions.assertThrows(IllegalArgumentException.class, () -> users.select(List.of(), Map.of(), orderBy, null),
					"Expected rejection of ORDER BY '" + orderBy + "'");
	}

	@Test
	public void testNegativeLimitIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> users.select(List.of(), Map.of(), null, -1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> users.selectBy("status", "x", -1));
		Assertions.assertEquals("SELECT * FROM users WHERE status = :status LIMIT 0", users.selectBy("status", "x", 0).getSql());
	}

	@Test
	public void testInvalidIdentifiersAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> users.select(List.of(), Map.of("name = name OR 1", 1), null, null));
		Assertions.assertThrows(IllegalArgumentException.class, () -> users.selectBy("name;", "x", null));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> SqlRenderer.forSchema(Schema.of("users; DROP TABLE users", List.of("id")), "id"));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> SqlRenderer.forSchema(Schema.of("users", List.of("id")), "id name"));
	}

	@Test
	public void testInsertOmitsAbsentPrimaryKey() {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("id", null);
		values.put("name", "Jane");
		values.put("email", "jane@x.com");

		ParameterizedSql sql = users.insert(values);

		Assertions.assertEquals("INSERT INTO users (name, email) VALUES (:name, :email)", sql.getSql());
		Assertions.assertEquals(Map.of("name", "Jane", "email", "jane@x.com"), sql.getParameters());
	}

	@Test
	public void testInsertNeverSendsPrimaryKey() {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("id", 999);
		values.put("name", "Jane");

		ParameterizedSql sql = users.insert(values);

		Assertions.assertEquals("INSERT INTO users (name) VALUES (:name)", sql.getSql());
		Assertions.assertEquals(Map.of("name", "Jane"), sql.getParameters());
		Assertions.assertEquals("INSERT INTO users DEFAULT VALUES", users.insert(Map.of("id", 999)).getSql());
	}

	@Test
	public void testInsertGivesCollidingColumnsDistinctParameters() {
		SqlRenderer renderer = SqlRenderer.forSchema(Schema.of("t", List.of("id", "a$b", "a_b")), "id");

		Map<String, Object> values = new LinkedHashMap<>();
		values.put("a$b", 1);
		values.put("a_b", 2);

		ParameterizedSql sql = renderer.insert(values);

		Assertions.assertEquals("INSERT INTO t (a$b, a_b) VALUES (:a_b, :a_b_2)", sql.getSql());
		Assertions.assertEquals(Map.of("a_b", 1, "a_b_2", 2), sql.getParameters());
	}

	@Test
	public void testUpdateGivesCollidingColumnsDistinctParameters() {
		SqlRenderer renderer = SqlRenderer.forSchema(Schema.of("t", List.of("a_b", "a$b", "c")), "a_b");

		Map<String, Object> values = new LinkedHashMap<>();
		values.put("a_b", 7);
		values.put("a$b", 1);
		values.put("c", 2);

		ParameterizedSql sql = renderer.update(values).orElseThrow();

		Assertions.assertEquals("UPDATE t SET a$b = :a_b_2, c = :c WHERE a_b = :a_b", sql.getSql());
		Assertions.assertEquals(Map.of("a_b", 7, "a_b_2", 1, "c", 2), sql.getParameters(),
				"The key keeps its own value when a column maps to the same name");
	}

	@Test
	public void testInsertWithNothingUsesDefaultValues() {
		ParameterizedSql sql = users.insert(Map.of());

		Assertions.assertEquals("INSERT INTO users DEFAULT VALUES", sql.getSql());
		Assertions.assertTrue(sql.getParameters().isEmpty());
	}

	@Test
	public void testInsertBindsNullValues() {
		Map<String, Object> values = new HashMap<>();
		values.put("email", null);

		ParameterizedSql sql = users.insert(values);

		Assertions.assertEquals("INSERT INTO users (email) VALUES (:email)", sql.getSql());
		Assertions.assertTrue(sql.getParameters().containsKey("email"));
	}

	@Test
	public void testUpdate() {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("id", 3);
		values.put("name", "Jane");
		values.put("email", "jane@y.com");

		ParameterizedSql sql = users.update(values).orElseThrow();

		Assertions.assertEquals("UPDATE users SET name = :name, email = :email WHERE id = :id", sql.getSql());
		Assertions.assertEquals(Map.of("name", "Jane", "email", "jane@y.com", "id", 3), sql.getParameters());
	}

	@Test
	public void testUpdateSkipsValuesOutsideTheTable() {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("id", 3);
		values.put("name", "Jane");
		values.put("user_count", 12L);

		ParameterizedSql sql = users.update(values).orElseThrow();

		Assertions.assertEquals("UPDATE users SET name = :name WHERE id = :id", sql.getSql());
		Assertions.assertEquals(Map.of("name", "Jane", "id", 3), sql.getParameters());
		Assertions.assertEquals(Optional.empty(), users.update(Map.of("id", 3, "user_count", 12L)));
	}

	@Test
	public void testUpdateWithOnlyPrimaryKeyRendersNothing() {
		Assertions.assertEquals(Optional.empty(), users.update(Map.of("id", 3)));
	}

	@Test
	public void testUpdateRequiresPrimaryKey() {
		MissingPrimaryKeyException e = Assertions.assertThrows(MissingPrimaryKeyException.class, () -> users.update(Map.of("name", "Jane")));

		Assertions.assertEquals("users", e.getTable());
		Assertions.assertEquals("id", e.getPrimaryKeyName());
	}

	@Test
	public void testDeleteById() {
		ParameterizedSql sql = users.deleteById(3);

		Assertions.assertEquals("DELETE FROM users WHERE id = :id", sql.getSql());
		Assertions.assertEquals(Map.of("id", 3), sql.getParameters());
		Assertions.assertThrows(MissingPrimaryKeyException.class, () -> users.deleteById(null));
	}

	@Test
	public void testDeleteWhere() {
		Assertions.assertEquals("DELETE FROM users WHERE status = :status", users.deleteWhere(Map.of("status", "inactive")).getSql());
		Assertions.assertThrows(EmptyConditionException.class, () -> users.deleteWhere(Map.of()));
	}

	@Test
	public void testCustomPrimaryKey() {
		SqlRenderer codes = SqlRenderer.forSchema(Schema.of("app.codes", List.of("code", "label")), "code");

		Assertions.assertEquals("SELECT * FROM app.codes WHERE code = :code LIMIT 1", codes.selectById("A1").getSql());
		Assertions.assertEquals("UPDATE app.codes SET label = :label WHERE code = :code",
				codes.update(Map.of("code", "A1", "label", "x")).orElseThrow().getSql());
	}
}
