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
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.nanoorm.TestDatabases.createInMemoryDataSource;
import static com.nanoorm.TestDatabases.execute;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class JoinQueryTests {
	@Test
	public void testJoinExpansion() {
		Record orders = fixedOrders("testJoinExpansion");

		JoinQuery joinQuery = orders
				.addJoin("users", "user_id", "id", "inner", List.of("name"))
				.addJoin("products", "product_id", "id", "LEFT", List.of("title"));

		Assertions.assertEquals("SELECT orders.id, orders.user_id, orders.product_id, orders.status, "
						+ "j0.name AS j0_name, j1.title AS j1_title FROM orders "
						+ "INNER JOIN users AS j0 ON orders.user_id = j0.id "
						+ "LEFT JOIN products AS j1 ON orders.product_id = j1.id",
				joinQuery.toSql(Map.of()).getSql());
	}

	@Test
	public void testWildcardJoinAndConditions() {
		Record orders = fixedOrders("testWildcardJoinAndConditions");

		ParameterizedSql sql = orders.addJoin("users", "user_id", "id", JoinType.RIGHT, JoinDescriptor.ALL_FIELDS)
				.toSql(Map.of("orders.status", "shipped"));

		Assertions.assertEquals("SELECT orders.id, orders.user_id, orders.product_id, orders.status, j0.* FROM orders "
				+ "RIGHT JOIN users AS j0 ON orders.user_id = j0.id WHERE orders.status = :orders_status", sql.getSql());
		Assertions.assertEquals(Map.of("orders_status", "shipped"), sql.getParameters());
	}

	@Test
	public void testDefaultJoinIsInnerOnAllFields() {
		JoinDescriptor join = fixedOrders("testDefaultJoinIsInnerOnAllFields").addJoin("users", "user_id", "id").getJoins().get(0);

		Assertions.assertEquals(JoinType.INNER, join.getJoinType());
		Assertions.assertTrue(join.selectsAllFields());
		Assertions.assertEquals("j0", join.getAlias());
	}

	@Test
	public void testJoinChainsAreImmutable() {
		Record orders = fixedOrders("testJoinChainsAreImmutable");

		JoinQuery base = orders.addJoin("users", "user_id", "id");
		JoinQuery withProducts = base.addJoin("products", "product_id", "id");
		JoinQuery withUsersAgain = base.addJoin("users", "user_id", "id", "LEFT");

		Assertions.assertEquals(1, base.getJoins().size(), "Extending a chain must not change it");
		Assertions.assertEquals("j1", withProducts.getJoins().get(1).getAlias());
		Assertions.assertEquals("j1", withUsersAgain.getJoins().get(1).getAlias());
		Assertions.assertEquals("products", withProducts.getJoins().get(1).getTargetTable());

		Assertions.assertEquals(0, orders.addJoin("products", "product_id", "id").getJoins().get(0).getAlias().compareTo("j0"),
				"A new chain from the record starts over at j0");
	}

	@Test
	public void testJoinTypeNames() {
		Assertions.assertEquals(JoinType.LEFT, JoinType.fromName(" left "));
		Assertions.assertEquals(JoinType.RIGHT, JoinType.fromName("Right"));
		Assertions.assertEquals("INNER JOIN", JoinType.INNER.toSql());
		Assertions.assertThrows(IllegalArgumentException.class, () -> JoinType.fromName("OUTER"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> JoinType.fromName("LEFT; DROP TABLE users"));
	}

	@Test
	public void testInvalidJoinsAreRejected() {
		Record orders = fixedOrders("testInvalidJoinsAreRejected");

		Assertions.assertThrows(IllegalArgumentException.class, () -> orders.addJoin("users u", "user_id", "id"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> orders.addJoin("users", "user_id = 1 OR 1", "id"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> orders.addJoin("users", "user_id", "id", "INNER", List.of()));
		Assertions.assertThrows(IllegalArgumentException.class, () -> orders.addJoin("users", "user_id", "id", "INNER", List.of("name, password")));
		Assertions.assertThrows(IllegalArgumentException.class, () -> JoinDescriptor.aliasFor(-1));
	}

	@Test
	public void testFetchWithJoins() {
		Database db = Database.withDataSource(createInMemoryDataSource("testFetchWithJoins")).build();
		TestDatabases.createShopSchema(db);

		execute(db, "INSERT INTO users (id, name, email, status) VALUES (1, 'Jane', 'jane@x.com', 'active')");
		execute(db, "INSERT INTO users (id, name, email, status) VALUES (2, 'John', 'john@x.com', 'active')");
		execute(db, "INSERT INTO products (id, title) VALUES (10, 'Widget')");
		execute(db, "INSERT INTO orders (id, user_id, product_id, status) VALUES (100, 1, 10, 'shipped')");
		execute(db, "INSERT INTO orders (id, user_id, product_id, status) VALUES (101, 2, 99, 'pending')");

		Record orders = new Record(db, "orders");
		JoinQuery joinQuery = orders
				.addJoin("users", "user_id", "id", "INNER", List.of("name"))
				.addJoin("products", "product_id", "id", "LEFT", List.of("title"));

		List<Map<String, Object>> rows = joinQuery.fetchWithJoins();
		rows.sort(Comparator.comparing(row -> ((Number) row.get("id")).intValue()));

		Assertions.assertEquals(2, rows.size());

		Map<String, Object> shipped = rows.get(0);
		Assertions.assertEquals(List.of("id", "user_id", "product_id", "status", "j0_name", "j1_title"), List.copyOf(shipped.keySet()));
		Assertions.assertEquals("Jane", shipped.get("j0_name"));
		Assertions.assertEquals("Widget", shipped.get("j1_title"));

		Map<String, Object> pending = rows.get(1);
		Assertions.assertEquals("John", pending.get("j0_name"));
		Assertions.assertTrue(pending.containsKey("j1_title"));
		Assertions.assertNull(pending.get("j1_title"), "LEFT join with no product yields null");

		List<Map<String, Object>> filtered = joinQuery.fetchWithJoins(Map.of("orders.status", "shipped"));
		Assertions.assertEquals(1, filtered.size());
		Assertions.assertEquals("Jane", filtered.get(0).get("j0_name"));

		Assertions.assertTrue(orders.isNew(), "Joins must not touch the record");
		Assertions.assertEquals(2, orders.fetchWithJoins().size(), "A record's own fetch carries no joins");
		Assertions.assertEquals(List.of("id", "user_id", "product_id", "status"), List.copyOf(orders.fetchWithJoins().get(0).keySet()));
	}

	private Record fixedOrders(String databaseName) {
		Database db = Database.withDataSource(createInMemoryDataSource(databaseName))
				.identifierCase(IdentifierCase.AS_REPORTED)
				.build();

		return Record.forTable(db, "orders")
				.schemaProbe(SchemaProbe.fixed("id", "user_id", "product_id", "status"))
				.build();
	}
}
