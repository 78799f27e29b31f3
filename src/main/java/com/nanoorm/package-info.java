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

/**
 * NanoORM is a schema-reflecting active-record mapper over JDBC: a {@link com.nanoorm.Record} discovers its table's
 * columns at runtime and renders parameterized SQL for finding, saving and deleting rows, with no compile-time model.
 *
 * <pre>
 * // Minimal setup, uses defaults
 * DataSource dataSource = ...
 * Database database = Database.withDataSource(dataSource).build();
 *
 * // Insert; the generated key is stored on the record
 * Record user = new Record(database, "users");
 * user.fill(Map.of("name", "Jane", "email", "jane@x.com")).save();
 *
 * // Finders return fresh, persisted records
 * Optional&lt;Record&gt; jane = user.findById(user.getId());
 * List&lt;Record&gt; inactive = user.findBy("status", "inactive");
 * List&lt;Record&gt; recent = user.findAll(Map.of("status", "active"), "created_at DESC", 10);
 *
 * // Joins produce raw rows; joined columns are prefixed by alias
 * List&lt;Map&lt;String, Object&gt;&gt; rows = new Record(database, "orders")
 *   .addJoin("users", "user_id", "id", "INNER", List.of("name"))
 *   .fetchWithJoins(); // ... j0_name ...
 *
 * // Bulk delete requires conditions
 * long deleted = user.deleteWhere(Map.of("status", "inactive"));
 *
 * // Plain SQL with named parameters
 * List&lt;Map&lt;String, Object&gt;&gt; rows = database.query("SELECT * FROM users WHERE email = :email")
 *   .bind("email", "jane@x.com")
 *   .fetchList();</pre>
 *
 * @since 1.0.0
 */
package com.nanoorm;
