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
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Discovers a table's {@link Schema} by trying each of its {@link SchemaProbe}s in order until one reports columns.
 * <p>
 * Introspection is not cached; each {@link Record} construction introspects once.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SchemaIntrospector {
	@NonNull
	private static final SchemaIntrospector DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new SchemaIntrospector(List.of(
				SchemaProbe.describeTable(),
				SchemaProbe.pragmaTableInfo(),
				SchemaProbe.databaseMetaData()));
	}

	@NonNull
	private final List<SchemaProbe> schemaProbes;
	@NonNull
	private final Logger logger;

	private SchemaIntrospector(@NonNull List<SchemaProbe> schemaProbes) {
		requireNonNull(schemaProbes);

		if (schemaProbes.isEmpty())
			throw new IllegalArgumentException("At least one schema probe is required");

		this.schemaProbes = List.copyOf(schemaProbes);
		this.logger = Logger.getLogger(SchemaIntrospector.class.getName());
	}

	/**
	 * The standard probe chain: {@link SchemaProbe#describeTable()}, then {@link SchemaProbe#pragmaTableInfo()}, then
	 * {@link SchemaProbe#databaseMetaData()}.
	 *
	 * @return the default introspector
	 */
	@NonNull
	public static SchemaIntrospector withDefaultProbes() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * An introspector that tries exactly the given probes, in order.
	 *
	 * @param schemaProbes the probes to try
	 * @return the introspector
	 */
	@NonNull
	public static SchemaIntrospector withProbes(@NonNull List<@NonNull SchemaProbe> schemaProbes) {
		requireNonNull(schemaProbes);
		return new SchemaIntrospector(schemaProbes);
	}

	/**
	 * Discovers the columns of {@code table}.
	 *
	 * @param database the database to examine
	 * @param table    the table name
	 * @return the table's schema
	 * @throws IllegalArgumentException   if {@code table} is not a valid identifier
	 * @throws SchemaUnavailableException if every probe failed
	 */
	@NonNull
	public Schema introspect(@NonNull Database database,
													 @NonNull String table) {
		requireNonNull(database);
		Identifiers.requireQualifiedIdentifier(table, "table");

		List<DatabaseException> failures = new ArrayList<>(getSchemaProbes().size());

		for (int i = 0; i < getSchemaProbes().size(); ++i) {
			SchemaProbe schemaProbe = getSchemaProbes().get(i);
			List<String> columnNames;

			try {
				columnNames = schemaProbe.describe(database, table);
			} catch (DatabaseException e) {
				getLogger().log(FINE, format("Schema probe %d of %d failed for table '%s'", i + 1, getSchemaProbes().size(), table), e);
				failures.add(e);
				continue;
			}

			if (columnNames == null || columnNames.isEmpty()) {
				getLogger().fine(format("Schema probe %d of %d found no columns for table '%s'", i + 1, getSchemaProbes().size(), table));
				failures.add(new DatabaseException(format("No columns found for table '%s'", table)));
				continue;
			}

			return Schema.of(table, columnNames);
		}

		SchemaUnavailableException schemaUnavailableException =
				new SchemaUnavailableException(table, failures.get(failures.size() - 1));

		for (int i = 0; i < failures.size() - 1; ++i)
			schemaUnavailableException.addSuppressed(failures.get(i));

		throw schemaUnavailableException;
	}

	@NonNull
	public List<@NonNull SchemaProbe> getSchemaProbes() {
		return this.schemaProbes;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
