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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * One row of one table, with its columns discovered from the live database rather than declared in code.
 * <p>
 * Construction introspects the table once (see {@link SchemaIntrospector}); from then on the record accepts values
 * only for the table's columns and its primary key. Writes to any other name are ignored, so a superset payload
 * (e.g. a request body) can be passed to {@link #fill(Map)} as-is.
 * <p>
 * A record is either <em>new</em> or <em>persisted</em>. {@link #save()} inserts a new record and updates a persisted
 * one; finders return persisted records; {@link #delete()} makes a record new again. Storage is never re-checked, so
 * a row deleted elsewhere still looks persisted here.
 * <pre>{@code
 * Record user = new Record(database, "users");
 * user.fill(Map.of("name", "Jane", "email", "jane@x.com")).save();
 *
 * Record jane = new Record(database, "users").findById(user.getId()).orElseThrow();
 * jane.set("email", "jane@y.com");
 * jane.save(); // UPDATE
 * }</pre>
 * <p>
 * Each statement runs on its own connection, in the driver's auto-commit mode.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class Record {
	@NonNull
	public static final String DEFAULT_PRIMARY_KEY_NAME = "id";

	@NonNull
	private final Database database;
	@NonNull
	private final Schema schema;
	@NonNull
	private final String primaryKeyName;
	@NonNull
	private final SqlRenderer sqlRenderer;
	@NonNull
	private final Map<String, Object> values;
	@NonNull
	private final Logger logger;

	private boolean persisted;

	/**
	 * Binds a record to {@code table}, whose primary key is {@value #DEFAULT_PRIMARY_KEY_NAME}.
	 *
	 * @param database the database holding the table
	 * @param table    the table name
	 * @throws SchemaUnavailableException if the table's columns cannot be discovered
	 */
	public Record(@NonNull Database database,
								@NonNull String table) {
		this(forTable(database, table));
	}

	/**
	 * Binds a record to {@code table} with the given primary key column.
	 *
	 * @param database       the database holding the table
	 * @param table          the table name
	 * @param primaryKeyName the primary key column
	 * @throws SchemaUnavailableException if the table's columns cannot be discovered
	 */
	public Record(@NonNull Database database,
								@NonNull String table,
								@NonNull String primaryKeyName) {
		this(forTable(database, table).primaryKeyName(primaryKeyName));
	}

	protected Record(@NonNull Builder builder) {
		requireNonNull(builder);

		this.database = builder.database;
		this.primaryKeyName = Identifiers.requireIdentifier(builder.primaryKeyName, "primary key");
		this.schema = builder.schemaIntrospector.introspect(builder.database, builder.table);
		this.sqlRenderer = SqlRenderer.forSchema(this.schema, this.primaryKeyName);
		this.values = new LinkedHashMap<>();
		this.logger = Logger.getLogger(getClass().getName());
		this.persisted = false;
	}

	/**
	 * A new, empty record sharing {@code prototype}'s database, schema and primary key; no introspection happens.
	 *
	 * @param prototype the record to share table metadata with
	 */
	protected Record(@NonNull Record prototype) {
		requireNonNull(prototype);

		this.database = prototype.database;
		this.primaryKeyName = prototype.primaryKeyName;
		this.schema = prototype.schema;
		this.sqlRenderer = prototype.sqlRenderer;
		this.values = new LinkedHashMap<>();
		this.logger = prototype.logger;
		this.persisted = false;
	}

	/**
	 * Provides a {@link Record} builder for the given table.
	 *
	 * @param database the database holding the table
	 * @param table    the table name
	 * @return a {@link Record} builder
	 */
	@NonNull
	public static Builder forTable(@NonNull Database database,
																 @NonNull String table) {
		requireNonNull(database);
		requireNonNull(table);

		return new Builder(database, table);
	}

	// Field store

	/**
	 * The stored value of {@code name}, or {@code null} if none. Any name may be read.
	 */
	@Nullable
	public Object get(@NonNull String name) {
		requireNonNull(name);
		return this.values.get(name);
	}

	@NonNull
	public Optional<Object> getOptional(@NonNull String name) {
		return Optional.ofNullable(get(name));
	}

	/**
	 * Stores {@code value} under {@code name} if {@code name} is one of the table's columns or its primary key.
	 * <p>
	 * Any other name is ignored without error.
	 *
	 * @param name  the field name
	 * @param value the value, which may be {@code null}
	 * @return {@code true} if the value was stored, {@code false} if the name was ignored
	 */
	public boolean set(@NonNull String name,
										 @Nullable Object value) {
		requireNonNull(name);

		if (!isAcceptedField(name))
			return false;

		this.values.put(name, value);
		return true;
	}

	/**
	 * Whether a non-null value is stored under {@code name}.
	 */
	public boolean has(@NonNull String name) {
		requireNonNull(name);
		return this.values.get(name) != null;
	}

	/**
	 * Discards the value stored under {@code name}, if any. Persistence state is unaffected.
	 */
	public void remove(@NonNull String name) {
		requireNonNull(name);
		this.values.remove(name);
	}

	/**
	 * {@link #set(String, Object)} for each entry, in the map's iteration order.
	 *
	 * @param values field values; unknown names are ignored
	 * @return this record
	 */
	@NonNull
	public Record fill(@NonNull Map<@NonNull String, @Nullable Object> values) {
		requireNonNull(values);

		for (Map.Entry<String, Object> entry : values.entrySet())
			set(entry.getKey(), entry.getValue());

		return this;
	}

	/**
	 * @return a copy of the stored values, in the order they were stored
	 */
	@NonNull
	public Map<@NonNull String, @Nullable Object> toMap() {
		return new LinkedHashMap<>(this.values);
	}

	/**
	 * Empties the stored values and makes this record new. Idempotent.
	 *
	 * @return this record
	 */
	@NonNull
	public Record clear() {
		this.values.clear();
		this.persisted = false;
		return this;
	}

	// Persistence state

	public boolean isPersisted() {
		return this.persisted;
	}

	public boolean isNew() {
		return !this.persisted;
	}

	// Finders

	/**
	 * Looks up the row whose primary key equals {@code id}.
	 *
	 * @param id the primary key value
	 * @return a new persisted record, or empty if no row matches
	 */
	@NonNull
	public Optional<Record> findById(@Nullable Object id) {
		return getSqlRenderer().selectById(id).toQuery(getDatabase()).fetchObject()
				.map(row -> hydrate(row));
	}

	@NonNull
	public List<@NonNull Record> findBy(@NonNull String field,
																			@Nullable Object value) {
		return findBy(field, value, null);
	}

	/**
	 * Looks up rows whose {@code field} equals {@code value}.
	 *
	 * @param field the (possibly qualified) column to compare
	 * @param value the value to compare against
	 * @param limit maximum rows to return, or {@code null} for all
	 * @return new persisted records, possibly none
	 * @throws IllegalArgumentException if {@code field} is not a valid identifier or {@code limit} is negative
	 */
	@NonNull
	public List<@NonNull Record> findBy(@NonNull String field,
																			@Nullable Object value,
																			@Nullable Integer limit) {
		requireNonNull(field);
		return hydrateAll(getSqlRenderer().selectBy(field, value, limit).toQuery(getDatabase()).fetchList());
	}

	@NonNull
	public List<@NonNull Record> findAll() {
		return findAll(Map.of(), null, null);
	}

	@NonNull
	public List<@NonNull Record> findAll(@NonNull Map<@NonNull String, @Nullable Object> conditions) {
		return findAll(conditions, null, null);
	}

	@NonNull
	public List<@NonNull Record> findAll(@NonNull Map<@NonNull String, @Nullable Object> conditions,
																			 @Nullable String orderBy) {
		return findAll(conditions, orderBy, null);
	}

	/**
	 * Looks up rows matching every condition.
	 *
	 * @param conditions equality conditions, conjoined with {@code AND} in iteration order
	 * @param orderBy    e.g. {@code "created_at DESC, id"}; {@code null} or blank for none
	 * @param limit      maximum rows to return, or {@code null} for all
	 * @return new persisted records, possibly none
	 * @throws IllegalArgumentException if an identifier or {@code orderBy} is malformed, or {@code limit} is negative
	 */
	@NonNull
	public List<@NonNull Record> findAll(@NonNull Map<@NonNull String, @Nullable Object> conditions,
																			 @Nullable String orderBy,
																			 @Nullable Integer limit) {
		requireNonNull(conditions);
		return hydrateAll(getSqlRenderer().select(List.of(), conditions, orderBy, limit).toQuery(getDatabase()).fetchList());
	}

	// Joins

	@NonNull
	public JoinQuery addJoin(@NonNull String table,
													 @NonNull String localKey,
													 @NonNull String foreignKey) {
		return joinQuery().addJoin(table, localKey, foreignKey);
	}

	@NonNull
	public JoinQuery addJoin(@NonNull String table,
													 @NonNull String localKey,
													 @NonNull String foreignKey,
													 @NonNull String joinType) {
		return joinQuery().addJoin(table, localKey, foreignKey, joinType);
	}

	@NonNull
	public JoinQuery addJoin(@NonNull String table,
													 @NonNull String localKey,
													 @NonNull String foreignKey,
													 @NonNull String joinType,
													 @NonNull List<@NonNull String> selectedFields) {
		return joinQuery().addJoin(table, localKey, foreignKey, joinType, selectedFields);
	}

	/**
	 * Starts a join chain from this record's table. This record is not modified.
	 *
	 * @see JoinQuery#addJoin(String, String, String, JoinType, List)
	 */
	@NonNull
	public JoinQuery addJoin(@NonNull String table,
													 @NonNull String localKey,
													 @NonNull String foreignKey,
													 @NonNull JoinType joinType,
													 @NonNull List<@NonNull String> selectedFields) {
		return joinQuery().addJoin(table, localKey, foreignKey, joinType, selectedFields);
	}

	/**
	 * This table's columns as raw rows, with no joins.
	 */
	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> fetchWithJoins() {
		return joinQuery().fetchWithJoins();
	}

	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> fetchWithJoins(@NonNull Map<@NonNull String, @Nullable Object> conditions) {
		return joinQuery().fetchWithJoins(conditions);
	}

	// Writers

	/**
	 * Inserts this record if it is new, otherwise updates it.
	 * <p>
	 * An insert never sends the primary key; the key the database generated replaces whatever was stored.
	 * An update with nothing but the primary key stored issues no statement.
	 *
	 * @return {@code true} if the row was written
	 * @throws MissingPrimaryKeyException if this record is persisted but has no primary key value
	 * @throws DatabaseException          if the statement fails
	 */
	public boolean save() {
		return isPersisted() ? update() : insert();
	}

	protected boolean insert() {
		Object callerKey = getId();
		Optional<Object> generatedKey = getSqlRenderer().insert(this.values).toQuery(getDatabase())
				.executeForGeneratedKey(getPrimaryKeyName());

		if (generatedKey.isPresent())
			this.values.put(getPrimaryKeyName(), generatedKey.get());
		else if (callerKey == null)
			getLogger().log(WARNING, format("Driver reported no generated key for insert into '%s'; '%s' remains unset",
					getTable(), getPrimaryKeyName()));
		else
			getLogger().log(WARNING, format("Driver reported no generated key for insert into '%s'; '%s' keeps the unsent value %s",
					getTable(), getPrimaryKeyName(), callerKey));

		this.persisted = true;
		return true;
	}

	protected boolean update() {
		Optional<ParameterizedSql> update = getSqlRenderer().update(this.values);

		// Zero affected rows is still success: some databases only count rows whose values changed
		update.ifPresent(parameterizedSql -> parameterizedSql.toQuery(getDatabase()).execute());
		return true;
	}

	/**
	 * Deletes this record's row by primary key, then empties this record and makes it new.
	 *
	 * @return {@code true} once the statement has run
	 * @throws MissingPrimaryKeyException if this record has no primary key value; no statement is issued
	 * @throws DatabaseException          if the statement fails
	 */
	public boolean delete() {
		getSqlRenderer().deleteById(getId()).toQuery(getDatabase()).execute();
		clear();
		return true;
	}

	/**
	 * Deletes every row of this table matching all conditions.
	 *
	 * @param conditions equality conditions, conjoined with {@code AND}; must not be empty
	 * @return the number of rows deleted
	 * @throws EmptyConditionException if {@code conditions} is empty; no statement is issued
	 */
	public long deleteWhere(@NonNull Map<@NonNull String, @Nullable Object> conditions) {
		requireNonNull(conditions);
		return getSqlRenderer().deleteWhere(conditions).toQuery(getDatabase()).execute();
	}

	// Hydration

	/**
	 * A new persisted record holding {@code row} exactly, including columns outside the schema.
	 */
	@NonNull
	protected Record hydrate(@NonNull Map<@NonNull String, @Nullable Object> row) {
		requireNonNull(row);

		Record record = newInstance();
		record.values.clear();
		record.values.putAll(row);
		record.persisted = true;

		return record;
	}

	/**
	 * Creates the empty instances that finders hydrate. Subclasses override this to return their own type.
	 *
	 * @return a new record sharing this record's table metadata
	 */
	@NonNull
	protected Record newInstance() {
		return new Record(this);
	}

	@NonNull
	private List<Record> hydrateAll(@NonNull List<Map<String, Object>> rows) {
		requireNonNull(rows);

		List<Record> records = new ArrayList<>(rows.size());

		for (Map<String, Object> row : rows)
			records.add(hydrate(row));

		return records;
	}

	@NonNull
	private JoinQuery joinQuery() {
		return new JoinQuery(getDatabase(), getSqlRenderer(), List.of());
	}

	protected boolean isAcceptedField(@NonNull String name) {
		requireNonNull(name);
		return name.equals(getPrimaryKeyName()) || getSchema().hasColumn(name);
	}

	// Accessors

	/**
	 * @return the primary key value, or {@code null} if unset
	 */
	@Nullable
	public Object getId() {
		return this.values.get(getPrimaryKeyName());
	}

	@NonNull
	public Optional<Object> getIdOptional() {
		return Optional.ofNullable(getId());
	}

	@NonNull
	public String getTable() {
		return getSchema().getTable();
	}

	@NonNull
	public String getPrimaryKeyName() {
		return this.primaryKeyName;
	}

	@NonNull
	public Schema getSchema() {
		return this.schema;
	}

	/**
	 * @return the table's columns, in table order
	 */
	@NonNull
	public List<@NonNull String> getKnownFields() {
		return getSchema().getColumnNames();
	}

	@NonNull
	protected Database getDatabase() {
		return this.database;
	}

	@NonNull
	protected SqlRenderer getSqlRenderer() {
		return this.sqlRenderer;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@Override
	public String toString() {
		return format("%s{table=%s, persisted=%s, values=%s}", getClass().getSimpleName(), getTable(), isPersisted(), this.values);
	}

	/**
	 * Builder used to construct instances of {@link Record}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Database database;
		@NonNull
		private final String table;
		@NonNull
		private String primaryKeyName;
		@NonNull
		private SchemaIntrospector schemaIntrospector;

		private Builder(@NonNull Database database,
										@NonNull String table) {
			this.database = requireNonNull(database);
			this.table = requireNonNull(table);
			this.primaryKeyName = DEFAULT_PRIMARY_KEY_NAME;
			this.schemaIntrospector = SchemaIntrospector.withDefaultProbes();
		}

		@NonNull
		public Builder primaryKeyName(@NonNull String primaryKeyName) {
			this.primaryKeyName = requireNonNull(primaryKeyName);
			return this;
		}

		/**
		 * Discovers the schema with this probe alone, e.g. {@link SchemaProbe#fixed(String...)}.
		 */
		@NonNull
		public Builder schemaProbe(@NonNull SchemaProbe schemaProbe) {
			requireNonNull(schemaProbe);
			this.schemaIntrospector = SchemaIntrospector.withProbes(List.of(schemaProbe));
			return this;
		}

		@NonNull
		public Builder schemaIntrospector(@NonNull SchemaIntrospector schemaIntrospector) {
			this.schemaIntrospector = requireNonNull(schemaIntrospector);
			return this;
		}

		@NonNull
		public Record build() {
			return new Record(this);
		}
	}
}
