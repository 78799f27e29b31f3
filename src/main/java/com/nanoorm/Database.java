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
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Main class for performing database access operations.
 * <p>
 * Every statement borrows its own {@link Connection} from the {@link DataSource} and closes it afterwards, so each
 * statement is committed (or not) according to the driver's auto-commit setting.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Database {
	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final IdentifierCase identifierCase;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@NonNull
	private final ResultSetMapper resultSetMapper;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final AtomicInteger defaultIdGenerator;

	@NonNull
	private volatile DatabaseOperationSupportStatus executeLargeUpdateSupported;

	protected Database(@NonNull Builder builder) {
		requireNonNull(builder);

		this.dataSource = requireNonNull(builder.dataSource);
		this.identifierCase = builder.identifierCase == null ? IdentifierCase.fromDataSource(builder.dataSource) : builder.identifierCase;
		this.preparedStatementBinder = builder.preparedStatementBinder == null ? PreparedStatementBinder.withDefaultConfiguration() : builder.preparedStatementBinder;
		this.resultSetMapper = builder.resultSetMapper == null ? ResultSetMapper.withDefaultConfiguration() : builder.resultSetMapper;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.defaultIdGenerator = new AtomicInteger();
		this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.UNKNOWN;
	}

	/**
	 * Provides a {@link Database} builder for the given {@link DataSource}.
	 *
	 * @param dataSource data source used to create the {@link Database} builder
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new Builder(dataSource);
	}

	/**
	 * Creates a fluent builder for executing SQL.
	 * <p>
	 * Named parameters use the {@code :paramName} syntax and are bound via {@link Query#bind(String, Object)}.
	 * Positional parameters via {@code ?} are not supported.
	 * <p>
	 * Example:
	 * <pre>{@code
	 * Optional<Map<String, Object>> row = database.query("SELECT * FROM users WHERE id = :id")
	 *   .bind("id", 42)
	 *   .fetchObject();
	 * }</pre>
	 *
	 * @param sql SQL containing {@code :paramName} placeholders
	 * @return a fluent builder for binding parameters and executing
	 * @throws IllegalArgumentException if the SQL contains positional parameters
	 */
	@NonNull
	public Query query(@NonNull String sql) {
		requireNonNull(sql);
		return new DefaultQuery(this, sql);
	}

	/**
	 * Exposes a temporary handle to JDBC metadata for this database.
	 * <p>
	 * This method acquires its own newly-borrowed connection, which is closed as soon as
	 * {@link DatabaseMetaDataReader#read(Connection, java.sql.DatabaseMetaData)} completes.
	 *
	 * @param databaseMetaDataReader the callback that examines the metadata
	 * @param <T>                    the type of value the reader produces
	 * @return the reader's result
	 * @throws DatabaseException if the connection cannot be acquired or the reader fails
	 */
	@Nullable
	public <T> T readDatabaseMetaData(@NonNull DatabaseMetaDataReader<T> databaseMetaDataReader) {
		requireNonNull(databaseMetaDataReader);

		Connection connection = acquireConnection();
		Throwable thrown = null;

		try {
			return databaseMetaDataReader.read(connection, connection.getMetaData());
		} catch (SQLException e) {
			DatabaseException wrapped = new DatabaseException("Unable to read database metadata", e);
			thrown = wrapped;
			throw wrapped;
		} catch (RuntimeException | Error e) {
			thrown = e;
			throw e;
		} finally {
			try {
				closeConnection(connection);
			} catch (RuntimeException cleanupException) {
				if (thrown == null)
					throw cleanupException;

				thrown.addSuppressed(cleanupException);
			}
		}
	}

	@NonNull
	private Optional<Map<String, Object>> queryForObject(@NonNull StatementContext statementContext) {
		requireNonNull(statementContext);

		ResultHolder<Optional<Map<String, Object>>> resultHolder = new ResultHolder<>();

		performDatabaseOperation(statementContext, false, (PreparedStatement preparedStatement) -> {
			long startTime = nanoTime();

			try (ResultSet resultSet = preparedStatement.executeQuery()) {
				Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();

				Optional<Map<String, Object>> result = Optional.empty();
				long rowCount = 0;

				if (resultSet.next()) {
					result = Optional.of(mapRow(statementContext, resultSet));
					rowCount = 1;

					if (resultSet.next())
						throw new DatabaseException("Expected 1 row in resultset but got more than 1 instead");
				}

				resultHolder.value = result;
				Duration resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
				return new DatabaseOperationResult(executionDuration, resultSetMappingDuration, rowCount);
			}
		});

		return resultHolder.value;
	}

	@NonNull
	private List<Map<String, Object>> queryForList(@NonNull StatementContext statementContext) {
		requireNonNull(statementContext);

		ResultHolder<List<Map<String, Object>>> resultHolder = new ResultHolder<>();

		performDatabaseOperation(statementContext, false, (PreparedStatement preparedStatement) -> {
			long startTime = nanoTime();

			try (ResultSet resultSet = preparedStatement.executeQuery()) {
				Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();

				List<Map<String, Object>> rows = new ArrayList<>();

				while (resultSet.next())
					rows.add(mapRow(statementContext, resultSet));

				resultHolder.value = rows;
				Duration resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
				return new DatabaseOperationResult(executionDuration, resultSetMappingDuration, (long) rows.size());
			}
		});

		return resultHolder.value;
	}

	@NonNull
	private Long execute(@NonNull StatementContext statementContext) {
		requireNonNull(statementContext);

		ResultHolder<Long> resultHolder = new ResultHolder<>();

		performDatabaseOperation(statementContext, false, (PreparedStatement preparedStatement) -> {
			long startTime = nanoTime();
			resultHolder.value = executeUpdate(preparedStatement);
			Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);
			return new DatabaseOperationResult(executionDuration, null, resultHolder.value);
		});

		return resultHolder.value;
	}

	@NonNull
	private Optional<Object> executeForGeneratedKey(@NonNull StatementContext statementContext,
																									@Nullable String keyColumnName) {
		requireNonNull(statementContext);

		ResultHolder<Optional<Object>> resultHolder = new ResultHolder<>();

		performDatabaseOperation(statementContext, true, (PreparedStatement preparedStatement) -> {
			long startTime = nanoTime();
			long rowCount = executeUpdate(preparedStatement);
			Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			Optional<Object> generatedKey = Optional.empty();

			try (ResultSet generatedKeys = preparedStatement.getGeneratedKeys()) {
				if (generatedKeys != null && generatedKeys.next())
					generatedKey = readGeneratedKey(generatedKeys, getIdentifierCase(), keyColumnName);
			}

			resultHolder.value = generatedKey;
			Duration resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
			return new DatabaseOperationResult(executionDuration, resultSetMappingDuration, rowCount);
		});

		return resultHolder.value;
	}

	/**
	 * Picks the generated key out of the current row of a generated-keys resultset.
	 * <p>
	 * With no {@code keyColumnName}, or a single column, the first column is the key. Otherwise the column whose
	 * normalized label matches {@code keyColumnName} (ignoring case) is, and there is no key if none matches.
	 */
	@NonNull
	static Optional<Object> readGeneratedKey(@NonNull ResultSet generatedKeys,
																					 @NonNull IdentifierCase identifierCase,
																					 @Nullable String keyColumnName) throws SQLException {
		requireNonNull(generatedKeys);
		requireNonNull(identifierCase);

		ResultSetMetaData resultSetMetaData = generatedKeys.getMetaData();
		int columnCount = resultSetMetaData.getColumnCount();

		if (columnCount == 0)
			return Optional.empty();

		if (keyColumnName == null || columnCount == 1)
			return Optional.ofNullable(generatedKeys.getObject(1));

		for (int i = 1; i <= columnCount; ++i)
			if (identifierCase.normalize(resultSetMetaData.getColumnLabel(i)).equalsIgnoreCase(keyColumnName))
				return Optional.ofNullable(generatedKeys.getObject(i));

		return Optional.empty();
	}

	@NonNull
	private Map<String, Object> mapRow(@NonNull StatementContext statementContext,
																		 @NonNull ResultSet resultSet) {
		requireNonNull(statementContext);
		requireNonNull(resultSet);

		try {
			return getResultSetMapper().map(statementContext, resultSet);
		} catch (SQLException e) {
			throw new DatabaseException(format("Unable to map JDBC %s row", ResultSet.class.getSimpleName()), e);
		}
	}

	private long executeUpdate(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		DatabaseOperationSupportStatus executeLargeUpdateSupported = getExecuteLargeUpdateSupported();

		// Use the appropriate "large" value if we know it.
		// If we don't know it, detect it and store it.
		if (executeLargeUpdateSupported == DatabaseOperationSupportStatus.YES)
			return preparedStatement.executeLargeUpdate();

		if (executeLargeUpdateSupported == DatabaseOperationSupportStatus.NO)
			return preparedStatement.executeUpdate();

		try {
			long rowCount = preparedStatement.executeLargeUpdate();
			setExecuteLargeUpdateSupported(DatabaseOperationSupportStatus.YES);
			return rowCount;
		} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
			setExecuteLargeUpdateSupported(DatabaseOperationSupportStatus.NO);
			return preparedStatement.executeUpdate();
		}
	}

	protected void performDatabaseOperation(@NonNull StatementContext statementContext,
																					boolean returnGeneratedKeys,
																					@NonNull DatabaseOperation databaseOperation) {
		requireNonNull(statementContext);
		requireNonNull(databaseOperation);

		long startTime = nanoTime();
		Duration connectionAcquisitionDuration = null;
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultSetMappingDuration = null;
		Long rowCount = null;
		Exception exception = null;
		Throwable thrown = null;
		Connection connection = null;

		try {
			connection = acquireConnection();
			connectionAcquisitionDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			try (PreparedStatement preparedStatement = returnGeneratedKeys
					? connection.prepareStatement(statementContext.getJdbcSql(), Statement.RETURN_GENERATED_KEYS)
					: connection.prepareStatement(statementContext.getJdbcSql())) {
				performPreparedStatementBinding(statementContext, preparedStatement);
				preparationDuration = Duration.ofNanos(nanoTime() - startTime);

				DatabaseOperationResult databaseOperationResult = databaseOperation.perform(preparedStatement);
				executionDuration = databaseOperationResult.getExecutionDuration().orElse(null);
				resultSetMappingDuration = databaseOperationResult.getResultSetMappingDuration().orElse(null);
				rowCount = databaseOperationResult.getRowCount().orElse(null);
			}
		} catch (DatabaseException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new DatabaseException(e);
			thrown = e;
			throw e;
		} catch (Exception e) {
			exception = e;
			DatabaseException wrapped = new DatabaseException(e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			Throwable cleanupFailure = null;

			if (connection != null) {
				try {
					closeConnection(connection);
				} catch (Throwable cleanupException) {
					cleanupFailure = cleanupException;
				}
			}

			StatementLog statementLog =
					StatementLog.withStatementContext(statementContext)
							.connectionAcquisitionDuration(connectionAcquisitionDuration)
							.preparationDuration(preparationDuration)
							.executionDuration(executionDuration)
							.resultSetMappingDuration(resultSetMappingDuration)
							.rowCount(rowCount)
							.exception(exception)
							.build();

			try {
				getStatementLogger().log(statementLog);
			} catch (Throwable cleanupException) {
				if (cleanupFailure == null)
					cleanupFailure = cleanupException;
				else
					cleanupFailure.addSuppressed(cleanupException);
			}

			if (cleanupFailure != null) {
				if (thrown != null) {
					thrown.addSuppressed(cleanupFailure);
				} else if (cleanupFailure instanceof RuntimeException) {
					throw (RuntimeException) cleanupFailure;
				} else if (cleanupFailure instanceof Error) {
					throw (Error) cleanupFailure;
				} else {
					throw new RuntimeException(cleanupFailure);
				}
			}
		}
	}

	protected void performPreparedStatementBinding(@NonNull StatementContext statementContext,
																								 @NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(preparedStatement);

		List<Object> parameters = statementContext.getParameters();

		for (int i = 0; i < parameters.size(); ++i) {
			Object parameter = parameters.get(i);

			if (parameter != null) {
				getPreparedStatementBinder().bindParameter(statementContext, preparedStatement, i + 1, parameter);
			} else {
				try {
					ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

					if (parameterMetaData != null) {
						preparedStatement.setNull(i + 1, parameterMetaData.getParameterType(i + 1));
					} else {
						preparedStatement.setNull(i + 1, Types.NULL);
					}
				} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
					preparedStatement.setNull(i + 1, Types.NULL);
				}
			}
		}
	}

	@NonNull
	protected Connection acquireConnection() {
		try {
			return getDataSource().getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	protected void closeConnection(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			connection.close();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}

	/**
	 * How this database's column labels and introspected column names are normalized.
	 *
	 * @return the identifier case, either configured or detected from database metadata
	 */
	@NonNull
	public IdentifierCase getIdentifierCase() {
		return this.identifierCase;
	}

	@NonNull
	protected DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	protected PreparedStatementBinder getPreparedStatementBinder() {
		return this.preparedStatementBinder;
	}

	@NonNull
	protected ResultSetMapper getResultSetMapper() {
		return this.resultSetMapper;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	protected DatabaseOperationSupportStatus getExecuteLargeUpdateSupported() {
		return this.executeLargeUpdateSupported;
	}

	protected void setExecuteLargeUpdateSupported(@NonNull DatabaseOperationSupportStatus executeLargeUpdateSupported) {
		requireNonNull(executeLargeUpdateSupported);
		this.executeLargeUpdateSupported = executeLargeUpdateSupported;
	}

	@NonNull
	protected Object generateId() {
		// "Unique" keys
		return format("com.nanoorm.%s", this.defaultIdGenerator.incrementAndGet());
	}

	@FunctionalInterface
	protected interface DatabaseOperation {
		@NonNull
		DatabaseOperationResult perform(@NonNull PreparedStatement preparedStatement) throws Exception;
	}

	/**
	 * Default {@link Query}: named parameters are collected here and rewritten to JDBC placeholders at execution time.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	private static final class DefaultQuery implements Query {
		@NonNull
		private final Database database;
		@NonNull
		private final NamedParameterSql namedParameterSql;
		@NonNull
		private final Map<String, Object> bindings;
		@Nullable
		private Object id;

		private DefaultQuery(@NonNull Database database,
												 @NonNull String sql) {
			requireNonNull(database);
			requireNonNull(sql);

			this.database = database;
			this.namedParameterSql = NamedParameterSql.parse(sql);
			this.bindings = new LinkedHashMap<>(Math.max(8, this.namedParameterSql.getDistinctParameterNames().size() * 2));
		}

		@NonNull
		@Override
		public Query bind(@NonNull String name,
											@Nullable Object value) {
			requireNonNull(name);

			if (!this.namedParameterSql.getDistinctParameterNames().contains(name))
				throw new IllegalArgumentException(format("Unknown named parameter '%s' for SQL: %s", name, this.namedParameterSql.getSql()));

			this.bindings.put(name, value);
			return this;
		}

		@NonNull
		@Override
		public Query bindAll(@NonNull Map<@NonNull String, @Nullable Object> parameters) {
			requireNonNull(parameters);

			for (Map.Entry<@NonNull String, @Nullable Object> entry : parameters.entrySet())
				bind(entry.getKey(), entry.getValue());

			return this;
		}

		@NonNull
		@Override
		public Query id(@Nullable Object id) {
			this.id = id;
			return this;
		}

		@NonNull
		@Override
		public Optional<Map<@NonNull String, @Nullable Object>> fetchObject() {
			return this.database.queryForObject(prepare());
		}

		@NonNull
		@Override
		public List<@NonNull Map<@NonNull String, @Nullable Object>> fetchList() {
			return this.database.queryForList(prepare());
		}

		@NonNull
		@Override
		public Long execute() {
			return this.database.execute(prepare());
		}

		@NonNull
		@Override
		public Optional<Object> executeForGeneratedKey() {
			return this.database.executeForGeneratedKey(prepare(), null);
		}

		@NonNull
		@Override
		public Optional<Object> executeForGeneratedKey(@NonNull String keyColumnName) {
			requireNonNull(keyColumnName);
			return this.database.executeForGeneratedKey(prepare(), keyColumnName);
		}

		@NonNull
		private StatementContext prepare() {
			NamedParameterSql.JdbcSql jdbcSql = this.namedParameterSql.toJdbcSql(this.bindings);
			Object statementId = this.id == null ? this.database.generateId() : this.id;

			return StatementContext.with(statementId, this.namedParameterSql.getSql(), this.database)
					.jdbcSql(jdbcSql.getSql())
					.parameters(jdbcSql.getParameters())
					.build();
		}
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DataSource dataSource;
		@Nullable
		private IdentifierCase identifierCase;
		@Nullable
		private PreparedStatementBinder preparedStatementBinder;
		@Nullable
		private ResultSetMapper resultSetMapper;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull DataSource dataSource) {
			this.dataSource = requireNonNull(dataSource);
		}

		/**
		 * Overrides automatic identifier case detection.
		 *
		 * @param identifierCase the identifier case to use (null to enable auto-detection)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder identifierCase(@Nullable IdentifierCase identifierCase) {
			this.identifierCase = identifierCase;
			return this;
		}

		@NonNull
		public Builder preparedStatementBinder(@Nullable PreparedStatementBinder preparedStatementBinder) {
			this.preparedStatementBinder = preparedStatementBinder;
			return this;
		}

		@NonNull
		public Builder resultSetMapper(@Nullable ResultSetMapper resultSetMapper) {
			this.resultSetMapper = resultSetMapper;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Database build() {
			return new Database(this);
		}
	}

	@ThreadSafe
	static class DatabaseOperationResult {
		@Nullable
		private final Duration executionDuration;
		@Nullable
		private final Duration resultSetMappingDuration;
		@Nullable
		private final Long rowCount;

		public DatabaseOperationResult(@Nullable Duration executionDuration,
																	 @Nullable Duration resultSetMappingDuration,
																	 @Nullable Long rowCount) {
			this.executionDuration = executionDuration;
			this.resultSetMappingDuration = resultSetMappingDuration;
			this.rowCount = rowCount;
		}

		@NonNull
		public Optional<Duration> getExecutionDuration() {
			return Optional.ofNullable(this.executionDuration);
		}

		@NonNull
		public Optional<Duration> getResultSetMappingDuration() {
			return Optional.ofNullable(this.resultSetMappingDuration);
		}

		@NonNull
		public Optional<Long> getRowCount() {
			return Optional.ofNullable(this.rowCount);
		}
	}

	@NotThreadSafe
	static class ResultHolder<T> {
		T value;
	}

	enum DatabaseOperationSupportStatus {
		UNKNOWN,
		YES,
		NO
	}
}
