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

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * How column labels and introspected column names reported by the database are normalized before they become
 * {@link Record} field names.
 * <p>
 * Some engines (HSQLDB, H2, Oracle) fold unquoted identifiers to upper case, so a column created as {@code name}
 * is reported as {@code NAME}. Normalizing lets callers use the identifiers they wrote.
 *
 * @since 1.0.0
 */
public enum IdentifierCase {
	/**
	 * Identifiers are used exactly as the driver reports them.
	 */
	AS_REPORTED {
		@NonNull
		@Override
		public String normalize(@NonNull String identifier) {
			requireNonNull(identifier);
			return identifier;
		}
	},
	/**
	 * Identifiers reported entirely in upper case are lower-cased; mixed-case (quoted) identifiers are untouched.
	 */
	FOLD_UPPER_CASE {
		@NonNull
		@Override
		public String normalize(@NonNull String identifier) {
			requireNonNull(identifier);

			// All of our folding is against unquoted SQL identifiers, which are ASCII in practice
			String upperCase = identifier.toUpperCase(Locale.ENGLISH);

			if (!identifier.equals(upperCase))
				return identifier;

			return identifier.toLowerCase(Locale.ENGLISH);
		}
	};

	/**
	 * Normalizes an identifier reported by the database.
	 *
	 * @param identifier the identifier as the driver reported it
	 * @return the normalized identifier
	 */
	@NonNull
	public abstract String normalize(@NonNull String identifier);

	/**
	 * Determines identifier handling from the database's own description of how it stores unquoted identifiers.
	 *
	 * @param databaseMetaData JDBC metadata for the database
	 * @return the identifier handling to use
	 * @throws SQLException if metadata cannot be read
	 */
	@NonNull
	public static IdentifierCase fromDatabaseMetaData(@NonNull DatabaseMetaData databaseMetaData) throws SQLException {
		requireNonNull(databaseMetaData);
		return databaseMetaData.storesUpperCaseIdentifiers() ? FOLD_UPPER_CASE : AS_REPORTED;
	}

	/**
	 * Determines identifier handling for the database to which the given {@code dataSource} connects.
	 * <p>
	 * Note: this will establish a {@link Connection} to the database.
	 *
	 * @param dataSource the database connection factory
	 * @return the identifier handling to use
	 * @throws DatabaseException if an exception occurs while attempting to read database metadata
	 */
	@NonNull
	public static IdentifierCase fromDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		try (Connection connection = dataSource.getConnection()) {
			return fromDatabaseMetaData(connection.getMetaData());
		} catch (SQLException e) {
			throw new DatabaseException("Unable to connect to database to determine its identifier case", e);
		}
	}
}
