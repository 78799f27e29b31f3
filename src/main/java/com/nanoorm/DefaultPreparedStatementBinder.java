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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Date;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link PreparedStatementBinder}.
 * <p>
 * Values arrive untyped from {@link Record} field stores, so the binder only massages the handful of Java types that
 * drivers disagree on and hands everything else to {@link PreparedStatement#setObject(int, Object)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultPreparedStatementBinder implements PreparedStatementBinder {
	@Override
	public void bindParameter(@NonNull StatementContext statementContext,
														@NonNull PreparedStatement preparedStatement,
														@NonNull Integer parameterIndex,
														@NonNull Object parameter) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(parameter);

		if (parameter instanceof LocalDate localDate) {
			if (!trySetObject(preparedStatement, parameterIndex, localDate, Types.DATE))
				preparedStatement.setDate(parameterIndex, java.sql.Date.valueOf(localDate));

			return;
		}

		if (parameter instanceof LocalDateTime localDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
				preparedStatement.setTimestamp(parameterIndex, Timestamp.valueOf(localDateTime));

			return;
		}

		if (parameter instanceof LocalTime localTime) {
			// Some drivers used to offset LocalTime; safest is a tz-free string.
			preparedStatement.setString(parameterIndex, localTime.toString());
			return;
		}

		if (parameter instanceof Instant instant) {
			preparedStatement.setTimestamp(parameterIndex, Timestamp.from(instant));
			return;
		}

		// java.sql.Date/Time/Timestamp are handled natively by setObject
		if (parameter instanceof Date date && parameter.getClass() == Date.class) {
			preparedStatement.setTimestamp(parameterIndex, new Timestamp(date.getTime()));
			return;
		}

		if (parameter instanceof Enum<?> enumValue) {
			preparedStatement.setString(parameterIndex, enumValue.name());
			return;
		}

		if (parameter instanceof UUID uuid) {
			if (!trySetObject(preparedStatement, parameterIndex, uuid))
				preparedStatement.setString(parameterIndex, uuid.toString());

			return;
		}

		if (parameter instanceof BigInteger bigInteger) {
			preparedStatement.setBigDecimal(parameterIndex, new BigDecimal(bigInteger));
			return;
		}

		if (parameter instanceof Character character) {
			preparedStatement.setString(parameterIndex, character.toString());
			return;
		}

		preparedStatement.setObject(parameterIndex, parameter);
	}

	protected boolean trySetObject(@NonNull PreparedStatement preparedStatement,
																 @NonNull Integer parameterIndex,
																 @NonNull Object value,
																 int sqlType) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(value);

		try {
			preparedStatement.setObject(parameterIndex, value, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}

	protected boolean trySetObject(@NonNull PreparedStatement preparedStatement,
																 @NonNull Integer parameterIndex,
																 @NonNull Object value) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(value);

		try {
			preparedStatement.setObject(parameterIndex, value);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}
}
