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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Checks for the SQL identifiers and clauses that are interpolated into statement text rather than bound.
 * <p>
 * Accepted identifiers are unquoted: a letter or underscore, then letters, digits, underscores or {@code $}.
 * Qualified names ({@code orders.status}, {@code app.users}) are accepted where noted.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class Identifiers {
	@NonNull
	private static final String IDENTIFIER_REGEX = "[A-Za-z_][A-Za-z0-9_$]*";
	@NonNull
	private static final Pattern IDENTIFIER_PATTERN = Pattern.compile(IDENTIFIER_REGEX);
	@NonNull
	private static final Pattern QUALIFIED_IDENTIFIER_PATTERN = Pattern.compile(format("%s(?:\\.%s)*", IDENTIFIER_REGEX, IDENTIFIER_REGEX));
	@NonNull
	private static final Pattern ORDER_BY_TERM_PATTERN = Pattern.compile(format("\\s*(%s(?:\\.%s)*)(?:\\s+(ASC|DESC))?\\s*", IDENTIFIER_REGEX, IDENTIFIER_REGEX), Pattern.CASE_INSENSITIVE);
	@NonNull
	private static final Pattern PARAMETER_NAME_INVALID_CHARACTERS = Pattern.compile("[^A-Za-z0-9_]");

	private Identifiers() {
		// Non-instantiable
	}

	/**
	 * Validates a bare identifier, such as a column name or a join key.
	 *
	 * @param identifier the identifier to check
	 * @param role       what the identifier names, for the error message
	 * @return {@code identifier}, unchanged
	 * @throws IllegalArgumentException if the identifier is not a bare identifier
	 */
	@NonNull
	static String requireIdentifier(@Nullable String identifier,
																	@NonNull String role) {
		requireNonNull(role);

		if (identifier == null || !IDENTIFIER_PATTERN.matcher(identifier).matches())
			throw new IllegalArgumentException(format("Invalid %s identifier: '%s'", role, identifier));

		return identifier;
	}

	/**
	 * Validates a possibly-qualified identifier, such as a table name or a condition field.
	 *
	 * @param identifier the identifier to check
	 * @param role       what the identifier names, for the error message
	 * @return {@code identifier}, unchanged
	 * @throws IllegalArgumentException if the identifier is not a dot-separated sequence of bare identifiers
	 */
	@NonNull
	static String requireQualifiedIdentifier(@Nullable String identifier,
																					 @NonNull String role) {
		requireNonNull(role);

		if (identifier == null || !QUALIFIED_IDENTIFIER_PATTERN.matcher(identifier).matches())
			throw new IllegalArgumentException(format("Invalid %s identifier: '%s'", role, identifier));

		return identifier;
	}

	/**
	 * Validates an {@code ORDER BY} list of the form {@code column [ASC|DESC] (, column [ASC|DESC])*} and returns it
	 * in canonical spacing, e.g. {@code "name   desc,id"} becomes {@code "name DESC, id"}.
	 *
	 * @param orderBy the caller-supplied ordering
	 * @return the canonical ordering
	 * @throws IllegalArgumentException if the text is anything other than such a list
	 */
	@NonNull
	static String requireOrderBy(@NonNull String orderBy) {
		requireNonNull(orderBy);

		String[] terms = orderBy.split(",", -1);
		List<String> canonicalTerms = new ArrayList<>(terms.length);

		for (String term : terms) {
			Matcher matcher = ORDER_BY_TERM_PATTERN.matcher(term);

			if (!matcher.matches())
				throw new IllegalArgumentException(format("Invalid ORDER BY clause: '%s'. Expected a comma-separated list of 'column [ASC|DESC]'", orderBy));

			String direction = matcher.group(2);
			canonicalTerms.add(direction == null ? matcher.group(1) : format("%s %s", matcher.group(1), direction.toUpperCase(Locale.ENGLISH)));
		}

		return String.join(", ", canonicalTerms);
	}

	/**
	 * The named-parameter name under which a value compared against {@code field} is bound.
	 * <p>
	 * Characters other than letters, digits and underscores become underscores, so {@code orders.status} binds as
	 * {@code :orders_status}.
	 *
	 * @param field a (possibly qualified) field name
	 * @return the parameter name, without the leading colon
	 */
	@NonNull
	static String parameterNameFor(@NonNull String field) {
		requireNonNull(field);
		return PARAMETER_NAME_INVALID_CHARACTERS.matcher(field).replaceAll("_");
	}
}
