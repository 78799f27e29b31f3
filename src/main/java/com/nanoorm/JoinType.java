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

import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Kinds of join a {@link JoinDescriptor} may render.
 *
 * @since 1.0.0
 */
public enum JoinType {
	INNER,
	LEFT,
	RIGHT;

	/**
	 * Parses a join type name case-insensitively, ignoring surrounding whitespace.
	 *
	 * @param name e.g. {@code "left"}
	 * @return the join type
	 * @throws IllegalArgumentException if {@code name} is not a supported join type
	 */
	@NonNull
	public static JoinType fromName(@NonNull String name) {
		requireNonNull(name);

		String normalizedName = name.trim().toUpperCase(Locale.ENGLISH);

		for (JoinType joinType : values())
			if (joinType.name().equals(normalizedName))
				return joinType;

		throw new IllegalArgumentException(format("Unsupported join type '%s'; expected one of INNER, LEFT, RIGHT", name));
	}

	/**
	 * @return the SQL keyword phrase, e.g. {@code LEFT JOIN}
	 */
	@NonNull
	public String toSql() {
		return format("%s JOIN", name());
	}
}
