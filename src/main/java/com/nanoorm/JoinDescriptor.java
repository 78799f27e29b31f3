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
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One table added to a {@link JoinQuery}.
 * <p>
 * The join predicate is {@code <base table>.<localKey> = <alias>.<foreignKey>}. The alias is assigned from the
 * join's position in the chain ({@code j0}, {@code j1}, ...). Selected fields are either {@link #ALL_FIELDS}, which
 * renders {@code <alias>.*}, or named columns, each rendered as {@code <alias>.<field> AS <alias>_<field>}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class JoinDescriptor {
	/**
	 * Marker for "every column of the joined table".
	 */
	@NonNull
	public static final String WILDCARD = "*";
	@NonNull
	public static final List<String> ALL_FIELDS = List.of(WILDCARD);

	@NonNull
	private final String targetTable;
	@NonNull
	private final String localKey;
	@NonNull
	private final String foreignKey;
	@NonNull
	private final JoinType joinType;
	@NonNull
	private final List<String> selectedFields;
	@NonNull
	private final String alias;

	JoinDescriptor(int position,
								 @NonNull String targetTable,
								 @NonNull String localKey,
								 @NonNull String foreignKey,
								 @NonNull JoinType joinType,
								 @NonNull List<@NonNull String> selectedFields) {
		requireNonNull(joinType);
		requireNonNull(selectedFields);

		if (selectedFields.isEmpty())
			throw new IllegalArgumentException(format("No fields selected from joined table '%s'; use %s.ALL_FIELDS for every column",
					targetTable, JoinDescriptor.class.getSimpleName()));

		for (String selectedField : selectedFields)
			if (!WILDCARD.equals(selectedField))
				Identifiers.requireIdentifier(selectedField, "joined field");

		this.targetTable = Identifiers.requireQualifiedIdentifier(targetTable, "join table");
		this.localKey = Identifiers.requireIdentifier(localKey, "join local key");
		this.foreignKey = Identifiers.requireIdentifier(foreignKey, "join foreign key");
		this.joinType = joinType;
		this.selectedFields = List.copyOf(selectedFields);
		this.alias = aliasFor(position);
	}

	/**
	 * The alias given to the join at {@code position} in a chain.
	 *
	 * @param position zero-based position
	 * @return e.g. {@code j0}
	 */
	@NonNull
	public static String aliasFor(int position) {
		if (position < 0)
			throw new IllegalArgumentException("Join position must be >= 0");

		return format("j%d", position);
	}

	public boolean selectsAllFields() {
		return getSelectedFields().contains(WILDCARD);
	}

	@NonNull
	public String getTargetTable() {
		return this.targetTable;
	}

	@NonNull
	public String getLocalKey() {
		return this.localKey;
	}

	@NonNull
	public String getForeignKey() {
		return this.foreignKey;
	}

	@NonNull
	public JoinType getJoinType() {
		return this.joinType;
	}

	@NonNull
	public List<@NonNull String> getSelectedFields() {
		return this.selectedFields;
	}

	@NonNull
	public String getAlias() {
		return this.alias;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof JoinDescriptor))
			return false;

		JoinDescriptor joinDescriptor = (JoinDescriptor) object;

		return Objects.equals(joinDescriptor.getTargetTable(), getTargetTable())
				&& Objects.equals(joinDescriptor.getLocalKey(), getLocalKey())
				&& Objects.equals(joinDescriptor.getForeignKey(), getForeignKey())
				&& joinDescriptor.getJoinType() == getJoinType()
				&& Objects.equals(joinDescriptor.getSelectedFields(), getSelectedFields())
				&& Objects.equals(joinDescriptor.getAlias(), getAlias());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTargetTable(), getLocalKey(), getForeignKey(), getJoinType(), getSelectedFields(), getAlias());
	}

	@Override
	public String toString() {
		return format("%s{%s %s AS %s ON %s = %s, selectedFields=%s}", getClass().getSimpleName(), getJoinType().toSql(),
				getTargetTable(), getAlias(), getLocalKey(), getForeignKey(), getSelectedFields());
	}
}
