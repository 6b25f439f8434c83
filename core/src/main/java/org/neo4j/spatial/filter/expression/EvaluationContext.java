/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [http://neo4j.com]
 *
 * This file is part of Neo4j Spatial.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package org.neo4j.spatial.filter.expression;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.neo4j.spatial.filter.api.FeatureRecord;

/**
 * The rows visible while evaluating an expression. Each subquery level pushes its current row under its alias
 * and table name. Unqualified columns resolve against the innermost row that has them.
 */
public final class EvaluationContext {

	private final TableResolver resolver;
	private final FeatureRecord row;
	private final Set<String> names;
	private final EvaluationContext parent;

	private EvaluationContext(TableResolver resolver, FeatureRecord row, Set<String> names,
			EvaluationContext parent) {
		this.resolver = resolver;
		this.row = row;
		this.names = names;
		this.parent = parent;
	}

	public static EvaluationContext forRow(FeatureRecord row, String... names) {
		return forRow(row, TableResolver.NONE, names);
	}

	public static EvaluationContext forRow(FeatureRecord row, TableResolver resolver, String... names) {
		return new EvaluationContext(resolver, row, normalize(List.of(names)), null);
	}

	public EvaluationContext push(FeatureRecord inner, Collection<String> innerNames) {
		return new EvaluationContext(resolver, inner, normalize(innerNames), this);
	}

	public TableResolver getResolver() {
		return resolver;
	}

	public FeatureRecord getRow() {
		return row;
	}

	Object resolveColumn(String qualifier, String name) {
		if (qualifier != null) {
			String key = qualifier.toLowerCase(Locale.ROOT);
			for (EvaluationContext c = this; c != null; c = c.parent) {
				if (c.names.contains(key)) {
					return c.row.getValue(name);
				}
			}
			throw new ExpressionEvaluationException("Unknown table or alias '" + qualifier + "'");
		}
		for (EvaluationContext c = this; c != null; c = c.parent) {
			if (c.row.hasValue(name)) {
				return c.row.getValue(name);
			}
		}
		return null;
	}

	private static Set<String> normalize(Collection<String> names) {
		return names.stream().map(n -> n.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
	}
}
