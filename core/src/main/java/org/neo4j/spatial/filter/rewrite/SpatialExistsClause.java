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
package org.neo4j.spatial.filter.rewrite;

import java.util.List;
import org.neo4j.spatial.filter.expression.ColumnRef;
import org.neo4j.spatial.filter.expression.Expression;
import org.neo4j.spatial.filter.expression.ExistsExpression;

/**
 * {@code EXISTS (SELECT 1 FROM source AS alias WHERE ...)} whose condition contains a spatial predicate.
 *
 * @param node       the parsed EXISTS
 * @param predicates the spatial predicate calls and bbox operators found in the condition
 * @param outerRefs  column references that point outside the subquery, at the filtered dataset
 * @param innerNames lower case aliases and table names declared inside the subquery
 */
public record SpatialExistsClause(ExistsExpression node, List<Expression> predicates, List<ColumnRef> outerRefs,
		List<String> innerNames) {
}
