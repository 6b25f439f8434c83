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

import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.expression.ColumnRef;
import org.neo4j.spatial.filter.expression.Expression;

/**
 * A condition that is exactly "the id column is one of these ids", whether written as an equality, an IN list,
 * a BETWEEN, a range with exclusions or an OR of ranges.
 *
 * @param node     the parsed condition
 * @param column   the id column it tests
 * @param ids      the ids it accepts
 * @param rangeForm true when it was written with ranges rather than literal ids
 */
public record IdPredicate(Expression node, ColumnRef column, IdSet ids, boolean rangeForm) {

	/**
	 * @return the id column exactly as written, for example {@code "fid"}
	 */
	public String columnText() {
		return column.getSourceText();
	}
}
