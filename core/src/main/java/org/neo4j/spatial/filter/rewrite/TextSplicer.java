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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.neo4j.spatial.filter.expression.Expression;

/**
 * Rebuilds the source text of a parsed node with some of its descendants replaced, leaving every other
 * character exactly as written.
 */
final class TextSplicer {

	private TextSplicer() {
	}

	static String splice(Expression node, Map<Expression, String> replacements) {
		List<Map.Entry<Expression, String>> ordered = new ArrayList<>(replacements.entrySet());
		ordered.sort(Comparator.comparingInt(e -> e.getKey().getStart()));
		String source = node.getSource();
		StringBuilder sb = new StringBuilder();
		int position = node.getStart();
		for (Map.Entry<Expression, String> entry : ordered) {
			Expression replaced = entry.getKey();
			if (replaced.getStart() < position || replaced.getEnd() > node.getEnd()) {
				throw new IllegalArgumentException("Overlapping or foreign replacement: " + replaced);
			}
			sb.append(source, position, replaced.getStart()).append(entry.getValue());
			position = replaced.getEnd();
		}
		sb.append(source, position, node.getEnd());
		return sb.toString();
	}
}
