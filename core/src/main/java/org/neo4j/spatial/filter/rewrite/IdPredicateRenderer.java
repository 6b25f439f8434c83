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
import java.util.List;
import java.util.StringJoiner;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.IdRange;
import org.neo4j.spatial.filter.api.IdSet;

/**
 * Writes an {@link IdSet} as a literal id predicate. The output never contains a subquery, so it is valid for
 * every backend including flat files.
 */
public class IdPredicateRenderer {

	private final OptimizerConfig config;
	private final BackendKind backend;

	public IdPredicateRenderer(OptimizerConfig config, BackendKind backend) {
		this.config = config;
		this.backend = backend;
	}

	/**
	 * @return a double quoted identifier
	 */
	public static String quote(String identifier) {
		return "\"" + identifier.replace("\"", "\"\"") + "\"";
	}

	/**
	 * Chooses the cheapest literal form: equality for one id, an IN list up to the inline limit, then a range
	 * with exclusions, then an OR of consecutive runs, and an IN list when nothing compresses well.
	 *
	 * @param column the id column as it should appear in the output, already quoted where needed
	 */
	public String render(String column, IdSet ids) {
		if (ids.isEmpty()) {
			return matchNothing(column);
		}
		if (ids.isCompressed()) {
			return renderCompressed(column, ids);
		}
		long[] sorted = ids.toIdArray();
		if (sorted.length == 1) {
			return column + " = " + sorted[0];
		}
		if (sorted.length <= config.getMaxInlineIds()) {
			return inList(column, sorted, false);
		}
		IdSet compressed = IdSet.compress(sorted, config.getRangeMinIds(), config.getRangeMinCoverage());
		if (compressed.isCompressed()) {
			return renderCompressed(column, compressed);
		}
		List<IdRange> runs = IdSet.runs(sorted);
		if (runs.size() < sorted.length / 3) {
			return "(" + renderRuns(column, runs) + ")";
		}
		return inList(column, sorted, false);
	}

	/**
	 * Writes compressed ranges as {@code (col >= a AND col <= b AND col NOT IN (...))}, joining several ranges
	 * with OR.
	 */
	public String renderCompressed(String column, IdSet ids) {
		if (ids.isEmpty()) {
			return matchNothing(column);
		}
		if (!ids.isCompressed()) {
			return inList(column, ids.toIdArray(), false);
		}
		long[] exclusions = ids.getExclusions();
		List<IdRange> ranges = ids.getRanges();
		if (ranges.size() > 1) {
			String union = renderRuns(column, ranges);
			if (exclusions.length == 0) {
				return "(" + union + ")";
			}
			return "((" + union + ") AND " + inList(column, exclusions, true) + ")";
		}
		IdRange range = ranges.get(0);
		StringBuilder sb = new StringBuilder("(");
		sb.append(column).append(" >= ").append(range.min()).append(" AND ").append(column).append(" <= ")
				.append(range.max());
		if (exclusions.length > 0) {
			sb.append(" AND ").append(inList(column, exclusions, true));
		}
		return sb.append(")").toString();
	}

	private String renderRuns(String column, List<IdRange> runs) {
		List<String> parts = new ArrayList<>(runs.size());
		for (IdRange run : runs) {
			if (run.min() == run.max()) {
				parts.add(column + " = " + run.min());
			} else {
				parts.add("(" + column + " >= " + run.min() + " AND " + column + " <= " + run.max() + ")");
			}
		}
		return String.join(" OR ", parts);
	}

	private static String inList(String column, long[] ids, boolean negated) {
		StringJoiner joiner = new StringJoiner(", ", column + (negated ? " NOT IN (" : " IN ("), ")");
		for (long id : ids) {
			joiner.add(Long.toString(id));
		}
		return joiner.toString();
	}

	/**
	 * A predicate that is false for every row. Flat file grammars get an impossible id.
	 */
	public String matchNothing(String column) {
		return switch (backend) {
			case FLAT_FILE -> column + " = -1";
			case SERVER_SQL -> "FALSE";
			default -> "0 = 1";
		};
	}
}
