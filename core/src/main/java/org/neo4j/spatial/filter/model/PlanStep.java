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
package org.neo4j.spatial.filter.model;

import java.util.Objects;

/**
 * One step of a {@link FilterPlan}. Only attribute filter steps carry an expression.
 */
public final class PlanStep {

	public enum Kind {
		ATTRIBUTE_FILTER,
		BBOX_PREFILTER,
		EXACT_SPATIAL,
		RANGE
	}

	private final Kind kind;
	private final String expression;
	private final long estimatedOutputRows;

	private PlanStep(Kind kind, String expression, long estimatedOutputRows) {
		this.kind = kind;
		this.expression = expression;
		this.estimatedOutputRows = Math.max(0, estimatedOutputRows);
	}

	public static PlanStep attributeFilter(String expression, long estimatedOutputRows) {
		return new PlanStep(Kind.ATTRIBUTE_FILTER, expression, estimatedOutputRows);
	}

	public static PlanStep bboxPrefilter(long estimatedOutputRows) {
		return new PlanStep(Kind.BBOX_PREFILTER, null, estimatedOutputRows);
	}

	public static PlanStep exactSpatial(long estimatedOutputRows) {
		return new PlanStep(Kind.EXACT_SPATIAL, null, estimatedOutputRows);
	}

	public static PlanStep range(long estimatedOutputRows) {
		return new PlanStep(Kind.RANGE, null, estimatedOutputRows);
	}

	public Kind getKind() {
		return kind;
	}

	public String getExpression() {
		return expression;
	}

	public long getEstimatedOutputRows() {
		return estimatedOutputRows;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof PlanStep that)) {
			return false;
		}
		return kind == that.kind && estimatedOutputRows == that.estimatedOutputRows
				&& Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, expression, estimatedOutputRows);
	}

	@Override
	public String toString() {
		return kind + (expression == null ? "" : "{" + expression + "}") + "->" + estimatedOutputRows;
	}
}
