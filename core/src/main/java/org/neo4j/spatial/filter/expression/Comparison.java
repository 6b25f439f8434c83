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

import java.util.List;
import org.locationtech.jts.geom.Geometry;

/**
 * A binary comparison, including the {@code &&} bounding box overlap operator.
 */
public class Comparison extends Expression {

	private final String operator;
	private final Expression left;
	private final Expression right;

	public Comparison(String source, int start, int end, String operator, Expression left, Expression right) {
		super(source, start, end);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public String getOperator() {
		return operator;
	}

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public Object evaluate(EvaluationContext context) {
		Object l = left.evaluate(context);
		Object r = right.evaluate(context);
		if (l == null || r == null) {
			return null;
		}
		if (operator.equals("&&")) {
			if (!(l instanceof Geometry lg) || !(r instanceof Geometry rg)) {
				throw new ExpressionEvaluationException("Operator && needs two geometries: " + getSourceText());
			}
			return lg.getEnvelopeInternal().intersects(rg.getEnvelopeInternal());
		}
		if (operator.equals("=")) {
			return SqlValues.equal(l, r);
		}
		if (operator.equals("<>") || operator.equals("!=")) {
			return !SqlValues.equal(l, r);
		}
		int c = SqlValues.compare(l, r);
		return switch (operator) {
			case "<" -> c < 0;
			case "<=" -> c <= 0;
			case ">" -> c > 0;
			case ">=" -> c >= 0;
			default -> throw new ExpressionEvaluationException("Unsupported comparison operator: " + operator);
		};
	}

	@Override
	public List<Expression> children() {
		return List.of(left, right);
	}
}
