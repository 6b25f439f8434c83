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

public class IsNullExpression extends Expression {

	private final Expression operand;
	private final boolean negated;

	public IsNullExpression(String source, int start, int end, Expression operand, boolean negated) {
		super(source, start, end);
		this.operand = operand;
		this.negated = negated;
	}

	@Override
	public Object evaluate(EvaluationContext context) {
		return negated != (operand.evaluate(context) == null);
	}

	@Override
	public List<Expression> children() {
		return List.of(operand);
	}
}
