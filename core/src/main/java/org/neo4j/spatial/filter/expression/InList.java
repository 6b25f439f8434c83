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

import java.util.ArrayList;
import java.util.List;

/**
 * {@code operand [NOT] IN (value, ...)}
 */
public class InList extends Expression {

	private final Expression operand;
	private final List<Expression> values;
	private final boolean negated;

	public InList(String source, int start, int end, Expression operand, List<Expression> values, boolean negated) {
		super(source, start, end);
		this.operand = operand;
		this.values = List.copyOf(values);
		this.negated = negated;
	}

	public Expression getOperand() {
		return operand;
	}

	public List<Expression> getValues() {
		return values;
	}

	public boolean isNegated() {
		return negated;
	}

	@Override
	public Object evaluate(EvaluationContext context) {
		Object value = operand.evaluate(context);
		List<Object> candidates = new ArrayList<>(values.size());
		for (Expression v : values) {
			candidates.add(v.evaluate(context));
		}
		return SqlValues.membership(value, candidates, negated);
	}

	@Override
	public List<Expression> children() {
		List<Expression> children = new ArrayList<>(values.size() + 1);
		children.add(operand);
		children.addAll(values);
		return children;
	}
}
