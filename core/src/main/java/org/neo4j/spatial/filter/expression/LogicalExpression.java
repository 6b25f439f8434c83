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

/**
 * A chain of operands joined by AND or by OR, evaluated left to right with SQL three valued logic.
 */
public class LogicalExpression extends Expression {

	public enum Operator {
		AND,
		OR
	}

	private final Operator operator;
	private final List<Expression> operands;

	public LogicalExpression(String source, int start, int end, Operator operator, List<Expression> operands) {
		super(source, start, end);
		this.operator = operator;
		this.operands = List.copyOf(operands);
	}

	public Operator getOperator() {
		return operator;
	}

	public List<Expression> getOperands() {
		return operands;
	}

	@Override
	public Object evaluate(EvaluationContext context) {
		boolean sawUnknown = false;
		for (Expression operand : operands) {
			Boolean value = SqlValues.toBoolean(operand.evaluate(context));
			if (value == null) {
				sawUnknown = true;
			} else if (operator == Operator.AND && !value) {
				return false;
			} else if (operator == Operator.OR && value) {
				return true;
			}
		}
		if (sawUnknown) {
			return null;
		}
		return operator == Operator.AND;
	}

	@Override
	public List<Expression> children() {
		return operands;
	}
}
