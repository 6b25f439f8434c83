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
 * A node of a parsed filter expression. Every node remembers the exact source text it was parsed from, so that
 * untouched parts of an expression can be written back unchanged.
 */
public abstract class Expression {

	private final String source;
	private final int start;
	private final int end;

	protected Expression(String source, int start, int end) {
		this.source = source;
		this.start = start;
		this.end = end;
	}

	/**
	 * @return the value of this node for the rows bound in the context: Boolean for conditions, null for SQL
	 * unknown
	 */
	public abstract Object evaluate(EvaluationContext context);

	public abstract List<Expression> children();

	public String getSourceText() {
		return source.substring(start, end);
	}

	/**
	 * @return the full text this node was parsed from
	 */
	public String getSource() {
		return source;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	/**
	 * @return true only when the condition evaluates to TRUE, treating unknown as no match
	 */
	public boolean test(EvaluationContext context) {
		return Boolean.TRUE.equals(SqlValues.toBoolean(evaluate(context)));
	}

	/**
	 * @return this node and all nodes below it, depth first
	 */
	public List<Expression> descendants() {
		List<Expression> all = new ArrayList<>();
		collect(this, all);
		return all;
	}

	private static void collect(Expression node, List<Expression> into) {
		into.add(node);
		for (Expression child : node.children()) {
			collect(child, into);
		}
	}

	/**
	 * @return the node inside any number of redundant enclosing parentheses
	 */
	public Expression unwrap() {
		Expression current = this;
		while (current instanceof Parenthesized p) {
			current = p.getInner();
		}
		return current;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + getSourceText() + "]";
	}
}
