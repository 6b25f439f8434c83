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
import java.util.regex.Pattern;

/**
 * SQL {@code LIKE} and {@code ILIKE} with the {@code %} and {@code _} wildcards.
 */
public class LikeExpression extends Expression {

	private final Expression operand;
	private final Expression pattern;
	private final boolean caseInsensitive;
	private final boolean negated;

	public LikeExpression(String source, int start, int end, Expression operand, Expression pattern,
			boolean caseInsensitive, boolean negated) {
		super(source, start, end);
		this.operand = operand;
		this.pattern = pattern;
		this.caseInsensitive = caseInsensitive;
		this.negated = negated;
	}

	@Override
	public Object evaluate(EvaluationContext context) {
		Object value = operand.evaluate(context);
		Object like = pattern.evaluate(context);
		if (value == null || like == null) {
			return null;
		}
		boolean matches = toRegex(like.toString()).matcher(value.toString()).matches();
		return negated != matches;
	}

	private Pattern toRegex(String like) {
		StringBuilder regex = new StringBuilder();
		for (char c : like.toCharArray()) {
			switch (c) {
				case '%' -> regex.append(".*");
				case '_' -> regex.append('.');
				default -> regex.append(Pattern.quote(String.valueOf(c)));
			}
		}
		return Pattern.compile(regex.toString(), caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.DOTALL
				: Pattern.DOTALL);
	}

	@Override
	public List<Expression> children() {
		return List.of(operand, pattern);
	}
}
