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
import java.util.Locale;

public class FunctionCall extends Expression {

	private final String name;
	private final List<Expression> arguments;

	public FunctionCall(String source, int start, int end, String name, List<Expression> arguments) {
		super(source, start, end);
		this.name = name;
		this.arguments = List.copyOf(arguments);
	}

	public String getName() {
		return name;
	}

	public String getUpperName() {
		return name.toUpperCase(Locale.ROOT);
	}

	public List<Expression> getArguments() {
		return arguments;
	}

	@Override
	public Object evaluate(EvaluationContext context) {
		List<Object> values = new ArrayList<>(arguments.size());
		for (Expression argument : arguments) {
			values.add(argument.evaluate(context));
		}
		return SqlFunctions.call(getUpperName(), values);
	}

	@Override
	public List<Expression> children() {
		return arguments;
	}
}
