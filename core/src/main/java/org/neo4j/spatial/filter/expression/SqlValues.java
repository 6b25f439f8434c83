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
 * Value semantics shared by the expression nodes: SQL three valued logic, and comparisons that convert between
 * numbers and numeric strings the way the supported backends do.
 */
final class SqlValues {

	private SqlValues() {
	}

	static Boolean toBoolean(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		if (value instanceof Number n) {
			return n.doubleValue() != 0.0;
		}
		if (value instanceof String s) {
			if (s.equalsIgnoreCase("true")) {
				return true;
			}
			if (s.equalsIgnoreCase("false")) {
				return false;
			}
		}
		throw new ExpressionEvaluationException("Not a boolean value: " + value);
	}

	static boolean equal(Object a, Object b) {
		if (a instanceof Number || b instanceof Number) {
			Double x = toNumber(a);
			Double y = toNumber(b);
			if (x != null && y != null) {
				if (a instanceof Long la && b instanceof Long lb) {
					return la.longValue() == lb.longValue();
				}
				return x.doubleValue() == y.doubleValue();
			}
			return false;
		}
		if (a instanceof Geometry ga && b instanceof Geometry gb) {
			return ga.equalsTopo(gb);
		}
		return a.equals(b);
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	static int compare(Object a, Object b) {
		if (a instanceof Number || b instanceof Number) {
			Double x = toNumber(a);
			Double y = toNumber(b);
			if (x == null || y == null) {
				throw new ExpressionEvaluationException("Cannot compare " + a + " with " + b);
			}
			if (a instanceof Long la && b instanceof Long lb) {
				return Long.compare(la, lb);
			}
			return Double.compare(x, y);
		}
		if (a instanceof Comparable ca && a.getClass().isInstance(b)) {
			return ca.compareTo(b);
		}
		throw new ExpressionEvaluationException("Cannot compare " + a + " with " + b);
	}

	static Object membership(Object value, List<Object> candidates, boolean negated) {
		if (value == null) {
			return null;
		}
		boolean sawNull = false;
		for (Object candidate : candidates) {
			if (candidate == null) {
				sawNull = true;
			} else if (equal(value, candidate)) {
				return !negated;
			}
		}
		if (sawNull) {
			return null;
		}
		return negated;
	}

	static Double toNumber(Object value) {
		if (value instanceof Number n) {
			return n.doubleValue();
		}
		if (value instanceof String s) {
			try {
				return Double.parseDouble(s.trim());
			} catch (NumberFormatException e) {
				return null;
			}
		}
		if (value instanceof Boolean b) {
			return b ? 1.0 : 0.0;
		}
		return null;
	}
}
