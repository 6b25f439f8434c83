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
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;
import org.neo4j.spatial.filter.model.SpatialPredicate;

/**
 * The spatial and scalar functions the supported backends share, evaluated with JTS. Names are accepted with
 * and without the ST_ prefix.
 */
final class SqlFunctions {

	private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();
	private static final Pattern QUAD_SEGS = Pattern.compile("quad_segs\\s*=\\s*(\\d+)");
	private static final int DEFAULT_QUADRANT_SEGMENTS = 8;

	private SqlFunctions() {
	}

	/**
	 * @throws ExpressionEvaluationException for bad arguments, and for geometry operations JTS cannot perform
	 * on the given inputs
	 */
	static Object call(String upperName, List<Object> args) {
		try {
			return evaluate(upperName, args);
		} catch (IllegalArgumentException | TopologyException e) {
			throw new ExpressionEvaluationException(upperName + " failed: " + e.getMessage(), e);
		}
	}

	private static Object evaluate(String upperName, List<Object> args) {
		SpatialPredicate predicate = SpatialPredicate.fromFunctionName(upperName);
		if (predicate != null) {
			expectArgs(upperName, args, 2, 2);
			if (args.get(0) == null || args.get(1) == null) {
				return null;
			}
			return predicate.evaluate(geometry(upperName, args.get(0)), geometry(upperName, args.get(1)));
		}
		String name = upperName.startsWith("ST_") ? upperName.substring(3) : upperName;
		switch (name) {
			case "GEOMFROMTEXT", "GEOMETRYFROMTEXT" -> {
				expectArgs(upperName, args, 1, 2);
				return args.get(0) == null ? null : parseWkt(args.get(0).toString());
			}
			case "BUILDMBR", "MAKEENVELOPE" -> {
				expectArgs(upperName, args, 4, 5);
				Envelope envelope = new Envelope(number(upperName, args.get(0)), number(upperName, args.get(2)),
						number(upperName, args.get(1)), number(upperName, args.get(3)));
				return GEOMETRY_FACTORY.toGeometry(envelope);
			}
			case "MBRINTERSECTS", "ENVELOPESINTERSECT" -> {
				expectArgs(upperName, args, 2, 2);
				if (args.get(0) == null || args.get(1) == null) {
					return null;
				}
				return geometry(upperName, args.get(0)).getEnvelopeInternal()
						.intersects(geometry(upperName, args.get(1)).getEnvelopeInternal());
			}
			case "ENVELOPE" -> {
				expectArgs(upperName, args, 1, 1);
				return args.get(0) == null ? null : geometry(upperName, args.get(0)).getEnvelope();
			}
			case "BUFFER" -> {
				expectArgs(upperName, args, 2, 3);
				if (args.get(0) == null) {
					return null;
				}
				int segments = args.size() == 3 ? quadrantSegments(args.get(2)) : DEFAULT_QUADRANT_SEGMENTS;
				return geometry(upperName, args.get(0)).buffer(number(upperName, args.get(1)), segments);
			}
			case "SIMPLIFYPRESERVETOPOLOGY" -> {
				expectArgs(upperName, args, 2, 2);
				if (args.get(0) == null) {
					return null;
				}
				return TopologyPreservingSimplifier.simplify(geometry(upperName, args.get(0)),
						number(upperName, args.get(1)));
			}
			case "DWITHIN", "PTDISTWITHIN" -> {
				expectArgs(upperName, args, 3, 3);
				if (args.get(0) == null || args.get(1) == null) {
					return null;
				}
				return geometry(upperName, args.get(0))
						.isWithinDistance(geometry(upperName, args.get(1)), number(upperName, args.get(2)));
			}
			case "ISVALID" -> {
				expectArgs(upperName, args, 1, 1);
				return args.get(0) == null ? null : geometry(upperName, args.get(0)).isValid();
			}
			case "UPPER" -> {
				expectArgs(upperName, args, 1, 1);
				return args.get(0) == null ? null : args.get(0).toString().toUpperCase(Locale.ROOT);
			}
			case "LOWER" -> {
				expectArgs(upperName, args, 1, 1);
				return args.get(0) == null ? null : args.get(0).toString().toLowerCase(Locale.ROOT);
			}
			case "COALESCE" -> {
				for (Object arg : args) {
					if (arg != null) {
						return arg;
					}
				}
				return null;
			}
			default -> throw new ExpressionEvaluationException("Unsupported function: " + upperName);
		}
	}

	private static void expectArgs(String name, List<Object> args, int min, int max) {
		if (args.size() < min || args.size() > max) {
			throw new ExpressionEvaluationException(
					name + " expects " + (min == max ? min : min + " to " + max) + " arguments, got " + args.size());
		}
	}

	private static Geometry geometry(String name, Object value) {
		if (value instanceof Geometry geometry) {
			return geometry;
		}
		if (value instanceof String wkt) {
			return parseWkt(wkt);
		}
		throw new ExpressionEvaluationException(name + " expects a geometry, got " + value);
	}

	private static double number(String name, Object value) {
		Double number = SqlValues.toNumber(value);
		if (number == null) {
			throw new ExpressionEvaluationException(name + " expects a number, got " + value);
		}
		return number;
	}

	private static int quadrantSegments(Object value) {
		if (value instanceof Number n) {
			return n.intValue();
		}
		Matcher matcher = QUAD_SEGS.matcher(String.valueOf(value));
		return matcher.find() ? Integer.parseInt(matcher.group(1)) : DEFAULT_QUADRANT_SEGMENTS;
	}

	private static Geometry parseWkt(String wkt) {
		String text = wkt.trim();
		if (text.regionMatches(true, 0, "SRID=", 0, 5) && text.indexOf(';') > 0) {
			text = text.substring(text.indexOf(';') + 1);
		}
		try {
			return new WKTReader(GEOMETRY_FACTORY).read(text);
		} catch (ParseException e) {
			throw new ExpressionEvaluationException("Invalid WKT: " + wkt, e);
		}
	}
}
