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

import java.util.Locale;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;

/**
 * Spatial predicates, read as "feature PREDICATE source".
 */
public enum SpatialPredicate {
	INTERSECTS {
		@Override
		public boolean test(PreparedGeometry source, Geometry feature) {
			return source.intersects(feature);
		}
	},
	WITHIN {
		@Override
		public boolean test(PreparedGeometry source, Geometry feature) {
			return source.contains(feature);
		}
	},
	CONTAINS {
		@Override
		public boolean test(PreparedGeometry source, Geometry feature) {
			return source.within(feature);
		}
	},
	OVERLAPS {
		@Override
		public boolean test(PreparedGeometry source, Geometry feature) {
			return source.overlaps(feature);
		}
	},
	TOUCHES {
		@Override
		public boolean test(PreparedGeometry source, Geometry feature) {
			return source.touches(feature);
		}
	},
	CROSSES {
		@Override
		public boolean test(PreparedGeometry source, Geometry feature) {
			return source.crosses(feature);
		}
	},
	DISJOINT {
		@Override
		public boolean test(PreparedGeometry source, Geometry feature) {
			return source.disjoint(feature);
		}

		@Override
		public boolean requiresEnvelopeOverlap() {
			return false;
		}
	},
	EQUALS {
		@Override
		public boolean test(PreparedGeometry source, Geometry feature) {
			return feature.equalsTopo(source.getGeometry());
		}
	};

	public abstract boolean test(PreparedGeometry source, Geometry feature);

	/**
	 * @return true if no feature outside the source envelope can match, so a bounding box pass is safe
	 */
	public boolean requiresEnvelopeOverlap() {
		return true;
	}

	/**
	 * Evaluates the predicate directly between two geometries, in the order they appear in a function call.
	 */
	public boolean evaluate(Geometry first, Geometry second) {
		return switch (this) {
			case INTERSECTS -> first.intersects(second);
			case WITHIN -> first.within(second);
			case CONTAINS -> first.contains(second);
			case OVERLAPS -> first.overlaps(second);
			case TOUCHES -> first.touches(second);
			case CROSSES -> first.crosses(second);
			case DISJOINT -> first.disjoint(second);
			case EQUALS -> first.equalsTopo(second);
		};
	}

	/**
	 * @return the name of this predicate as a server side function, for example ST_Intersects
	 */
	public String serverFunction() {
		String name = name().toLowerCase(Locale.ROOT);
		return "ST_" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
	}

	/**
	 * Accepts plain names and ST_ prefixed function names in any case.
	 *
	 * @return the matching predicate or null
	 */
	public static SpatialPredicate fromFunctionName(String name) {
		String upper = name.toUpperCase(Locale.ROOT);
		if (upper.startsWith("ST_")) {
			upper = upper.substring(3);
		}
		for (SpatialPredicate predicate : values()) {
			if (predicate.name().equals(upper)) {
				return predicate;
			}
		}
		return null;
	}
}
