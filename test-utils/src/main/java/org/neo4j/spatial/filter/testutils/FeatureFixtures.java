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
package org.neo4j.spatial.filter.testutils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.neo4j.spatial.filter.api.FeatureRecord;

/**
 * Small synthetic datasets. Ids start at 1 and follow row order, so tests can reason about id ranges.
 */
public final class FeatureFixtures {

	public static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

	public static final String[] CATEGORIES = {"residential", "commercial", "industrial", "park", "water"};

	private FeatureFixtures() {
	}

	/**
	 * Points at integer coordinates of a {@code width} by {@code height} grid, row by row. Each record carries
	 * {@code category} (cycling through {@link #CATEGORIES}), {@code population} (id times ten) and
	 * {@code name}.
	 */
	public static List<FeatureRecord> pointGrid(int width, int height) {
		List<FeatureRecord> records = new ArrayList<>(width * height);
		long id = 1;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				records.add(new FeatureRecord(id, GEOMETRY_FACTORY.createPoint(new Coordinate(x, y)),
						attributes(id)));
				id++;
			}
		}
		return records;
	}

	/**
	 * Unit squares with their lower left corner on the grid points.
	 */
	public static List<FeatureRecord> squareGrid(int width, int height) {
		List<FeatureRecord> records = new ArrayList<>(width * height);
		long id = 1;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				Geometry square = GEOMETRY_FACTORY.toGeometry(new Envelope(x, x + 1, y, y + 1));
				records.add(new FeatureRecord(id, square, attributes(id)));
				id++;
			}
		}
		return records;
	}

	private static Map<String, Object> attributes(long id) {
		Map<String, Object> attributes = new HashMap<>();
		attributes.put("category", CATEGORIES[(int) ((id - 1) % CATEGORIES.length)]);
		attributes.put("population", id * 10);
		attributes.put("name", "feature-" + id);
		return attributes;
	}

	public static FeatureRecord record(long id, String wkt, Map<String, Object> attributes) {
		return new FeatureRecord(id, geometry(wkt), attributes);
	}

	public static Geometry geometry(String wkt) {
		try {
			return new WKTReader(GEOMETRY_FACTORY).read(wkt);
		} catch (ParseException e) {
			throw new IllegalArgumentException("Invalid WKT in fixture: " + wkt, e);
		}
	}

	public static Geometry box(double minX, double minY, double maxX, double maxY) {
		return GEOMETRY_FACTORY.toGeometry(new Envelope(minX, maxX, minY, maxY));
	}

	public static long[] consecutiveIds(long first, int count) {
		long[] ids = new long[count];
		for (int i = 0; i < count; i++) {
			ids[i] = first + i;
		}
		return ids;
	}

	/**
	 * {@code "col" IN (a, b, ...)}.
	 */
	public static String inList(String column, long... ids) {
		StringBuilder sb = new StringBuilder(column).append(" IN (");
		for (int i = 0; i < ids.length; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(ids[i]);
		}
		return sb.append(')').toString();
	}
}
