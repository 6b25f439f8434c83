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
package org.neo4j.spatial.filter.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.locationtech.jts.geom.Geometry;

/**
 * A single row of a dataset: its id, its geometry (which may be null) and its attribute values.
 */
public class FeatureRecord {

	public static final Set<String> ID_ALIASES = Set.of("fid", "$id", "rowid", "id", "pk");
	public static final Set<String> GEOMETRY_ALIASES = Set.of("geom", "geometry", "the_geom", "wkb_geometry",
			"$geometry", "geom_buffered");

	private final long id;
	private final Geometry geometry;
	private final Map<String, Object> attributes;

	public FeatureRecord(long id, Geometry geometry, Map<String, Object> attributes) {
		this.id = id;
		this.geometry = geometry;
		this.attributes = attributes == null ? Collections.emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}

	public FeatureRecord(long id, Geometry geometry) {
		this(id, geometry, null);
	}

	public long getId() {
		return id;
	}

	public Geometry getGeometry() {
		return geometry;
	}

	public Map<String, Object> getAttributes() {
		return attributes;
	}

	public boolean hasValue(String name) {
		return attributes.containsKey(name) || isIdName(name) || isGeometryName(name);
	}

	/**
	 * Resolves a column name against this record. Attributes win over the id and geometry aliases, so a dataset
	 * with a real attribute called "id" sees that attribute.
	 */
	public Object getValue(String name) {
		if (attributes.containsKey(name)) {
			return attributes.get(name);
		}
		if (isIdName(name)) {
			return id;
		}
		if (isGeometryName(name)) {
			return geometry;
		}
		return null;
	}

	private static boolean isIdName(String name) {
		return ID_ALIASES.contains(name.toLowerCase(Locale.ROOT));
	}

	private static boolean isGeometryName(String name) {
		return GEOMETRY_ALIASES.contains(name.toLowerCase(Locale.ROOT));
	}

	@Override
	public String toString() {
		return "FeatureRecord[" + id + "]" + attributes;
	}
}
