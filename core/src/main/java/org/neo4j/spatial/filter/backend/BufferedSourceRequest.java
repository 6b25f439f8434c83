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
package org.neo4j.spatial.filter.backend;

import java.util.Objects;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.model.SpatialPredicate;

/**
 * The source side of a buffered spatial join on a server backend, and the target geometry it is tested against.
 *
 * @param sourceSchema         schema of the source table
 * @param sourceTable          source table name, unquoted
 * @param keyColumn            key column of the source table, unquoted
 * @param geometryColumn       geometry column of the source table, unquoted
 * @param sourceIds            selected source rows, or null for all rows matching the filter
 * @param sourceFilter         optional attribute filter on the source table
 * @param bufferDistance       buffer distance in layer units
 * @param targetTable          target table as written in the target's filter, for example {@code "public"."parcels"}
 * @param targetGeometryColumn geometry column of the target table, unquoted
 * @param predicate            how target rows relate to the buffered source
 */
public record BufferedSourceRequest(String sourceSchema, String sourceTable, String keyColumn, String geometryColumn,
		IdSet sourceIds, String sourceFilter, double bufferDistance, String targetTable, String targetGeometryColumn,
		SpatialPredicate predicate) {

	public BufferedSourceRequest {
		Objects.requireNonNull(sourceSchema, "sourceSchema");
		Objects.requireNonNull(sourceTable, "sourceTable");
		Objects.requireNonNull(keyColumn, "keyColumn");
		Objects.requireNonNull(geometryColumn, "geometryColumn");
		Objects.requireNonNull(targetTable, "targetTable");
		Objects.requireNonNull(targetGeometryColumn, "targetGeometryColumn");
		if (predicate == null) {
			predicate = SpatialPredicate.INTERSECTS;
		}
		if (Double.isNaN(bufferDistance) || Double.isInfinite(bufferDistance)) {
			throw new IllegalArgumentException("Invalid buffer distance: " + bufferDistance);
		}
	}

	public boolean hasSourceFilter() {
		return sourceFilter != null && !sourceFilter.isBlank();
	}

	public long sourceIdCount() {
		return sourceIds == null ? 0 : sourceIds.size();
	}
}
