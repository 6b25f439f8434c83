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

import java.util.Objects;
import org.locationtech.jts.geom.Envelope;

/**
 * What the sampler learned about a dataset. Row counts reported as negative by the backend are clamped to zero
 * and flagged through {@link #isCountKnown()}.
 */
public final class DatasetStats {

	private final long rowCount;
	private final boolean countKnown;
	private final Envelope extent;
	private final boolean hasNativeSpatialIndex;
	private final String geometryType;
	private final double avgVertexCount;
	private final long sampledAtMillis;

	public DatasetStats(long rowCount, boolean countKnown, Envelope extent, boolean hasNativeSpatialIndex,
			String geometryType, double avgVertexCount, long sampledAtMillis) {
		this.rowCount = Math.max(0, rowCount);
		this.countKnown = countKnown && rowCount >= 0;
		this.extent = extent == null ? null : new Envelope(extent);
		this.hasNativeSpatialIndex = hasNativeSpatialIndex;
		this.geometryType = geometryType == null ? "Unknown" : geometryType;
		this.avgVertexCount = Math.max(0.0, avgVertexCount);
		this.sampledAtMillis = sampledAtMillis;
	}

	/**
	 * Stats for tests and callers that know the row count and nothing else.
	 */
	public static DatasetStats ofRowCount(long rowCount) {
		return new DatasetStats(rowCount, true, null, false, "Unknown", 0.0, 0L);
	}

	public long getRowCount() {
		return rowCount;
	}

	public boolean isCountKnown() {
		return countKnown;
	}

	public Envelope getExtent() {
		return extent == null ? null : new Envelope(extent);
	}

	public boolean hasNativeSpatialIndex() {
		return hasNativeSpatialIndex;
	}

	public String getGeometryType() {
		return geometryType;
	}

	public double getAvgVertexCount() {
		return avgVertexCount;
	}

	public long getSampledAtMillis() {
		return sampledAtMillis;
	}

	/**
	 * Geometry complexity on a scale where 1 is a simple shape, growing by one per ten vertices.
	 */
	public double complexity() {
		return Math.max(1.0, avgVertexCount / 10.0);
	}

	public DatasetStats withNativeSpatialIndex(boolean indexed) {
		return new DatasetStats(rowCount, countKnown, extent, indexed, geometryType, avgVertexCount,
				sampledAtMillis);
	}

	public DatasetStats withAvgVertexCount(double vertices) {
		return new DatasetStats(rowCount, countKnown, extent, hasNativeSpatialIndex, geometryType, vertices,
				sampledAtMillis);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof DatasetStats that)) {
			return false;
		}
		return rowCount == that.rowCount && countKnown == that.countKnown
				&& hasNativeSpatialIndex == that.hasNativeSpatialIndex
				&& Double.compare(avgVertexCount, that.avgVertexCount) == 0
				&& Objects.equals(extent, that.extent) && geometryType.equals(that.geometryType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(rowCount, countKnown, extent, hasNativeSpatialIndex, geometryType, avgVertexCount);
	}

	@Override
	public String toString() {
		return "DatasetStats(rows=" + rowCount + (countKnown ? "" : "?") + ", extent=" + extent + ", indexed="
				+ hasNativeSpatialIndex + ", type=" + geometryType + ", avgVertices=" + avgVertexCount + ")";
	}
}
