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

/**
 * Estimated fraction of rows matched by the attribute part and the spatial part of a filter request.
 */
public final class SelectivityEstimate {

	private final double attributeSelectivity;
	private final double spatialSelectivity;
	private final String attributeExpression;
	private final boolean spatialFilter;

	public SelectivityEstimate(double attributeSelectivity, double spatialSelectivity, String attributeExpression,
			boolean spatialFilter) {
		this.attributeSelectivity = clamp(attributeSelectivity);
		this.spatialSelectivity = clamp(spatialSelectivity);
		this.attributeExpression = attributeExpression == null || attributeExpression.isBlank() ? null
				: attributeExpression;
		this.spatialFilter = spatialFilter;
	}

	/**
	 * An estimate without the request details. Any selectivity below one is taken to mean the corresponding
	 * filter is present.
	 */
	public static SelectivityEstimate of(double attributeSelectivity, double spatialSelectivity) {
		return new SelectivityEstimate(attributeSelectivity, spatialSelectivity, null, spatialSelectivity < 1.0);
	}

	public double getAttributeSelectivity() {
		return attributeSelectivity;
	}

	public double getSpatialSelectivity() {
		return spatialSelectivity;
	}

	public String getAttributeExpression() {
		return attributeExpression;
	}

	public boolean hasAttributeFilter() {
		return attributeExpression != null || attributeSelectivity < 1.0;
	}

	public boolean hasSpatialFilter() {
		return spatialFilter;
	}

	public double combined() {
		return attributeSelectivity * spatialSelectivity;
	}

	private static double clamp(double value) {
		if (Double.isNaN(value)) {
			return 0.5;
		}
		return Math.max(0.0, Math.min(1.0, value));
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof SelectivityEstimate that)) {
			return false;
		}
		return Double.compare(attributeSelectivity, that.attributeSelectivity) == 0
				&& Double.compare(spatialSelectivity, that.spatialSelectivity) == 0
				&& spatialFilter == that.spatialFilter
				&& java.util.Objects.equals(attributeExpression, that.attributeExpression);
	}

	@Override
	public int hashCode() {
		return java.util.Objects.hash(attributeSelectivity, spatialSelectivity, attributeExpression, spatialFilter);
	}

	@Override
	public String toString() {
		return String.format(java.util.Locale.ENGLISH, "Selectivity(attribute=%.3f, spatial=%.3f)",
				attributeSelectivity, spatialSelectivity);
	}
}
