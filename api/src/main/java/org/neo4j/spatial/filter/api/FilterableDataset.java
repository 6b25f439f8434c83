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

import java.util.List;
import javax.annotation.Nonnull;
import org.locationtech.jts.geom.Envelope;

/**
 * The dataset handle supplied by the host application. The optimizer only reads from it, apart from
 * {@link #executeFilter(String)} which applies a finished expression.
 */
public interface FilterableDataset {

	@Nonnull
	String getDatasetId();

	@Nonnull
	BackendKind getBackendKind();

	/**
	 * @return the number of rows, or a negative number if the backend cannot tell
	 */
	long rowCount();

	/**
	 * @return the extent of all geometries, or null when unknown
	 */
	Envelope extent();

	default boolean hasNativeSpatialIndex() {
		return false;
	}

	default String geometryType() {
		return "Unknown";
	}

	/**
	 * Where the data physically lives, for example the path of an embedded database file. Datasets returning
	 * the same location share a connection and are never filtered concurrently.
	 */
	default String getSourceLocation() {
		return null;
	}

	/**
	 * Returns up to {@code n} rows, preferably a random selection.
	 *
	 * @throws EstimationException if the backend cannot produce a sample
	 */
	List<FeatureRecord> getSample(int n);

	/**
	 * Iterates the rows of this dataset in backend order, restricted to the given id set when it is not null.
	 */
	Iterable<FeatureRecord> features(IdSet restriction);

	/**
	 * Applies the expression as the dataset's filter.
	 *
	 * @return the number of rows matched
	 * @throws FilterExecutionException if the backend rejected the expression
	 */
	long executeFilter(String expression);
}
