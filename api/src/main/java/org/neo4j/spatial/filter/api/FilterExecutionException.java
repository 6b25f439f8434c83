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

/**
 * A filter failed while running against its backend. This is the one error the optimizer never hides.
 */
public class FilterExecutionException extends SpatialFilterException {

	private final String datasetId;

	public FilterExecutionException(String datasetId, String message) {
		super(message);
		this.datasetId = datasetId;
	}

	public FilterExecutionException(String datasetId, String message, Throwable cause) {
		super(message, cause);
		this.datasetId = datasetId;
	}

	public String getDatasetId() {
		return datasetId;
	}
}
