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
 * What happened to one dataset in a multi-dataset filter run.
 */
public final class FilterOutcome {

	public enum Status {
		SUCCEEDED,
		FAILED,
		CANCELLED
	}

	private final String datasetId;
	private final Status status;
	private final long matchedRows;
	private final long elapsedMillis;
	private final Throwable error;

	private FilterOutcome(String datasetId, Status status, long matchedRows, long elapsedMillis, Throwable error) {
		this.datasetId = datasetId;
		this.status = status;
		this.matchedRows = matchedRows;
		this.elapsedMillis = elapsedMillis;
		this.error = error;
	}

	public static FilterOutcome succeeded(String datasetId, long matchedRows, long elapsedMillis) {
		return new FilterOutcome(datasetId, Status.SUCCEEDED, matchedRows, elapsedMillis, null);
	}

	public static FilterOutcome failed(String datasetId, Throwable error, long elapsedMillis) {
		return new FilterOutcome(datasetId, Status.FAILED, 0, elapsedMillis, error);
	}

	public static FilterOutcome cancelled(String datasetId) {
		return new FilterOutcome(datasetId, Status.CANCELLED, 0, 0, null);
	}

	public String getDatasetId() {
		return datasetId;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isSuccess() {
		return status == Status.SUCCEEDED;
	}

	public long getMatchedRows() {
		return matchedRows;
	}

	public long getElapsedMillis() {
		return elapsedMillis;
	}

	public Throwable getError() {
		return error;
	}

	@Override
	public String toString() {
		return "FilterOutcome(" + datasetId + ", " + status + ", rows=" + matchedRows + ", " + elapsedMillis + "ms"
				+ (error == null ? "" : ", error=" + error.getMessage()) + ")";
	}
}
