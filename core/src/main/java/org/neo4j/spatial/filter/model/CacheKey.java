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

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.neo4j.spatial.filter.api.BackendKind;

/**
 * Identity of a built filter expression. Predicate names are kept sorted so their order does not matter.
 */
public final class CacheKey {

	private final String datasetId;
	private final List<String> predicates;
	private final Double bufferValue;
	private final GeometryFingerprint sourceFingerprint;
	private final BackendKind backend;

	public CacheKey(String datasetId, Iterable<String> predicates, Double bufferValue,
			GeometryFingerprint sourceFingerprint, BackendKind backend) {
		this.datasetId = Objects.requireNonNull(datasetId, "datasetId");
		TreeSet<String> sorted = new TreeSet<>();
		predicates.forEach(sorted::add);
		this.predicates = List.copyOf(sorted);
		this.bufferValue = bufferValue;
		this.sourceFingerprint = Objects.requireNonNull(sourceFingerprint, "sourceFingerprint");
		this.backend = Objects.requireNonNull(backend, "backend");
	}

	public String getDatasetId() {
		return datasetId;
	}

	public List<String> getPredicates() {
		return predicates;
	}

	public Double getBufferValue() {
		return bufferValue;
	}

	public GeometryFingerprint getSourceFingerprint() {
		return sourceFingerprint;
	}

	public BackendKind getBackend() {
		return backend;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CacheKey that)) {
			return false;
		}
		return datasetId.equals(that.datasetId) && predicates.equals(that.predicates)
				&& Objects.equals(bufferValue, that.bufferValue)
				&& sourceFingerprint.equals(that.sourceFingerprint) && backend == that.backend;
	}

	@Override
	public int hashCode() {
		return Objects.hash(datasetId, predicates, bufferValue, sourceFingerprint, backend);
	}

	@Override
	public String toString() {
		return "CacheKey(" + datasetId + ", " + predicates + ", buffer=" + bufferValue + ", "
				+ sourceFingerprint + ", " + backend + ")";
	}
}
