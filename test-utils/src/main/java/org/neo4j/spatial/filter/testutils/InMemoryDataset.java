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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.EstimationException;
import org.neo4j.spatial.filter.api.FeatureRecord;
import org.neo4j.spatial.filter.api.FilterExecutionException;
import org.neo4j.spatial.filter.api.FilterableDataset;
import org.neo4j.spatial.filter.api.IdSet;

/**
 * A dataset backed by a list of records, pretending to be any backend kind. Filter expressions are turned into
 * row predicates by a compiler supplied by the test.
 */
public class InMemoryDataset implements FilterableDataset {

	private final String datasetId;
	private final BackendKind backendKind;
	private final List<FeatureRecord> records;
	private final List<String> executed = new CopyOnWriteArrayList<>();
	private final AtomicInteger sampleCalls = new AtomicInteger();
	private Long reportedRowCount;
	private Envelope reportedExtent;
	private boolean nativeSpatialIndex;
	private String geometryType = "Unknown";
	private String sourceLocation;
	private Function<String, Predicate<FeatureRecord>> filterCompiler;
	private boolean failSampling;
	private long executeDelayMillis;

	public InMemoryDataset(String datasetId, BackendKind backendKind, List<FeatureRecord> records) {
		this.datasetId = datasetId;
		this.backendKind = backendKind;
		this.records = new ArrayList<>(records);
	}

	public InMemoryDataset withRowCount(long rowCount) {
		this.reportedRowCount = rowCount;
		return this;
	}

	public InMemoryDataset withExtent(Envelope extent) {
		this.reportedExtent = extent;
		return this;
	}

	public InMemoryDataset withNativeSpatialIndex(boolean indexed) {
		this.nativeSpatialIndex = indexed;
		return this;
	}

	public InMemoryDataset withGeometryType(String type) {
		this.geometryType = type;
		return this;
	}

	public InMemoryDataset withSourceLocation(String location) {
		this.sourceLocation = location;
		return this;
	}

	public InMemoryDataset withFilterCompiler(Function<String, Predicate<FeatureRecord>> compiler) {
		this.filterCompiler = compiler;
		return this;
	}

	public InMemoryDataset failingSamples() {
		this.failSampling = true;
		return this;
	}

	public InMemoryDataset withExecuteDelay(long millis) {
		this.executeDelayMillis = millis;
		return this;
	}

	@Nonnull
	@Override
	public String getDatasetId() {
		return datasetId;
	}

	@Nonnull
	@Override
	public BackendKind getBackendKind() {
		return backendKind;
	}

	@Override
	public long rowCount() {
		return reportedRowCount != null ? reportedRowCount : records.size();
	}

	@Override
	public Envelope extent() {
		if (reportedExtent != null) {
			return reportedExtent;
		}
		Envelope extent = new Envelope();
		for (FeatureRecord record : records) {
			Geometry geometry = record.getGeometry();
			if (geometry != null) {
				extent.expandToInclude(geometry.getEnvelopeInternal());
			}
		}
		return extent.isNull() ? null : extent;
	}

	@Override
	public boolean hasNativeSpatialIndex() {
		return nativeSpatialIndex;
	}

	@Override
	public String geometryType() {
		return geometryType;
	}

	@Override
	public String getSourceLocation() {
		return sourceLocation;
	}

	@Override
	public List<FeatureRecord> getSample(int n) {
		sampleCalls.incrementAndGet();
		if (failSampling) {
			throw new EstimationException("Sampling disabled for " + datasetId);
		}
		return Collections.unmodifiableList(records.subList(0, Math.min(n, records.size())));
	}

	@Override
	public Iterable<FeatureRecord> features(IdSet restriction) {
		if (restriction == null) {
			return Collections.unmodifiableList(records);
		}
		List<FeatureRecord> selected = new ArrayList<>();
		for (FeatureRecord record : records) {
			if (restriction.contains(record.getId())) {
				selected.add(record);
			}
		}
		return selected;
	}

	@Override
	public long executeFilter(String expression) {
		executed.add(expression);
		if (executeDelayMillis > 0) {
			try {
				Thread.sleep(executeDelayMillis);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new FilterExecutionException(datasetId, "Interrupted while filtering", e);
			}
		}
		if (filterCompiler == null) {
			throw new FilterExecutionException(datasetId, "No filter compiler for " + datasetId);
		}
		Predicate<FeatureRecord> predicate;
		try {
			predicate = filterCompiler.apply(expression);
		} catch (RuntimeException e) {
			throw new FilterExecutionException(datasetId, "Rejected expression: " + expression, e);
		}
		return records.stream().filter(predicate).count();
	}

	/**
	 * @return the ids of the records matching the predicate, in ascending order
	 */
	public List<Long> matchingIds(Predicate<FeatureRecord> predicate) {
		List<Long> ids = new ArrayList<>();
		for (FeatureRecord record : records) {
			if (predicate.test(record)) {
				ids.add(record.getId());
			}
		}
		Collections.sort(ids);
		return ids;
	}

	public List<FeatureRecord> getRecords() {
		return Collections.unmodifiableList(records);
	}

	public List<String> getExecutedExpressions() {
		return executed;
	}

	public int getSampleCalls() {
		return sampleCalls.get();
	}
}
