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
package org.neo4j.spatial.filter.stats;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.EstimationException;
import org.neo4j.spatial.filter.api.FeatureRecord;
import org.neo4j.spatial.filter.api.FilterableDataset;
import org.neo4j.spatial.filter.model.DatasetStats;

/**
 * Reads row count, extent and geometry complexity from a dataset handle, without relying on server side
 * statistics. Results are cached per dataset id for a limited time.
 */
public class StatsSampler {

	private static final Logger LOGGER = Logger.getLogger(StatsSampler.class.getName());

	private final Object lock = new Object();
	private final Map<String, DatasetStats> cache = new HashMap<>();
	private final long ttlMillis;
	private final int sampleSize;
	private final Clock clock;

	public StatsSampler(OptimizerConfig config) {
		this(config, Clock.systemUTC());
	}

	public StatsSampler(OptimizerConfig config, Clock clock) {
		this.ttlMillis = config.getStatsTtlSeconds() * 1000L;
		this.sampleSize = config.getStatsSampleSize();
		this.clock = clock;
	}

	public DatasetStats sample(FilterableDataset dataset) {
		return sample(dataset, false);
	}

	/**
	 * @param forceRefresh ignore any cached stats for this dataset
	 */
	public DatasetStats sample(FilterableDataset dataset, boolean forceRefresh) {
		String datasetId = dataset.getDatasetId();
		long now = clock.millis();
		if (!forceRefresh) {
			synchronized (lock) {
				DatasetStats cached = cache.get(datasetId);
				if (cached != null && now - cached.getSampledAtMillis() < ttlMillis) {
					return cached;
				}
			}
		}
		DatasetStats stats = collect(dataset, now);
		synchronized (lock) {
			cache.put(datasetId, stats);
		}
		return stats;
	}

	private DatasetStats collect(FilterableDataset dataset, long now) {
		long rawCount;
		try {
			rawCount = dataset.rowCount();
		} catch (RuntimeException e) {
			LOGGER.log(Level.FINE, "Row count unavailable for " + dataset.getDatasetId(), e);
			rawCount = -1;
		}
		boolean countKnown = rawCount >= 0;
		Envelope extent;
		try {
			extent = dataset.extent();
		} catch (RuntimeException e) {
			LOGGER.log(Level.FINE, "Extent unavailable for " + dataset.getDatasetId(), e);
			extent = null;
		}
		double avgVertices = 0.0;
		try {
			avgVertices = averageVertexCount(dataset);
		} catch (EstimationException e) {
			LOGGER.fine("Complexity sampling failed for " + dataset.getDatasetId() + ": " + e.getMessage());
		}
		DatasetStats stats = new DatasetStats(rawCount, countKnown, extent, dataset.hasNativeSpatialIndex(),
				dataset.geometryType(), avgVertices, now);
		if (!countKnown) {
			LOGGER.fine(() -> "Backend reported no usable row count for " + dataset.getDatasetId());
		}
		return stats;
	}

	private double averageVertexCount(FilterableDataset dataset) {
		List<FeatureRecord> sample;
		try {
			sample = dataset.getSample(sampleSize);
		} catch (EstimationException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new EstimationException("Sampling failed for " + dataset.getDatasetId(), e);
		}
		long vertices = 0;
		int geometries = 0;
		for (FeatureRecord record : sample) {
			if (geometries >= sampleSize) {
				break;
			}
			Geometry geometry = record.getGeometry();
			if (geometry != null && !geometry.isEmpty()) {
				vertices += geometry.getNumPoints();
				geometries++;
			}
		}
		return geometries == 0 ? 0.0 : (double) vertices / geometries;
	}

	public void invalidate(String datasetId) {
		synchronized (lock) {
			cache.remove(datasetId);
		}
	}

	public void clear() {
		synchronized (lock) {
			cache.clear();
		}
	}

	public int cachedCount() {
		synchronized (lock) {
			return cache.size();
		}
	}
}
