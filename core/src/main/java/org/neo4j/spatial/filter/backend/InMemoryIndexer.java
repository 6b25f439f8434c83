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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;
import org.neo4j.spatial.filter.api.FeatureRecord;
import org.neo4j.spatial.filter.api.FilterExecutionException;
import org.neo4j.spatial.filter.api.FilterableDataset;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.model.SpatialPredicate;

/**
 * Spatial selection over datasets held in memory. A packed R-tree and an id to geometry map are built on first
 * use of a dataset and kept until {@link #clearCache(String)}.
 */
public class InMemoryIndexer {

	private static final Logger LOGGER = Logger.getLogger(InMemoryIndexer.class.getName());

	private static final class DatasetIndex {
		private final STRtree tree = new STRtree();
		private final Map<Long, Geometry> geometries = new HashMap<>();
		private int skipped;
	}

	private final Object lock = new Object();
	private final Map<String, DatasetIndex> indexes = new HashMap<>();

	/**
	 * Selects the ids of features that match at least one of the predicates against the source geometry.
	 *
	 * @param restriction only consider these ids, or null for all features
	 * @return the matching ids in ascending order
	 * @throws FilterExecutionException if a predicate cannot be computed for the source geometry
	 */
	public IdSet select(FilterableDataset dataset, Geometry source, Collection<SpatialPredicate> predicates,
			IdSet restriction) {
		if (source == null || source.isEmpty() || predicates.isEmpty()) {
			return IdSet.empty();
		}
		DatasetIndex index = indexFor(dataset);
		boolean envelopeOnly = predicates.stream().allMatch(SpatialPredicate::requiresEnvelopeOverlap);
		Collection<Long> candidates = envelopeOnly ? candidates(index, source.getEnvelopeInternal())
				: index.geometries.keySet();
		PreparedGeometry prepared = PreparedGeometryFactory.prepare(source);
		List<Long> matches = new ArrayList<>();
		for (Long id : candidates) {
			if (restriction != null && !restriction.contains(id)) {
				continue;
			}
			Geometry geometry = index.geometries.get(id);
			for (SpatialPredicate predicate : predicates) {
				if (test(dataset, predicate, prepared, id, geometry)) {
					matches.add(id);
					break;
				}
			}
		}
		return IdSet.of(matches);
	}

	private static boolean test(FilterableDataset dataset, SpatialPredicate predicate, PreparedGeometry source,
			long id, Geometry geometry) {
		try {
			return predicate.test(source, geometry);
		} catch (IllegalArgumentException | TopologyException e) {
			throw new FilterExecutionException(dataset.getDatasetId(), predicate + " of feature " + id + " in "
					+ dataset.getDatasetId() + " failed: " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Collection<Long> candidates(DatasetIndex index, Envelope envelope) {
		return (List<Long>) index.tree.query(envelope);
	}

	private DatasetIndex indexFor(FilterableDataset dataset) {
		synchronized (lock) {
			DatasetIndex index = indexes.get(dataset.getDatasetId());
			if (index == null) {
				index = build(dataset);
				indexes.put(dataset.getDatasetId(), index);
			}
			return index;
		}
	}

	private static DatasetIndex build(FilterableDataset dataset) {
		DatasetIndex index = new DatasetIndex();
		for (FeatureRecord record : dataset.features(null)) {
			Geometry geometry = record.getGeometry();
			if (geometry == null || geometry.isEmpty() || !geometry.isValid()) {
				index.skipped++;
				continue;
			}
			index.tree.insert(geometry.getEnvelopeInternal(), record.getId());
			index.geometries.put(record.getId(), geometry);
		}
		// build now, later queries only read the tree
		index.tree.build();
		LOGGER.fine(() -> "Indexed " + index.geometries.size() + " features of " + dataset.getDatasetId()
				+ (index.skipped > 0 ? ", skipped " + index.skipped + " without a usable geometry" : ""));
		return index;
	}

	public int indexedFeatureCount(String datasetId) {
		synchronized (lock) {
			DatasetIndex index = indexes.get(datasetId);
			return index == null ? 0 : index.geometries.size();
		}
	}

	public boolean clearCache(String datasetId) {
		synchronized (lock) {
			return indexes.remove(datasetId) != null;
		}
	}

	public void clearAll() {
		synchronized (lock) {
			indexes.clear();
		}
	}

	public int cachedDatasetCount() {
		synchronized (lock) {
			return indexes.size();
		}
	}
}
