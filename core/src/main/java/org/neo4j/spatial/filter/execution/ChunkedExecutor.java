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
package org.neo4j.spatial.filter.execution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.neo4j.spatial.filter.api.CancellationToken;
import org.neo4j.spatial.filter.api.FeatureRecord;
import org.neo4j.spatial.filter.api.FilterExecutionException;
import org.neo4j.spatial.filter.api.FilterableDataset;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.monitoring.Listener;
import org.neo4j.spatial.filter.model.FilterPlan;

/**
 * Runs a matcher over a dataset in batches of bounded size, so that memory use does not grow with the dataset.
 * Batches are read in dataset order and cancellation is checked before each one; a batch that has started
 * always completes.
 */
public class ChunkedExecutor {

	private static final Logger LOGGER = Logger.getLogger(ChunkedExecutor.class.getName());

	public ChunkedResult execute(FilterableDataset dataset, FilterPlan plan, IdSet restriction,
			BatchMatcher matcher, Listener listener, CancellationToken cancellation) {
		return execute(dataset, restriction, plan.getChunkSize(), matcher, listener, cancellation);
	}

	/**
	 * @param restriction only these ids are read, or all rows when null
	 * @param chunkSize   rows per batch, zero or less for a single batch
	 * @throws FilterExecutionException if the matcher fails on a batch
	 */
	public ChunkedResult execute(FilterableDataset dataset, IdSet restriction, int chunkSize, BatchMatcher matcher,
			Listener listener, CancellationToken cancellation) {
		int batchSize = chunkSize <= 0 ? Integer.MAX_VALUE : chunkSize;
		TreeSet<Long> matched = new TreeSet<>();
		long processed = 0;
		int batches = 0;
		boolean cancelled = false;
		listener.begin(expectedRows(dataset, restriction));
		try {
			Iterator<FeatureRecord> rows = dataset.features(restriction).iterator();
			while (rows.hasNext()) {
				if (cancellation.isCancelled()) {
					cancelled = true;
					LOGGER.info("Filtering " + dataset.getDatasetId() + " cancelled after " + batches + " batch(es)");
					break;
				}
				List<FeatureRecord> batch = new ArrayList<>(Math.min(batchSize, 10000));
				while (rows.hasNext() && batch.size() < batchSize) {
					batch.add(rows.next());
				}
				matched.addAll(matchBatch(dataset, matcher, batch, batches));
				processed += batch.size();
				batches++;
				listener.worked(batch.size());
			}
		} finally {
			listener.done();
		}
		return new ChunkedResult(IdSet.of(matched), processed, batches, cancelled);
	}

	private static Collection<Long> matchBatch(FilterableDataset dataset, BatchMatcher matcher,
			List<FeatureRecord> batch, int index) {
		try {
			return matcher.match(batch);
		} catch (FilterExecutionException e) {
			throw e;
		} catch (Exception e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new FilterExecutionException(dataset.getDatasetId(),
					"Batch " + index + " of " + dataset.getDatasetId() + " failed: " + e.getMessage(), e);
		}
	}

	private static int expectedRows(FilterableDataset dataset, IdSet restriction) {
		long rows = restriction != null ? restriction.size() : dataset.rowCount();
		return (int) Math.max(0, Math.min(Integer.MAX_VALUE, rows));
	}
}
