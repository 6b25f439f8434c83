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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.CancellationToken;
import org.neo4j.spatial.filter.api.FilterableDataset;
import org.neo4j.spatial.filter.model.FilterOutcome;

/**
 * Applies one operation to several datasets on a bounded pool of worker threads. Outcomes are returned in the
 * order of the input datasets. Batches that cannot safely run concurrently run on the calling thread, one
 * dataset after the other.
 * <p>
 * Running units are never interrupted. A unit past its timeout is reported as failed and left to finish on its
 * worker; units not yet started are skipped.
 */
public class ParallelDispatcher implements AutoCloseable {

	private static final Logger LOGGER = Logger.getLogger(ParallelDispatcher.class.getName());

	private final int workers;
	private final long timeoutMillis;
	private final Object lock = new Object();
	private ExecutorService executor;

	public ParallelDispatcher(OptimizerConfig config) {
		this(config.getEffectiveWorkers(), TimeUnit.SECONDS.toMillis(config.getDatasetTimeoutSeconds()));
	}

	public ParallelDispatcher(int workers, long timeoutMillis) {
		if (workers < 1) {
			throw new IllegalArgumentException("At least one worker is required, got " + workers);
		}
		this.workers = workers;
		this.timeoutMillis = timeoutMillis;
	}

	public int getWorkers() {
		return workers;
	}

	public List<FilterOutcome> filterMany(List<? extends FilterableDataset> datasets, DatasetOperation operation,
			CancellationToken cancellation) {
		if (runsSequentially(datasets)) {
			List<FilterOutcome> outcomes = new ArrayList<>(datasets.size());
			for (FilterableDataset dataset : datasets) {
				outcomes.add(cancellation.isCancelled() ? FilterOutcome.cancelled(dataset.getDatasetId())
						: run(dataset, operation));
			}
			return outcomes;
		}
		ExecutorService pool = executor();
		List<Unit> units = new ArrayList<>(datasets.size());
		for (FilterableDataset dataset : datasets) {
			Unit unit = new Unit(dataset);
			unit.future = pool.submit(() -> {
				if (cancellation.isCancelled()) {
					return FilterOutcome.cancelled(dataset.getDatasetId());
				}
				unit.startedAt.set(System.currentTimeMillis());
				return run(dataset, operation);
			});
			units.add(unit);
		}
		List<FilterOutcome> outcomes = new ArrayList<>(units.size());
		boolean interrupted = false;
		for (Unit unit : units) {
			if (interrupted) {
				unit.future.cancel(false);
				outcomes.add(FilterOutcome.cancelled(unit.dataset.getDatasetId()));
			} else {
				try {
					outcomes.add(await(unit));
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					interrupted = true;
					unit.future.cancel(false);
					outcomes.add(FilterOutcome.cancelled(unit.dataset.getDatasetId()));
				}
			}
		}
		return outcomes;
	}

	/**
	 * True for fewer than two datasets, for backends that cannot be queried concurrently, and for embedded
	 * datasets sharing one database file.
	 */
	public static boolean runsSequentially(List<? extends FilterableDataset> datasets) {
		if (datasets.size() < 2) {
			return true;
		}
		Set<String> embeddedLocations = new HashSet<>();
		for (FilterableDataset dataset : datasets) {
			BackendKind kind = dataset.getBackendKind();
			if (!kind.isConcurrencySafe()) {
				return true;
			}
			if (kind == BackendKind.EMBEDDED_SQL && dataset.getSourceLocation() != null
					&& !embeddedLocations.add(dataset.getSourceLocation())) {
				return true;
			}
		}
		return false;
	}

	private static final class Unit {
		private final FilterableDataset dataset;
		private final AtomicLong startedAt = new AtomicLong();
		private Future<FilterOutcome> future;

		private Unit(FilterableDataset dataset) {
			this.dataset = dataset;
		}
	}

	private FilterOutcome await(Unit unit) throws InterruptedException {
		String datasetId = unit.dataset.getDatasetId();
		while (true) {
			long started = unit.startedAt.get();
			long wait = started == 0 ? timeoutMillis : started + timeoutMillis - System.currentTimeMillis();
			if (wait <= 0) {
				unit.future.cancel(false);
				LOGGER.warning("Filtering " + datasetId + " timed out after " + timeoutMillis + "ms");
				return FilterOutcome.failed(datasetId,
						new TimeoutException("No result within " + timeoutMillis + "ms"), timeoutMillis);
			}
			try {
				return unit.future.get(wait, TimeUnit.MILLISECONDS);
			} catch (TimeoutException e) {
				LOGGER.finest(() -> "Still waiting for " + datasetId);
			} catch (ExecutionException e) {
				return FilterOutcome.failed(datasetId, e.getCause(), 0);
			}
		}
	}

	private static FilterOutcome run(FilterableDataset dataset, DatasetOperation operation) {
		long start = System.currentTimeMillis();
		try {
			long rows = operation.apply(dataset);
			return FilterOutcome.succeeded(dataset.getDatasetId(), rows, System.currentTimeMillis() - start);
		} catch (Exception e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			LOGGER.log(Level.WARNING, "Filtering " + dataset.getDatasetId() + " failed: " + e.getMessage(), e);
			return FilterOutcome.failed(dataset.getDatasetId(), e, System.currentTimeMillis() - start);
		}
	}

	private ExecutorService executor() {
		synchronized (lock) {
			if (executor == null) {
				executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
			}
			return executor;
		}
	}

	@Override
	public void close() {
		synchronized (lock) {
			if (executor != null) {
				executor.shutdownNow();
				executor = null;
			}
		}
	}

	private static final class WorkerThreadFactory implements ThreadFactory {
		private static final AtomicInteger POOL = new AtomicInteger();
		private final int pool = POOL.incrementAndGet();
		private final AtomicInteger thread = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread t = new Thread(runnable, "spatial-filter-" + pool + "-worker-" + thread.incrementAndGet());
			t.setDaemon(true);
			return t;
		}
	}
}
