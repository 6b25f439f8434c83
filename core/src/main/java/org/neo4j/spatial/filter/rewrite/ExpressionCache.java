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
package org.neo4j.spatial.filter.rewrite;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.neo4j.spatial.filter.model.CacheKey;
import org.neo4j.spatial.filter.model.OptimizationKind;

/**
 * Least recently used cache of built filter expressions, guarded by one lock. A builder runs outside the lock
 * and at most once per key: concurrent callers asking for a key that is being built wait for that build.
 * Owned by whoever constructs it, there is no shared instance.
 */
public class ExpressionCache {

	private static final Logger LOGGER = Logger.getLogger(ExpressionCache.class.getName());

	public static final int DEFAULT_MAX_ENTRIES = 100;

	/**
	 * A built expression with the time it was built. Entries created by the combined rewriter also record which
	 * optimization produced them.
	 */
	public record CacheEntry(String expression, long createdAtMillis, OptimizationKind kind, double speedup,
			String detail) {

		public CacheEntry {
			Objects.requireNonNull(expression, "expression");
		}
	}

	public record Statistics(int size, long hits, long misses, long evictions, long invalidations) {
	}

	private final Object lock = new Object();
	private final int maxEntries;
	private final Clock clock;
	private final LinkedHashMap<CacheKey, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
	private final Map<CacheKey, CompletableFuture<CacheEntry>> building = new HashMap<>();
	private long hits;
	private long misses;
	private long evictions;
	private long invalidations;

	public ExpressionCache() {
		this(DEFAULT_MAX_ENTRIES, Clock.systemUTC());
	}

	public ExpressionCache(int maxEntries, Clock clock) {
		if (maxEntries < 1) {
			throw new IllegalArgumentException("Cache must allow at least one entry: " + maxEntries);
		}
		this.maxEntries = maxEntries;
		this.clock = clock;
	}

	/**
	 * Returns the cached expression for the key, building and caching it on a miss.
	 */
	public String getOrBuild(CacheKey key, Supplier<String> builder) {
		return getOrBuildEntry(key,
				() -> new CacheEntry(builder.get(), clock.millis(), OptimizationKind.NONE, 1.0, null)).expression();
	}

	public CacheEntry getOrBuildEntry(CacheKey key, Supplier<CacheEntry> builder) {
		CompletableFuture<CacheEntry> future;
		boolean owner = false;
		synchronized (lock) {
			CacheEntry entry = entries.get(key);
			if (entry != null) {
				hits++;
				return entry;
			}
			future = building.get(key);
			if (future == null) {
				future = new CompletableFuture<>();
				building.put(key, future);
				owner = true;
				misses++;
			} else {
				hits++;
			}
		}
		if (!owner) {
			return await(future);
		}
		CacheEntry built;
		try {
			built = Objects.requireNonNull(builder.get(), "builder returned null");
		} catch (RuntimeException e) {
			synchronized (lock) {
				building.remove(key, future);
			}
			future.completeExceptionally(e);
			throw e;
		}
		synchronized (lock) {
			// an invalidation during the build removed our marker, the result must not be cached
			if (building.remove(key, future)) {
				entries.put(key, built);
				evictOverflow();
			}
		}
		future.complete(built);
		return built;
	}

	private static CacheEntry await(CompletableFuture<CacheEntry> future) {
		try {
			return future.join();
		} catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException cause) {
				throw cause;
			}
			throw e;
		}
	}

	private void evictOverflow() {
		Iterator<CacheKey> eldest = entries.keySet().iterator();
		while (entries.size() > maxEntries && eldest.hasNext()) {
			CacheKey key = eldest.next();
			eldest.remove();
			evictions++;
			LOGGER.finest(() -> "Evicted expression for " + key);
		}
	}

	public Optional<CacheEntry> get(CacheKey key) {
		synchronized (lock) {
			CacheEntry entry = entries.get(key);
			if (entry == null) {
				misses++;
			} else {
				hits++;
			}
			return Optional.ofNullable(entry);
		}
	}

	public void put(CacheKey key, String expression) {
		put(key, new CacheEntry(expression, clock.millis(), OptimizationKind.NONE, 1.0, null));
	}

	public void put(CacheKey key, CacheEntry entry) {
		synchronized (lock) {
			building.remove(key);
			entries.put(key, entry);
			evictOverflow();
		}
	}

	/**
	 * Removes every entry built for the dataset, including any build still in progress.
	 *
	 * @return the number of entries removed
	 */
	public int invalidateDataset(String datasetId) {
		return invalidateWhere(key -> key.getDatasetId().equals(datasetId), entry -> false);
	}

	/**
	 * Removes every entry whose expression text matches, for example all expressions that reference a dropped
	 * materialized result.
	 */
	public int invalidateExpressions(Predicate<String> expressionMatcher) {
		return invalidateWhere(key -> false, entry -> expressionMatcher.test(entry.expression()));
	}

	private int invalidateWhere(Predicate<CacheKey> keyMatcher, Predicate<CacheEntry> entryMatcher) {
		synchronized (lock) {
			int before = entries.size();
			entries.entrySet().removeIf(e -> keyMatcher.test(e.getKey()) || entryMatcher.test(e.getValue()));
			building.keySet().removeIf(keyMatcher);
			int removed = before - entries.size();
			invalidations += removed;
			return removed;
		}
	}

	public void clear() {
		synchronized (lock) {
			invalidations += entries.size();
			entries.clear();
			building.clear();
		}
	}

	public int size() {
		synchronized (lock) {
			return entries.size();
		}
	}

	public Statistics getStatistics() {
		synchronized (lock) {
			return new Statistics(entries.size(), hits, misses, evictions, invalidations);
		}
	}
}
