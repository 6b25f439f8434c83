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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.neo4j.spatial.filter.api.MaterializationException;
import org.neo4j.spatial.filter.model.MaterializedResultRef;

/**
 * Tracks the materialized results created on behalf of each session. Readers take a {@link Lease} while they
 * use a result, and a result retired by {@link #cleanupSession(String)} is only dropped once no lease remains,
 * so cleanup can run concurrently with filters still reading the result.
 */
public class SessionRegistry {

	private static final Logger LOGGER = Logger.getLogger(SessionRegistry.class.getName());

	/**
	 * Physically removes a result from its backend.
	 */
	@FunctionalInterface
	public interface ResultDropper {
		void drop(MaterializedResultRef ref);
	}

	private enum State {
		ACTIVE, RETIRED
	}

	private static final class Entry {
		private final MaterializedResultRef ref;
		private State state = State.ACTIVE;
		private int leases;
		private boolean dropping;

		private Entry(MaterializedResultRef ref) {
			this.ref = ref;
		}
	}

	/**
	 * A read claim on a materialized result. Closing the last lease of a retired result drops it.
	 */
	public final class Lease implements AutoCloseable {
		private final Entry entry;
		private boolean closed;

		private Lease(Entry entry) {
			this.entry = entry;
		}

		public MaterializedResultRef getRef() {
			return entry.ref;
		}

		@Override
		public void close() {
			boolean drop;
			synchronized (lock) {
				if (closed) {
					return;
				}
				closed = true;
				entry.leases--;
				drop = readyToDrop(entry);
			}
			if (drop) {
				tryDrop(entry);
			}
		}
	}

	/**
	 * The leases taken for one expression, closed together.
	 */
	public static final class Leases implements AutoCloseable {
		private static final Leases NONE = new Leases(List.of());

		private final List<Lease> leases;

		private Leases(List<Lease> leases) {
			this.leases = leases;
		}

		public static Leases none() {
			return NONE;
		}

		public int size() {
			return leases.size();
		}

		@Override
		public void close() {
			for (Lease lease : leases) {
				lease.close();
			}
		}
	}

	public static final int DEFAULT_MAX_RETIRED_NAMES = 10000;

	private final Object lock = new Object();
	private final Map<String, Entry> entries = new LinkedHashMap<>();
	private final Set<String> retiredNames;
	private final ResultDropper dropper;

	public SessionRegistry(ResultDropper dropper) {
		this(dropper, DEFAULT_MAX_RETIRED_NAMES);
	}

	/**
	 * @param maxRetiredNames how many names of retired results are remembered for {@link #isRetired(String)},
	 *                        oldest forgotten first
	 */
	public SessionRegistry(ResultDropper dropper, int maxRetiredNames) {
		if (maxRetiredNames < 1) {
			throw new IllegalArgumentException("maxRetiredNames must be positive, got " + maxRetiredNames);
		}
		this.dropper = dropper;
		this.retiredNames = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>(16, 0.75f, false) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
				return size() > maxRetiredNames;
			}
		});
	}

	public void register(MaterializedResultRef ref) {
		synchronized (lock) {
			if (entries.containsKey(ref.qualifiedName())) {
				throw new MaterializationException("Materialized result already registered: " + ref.qualifiedName());
			}
			entries.put(ref.qualifiedName(), new Entry(ref));
		}
	}

	/**
	 * @throws MaterializationException if the result is unknown or its session was cleaned up
	 */
	public Lease acquire(MaterializedResultRef ref) {
		synchronized (lock) {
			Entry entry = entries.get(ref.qualifiedName());
			if (entry == null || entry.state != State.ACTIVE) {
				throw new MaterializationException("Materialized result " + ref.qualifiedName()
						+ " is no longer available");
			}
			entry.leases++;
			return new Lease(entry);
		}
	}

	/**
	 * Leases every active result whose qualified name appears in the expression, so that a concurrent
	 * {@link #cleanupSession(String)} defers dropping them until the returned leases are closed.
	 *
	 * @throws MaterializationException if the expression reads a result whose session was cleaned up
	 */
	public Leases acquireReferenced(String expression) {
		if (expression == null || expression.isEmpty()) {
			return Leases.none();
		}
		List<Lease> leases = new ArrayList<>();
		synchronized (lock) {
			for (String name : retiredNames) {
				if (expression.contains(name)) {
					throw new MaterializationException("Materialized result " + name + " is no longer available");
				}
			}
			for (Entry entry : entries.values()) {
				if (entry.state == State.ACTIVE && expression.contains(entry.ref.qualifiedName())) {
					entry.leases++;
					leases.add(new Lease(entry));
				}
			}
		}
		return leases.isEmpty() ? Leases.none() : new Leases(leases);
	}

	public boolean isActive(MaterializedResultRef ref) {
		synchronized (lock) {
			Entry entry = entries.get(ref.qualifiedName());
			return entry != null && entry.state == State.ACTIVE;
		}
	}

	/**
	 * @return true if a result of this name existed and its session has been cleaned up
	 */
	public boolean isRetired(String qualifiedName) {
		synchronized (lock) {
			return retiredNames.contains(qualifiedName);
		}
	}

	public List<MaterializedResultRef> getResults(String sessionId) {
		List<MaterializedResultRef> results = new ArrayList<>();
		synchronized (lock) {
			for (Entry entry : entries.values()) {
				if (entry.ref.sessionId().equals(sessionId)) {
					results.add(entry.ref);
				}
			}
		}
		return results;
	}

	/**
	 * Retires every active result of the session. Unleased results are dropped immediately, leased ones when
	 * their last lease closes. Retired results whose earlier drop failed are retried.
	 *
	 * @return the number of results retired by this call
	 */
	public int cleanupSession(String sessionId) {
		int retired = 0;
		List<Entry> toDrop = new ArrayList<>();
		synchronized (lock) {
			for (Entry entry : entries.values()) {
				if (!entry.ref.sessionId().equals(sessionId)) {
					continue;
				}
				if (entry.state == State.ACTIVE) {
					entry.state = State.RETIRED;
					retiredNames.add(entry.ref.qualifiedName());
					retired++;
				}
				if (readyToDrop(entry)) {
					toDrop.add(entry);
				}
			}
		}
		for (Entry entry : toDrop) {
			tryDrop(entry);
		}
		if (retired > 0) {
			LOGGER.info("Retired " + retired + " materialized result(s) of session " + sessionId);
		}
		return retired;
	}

	/**
	 * Retires all sessions, for shutdown.
	 */
	public int cleanupAll() {
		List<String> sessions = new ArrayList<>();
		synchronized (lock) {
			for (Entry entry : entries.values()) {
				if (!sessions.contains(entry.ref.sessionId())) {
					sessions.add(entry.ref.sessionId());
				}
			}
		}
		int retired = 0;
		for (String session : sessions) {
			retired += cleanupSession(session);
		}
		return retired;
	}

	/**
	 * @return results still known to the registry, including retired results not yet dropped
	 */
	public int trackedCount() {
		synchronized (lock) {
			return entries.size();
		}
	}

	public int activeCount(String sessionId) {
		synchronized (lock) {
			return (int) entries.values().stream()
					.filter(e -> e.state == State.ACTIVE && e.ref.sessionId().equals(sessionId)).count();
		}
	}

	private boolean readyToDrop(Entry entry) {
		if (entry.state == State.RETIRED && entry.leases == 0 && !entry.dropping) {
			entry.dropping = true;
			return true;
		}
		return false;
	}

	private void tryDrop(Entry entry) {
		try {
			dropper.drop(entry.ref);
			synchronized (lock) {
				entries.remove(entry.ref.qualifiedName());
			}
		} catch (RuntimeException e) {
			LOGGER.log(Level.WARNING, "Failed to drop materialized result " + entry.ref.qualifiedName()
					+ ", it stays tracked for the next cleanup", e);
			synchronized (lock) {
				entry.dropping = false;
			}
		}
	}
}
