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
 * The backend family a dataset lives in. Every filter request carries one of these explicitly, taken from the
 * dataset handle. {@link #UNKNOWN} is only produced when classifying an expression of unknown origin.
 */
public enum BackendKind {
	SERVER_SQL(true, true),
	EMBEDDED_SQL(true, true),
	FLAT_FILE(false, false),
	IN_MEMORY(false, false),
	UNKNOWN(false, false);

	private final boolean concurrencySafe;
	private final boolean supportsSubqueries;

	BackendKind(boolean concurrencySafe, boolean supportsSubqueries) {
		this.concurrencySafe = concurrencySafe;
		this.supportsSubqueries = supportsSubqueries;
	}

	/**
	 * @return true if independent filter operations against datasets of this kind may run on separate threads
	 */
	public boolean isConcurrencySafe() {
		return concurrencySafe;
	}

	public boolean supportsSubqueries() {
		return supportsSubqueries;
	}
}
