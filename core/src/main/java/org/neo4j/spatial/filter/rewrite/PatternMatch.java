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

import java.util.Objects;

/**
 * Outcome of looking for a known pattern in an expression. A malformed match is a pattern that was clearly
 * intended but cannot be used, which is different from the pattern simply not being there.
 */
public final class PatternMatch<T> {

	public enum Outcome {
		MATCH,
		NO_MATCH,
		MALFORMED
	}

	private static final PatternMatch<?> NO_MATCH = new PatternMatch<>(Outcome.NO_MATCH, null, null);

	private final Outcome outcome;
	private final T value;
	private final String reason;

	private PatternMatch(Outcome outcome, T value, String reason) {
		this.outcome = outcome;
		this.value = value;
		this.reason = reason;
	}

	public static <T> PatternMatch<T> match(T value) {
		return new PatternMatch<>(Outcome.MATCH, Objects.requireNonNull(value), null);
	}

	@SuppressWarnings("unchecked")
	public static <T> PatternMatch<T> noMatch() {
		return (PatternMatch<T>) NO_MATCH;
	}

	public static <T> PatternMatch<T> malformed(String reason) {
		return new PatternMatch<>(Outcome.MALFORMED, null, reason);
	}

	public Outcome getOutcome() {
		return outcome;
	}

	public boolean isMatch() {
		return outcome == Outcome.MATCH;
	}

	public boolean isMalformed() {
		return outcome == Outcome.MALFORMED;
	}

	public T getValue() {
		if (outcome != Outcome.MATCH) {
			throw new IllegalStateException("No value for " + outcome + " pattern match");
		}
		return value;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public String toString() {
		return outcome + (value != null ? "(" + value + ")" : reason != null ? "(" + reason + ")" : "");
	}
}
