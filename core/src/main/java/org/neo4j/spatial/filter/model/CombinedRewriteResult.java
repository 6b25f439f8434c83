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

import java.util.Locale;

/**
 * Result of combining an existing filter expression with a new one. When nothing could be optimized the
 * rewritten expression is the plain combination and {@link #isSuccess()} is false.
 */
public final class CombinedRewriteResult {

	private final boolean success;
	private final String rewrittenExpression;
	private final String originalExpression;
	private final OptimizationKind optimizationKind;
	private final double estimatedSpeedup;
	private final String detail;

	public CombinedRewriteResult(boolean success, String rewrittenExpression, String originalExpression,
			OptimizationKind optimizationKind, double estimatedSpeedup, String detail) {
		this.success = success;
		this.rewrittenExpression = rewrittenExpression;
		this.originalExpression = originalExpression;
		this.optimizationKind = optimizationKind;
		this.estimatedSpeedup = estimatedSpeedup;
		this.detail = detail;
	}

	public static CombinedRewriteResult unchanged(String naiveExpression, String detail) {
		return new CombinedRewriteResult(false, naiveExpression, naiveExpression, OptimizationKind.NONE, 1.0,
				detail);
	}

	public boolean isSuccess() {
		return success;
	}

	public String getRewrittenExpression() {
		return rewrittenExpression;
	}

	/**
	 * @return the plain {@code (old) op (new)} combination the rewrite is equivalent to
	 */
	public String getOriginalExpression() {
		return originalExpression;
	}

	public OptimizationKind getOptimizationKind() {
		return optimizationKind;
	}

	public double getEstimatedSpeedup() {
		return estimatedSpeedup;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public String toString() {
		return String.format(Locale.ENGLISH, "CombinedRewriteResult(%s, %s, speedup=%.1f)",
				success ? "success" : "unchanged", optimizationKind, estimatedSpeedup);
	}
}
