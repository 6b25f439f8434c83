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

import java.util.List;
import java.util.Objects;

/**
 * The execution plan chosen for one filter request. Immutable.
 */
public final class FilterPlan {

	private final FilterStrategy strategy;
	private final double estimatedSelectivity;
	private final double estimatedCost;
	private final List<PlanStep> steps;
	private final int chunkSize;
	private final boolean useIndex;

	public FilterPlan(FilterStrategy strategy, double estimatedSelectivity, double estimatedCost,
			List<PlanStep> steps, int chunkSize, boolean useIndex) {
		this.strategy = Objects.requireNonNull(strategy);
		this.estimatedSelectivity = estimatedSelectivity;
		this.estimatedCost = estimatedCost;
		this.steps = List.copyOf(steps);
		this.chunkSize = chunkSize;
		this.useIndex = useIndex;
	}

	public FilterStrategy getStrategy() {
		return strategy;
	}

	public double getEstimatedSelectivity() {
		return estimatedSelectivity;
	}

	public double getEstimatedCost() {
		return estimatedCost;
	}

	public List<PlanStep> getSteps() {
		return steps;
	}

	/**
	 * @return the batch size for chunked execution, 0 for a single pass
	 */
	public int getChunkSize() {
		return chunkSize;
	}

	public boolean useIndex() {
		return useIndex;
	}

	public boolean hasStep(PlanStep.Kind kind) {
		return steps.stream().anyMatch(step -> step.getKind() == kind);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FilterPlan that)) {
			return false;
		}
		return strategy == that.strategy && Double.compare(estimatedSelectivity, that.estimatedSelectivity) == 0
				&& Double.compare(estimatedCost, that.estimatedCost) == 0 && chunkSize == that.chunkSize
				&& useIndex == that.useIndex && steps.equals(that.steps);
	}

	@Override
	public int hashCode() {
		return Objects.hash(strategy, estimatedSelectivity, estimatedCost, steps, chunkSize, useIndex);
	}

	@Override
	public String toString() {
		return "FilterPlan(" + strategy + ", selectivity=" + estimatedSelectivity + ", cost=" + estimatedCost
				+ ", chunk=" + chunkSize + ", index=" + useIndex + ", steps=" + steps + ")";
	}
}
