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
package org.neo4j.spatial.filter.plan;

import java.util.ArrayList;
import java.util.List;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.model.DatasetStats;
import org.neo4j.spatial.filter.model.FilterPlan;
import org.neo4j.spatial.filter.model.FilterStrategy;
import org.neo4j.spatial.filter.model.PlanStep;
import org.neo4j.spatial.filter.model.SelectivityEstimate;

/**
 * Chooses a {@link FilterStrategy} from dataset statistics and selectivity estimates. The rules are evaluated in
 * a fixed order and the first one that applies wins:
 * <ol>
 * <li>small datasets are filtered directly</li>
 * <li>a selective attribute filter is applied before the spatial one</li>
 * <li>a selective spatial filter on a medium dataset uses a bounding box prefilter</li>
 * <li>large datasets are processed in chunks</li>
 * <li>everything else gets the hybrid plan</li>
 * </ol>
 * The builder holds no state besides its configuration, so the same inputs always give the same plan.
 */
public class PlanBuilder {

	public static final double DIRECT_COST = 1.0;
	public static final double ATTRIBUTE_FIRST_COST = 2.0;
	public static final double SPATIAL_FOLLOW_UP_COST = 0.5;
	public static final double BBOX_THEN_EXACT_COST = 3.0;
	public static final double PROGRESSIVE_BASE_COST = 5.0;
	public static final double PROGRESSIVE_COST_PER_CHUNK = 0.1;
	public static final double HYBRID_COST = 2.5;

	private final OptimizerConfig config;

	public PlanBuilder(OptimizerConfig config) {
		this.config = config;
	}

	public FilterPlan buildPlan(DatasetStats stats, SelectivityEstimate estimate) {
		long rows = stats.getRowCount();
		double selectivity = estimate.combined();
		boolean nativeIndex = stats.hasNativeSpatialIndex();

		if (rows <= config.getSmallDatasetRows()) {
			return new FilterPlan(FilterStrategy.DIRECT, selectivity, DIRECT_COST,
					steps(rows, estimate, false, false), 0, false);
		}
		if (estimate.hasAttributeFilter()
				&& estimate.getAttributeSelectivity() < config.getAttributeFirstSelectivity()) {
			double cost = ATTRIBUTE_FIRST_COST + (estimate.hasSpatialFilter() ? SPATIAL_FOLLOW_UP_COST : 0.0);
			return new FilterPlan(FilterStrategy.ATTRIBUTE_FIRST, selectivity, cost,
					steps(rows, estimate, nativeIndex, false), config.getDefaultChunkSize(), nativeIndex);
		}
		if (estimate.hasSpatialFilter() && estimate.getSpatialSelectivity() < config.getBboxPrefilterSelectivity()
				&& rows > config.getMediumDatasetRows()) {
			return new FilterPlan(FilterStrategy.BBOX_THEN_EXACT, selectivity, BBOX_THEN_EXACT_COST,
					steps(rows, estimate, true, false), config.getDefaultChunkSize(), true);
		}
		if (rows > config.getLargeDatasetRows()) {
			int chunkSize = progressiveChunkSize(stats);
			double cost = PROGRESSIVE_BASE_COST + ((double) rows / chunkSize) * PROGRESSIVE_COST_PER_CHUNK;
			return new FilterPlan(FilterStrategy.PROGRESSIVE_CHUNKS, selectivity, cost,
					steps(rows, estimate, true, true), chunkSize, true);
		}
		return new FilterPlan(FilterStrategy.HYBRID, selectivity, HYBRID_COST,
				steps(rows, estimate, nativeIndex, false), config.getDefaultChunkSize(), nativeIndex);
	}

	/**
	 * Complex geometries get smaller chunks, within the configured bounds.
	 */
	int progressiveChunkSize(DatasetStats stats) {
		double divisor = Math.max(1.0, stats.complexity() / 2.0);
		int size = (int) (config.getBaseChunkSize() / divisor);
		return Math.max(config.getMinChunkSize(), Math.min(config.getMaxChunkSize(), size));
	}

	private static List<PlanStep> steps(long rows, SelectivityEstimate estimate, boolean bbox, boolean range) {
		List<PlanStep> steps = new ArrayList<>();
		long remaining = rows;
		if (estimate.hasAttributeFilter()) {
			remaining = Math.round(remaining * estimate.getAttributeSelectivity());
			steps.add(PlanStep.attributeFilter(estimate.getAttributeExpression(), remaining));
		}
		if (bbox && estimate.hasSpatialFilter()) {
			steps.add(PlanStep.bboxPrefilter(remaining));
		}
		if (range) {
			steps.add(PlanStep.range(remaining));
		}
		if (estimate.hasSpatialFilter()) {
			remaining = Math.round(remaining * estimate.getSpatialSelectivity());
			steps.add(PlanStep.exactSpatial(remaining));
		}
		return steps;
	}
}
