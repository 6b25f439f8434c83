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
package org.neo4j.spatial.filter.stats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.model.SelectivityEstimate;
import org.neo4j.spatial.filter.testutils.FeatureFixtures;
import org.neo4j.spatial.filter.testutils.InMemoryDataset;

public class SelectivityEstimatorTest {

	private SelectivityEstimator estimator;
	private InMemoryDataset grid;

	@BeforeEach
	public void setup() {
		OptimizerConfig config = OptimizerConfig.fromJson("{\"attributeSampleSize\": 100, \"spatialDampening\": 0.5}");
		estimator = new SelectivityEstimator(config, new StatsSampler(config));
		// 10 x 10 points from (0 0) to (9 9)
		grid = new InMemoryDataset("grid", BackendKind.SERVER_SQL, FeatureFixtures.pointGrid(10, 10));
	}

	@Test
	public void shouldMeasureAttributeSelectivityOnSample() {
		assertThat(estimator.estimateAttributeSelectivity(grid, "category = 'park'")).isEqualTo(0.2);
		assertThat(estimator.estimateAttributeSelectivity(grid, "population <= 250")).isEqualTo(0.25);
		assertThat(estimator.estimateAttributeSelectivity(grid, "grid.population > 0")).isEqualTo(1.0);
		assertThat(estimator.estimateAttributeSelectivity(grid, "population > 250", 10)).isEqualTo(0.0);
	}

	@Test
	public void shouldNotFilterWithoutExpression() {
		assertThat(estimator.estimateAttributeSelectivity(grid, null)).isEqualTo(1.0);
		assertThat(estimator.estimateAttributeSelectivity(grid, "  ")).isEqualTo(1.0);
	}

	@Test
	public void shouldFallBackToNeutralEstimate() {
		assertThat(estimator.estimateAttributeSelectivity(grid, "category = ")).isEqualTo(0.5);
		assertThat(estimator.estimateAttributeSelectivity(grid, "NoSuchFunction(category)")).isEqualTo(0.5);
		InMemoryDataset broken = new InMemoryDataset("broken", BackendKind.SERVER_SQL,
				FeatureFixtures.pointGrid(3, 3)).failingSamples();
		assertThat(estimator.estimateAttributeSelectivity(broken, "category = 'park'")).isEqualTo(0.5);
	}

	@Test
	public void shouldFallBackWhenGeometryOperationFails() {
		// relate based predicates reject collections
		String collection = "ST_Within(geom, ST_GeomFromText('GEOMETRYCOLLECTION(POINT(1 1), "
				+ "POLYGON((0 0, 10 0, 10 10, 0 10, 0 0)))'))";
		assertThat(estimator.estimateAttributeSelectivity(grid, collection)).isEqualTo(0.5);
		SelectivityEstimate estimate = estimator.estimate(grid, collection, null);
		assertThat(estimate.getAttributeSelectivity()).isEqualTo(0.5);
	}

	@Test
	public void shouldKnowEmptyDatasetsMatchNothing() {
		InMemoryDataset empty = new InMemoryDataset("empty", BackendKind.SERVER_SQL, List.of());
		assertThat(estimator.estimateAttributeSelectivity(empty, "category = 'park'")).isEqualTo(0.0);
	}

	@Test
	public void shouldDampenExtentOverlap() {
		// the grid extent is 9 by 9, a quarter of it lies inside this window
		assertThat(estimator.estimateSpatialSelectivity(grid, new Envelope(-5, 4.5, -5, 4.5)))
				.isCloseTo(0.125, within(1e-9));
		assertThat(estimator.estimateSpatialSelectivity(grid, new Envelope(100, 200, 100, 200))).isEqualTo(0.0);
		assertThat(estimator.estimateSpatialSelectivity(grid, null)).isEqualTo(1.0);
		assertThat(estimator.estimateSpatialSelectivity(grid, new Envelope())).isEqualTo(1.0);
	}

	@Test
	public void shouldNotGuessForDegenerateExtents() {
		InMemoryDataset single = new InMemoryDataset("single", BackendKind.SERVER_SQL,
				FeatureFixtures.pointGrid(1, 1));
		assertThat(estimator.estimateSpatialSelectivity(single, new Envelope(-1, 1, -1, 1))).isEqualTo(0.5);
		InMemoryDataset empty = new InMemoryDataset("empty", BackendKind.SERVER_SQL, List.of());
		assertThat(estimator.estimateSpatialSelectivity(empty, new Envelope(-1, 1, -1, 1))).isEqualTo(0.5);
	}

	@Test
	public void shouldCombineBothEstimates() {
		SelectivityEstimate estimate = estimator.estimate(grid, "category = 'park'", new Envelope(0, 9, 0, 9));
		assertThat(estimate.getAttributeSelectivity()).isEqualTo(0.2);
		assertThat(estimate.getSpatialSelectivity()).isEqualTo(0.5);
		assertThat(estimate.hasAttributeFilter()).isTrue();
		assertThat(estimate.hasSpatialFilter()).isTrue();
		assertThat(estimate.getAttributeExpression()).isEqualTo("category = 'park'");
	}
}
