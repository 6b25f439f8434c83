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
package org.neo4j.spatial.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.box;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.consecutiveIds;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.inList;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.CancellationToken;
import org.neo4j.spatial.filter.api.FilterExecutionException;
import org.neo4j.spatial.filter.api.FilterableDataset;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.backend.SessionRegistry;
import org.neo4j.spatial.filter.execution.BatchMatcher;
import org.neo4j.spatial.filter.execution.ChunkedResult;
import org.neo4j.spatial.filter.model.CacheKey;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.model.FilterOutcome;
import org.neo4j.spatial.filter.model.FilterPlan;
import org.neo4j.spatial.filter.model.FilterStrategy;
import org.neo4j.spatial.filter.model.GeometryFingerprint;
import org.neo4j.spatial.filter.model.OptimizationKind;
import org.neo4j.spatial.filter.model.SpatialPredicate;
import org.neo4j.spatial.filter.monitoring.CountingMonitor;
import org.neo4j.spatial.filter.monitoring.NullListener;
import org.neo4j.spatial.filter.testutils.FeatureFixtures;
import org.neo4j.spatial.filter.testutils.InMemoryDataset;
import org.neo4j.spatial.filter.testutils.RecordingServerConnection;

public class SpatialFilterOptimizerTest {

	private static final String TARGET = "\"public\".\"roads\"";

	private CountingMonitor monitor;
	private RecordingServerConnection connection;
	private SpatialFilterOptimizer optimizer;

	@BeforeEach
	public void setup() {
		monitor = new CountingMonitor();
		connection = new RecordingServerConnection("pg-main");
		optimizer = new SpatialFilterOptimizer(OptimizerConfig.defaults(), connection, monitor);
	}

	@AfterEach
	public void teardown() {
		optimizer.close();
	}

	private static CacheKey key(String datasetId, String predicate) {
		return new CacheKey(datasetId, List.of(predicate), null, GeometryFingerprint.NONE, BackendKind.SERVER_SQL);
	}

	@Test
	public void shouldPlanSmallDatasetDirectly() {
		InMemoryDataset grid = new InMemoryDataset("grid", BackendKind.FLAT_FILE, FeatureFixtures.pointGrid(10, 10));

		FilterPlan plan = optimizer.planFor(grid, "category = 'park'", null);

		assertEquals(FilterStrategy.DIRECT, plan.getStrategy());
		assertThat(monitor.getCaseCounts()).containsEntry("plan.DIRECT", 1);
	}

	@Test
	public void shouldPlanSelectiveAttributeFilterFirst() {
		InMemoryDataset parcels = new InMemoryDataset("parcels", BackendKind.SERVER_SQL,
				FeatureFixtures.pointGrid(10, 10)).withRowCount(500_000);

		FilterPlan plan = optimizer.planFor(parcels, "category = 'park'", null);

		assertEquals(FilterStrategy.ATTRIBUTE_FIRST, plan.getStrategy());
		assertEquals(0.2, plan.getEstimatedSelectivity(), 1e-9);
		assertThat(monitor.getCaseCounts()).containsEntry("plan.ATTRIBUTE_FIRST", 1);
	}

	@Test
	public void shouldRewriteWithoutServerConnection() {
		try (SpatialFilterOptimizer local = new SpatialFilterOptimizer(OptimizerConfig.defaults())) {
			CombinedRewriteResult result = local.rewriteCombined(inList("fid", consecutiveIds(1, 1000)),
					"category = 'park'", CombineOperator.AND, "parcels", BackendKind.SERVER_SQL);
			assertEquals(OptimizationKind.RANGE_OPTIMIZE, result.getOptimizationKind());
			assertEquals("((fid >= 1 AND fid <= 1000)) AND (category = 'park')", result.getRewrittenExpression());
			assertEquals(0, local.cleanupSession("anything"));
			assertThrows(IllegalStateException.class, () -> local.materializeFilterResult("s1", TARGET, "fid",
					"geom", "kind = 'main'"));
		}
	}

	@Test
	public void shouldDetectBackendOfExistingExpression() {
		CombinedRewriteResult result = optimizer.rewriteCombined("ROWID IN (5, 6, 7)", "category = 'park'",
				CombineOperator.AND, "parcels");
		assertEquals("(ROWID IN (5, 6, 7)) AND (category = 'park')", result.getOriginalExpression());
	}

	@Test
	public void shouldKeepNaiveExpressionWhenFlatFileRewriteIsImpossible() {
		CombinedRewriteResult result = optimizer.rewriteCombined("fid IN (SELECT pk FROM results)",
				"category = 'water'", CombineOperator.AND, "shapes", BackendKind.FLAT_FILE);

		assertFalse(result.isSuccess());
		assertEquals(OptimizationKind.NONE, result.getOptimizationKind());
		assertEquals("(fid IN (SELECT pk FROM results)) AND (category = 'water')", result.getRewrittenExpression());
	}

	@Test
	public void shouldRejectCombiningWithCleanedUpResult() {
		String previous = optimizer.materializeFilterResult("s1", TARGET, "fid", "geom", "kind = 'main'")
				.expression();
		assertEquals(1, optimizer.cleanupSession("s1"));

		FilterExecutionException e = assertThrows(FilterExecutionException.class,
				() -> optimizer.rewriteCombined(previous, "kind = 'minor'", CombineOperator.AND, "roads",
						BackendKind.SERVER_SQL));
		assertEquals("roads", e.getDatasetId());
	}

	@Test
	public void shouldForgetCachedExpressionsOfCleanedUpSession() {
		String previous = optimizer.materializeFilterResult("s1", TARGET, "fid", "geom", "kind = 'main'")
				.expression();
		optimizer.getOrBuildExpression(key("roads", "a"), () -> previous + " AND kind = 'minor'");
		optimizer.getOrBuildExpression(key("roads", "b"), () -> "kind = 'minor'");
		assertEquals(2, optimizer.getExpressionCache().size());

		optimizer.cleanupSession("s1");

		assertEquals(1, optimizer.getExpressionCache().size());
		assertThat(connection.statementsStartingWith("DROP MATERIALIZED VIEW")).isNotEmpty();
	}

	@Test
	public void shouldInvalidateEverythingKnownAboutDataset() {
		InMemoryDataset roads = new InMemoryDataset("roads", BackendKind.IN_MEMORY, FeatureFixtures.squareGrid(3, 3));
		AtomicInteger builds = new AtomicInteger();
		optimizer.getOrBuildExpression(key("roads", "a"), () -> "x" + builds.incrementAndGet());
		optimizer.getOrBuildExpression(key("rivers", "a"), () -> "y");
		optimizer.sampleStats(roads);
		optimizer.sampleStats(roads);
		optimizer.selectInMemory(roads, box(0, 0, 1, 1), List.of(SpatialPredicate.INTERSECTS), null);
		assertEquals(1, roads.getSampleCalls());
		assertEquals(1, optimizer.getInMemoryIndexer().cachedDatasetCount());

		assertEquals(1, optimizer.invalidateDataset("roads"));

		optimizer.sampleStats(roads);
		assertEquals(2, roads.getSampleCalls());
		assertEquals(0, optimizer.getInMemoryIndexer().cachedDatasetCount());
		assertEquals("x2", optimizer.getOrBuildExpression(key("roads", "a"), () -> "x" + builds.incrementAndGet()));
		assertEquals(2, optimizer.getExpressionCache().size());
	}

	@Test
	public void shouldRenderIdPredicatesPerBackend() {
		assertEquals("fid IN (2, 4)", optimizer.idPredicate(BackendKind.FLAT_FILE, IdSet.of(4, 2)));
		assertEquals("ROWID IN (2, 4)", optimizer.idPredicate(BackendKind.EMBEDDED_SQL, IdSet.of(4, 2)));
	}

	@Test
	public void shouldCountExecutedFilters() {
		InMemoryDataset grid = new InMemoryDataset("grid", BackendKind.FLAT_FILE, FeatureFixtures.pointGrid(10, 10))
				.withFilterCompiler(expression -> record -> "park".equals(record.getValue("category")));
		FilterableDataset broken = mock(FilterableDataset.class);
		when(broken.getDatasetId()).thenReturn("broken");
		when(broken.executeFilter("x = 1")).thenThrow(new IllegalStateException("connection lost"));

		assertEquals(20, optimizer.applyFilter(grid, "category = 'park'"));
		FilterExecutionException e = assertThrows(FilterExecutionException.class,
				() -> optimizer.applyFilter(broken, "x = 1"));
		assertEquals("broken", e.getDatasetId());
		assertThat(e).hasCauseInstanceOf(IllegalStateException.class);
		assertThrows(FilterExecutionException.class,
				() -> optimizer.applyFilter(new InMemoryDataset("plain", BackendKind.FLAT_FILE, List.of()), "x = 1"));

		assertThat(monitor.getCaseCounts()).containsEntry("execute.SUCCEEDED", 1).containsEntry("execute.FAILED", 2);
	}

	@Test
	public void shouldKeepResultsReadByRunningFilter() {
		String previous = optimizer.materializeFilterResult("abc123", TARGET, "fid", "geom", "kind = 'main'")
				.expression();
		connection.clear();
		List<String> dropsDuringFilter = new ArrayList<>();
		InMemoryDataset roads = new InMemoryDataset("roads", BackendKind.SERVER_SQL, FeatureFixtures.pointGrid(3, 3))
				.withFilterCompiler(expression -> {
					assertEquals(1, optimizer.cleanupSession("abc123"));
					dropsDuringFilter.addAll(connection.statementsStartingWith("DROP MATERIALIZED VIEW"));
					return record -> true;
				});

		assertEquals(9, optimizer.applyFilter(roads, previous));

		assertThat(dropsDuringFilter).isEmpty();
		assertThat(connection.statementsStartingWith("DROP MATERIALIZED VIEW")).hasSize(1);
		FilterExecutionException e = assertThrows(FilterExecutionException.class,
				() -> optimizer.applyFilter(roads, previous));
		assertEquals("roads", e.getDatasetId());
		assertThat(monitor.getCaseCounts()).containsEntry("execute.SUCCEEDED", 1).containsEntry("execute.FAILED", 1);
	}

	@Test
	public void shouldLeaseResultsForCustomOperations() {
		String previous = optimizer.materializeFilterResult("s1", TARGET, "fid", "geom", "kind = 'main'")
				.expression();
		connection.clear();

		try (SessionRegistry.Leases leases = optimizer.leaseResults(previous)) {
			assertEquals(1, leases.size());
			optimizer.cleanupSession("s1");
			assertThat(connection.getStatements()).isEmpty();
		}
		assertThat(connection.statementsStartingWith("DROP MATERIALIZED VIEW")).hasSize(1);
	}

	@Test
	public void shouldApplyExpressionPerDataset() {
		List<InMemoryDataset> datasets = List.of(
				new InMemoryDataset("a", BackendKind.SERVER_SQL, FeatureFixtures.pointGrid(10, 10))
						.withFilterCompiler(expression -> record -> "park".equals(record.getValue("category"))),
				new InMemoryDataset("b", BackendKind.SERVER_SQL, FeatureFixtures.pointGrid(2, 2))
						.withFilterCompiler(expression -> record -> true));

		List<FilterOutcome> outcomes = optimizer.applyFilterMany(datasets,
				dataset -> "name <> '" + dataset.getDatasetId() + "'", CancellationToken.NONE);

		assertThat(outcomes).extracting(FilterOutcome::getMatchedRows).containsExactly(20L, 4L);
		assertThat(datasets.get(1).getExecutedExpressions()).containsExactly("name <> 'b'");
		assertThat(monitor.getCaseCounts()).containsEntry("execute.SUCCEEDED", 2)
				.containsEntry("dispatch.SUCCEEDED", 2);
	}

	@Test
	public void shouldChunkByPlan() {
		InMemoryDataset grid = new InMemoryDataset("grid", BackendKind.FLAT_FILE, FeatureFixtures.pointGrid(10, 10));
		FilterPlan plan = new FilterPlan(FilterStrategy.PROGRESSIVE_CHUNKS, 0.2, 10.0, List.of(), 25, true);

		ChunkedResult result = optimizer.executeChunked(grid, plan, null,
				BatchMatcher.of(record -> record.getId() % 10 == 0), new NullListener(), CancellationToken.NONE);

		assertEquals(4, result.batches());
		assertEquals(10, result.matched().size());
	}

	@Test
	public void shouldCountDispatchOutcomes() {
		List<InMemoryDataset> datasets = List.of(
				new InMemoryDataset("a", BackendKind.SERVER_SQL, FeatureFixtures.pointGrid(2, 2)),
				new InMemoryDataset("b", BackendKind.SERVER_SQL, FeatureFixtures.pointGrid(2, 2)));

		List<FilterOutcome> outcomes = optimizer.filterMany(datasets, dataset -> {
			if (dataset.getDatasetId().equals("b")) {
				throw new IllegalStateException("gone");
			}
			return dataset.rowCount();
		}, CancellationToken.NONE);

		assertTrue(outcomes.get(0).isSuccess());
		assertEquals(4, outcomes.get(0).getMatchedRows());
		assertThat(monitor.getCaseCounts()).containsEntry("dispatch.SUCCEEDED", 1)
				.containsEntry("dispatch.FAILED", 1);
	}

	@Test
	public void shouldRetireAllResultsOnClose() {
		optimizer.materializeFilterResult("s1", TARGET, "fid", "geom", "kind = 'main'");
		optimizer.materializeFilterResult("s2", TARGET, "fid", "geom", "kind = 'minor'");
		connection.clear();

		optimizer.close();

		assertThat(connection.statementsStartingWith("DROP MATERIALIZED VIEW")).hasSize(2);
		assertEquals(0, optimizer.getExpressionCache().size());
	}
}
