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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.consecutiveIds;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.inList;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.FeatureRecord;
import org.neo4j.spatial.filter.expression.EvaluationContext;
import org.neo4j.spatial.filter.expression.Expression;
import org.neo4j.spatial.filter.expression.ExpressionParser;
import org.neo4j.spatial.filter.expression.ExpressionSyntaxException;
import org.neo4j.spatial.filter.expression.TableResolver;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.model.OptimizationKind;
import org.neo4j.spatial.filter.monitoring.CountingMonitor;
import org.neo4j.spatial.filter.testutils.FeatureFixtures;

public class CombinedExpressionRewriterTest {

	private static final String SPATIAL = "ST_Intersects(\"geom\", "
			+ "ST_GeomFromText('POLYGON((0 0, 12 0, 12 12, 0 12, 0 0))'))";

	private CountingMonitor monitor;
	private CombinedExpressionRewriter rewriter;

	@BeforeEach
	public void setup() {
		monitor = new CountingMonitor();
		rewriter = new CombinedExpressionRewriter(OptimizerConfig.defaults(), new ExpressionCache(),
				new ExpressionPatterns(), monitor, Clock.systemUTC());
	}

	@Test
	public void shouldPutCompressedIdRangeBeforeSpatialPredicate() {
		String ids = inList("\"id\"", consecutiveIds(1, 1000));
		CombinedRewriteResult result = rewriter.rewrite(ids, SPATIAL, CombineOperator.AND, "parcels",
				BackendKind.SERVER_SQL);

		assertTrue(result.isSuccess());
		assertEquals(OptimizationKind.FID_LIST_OPTIMIZE, result.getOptimizationKind());
		assertEquals("((\"id\" >= 1 AND \"id\" <= 1000)) AND (" + SPATIAL + ")", result.getRewrittenExpression());
		assertThat(result.getEstimatedSpeedup()).isGreaterThanOrEqualTo(2.0);
		assertEquals("(" + ids + ") AND (" + SPATIAL + ")", result.getOriginalExpression());
		assertThat(monitor.getCaseCounts()).containsEntry("rewrite.FID_LIST_OPTIMIZE", 1);
	}

	@Test
	public void shouldMoveShortIdListInFrontWithoutCompression() {
		CombinedRewriteResult result = rewriter.rewrite(SPATIAL, "fid IN (4, 9)", CombineOperator.AND, "parcels",
				BackendKind.EMBEDDED_SQL);
		assertEquals(OptimizationKind.FID_LIST_OPTIMIZE, result.getOptimizationKind());
		assertEquals("(fid IN (4, 9)) AND (" + SPATIAL + ")", result.getRewrittenExpression());
	}

	@Test
	public void shouldJoinThroughMaterializedResult() {
		String previous = "\"fid\" IN (SELECT \"pk\" FROM \"filter_temp\".\"fm_res_1\")";
		String exists = "EXISTS (SELECT 1 FROM \"filter_temp\".\"fm_buf_2\" AS __src WHERE __src.\"bbox\" && "
				+ "\"roads\".\"geom\" AND ST_Intersects(\"roads\".\"geom\", __src.\"geom_buffered\"))";
		CombinedRewriteResult result = rewriter.rewrite(previous, exists, CombineOperator.AND, "roads",
				BackendKind.SERVER_SQL);

		assertEquals(OptimizationKind.MV_REUSE, result.getOptimizationKind());
		assertEquals("\"fid\" IN (SELECT __mv.\"pk\" FROM \"filter_temp\".\"fm_res_1\" AS __mv WHERE "
				+ "EXISTS (SELECT 1 FROM \"filter_temp\".\"fm_buf_2\" AS __src WHERE __src.\"bbox\" && "
				+ "__mv.\"geom\" AND ST_Intersects(__mv.\"geom\", __src.\"geom_buffered\")))",
				result.getRewrittenExpression());
		assertThat(result.getEstimatedSpeedup()).isGreaterThan(1.0);
	}

	@Test
	public void shouldNotJoinWhenExistsNeedsOtherColumns() {
		String previous = "\"fid\" IN (SELECT \"pk\" FROM \"filter_temp\".\"fm_res_1\")";
		String exists = "EXISTS (SELECT 1 FROM lakes AS l WHERE l.kind = roads.kind "
				+ "AND ST_Intersects(roads.geom, l.geom))";
		CombinedRewriteResult result = rewriter.rewrite(previous, exists, CombineOperator.AND, "roads",
				BackendKind.SERVER_SQL);
		assertFalse(result.isSuccess());
		assertEquals(OptimizationKind.NONE, result.getOptimizationKind());
		assertEquals("(" + previous + ") AND (" + exists + ")", result.getRewrittenExpression());
	}

	@Test
	public void shouldCompressIdListInOrCombination() {
		List<Long> ids = new ArrayList<>();
		for (long id = 1; id <= 25; id++) {
			if (id != 3) {
				ids.add(id);
			}
		}
		String old = "fid IN (" + ids.stream().map(String::valueOf).collect(Collectors.joining(", ")) + ")";
		CombinedRewriteResult result = rewriter.rewrite(old, "category = 'park'", CombineOperator.OR, "parcels",
				BackendKind.FLAT_FILE);
		assertEquals(OptimizationKind.RANGE_OPTIMIZE, result.getOptimizationKind());
		assertEquals("((fid >= 1 AND fid <= 25 AND fid NOT IN (3))) OR (category = 'park')",
				result.getRewrittenExpression());
	}

	@Test
	public void shouldServeRepeatedCombinationFromCache() {
		String ids = inList("\"id\"", consecutiveIds(1, 1000));
		CombinedRewriteResult first = rewriter.rewrite(ids, SPATIAL, CombineOperator.AND, "parcels",
				BackendKind.SERVER_SQL);
		CombinedRewriteResult second = rewriter.rewrite(ids, SPATIAL, CombineOperator.AND, "parcels",
				BackendKind.SERVER_SQL);
		assertEquals(OptimizationKind.CACHE_HIT, second.getOptimizationKind());
		assertEquals(first.getRewrittenExpression(), second.getRewrittenExpression());
		assertEquals(1L, rewriter.getStatistics().cacheHits());
		assertEquals(2L, rewriter.getStatistics().attempts());
	}

	@Test
	public void shouldFallBackToNaiveCombinationForMalformedIdList() {
		String broken = "\"id\" IN (1, 2, ";
		CombinedRewriteResult result = rewriter.rewrite(broken, SPATIAL, CombineOperator.AND, "parcels",
				BackendKind.SERVER_SQL);
		assertFalse(result.isSuccess());
		assertEquals("(" + broken + ") AND (" + SPATIAL + ")", result.getRewrittenExpression());
		assertEquals(1L, rewriter.getStatistics().missedOptimizations());
		assertThat(monitor.getCaseCounts()).containsEntry("rewrite.MISSED", 1);

		CombinedRewriteResult mixed = rewriter.rewrite("fid IN (1, 'x')", SPATIAL, CombineOperator.AND, "parcels",
				BackendKind.SERVER_SQL);
		assertFalse(mixed.isSuccess());
		assertEquals(2L, rewriter.getStatistics().missedOptimizations());
	}

	@Test
	public void shouldPassThroughWhenOneSideIsBlank() {
		CombinedRewriteResult result = rewriter.rewrite(" ", SPATIAL, CombineOperator.AND, "parcels");
		assertEquals(SPATIAL, result.getRewrittenExpression());
		assertFalse(result.isSuccess());
	}

	@Test
	public void shouldKeepRowSemanticsOfRewrites() throws ExpressionSyntaxException {
		List<FeatureRecord> rows = FeatureFixtures.pointGrid(20, 20);
		long[] scattered = {1, 2, 3, 5, 8, 13, 21, 34, 55, 89, 144, 233, 377};
		List<String[]> cases = List.of(
				new String[]{inList("\"id\"", consecutiveIds(1, 200)), SPATIAL, "AND"},
				new String[]{inList("fid", consecutiveIds(5, 60)), "category = 'park'", "OR"},
				new String[]{inList("fid", scattered), SPATIAL, "AND"},
				new String[]{"population > 1000", inList("$id", consecutiveIds(30, 40)), "AND"});
		for (String[] c : cases) {
			CombineOperator operator = CombineOperator.parse(c[2]);
			CombinedRewriteResult result = rewriter.rewrite(c[0], c[1], operator, "grid", BackendKind.UNKNOWN);
			Expression naive = ExpressionParser.parse(result.getOriginalExpression());
			Expression rewritten = ExpressionParser.parse(result.getRewrittenExpression());
			for (FeatureRecord row : rows) {
				EvaluationContext context = EvaluationContext.forRow(row, "grid");
				assertEquals(naive.test(context), rewritten.test(context),
						"row " + row.getId() + " of " + result.getRewrittenExpression());
			}
		}
	}

	@Test
	public void shouldKeepRowSemanticsOfRandomCombinations() throws ExpressionSyntaxException {
		Random random = new Random(7321L);
		List<FeatureRecord> rows = FeatureFixtures.pointGrid(15, 15);
		Set<OptimizationKind> seen = EnumSet.noneOf(OptimizationKind.class);
		for (int i = 0; i < 90; i++) {
			List<FeatureRecord> previousResult = new ArrayList<>();
			for (FeatureRecord row : rows) {
				if (random.nextInt(3) == 0) {
					previousResult.add(row);
				}
			}
			List<FeatureRecord> sources = randomSources(random);
			TableResolver tables = name -> switch (name) {
				case "filter_temp.fm_res_1" -> previousResult;
				case "filter_temp.fm_buf_2" -> sources;
				default -> throw new IllegalArgumentException("Unexpected table " + name);
			};
			CombineOperator operator = random.nextInt(3) > 0 ? CombineOperator.AND : CombineOperator.OR;
			String oldExpression;
			String newExpression;
			BackendKind backend;
			switch (i % 3) {
				case 0 -> {
					oldExpression = randomIdPredicate(random);
					newExpression = randomBox(random);
					backend = BackendKind.SERVER_SQL;
				}
				case 1 -> {
					oldExpression = randomIdPredicate(random);
					newExpression = random.nextBoolean() ? "population > " + random.nextInt(4000)
							: "category = '" + FeatureFixtures.CATEGORIES[random.nextInt(5)] + "'";
					backend = BackendKind.FLAT_FILE;
				}
				default -> {
					oldExpression = "\"fid\" IN (SELECT \"pk\" FROM \"filter_temp\".\"fm_res_1\")";
					newExpression = "EXISTS (SELECT 1 FROM \"filter_temp\".\"fm_buf_2\" AS __src WHERE __src.\"bbox\" && "
							+ "\"grid\".\"geom\" AND ST_Intersects(\"grid\".\"geom\", __src.\"geom_buffered\")"
							+ (random.nextBoolean() ? " AND " + inList("__src.\"fid\"", consecutiveIds(1, 30)) : "")
							+ ")";
					backend = BackendKind.SERVER_SQL;
				}
			}
			CombinedRewriteResult result = rewriter.rewrite(oldExpression, newExpression, operator, "grid", backend);
			seen.add(result.getOptimizationKind());
			Expression naive = ExpressionParser.parse(result.getOriginalExpression());
			Expression rewritten = ExpressionParser.parse(result.getRewrittenExpression());
			for (FeatureRecord row : rows) {
				EvaluationContext context = EvaluationContext.forRow(row, tables, "grid");
				assertEquals(naive.test(context), rewritten.test(context),
						"row " + row.getId() + " of " + result.getRewrittenExpression());
			}
		}
		assertThat(seen).contains(OptimizationKind.FID_LIST_OPTIMIZE, OptimizationKind.RANGE_OPTIMIZE,
				OptimizationKind.MV_REUSE);
	}

	private static String randomIdPredicate(Random random) {
		String column = List.of("fid", "\"id\"", "$id").get(random.nextInt(3));
		long first = 1 + random.nextInt(200);
		int span = 10 + random.nextInt(100);
		if (random.nextInt(5) == 0) {
			return column + " BETWEEN " + first + " AND " + (first + span);
		}
		double density = random.nextInt(4) > 0 ? 0.9 : 0.2;
		List<Long> ids = new ArrayList<>();
		for (long id = first; id < first + span; id++) {
			if (random.nextDouble() < density) {
				ids.add(id);
			}
		}
		if (ids.isEmpty()) {
			ids.add(first);
		}
		Collections.shuffle(ids, random);
		return inList(column, ids.stream().mapToLong(Long::longValue).toArray());
	}

	private static String randomBox(Random random) {
		int minX = random.nextInt(13);
		int minY = random.nextInt(13);
		int maxX = minX + 1 + random.nextInt(15 - minX);
		int maxY = minY + 1 + random.nextInt(15 - minY);
		if (random.nextBoolean()) {
			return "\"geom\" && ST_MakeEnvelope(" + minX + ", " + minY + ", " + maxX + ", " + maxY + ")";
		}
		return String.format(Locale.ENGLISH, "ST_Intersects(\"geom\", ST_GeomFromText('POLYGON((%d %d, %d %d, %d %d, "
				+ "%d %d, %d %d))'))", minX, minY, maxX, minY, maxX, maxY, minX, maxY, minX, minY);
	}

	private static List<FeatureRecord> randomSources(Random random) {
		List<FeatureRecord> sources = new ArrayList<>();
		int count = 1 + random.nextInt(4);
		for (int s = 1; s <= count; s++) {
			Geometry buffered = FeatureFixtures.GEOMETRY_FACTORY
					.createPoint(new Coordinate(random.nextInt(15), random.nextInt(15)))
					.buffer(0.5 + random.nextInt(3));
			Map<String, Object> attributes = new HashMap<>();
			attributes.put("bbox", buffered.getEnvelope());
			attributes.put("geom_buffered", buffered);
			sources.add(new FeatureRecord(s * 10L, buffered, attributes));
		}
		return sources;
	}
}
