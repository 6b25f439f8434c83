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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.consecutiveIds;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.inList;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.RewriteException;
import org.neo4j.spatial.filter.expression.EvaluationContext;
import org.neo4j.spatial.filter.expression.ExpressionParser;
import org.neo4j.spatial.filter.expression.ExpressionSyntaxException;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.model.OptimizationKind;
import org.neo4j.spatial.filter.model.SpatialPredicate;
import org.neo4j.spatial.filter.rewrite.CombinedExpressionRewriter;
import org.neo4j.spatial.filter.rewrite.ExpressionCache;
import org.neo4j.spatial.filter.testutils.FeatureFixtures;

public class EmbeddedSqlRewriterTest {

	private static final String SOURCE = "POLYGON((0 0, 10 0, 10 5, 0 5, 0 0))";

	private final OptimizerConfig config = OptimizerConfig.defaults();
	private final EmbeddedSqlRewriter rewriter = new EmbeddedSqlRewriter(config,
			new CombinedExpressionRewriter(config, new ExpressionCache()));

	@Test
	public void shouldRenderRowIdPredicates() {
		assertEquals("ROWID IN (1, 2, 3)", rewriter.idPredicate(IdSet.of(3, 2, 1)));
		assertEquals("0 = 1", rewriter.idPredicate(IdSet.empty()));
		assertEquals("(ROWID >= 1 AND ROWID <= 600)", rewriter.idPredicate(IdSet.of(consecutiveIds(1, 600))));
		assertEquals("\"ogc_fid\" = 4", rewriter.idPredicate("\"ogc_fid\"", IdSet.of(4)));
	}

	@Test
	public void shouldDetectIdSets() {
		assertEquals(Optional.of(IdSet.of(1, 2)), rewriter.detectIdSet("ROWID IN (1, 2)"));
		assertEquals(Optional.of(IdSet.of(5, 6, 7)), rewriter.detectIdSet("fid BETWEEN 5 AND 7"));
		assertFalse(rewriter.detectIdSet("category = 'park'").isPresent());
		assertThrows(RewriteException.class, () -> rewriter.detectIdSet("ROWID IN (1, 2"));
	}

	@Test
	public void shouldPrefilterThroughRtreeTable() {
		String predicate = rewriter.bboxPrefilteredPredicate("roads", "geom", SOURCE, 4326,
				SpatialPredicate.INTERSECTS);
		assertEquals("ROWID IN (SELECT pkid FROM \"idx_roads_geom\" WHERE xmin <= 10.0 AND xmax >= 0.0 "
				+ "AND ymin <= 5.0 AND ymax >= 0.0) AND Intersects(\"geom\", GeomFromText('" + SOURCE + "', 4326))",
				predicate);
	}

	@Test
	public void shouldUseExactPredicateAloneWhenPrefilterDoesNotApply() {
		assertEquals("Disjoint(\"geom\", GeomFromText('" + SOURCE + "', 4326))",
				rewriter.bboxPrefilteredPredicate("roads", "geom", SOURCE, 4326, SpatialPredicate.DISJOINT));
		assertEquals("Within(\"geom\", GeomFromText('POLYGON((0 0, 1 1', 0))",
				rewriter.bboxPrefilteredPredicate("roads", "geom", "POLYGON((0 0, 1 1", 0, SpatialPredicate.WITHIN));
		assertEquals("Intersects(\"geom\", GeomFromText('POINT EMPTY', 0))",
				rewriter.bboxPrefilteredPredicate("roads", "geom", "POINT EMPTY", 0, SpatialPredicate.INTERSECTS));
	}

	@Test
	public void shouldEvaluateExactPredicateLikeTheEngine() throws ExpressionSyntaxException {
		String exact = rewriter.bboxPrefilteredPredicate("roads", "geom", SOURCE, 4326, SpatialPredicate.DISJOINT);
		assertTrue(ExpressionParser.parse(exact).test(EvaluationContext.forRow(
				FeatureFixtures.record(1, "POINT (20 20)", null), "roads")));
	}

	@Test
	public void shouldCombineWithEmbeddedDialect() {
		CombinedRewriteResult result = rewriter.rewriteCombined(inList("ROWID", consecutiveIds(1, 40)),
				"MbrIntersects(geom, BuildMbr(0, 0, 5, 5))", CombineOperator.AND, "roads");
		assertEquals(OptimizationKind.FID_LIST_OPTIMIZE, result.getOptimizationKind());
		assertEquals("((ROWID >= 1 AND ROWID <= 40)) AND (MbrIntersects(geom, BuildMbr(0, 0, 5, 5)))",
				result.getRewrittenExpression());
	}
}
