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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.consecutiveIds;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.inList;

import org.junit.jupiter.api.Test;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.RewriteException;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.model.OptimizationKind;
import org.neo4j.spatial.filter.rewrite.CombinedExpressionRewriter;
import org.neo4j.spatial.filter.rewrite.ExpressionCache;

public class FlatFileRewriterTest {

	private final OptimizerConfig config = OptimizerConfig.defaults();
	private final FlatFileRewriter rewriter = new FlatFileRewriter(config,
			new CombinedExpressionRewriter(config, new ExpressionCache()));

	@Test
	public void shouldRenderLiteralFidPredicates() {
		assertEquals("fid = 5", rewriter.idPredicate(IdSet.of(5)));
		assertEquals("fid = -1", rewriter.idPredicate(IdSet.empty()));
		assertEquals("fid IN (2, 4, 8)", rewriter.idPredicate(IdSet.of(8, 4, 2)));
	}

	@Test
	public void shouldCompressIdListsWithoutSubqueries() {
		CombinedRewriteResult result = rewriter.rewriteCombined(inList("fid", consecutiveIds(100, 50)),
				"category = 'water'", CombineOperator.OR, "parcels");
		assertEquals(OptimizationKind.RANGE_OPTIMIZE, result.getOptimizationKind());
		assertEquals("((fid >= 100 AND fid <= 149)) OR (category = 'water')", result.getRewrittenExpression());
	}

	@Test
	public void shouldRejectSubqueriesItCannotAvoid() {
		assertThrows(RewriteException.class, () -> rewriter.rewriteCombined(
				"fid IN (SELECT pk FROM results)", "category = 'water'", CombineOperator.AND, "parcels"));
	}

	@Test
	public void shouldDiscardRewritesThatIntroduceSubqueries() {
		CombinedExpressionRewriter combiner = mock(CombinedExpressionRewriter.class);
		when(combiner.rewrite(anyString(), anyString(), any(CombineOperator.class), eq("parcels"),
				eq(BackendKind.FLAT_FILE))).thenReturn(new CombinedRewriteResult(true,
						"fid IN (SELECT pk FROM cache)", "(fid = 1) AND (category = 'water')",
						OptimizationKind.MV_REUSE, 10.0, "semi-join"));
		FlatFileRewriter guarded = new FlatFileRewriter(config, combiner);

		CombinedRewriteResult result = guarded.rewriteCombined("fid = 1", "category = 'water'", CombineOperator.AND,
				"parcels");
		assertFalse(result.isSuccess());
		assertEquals("(fid = 1) AND (category = 'water')", result.getRewrittenExpression());
	}

	@Test
	public void shouldSpotSubqueriesInBrokenText() {
		assertTrue(FlatFileRewriter.containsSubquery("fid IN (SELECT pk FROM"));
		assertTrue(FlatFileRewriter.containsSubquery("EXISTS (SELECT 1 FROM t WHERE t.a = fid)"));
		assertFalse(FlatFileRewriter.containsSubquery("name = 'selection'"));
		assertFalse(FlatFileRewriter.containsSubquery(null));
	}
}
