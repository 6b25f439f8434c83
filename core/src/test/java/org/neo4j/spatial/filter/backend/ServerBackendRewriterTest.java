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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.consecutiveIds;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.IdRange;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.MaterializationException;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.OptimizationKind;
import org.neo4j.spatial.filter.model.SpatialPredicate;
import org.neo4j.spatial.filter.rewrite.CombinedExpressionRewriter;
import org.neo4j.spatial.filter.rewrite.ExpressionCache;
import org.neo4j.spatial.filter.testutils.RecordingServerConnection;

public class ServerBackendRewriterTest {

	private static final String TARGET = "\"public\".\"roads\"";

	private RecordingServerConnection connection;
	private ServerBackendRewriter rewriter;

	@BeforeEach
	public void setup() {
		OptimizerConfig config = OptimizerConfig.defaults();
		connection = new RecordingServerConnection("pg-main");
		rewriter = new ServerBackendRewriter(config, connection,
				new CombinedExpressionRewriter(config, new ExpressionCache()));
	}

	private static BufferedSourceRequest request(IdSet ids, String filter, double distance,
			SpatialPredicate predicate) {
		return new BufferedSourceRequest("public", "lakes", "id", "geom", ids, filter, distance, TARGET, "geom",
				predicate);
	}

	@Test
	public void shouldMaterializeLargeBufferedSource() {
		ServerRewrite rewrite = rewriter.prepareBufferedSource("abc123",
				request(IdSet.of(consecutiveIds(1, 100)), null, 50, SpatialPredicate.INTERSECTS));

		assertTrue(rewrite.isMaterialized());
		assertFalse(rewrite.fallback());
		assertEquals(5.0, rewrite.simplifyTolerance());
		assertEquals(8, rewrite.bufferSegments());
		String view = rewrite.result().qualifiedName();
		assertThat(view).matches("\"filter_temp\"\\.\"fm_buf_abc123_[0-9a-f]{8}\"");
		assertEquals("abc123", rewrite.result().sessionId());
		assertEquals("pg-main", rewrite.result().backendId());

		List<String> statements = connection.getStatements();
		assertThat(statements).hasSize(8);
		assertEquals("CREATE SCHEMA IF NOT EXISTS \"filter_temp\"", statements.get(0));
		assertEquals("DROP MATERIALIZED VIEW IF EXISTS " + view + " CASCADE", statements.get(1));
		assertThat(statements.get(2)).startsWith("CREATE MATERIALIZED VIEW " + view + " AS SELECT b.\"pk\"")
				.contains("ST_Buffer(ST_SimplifyPreserveTopology(\"geom\", 5), 50, 'quad_segs=8') AS \"geom_buffered\"")
				.contains("FROM \"public\".\"lakes\" WHERE \"id\" IN (1, 2, 3")
				.contains("ST_Envelope(b.\"geom_buffered\") AS \"bbox\"")
				.endsWith("AND \"geom\" IS NOT NULL AND NOT ST_IsEmpty(\"geom\")) AS b WITH DATA");
		assertThat(connection.statementsStartingWith("CREATE INDEX")).hasSize(4);
		assertEquals("ANALYZE " + view, statements.get(7));

		assertEquals("EXISTS (SELECT 1 FROM " + view + " AS __src WHERE __src.\"bbox\" && " + TARGET
				+ ".\"geom\" AND ST_Intersects(" + TARGET + ".\"geom\", __src.\"geom_buffered\"))",
				rewrite.expression());
		assertTrue(rewriter.getRegistry().isActive(rewrite.result()));
	}

	@Test
	public void shouldKeepSmallSourcesInline() {
		ServerRewrite rewrite = rewriter.prepareBufferedSource("s1",
				request(IdSet.of(3, 4), null, 2.5, SpatialPredicate.WITHIN));
		assertFalse(rewrite.isMaterialized());
		assertFalse(rewrite.fallback());
		assertThat(connection.getStatements()).isEmpty();
		assertEquals("EXISTS (SELECT 1 FROM (SELECT ST_Buffer(ST_SimplifyPreserveTopology(\"geom\", 0.5), 2.5) "
				+ "AS \"geom_buffered\" FROM \"public\".\"lakes\" WHERE \"id\" IN (3, 4)) AS __src WHERE ST_Within("
				+ TARGET + ".\"geom\", __src.\"geom_buffered\"))", rewrite.expression());
	}

	@Test
	public void shouldMaterializeFilteredSources() {
		ServerRewrite rewrite = rewriter.prepareBufferedSource("s1",
				request(null, "kind = 'reservoir'", 0, SpatialPredicate.INTERSECTS));
		assertTrue(rewrite.isMaterialized());
		String create = connection.statementsStartingWith("CREATE MATERIALIZED VIEW").get(0);
		assertThat(create).contains("\"geom\" AS \"geom_buffered\"").doesNotContain("ST_Buffer")
				.contains("WHERE (kind = 'reservoir') AND \"geom\" IS NOT NULL");
	}

	@Test
	public void shouldUseFewerSegmentsForHugeSources() {
		IdSet many = IdSet.ofRanges(List.of(new IdRange(1, 20_000)), List.of());
		ServerRewrite rewrite = rewriter.prepareBufferedSource("s1",
				request(many, null, 1000, SpatialPredicate.INTERSECTS));
		assertEquals(3, rewrite.bufferSegments());
		assertEquals(10.0, rewrite.simplifyTolerance());
		assertThat(connection.statementsStartingWith("CREATE MATERIALIZED VIEW").get(0))
				.contains("'quad_segs=3'").contains("WHERE (\"id\" >= 1 AND \"id\" <= 20000)");
	}

	@Test
	public void shouldFallBackToInlineBufferWhenMaterializationFails() {
		connection.failOnPrefix("CREATE MATERIALIZED VIEW");
		ServerRewrite rewrite = rewriter.prepareBufferedSource("s1",
				request(IdSet.of(consecutiveIds(1, 60)), null, 10, SpatialPredicate.INTERSECTS));
		assertFalse(rewrite.isMaterialized());
		assertTrue(rewrite.fallback());
		assertNull(rewrite.result());
		assertThat(rewrite.expression()).startsWith("EXISTS (SELECT 1 FROM (SELECT ST_Buffer(");
		assertEquals(0, rewriter.getRegistry().trackedCount());
		// the partial view is dropped after the failure
		assertThat(connection.statementsStartingWith("DROP MATERIALIZED VIEW")).hasSize(2);
	}

	@Test
	public void shouldSkipEnvelopeStepForDisjoint() {
		ServerRewrite rewrite = rewriter.prepareBufferedSource("s1",
				request(IdSet.of(consecutiveIds(1, 60)), null, 10, SpatialPredicate.DISJOINT));
		assertThat(rewrite.expression()).doesNotContain("&&").contains("ST_Disjoint(" + TARGET + ".\"geom\"");
	}

	@Test
	public void shouldRetireSessionResults() {
		ServerRewrite buffered = rewriter.prepareBufferedSource("abc123",
				request(IdSet.of(consecutiveIds(1, 100)), null, 50, SpatialPredicate.INTERSECTS));
		ServerRewrite result = rewriter.materializeFilterResult("abc123", TARGET, "fid", "geom",
				buffered.expression());
		assertTrue(result.isMaterialized());
		assertEquals("\"fid\" IN (SELECT \"pk\" FROM " + result.result().qualifiedName() + ")",
				result.expression());
		rewriter.prepareBufferedSource("other",
				request(IdSet.of(consecutiveIds(1, 100)), null, 50, SpatialPredicate.INTERSECTS));
		connection.clear();

		assertEquals(2, rewriter.cleanupSession("abc123"));
		assertThat(connection.getStatements()).containsExactlyInAnyOrder(
				"DROP MATERIALIZED VIEW IF EXISTS " + buffered.result().qualifiedName() + " CASCADE",
				"DROP MATERIALIZED VIEW IF EXISTS " + result.result().qualifiedName() + " CASCADE");
		assertEquals(1, rewriter.getRegistry().trackedCount());
		assertEquals(0, rewriter.cleanupSession("abc123"));

		assertThrows(MaterializationException.class, () -> rewriter.bboxAssistedExistsPredicate(buffered.result(),
				TARGET + ".\"geom\"", SpatialPredicate.INTERSECTS));
		assertThrows(MaterializationException.class, () -> rewriter.rewriteCombined(result.expression(),
				"ST_Intersects(\"geom\", ST_GeomFromText('POINT(0 0)'))", CombineOperator.AND, "roads"));
	}

	@Test
	public void shouldCombineOverActiveResult() {
		ServerRewrite result = rewriter.materializeFilterResult("s1", TARGET, "fid", "geom", "kind = 'main'");
		ServerRewrite buffered = rewriter.prepareBufferedSource("s1",
				request(IdSet.of(consecutiveIds(1, 100)), null, 50, SpatialPredicate.INTERSECTS));
		assertEquals(OptimizationKind.MV_REUSE, rewriter.rewriteCombined(result.expression(), buffered.expression(),
				CombineOperator.AND, "roads").getOptimizationKind());
	}

	@Test
	public void shouldKeepFilterInlineWhenResultCannotBeStored() {
		connection.failOnPrefix("CREATE INDEX");
		ServerRewrite result = rewriter.materializeFilterResult("s1", TARGET, "fid", "geom", "kind = 'main'");
		assertTrue(result.fallback());
		assertEquals("kind = 'main'", result.expression());
		assertEquals(0, rewriter.getRegistry().trackedCount());
	}

	@Test
	public void shouldClampSimplifyTolerance() {
		assertEquals(0.5, rewriter.simplifyTolerance(1));
		assertEquals(2.0, rewriter.simplifyTolerance(-20));
		assertEquals(10.0, rewriter.simplifyTolerance(5000));
	}

	@Test
	public void shouldExpandExtentByBufferDistance() {
		assertEquals(new Envelope(-5, 15, -5, 15),
				ServerBackendRewriter.expandExtentForBuffer(new Envelope(0, 10, 0, 10), 5));
		assertNull(ServerBackendRewriter.expandExtentForBuffer(null, 5));
		assertTrue(ServerBackendRewriter.expandExtentForBuffer(new Envelope(), 5).isNull());
	}

	@Test
	public void shouldNameResultsPerSession() {
		assertThat(ServerBackendRewriter.newName("fm_res_", "Session-0123456789"))
				.matches("fm_res_session0_[0-9a-f]{8}");
		assertThat(ServerBackendRewriter.newName("fm_buf_", "s1"))
				.isNotEqualTo(ServerBackendRewriter.newName("fm_buf_", "s1"));
	}

	@Test
	public void shouldRejectInvalidBufferDistance() {
		assertThrows(IllegalArgumentException.class,
				() -> request(IdSet.of(1), null, Double.NaN, SpatialPredicate.INTERSECTS));
		assertEquals(SpatialPredicate.INTERSECTS, request(IdSet.of(1), null, 1, null).predicate());
	}
}
