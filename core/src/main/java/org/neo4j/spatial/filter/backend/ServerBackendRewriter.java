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

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.locationtech.jts.geom.Envelope;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.MaterializationException;
import org.neo4j.spatial.filter.api.ServerConnection;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.model.MaterializedResultRef;
import org.neo4j.spatial.filter.model.SpatialPredicate;
import org.neo4j.spatial.filter.rewrite.CombinedExpressionRewriter;
import org.neo4j.spatial.filter.rewrite.ExpressionPatterns;
import org.neo4j.spatial.filter.rewrite.IdPredicateRenderer;
import org.neo4j.spatial.filter.rewrite.MaterializedMembership;
import org.neo4j.spatial.filter.rewrite.PatternMatch;

/**
 * Builds filter expressions for a SQL server with spatial functions. Buffered joins against many source rows
 * are backed by a session owned materialized view holding the buffered source geometries with spatial
 * indexes, so the buffer is computed once instead of once per target row.
 * <p>
 * Every view created here is registered in the {@link SessionRegistry} and dropped by
 * {@link #cleanupSession(String)}.
 */
public class ServerBackendRewriter {

	private static final Logger LOGGER = Logger.getLogger(ServerBackendRewriter.class.getName());

	static final String SOURCE_ALIAS = "__src";
	static final String BUFFER_PREFIX = "fm_buf_";
	static final String RESULT_PREFIX = "fm_res_";
	static final String KEY = "pk";

	private final OptimizerConfig config;
	private final ServerConnection connection;
	private final SessionRegistry registry;
	private final IdPredicateRenderer ids;
	private final CombinedExpressionRewriter combiner;
	private final ExpressionPatterns patterns;

	public ServerBackendRewriter(OptimizerConfig config, ServerConnection connection,
			CombinedExpressionRewriter combiner) {
		this.config = config;
		this.connection = connection;
		this.registry = new SessionRegistry(this::dropResult);
		this.ids = new IdPredicateRenderer(config, BackendKind.SERVER_SQL);
		this.combiner = combiner;
		this.patterns = combiner.getPatterns();
	}

	public String getBackendId() {
		return connection.getBackendId();
	}

	public SessionRegistry getRegistry() {
		return registry;
	}

	/**
	 * Returns an EXISTS predicate testing target rows against the buffered source. When the source is large or
	 * filtered, the buffered geometries are materialized first; otherwise, or if materialization fails, the
	 * buffer is computed inline.
	 */
	public ServerRewrite prepareBufferedSource(String sessionId, BufferedSourceRequest request) {
		double tolerance = simplifyTolerance(request.bufferDistance());
		int segments = bufferSegments(request);
		if (!shouldMaterialize(request)) {
			return new ServerRewrite(inlineExistsPredicate(request, tolerance), null, false, tolerance, segments);
		}
		String name = newName(BUFFER_PREFIX, sessionId);
		String qualifiedName = qualify(name);
		MaterializedResultRef ref = new MaterializedResultRef(connection.getBackendId(), qualifiedName, KEY,
				"geom", sessionId);
		try {
			for (String statement : bufferedSourceStatements(request, name, qualifiedName, tolerance, segments)) {
				connection.execute(statement);
			}
		} catch (SQLException e) {
			LOGGER.log(Level.WARNING, "Could not materialize buffered source " + qualifiedName
					+ ", using inline buffer instead: " + e.getMessage(), e);
			dropPartial(qualifiedName);
			return new ServerRewrite(inlineExistsPredicate(request, tolerance), null, true, tolerance, segments);
		}
		registry.register(ref);
		LOGGER.info("Materialized buffered source " + qualifiedName + " for session " + sessionId + " (buffer "
				+ request.bufferDistance() + ", simplify " + tolerance + ", segments " + segments + ")");
		String expression = bboxAssistedExistsPredicate(ref, targetGeometry(request), request.predicate());
		return new ServerRewrite(expression, ref, false, tolerance, segments);
	}

	/**
	 * Stores the key and geometry of the target rows matching {@code expression} as a materialized result, and
	 * returns a membership predicate over it. Later combinations with a spatial EXISTS check can then be
	 * evaluated over the stored rows only.
	 *
	 * @param targetTable the qualified target table, as written in SQL
	 */
	public ServerRewrite materializeFilterResult(String sessionId, String targetTable, String keyColumn,
			String geometryColumn, String expression) {
		String name = newName(RESULT_PREFIX, sessionId);
		String qualifiedName = qualify(name);
		String key = IdPredicateRenderer.quote(keyColumn);
		String geometry = IdPredicateRenderer.quote(geometryColumn);
		List<String> statements = new ArrayList<>();
		statements.add("CREATE SCHEMA IF NOT EXISTS " + IdPredicateRenderer.quote(config.getTempSchema()));
		statements.add("DROP MATERIALIZED VIEW IF EXISTS " + qualifiedName + " CASCADE");
		statements.add("CREATE MATERIALIZED VIEW " + qualifiedName + " AS SELECT " + key + " AS \"" + KEY + "\", "
				+ geometry + " AS " + geometry + " FROM " + targetTable + " WHERE " + expression + " WITH DATA");
		statements.add("CREATE INDEX " + IdPredicateRenderer.quote(name + "_pk_idx") + " ON " + qualifiedName
				+ " (\"" + KEY + "\")");
		statements.add("CREATE INDEX " + IdPredicateRenderer.quote(name + "_geom_idx") + " ON " + qualifiedName
				+ " USING GIST (" + geometry + ")");
		statements.add("ANALYZE " + qualifiedName);
		try {
			for (String statement : statements) {
				connection.execute(statement);
			}
		} catch (SQLException e) {
			LOGGER.log(Level.WARNING, "Could not materialize filter result " + qualifiedName
					+ ", keeping the expression inline: " + e.getMessage(), e);
			dropPartial(qualifiedName);
			return new ServerRewrite(expression, null, true, 0.0, 0);
		}
		MaterializedResultRef ref = new MaterializedResultRef(connection.getBackendId(), qualifiedName, KEY,
				geometryColumn, sessionId);
		registry.register(ref);
		LOGGER.info("Materialized filter result " + qualifiedName + " for session " + sessionId);
		return new ServerRewrite(key + " IN (SELECT \"" + KEY + "\" FROM " + qualifiedName + ")", ref, false, 0.0,
				0);
	}

	/**
	 * Two step existence check: the envelope index of the materialized result first, then the exact predicate
	 * against the buffered geometry. Disjoint has no envelope step, since disjoint geometries may have
	 * overlapping envelopes.
	 *
	 * @param targetGeometry the target geometry as SQL, qualified with the target table
	 * @throws MaterializationException if the result has been cleaned up
	 */
	public String bboxAssistedExistsPredicate(MaterializedResultRef ref, String targetGeometry,
			SpatialPredicate predicate) {
		if (!registry.isActive(ref)) {
			throw new MaterializationException("Materialized result " + ref.qualifiedName()
					+ " is no longer available");
		}
		StringBuilder sb = new StringBuilder("EXISTS (SELECT 1 FROM ").append(ref.qualifiedName()).append(" AS ")
				.append(SOURCE_ALIAS).append(" WHERE ");
		if (predicate.requiresEnvelopeOverlap()) {
			sb.append(SOURCE_ALIAS).append(".\"bbox\" && ").append(targetGeometry).append(" AND ");
		}
		sb.append(predicate.serverFunction()).append('(').append(targetGeometry).append(", ").append(SOURCE_ALIAS)
				.append(".\"geom_buffered\"))");
		return sb.toString();
	}

	/**
	 * Combines filter expressions on this server. Membership in a result of a cleaned up session fails instead
	 * of silently selecting nothing.
	 *
	 * @throws MaterializationException if {@code oldExpression} reads a retired materialized result
	 */
	public CombinedRewriteResult rewriteCombined(String oldExpression, String newExpression,
			CombineOperator operator, String datasetId) {
		PatternMatch<MaterializedMembership> membership = patterns.materializedMembership(oldExpression);
		if (membership.isMatch() && registry.isRetired(membership.getValue().tableText())) {
			throw new MaterializationException("Expression references materialized result "
					+ membership.getValue().tableText() + " of a session that was cleaned up");
		}
		return combiner.rewrite(oldExpression, newExpression, operator, datasetId, BackendKind.SERVER_SQL);
	}

	/**
	 * Grows an extent so that features within {@code bufferDistance} of it are not lost by a bounding box
	 * prefilter.
	 */
	public static Envelope expandExtentForBuffer(Envelope extent, double bufferDistance) {
		if (extent == null) {
			return null;
		}
		Envelope expanded = new Envelope(extent);
		if (!expanded.isNull()) {
			expanded.expandBy(Math.abs(bufferDistance));
		}
		return expanded;
	}

	/**
	 * @return the number of materialized results retired
	 */
	public int cleanupSession(String sessionId) {
		return registry.cleanupSession(sessionId);
	}

	boolean shouldMaterialize(BufferedSourceRequest request) {
		return request.sourceIdCount() > config.getMaterializationThreshold() || request.hasSourceFilter();
	}

	double simplifyTolerance(double bufferDistance) {
		double tolerance = Math.abs(bufferDistance) * config.getSimplifyFactor();
		return Math.min(config.getMaxSimplifyTolerance(), Math.max(config.getMinSimplifyTolerance(), tolerance));
	}

	int bufferSegments(BufferedSourceRequest request) {
		return request.sourceIdCount() > config.getReduceSegmentsRows() ? config.getReducedBufferSegments()
				: config.getBufferSegments();
	}

	List<String> bufferedSourceStatements(BufferedSourceRequest request, String name, String qualifiedName,
			double tolerance, int segments) {
		String geometry = IdPredicateRenderer.quote(request.geometryColumn());
		String simplified = "ST_SimplifyPreserveTopology(" + geometry + ", " + number(tolerance) + ")";
		String buffered = request.bufferDistance() == 0.0 ? geometry
				: "ST_Buffer(" + simplified + ", " + number(request.bufferDistance()) + ", 'quad_segs=" + segments
						+ "')";
		List<String> statements = new ArrayList<>();
		statements.add("CREATE SCHEMA IF NOT EXISTS " + IdPredicateRenderer.quote(config.getTempSchema()));
		statements.add("DROP MATERIALIZED VIEW IF EXISTS " + qualifiedName + " CASCADE");
		statements.add("CREATE MATERIALIZED VIEW " + qualifiedName + " AS SELECT b.\"pk\", b.\"geom\", "
				+ "b.\"geom_simplified\", b.\"geom_buffered\", ST_Envelope(b.\"geom_buffered\") AS \"bbox\" FROM ("
				+ "SELECT " + IdPredicateRenderer.quote(request.keyColumn()) + " AS \"pk\", " + geometry
				+ " AS \"geom\", " + simplified + " AS \"geom_simplified\", " + buffered + " AS \"geom_buffered\""
				+ " FROM " + sourceTable(request) + " WHERE " + sourceWhere(request) + " AND " + geometry
				+ " IS NOT NULL AND NOT ST_IsEmpty(" + geometry + ")) AS b WITH DATA");
		statements.add(index(name, "bbox_idx", qualifiedName, "USING GIST (\"bbox\")"));
		statements.add(index(name, "buf_idx", qualifiedName, "USING GIST (\"geom_buffered\")"));
		statements.add(index(name, "simp_idx", qualifiedName, "USING GIST (\"geom_simplified\")"));
		statements.add(index(name, "pk_idx", qualifiedName, "(\"pk\")"));
		statements.add("ANALYZE " + qualifiedName);
		return statements;
	}

	/**
	 * The non materialized form, used for small sources and when materialization fails.
	 */
	String inlineExistsPredicate(BufferedSourceRequest request, double tolerance) {
		String geometry = IdPredicateRenderer.quote(request.geometryColumn());
		String buffered = request.bufferDistance() == 0.0 ? geometry
				: "ST_Buffer(ST_SimplifyPreserveTopology(" + geometry + ", " + number(tolerance) + "), "
						+ number(request.bufferDistance()) + ")";
		return "EXISTS (SELECT 1 FROM (SELECT " + buffered + " AS \"geom_buffered\" FROM " + sourceTable(request)
				+ " WHERE " + sourceWhere(request) + ") AS " + SOURCE_ALIAS + " WHERE "
				+ request.predicate().serverFunction() + "(" + targetGeometry(request) + ", " + SOURCE_ALIAS
				+ ".\"geom_buffered\"))";
	}

	private String sourceWhere(BufferedSourceRequest request) {
		List<String> parts = new ArrayList<>();
		if (request.hasSourceFilter()) {
			parts.add("(" + request.sourceFilter() + ")");
		}
		if (request.sourceIds() != null) {
			parts.add(ids.render(IdPredicateRenderer.quote(request.keyColumn()), request.sourceIds()));
		}
		return parts.isEmpty() ? "TRUE" : String.join(" AND ", parts);
	}

	private static String sourceTable(BufferedSourceRequest request) {
		return IdPredicateRenderer.quote(request.sourceSchema()) + "." + IdPredicateRenderer.quote(request.sourceTable());
	}

	private static String targetGeometry(BufferedSourceRequest request) {
		return request.targetTable() + "." + IdPredicateRenderer.quote(request.targetGeometryColumn());
	}

	private static String index(String name, String suffix, String qualifiedName, String definition) {
		return "CREATE INDEX " + IdPredicateRenderer.quote(name + "_" + suffix) + " ON " + qualifiedName + " "
				+ definition;
	}

	private String qualify(String name) {
		return IdPredicateRenderer.quote(config.getTempSchema()) + "." + IdPredicateRenderer.quote(name);
	}

	static String newName(String prefix, String sessionId) {
		String session = sessionId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
		if (session.length() > 8) {
			session = session.substring(0, 8);
		}
		return prefix + session + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
	}

	private static String number(double value) {
		if (value == Math.rint(value) && !Double.isInfinite(value)) {
			return Long.toString((long) value);
		}
		return Double.toString(value);
	}

	private void dropPartial(String qualifiedName) {
		try {
			connection.execute("DROP MATERIALIZED VIEW IF EXISTS " + qualifiedName + " CASCADE");
		} catch (SQLException e) {
			LOGGER.log(Level.FINE, "Could not drop partial materialized view " + qualifiedName, e);
		}
	}

	private void dropResult(MaterializedResultRef ref) {
		try {
			connection.execute("DROP MATERIALIZED VIEW IF EXISTS " + ref.qualifiedName() + " CASCADE");
		} catch (SQLException e) {
			throw new MaterializationException("Failed to drop " + ref.qualifiedName(), e);
		}
	}
}
