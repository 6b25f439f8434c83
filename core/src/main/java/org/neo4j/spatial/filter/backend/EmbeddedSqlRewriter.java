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

import java.util.Optional;
import java.util.logging.Logger;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.RewriteException;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.model.SpatialPredicate;
import org.neo4j.spatial.filter.rewrite.CombinedExpressionRewriter;
import org.neo4j.spatial.filter.rewrite.IdPredicate;
import org.neo4j.spatial.filter.rewrite.IdPredicateRenderer;
import org.neo4j.spatial.filter.rewrite.PatternMatch;

/**
 * Filter expressions for an embedded SQL engine with an R-tree spatial index stored as a virtual table next to
 * each indexed geometry column.
 */
public class EmbeddedSqlRewriter {

	private static final Logger LOGGER = Logger.getLogger(EmbeddedSqlRewriter.class.getName());

	public static final String ROWID = "ROWID";

	private final IdPredicateRenderer ids;
	private final CombinedExpressionRewriter combiner;

	public EmbeddedSqlRewriter(OptimizerConfig config, CombinedExpressionRewriter combiner) {
		this.ids = new IdPredicateRenderer(config, BackendKind.EMBEDDED_SQL);
		this.combiner = combiner;
	}

	public String idPredicate(IdSet idSet) {
		return idPredicate(ROWID, idSet);
	}

	public String idPredicate(String column, IdSet idSet) {
		return ids.render(column, idSet);
	}

	/**
	 * @return the ids selected by an id list or id range expression, empty if the expression is anything else
	 * @throws RewriteException if the expression is an id predicate that cannot be read
	 */
	public Optional<IdSet> detectIdSet(String expression) {
		PatternMatch<IdPredicate> match = combiner.getPatterns().idPredicate(expression);
		if (match.isMalformed()) {
			throw new RewriteException(match.getReason());
		}
		return match.isMatch() ? Optional.of(match.getValue().ids()) : Optional.empty();
	}

	public CombinedRewriteResult rewriteCombined(String oldExpression, String newExpression,
			CombineOperator operator, String datasetId) {
		return combiner.rewrite(oldExpression, newExpression, operator, datasetId, BackendKind.EMBEDDED_SQL);
	}

	/**
	 * Restricts the exact predicate to rows whose envelope overlaps the source envelope, using the R-tree
	 * virtual table {@code idx_<table>_<column>}. Disjoint, and sources that are not valid WKT, get the exact
	 * predicate alone.
	 */
	public String bboxPrefilteredPredicate(String table, String geometryColumn, String sourceWkt, int srid,
			SpatialPredicate predicate) {
		String exact = predicate.serverFunction().substring(3) + "(" + IdPredicateRenderer.quote(geometryColumn)
				+ ", GeomFromText('" + sourceWkt.replace("'", "''") + "', " + srid + "))";
		if (!predicate.requiresEnvelopeOverlap()) {
			return exact;
		}
		Envelope envelope;
		try {
			Geometry source = new WKTReader().read(sourceWkt);
			envelope = source.getEnvelopeInternal();
		} catch (ParseException e) {
			LOGGER.warning("Source geometry is not valid WKT, skipping the R-tree prefilter: " + e.getMessage());
			return exact;
		}
		if (envelope.isNull()) {
			return exact;
		}
		String index = IdPredicateRenderer.quote("idx_" + table + "_" + geometryColumn);
		return ROWID + " IN (SELECT pkid FROM " + index + " WHERE xmin <= " + envelope.getMaxX() + " AND xmax >= "
				+ envelope.getMinX() + " AND ymin <= " + envelope.getMaxY() + " AND ymax >= " + envelope.getMinY()
				+ ") AND " + exact;
	}
}
