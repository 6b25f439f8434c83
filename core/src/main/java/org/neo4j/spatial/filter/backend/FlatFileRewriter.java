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

import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.RewriteException;
import org.neo4j.spatial.filter.expression.ExistsExpression;
import org.neo4j.spatial.filter.expression.Expression;
import org.neo4j.spatial.filter.expression.InSubquery;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.rewrite.CombinedExpressionRewriter;
import org.neo4j.spatial.filter.rewrite.ExpressionPatterns;
import org.neo4j.spatial.filter.rewrite.IdPredicateRenderer;

/**
 * Subset expressions for flat file formats whose filter grammar has no subqueries. Only literal id predicates
 * and the attribute expressions given by the caller are emitted.
 */
public class FlatFileRewriter {

	private static final Logger LOGGER = Logger.getLogger(FlatFileRewriter.class.getName());

	public static final String FID = "fid";

	private static final Pattern SELECT = Pattern.compile("\\bSELECT\\b", Pattern.CASE_INSENSITIVE);

	private final IdPredicateRenderer ids;
	private final CombinedExpressionRewriter combiner;

	public FlatFileRewriter(OptimizerConfig config, CombinedExpressionRewriter combiner) {
		this.ids = new IdPredicateRenderer(config, BackendKind.FLAT_FILE);
		this.combiner = combiner;
	}

	public String idPredicate(IdSet idSet) {
		return ids.render(FID, idSet);
	}

	/**
	 * @throws RewriteException if neither the rewritten nor the plain combination can be expressed without a
	 * subquery
	 */
	public CombinedRewriteResult rewriteCombined(String oldExpression, String newExpression,
			CombineOperator operator, String datasetId) {
		CombinedRewriteResult result = combiner.rewrite(oldExpression, newExpression, operator, datasetId,
				BackendKind.FLAT_FILE);
		if (!containsSubquery(result.getRewrittenExpression())) {
			return result;
		}
		String naive = result.getOriginalExpression();
		if (containsSubquery(naive)) {
			throw new RewriteException("Flat file filters cannot contain subqueries: "
					+ ExpressionPatterns.abbreviate(naive));
		}
		LOGGER.fine("Discarding rewrite with a subquery for flat file dataset " + datasetId);
		return CombinedRewriteResult.unchanged(naive, "subqueries unsupported by flat file backend");
	}

	static boolean containsSubquery(String expression) {
		if (expression == null) {
			return false;
		}
		Expression parsed = ExpressionPatterns.parseOrNull(expression);
		if (parsed == null) {
			return SELECT.matcher(expression).find();
		}
		for (Expression node : parsed.descendants()) {
			if (node instanceof InSubquery || node instanceof ExistsExpression) {
				return true;
			}
		}
		return false;
	}
}
