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

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.RewriteException;
import org.neo4j.spatial.filter.api.monitoring.OptimizerMonitor;
import org.neo4j.spatial.filter.expression.ColumnRef;
import org.neo4j.spatial.filter.expression.Expression;
import org.neo4j.spatial.filter.expression.InList;
import org.neo4j.spatial.filter.model.CacheKey;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.model.GeometryFingerprint;
import org.neo4j.spatial.filter.model.OptimizationKind;
import org.neo4j.spatial.filter.monitoring.EmptyMonitor;

/**
 * Combines an existing filter expression with a new one, reusing structure of the existing expression where it
 * is safe to do so:
 * <ul>
 * <li>a spatial EXISTS check combined with membership in a materialized result becomes a semi-join over that
 * result</li>
 * <li>id predicates combined with a spatial predicate are moved in front of it, compressed to ranges when
 * possible</li>
 * <li>long id lists with good coverage become a range with exclusions</li>
 * </ul>
 * The rewritten expression always selects exactly the rows of {@code (old) op (new)}. Anything unrecognised,
 * or recognised but malformed, produces that plain combination.
 */
public class CombinedExpressionRewriter {

	private static final Logger LOGGER = Logger.getLogger(CombinedExpressionRewriter.class.getName());

	static final String MV_ALIAS = "__mv";
	static final double MV_REUSE_SPEEDUP = 10.0;

	public record Statistics(long attempts, long successes, long cacheHits, long missedOptimizations,
			Map<OptimizationKind, Long> byKind) {

		public double successRate() {
			return attempts == 0 ? 0.0 : (double) successes / attempts;
		}
	}

	private final OptimizerConfig config;
	private final ExpressionCache cache;
	private final ExpressionPatterns patterns;
	private final OptimizerMonitor monitor;
	private final Clock clock;
	private final AtomicLong attempts = new AtomicLong();
	private final AtomicLong successes = new AtomicLong();
	private final AtomicLong cacheHits = new AtomicLong();
	private final AtomicLong missed = new AtomicLong();
	private final Map<OptimizationKind, Long> byKind = new EnumMap<>(OptimizationKind.class);

	public CombinedExpressionRewriter(OptimizerConfig config, ExpressionCache cache) {
		this(config, cache, new ExpressionPatterns(), new EmptyMonitor(), Clock.systemUTC());
	}

	public CombinedExpressionRewriter(OptimizerConfig config, ExpressionCache cache, ExpressionPatterns patterns,
			OptimizerMonitor monitor, Clock clock) {
		this.config = config;
		this.cache = cache;
		this.patterns = patterns;
		this.monitor = monitor;
		this.clock = clock;
	}

	/**
	 * Rewrites a combination whose backend is not known, classifying the existing expression heuristically.
	 */
	public CombinedRewriteResult rewrite(String oldExpression, String newExpression, CombineOperator operator,
			String datasetId) {
		return rewrite(oldExpression, newExpression, operator, datasetId,
				BackendDialectDetector.detect(oldExpression));
	}

	public CombinedRewriteResult rewrite(String oldExpression, String newExpression, CombineOperator operator,
			String datasetId, BackendKind backend) {
		if (oldExpression == null || oldExpression.isBlank()) {
			return CombinedRewriteResult.unchanged(newExpression, "no existing expression");
		}
		if (newExpression == null || newExpression.isBlank()) {
			return CombinedRewriteResult.unchanged(oldExpression, "no new expression");
		}
		String naive = operator.combine(oldExpression, newExpression);
		attempts.incrementAndGet();
		CacheKey key = new CacheKey(datasetId, List.of("combine:" + operator.name()), null,
				GeometryFingerprint.of(oldExpression + '\u0000' + operator + '\u0000' + newExpression), backend);
		boolean[] built = {false};
		ExpressionCache.CacheEntry entry = cache.getOrBuildEntry(key, () -> {
			built[0] = true;
			return buildEntry(oldExpression, newExpression, operator, backend, naive);
		});
		if (entry.kind() == OptimizationKind.NONE) {
			return CombinedRewriteResult.unchanged(naive, entry.detail());
		}
		successes.incrementAndGet();
		if (!built[0]) {
			cacheHits.incrementAndGet();
			record(OptimizationKind.CACHE_HIT);
			return new CombinedRewriteResult(true, entry.expression(), naive, OptimizationKind.CACHE_HIT,
					entry.speedup(), entry.detail());
		}
		record(entry.kind());
		return new CombinedRewriteResult(true, entry.expression(), naive, entry.kind(), entry.speedup(),
				entry.detail());
	}

	private void record(OptimizationKind kind) {
		synchronized (byKind) {
			byKind.merge(kind, 1L, Long::sum);
		}
		monitor.addCase("rewrite." + kind.name());
	}

	private ExpressionCache.CacheEntry buildEntry(String oldExpression, String newExpression,
			CombineOperator operator, BackendKind backend, String naive) {
		Rewrite found;
		try {
			found = tryRewrite(oldExpression, newExpression, operator, backend);
		} catch (RewriteException e) {
			missed.incrementAndGet();
			monitor.addCase("rewrite.MISSED");
			LOGGER.warning("Missed optimization combining filter expressions: " + e.getMessage());
			found = null;
		}
		final Rewrite rewrite = found;
		if (rewrite == null) {
			return new ExpressionCache.CacheEntry(naive, clock.millis(), OptimizationKind.NONE, 1.0,
					"no reusable pattern");
		}
		LOGGER.fine(() -> "Rewrote combined expression with " + rewrite.kind + ": " + rewrite.detail);
		return new ExpressionCache.CacheEntry(rewrite.expression, clock.millis(), rewrite.kind, rewrite.speedup,
				rewrite.detail);
	}

	private record Rewrite(String expression, OptimizationKind kind, double speedup, String detail) {
	}

	private Rewrite tryRewrite(String oldExpression, String newExpression, CombineOperator operator,
			BackendKind backend) {
		Expression oldNode = ExpressionPatterns.parseOrNull(oldExpression);
		if (oldNode == null) {
			failIfMalformed(patterns.materializedMembership(oldExpression));
			failIfMalformed(patterns.idPredicate(oldExpression));
			return null;
		}
		Expression newNode = ExpressionPatterns.parseOrNull(newExpression);
		if (newNode == null) {
			failIfMalformed(patterns.spatialExists(newExpression));
			return null;
		}
		if (operator == CombineOperator.AND && backend != BackendKind.FLAT_FILE && backend != BackendKind.IN_MEMORY) {
			PatternMatch<MaterializedMembership> membership = failIfMalformed(patterns.materializedMembership(oldNode));
			if (membership.isMatch()) {
				PatternMatch<SpatialExistsClause> exists = failIfMalformed(patterns.spatialExists(newNode));
				if (exists.isMatch()) {
					Rewrite rewrite = semiJoin(membership.getValue(), exists.getValue());
					if (rewrite != null) {
						return rewrite;
					}
				}
			}
		}
		if (operator == CombineOperator.AND) {
			Rewrite rewrite = idFirst(oldNode, newNode);
			if (rewrite != null) {
				return rewrite;
			}
		}
		return rangeCompression(oldNode, newExpression, operator, backend);
	}

	private static <T> PatternMatch<T> failIfMalformed(PatternMatch<T> match) {
		if (match.isMalformed()) {
			throw new RewriteException(match.getReason());
		}
		return match;
	}

	/**
	 * {@code col IN (SELECT key FROM mv) AND EXISTS (... target.geom ...)} becomes
	 * {@code col IN (SELECT __mv.key FROM mv AS __mv WHERE EXISTS (... __mv.geom ...))}. Only valid when every
	 * reference to the filtered dataset inside the EXISTS is its geometry or its id, both of which the
	 * materialized result carries.
	 */
	private Rewrite semiJoin(MaterializedMembership membership, SpatialExistsClause exists) {
		if (exists.innerNames().contains(MV_ALIAS)) {
			return null;
		}
		String key = membership.keyColumn().getSourceText();
		Map<Expression, String> replacements = new LinkedHashMap<>();
		for (ColumnRef ref : exists.outerRefs()) {
			if (ExpressionPatterns.isGeometryColumnName(ref.getName())) {
				replacements.put(ref, MV_ALIAS + "." + IdPredicateRenderer.quote(ref.getName()));
			} else if (ref.getName().equalsIgnoreCase(membership.column().getName())) {
				replacements.put(ref, MV_ALIAS + "." + key);
			} else {
				LOGGER.fine(() -> "Materialized result does not carry " + ref.getSourceText());
				return null;
			}
		}
		int compressedLists = compressInnerIdLists(exists, replacements);
		String rewrittenExists = TextSplicer.splice(exists.node(), replacements);
		String expression = membership.column().getSourceText() + " IN (SELECT " + MV_ALIAS + "." + key + " FROM "
				+ membership.tableText() + " AS " + MV_ALIAS + " WHERE " + rewrittenExists + ")";
		return new Rewrite(expression, OptimizationKind.MV_REUSE, MV_REUSE_SPEEDUP,
				"semi-join over " + membership.tableName()
						+ (compressedLists > 0 ? ", " + compressedLists + " source id list(s) compressed" : ""));
	}

	private int compressInnerIdLists(SpatialExistsClause exists, Map<Expression, String> replacements) {
		IdPredicateRenderer renderer = new IdPredicateRenderer(config, BackendKind.SERVER_SQL);
		int compressed = 0;
		for (Expression d : exists.node().descendants()) {
			if (!(d instanceof InList in) || replacements.containsKey(in.getOperand())
					|| exists.outerRefs().contains(in.getOperand())) {
				continue;
			}
			PatternMatch<IdPredicate> match = patterns.idPredicate(in);
			if (match.isMatch()) {
				IdSet ids = compressible(match.getValue());
				if (ids != null) {
					replacements.put(in, renderer.renderCompressed(match.getValue().columnText(), ids));
					compressed++;
				}
			}
		}
		return compressed;
	}

	/**
	 * Moves id predicates in front of spatial predicates in an AND combination.
	 */
	private Rewrite idFirst(Expression oldNode, Expression newNode) {
		List<Expression> conjuncts = new ArrayList<>(ExpressionPatterns.conjuncts(oldNode));
		conjuncts.addAll(ExpressionPatterns.conjuncts(newNode));
		List<String> idParts = new ArrayList<>();
		List<String> otherParts = new ArrayList<>();
		boolean spatial = false;
		boolean compressed = false;
		long idCount = 0;
		IdPredicateRenderer renderer = new IdPredicateRenderer(config, BackendKind.UNKNOWN);
		for (Expression conjunct : conjuncts) {
			PatternMatch<IdPredicate> match = failIfMalformed(patterns.idPredicate(conjunct));
			if (match.isMatch()) {
				IdPredicate predicate = match.getValue();
				idCount += predicate.ids().size();
				IdSet ids = compressible(predicate);
				if (ids != null) {
					idParts.add(renderer.renderCompressed(predicate.columnText(), ids));
					compressed = true;
				} else {
					idParts.add(conjunct.getSourceText());
				}
			} else {
				spatial |= ExpressionPatterns.containsSpatialPredicate(conjunct);
				otherParts.add(conjunct.getSourceText());
			}
		}
		if (idParts.isEmpty() || !spatial) {
			return null;
		}
		List<String> ordered = new ArrayList<>(idParts);
		ordered.addAll(otherParts);
		double speedup = Math.min(5.0, 1.0 + idCount / 100.0);
		if (compressed) {
			speedup = Math.max(2.0, speedup);
		}
		return new Rewrite(joinAnd(ordered), OptimizationKind.FID_LIST_OPTIMIZE, speedup,
				idCount + " id(s) checked before the spatial predicate" + (compressed ? ", compressed to ranges" : ""));
	}

	private Rewrite rangeCompression(Expression oldNode, String newExpression, CombineOperator operator,
			BackendKind backend) {
		PatternMatch<IdPredicate> match = failIfMalformed(patterns.idPredicate(oldNode));
		if (!match.isMatch()) {
			return null;
		}
		IdSet ids = compressible(match.getValue());
		if (ids == null) {
			return null;
		}
		String range = new IdPredicateRenderer(config, backend).renderCompressed(match.getValue().columnText(), ids);
		double coverage = IdSet.coverage(ids.toIdArray());
		return new Rewrite(operator.combine(range, newExpression), OptimizationKind.RANGE_OPTIMIZE, 2.0 + coverage,
				String.format(Locale.ENGLISH, "%d ids as range, coverage %.2f", ids.size(), coverage));
	}

	/**
	 * @return the compressed form of an explicit id list when it is long enough and covers enough of its span,
	 * otherwise null
	 */
	private IdSet compressible(IdPredicate predicate) {
		if (predicate.rangeForm() || predicate.ids().isCompressed()) {
			return null;
		}
		IdSet compressed = IdSet.compress(predicate.ids().toIdArray(), config.getRangeMinIds(),
				config.getRangeMinCoverage());
		return compressed.isCompressed() ? compressed : null;
	}

	private static String joinAnd(List<String> parts) {
		StringBuilder sb = new StringBuilder();
		for (String part : parts) {
			if (!sb.isEmpty()) {
				sb.append(" AND ");
			}
			sb.append('(').append(part).append(')');
		}
		return sb.toString();
	}

	public Statistics getStatistics() {
		synchronized (byKind) {
			return new Statistics(attempts.get(), successes.get(), cacheHits.get(), missed.get(),
					new EnumMap<>(byKind));
		}
	}

	public ExpressionPatterns getPatterns() {
		return patterns;
	}
}
