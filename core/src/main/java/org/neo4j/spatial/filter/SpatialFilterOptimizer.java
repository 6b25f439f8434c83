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

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.CancellationToken;
import org.neo4j.spatial.filter.api.FilterExecutionException;
import org.neo4j.spatial.filter.api.FilterableDataset;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.MaterializationException;
import org.neo4j.spatial.filter.api.RewriteException;
import org.neo4j.spatial.filter.api.ServerConnection;
import org.neo4j.spatial.filter.api.monitoring.Listener;
import org.neo4j.spatial.filter.api.monitoring.OptimizerMonitor;
import org.neo4j.spatial.filter.backend.BufferedSourceRequest;
import org.neo4j.spatial.filter.backend.EmbeddedSqlRewriter;
import org.neo4j.spatial.filter.backend.FlatFileRewriter;
import org.neo4j.spatial.filter.backend.InMemoryIndexer;
import org.neo4j.spatial.filter.backend.ServerBackendRewriter;
import org.neo4j.spatial.filter.backend.ServerRewrite;
import org.neo4j.spatial.filter.backend.SessionRegistry;
import org.neo4j.spatial.filter.execution.BatchMatcher;
import org.neo4j.spatial.filter.execution.ChunkedExecutor;
import org.neo4j.spatial.filter.execution.ChunkedResult;
import org.neo4j.spatial.filter.execution.DatasetOperation;
import org.neo4j.spatial.filter.execution.ParallelDispatcher;
import org.neo4j.spatial.filter.model.CacheKey;
import org.neo4j.spatial.filter.model.CombineOperator;
import org.neo4j.spatial.filter.model.CombinedRewriteResult;
import org.neo4j.spatial.filter.model.DatasetStats;
import org.neo4j.spatial.filter.model.FilterOutcome;
import org.neo4j.spatial.filter.model.FilterPlan;
import org.neo4j.spatial.filter.model.MaterializedResultRef;
import org.neo4j.spatial.filter.model.SelectivityEstimate;
import org.neo4j.spatial.filter.model.SpatialPredicate;
import org.neo4j.spatial.filter.monitoring.EmptyMonitor;
import org.neo4j.spatial.filter.plan.PlanBuilder;
import org.neo4j.spatial.filter.rewrite.BackendDialectDetector;
import org.neo4j.spatial.filter.rewrite.CombinedExpressionRewriter;
import org.neo4j.spatial.filter.rewrite.ExpressionCache;
import org.neo4j.spatial.filter.rewrite.ExpressionPatterns;
import org.neo4j.spatial.filter.stats.SelectivityEstimator;
import org.neo4j.spatial.filter.stats.StatsSampler;

/**
 * Entry point for planning, rewriting and running spatial filters. An instance owns all caches and the worker
 * pool; nothing is shared between instances. Call {@link #cleanupSession(String)} when a session ends and
 * {@link #invalidateDataset(String)} when a dataset's filter changes outside the optimizer.
 * <p>
 * Planning and rewriting never fail: they fall back to the straightforward expression. Only
 * {@link FilterExecutionException} is thrown to callers.
 */
public class SpatialFilterOptimizer implements AutoCloseable {

	private static final Logger LOGGER = Logger.getLogger(SpatialFilterOptimizer.class.getName());

	private final OptimizerConfig config;
	private final OptimizerMonitor monitor;
	private final StatsSampler sampler;
	private final SelectivityEstimator estimator;
	private final PlanBuilder planBuilder;
	private final ExpressionCache cache;
	private final CombinedExpressionRewriter combiner;
	private final ServerBackendRewriter server;
	private final EmbeddedSqlRewriter embedded;
	private final FlatFileRewriter flatFile;
	private final InMemoryIndexer inMemory;
	private final ChunkedExecutor chunkedExecutor;
	private final ParallelDispatcher dispatcher;

	public SpatialFilterOptimizer(OptimizerConfig config) {
		this(config, null, new EmptyMonitor(), Clock.systemUTC());
	}

	/**
	 * @param connection the server backend used for materialized results, or null if there is none
	 */
	public SpatialFilterOptimizer(OptimizerConfig config, ServerConnection connection, OptimizerMonitor monitor) {
		this(config, connection, monitor, Clock.systemUTC());
	}

	public SpatialFilterOptimizer(OptimizerConfig config, ServerConnection connection, OptimizerMonitor monitor,
			Clock clock) {
		this.config = config;
		this.monitor = monitor;
		this.sampler = new StatsSampler(config, clock);
		this.estimator = new SelectivityEstimator(config, sampler);
		this.planBuilder = new PlanBuilder(config);
		this.cache = new ExpressionCache(config.getCacheMaxEntries(), clock);
		this.combiner = new CombinedExpressionRewriter(config, cache, new ExpressionPatterns(), monitor, clock);
		this.server = connection == null ? null : new ServerBackendRewriter(config, connection, combiner);
		this.embedded = new EmbeddedSqlRewriter(config, combiner);
		this.flatFile = new FlatFileRewriter(config, combiner);
		this.inMemory = new InMemoryIndexer();
		this.chunkedExecutor = new ChunkedExecutor();
		this.dispatcher = new ParallelDispatcher(config);
	}

	public DatasetStats sampleStats(FilterableDataset dataset) {
		return sampler.sample(dataset);
	}

	public DatasetStats sampleStats(FilterableDataset dataset, boolean forceRefresh) {
		return sampler.sample(dataset, forceRefresh);
	}

	public SelectivityEstimate estimate(FilterableDataset dataset, String attributeExpression,
			Envelope sourceExtent) {
		return estimator.estimate(dataset, attributeExpression, sourceExtent);
	}

	public FilterPlan buildPlan(DatasetStats stats, SelectivityEstimate estimate) {
		FilterPlan plan = planBuilder.buildPlan(stats, estimate);
		monitor.addCase("plan." + plan.getStrategy().name());
		return plan;
	}

	/**
	 * Samples, estimates and plans in one call.
	 */
	public FilterPlan planFor(FilterableDataset dataset, String attributeExpression, Envelope sourceExtent) {
		DatasetStats stats = sampleStats(dataset);
		FilterPlan plan = buildPlan(stats, estimate(dataset, attributeExpression, sourceExtent));
		LOGGER.fine(() -> "Plan for " + dataset.getDatasetId() + ": " + plan);
		return plan;
	}

	/**
	 * Combines expressions for a dataset whose backend is unknown, classifying the existing expression.
	 */
	public CombinedRewriteResult rewriteCombined(String oldExpression, String newExpression,
			CombineOperator operator, String datasetId) {
		return rewriteCombined(oldExpression, newExpression, operator, datasetId,
				BackendDialectDetector.detect(oldExpression));
	}

	/**
	 * @throws FilterExecutionException if the existing expression reads a materialized result that was cleaned
	 * up
	 */
	public CombinedRewriteResult rewriteCombined(String oldExpression, String newExpression,
			CombineOperator operator, String datasetId, BackendKind backend) {
		switch (backend) {
			case SERVER_SQL:
				if (server != null) {
					try {
						return server.rewriteCombined(oldExpression, newExpression, operator, datasetId);
					} catch (MaterializationException e) {
						throw new FilterExecutionException(datasetId, e.getMessage(), e);
					}
				}
				return combiner.rewrite(oldExpression, newExpression, operator, datasetId, backend);
			case EMBEDDED_SQL:
				return embedded.rewriteCombined(oldExpression, newExpression, operator, datasetId);
			case FLAT_FILE:
				try {
					return flatFile.rewriteCombined(oldExpression, newExpression, operator, datasetId);
				} catch (RewriteException e) {
					LOGGER.warning("Missed optimization for flat file dataset " + datasetId + ": " + e.getMessage());
					return CombinedRewriteResult.unchanged(operator.combine(oldExpression, newExpression),
							e.getMessage());
				}
			default:
				return combiner.rewrite(oldExpression, newExpression, operator, datasetId, backend);
		}
	}

	public String getOrBuildExpression(CacheKey key, Supplier<String> builder) {
		return cache.getOrBuild(key, builder);
	}

	/**
	 * Literal id predicate in the dialect of the backend.
	 */
	public String idPredicate(BackendKind backend, IdSet ids) {
		return switch (backend) {
			case FLAT_FILE -> flatFile.idPredicate(ids);
			default -> embedded.idPredicate(ids);
		};
	}

	/**
	 * @throws IllegalStateException if this optimizer has no server connection
	 */
	public ServerRewrite prepareBufferedSource(String sessionId, BufferedSourceRequest request) {
		return requireServer().prepareBufferedSource(sessionId, request);
	}

	/**
	 * @throws IllegalStateException if this optimizer has no server connection
	 */
	public ServerRewrite materializeFilterResult(String sessionId, String targetTable, String keyColumn,
			String geometryColumn, String expression) {
		return requireServer().materializeFilterResult(sessionId, targetTable, keyColumn, geometryColumn,
				expression);
	}

	public IdSet selectInMemory(FilterableDataset dataset, Geometry source, Collection<SpatialPredicate> predicates,
			IdSet restriction) {
		return inMemory.select(dataset, source, predicates, restriction);
	}

	/**
	 * Drops every cached decision about the dataset: expressions, statistics and in-memory indexes.
	 *
	 * @return the number of cached expressions removed
	 */
	public int invalidateDataset(String datasetId) {
		int removed = cache.invalidateDataset(datasetId);
		sampler.invalidate(datasetId);
		inMemory.clearCache(datasetId);
		LOGGER.fine(() -> "Invalidated " + removed + " cached expression(s) of " + datasetId);
		return removed;
	}

	/**
	 * Retires all materialized results of the session and forgets cached expressions that read them.
	 *
	 * @return the number of materialized results retired
	 */
	public int cleanupSession(String sessionId) {
		if (server == null) {
			return 0;
		}
		List<MaterializedResultRef> results = server.getRegistry().getResults(sessionId);
		int retired = server.cleanupSession(sessionId);
		if (!results.isEmpty()) {
			int forgotten = cache.invalidateExpressions(
					expression -> results.stream().anyMatch(ref -> expression.contains(ref.qualifiedName())));
			LOGGER.info("Session " + sessionId + " cleaned up: " + retired + " result(s) retired, " + forgotten
					+ " cached expression(s) forgotten");
		}
		return retired;
	}

	/**
	 * Runs the finished expression on the dataset. Materialized results the expression reads are leased for the
	 * duration, so a concurrent {@link #cleanupSession(String)} drops them only afterwards.
	 *
	 * @return the number of matched rows
	 * @throws FilterExecutionException if the backend rejected the expression, or the expression reads a
	 * materialized result that was cleaned up
	 */
	public long applyFilter(FilterableDataset dataset, String expression) {
		SessionRegistry.Leases leases = leaseResults(dataset, expression);
		try (leases) {
			long rows = dataset.executeFilter(expression);
			monitor.addCase("execute.SUCCEEDED");
			return rows;
		} catch (FilterExecutionException e) {
			monitor.addCase("execute.FAILED");
			throw e;
		} catch (RuntimeException e) {
			monitor.addCase("execute.FAILED");
			throw new FilterExecutionException(dataset.getDatasetId(),
					"Filter failed on " + dataset.getDatasetId() + ": " + e.getMessage(), e);
		}
	}

	private SessionRegistry.Leases leaseResults(FilterableDataset dataset, String expression) {
		try {
			return leaseResults(expression);
		} catch (MaterializationException e) {
			monitor.addCase("execute.FAILED");
			throw new FilterExecutionException(dataset.getDatasetId(), e.getMessage(), e);
		}
	}

	/**
	 * Leases the materialized results an expression reads, for callers running it through their own
	 * {@link DatasetOperation} or {@link BatchMatcher}. Close the leases when the expression is no longer read.
	 *
	 * @throws MaterializationException if the expression reads a materialized result that was cleaned up
	 */
	public SessionRegistry.Leases leaseResults(String expression) {
		return server == null ? SessionRegistry.Leases.none() : server.getRegistry().acquireReferenced(expression);
	}

	public ChunkedResult executeChunked(FilterableDataset dataset, FilterPlan plan, IdSet restriction,
			BatchMatcher matcher, Listener listener, CancellationToken cancellation) {
		return chunkedExecutor.execute(dataset, plan, restriction, matcher, listener, cancellation);
	}

	public List<FilterOutcome> filterMany(List<? extends FilterableDataset> datasets, DatasetOperation operation,
			CancellationToken cancellation) {
		List<FilterOutcome> outcomes = dispatcher.filterMany(datasets, operation, cancellation);
		for (FilterOutcome outcome : outcomes) {
			monitor.addCase("dispatch." + outcome.getStatus().name());
		}
		return outcomes;
	}

	/**
	 * Applies one finished expression per dataset through {@link #applyFilter(FilterableDataset, String)}, in
	 * parallel where the datasets allow it.
	 */
	public List<FilterOutcome> applyFilterMany(List<? extends FilterableDataset> datasets,
			Function<FilterableDataset, String> expressionFor, CancellationToken cancellation) {
		return filterMany(datasets, dataset -> applyFilter(dataset, expressionFor.apply(dataset)), cancellation);
	}

	private ServerBackendRewriter requireServer() {
		if (server == null) {
			throw new IllegalStateException("No server connection configured");
		}
		return server;
	}

	public OptimizerConfig getConfig() {
		return config;
	}

	public OptimizerMonitor getMonitor() {
		return monitor;
	}

	public ExpressionCache getExpressionCache() {
		return cache;
	}

	public CombinedExpressionRewriter getCombinedRewriter() {
		return combiner;
	}

	public InMemoryIndexer getInMemoryIndexer() {
		return inMemory;
	}

	/**
	 * Retires the results of every session and stops the worker pool.
	 */
	@Override
	public void close() {
		dispatcher.close();
		if (server != null) {
			try {
				server.getRegistry().cleanupAll();
			} catch (RuntimeException e) {
				LOGGER.log(Level.WARNING, "Cleanup of materialized results failed on close", e);
			}
		}
		cache.clear();
		sampler.clear();
		inMemory.clearAll();
	}
}
