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
package org.neo4j.spatial.filter.stats;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.locationtech.jts.geom.Envelope;
import org.neo4j.spatial.filter.OptimizerConfig;
import org.neo4j.spatial.filter.api.FeatureRecord;
import org.neo4j.spatial.filter.api.FilterableDataset;
import org.neo4j.spatial.filter.expression.EvaluationContext;
import org.neo4j.spatial.filter.expression.Expression;
import org.neo4j.spatial.filter.expression.ExpressionEvaluationException;
import org.neo4j.spatial.filter.expression.ExpressionParser;
import org.neo4j.spatial.filter.expression.ExpressionSyntaxException;
import org.neo4j.spatial.filter.model.DatasetStats;
import org.neo4j.spatial.filter.model.SelectivityEstimate;

/**
 * Estimates the fraction of rows a filter will match. Every failure degrades to {@link #UNKNOWN_SELECTIVITY}
 * rather than an extreme, so that a broken estimate cannot push the planner into a bad strategy.
 */
public class SelectivityEstimator {

	private static final Logger LOGGER = Logger.getLogger(SelectivityEstimator.class.getName());

	public static final double UNKNOWN_SELECTIVITY = 0.5;

	private final OptimizerConfig config;
	private final StatsSampler sampler;

	public SelectivityEstimator(OptimizerConfig config, StatsSampler sampler) {
		this.config = config;
		this.sampler = sampler;
	}

	public double estimateAttributeSelectivity(FilterableDataset dataset, String expression) {
		return estimateAttributeSelectivity(dataset, expression, config.getAttributeSampleSize());
	}

	public double estimateAttributeSelectivity(FilterableDataset dataset, String expression, int sampleSize) {
		if (expression == null || expression.isBlank()) {
			return 1.0;
		}
		DatasetStats stats = sampler.sample(dataset);
		if (stats.isCountKnown() && stats.getRowCount() == 0) {
			return 0.0;
		}
		Expression parsed;
		try {
			parsed = ExpressionParser.parse(expression);
		} catch (ExpressionSyntaxException e) {
			LOGGER.fine("Cannot parse attribute filter for estimation, assuming " + UNKNOWN_SELECTIVITY + ": "
					+ e.getMessage());
			return UNKNOWN_SELECTIVITY;
		}
		List<FeatureRecord> sample;
		try {
			sample = dataset.getSample(sampleSize);
		} catch (RuntimeException e) {
			LOGGER.log(Level.FINE, "Sampling failed for " + dataset.getDatasetId() + ", assuming "
					+ UNKNOWN_SELECTIVITY, e);
			return UNKNOWN_SELECTIVITY;
		}
		int evaluated = 0;
		int matched = 0;
		for (FeatureRecord record : sample) {
			if (evaluated >= sampleSize) {
				break;
			}
			try {
				if (parsed.test(EvaluationContext.forRow(record, dataset.getDatasetId()))) {
					matched++;
				}
				evaluated++;
			} catch (ExpressionEvaluationException e) {
				LOGGER.finest(() -> "Row " + record.getId() + " not evaluable: " + e.getMessage());
			}
		}
		if (evaluated == 0) {
			return UNKNOWN_SELECTIVITY;
		}
		return (double) matched / evaluated;
	}

	/**
	 * Ratio of the dataset extent covered by the source extent, dampened because bounding box overlap always
	 * overestimates the rows an exact predicate keeps.
	 */
	public double estimateSpatialSelectivity(FilterableDataset dataset, Envelope sourceExtent) {
		if (sourceExtent == null || sourceExtent.isNull()) {
			return 1.0;
		}
		Envelope targetExtent = sampler.sample(dataset).getExtent();
		if (targetExtent == null || targetExtent.isNull()) {
			return UNKNOWN_SELECTIVITY;
		}
		if (!targetExtent.intersects(sourceExtent)) {
			return 0.0;
		}
		double targetArea = targetExtent.getArea();
		if (targetArea <= 0.0) {
			return UNKNOWN_SELECTIVITY;
		}
		double overlap = targetExtent.intersection(sourceExtent).getArea() / targetArea;
		return Math.max(0.0, Math.min(1.0, overlap * config.getSpatialDampening()));
	}

	public SelectivityEstimate estimate(FilterableDataset dataset, String attributeExpression,
			Envelope sourceExtent) {
		double attribute = estimateAttributeSelectivity(dataset, attributeExpression);
		double spatial = estimateSpatialSelectivity(dataset, sourceExtent);
		return new SelectivityEstimate(attribute, spatial, attributeExpression, sourceExtent != null);
	}
}
