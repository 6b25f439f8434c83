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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.neo4j.spatial.filter.api.Configurable;

/**
 * Tunable thresholds of the optimizer. The defaults are empirical values, kept configurable so they can be
 * calibrated against real workloads.
 */
public class OptimizerConfig implements Configurable {

	public static final String KEY_SMALL_DATASET_ROWS = "smallDatasetRows";
	public static final String KEY_MEDIUM_DATASET_ROWS = "mediumDatasetRows";
	public static final String KEY_LARGE_DATASET_ROWS = "largeDatasetRows";
	public static final String KEY_ATTRIBUTE_FIRST_SELECTIVITY = "attributeFirstSelectivity";
	public static final String KEY_BBOX_PREFILTER_SELECTIVITY = "bboxPrefilterSelectivity";
	public static final String KEY_MIN_CHUNK_SIZE = "minChunkSize";
	public static final String KEY_MAX_CHUNK_SIZE = "maxChunkSize";
	public static final String KEY_BASE_CHUNK_SIZE = "baseChunkSize";
	public static final String KEY_DEFAULT_CHUNK_SIZE = "defaultChunkSize";
	public static final String KEY_STATS_TTL_SECONDS = "statsTtlSeconds";
	public static final String KEY_STATS_SAMPLE_SIZE = "statsSampleSize";
	public static final String KEY_ATTRIBUTE_SAMPLE_SIZE = "attributeSampleSize";
	public static final String KEY_SPATIAL_DAMPENING = "spatialDampening";
	public static final String KEY_CACHE_MAX_ENTRIES = "cacheMaxEntries";
	public static final String KEY_RANGE_MIN_IDS = "rangeMinIds";
	public static final String KEY_RANGE_MIN_COVERAGE = "rangeMinCoverage";
	public static final String KEY_MAX_INLINE_IDS = "maxInlineIds";
	public static final String KEY_MATERIALIZATION_THRESHOLD = "materializationThreshold";
	public static final String KEY_SIMPLIFY_FACTOR = "simplifyFactor";
	public static final String KEY_MIN_SIMPLIFY_TOLERANCE = "minSimplifyTolerance";
	public static final String KEY_MAX_SIMPLIFY_TOLERANCE = "maxSimplifyTolerance";
	public static final String KEY_BUFFER_SEGMENTS = "bufferSegments";
	public static final String KEY_REDUCED_BUFFER_SEGMENTS = "reducedBufferSegments";
	public static final String KEY_REDUCE_SEGMENTS_ROWS = "reduceSegmentsRows";
	public static final String KEY_TEMP_SCHEMA = "tempSchema";
	public static final String KEY_MAX_WORKERS = "maxWorkers";
	public static final String KEY_DATASET_TIMEOUT_SECONDS = "datasetTimeoutSeconds";

	private long smallDatasetRows = 1000;
	private long mediumDatasetRows = 50000;
	private long largeDatasetRows = 200000;
	private double attributeFirstSelectivity = 0.3;
	private double bboxPrefilterSelectivity = 0.5;
	private int minChunkSize = 1000;
	private int maxChunkSize = 50000;
	private int baseChunkSize = 10000;
	private int defaultChunkSize = 10000;
	private long statsTtlSeconds = 300;
	private int statsSampleSize = 100;
	private int attributeSampleSize = 200;
	private double spatialDampening = 0.7;
	private int cacheMaxEntries = 100;
	private int rangeMinIds = 20;
	private double rangeMinCoverage = 0.5;
	private int maxInlineIds = 500;
	private int materializationThreshold = 50;
	private double simplifyFactor = 0.1;
	private double minSimplifyTolerance = 0.5;
	private double maxSimplifyTolerance = 10.0;
	private int bufferSegments = 8;
	private int reducedBufferSegments = 3;
	private long reduceSegmentsRows = 10000;
	private String tempSchema = "filter_temp";
	private int maxWorkers = 0;
	private long datasetTimeoutSeconds = 300;

	public static OptimizerConfig defaults() {
		return new OptimizerConfig();
	}

	public static OptimizerConfig fromJson(String json) {
		OptimizerConfig config = new OptimizerConfig();
		config.setConfiguration(json);
		return config;
	}

	/**
	 * Loads a JSON configuration from the classpath, falling back to the defaults when the resource is absent.
	 */
	public static OptimizerConfig fromResource(String resource) {
		OptimizerConfig config = new OptimizerConfig();
		try (InputStream in = OptimizerConfig.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				return config;
			}
			try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
				Object parsed = JSONValue.parse(reader);
				if (!(parsed instanceof JSONObject jsonObject)) {
					throw new IllegalArgumentException("Configuration resource is not a JSON object: " + resource);
				}
				config.configure(toMap(jsonObject));
			}
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read configuration resource " + resource, e);
		}
		return config;
	}

	@Override
	public void setConfiguration(String jsonConfig) {
		if (jsonConfig == null || jsonConfig.isBlank()) {
			return;
		}
		Object parsed = JSONValue.parse(jsonConfig);
		if (!(parsed instanceof JSONObject jsonObject)) {
			throw new IllegalArgumentException("Configuration is not a JSON object: " + jsonConfig);
		}
		configure(toMap(jsonObject));
	}

	private static Map<String, Object> toMap(JSONObject jsonObject) {
		Map<String, Object> config = new LinkedHashMap<>();
		for (Object key : jsonObject.keySet()) {
			config.put(key.toString(), jsonObject.get(key));
		}
		return config;
	}

	@Override
	public String getConfiguration() {
		Map<String, Object> config = new LinkedHashMap<>();
		config.put(KEY_SMALL_DATASET_ROWS, smallDatasetRows);
		config.put(KEY_MEDIUM_DATASET_ROWS, mediumDatasetRows);
		config.put(KEY_LARGE_DATASET_ROWS, largeDatasetRows);
		config.put(KEY_ATTRIBUTE_FIRST_SELECTIVITY, attributeFirstSelectivity);
		config.put(KEY_BBOX_PREFILTER_SELECTIVITY, bboxPrefilterSelectivity);
		config.put(KEY_MIN_CHUNK_SIZE, minChunkSize);
		config.put(KEY_MAX_CHUNK_SIZE, maxChunkSize);
		config.put(KEY_BASE_CHUNK_SIZE, baseChunkSize);
		config.put(KEY_DEFAULT_CHUNK_SIZE, defaultChunkSize);
		config.put(KEY_STATS_TTL_SECONDS, statsTtlSeconds);
		config.put(KEY_STATS_SAMPLE_SIZE, statsSampleSize);
		config.put(KEY_ATTRIBUTE_SAMPLE_SIZE, attributeSampleSize);
		config.put(KEY_SPATIAL_DAMPENING, spatialDampening);
		config.put(KEY_CACHE_MAX_ENTRIES, cacheMaxEntries);
		config.put(KEY_RANGE_MIN_IDS, rangeMinIds);
		config.put(KEY_RANGE_MIN_COVERAGE, rangeMinCoverage);
		config.put(KEY_MAX_INLINE_IDS, maxInlineIds);
		config.put(KEY_MATERIALIZATION_THRESHOLD, materializationThreshold);
		config.put(KEY_SIMPLIFY_FACTOR, simplifyFactor);
		config.put(KEY_MIN_SIMPLIFY_TOLERANCE, minSimplifyTolerance);
		config.put(KEY_MAX_SIMPLIFY_TOLERANCE, maxSimplifyTolerance);
		config.put(KEY_BUFFER_SEGMENTS, bufferSegments);
		config.put(KEY_REDUCED_BUFFER_SEGMENTS, reducedBufferSegments);
		config.put(KEY_REDUCE_SEGMENTS_ROWS, reduceSegmentsRows);
		config.put(KEY_TEMP_SCHEMA, tempSchema);
		config.put(KEY_MAX_WORKERS, maxWorkers);
		config.put(KEY_DATASET_TIMEOUT_SECONDS, datasetTimeoutSeconds);
		return JSONObject.toJSONString(config);
	}

	@Override
	public void configure(Map<String, Object> config) {
		config.forEach((key, rawValue) -> {
			if (rawValue == null) {
				throw new IllegalArgumentException("OptimizerConfig value for '" + key + "' must not be null");
			}
			String value = rawValue.toString();
			switch (key) {
				case KEY_SMALL_DATASET_ROWS -> smallDatasetRows = nonNegativeLong(key, value);
				case KEY_MEDIUM_DATASET_ROWS -> mediumDatasetRows = nonNegativeLong(key, value);
				case KEY_LARGE_DATASET_ROWS -> largeDatasetRows = nonNegativeLong(key, value);
				case KEY_ATTRIBUTE_FIRST_SELECTIVITY -> attributeFirstSelectivity = fraction(key, value);
				case KEY_BBOX_PREFILTER_SELECTIVITY -> bboxPrefilterSelectivity = fraction(key, value);
				case KEY_MIN_CHUNK_SIZE -> minChunkSize = positiveInt(key, value);
				case KEY_MAX_CHUNK_SIZE -> maxChunkSize = positiveInt(key, value);
				case KEY_BASE_CHUNK_SIZE -> baseChunkSize = positiveInt(key, value);
				case KEY_DEFAULT_CHUNK_SIZE -> defaultChunkSize = positiveInt(key, value);
				case KEY_STATS_TTL_SECONDS -> statsTtlSeconds = nonNegativeLong(key, value);
				case KEY_STATS_SAMPLE_SIZE -> statsSampleSize = positiveInt(key, value);
				case KEY_ATTRIBUTE_SAMPLE_SIZE -> attributeSampleSize = positiveInt(key, value);
				case KEY_SPATIAL_DAMPENING -> spatialDampening = fraction(key, value);
				case KEY_CACHE_MAX_ENTRIES -> cacheMaxEntries = positiveInt(key, value);
				case KEY_RANGE_MIN_IDS -> rangeMinIds = positiveInt(key, value);
				case KEY_RANGE_MIN_COVERAGE -> rangeMinCoverage = fraction(key, value);
				case KEY_MAX_INLINE_IDS -> maxInlineIds = positiveInt(key, value);
				case KEY_MATERIALIZATION_THRESHOLD -> materializationThreshold = positiveInt(key, value);
				case KEY_SIMPLIFY_FACTOR -> simplifyFactor = nonNegativeDouble(key, value);
				case KEY_MIN_SIMPLIFY_TOLERANCE -> minSimplifyTolerance = nonNegativeDouble(key, value);
				case KEY_MAX_SIMPLIFY_TOLERANCE -> maxSimplifyTolerance = nonNegativeDouble(key, value);
				case KEY_BUFFER_SEGMENTS -> bufferSegments = positiveInt(key, value);
				case KEY_REDUCED_BUFFER_SEGMENTS -> reducedBufferSegments = positiveInt(key, value);
				case KEY_REDUCE_SEGMENTS_ROWS -> reduceSegmentsRows = nonNegativeLong(key, value);
				case KEY_TEMP_SCHEMA -> {
					if (value.isBlank() || !value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
						throw new IllegalArgumentException("Invalid schema name for '" + key + "': " + value);
					}
					tempSchema = value;
				}
				case KEY_MAX_WORKERS -> maxWorkers = (int) nonNegativeLong(key, value);
				case KEY_DATASET_TIMEOUT_SECONDS -> datasetTimeoutSeconds = nonNegativeLong(key, value);
				default -> throw new IllegalArgumentException("No such OptimizerConfig configuration key: " + key);
			}
		});
		if (minChunkSize > maxChunkSize) {
			throw new IllegalArgumentException(
					KEY_MIN_CHUNK_SIZE + " " + minChunkSize + " exceeds " + KEY_MAX_CHUNK_SIZE + " " + maxChunkSize);
		}
		if (minSimplifyTolerance > maxSimplifyTolerance) {
			throw new IllegalArgumentException(KEY_MIN_SIMPLIFY_TOLERANCE + " exceeds " + KEY_MAX_SIMPLIFY_TOLERANCE);
		}
	}

	private static long nonNegativeLong(String key, String value) {
		long parsed;
		try {
			parsed = (long) Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("OptimizerConfig value for '" + key + "' is not a number: " + value);
		}
		if (parsed < 0) {
			throw new IllegalArgumentException("OptimizerConfig does not allow negative " + key + ": " + value);
		}
		return parsed;
	}

	private static int positiveInt(String key, String value) {
		long parsed = nonNegativeLong(key, value);
		if (parsed < 1 || parsed > Integer.MAX_VALUE) {
			throw new IllegalArgumentException("OptimizerConfig value for '" + key + "' out of range: " + value);
		}
		return (int) parsed;
	}

	private static double nonNegativeDouble(String key, String value) {
		double parsed;
		try {
			parsed = Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("OptimizerConfig value for '" + key + "' is not a number: " + value);
		}
		if (parsed < 0 || Double.isNaN(parsed)) {
			throw new IllegalArgumentException("OptimizerConfig does not allow negative " + key + ": " + value);
		}
		return parsed;
	}

	private static double fraction(String key, String value) {
		double parsed = nonNegativeDouble(key, value);
		if (parsed > 1.0) {
			throw new IllegalArgumentException("OptimizerConfig value for '" + key + "' must be within [0,1]: " + value);
		}
		return parsed;
	}

	public long getSmallDatasetRows() {
		return smallDatasetRows;
	}

	public long getMediumDatasetRows() {
		return mediumDatasetRows;
	}

	public long getLargeDatasetRows() {
		return largeDatasetRows;
	}

	public double getAttributeFirstSelectivity() {
		return attributeFirstSelectivity;
	}

	public double getBboxPrefilterSelectivity() {
		return bboxPrefilterSelectivity;
	}

	public int getMinChunkSize() {
		return minChunkSize;
	}

	public int getMaxChunkSize() {
		return maxChunkSize;
	}

	public int getBaseChunkSize() {
		return baseChunkSize;
	}

	public int getDefaultChunkSize() {
		return defaultChunkSize;
	}

	public long getStatsTtlSeconds() {
		return statsTtlSeconds;
	}

	public int getStatsSampleSize() {
		return statsSampleSize;
	}

	public int getAttributeSampleSize() {
		return attributeSampleSize;
	}

	public double getSpatialDampening() {
		return spatialDampening;
	}

	public int getCacheMaxEntries() {
		return cacheMaxEntries;
	}

	public int getRangeMinIds() {
		return rangeMinIds;
	}

	public double getRangeMinCoverage() {
		return rangeMinCoverage;
	}

	public int getMaxInlineIds() {
		return maxInlineIds;
	}

	public int getMaterializationThreshold() {
		return materializationThreshold;
	}

	public double getSimplifyFactor() {
		return simplifyFactor;
	}

	public double getMinSimplifyTolerance() {
		return minSimplifyTolerance;
	}

	public double getMaxSimplifyTolerance() {
		return maxSimplifyTolerance;
	}

	public int getBufferSegments() {
		return bufferSegments;
	}

	public int getReducedBufferSegments() {
		return reducedBufferSegments;
	}

	public long getReduceSegmentsRows() {
		return reduceSegmentsRows;
	}

	public String getTempSchema() {
		return tempSchema;
	}

	/**
	 * @return the configured worker count, or min(4, cores - 1) with a floor of one when not configured
	 */
	public int getEffectiveWorkers() {
		if (maxWorkers > 0) {
			return maxWorkers;
		}
		return Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors() - 1));
	}

	public long getDatasetTimeoutSeconds() {
		return datasetTimeoutSeconds;
	}
}
