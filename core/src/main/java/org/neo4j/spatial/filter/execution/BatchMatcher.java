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
package org.neo4j.spatial.filter.execution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import org.neo4j.spatial.filter.api.FeatureRecord;

/**
 * Decides which rows of one batch pass the filter.
 */
@FunctionalInterface
public interface BatchMatcher {

	/**
	 * @return the ids of the matching rows
	 */
	Collection<Long> match(List<FeatureRecord> batch) throws Exception;

	/**
	 * A matcher testing each row on its own.
	 */
	static BatchMatcher of(Predicate<FeatureRecord> predicate) {
		return batch -> {
			List<Long> ids = new ArrayList<>();
			for (FeatureRecord record : batch) {
				if (predicate.test(record)) {
					ids.add(record.getId());
				}
			}
			return ids;
		};
	}
}
