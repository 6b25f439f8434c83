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
package org.neo4j.spatial.filter.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A set of row ids, held either as an explicit sorted list or as ranges with an explicit exclusion list. Both
 * forms always reduce back to the exact same ids through {@link #toIdArray()}.
 */
public final class IdSet implements Iterable<Long> {

	private static final IdSet EMPTY = new IdSet(new long[0], null, null);

	private final long[] ids;
	private final List<IdRange> ranges;
	private final long[] exclusions;

	private IdSet(long[] ids, List<IdRange> ranges, long[] exclusions) {
		this.ids = ids;
		this.ranges = ranges;
		this.exclusions = exclusions;
	}

	public static IdSet empty() {
		return EMPTY;
	}

	public static IdSet of(long... ids) {
		return new IdSet(sortedDistinct(ids), null, null);
	}

	public static IdSet of(Collection<? extends Number> ids) {
		long[] values = new long[ids.size()];
		int i = 0;
		for (Number id : ids) {
			values[i++] = id.longValue();
		}
		return of(values);
	}

	/**
	 * Creates a compressed set. Overlapping or adjacent ranges are merged and exclusions outside every range are
	 * dropped, since they exclude nothing.
	 */
	public static IdSet ofRanges(List<IdRange> ranges, Collection<? extends Number> exclusions) {
		List<IdRange> merged = mergeRanges(ranges);
		long[] excluded = exclusions.stream().mapToLong(Number::longValue).toArray();
		excluded = Arrays.stream(sortedDistinct(excluded))
				.filter(id -> merged.stream().anyMatch(r -> r.contains(id)))
				.toArray();
		return new IdSet(null, Collections.unmodifiableList(merged), excluded);
	}

	/**
	 * Converts the ids into a single range with exclusions when there are at least {@code minIds} of them and
	 * they cover at least {@code minCoverage} of the span between their smallest and largest value. Otherwise the
	 * explicit form is returned.
	 */
	public static IdSet compress(long[] ids, int minIds, double minCoverage) {
		long[] sorted = sortedDistinct(ids);
		if (sorted.length < Math.max(2, minIds) || coverage(sorted) < minCoverage) {
			return new IdSet(sorted, null, null);
		}
		long min = sorted[0];
		long max = sorted[sorted.length - 1];
		long gaps = (max - min + 1) - sorted.length;
		long[] excluded = new long[(int) gaps];
		int e = 0;
		long expected = min;
		for (long id : sorted) {
			while (expected < id) {
				excluded[e++] = expected++;
			}
			expected = id + 1;
		}
		return new IdSet(null, List.of(new IdRange(min, max)), excluded);
	}

	/**
	 * @return the fraction of the span between the smallest and largest id that is actually present
	 */
	public static double coverage(long[] sortedDistinct) {
		if (sortedDistinct.length == 0) {
			return 0.0;
		}
		double span = (double) sortedDistinct[sortedDistinct.length - 1] - sortedDistinct[0] + 1;
		return sortedDistinct.length / span;
	}

	/**
	 * Splits sorted distinct ids into maximal runs of consecutive values.
	 */
	public static List<IdRange> runs(long[] sortedDistinct) {
		List<IdRange> runs = new ArrayList<>();
		if (sortedDistinct.length == 0) {
			return runs;
		}
		long start = sortedDistinct[0];
		long end = start;
		for (int i = 1; i < sortedDistinct.length; i++) {
			if (sortedDistinct[i] == end + 1) {
				end = sortedDistinct[i];
			} else {
				runs.add(new IdRange(start, end));
				start = end = sortedDistinct[i];
			}
		}
		runs.add(new IdRange(start, end));
		return runs;
	}

	public boolean isCompressed() {
		return ranges != null;
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public List<IdRange> getRanges() {
		return ranges == null ? List.of() : ranges;
	}

	public long[] getExclusions() {
		return exclusions == null ? new long[0] : exclusions.clone();
	}

	public long size() {
		if (ranges == null) {
			return ids.length;
		}
		long size = 0;
		for (IdRange range : ranges) {
			size += range.length();
		}
		return size - exclusions.length;
	}

	public boolean contains(long id) {
		if (ranges == null) {
			return Arrays.binarySearch(ids, id) >= 0;
		}
		for (IdRange range : ranges) {
			if (range.contains(id)) {
				return Arrays.binarySearch(exclusions, id) < 0;
			}
		}
		return false;
	}

	public long min() {
		if (isEmpty()) {
			throw new NoSuchElementException("Empty id set");
		}
		return toIdArray()[0];
	}

	public long max() {
		long[] all = toIdArray();
		if (all.length == 0) {
			throw new NoSuchElementException("Empty id set");
		}
		return all[all.length - 1];
	}

	/**
	 * @return the explicit sorted ids this set stands for
	 */
	public long[] toIdArray() {
		if (ranges == null) {
			return ids.clone();
		}
		long[] result = new long[Math.toIntExact(size())];
		int i = 0;
		for (IdRange range : ranges) {
			for (long id = range.min(); id <= range.max(); id++) {
				if (Arrays.binarySearch(exclusions, id) < 0) {
					result[i++] = id;
				}
			}
		}
		return result;
	}

	public List<Long> toIdList() {
		List<Long> list = new ArrayList<>();
		for (long id : toIdArray()) {
			list.add(id);
		}
		return list;
	}

	/**
	 * @return the explicit form of this set
	 */
	public IdSet expand() {
		return ranges == null ? this : new IdSet(toIdArray(), null, null);
	}

	@Override
	public Iterator<Long> iterator() {
		return toIdList().iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof IdSet other)) {
			return false;
		}
		return Arrays.equals(toIdArray(), other.toIdArray());
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(toIdArray());
	}

	@Override
	public String toString() {
		if (ranges == null) {
			return ids.length <= 10 ? "IdSet" + Arrays.toString(ids) : "IdSet[" + ids.length + " ids]";
		}
		return "IdSet" + ranges + " excluding " + exclusions.length;
	}

	private static long[] sortedDistinct(long[] ids) {
		return Arrays.stream(ids).sorted().distinct().toArray();
	}

	private static List<IdRange> mergeRanges(List<IdRange> ranges) {
		List<IdRange> sorted = new ArrayList<>(ranges);
		Collections.sort(sorted);
		List<IdRange> merged = new ArrayList<>();
		for (IdRange range : sorted) {
			if (!merged.isEmpty()) {
				IdRange last = merged.get(merged.size() - 1);
				if (range.min() <= last.max() + 1) {
					merged.set(merged.size() - 1, new IdRange(last.min(), Math.max(last.max(), range.max())));
					continue;
				}
			}
			merged.add(range);
		}
		return merged;
	}
}
