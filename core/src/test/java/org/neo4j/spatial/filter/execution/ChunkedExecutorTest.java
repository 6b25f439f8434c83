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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.api.CancellationToken;
import org.neo4j.spatial.filter.api.FilterExecutionException;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.api.monitoring.Listener;
import org.neo4j.spatial.filter.monitoring.NullListener;
import org.neo4j.spatial.filter.testutils.FeatureFixtures;
import org.neo4j.spatial.filter.testutils.InMemoryDataset;

public class ChunkedExecutorTest {

	private final ChunkedExecutor executor = new ChunkedExecutor();
	private InMemoryDataset grid;

	@BeforeEach
	public void setup() {
		grid = new InMemoryDataset("grid", BackendKind.FLAT_FILE, FeatureFixtures.pointGrid(10, 10));
	}

	private static BatchMatcher parks() {
		return BatchMatcher.of(record -> "park".equals(record.getValue("category")));
	}

	@Test
	public void shouldMatchAcrossBatches() {
		ChunkedResult result = executor.execute(grid, null, 30, parks(), new NullListener(), CancellationToken.NONE);

		assertThat(result.batches()).isEqualTo(4);
		assertThat(result.processedRows()).isEqualTo(100);
		assertThat(result.cancelled()).isFalse();
		assertThat(result.matched().size()).isEqualTo(20);
		assertThat(result.matched().min()).isEqualTo(4);
		assertThat(result.matched().max()).isEqualTo(99);
	}

	@Test
	public void shouldReportProgressPerBatch() {
		Listener listener = mock(Listener.class);

		executor.execute(grid, null, 30, parks(), listener, CancellationToken.NONE);

		InOrder order = inOrder(listener);
		order.verify(listener).begin(100);
		order.verify(listener, times(3)).worked(30);
		order.verify(listener).worked(10);
		order.verify(listener).done();
	}

	@Test
	public void shouldUseSingleBatchWithoutChunkSize() {
		ChunkedResult result = executor.execute(grid, null, 0, parks(), new NullListener(), CancellationToken.NONE);

		assertThat(result.batches()).isEqualTo(1);
		assertThat(result.processedRows()).isEqualTo(100);
	}

	@Test
	public void shouldOnlyReadRestrictedRows() {
		Listener listener = mock(Listener.class);
		List<Integer> batchSizes = new ArrayList<>();
		BatchMatcher matcher = batch -> {
			batchSizes.add(batch.size());
			return parks().match(batch);
		};

		ChunkedResult result = executor.execute(grid, IdSet.of(1, 2, 3, 4, 9, 50), 4, matcher, listener,
				CancellationToken.NONE);

		verify(listener).begin(6);
		assertThat(batchSizes).containsExactly(4, 2);
		assertThat(result.matched().toIdList()).containsExactly(4L, 9L);
	}

	@Test
	public void shouldStopBeforeNextBatchWhenCancelled() {
		CancellationToken.Flag cancellation = CancellationToken.flag();
		BatchMatcher matcher = batch -> {
			cancellation.cancel();
			return parks().match(batch);
		};

		ChunkedResult result = executor.execute(grid, null, 30, matcher, new NullListener(), cancellation);

		assertThat(result.cancelled()).isTrue();
		assertThat(result.batches()).isEqualTo(1);
		assertThat(result.processedRows()).isEqualTo(30);
		// the started batch completes
		assertThat(result.matched().toIdList()).containsExactly(4L, 9L, 14L, 19L, 24L, 29L);
	}

	@Test
	public void shouldNotReadAnythingWhenAlreadyCancelled() {
		CancellationToken.Flag cancellation = CancellationToken.flag();
		cancellation.cancel();

		ChunkedResult result = executor.execute(grid, null, 30, parks(), new NullListener(), cancellation);

		assertThat(result.cancelled()).isTrue();
		assertThat(result.batches()).isZero();
		assertThat(result.matched().isEmpty()).isTrue();
	}

	@Test
	public void shouldWrapMatcherFailures() {
		Listener listener = mock(Listener.class);
		BatchMatcher failing = batch -> {
			throw new IOException("disk gone");
		};

		FilterExecutionException e = assertThrows(FilterExecutionException.class,
				() -> executor.execute(grid, null, 30, failing, listener, CancellationToken.NONE));
		assertThat(e).hasMessageContaining("Batch 0 of grid").hasCauseInstanceOf(IOException.class);
		assertThat(e.getDatasetId()).isEqualTo("grid");
		verify(listener).done();
	}

	@Test
	public void shouldPassExecutionFailuresThrough() {
		FilterExecutionException failure = new FilterExecutionException("grid", "bad row");
		BatchMatcher failing = batch -> {
			throw failure;
		};

		assertThatThrownBy(() -> executor.execute(grid, null, 30, failing, new NullListener(), CancellationToken.NONE))
				.isSameAs(failure);
	}
}
