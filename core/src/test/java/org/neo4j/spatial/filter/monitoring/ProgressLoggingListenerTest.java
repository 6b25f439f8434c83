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
package org.neo4j.spatial.filter.monitoring;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;
import org.neo4j.spatial.filter.api.monitoring.Listener;

public class ProgressLoggingListenerTest {

	@Test
	public void testProgressLoggingListenerWithAllLogs() {
		int unitsOfWork = 10;
		long timeWait = 10;
		long throttle = 20;
		testProgressLoggingListenerWithSpecifiedWaits(unitsOfWork, timeWait, throttle, unitsOfWork + 2);
	}

	@Test
	public void testProgressLoggingListenerWithOnlyStartAndEnd() {
		int unitsOfWork = 10;
		long timeWait = 1000;
		long throttle = 10;
		testProgressLoggingListenerWithSpecifiedWaits(unitsOfWork, timeWait, throttle, 3);
	}

	@Test
	public void shouldLogThroughLogger() {
		Logger logger = spy(Logger.getLogger(ProgressLoggingListenerTest.class.getName()));
		Listener listener = new ProgressLoggingListener("logged", logger, Level.FINE).setTimeWait(10000);
		listener.begin(4);
		listener.worked(4);
		listener.done();
		verify(logger).log(Level.FINE, "Starting logged");
		verify(logger).log(Level.FINE, String.format(Locale.ENGLISH, "%.2f (4/4) - Completed logged", 100f));
	}

	@Test
	public void shouldReportRowsWhenTotalUnknown() {
		PrintStream out = spy(new PrintStream(OutputStream.nullOutputStream()));
		Listener listener = new ProgressLoggingListener("stream", out);
		listener.begin(0);
		listener.worked(7);
		listener.done();
		verify(out).println("Filtering stream (7 rows)");
		verify(out).println("Completed stream (7 rows)");
	}

	@Test
	public void shouldNeverLogUndefinedPercentages() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Listener listener = new ProgressLoggingListener("empty", new PrintStream(bytes, true, StandardCharsets.UTF_8))
				.setTimeWait(-1);
		for (int total : new int[] { 0, -3 }) {
			listener.begin(total);
			listener.worked(2);
			listener.done();
		}
		String logged = bytes.toString(StandardCharsets.UTF_8);
		assertThat(logged, containsString("Completed empty (2 rows)"));
		assertThat(logged, not(containsString("NaN")));
		assertThat(logged, not(containsString("Infinity")));
		assertThat(logged, not(containsString("%")));
	}

	private void testProgressLoggingListenerWithSpecifiedWaits(int unitsOfWork, long timeWait, long throttle,
			int expectedLogCount) {
		PrintStream out = spy(new PrintStream(OutputStream.nullOutputStream()));
		Listener listener = new ProgressLoggingListener("test", out).setTimeWait(timeWait);
		listener.begin(unitsOfWork);
		for (int step = 0; step < unitsOfWork; step++) {
			listener.worked(1);
			try {
				Thread.sleep(throttle);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
		listener.done();
		verify(out).println("Starting test");
		verify(out).println(String.format(Locale.ENGLISH, "%.2f (10/10) - Completed test", 100f));
		verify(out, times(expectedLogCount)).println(anyString());
	}
}
