/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.postgres.reporter.check.wait;

import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.check.hourly.HourlyWindow;
import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.prometheus.FakeMetricSource;
import ai.postgres.reporter.prometheus.MetricQueries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static ai.postgres.reporter.prometheus.FakeMetricSource.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class N001WaitEventsCheckTest {

    private static final List<Long> TIMELINE = List.of(0L, 3600L, 7200L);

    @Mock
    private ReporterMetrics metrics;

    private static CheckContext context() {
        return new CheckContext("prod", "node-01", List.of("db1"), 7200L);
    }

    @Test
    void testCollect_GroupsByTypeAndQuery() throws Exception {
        // Setup
        FakeMetricSource source = new FakeMetricSource().onRange("pgwatch_wait_events_total",
                series(TIMELINE, List.of(1.0, 2.0, 0.0),
                        "wait_event_type", "LWLock", "wait_event", "WALWrite", "query_id", "123"),
                series(TIMELINE, List.of(0.0, 1.0, 1.0),
                        "wait_event_type", "LWLock", "wait_event", "BufferContent", "query_id", "456"),
                series(TIMELINE, List.of(0.0, 0.0, 1.0),
                        "wait_event_type", "LWLock", "wait_event", "BufferContent", "query_id", "123"),
                series(TIMELINE, List.of(4.0, 4.0, 4.0),
                        "wait_event_type", "IO", "wait_event", "DataFileRead", "query_id", "0"),
                series(TIMELINE, List.of(0.0, 0.6, 0.0), "query_id", "789"));
        N001WaitEventsCheck check = new N001WaitEventsCheck(
                new MetricQueries(source, metrics), new HourlyWindow(2, 10, false));

        // Execute
        WaitEvents events = check.collect(context()).get("db1");

        // Verify
        assertEquals(TIMELINE, events.timeline());
        assertEquals(2, events.hours());
        assertEquals(List.of("LWLock", "Unknown"), List.copyOf(events.waitEventTypes().keySet()));

        WaitEventType lwlock = events.waitEventTypes().get("LWLock");
        assertEquals(2, lwlock.uniqueQueries());
        assertEquals(6, lwlock.totalOccurrences());
        WaitEventQuery first = lwlock.queriesList().get(0);
        assertEquals("123", first.queryId());
        assertEquals(4, first.totalOccurrences());
        assertEquals(List.of(1L, 2L, 1L), first.hourlyOccurrences());
        assertEquals(Map.of("BufferContent", 1L, "WALWrite", 3L), first.waitEvents());
        assertEquals("456", lwlock.queriesList().get(1).queryId());

        WaitEventType unknown = events.waitEventTypes().get("Unknown");
        assertEquals(1, unknown.totalOccurrences());
        assertEquals(Map.of("Unknown", 1L), unknown.queriesList().get(0).waitEvents());
    }

    @Test
    void testCollect_QueriesHourlyIncrease() throws Exception {
        FakeMetricSource source = new FakeMetricSource();
        N001WaitEventsCheck check = new N001WaitEventsCheck(
                new MetricQueries(source, metrics), new HourlyWindow(2, 10, false));

        WaitEvents events = check.collect(context()).get("db1");

        assertTrue(events.waitEventTypes().isEmpty());
        String expr = source.rangeQueries().get(0);
        assertTrue(expr.startsWith("sum by (wait_event_type, wait_event, query_id) (increase("), expr);
        assertTrue(expr.contains("datname=\"db1\""), expr);
        assertTrue(expr.contains("[3600s]"), expr);
    }
}
