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
package ai.postgres.reporter.aggregation;

import ai.postgres.reporter.model.Timeline;
import ai.postgres.reporter.model.TopKResult;
import ai.postgres.reporter.prometheus.FakeMetricSource;
import ai.postgres.reporter.prometheus.MetricSourceException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static ai.postgres.reporter.prometheus.FakeMetricSource.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HourlyTopKAggregatorTest {

    private static final Map<String, String> LABELS =
            FakeMetricSource.labels("cluster", "prod", "node_name", "node-01", "datname", "db1");

    @Test
    void testFloorHour() {
        assertEquals(7200L, HourlyTopKAggregator.floorHour(7200L));
        assertEquals(7200L, HourlyTopKAggregator.floorHour(10799L));
        assertEquals(-3600L, HourlyTopKAggregator.floorHour(-1L));
    }

    @Test
    void testBuildTimeline_HoursPlusOnePoints() {
        Timeline timeline = HourlyTopKAggregator.buildTimeline(7200L, 2, 3600L);

        assertEquals(List.of(0L, 3600L, 7200L), timeline.points());
        assertEquals(0L, timeline.startS());
        assertEquals(7200L, timeline.endS());
    }

    @Test
    void testBuildTimeline_RejectsNonPositiveHours() {
        assertThrows(IllegalArgumentException.class, () -> HourlyTopKAggregator.buildTimeline(0L, 0, 3600L));
    }

    @Test
    void testDensify_FillsGapsAndNonFinite() {
        Map<Long, Double> sparse = new HashMap<>();
        sparse.put(0L, 1.0);
        sparse.put(7200L, Double.NaN);

        assertEquals(List.of(1.0, 0.0, 0.0), HourlyTopKAggregator.densify(sparse, List.of(0L, 3600L, 7200L)));
        assertEquals(List.of(0.0, 0.0), HourlyTopKAggregator.densify(null, List.of(0L, 3600L)));
    }

    @Test
    void testReconcile_ClampsNegativeOther() {
        HourlyTopKAggregator.Reconciliation r = HourlyTopKAggregator.reconcile(
                List.of(10.0, 5.0, 100.0), List.of(4.0, 5.0000000001, 150.0));

        assertEquals(6.0, r.other().get(0), 1e-9);
        assertEquals(0.0, r.other().get(1));
        assertEquals(0.0, r.other().get(2));
        assertEquals(2, r.clampedPoints());
        assertEquals(1, r.beyondTolerancePoints());
    }

    @Test
    void testReconcile_MisalignedInputsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> HourlyTopKAggregator.reconcile(List.of(1.0), List.of(1.0, 2.0)));
    }

    @Test
    void testTopK_AttributesAndComputesOther() throws Exception {
        // Setup
        Timeline timeline = HourlyTopKAggregator.buildTimeline(3600L, 1, 3600L);
        List<Long> t = timeline.points();
        FakeMetricSource source = new FakeMetricSource()
                .onRange("topk(", series(List.of(3600L), List.of(3.0), "queryid", "1"),
                        series(List.of(3600L), List.of(4.0), "queryid", "2"))
                .onRange("queryid=~", series(t, List.of(1.0, 2.0), "queryid", "1"),
                        series(t, List.of(0.0, 4.0), "queryid", "2"))
                .onRange("sum(increase(", series(t, List.of(11.0, 6.0)));
        HourlyTopKAggregator aggregator = new HourlyTopKAggregator(source);

        // Execute
        TopKResult result = aggregator.topK("pgwatch_pg_stat_statements_temp_bytes_written", LABELS, 2, timeline);

        // Verify
        assertEquals(List.of("2", "1"), List.copyOf(result.perEntity().keySet()));
        assertEquals(List.of(1.0, 2.0), result.perEntity().get("1"));
        assertEquals(List.of(10.0, 0.0), result.other());
        assertEquals(7.0, result.trackedTotal());
        assertEquals(10.0, result.otherTotal());
        assertTrue(source.rangeQueries().stream().anyMatch(q -> q.contains("queryid=~\"^(?:2|1)$\"")));
    }

    @Test
    void testTopK_UnionCountsOnlySelectedIds() throws Exception {
        // Setup
        Timeline timeline = HourlyTopKAggregator.buildTimeline(3600L, 1, 3600L);
        List<Long> t = timeline.points();
        FakeMetricSource source = new FakeMetricSource()
                .onRange("topk(", series(List.of(3600L), List.of(9.0), "queryid", "1"),
                        series(List.of(3600L), List.of(8.0), "queryid", "2"),
                        series(List.of(3600L), List.of(1.0), "queryid", "3"))
                .onRange("queryid=~", series(t, List.of(1.0, 0.0), "queryid", "1"),
                        series(t, List.of(0.0, 2.0), "queryid", "1"),
                        series(t, List.of(3.0, 1.0), "queryid", "2"),
                        series(t, List.of(5.0, 5.0), "queryid", "3"))
                .onRange("sum(increase(", series(t, List.of(20.0, 10.0)));
        HourlyTopKAggregator aggregator = new HourlyTopKAggregator(source);

        // Execute
        TopKResult result = aggregator.topK("m", LABELS, 2, timeline);

        // Verify
        assertEquals(List.of("1", "2"), List.copyOf(result.perEntity().keySet()));
        assertEquals(List.of(1.0, 2.0), result.perEntity().get("1"));
        assertEquals(List.of(16.0, 7.0), result.other());
    }

    @Test
    void testTopK_NoCandidatesEverythingIsOther() throws Exception {
        Timeline timeline = HourlyTopKAggregator.buildTimeline(3600L, 1, 3600L);
        FakeMetricSource source = new FakeMetricSource()
                .onRange("sum(increase(", series(timeline.points(), List.of(5.0, 6.0)));
        HourlyTopKAggregator aggregator = new HourlyTopKAggregator(source);

        TopKResult result = aggregator.topK("m", LABELS, 10, timeline);

        assertTrue(result.perEntity().isEmpty());
        assertEquals(List.of(5.0, 6.0), result.other());
    }

    @Test
    void testTopK_InvalidQueryIdFailsClosed() {
        Timeline timeline = HourlyTopKAggregator.buildTimeline(3600L, 1, 3600L);
        FakeMetricSource source = new FakeMetricSource()
                .onRange("topk(", series(List.of(3600L), List.of(3.0), "queryid", ".*"));
        HourlyTopKAggregator aggregator = new HourlyTopKAggregator(source);

        assertThrows(InvalidQueryIdException.class, () -> aggregator.topK("m", LABELS, 10, timeline));
    }

    @Test
    void testTopK_BackendFailurePropagates() {
        Timeline timeline = HourlyTopKAggregator.buildTimeline(3600L, 1, 3600L);
        HourlyTopKAggregator aggregator = new HourlyTopKAggregator(new FakeMetricSource().failOn("topk("));

        assertThrows(MetricSourceException.class, () -> aggregator.topK("m", LABELS, 10, timeline));
    }

    @Test
    void testSeriesFor_DensifiesRequestedIds() throws Exception {
        Timeline timeline = HourlyTopKAggregator.buildTimeline(3600L, 1, 3600L);
        FakeMetricSource source = new FakeMetricSource()
                .onRange("queryid=~", series(List.of(3600L), List.of(2.0), "queryid", "7"));
        HourlyTopKAggregator aggregator = new HourlyTopKAggregator(source);

        Map<String, List<Double>> result = aggregator.seriesFor("m", LABELS, List.of("7", "8"), timeline);

        assertEquals(List.of(0.0, 2.0), result.get("7"));
        assertEquals(List.of(0.0, 0.0), result.get("8"));
    }
}
