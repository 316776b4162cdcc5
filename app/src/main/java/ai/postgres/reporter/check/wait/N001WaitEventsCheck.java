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

import ai.postgres.reporter.aggregation.HourlyTopKAggregator;
import ai.postgres.reporter.check.AbstractPerDatabaseCheck;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.check.hourly.HourlyWindow;
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.model.MetricSeries;
import ai.postgres.reporter.model.SamplePoint;
import ai.postgres.reporter.model.Timeline;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.report.CheckType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Wait events sampled per hour, grouped by wait event type and then by query id.
 */
@Slf4j
@ApplicationScoped
public class N001WaitEventsCheck extends AbstractPerDatabaseCheck<WaitEvents> {

    static final String METRIC = "pgwatch_wait_events_total";
    static final String LABEL_TYPE = "wait_event_type";
    static final String LABEL_EVENT = "wait_event";
    static final String LABEL_QUERY_ID = "query_id";
    static final String UNKNOWN = "Unknown";

    private final MetricQueries queries;
    private final HourlyWindow window;

    @Inject
    public N001WaitEventsCheck(MetricQueries queries, ReporterConfig config) {
        this(queries, HourlyWindow.from(config));
    }

    N001WaitEventsCheck(MetricQueries queries, HourlyWindow window) {
        this.queries = queries;
        this.window = window;
    }

    @Override
    public CheckType type() {
        return CheckType.N001;
    }

    @Override
    protected WaitEvents collectDatabase(CheckContext context, String database) {
        Timeline timeline = window.timeline(context.nowS());
        String step = timeline.stepS() + "s";
        String expr = "sum by (%s, %s, %s) (increase(%s))".formatted(
                LABEL_TYPE, LABEL_EVENT, LABEL_QUERY_ID,
                context.selector(METRIC, database).range(step));

        List<MetricSeries> series = queries.range(expr, timeline.startS(), timeline.endS(), step);
        log.debug("N001 {}: {} wait event series", database, series.size());

        // type -> query id -> accumulator
        Map<String, Map<String, Accumulator>> grouped = new TreeMap<>();
        for (MetricSeries s : series) {
            String queryId = s.label(LABEL_QUERY_ID);
            if (queryId == null || queryId.isEmpty() || "0".equals(queryId)) {
                continue;
            }
            String type = s.label(LABEL_TYPE, UNKNOWN);
            String event = s.label(LABEL_EVENT, UNKNOWN);

            Map<Long, Double> points = new HashMap<>();
            for (SamplePoint point : s.points()) {
                points.merge(point.epochSecond(), point.value(), Double::sum);
            }
            List<Double> hourly = HourlyTopKAggregator.densify(points, timeline.points());

            grouped.computeIfAbsent(type, k -> new LinkedHashMap<>())
                    .computeIfAbsent(queryId, k -> new Accumulator(timeline.size()))
                    .add(event, hourly);
        }

        Map<String, WaitEventType> types = new LinkedHashMap<>();
        grouped.forEach((type, byQuery) -> types.put(type, toType(byQuery)));
        return new WaitEvents(types, timeline.points(), window.hours());
    }

    private static WaitEventType toType(Map<String, Accumulator> byQuery) {
        List<WaitEventQuery> list = new ArrayList<>(byQuery.size());
        byQuery.forEach((queryId, acc) -> list.add(acc.toQuery(queryId)));
        list.sort(Comparator.comparingLong(WaitEventQuery::totalOccurrences).reversed()
                .thenComparing(WaitEventQuery::queryId));
        long total = list.stream().mapToLong(WaitEventQuery::totalOccurrences).sum();
        return new WaitEventType(list.size(), total, list);
    }

    private static final class Accumulator {
        private final double[] hourly;
        private final Map<String, Double> events = new TreeMap<>();

        Accumulator(int size) {
            this.hourly = new double[size];
        }

        void add(String event, List<Double> values) {
            double sum = 0.0;
            for (int i = 0; i < values.size(); i++) {
                hourly[i] += values.get(i);
                sum += values.get(i);
            }
            events.merge(event, sum, Double::sum);
        }

        WaitEventQuery toQuery(String queryId) {
            List<Long> rounded = new ArrayList<>(hourly.length);
            long total = 0;
            for (double v : hourly) {
                long n = Math.round(v);
                rounded.add(n);
                total += n;
            }
            Map<String, Long> byEvent = new LinkedHashMap<>();
            events.forEach((event, v) -> byEvent.put(event, Math.round(v)));
            return new WaitEventQuery(queryId, total, rounded, byEvent);
        }
    }
}
