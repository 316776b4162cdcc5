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

import ai.postgres.reporter.common.Constants;
import ai.postgres.reporter.model.MetricSeries;
import ai.postgres.reporter.model.SamplePoint;
import ai.postgres.reporter.model.Timeline;
import ai.postgres.reporter.model.TopKResult;
import ai.postgres.reporter.prometheus.MetricSource;
import ai.postgres.reporter.prometheus.MetricSourceException;
import ai.postgres.reporter.prometheus.Selector;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes a cumulative counter to its top-K queries on an hourly grid.
 *
 * <p>For a {@link Timeline} and a counter this:
 * <ol>
 *   <li>selects the K query ids with the largest increase over the whole window,</li>
 *   <li>fetches the hourly increase of every selected id in one grouped query,</li>
 *   <li>fetches the unfiltered hourly total,</li>
 *   <li>derives {@code other = total - union}, clamping negative drift to zero.</li>
 * </ol>
 *
 * <p>The union is not fetched separately: it is the point-wise sum of the per-id series
 * from step 2. Both come from the same {@code sum by (queryid)} expression restricted to
 * the selected ids, so a separate {@code sum(...)} over that filter would return the same
 * values. Series for ids outside the selection are ignored.
 *
 * <p>Query ids are always checked by {@link QueryIdRegex} before they are placed in
 * a selector. Backend failures propagate as {@link MetricSourceException}.
 */
@Slf4j
@ApplicationScoped
public class HourlyTopKAggregator {

    public static final long HOUR_S = 3600L;
    static final double RELATIVE_TOLERANCE = 1e-6;

    private final MetricSource source;

    @Inject
    public HourlyTopKAggregator(MetricSource source) {
        this.source = source;
    }

    public static long floorHour(long epochS) {
        return Math.floorDiv(epochS, HOUR_S) * HOUR_S;
    }

    /**
     * Build a grid of {@code hours + 1} points ending at {@code endS}.
     *
     * @param endS  Last point, already aligned by the caller when needed
     * @param hours Number of steps in the window
     * @param stepS Step length in seconds
     * @return Timeline starting at {@code endS - hours * stepS}
     */
    public static Timeline buildTimeline(long endS, int hours, long stepS) {
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be positive, got " + hours);
        }
        long startS = endS - hours * stepS;
        List<Long> points = new ArrayList<>(hours + 1);
        for (int i = 0; i <= hours; i++) {
            points.add(startS + i * stepS);
        }
        return new Timeline(startS, stepS, points);
    }

    /**
     * Top-K attribution of a single counter.
     *
     * @param metric   Counter name
     * @param labels   Exact label matchers (cluster, node, database)
     * @param k        Number of query ids to keep
     * @param timeline Grid to align on
     * @return Reconciled result aligned to the timeline
     * @throws MetricSourceException If any of the backend queries fails
     */
    public TopKResult topK(String metric, Map<String, String> labels, int k, Timeline timeline)
            throws MetricSourceException {
        String window = seconds(timeline.stepS() * (timeline.size() - 1));
        String step = seconds(timeline.stepS());

        String selection = "topk(%d, sum by (queryid) (increase(%s)))"
                .formatted(k, selector(metric, labels).range(window));
        String total = "sum(increase(%s))".formatted(selector(metric, labels).range(step));

        return attribute(selection, total, k, timeline,
                regex -> "sum by (queryid) (increase(%s))"
                        .formatted(selector(metric, labels).withRegex(Constants.LABEL_QUERY_ID, regex).range(step)));
    }

    /**
     * Top-K attribution of the sum of two counters, e.g. block read time plus block write time.
     *
     * <p>Queries that report only one of the two counters are not selectable.
     */
    public TopKResult topKSum2(String metricA, String metricB, Map<String, String> labels, int k,
                               Timeline timeline) throws MetricSourceException {
        String window = seconds(timeline.stepS() * (timeline.size() - 1));
        String step = seconds(timeline.stepS());

        String selection = "topk(%d, sum by (queryid) (increase(%s)) + sum by (queryid) (increase(%s)))"
                .formatted(k, selector(metricA, labels).range(window), selector(metricB, labels).range(window));
        String total = "sum(increase(%s)) + sum(increase(%s))"
                .formatted(selector(metricA, labels).range(step), selector(metricB, labels).range(step));

        return attribute(selection, total, k, timeline,
                regex -> "sum by (queryid) (increase(%s)) + sum by (queryid) (increase(%s))".formatted(
                        selector(metricA, labels).withRegex(Constants.LABEL_QUERY_ID, regex).range(step),
                        selector(metricB, labels).withRegex(Constants.LABEL_QUERY_ID, regex).range(step)));
    }

    /**
     * Hourly series of a counter for a given set of query ids, without reconciliation.
     *
     * @return Densified series keyed by query id, in the order of {@code ids}
     */
    public Map<String, List<Double>> seriesFor(String metric, Map<String, String> labels,
                                               Collection<String> ids, Timeline timeline)
            throws MetricSourceException {
        Map<String, List<Double>> result = new LinkedHashMap<>();
        if (ids.isEmpty()) {
            return result;
        }
        String regex = QueryIdRegex.build(ids);
        String expr = "sum by (queryid) (increase(%s))".formatted(
                selector(metric, labels).withRegex(Constants.LABEL_QUERY_ID, regex).range(seconds(timeline.stepS())));
        Map<String, Map<Long, Double>> byId = toSeriesMap(rangeOver(expr, timeline));
        for (String id : ids) {
            result.put(id, densify(byId.get(id), timeline.points()));
        }
        return result;
    }

    private TopKResult attribute(String selectionExpr, String totalExpr, int k, Timeline timeline,
                                 UnionQuery unionQuery) throws MetricSourceException {
        List<String> ids = selectTopIds(selectionExpr, k, timeline);

        Map<String, Map<Long, Double>> totalMap = toSeriesMap(rangeOver(totalExpr, timeline));
        List<Double> total = densify(totalMap.get(Constants.SINGLE_SERIES), timeline.points());

        if (ids.isEmpty()) {
            Reconciliation reconciliation = reconcile(total, zeros(timeline.size()));
            return new TopKResult(Map.of(), reconciliation.other(), timeline.points());
        }

        String regex = QueryIdRegex.build(ids);
        Map<String, Map<Long, Double>> unionMap = toSeriesMap(rangeOver(unionQuery.expression(regex), timeline));

        Map<String, List<Double>> perEntity = new LinkedHashMap<>();
        List<Double> union = zeros(timeline.size());
        for (String id : ids) {
            List<Double> values = densify(unionMap.get(id), timeline.points());
            perEntity.put(id, values);
            for (int t = 0; t < values.size(); t++) {
                union.set(t, union.get(t) + values.get(t));
            }
        }

        Reconciliation reconciliation = reconcile(total, union);
        return new TopKResult(perEntity, reconciliation.other(), timeline.points());
    }

    private List<String> selectTopIds(String selectionExpr, int k, Timeline timeline) throws MetricSourceException {
        long endS = timeline.endS();
        List<MetricSeries> selected = source.queryRange(selectionExpr, endS, endS, seconds(timeline.stepS()));

        Map<String, Double> totals = new LinkedHashMap<>();
        for (MetricSeries series : selected) {
            String id = series.label(Constants.LABEL_QUERY_ID);
            if (id == null || id.isEmpty() || series.points().isEmpty()) {
                continue;
            }
            double value = series.points().get(series.points().size() - 1).value();
            totals.merge(id, Double.isFinite(value) ? value : 0.0, Double::sum);
        }

        List<String> ids = totals.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(k)
                .map(Map.Entry::getKey)
                .toList();
        log.debug("Selected {} of {} candidate query ids", ids.size(), totals.size());
        return ids;
    }

    private List<MetricSeries> rangeOver(String expr, Timeline timeline) throws MetricSourceException {
        return source.queryRange(expr, timeline.startS(), timeline.endS(), seconds(timeline.stepS()));
    }

    /**
     * Index range results by query id; series without the label use {@link Constants#SINGLE_SERIES}.
     */
    static Map<String, Map<Long, Double>> toSeriesMap(List<MetricSeries> data) {
        Map<String, Map<Long, Double>> result = new LinkedHashMap<>();
        for (MetricSeries series : data) {
            String id = series.label(Constants.LABEL_QUERY_ID, Constants.SINGLE_SERIES);
            Map<Long, Double> points = result.computeIfAbsent(id, k -> new LinkedHashMap<>());
            for (SamplePoint point : series.points()) {
                points.merge(point.epochSecond(), point.value(), Double::sum);
            }
        }
        return result;
    }

    /**
     * Align a sparse series on the timeline. Missing and non-finite points become 0.
     */
    public static List<Double> densify(Map<Long, Double> series, List<Long> timeline) {
        List<Double> values = new ArrayList<>(timeline.size());
        for (Long t : timeline) {
            Double v = series == null ? null : series.get(t);
            values.add(v == null || !Double.isFinite(v) ? 0.0 : v);
        }
        return values;
    }

    /**
     * Compute {@code other = total - union} point by point.
     *
     * <p>Negative results are clamped to 0. Drift beyond
     * {@code 1e-6 * max(1, |total|)} is reported with a single warning per call.
     */
    static Reconciliation reconcile(List<Double> total, List<Double> union) {
        if (total.size() != union.size()) {
            throw new IllegalArgumentException("total and union must be aligned: %d != %d"
                    .formatted(total.size(), union.size()));
        }
        List<Double> other = new ArrayList<>(total.size());
        int clamped = 0;
        int beyondTolerance = 0;
        double worst = 0.0;
        for (int t = 0; t < total.size(); t++) {
            double value = total.get(t) - union.get(t);
            if (value < 0) {
                clamped++;
                double tolerance = RELATIVE_TOLERANCE * Math.max(1.0, Math.abs(total.get(t)));
                if (-value > tolerance) {
                    beyondTolerance++;
                    worst = Math.min(worst, value);
                }
                value = 0.0;
            }
            other.add(value);
        }
        if (beyondTolerance > 0) {
            log.warn("negative 'other' clamped to 0 at {} of {} points (worst {})",
                    beyondTolerance, total.size(), worst);
        }
        return new Reconciliation(other, clamped, beyondTolerance);
    }

    private static Selector selector(String metric, Map<String, String> labels) {
        Selector selector = Selector.of(metric);
        labels.forEach(selector::with);
        return selector;
    }

    private static List<Double> zeros(int size) {
        List<Double> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(0.0);
        }
        return values;
    }

    static String seconds(long s) {
        return s + "s";
    }

    /**
     * Residual series and how many points needed clamping.
     */
    record Reconciliation(List<Double> other, int clampedPoints, int beyondTolerancePoints) {
    }

    @FunctionalInterface
    private interface UnionQuery {
        String expression(String queryIdRegex);
    }
}
