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
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.prometheus.Selector;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns pg_stat_statements counters into per-query deltas and rates between two points in time.
 *
 * <p>For each counter the value closest to the window start and to the window end is
 * taken from a short range query around that instant. A counter that went backwards
 * (stats reset) yields a negative delta; it is reported as-is.
 */
@Slf4j
@ApplicationScoped
public class CounterWindowAggregator {

    /**
     * Source counter (without the pg_stat_statements prefix) to output column.
     */
    public static final Map<String, String> COLUMNS;

    static {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("calls", "calls");
        columns.put("exec_time_total", "total_time");
        columns.put("rows", "rows");
        columns.put("shared_bytes_hit_total", "shared_blks_hit");
        columns.put("shared_bytes_read_total", "shared_blks_read");
        columns.put("shared_bytes_dirtied_total", "shared_blks_dirtied");
        columns.put("shared_bytes_written_total", "shared_blks_written");
        columns.put("block_read_total", "blk_read_time");
        columns.put("block_write_total", "blk_write_time");
        COLUMNS = Collections.unmodifiableMap(columns);
    }

    private static final long LOOKAROUND_S = 60;
    private static final String LOOKAROUND_STEP = "30s";

    private final MetricQueries queries;

    @Inject
    public CounterWindowAggregator(MetricQueries queries) {
        this.queries = queries;
    }

    /**
     * Compute one row per (database, query id, user, instance) seen in the window.
     *
     * @param labels Label matchers applied to every counter (cluster, node, database)
     * @param startS Window start, epoch seconds
     * @param endS   Window end, epoch seconds
     * @return Rows in no particular order
     */
    public List<QueryWindowRow> aggregate(Map<String, String> labels, long startS, long endS) {
        List<MetricSeries> startData = new ArrayList<>();
        List<MetricSeries> endData = new ArrayList<>();

        for (String counter : COLUMNS.keySet()) {
            Selector selector = Selector.of(Constants.METRIC_PREFIX_PGSS + counter);
            labels.forEach(selector::with);
            String expr = selector.build();
            startData.addAll(queries.range(expr, startS - LOOKAROUND_S, startS + LOOKAROUND_S, LOOKAROUND_STEP));
            endData.addAll(queries.range(expr, endS - LOOKAROUND_S, endS + LOOKAROUND_S, LOOKAROUND_STEP));
        }

        Map<EntityKey, Snapshot> start = snapshot(startData, startS);
        Map<EntityKey, Snapshot> end = snapshot(endData, endS);
        log.debug("Counter window {}..{}: {} start entities, {} end entities",
                startS, endS, start.size(), end.size());
        return computeRows(start, end, endS - startS);
    }

    /**
     * Reduce range results to the sample closest to {@code targetS}, keyed by entity.
     */
    static Map<EntityKey, Snapshot> snapshot(List<MetricSeries> data, long targetS) {
        Map<EntityKey, Snapshot> result = new LinkedHashMap<>();
        for (MetricSeries series : data) {
            if (series.points().isEmpty()) {
                continue;
            }
            SamplePoint closest = series.points().get(0);
            for (SamplePoint point : series.points()) {
                if (Math.abs(point.timestamp() - targetS) < Math.abs(closest.timestamp() - targetS)) {
                    closest = point;
                }
            }

            EntityKey key = EntityKey.of(series);
            Snapshot snapshot = result.computeIfAbsent(key, k -> new Snapshot(new HashMap<>()));
            if (snapshot.timestamp == null) {
                snapshot.timestamp = closest.timestamp();
            }
            String name = series.label("__name__", Constants.METRIC_PREFIX_PGSS + "calls");
            String counter = name.startsWith(Constants.METRIC_PREFIX_PGSS)
                    ? name.substring(Constants.METRIC_PREFIX_PGSS.length())
                    : name;
            double value = Double.isFinite(closest.value()) ? closest.value() : 0.0;
            snapshot.values.put(counter, value);
        }
        return result;
    }

    /**
     * Build rows from two snapshots.
     *
     * @param start           Snapshot near the window start
     * @param end             Snapshot near the window end
     * @param windowSeconds   Duration used when either side has no timestamp
     * @return One row per entity present on either side
     */
    static List<QueryWindowRow> computeRows(Map<EntityKey, Snapshot> start, Map<EntityKey, Snapshot> end,
                                            double windowSeconds) {
        Set<EntityKey> keys = new LinkedHashSet<>(start.keySet());
        keys.addAll(end.keySet());

        List<QueryWindowRow> rows = new ArrayList<>(keys.size());
        for (EntityKey key : keys) {
            Snapshot s = start.get(key);
            Snapshot e = end.get(key);

            double duration = (s != null && e != null && s.timestamp != null && e.timestamp != null)
                    ? e.timestamp - s.timestamp
                    : windowSeconds;

            QueryWindowRow row = new QueryWindowRow(key.queryId(), key.database(), key.user(), duration);
            double callsDiff = 0.0;
            for (Map.Entry<String, String> column : COLUMNS.entrySet()) {
                String counter = column.getKey();
                String display = column.getValue();

                double diff = value(e, counter) - value(s, counter);
                if (display.contains("blks") && counter.contains("bytes")) {
                    diff = diff / Constants.PG_BLOCK_SIZE;
                }
                if ("calls".equals(display)) {
                    callsDiff = diff;
                }

                row.put(display, diff);
                row.put(display + "_per_sec", duration > 0 ? diff / duration : 0.0);
                row.put(display + "_per_call", callsDiff > 0 ? diff / callsDiff : 0.0);
            }
            rows.add(row);
        }
        return rows;
    }

    private static double value(Snapshot snapshot, String counter) {
        if (snapshot == null) {
            return 0.0;
        }
        return snapshot.values.getOrDefault(counter, 0.0);
    }

    /**
     * Identity of a pg_stat_statements entry.
     */
    public record EntityKey(String database, String queryId, String user, String instance) {

        static EntityKey of(MetricSeries series) {
            return new EntityKey(
                    series.label(Constants.LABEL_DATABASE, ""),
                    series.label(Constants.LABEL_QUERY_ID, ""),
                    series.label("user", ""),
                    series.label("instance", ""));
        }
    }

    static final class Snapshot {
        private final Map<String, Double> values;
        private Double timestamp;

        Snapshot(Map<String, Double> values) {
            this.values = values;
        }

        Snapshot(double timestamp, Map<String, Double> values) {
            this.values = new HashMap<>(values);
            this.timestamp = timestamp;
        }
    }
}
