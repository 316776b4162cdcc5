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
package ai.postgres.reporter.check.hourly;

import ai.postgres.reporter.model.TopKResult;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-database payload of the hourly top-K checks.
 *
 * <p>Field names carry the metric label, e.g. {@code total_wal_bytes} and
 * {@code hourly_wal_bytes} for label {@code wal_bytes}; an optional unit suffix
 * ends every labelled name ({@code total_io_time_ms}).
 */
public final class HourlyTopQueries {

    private final String label;
    private final String suffix;
    private final List<HourlyQuery> topQueries;
    private final List<Double> otherHourly;
    private final List<Long> timeline;
    private final int hours;

    HourlyTopQueries(String label, String suffix, List<HourlyQuery> topQueries, List<Double> otherHourly,
                     List<Long> timeline, int hours) {
        this.label = label;
        this.suffix = suffix;
        this.topQueries = List.copyOf(topQueries);
        this.otherHourly = List.copyOf(otherHourly);
        this.timeline = List.copyOf(timeline);
        this.hours = hours;
    }

    /**
     * Build the payload from a reconciled attribution. Queries are ordered by total,
     * largest first.
     */
    public static HourlyTopQueries from(TopKResult result, String label, String suffix, int hours) {
        List<HourlyQuery> queries = new ArrayList<>(result.perEntity().size());
        for (Map.Entry<String, List<Double>> entry : result.perEntity().entrySet()) {
            queries.add(new HourlyQuery(entry.getKey(), result.entityTotal(entry.getKey()), entry.getValue()));
        }
        queries.sort(Comparator.comparingDouble(HourlyQuery::total).reversed()
                .thenComparing(HourlyQuery::queryid));
        return new HourlyTopQueries(label, suffix, queries, result.other(), result.timeline(), hours);
    }

    public List<HourlyQuery> topQueries() {
        return topQueries;
    }

    public List<Double> otherHourly() {
        return otherHourly;
    }

    public List<Long> timeline() {
        return timeline;
    }

    public int hours() {
        return hours;
    }

    public double trackedTotal() {
        return topQueries.stream().mapToDouble(HourlyQuery::total).sum();
    }

    public double otherTotal() {
        return otherHourly.stream().mapToDouble(Double::doubleValue).sum();
    }

    public double total() {
        return trackedTotal() + otherTotal();
    }

    @JsonValue
    public Map<String, Object> toJson() {
        List<Map<String, Object>> top = new ArrayList<>(topQueries.size());
        for (HourlyQuery query : topQueries) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("queryid", query.queryid());
            entry.put(name("total_"), query.total());
            entry.put(name("hourly_"), query.hourly());
            top.add(entry);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_" + label + "_tracked_queries" + suffix, trackedTotal());
        summary.put("total_" + label + "_other" + suffix, otherTotal());
        summary.put(name("total_"), total());

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("top_queries", top);
        json.put("other_hourly", otherHourly);
        json.put("timeline", timeline);
        json.put("hours", hours);
        json.put("summary", summary);
        return json;
    }

    private String name(String prefix) {
        return prefix + label + suffix;
    }
}
