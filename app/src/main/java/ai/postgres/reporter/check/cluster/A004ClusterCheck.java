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
package ai.postgres.reporter.check.cluster;

import ai.postgres.reporter.check.Check;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.report.CheckType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Node-wide activity and size figures, plus the size of every database.
 */
@Slf4j
@ApplicationScoped
public class A004ClusterCheck implements Check {

    static final String METRIC_DB_SIZE = "pgwatch_db_size_size_b";

    private final MetricQueries queries;

    @Inject
    public A004ClusterCheck(MetricQueries queries) {
        this.queries = queries;
    }

    @Override
    public CheckType type() {
        return CheckType.A004;
    }

    @Override
    public A004Data collect(CheckContext context) {
        Map<String, ClusterMetric> general = new LinkedHashMap<>();
        for (GeneralMetric metric : GeneralMetric.values()) {
            OptionalDouble value = queries.scalar(metric.expression(context));
            if (value.isPresent() && Double.isFinite(value.getAsDouble())) {
                general.put(metric.key(), new ClusterMetric(value.getAsDouble(), metric.unit, metric.description));
            } else {
                log.debug("No value for {} on {}/{}", metric.key(), context.cluster(), context.node());
            }
        }

        Map<String, Double> sizes = new TreeMap<>();
        for (MetricSample sample : queries.instant(context.selector(METRIC_DB_SIZE).build())) {
            String db = sample.label("datname");
            if (db != null && !db.isEmpty() && Double.isFinite(sample.value())) {
                sizes.put(db, sample.value());
            }
        }
        return new A004Data(general, sizes);
    }

    enum GeneralMetric {
        ACTIVE_CONNECTIONS("connections", "Number of active connections",
                c -> "sum(%s)".formatted(c.selector("pgwatch_pg_stat_activity_count").with("state", "active"))),
        IDLE_CONNECTIONS("connections", "Number of idle connections",
                c -> "sum(%s)".formatted(c.selector("pgwatch_pg_stat_activity_count").with("state", "idle"))),
        TOTAL_CONNECTIONS("connections", "Total number of connections",
                c -> "sum(%s)".formatted(c.selector("pgwatch_pg_stat_activity_count"))),
        DATABASE_SIZE("bytes", "Total database size in bytes",
                c -> "sum(%s)".formatted(c.selector(METRIC_DB_SIZE))),
        CACHE_HIT_RATIO("%", "Cache hit ratio percentage",
                c -> "sum(%1$s) / (sum(%1$s) + sum(%2$s)) * 100".formatted(
                        c.selector("pgwatch_db_stats_blks_hit"), c.selector("pgwatch_db_stats_blks_read"))),
        TRANSACTIONS_PER_SEC("tps", "Transactions per second",
                c -> "sum(rate(%s)) + sum(rate(%s))".formatted(
                        c.selector("pgwatch_db_stats_xact_commit").range("5m"),
                        c.selector("pgwatch_db_stats_xact_rollback").range("5m"))),
        CHECKPOINTS_PER_SEC("checkpoints/s", "Checkpoints per second",
                c -> "sum(rate(%s)) + sum(rate(%s))".formatted(
                        c.selector("pgwatch_pg_stat_bgwriter_checkpoints_timed").range("5m"),
                        c.selector("pgwatch_pg_stat_bgwriter_checkpoints_req").range("5m"))),
        DEADLOCKS("count", "Number of deadlocks",
                c -> "sum(%s)".formatted(c.selector("pgwatch_db_stats_deadlocks"))),
        TEMP_FILES("files", "Number of temporary files",
                c -> "sum(%s)".formatted(c.selector("pgwatch_db_stats_temp_files"))),
        TEMP_BYTES("bytes", "Size of temporary files in bytes",
                c -> "sum(%s)".formatted(c.selector("pgwatch_db_stats_temp_bytes")));

        private final String unit;
        private final String description;
        private final Function<CheckContext, String> expression;

        GeneralMetric(String unit, String description, Function<CheckContext, String> expression) {
            this.unit = unit;
            this.description = description;
            this.expression = expression;
        }

        String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        String expression(CheckContext context) {
            return expression.apply(context);
        }
    }
}
