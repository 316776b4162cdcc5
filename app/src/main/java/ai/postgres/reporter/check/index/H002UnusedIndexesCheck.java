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
package ai.postgres.reporter.check.index;

import ai.postgres.reporter.check.AbstractPerDatabaseCheck;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.common.Timestamps;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.settings.SettingsFormatter;
import ai.postgres.reporter.sink.SinkStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Never-scanned indexes per database, with their DDL and the age of the usage statistics.
 */
@ApplicationScoped
public class H002UnusedIndexesCheck extends AbstractPerDatabaseCheck<UnusedIndexes> {

    static final String METRIC_INDEX_SIZE = "pgwatch_unused_indexes_index_size_bytes";
    static final String METRIC_IDX_SCAN = "pgwatch_unused_indexes_idx_scan";
    static final String METRIC_STATS_RESET = "pgwatch_stats_reset_stats_reset_epoch";
    static final String METRIC_UPTIME = "pgwatch_db_stats_postmaster_uptime_s";
    static final double DAY_S = 86400.0;

    private final MetricQueries queries;
    private final SinkStore sink;

    @Inject
    public H002UnusedIndexesCheck(MetricQueries queries, SinkStore sink) {
        this.queries = queries;
        this.sink = sink;
    }

    @Override
    public CheckType type() {
        return CheckType.H002;
    }

    @Override
    protected UnusedIndexes collectDatabase(CheckContext context, String database) {
        List<MetricSample> samples = queries.instant(context.selector(METRIC_INDEX_SIZE, database).build());
        Map<String, String> definitions = samples.isEmpty() ? Map.of() : sink.getIndexDefinitions(database);

        List<UnusedIndex> indexes = new ArrayList<>();
        for (MetricSample sample : samples) {
            String index = IndexLabels.index(sample);
            double size = IndexLabels.finite(sample.value());
            double scans = queries.scalarOrZero(
                    IndexLabels.companion(context, database, METRIC_IDX_SCAN, sample).build());
            indexes.add(new UnusedIndex(
                    IndexLabels.schema(sample),
                    IndexLabels.table(sample),
                    index,
                    definitions.get(index),
                    sample.label("reason", "Unknown"),
                    scans,
                    size,
                    isBtree(sample),
                    IndexLabels.flag(sample.label("supports_fk")),
                    SettingsFormatter.formatBytes(size)));
        }
        indexes.sort(Comparator.comparingDouble(UnusedIndex::indexSizeBytes).reversed());
        double total = indexes.stream().mapToDouble(UnusedIndex::indexSizeBytes).sum();
        return new UnusedIndexes(indexes, indexes.size(), total, SettingsFormatter.formatBytes(total),
                statsReset(context, database));
    }

    StatsReset statsReset(CheckContext context, String database) {
        Double resetEpoch = present(queries.scalar(context.selector(METRIC_STATS_RESET, database).build()));
        Double uptime = present(queries.scalar(context.selector(METRIC_UPTIME, database).build()));

        Double daysSinceReset = resetEpoch != null && resetEpoch > 0
                ? (context.nowS() - resetEpoch) / DAY_S
                : null;
        Double startupEpoch = uptime != null ? context.nowS() - uptime : null;
        return new StatsReset(
                resetEpoch,
                Timestamps.isoUtcOrNull(resetEpoch),
                daysSinceReset,
                startupEpoch,
                Timestamps.isoUtcOrNull(startupEpoch));
    }

    private static boolean isBtree(MetricSample sample) {
        String flag = sample.label("idx_is_btree");
        if (flag != null) {
            return IndexLabels.flag(flag);
        }
        return sample.label("opclasses", "").startsWith("btree");
    }

    private static Double present(OptionalDouble value) {
        return value.isPresent() && Double.isFinite(value.getAsDouble()) ? value.getAsDouble() : null;
    }
}
