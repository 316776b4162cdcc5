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
package ai.postgres.reporter.check.bloat;

import ai.postgres.reporter.check.AbstractPerDatabaseCheck;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.common.Timestamps;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.settings.SettingsFormatter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@ApplicationScoped
public class F005BtreeBloatCheck extends AbstractPerDatabaseCheck<IndexBloat> {

    static final String PREFIX = "pgwatch_pg_btree_bloat_";
    static final List<String> COLUMNS = List.of("real_size_mib", "table_size_mib", "extra_size", "extra_pct",
            "fillfactor", "bloat_size", "bloat_pct");

    private final BloatSamples samples;

    @Inject
    public F005BtreeBloatCheck(MetricQueries queries) {
        this.samples = new BloatSamples(queries);
    }

    @Override
    public CheckType type() {
        return CheckType.F005;
    }

    @Override
    protected IndexBloat collectDatabase(CheckContext context, String database) {
        Map<List<String>, Map<String, Double>> rows = samples.rows(context, database, PREFIX, COLUMNS,
                List.of(BloatSamples.LABEL_SCHEMA, BloatSamples.LABEL_TABLE, BloatSamples.LABEL_INDEX));
        Map<String, Double> lastVacuum = rows.isEmpty() ? Map.of() : samples.lastVacuum(context, database);

        List<BloatedIndex> indexes = new ArrayList<>(rows.size());
        for (Map.Entry<List<String>, Map<String, Double>> entry : rows.entrySet()) {
            String schema = entry.getKey().get(0);
            String table = entry.getKey().get(1);
            Map<String, Double> row = entry.getValue();
            double realSize = BloatSamples.column(row, "real_size_mib") * BloatSamples.MIB;
            double tableSize = BloatSamples.column(row, "table_size_mib") * BloatSamples.MIB;
            double extraSize = BloatSamples.column(row, "extra_size");
            double bloatSize = BloatSamples.column(row, "bloat_size");
            Double vacuumEpoch = BloatSamples.vacuumEpoch(lastVacuum, schema, table);
            indexes.add(new BloatedIndex(
                    schema,
                    table,
                    entry.getKey().get(2),
                    realSize,
                    tableSize,
                    extraSize,
                    BloatSamples.column(row, "extra_pct"),
                    bloatSize,
                    BloatSamples.column(row, "bloat_pct"),
                    BloatSamples.column(row, "fillfactor"),
                    vacuumEpoch,
                    Timestamps.isoUtcOrNull(vacuumEpoch),
                    SettingsFormatter.formatBytes(realSize),
                    SettingsFormatter.formatBytes(tableSize),
                    SettingsFormatter.formatBytes(extraSize),
                    SettingsFormatter.formatBytes(bloatSize)));
        }
        indexes.sort(Comparator.comparingDouble(BloatedIndex::bloatPct).reversed());

        double totalBloat = indexes.stream().mapToDouble(BloatedIndex::bloatSize).sum();
        return new IndexBloat(indexes, indexes.size(), totalBloat, SettingsFormatter.formatBytes(totalBloat));
    }
}
