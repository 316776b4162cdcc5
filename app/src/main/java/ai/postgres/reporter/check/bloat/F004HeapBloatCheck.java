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

/**
 * Estimated heap bloat per table, sorted by bloat percentage.
 */
@ApplicationScoped
public class F004HeapBloatCheck extends AbstractPerDatabaseCheck<HeapBloat> {

    static final String PREFIX = "pgwatch_pg_table_bloat_";
    static final String METRIC_DB_SIZE = "pgwatch_db_size_size_b";
    static final List<String> COLUMNS =
            List.of("real_size_mib", "extra_size", "extra_pct", "fillfactor", "bloat_size", "bloat_pct");

    private final MetricQueries queries;
    private final BloatSamples samples;

    @Inject
    public F004HeapBloatCheck(MetricQueries queries) {
        this.queries = queries;
        this.samples = new BloatSamples(queries);
    }

    @Override
    public CheckType type() {
        return CheckType.F004;
    }

    @Override
    protected HeapBloat collectDatabase(CheckContext context, String database) {
        Map<List<String>, Map<String, Double>> rows = samples.rows(context, database, PREFIX, COLUMNS,
                List.of(BloatSamples.LABEL_SCHEMA, BloatSamples.LABEL_TABLE));
        Map<String, Double> lastVacuum = rows.isEmpty() ? Map.of() : samples.lastVacuum(context, database);

        List<BloatedTable> tables = new ArrayList<>(rows.size());
        for (Map.Entry<List<String>, Map<String, Double>> entry : rows.entrySet()) {
            String schema = entry.getKey().get(0);
            String table = entry.getKey().get(1);
            Map<String, Double> row = entry.getValue();
            double realSize = BloatSamples.column(row, "real_size_mib") * BloatSamples.MIB;
            double extraSize = BloatSamples.column(row, "extra_size");
            double bloatSize = BloatSamples.column(row, "bloat_size");
            Double vacuumEpoch = BloatSamples.vacuumEpoch(lastVacuum, schema, table);
            tables.add(new BloatedTable(
                    schema,
                    table,
                    realSize,
                    extraSize,
                    BloatSamples.column(row, "extra_pct"),
                    bloatSize,
                    BloatSamples.column(row, "bloat_pct"),
                    BloatSamples.column(row, "fillfactor"),
                    vacuumEpoch,
                    Timestamps.isoUtcOrNull(vacuumEpoch),
                    SettingsFormatter.formatBytes(realSize),
                    SettingsFormatter.formatBytes(extraSize),
                    SettingsFormatter.formatBytes(bloatSize)));
        }
        tables.sort(Comparator.comparingDouble(BloatedTable::bloatPct).reversed());

        double totalBloat = tables.stream().mapToDouble(BloatedTable::bloatSize).sum();
        double dbSize = queries.scalarOrZero(context.selector(METRIC_DB_SIZE, database).build());
        return new HeapBloat(tables, tables.size(), totalBloat, SettingsFormatter.formatBytes(totalBloat),
                dbSize, SettingsFormatter.formatBytes(dbSize));
    }
}
