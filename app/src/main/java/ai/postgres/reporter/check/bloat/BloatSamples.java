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

import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.prometheus.MetricQueries;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins the per-column gauges of a bloat estimate into one row per relation.
 */
final class BloatSamples {

    static final String LABEL_SCHEMA = "schemaname";
    static final String LABEL_TABLE = "tblname";
    static final String LABEL_INDEX = "idxname";
    static final String METRIC_LAST_VACUUM = "pgwatch_pg_stat_all_tables_last_vacuum";
    static final double MIB = 1024.0 * 1024.0;

    private final MetricQueries queries;

    BloatSamples(MetricQueries queries) {
        this.queries = queries;
    }

    /**
     * Query {@code prefix + column} for each column and group values by relation.
     *
     * @param keyLabels Labels identifying a relation, in key order
     * @return Relation key (label values) to column values; columns without a sample are absent
     */
    Map<List<String>, Map<String, Double>> rows(CheckContext context, String database, String prefix,
                                                List<String> columns, List<String> keyLabels) {
        Map<List<String>, Map<String, Double>> rows = new LinkedHashMap<>();
        for (String column : columns) {
            for (MetricSample sample : queries.instant(context.selector(prefix + column, database).build())) {
                List<String> key = new ArrayList<>(keyLabels.size());
                for (String label : keyLabels) {
                    key.add(sample.label(label, "unknown"));
                }
                double value = Double.isFinite(sample.value()) ? sample.value() : 0.0;
                rows.computeIfAbsent(List.copyOf(key), k -> new LinkedHashMap<>()).put(column, value);
            }
        }
        return rows;
    }

    /**
     * Epoch of the last manual vacuum per {@code schema.table}.
     */
    Map<String, Double> lastVacuum(CheckContext context, String database) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (MetricSample sample : queries.instant(context.selector(METRIC_LAST_VACUUM, database).build())) {
            String schema = sample.label(LABEL_SCHEMA);
            String table = sample.label("relname");
            if (schema != null && table != null && Double.isFinite(sample.value())) {
                result.put(schema + "." + table, sample.value());
            }
        }
        return result;
    }

    static double column(Map<String, Double> row, String column) {
        return row.getOrDefault(column, 0.0);
    }

    /**
     * A vacuum epoch of 0 means "never vacuumed".
     */
    static Double vacuumEpoch(Map<String, Double> lastVacuum, String schema, String table) {
        Double epoch = lastVacuum.get(schema + "." + table);
        return epoch != null && epoch > 0 ? epoch : null;
    }
}
