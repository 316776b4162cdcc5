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

@ApplicationScoped
public class H004RedundantIndexesCheck extends AbstractPerDatabaseCheck<RedundantIndexes> {

    static final String METRIC_INDEX_SIZE = "pgwatch_redundant_indexes_index_size_bytes";
    static final String METRIC_TABLE_SIZE = "pgwatch_redundant_indexes_table_size_bytes";
    static final String METRIC_INDEX_USAGE = "pgwatch_redundant_indexes_index_usage";
    static final String METRIC_SUPPORTS_FK = "pgwatch_redundant_indexes_supports_fk";

    private final MetricQueries queries;
    private final SinkStore sink;

    @Inject
    public H004RedundantIndexesCheck(MetricQueries queries, SinkStore sink) {
        this.queries = queries;
        this.sink = sink;
    }

    @Override
    public CheckType type() {
        return CheckType.H004;
    }

    @Override
    protected RedundantIndexes collectDatabase(CheckContext context, String database) {
        List<MetricSample> samples = queries.instant(context.selector(METRIC_INDEX_SIZE, database).build());
        Map<String, String> definitions = samples.isEmpty() ? Map.of() : sink.getIndexDefinitions(database);

        List<RedundantIndex> indexes = new ArrayList<>();
        for (MetricSample sample : samples) {
            String schema = IndexLabels.schema(sample);
            String table = IndexLabels.table(sample);
            String index = IndexLabels.index(sample);
            double indexSize = IndexLabels.finite(sample.value());
            double tableSize = companion(context, database, METRIC_TABLE_SIZE, sample);
            indexes.add(new RedundantIndex(
                    schema,
                    table,
                    index,
                    sample.label("relation_name", schema + "." + table),
                    sample.label("access_method", "unknown"),
                    sample.label("reason", "Unknown"),
                    definitions.get(index),
                    indexSize,
                    tableSize,
                    companion(context, database, METRIC_INDEX_USAGE, sample),
                    companion(context, database, METRIC_SUPPORTS_FK, sample) >= 1.0,
                    SettingsFormatter.formatBytes(indexSize),
                    SettingsFormatter.formatBytes(tableSize)));
        }
        indexes.sort(Comparator.comparingDouble(RedundantIndex::indexSizeBytes).reversed());
        double total = indexes.stream().mapToDouble(RedundantIndex::indexSizeBytes).sum();
        return new RedundantIndexes(indexes, indexes.size(), total, SettingsFormatter.formatBytes(total));
    }

    private double companion(CheckContext context, String database, String metric, MetricSample sample) {
        return queries.scalarOrZero(IndexLabels.companion(context, database, metric, sample).build());
    }
}
