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
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@ApplicationScoped
public class H001InvalidIndexesCheck extends AbstractPerDatabaseCheck<InvalidIndexes> {

    static final String METRIC_INVALID_INDEXES = "pgwatch_pg_invalid_indexes";

    private final MetricQueries queries;

    @Inject
    public H001InvalidIndexesCheck(MetricQueries queries) {
        this.queries = queries;
    }

    @Override
    public CheckType type() {
        return CheckType.H001;
    }

    @Override
    protected InvalidIndexes collectDatabase(CheckContext context, String database) {
        List<InvalidIndex> indexes = new ArrayList<>();
        for (MetricSample sample : queries.instant(context.selector(METRIC_INVALID_INDEXES, database).build())) {
            String schema = IndexLabels.schema(sample);
            String table = IndexLabels.table(sample);
            double size = IndexLabels.finite(sample.value());
            indexes.add(new InvalidIndex(
                    schema,
                    table,
                    IndexLabels.index(sample),
                    sample.label("relation_name", schema + "." + table),
                    size,
                    SettingsFormatter.formatBytes(size),
                    IndexLabels.flag(sample.label("supports_fk"))));
        }
        indexes.sort(Comparator.comparingDouble(InvalidIndex::indexSizeBytes).reversed());
        double total = indexes.stream().mapToDouble(InvalidIndex::indexSizeBytes).sum();
        return new InvalidIndexes(indexes, indexes.size(), total, SettingsFormatter.formatBytes(total));
    }
}
