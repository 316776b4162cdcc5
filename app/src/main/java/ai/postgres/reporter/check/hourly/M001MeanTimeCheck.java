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

import ai.postgres.reporter.aggregation.HourlyTopKAggregator;
import ai.postgres.reporter.check.AbstractPerDatabaseCheck;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.common.Constants;
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.model.Timeline;
import ai.postgres.reporter.model.TopKResult;
import ai.postgres.reporter.prometheus.MetricSourceException;
import ai.postgres.reporter.report.CheckType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Queries ranked by mean execution time over the window.
 *
 * <p>Candidates are the top queries by total execution time; their call counts are
 * fetched for the same ids and the mean is {@code sum(exec_time) / sum(calls)}.
 */
@ApplicationScoped
public class M001MeanTimeCheck extends AbstractPerDatabaseCheck<MeanTimeQueries> {

    static final String METRIC_EXEC_TIME = Constants.METRIC_PREFIX_PGSS + "exec_time_total";
    static final String METRIC_CALLS = Constants.METRIC_PREFIX_PGSS + "calls";

    private final HourlyTopKAggregator aggregator;
    private final HourlyWindow window;

    @Inject
    public M001MeanTimeCheck(HourlyTopKAggregator aggregator, ReporterConfig config) {
        this(aggregator, HourlyWindow.from(config));
    }

    M001MeanTimeCheck(HourlyTopKAggregator aggregator, HourlyWindow window) {
        this.aggregator = aggregator;
        this.window = window;
    }

    @Override
    public CheckType type() {
        return CheckType.M001;
    }

    @Override
    protected MeanTimeQueries collectDatabase(CheckContext context, String database) throws MetricSourceException {
        Timeline timeline = window.timeline(context.nowS());
        Map<String, String> labels = context.labels(database);

        TopKResult execTime = aggregator.topK(METRIC_EXEC_TIME, labels, window.limit(), timeline);
        Map<String, List<Double>> calls =
                aggregator.seriesFor(METRIC_CALLS, labels, execTime.perEntity().keySet(), timeline);

        List<MeanTimeQuery> queries = new ArrayList<>(execTime.perEntity().size());
        for (String queryId : execTime.perEntity().keySet()) {
            double totalExec = execTime.entityTotal(queryId);
            double totalCalls = sum(calls.get(queryId));
            double mean = totalCalls > 0 ? totalExec / totalCalls : 0.0;
            queries.add(new MeanTimeQuery(queryId, mean, totalExec, totalCalls));
        }
        queries.sort(Comparator.comparingDouble(MeanTimeQuery::meanTimeMs).reversed()
                .thenComparing(MeanTimeQuery::queryid));

        MeanTimeQueries.Summary summary = new MeanTimeQueries.Summary(
                queries.size(),
                queries.stream().mapToDouble(MeanTimeQuery::totalExecTimeMs).sum(),
                queries.stream().mapToDouble(MeanTimeQuery::totalCalls).sum());
        return new MeanTimeQueries(queries, timeline.points(), window.hours(), summary);
    }

    private static double sum(List<Double> values) {
        return values == null ? 0.0 : values.stream().mapToDouble(Double::doubleValue).sum();
    }
}
