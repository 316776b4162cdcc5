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
package ai.postgres.reporter.check.query;

import ai.postgres.reporter.aggregation.CounterWindowAggregator;
import ai.postgres.reporter.aggregation.QueryWindowRow;
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.report.CheckType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Every query seen in the window, most called first.
 */
@ApplicationScoped
public class K001QueryCallsCheck extends AbstractQueryWindowCheck<QueryMetrics> {

    @Inject
    public K001QueryCallsCheck(CounterWindowAggregator aggregator, ReporterConfig config) {
        this(aggregator, config.queryWindowMinutes());
    }

    K001QueryCallsCheck(CounterWindowAggregator aggregator, int windowMinutes) {
        super(aggregator, windowMinutes);
    }

    @Override
    public CheckType type() {
        return CheckType.K001;
    }

    @Override
    protected QueryMetrics build(List<QueryWindowRow> rows, String startTime, String endTime) {
        List<QueryWindowRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparingDouble((QueryWindowRow r) -> r.metric("calls")).reversed());
        QueryWindowSummary summary = new QueryWindowSummary(
                sorted.size(),
                null,
                sum(sorted, "calls"),
                sum(sorted, "total_time"),
                sum(sorted, "rows"),
                windowMinutes,
                startTime,
                endTime,
                null);
        return new QueryMetrics(sorted, summary);
    }
}
