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

import java.util.Comparator;
import java.util.List;

/**
 * The {@code limit} queries with the largest total execution time in the window.
 */
@ApplicationScoped
public class K003TopQueriesCheck extends AbstractQueryWindowCheck<TopQueries> {

    private final int limit;

    @Inject
    public K003TopQueriesCheck(CounterWindowAggregator aggregator, ReporterConfig config) {
        this(aggregator, config.queryWindowMinutes(), config.topQueriesLimit());
    }

    K003TopQueriesCheck(CounterWindowAggregator aggregator, int windowMinutes, int limit) {
        super(aggregator, windowMinutes);
        this.limit = limit;
    }

    @Override
    public CheckType type() {
        return CheckType.K003;
    }

    @Override
    protected TopQueries build(List<QueryWindowRow> rows, String startTime, String endTime) {
        List<QueryWindowRow> top = rows.stream()
                .sorted(Comparator.comparingDouble((QueryWindowRow r) -> r.metric("total_time")).reversed())
                .limit(limit)
                .toList();
        QueryWindowSummary summary = new QueryWindowSummary(
                null,
                top.size(),
                sum(top, "calls"),
                sum(top, "total_time"),
                sum(top, "rows"),
                windowMinutes,
                startTime,
                endTime,
                limit);
        return new TopQueries(top, summary);
    }
}
