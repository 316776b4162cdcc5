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
import ai.postgres.reporter.check.AbstractPerDatabaseCheck;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.common.Timestamps;

import java.util.List;

/**
 * Base class for the checks built on pg_stat_statements counter deltas over
 * the last {@code windowMinutes} minutes.
 *
 * @param <T> Per-database payload
 */
public abstract class AbstractQueryWindowCheck<T> extends AbstractPerDatabaseCheck<T> {

    protected final CounterWindowAggregator aggregator;
    protected final int windowMinutes;

    protected AbstractQueryWindowCheck(CounterWindowAggregator aggregator, int windowMinutes) {
        this.aggregator = aggregator;
        this.windowMinutes = windowMinutes;
    }

    @Override
    protected T collectDatabase(CheckContext context, String database) {
        long endS = context.nowS();
        long startS = endS - windowMinutes * 60L;
        List<QueryWindowRow> rows = aggregator.aggregate(context.labels(database), startS, endS);
        return build(rows, Timestamps.isoUtc(startS), Timestamps.isoUtc(endS));
    }

    protected abstract T build(List<QueryWindowRow> rows, String startTime, String endTime);

    protected static double sum(List<QueryWindowRow> rows, String column) {
        return rows.stream().mapToDouble(r -> r.metric(column)).sum();
    }
}
