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
import ai.postgres.reporter.model.Timeline;
import ai.postgres.reporter.model.TopKResult;
import ai.postgres.reporter.prometheus.MetricSourceException;

/**
 * Base class for checks that attribute one pg_stat_statements counter to its top
 * queries hour by hour. Backend failures are not degraded: a partial attribution
 * would break the reconciliation against the total.
 */
public abstract class AbstractHourlyTopKCheck extends AbstractPerDatabaseCheck<HourlyTopQueries> {

    protected final HourlyTopKAggregator aggregator;
    protected final HourlyWindow window;
    private final String label;
    private final String suffix;

    protected AbstractHourlyTopKCheck(HourlyTopKAggregator aggregator, HourlyWindow window,
                                      String label, String suffix) {
        this.aggregator = aggregator;
        this.window = window;
        this.label = label;
        this.suffix = suffix;
    }

    @Override
    protected HourlyTopQueries collectDatabase(CheckContext context, String database) throws MetricSourceException {
        Timeline timeline = window.timeline(context.nowS());
        TopKResult result = attribute(context, database, timeline);
        return HourlyTopQueries.from(result, label, suffix, window.hours());
    }

    /**
     * Run the attribution for one database.
     */
    protected abstract TopKResult attribute(CheckContext context, String database, Timeline timeline)
            throws MetricSourceException;
}
