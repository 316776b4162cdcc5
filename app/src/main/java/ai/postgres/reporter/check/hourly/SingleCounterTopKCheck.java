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
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.common.Constants;
import ai.postgres.reporter.model.Timeline;
import ai.postgres.reporter.model.TopKResult;
import ai.postgres.reporter.prometheus.MetricSourceException;

/**
 * Hourly top-K check over a single pg_stat_statements counter.
 */
public abstract class SingleCounterTopKCheck extends AbstractHourlyTopKCheck {

    private final String metric;

    protected SingleCounterTopKCheck(HourlyTopKAggregator aggregator, HourlyWindow window,
                                     String counter, String label) {
        super(aggregator, window, label, "");
        this.metric = Constants.METRIC_PREFIX_PGSS + counter;
    }

    @Override
    protected TopKResult attribute(CheckContext context, String database, Timeline timeline)
            throws MetricSourceException {
        return aggregator.topK(metric, context.labels(database), window.limit(), timeline);
    }

    public String metric() {
        return metric;
    }
}
