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
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.model.Timeline;
import ai.postgres.reporter.model.TopKResult;
import ai.postgres.reporter.prometheus.MetricSourceException;
import ai.postgres.reporter.report.CheckType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Block read time plus block write time, in milliseconds.
 */
@ApplicationScoped
public class M003IoTimeCheck extends AbstractHourlyTopKCheck {

    static final String METRIC_READ = Constants.METRIC_PREFIX_PGSS + "block_read_total";
    static final String METRIC_WRITE = Constants.METRIC_PREFIX_PGSS + "block_write_total";

    @Inject
    public M003IoTimeCheck(HourlyTopKAggregator aggregator, ReporterConfig config) {
        this(aggregator, HourlyWindow.from(config));
    }

    M003IoTimeCheck(HourlyTopKAggregator aggregator, HourlyWindow window) {
        super(aggregator, window, "io_time", "_ms");
    }

    @Override
    public CheckType type() {
        return CheckType.M003;
    }

    @Override
    protected TopKResult attribute(CheckContext context, String database, Timeline timeline)
            throws MetricSourceException {
        return aggregator.topKSum2(METRIC_READ, METRIC_WRITE, context.labels(database), window.limit(), timeline);
    }
}
