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
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.report.CheckType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class K006SharedReadCheck extends SingleCounterTopKCheck {

    @Inject
    public K006SharedReadCheck(HourlyTopKAggregator aggregator, ReporterConfig config) {
        this(aggregator, HourlyWindow.from(config));
    }

    K006SharedReadCheck(HourlyTopKAggregator aggregator, HourlyWindow window) {
        super(aggregator, window, "shared_bytes_read_total", "shared_read_bytes");
    }

    @Override
    public CheckType type() {
        return CheckType.K006;
    }
}
