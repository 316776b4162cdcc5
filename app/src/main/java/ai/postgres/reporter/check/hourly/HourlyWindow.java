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
import ai.postgres.reporter.model.Timeline;

/**
 * Shape of the hourly window shared by the top-K and wait event checks.
 *
 * @param hours          Number of hourly steps
 * @param limit          Number of query ids kept per database
 * @param useCurrentTime End the window now instead of at the last full hour
 */
public record HourlyWindow(int hours, int limit, boolean useCurrentTime) {

    public static HourlyWindow from(ReporterConfig config) {
        return new HourlyWindow(config.hours(), config.topQueriesLimit(), config.useCurrentTime());
    }

    public Timeline timeline(long nowS) {
        long endS = useCurrentTime ? nowS : HourlyTopKAggregator.floorHour(nowS);
        return HourlyTopKAggregator.buildTimeline(endS, hours, HourlyTopKAggregator.HOUR_S);
    }
}
