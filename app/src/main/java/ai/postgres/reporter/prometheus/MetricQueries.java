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
package ai.postgres.reporter.prometheus;

import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.model.MetricSeries;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Lenient access to the {@link MetricSource} for report generation.
 *
 * <p>A failed query is logged, counted and turned into an empty result, so a
 * single missing metric leaves a gap in a report instead of failing it.
 */
@Slf4j
@ApplicationScoped
public class MetricQueries {

    private final MetricSource source;
    private final ReporterMetrics metrics;

    @Inject
    public MetricQueries(MetricSource source, ReporterMetrics metrics) {
        this.source = source;
        this.metrics = metrics;
    }

    public MetricSource source() {
        return source;
    }

    public List<MetricSample> instant(String expr) {
        try {
            return source.queryInstant(expr);
        } catch (MetricSourceException e) {
            recordFailure(expr, e);
            return List.of();
        }
    }

    public List<MetricSeries> range(String expr, long startS, long endS, String step) {
        try {
            return source.queryRange(expr, startS, endS, step);
        } catch (MetricSourceException e) {
            recordFailure(expr, e);
            return List.of();
        }
    }

    /**
     * Value of the first sample returned by an instant query.
     *
     * @param expr Query expression
     * @return The value, or empty when the query failed or returned nothing
     */
    public OptionalDouble scalar(String expr) {
        List<MetricSample> samples = instant(expr);
        if (samples.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(samples.get(0).value());
    }

    public double scalarOrZero(String expr) {
        OptionalDouble value = scalar(expr);
        return value.isPresent() && Double.isFinite(value.getAsDouble()) ? value.getAsDouble() : 0.0;
    }

    private void recordFailure(String expr, MetricSourceException e) {
        log.warn("Metric query failed, continuing without it: {}", e.getMessage());
        log.debug("Failed expression: {}", expr);
        metrics.incrementMetricQueryErrors();
    }
}
