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
package ai.postgres.reporter.metrics;

import ai.postgres.reporter.common.Constants;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Self-monitoring meters of the reporter. Counters are exported with the
 * registry's {@code _total} suffix.
 */
@Slf4j
@ApplicationScoped
public class ReporterMetrics {

    private static final String NAME_RUNS = name(Constants.SUBSYSTEM_REPORTER, "runs");
    private static final String NAME_RUN_ERRORS = name(Constants.SUBSYSTEM_REPORTER, "run_errors");
    private static final String NAME_REPORT_ERRORS = name(Constants.SUBSYSTEM_REPORTER, "report_errors");
    private static final String NAME_METRIC_QUERY_ERRORS = name(Constants.SUBSYSTEM_REPORTER, "metric_query_errors");
    private static final String NAME_RUN_DURATION = name(Constants.SUBSYSTEM_REPORTER, "run_duration_seconds");
    private static final String NAME_UPTIME = name(Constants.SUBSYSTEM_REPORTER, "uptime_seconds");
    private static final String NAME_UP = name(null, "up");

    private final AtomicReference<Double> backendUpGaugeValue = new AtomicReference<>(0.0);
    private final Instant startTime = Instant.now();

    private final MeterRegistry registry;

    private Counter runCounter;
    private Counter runErrorCounter;
    private Counter metricQueryErrorCounter;
    private Timer runDurationTimer;

    @Inject
    public ReporterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        runCounter = Counter.builder(NAME_RUNS)
                .description("Total number of report runs")
                .register(registry);
        runErrorCounter = Counter.builder(NAME_RUN_ERRORS)
                .description("Total number of clusters that failed during a run")
                .register(registry);
        metricQueryErrorCounter = Counter.builder(NAME_METRIC_QUERY_ERRORS)
                .description("Backend queries that failed and left a gap in a report")
                .register(registry);
        runDurationTimer = Timer.builder(NAME_RUN_DURATION)
                .description("Duration of a full report run")
                .register(registry);
        Gauge.builder(NAME_UP, backendUpGaugeValue::get)
                .description("Whether the metrics backend is reachable (1=up, 0=down)")
                .register(registry);
        Gauge.builder(NAME_UPTIME, () -> Duration.between(startTime, Instant.now()).toSeconds())
                .description("Duration in seconds since the reporter started")
                .register(registry);
        log.info("Reporter metrics initialized");
    }

    public void incrementRuns() {
        runCounter.increment();
    }

    public void incrementRunErrors() {
        runErrorCounter.increment();
    }

    public void incrementMetricQueryErrors() {
        metricQueryErrorCounter.increment();
    }

    /**
     * Count a check whose report was emitted with an {@code error} field.
     *
     * @param checkId Check identifier, e.g. "H002"
     */
    public void incrementReportError(String checkId) {
        Counter.builder(NAME_REPORT_ERRORS)
                .tag("check", checkId)
                .description("Number of failed report generations per check")
                .register(registry)
                .increment();
    }

    public void recordRunDuration(Duration duration) {
        runDurationTimer.record(duration);
    }

    public void setBackendUp(boolean up) {
        backendUpGaugeValue.set(up ? 1.0 : 0.0);
    }

    private static String name(String subsystem, String metric) {
        if (subsystem == null || subsystem.isEmpty()) {
            return Constants.NAMESPACE + "_" + metric;
        }
        return Constants.NAMESPACE + "_" + subsystem + "_" + metric;
    }
}
