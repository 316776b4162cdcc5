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
package ai.postgres.reporter.bootstrap;

import ai.postgres.reporter.check.CheckOrchestrator;
import ai.postgres.reporter.config.PrometheusConfig;
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.config.UploadConfig;
import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.prometheus.MetricSource;
import ai.postgres.reporter.runner.ReportRunner;
import ai.postgres.reporter.runner.RunResult;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Application lifecycle: verifies the metrics backend on startup and triggers
 * report runs on a schedule.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Startup: log configuration, test the backend with retries</li>
 *   <li>Runtime: one report run per interval, overlapping triggers skipped</li>
 * </ol>
 */
@Slf4j
@ApplicationScoped
public class ReporterApp {

    private final MetricSource metricSource;
    private final ReportRunner runner;
    private final CheckOrchestrator orchestrator;
    private final ReporterConfig config;
    private final PrometheusConfig prometheusConfig;
    private final UploadConfig uploadConfig;
    private final ReporterMetrics metrics;

    @Inject
    public ReporterApp(MetricSource metricSource,
                       ReportRunner runner,
                       CheckOrchestrator orchestrator,
                       ReporterConfig config,
                       PrometheusConfig prometheusConfig,
                       UploadConfig uploadConfig,
                       ReporterMetrics metrics) {
        this.metricSource = metricSource;
        this.runner = runner;
        this.orchestrator = orchestrator;
        this.config = config;
        this.prometheusConfig = prometheusConfig;
        this.uploadConfig = uploadConfig;
        this.metrics = metrics;
    }

    void onStartup(@Observes StartupEvent event) {
        log.info("Postgres health reporter {} starting", config.build().version());
        logConfiguration();

        if (!verifyBackend()) {
            log.error("Cannot connect to the metrics backend at {}, shutting down",
                    maskSensitiveInfo(prometheusConfig.url()));
            System.exit(1);
        }

        log.info("Reporter started: first run in {}, then every {}; reports go to {}",
                config.initialDelay(), config.interval(), config.outputDir());
        log.info("Metrics at /q/metrics, readiness at /q/health/ready");
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Metrics backend:        {}", maskSensitiveInfo(prometheusConfig.url()));
        log.info("  Request signing:        {}", prometheusConfig.amp().enabled()
                ? "enabled (" + prometheusConfig.amp().region() + ")" : "disabled");
        log.info("  Cluster:                {}", config.cluster().orElse("all"));
        log.info("  Node:                   {}", config.nodeName().orElse("default"));
        log.info("  Combine nodes:          {}", config.combineNodes());
        log.info("  Output directory:       {}", config.outputDir());
        log.info("  Hours:                  {}", config.hours());
        log.info("  Top queries limit:      {}", config.topQueriesLimit());
        log.info("  Registered checks:      {}", orchestrator.getCheckCount());
        log.info("  Per-query documents:    {}", config.perQuery().enabled());
        log.info("  Upload:                 {}", uploadConfig.enabled()
                ? maskSensitiveInfo(uploadConfig.apiUrl()) + " (token " + maskToken(uploadConfig.token().orElse("")) + ")"
                : "disabled");
    }

    /**
     * Test the backend, backing off linearly between attempts.
     *
     * @return true once the backend answered
     */
    boolean verifyBackend() {
        int maxAttempts = Math.max(1, config.connectionRetryAttempts());
        Duration retryDelay = config.connectionRetryDelay();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (metricSource.testConnection()) {
                metrics.setBackendUp(true);
                if (attempt > 1) {
                    log.info("Metrics backend reachable after {} attempts", attempt);
                }
                return true;
            }
            metrics.setBackendUp(false);
            if (attempt < maxAttempts) {
                log.warn("Metrics backend connection test failed (attempt {}/{}), retrying in {}",
                        attempt, maxAttempts, retryDelay.multipliedBy(attempt));
                try {
                    Thread.sleep(retryDelay.multipliedBy(attempt).toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Connection retry interrupted");
                    return false;
                }
            }
        }
        log.error("Metrics backend connection test failed after {} attempts", maxAttempts);
        return false;
    }

    static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("password=[^&\\s]+", "password=***")
                .replaceAll("//[^/@\\s]+@", "//***@");
    }

    static String maskToken(String token) {
        if (token == null || token.isEmpty()) {
            return "not set";
        }
        return token.length() <= 4 ? "***" : token.substring(0, 2) + "***";
    }

    @Scheduled(every = "${app.reporter.interval}",
            delayed = "${app.reporter.initial-delay}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleReportRun() {
        log.debug("Scheduled report run triggered");
        try {
            RunResult result = runner.run();
            metrics.setBackendUp(metricSource.testConnection());
            if (!result.skipped() && !result.successful()) {
                log.warn("Report run finished with {} failed clusters", result.failedClusters());
            }
        } catch (Exception e) {
            log.error("Unexpected error in scheduled report run: {}", e.getMessage(), e);
        }
    }
}
