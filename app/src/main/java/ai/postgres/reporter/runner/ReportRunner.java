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
package ai.postgres.reporter.runner;

import ai.postgres.reporter.check.CheckOrchestrator;
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.config.UploadConfig;
import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.output.ReportWriter;
import ai.postgres.reporter.query.PerQueryArtifact;
import ai.postgres.reporter.query.PerQueryExporter;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.report.Report;
import ai.postgres.reporter.sink.SinkStore;
import ai.postgres.reporter.topology.PostgresVersionService;
import ai.postgres.reporter.topology.TopologyService;
import ai.postgres.reporter.upload.FeatureUnavailableException;
import ai.postgres.reporter.upload.UploadClient;
import ai.postgres.reporter.upload.UploadException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One full report run: every cluster, every check, the per-query documents and
 * the optional upload.
 *
 * <p>Runs are serialized by a lock; a trigger arriving while a run is in
 * progress is skipped. A failing cluster is logged and counted and the
 * remaining clusters still run.
 */
@Slf4j
@ApplicationScoped
public class ReportRunner {

    static final String DEFAULT_NODE = "node-01";

    private final Lock runLock = new ReentrantLock();

    private final ReporterConfig config;
    private final UploadConfig uploadConfig;
    private final TopologyService topologyService;
    private final PostgresVersionService versionService;
    private final CheckOrchestrator orchestrator;
    private final PerQueryExporter perQueryExporter;
    private final ReportWriter writer;
    private final UploadClient uploadClient;
    private final SinkStore sinkStore;
    private final ReporterMetrics metrics;

    @Inject
    public ReportRunner(ReporterConfig config,
                        UploadConfig uploadConfig,
                        TopologyService topologyService,
                        PostgresVersionService versionService,
                        CheckOrchestrator orchestrator,
                        PerQueryExporter perQueryExporter,
                        ReportWriter writer,
                        UploadClient uploadClient,
                        SinkStore sinkStore,
                        ReporterMetrics metrics) {
        this.config = config;
        this.uploadConfig = uploadConfig;
        this.topologyService = topologyService;
        this.versionService = versionService;
        this.orchestrator = orchestrator;
        this.perQueryExporter = perQueryExporter;
        this.writer = writer;
        this.uploadClient = uploadClient;
        this.sinkStore = sinkStore;
        this.metrics = metrics;
    }

    /**
     * Run all reports unless a run is already in progress.
     *
     * @return Result of the run, {@link RunResult#skipped(Instant)} when another run holds the lock
     */
    public RunResult run() {
        if (!runLock.tryLock()) {
            log.warn("Report run already in progress, skipping this trigger");
            return RunResult.skipped(Instant.now());
        }
        try {
            return runInternal();
        } finally {
            runLock.unlock();
        }
    }

    private RunResult runInternal() {
        Instant start = Instant.now();
        metrics.incrementRuns();
        versionService.clear();

        List<String> clusters = config.cluster()
                .map(List::of)
                .orElseGet(topologyService::getAllClusters);
        if (clusters.isEmpty()) {
            log.warn("No clusters found in the metrics backend, nothing to report");
        }
        log.info("Starting report run for {} clusters: {}", clusters.size(), clusters);

        List<Path> files = new ArrayList<>();
        int failed = 0;
        try {
            UploadSession upload = openUploadSession();
            for (String cluster : clusters) {
                try {
                    files.addAll(processCluster(cluster, upload));
                } catch (Exception e) {
                    failed++;
                    log.error("Report run failed for cluster {}: {}", cluster, e.getMessage(), e);
                    metrics.incrementRunErrors();
                }
            }
        } finally {
            closeSink();
            Duration duration = Duration.between(start, Instant.now());
            metrics.recordRunDuration(duration);
            log.info("Report run finished in {} ms: {} files, {} of {} clusters failed",
                    duration.toMillis(), files.size(), failed, clusters.size());
        }
        return RunResult.completed(start, clusters.size(), failed, files);
    }

    private List<Path> processCluster(String cluster, UploadSession upload) throws IOException {
        String node = config.nodeName().orElse(DEFAULT_NODE);
        Map<CheckType, Report> reports = orchestrator.generateAllReports(cluster, node, config.combineNodes());

        List<Path> files = new ArrayList<>();
        for (Map.Entry<CheckType, Report> entry : reports.entrySet()) {
            Path path = writer.write(ReportWriter.reportFileName(cluster, entry.getKey().id()), entry.getValue());
            files.add(path);
            upload.upload(path, cluster);
        }
        log.info("Cluster {}: wrote {} reports to {}", cluster, reports.size(), writer.outputDir());

        if (config.perQuery().enabled()) {
            List<PerQueryArtifact> artifacts = perQueryExporter.generatePerQueryJSONs(
                    reports, cluster, config.combineNodes() ? null : node, config.hours(),
                    true, config.perQuery().includeClusterPrefix());
            for (PerQueryArtifact artifact : artifacts) {
                files.add(artifact.path());
                upload.upload(artifact.path(), cluster);
            }
            log.info("Cluster {}: wrote {} per-query documents", cluster, artifacts.size());
        }
        return files;
    }

    private UploadSession openUploadSession() {
        if (!uploadConfig.enabled()) {
            return UploadSession.disabled();
        }
        String token = uploadConfig.token().orElse("");
        if (token.isBlank()) {
            log.warn("Upload is enabled but no API token is configured, skipping upload");
            return UploadSession.disabled();
        }
        try {
            long reportId = uploadClient.createReport(token, uploadConfig.project(), uploadConfig.epoch());
            return new UploadSession(uploadClient, token, reportId);
        } catch (FeatureUnavailableException e) {
            log.warn("{}, continuing without upload", e.getMessage());
        } catch (UploadException e) {
            log.error("Cannot create checkup report, continuing without upload: {}", e.getMessage(), e);
        }
        return UploadSession.disabled();
    }

    private void closeSink() {
        try {
            sinkStore.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close sink store: {}", e.getMessage());
        }
    }

    /**
     * Upload state of one run. A 404 from the API turns uploading off for the rest of the run.
     */
    private static final class UploadSession {
        private final UploadClient client;
        private final String token;
        private final long reportId;
        private boolean active;

        UploadSession(UploadClient client, String token, long reportId) {
            this.client = client;
            this.token = token;
            this.reportId = reportId;
            this.active = client != null;
        }

        static UploadSession disabled() {
            return new UploadSession(null, null, 0L);
        }

        void upload(Path path, String cluster) {
            if (!active || path == null) {
                return;
            }
            try {
                client.uploadReportFile(token, reportId, path, cluster);
            } catch (FeatureUnavailableException e) {
                log.warn("{}, disabling upload for this run", e.getMessage());
                active = false;
            } catch (UploadException e) {
                log.error("Failed to upload {}: {}", path.getFileName(), e.getMessage(), e);
            }
        }
    }
}
