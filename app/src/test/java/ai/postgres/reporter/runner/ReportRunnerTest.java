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
import ai.postgres.reporter.model.NodeTopology;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportRunnerTest {

    @Mock
    private ReporterConfig config;

    @Mock
    private ReporterConfig.PerQuery perQuery;

    @Mock
    private UploadConfig uploadConfig;

    @Mock
    private TopologyService topologyService;

    @Mock
    private PostgresVersionService versionService;

    @Mock
    private CheckOrchestrator orchestrator;

    @Mock
    private PerQueryExporter perQueryExporter;

    @Mock
    private ReportWriter writer;

    @Mock
    private UploadClient uploadClient;

    @Mock
    private SinkStore sinkStore;

    @Mock
    private ReporterMetrics metrics;

    private ReportRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        lenient().when(config.cluster()).thenReturn(Optional.empty());
        lenient().when(config.nodeName()).thenReturn(Optional.empty());
        lenient().when(config.combineNodes()).thenReturn(true);
        lenient().when(config.hours()).thenReturn(24);
        lenient().when(config.perQuery()).thenReturn(perQuery);
        lenient().when(perQuery.enabled()).thenReturn(false);
        lenient().when(perQuery.includeClusterPrefix()).thenReturn(true);
        lenient().when(uploadConfig.enabled()).thenReturn(false);
        lenient().when(uploadConfig.project()).thenReturn("monitoring");
        lenient().when(uploadConfig.epoch()).thenReturn("1");
        lenient().when(writer.write(anyString(), any())).thenAnswer(inv -> Path.of("/out", inv.getArgument(0, String.class)));
        lenient().when(writer.outputDir()).thenReturn(Path.of("/out"));

        runner = new ReportRunner(config, uploadConfig, topologyService, versionService, orchestrator,
                perQueryExporter, writer, uploadClient, sinkStore, metrics);
    }

    private static Map<CheckType, Report> reports(String cluster) {
        Map<CheckType, Report> reports = new LinkedHashMap<>();
        for (CheckType type : List.of(CheckType.A002, CheckType.K003)) {
            reports.put(type, new Report(type.id(), type.title(), "2024-01-01T00:00:00Z", "1.0", "", "full",
                    NodeTopology.single(cluster + "-1"), Map.of()));
        }
        return reports;
    }

    @Test
    void testRun_DiscoversClustersAndWritesReports() throws Exception {
        // Setup
        when(topologyService.getAllClusters()).thenReturn(List.of("prod", "staging"));
        when(orchestrator.generateAllReports("prod", "node-01", true)).thenReturn(reports("prod"));
        when(orchestrator.generateAllReports("staging", "node-01", true)).thenReturn(reports("staging"));

        // Execute
        RunResult result = runner.run();

        // Verify
        assertTrue(result.successful());
        assertEquals(2, result.clusters());
        assertEquals(List.of(Path.of("/out/prod_A002.json"), Path.of("/out/prod_K003.json"),
                Path.of("/out/staging_A002.json"), Path.of("/out/staging_K003.json")), result.files());
        verify(versionService).clear();
        verify(metrics).incrementRuns();
        verify(metrics).recordRunDuration(any(Duration.class));
        verify(sinkStore).close();
        verify(uploadClient, never()).createReport(anyString(), anyString(), anyString());
    }

    @Test
    void testRun_ConfiguredClusterAndNode() {
        when(config.cluster()).thenReturn(Optional.of("prod"));
        when(config.nodeName()).thenReturn(Optional.of("pg-2"));
        when(config.combineNodes()).thenReturn(false);
        when(orchestrator.generateAllReports("prod", "pg-2", false)).thenReturn(Map.of());

        RunResult result = runner.run();

        assertEquals(1, result.clusters());
        verify(topologyService, never()).getAllClusters();
    }

    @Test
    void testRun_ClusterFailure_ContinuesWithOthers() {
        when(topologyService.getAllClusters()).thenReturn(List.of("bad", "prod"));
        when(orchestrator.generateAllReports("bad", "node-01", true))
                .thenThrow(new IllegalStateException("boom"));
        when(orchestrator.generateAllReports("prod", "node-01", true)).thenReturn(reports("prod"));

        RunResult result = runner.run();

        assertFalse(result.successful());
        assertEquals(1, result.failedClusters());
        assertEquals(2, result.files().size());
        verify(metrics).incrementRunErrors();
        verify(sinkStore).close();
    }

    @Test
    void testRun_PerQueryDocumentsGeneratedAndUploaded() throws Exception {
        // Setup
        Map<CheckType, Report> reports = reports("prod");
        when(config.cluster()).thenReturn(Optional.of("prod"));
        when(perQuery.enabled()).thenReturn(true);
        when(uploadConfig.enabled()).thenReturn(true);
        when(uploadConfig.token()).thenReturn(Optional.of("secret"));
        when(uploadClient.createReport("secret", "monitoring", "1")).thenReturn(77L);
        when(orchestrator.generateAllReports("prod", "node-01", true)).thenReturn(reports);
        when(perQueryExporter.generatePerQueryJSONs(eq(reports), eq("prod"), isNull(), eq(24), eq(true), eq(true)))
                .thenReturn(List.of(new PerQueryArtifact("prod_query_1.json", null, Path.of("/out/prod_query_1.json"))));

        // Execute
        RunResult result = runner.run();

        // Verify
        assertEquals(3, result.files().size());
        verify(uploadClient).uploadReportFile("secret", 77L, Path.of("/out/prod_A002.json"), "prod");
        verify(uploadClient).uploadReportFile("secret", 77L, Path.of("/out/prod_query_1.json"), "prod");
        verify(uploadClient, times(3)).uploadReportFile(eq("secret"), eq(77L), any(Path.class), eq("prod"));
    }

    @Test
    void testRun_UploadNotFound_DisablesUploadForRun() throws Exception {
        when(config.cluster()).thenReturn(Optional.of("prod"));
        when(uploadConfig.enabled()).thenReturn(true);
        when(uploadConfig.token()).thenReturn(Optional.of("secret"));
        when(uploadClient.createReport("secret", "monitoring", "1")).thenReturn(77L);
        when(orchestrator.generateAllReports("prod", "node-01", true)).thenReturn(reports("prod"));
        doThrow(new FeatureUnavailableException("/rpc/checkup_report_file_post"))
                .when(uploadClient).uploadReportFile(anyString(), anyLong(), any(Path.class), anyString());

        RunResult result = runner.run();

        assertTrue(result.successful());
        verify(uploadClient, times(1)).uploadReportFile(anyString(), anyLong(), any(Path.class), anyString());
    }

    @Test
    void testRun_UploadFailure_KeepsUploading() throws Exception {
        when(config.cluster()).thenReturn(Optional.of("prod"));
        when(uploadConfig.enabled()).thenReturn(true);
        when(uploadConfig.token()).thenReturn(Optional.of("secret"));
        when(uploadClient.createReport("secret", "monitoring", "1")).thenReturn(77L);
        when(orchestrator.generateAllReports("prod", "node-01", true)).thenReturn(reports("prod"));
        doThrow(new UploadException("rejected"))
                .when(uploadClient).uploadReportFile(anyString(), anyLong(), any(Path.class), anyString());

        RunResult result = runner.run();

        assertTrue(result.successful());
        verify(uploadClient, times(2)).uploadReportFile(anyString(), anyLong(), any(Path.class), anyString());
    }

    @Test
    void testRun_UploadWithoutToken_Skipped() throws Exception {
        when(config.cluster()).thenReturn(Optional.of("prod"));
        when(uploadConfig.enabled()).thenReturn(true);
        when(uploadConfig.token()).thenReturn(Optional.of(" "));
        when(orchestrator.generateAllReports("prod", "node-01", true)).thenReturn(reports("prod"));

        runner.run();

        verify(uploadClient, never()).createReport(anyString(), anyString(), anyString());
        verify(uploadClient, never()).uploadReportFile(anyString(), anyLong(), any(Path.class), anyString());
    }

    @Test
    void testRun_SinkCloseFailure_IsLogged() {
        when(config.cluster()).thenReturn(Optional.of("prod"));
        when(orchestrator.generateAllReports("prod", "node-01", true)).thenReturn(Map.of());
        doThrow(new IllegalStateException("pool closed")).when(sinkStore).close();

        RunResult result = runner.run();

        assertTrue(result.successful());
    }

    @Test
    void testRunResult_Skipped() {
        RunResult skipped = RunResult.skipped(Instant.now());

        assertTrue(skipped.skipped());
        assertFalse(skipped.successful());
        assertTrue(skipped.files().isEmpty());
        assertFalse(skipped.getAge().isNegative());
    }
}
