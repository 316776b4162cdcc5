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
package ai.postgres.reporter.check;

import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.model.NodeTopology;
import ai.postgres.reporter.model.PostgresVersion;
import ai.postgres.reporter.prometheus.MetricSourceException;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.report.NodeResult;
import ai.postgres.reporter.report.Report;
import ai.postgres.reporter.report.ReportAssembler;
import ai.postgres.reporter.report.ReportSchemaValidator;
import ai.postgres.reporter.report.ReportValidationException;
import ai.postgres.reporter.settings.SettingEntry;
import ai.postgres.reporter.topology.PostgresVersionService;
import ai.postgres.reporter.topology.TopologyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @Mock
    private TopologyService topologyService;

    @Mock
    private PostgresVersionService versionService;

    @Mock
    private ReportAssembler assembler;

    @Mock
    private ReportSchemaValidator validator;

    @Mock
    private ReporterMetrics metrics;

    @Mock
    private Check settingsCheck;

    @Mock
    private Check queryCheck;

    private Map<String, SettingEntry> settings;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        settings = new LinkedHashMap<>();
        settings.put("server_version", new SettingEntry("16.2", "", "Preset Options", "internal", "string", "16.2"));
        settings.put("server_version_num",
                new SettingEntry("160002", "", "Preset Options", "internal", "integer", "160002"));

        lenient().when(settingsCheck.type()).thenReturn(CheckType.A003);
        lenient().when(queryCheck.type()).thenReturn(CheckType.K003);
        lenient().when(settingsCheck.collect(any())).thenReturn(settings);
        lenient().when(queryCheck.collect(any())).thenReturn(Map.of("db1", Map.of()));

        lenient().when(assembler.clock()).thenReturn(CLOCK);
        lenient().when(assembler.formatReportData(anyString(), anyMap(), any(NodeTopology.class)))
                .thenAnswer(inv -> new Report(inv.getArgument(0), "title", "2023-11-14T22:13:20Z", "1.0", "",
                        "full", inv.getArgument(2), (Map<String, NodeResult>) inv.getArgument(1)));
        lenient().when(topologyService.getAllDatabases(anyString(), anyString())).thenReturn(List.of("db1"));
        lenient().when(versionService.getPostgresVersionInfo(anyString(), anyString()))
                .thenReturn(PostgresVersion.EMPTY);
    }

    private CheckOrchestrator orchestrator() {
        return new CheckOrchestrator(List.of(queryCheck, settingsCheck),
                topologyService, versionService, assembler, validator, metrics);
    }

    @Test
    void testGenerateAllReports_SingleNode_RunsSettingsFirst() throws Exception {
        // Execute
        Map<CheckType, Report> reports = orchestrator().generateAllReports("prod", "node-01", false);

        // Verify
        assertEquals(List.of(CheckType.A003, CheckType.K003), List.copyOf(reports.keySet()));
        NodeResult a003 = reports.get(CheckType.A003).result("node-01");
        assertEquals("16", a003.postgresVersion().serverMajorVer(),
                "Version should fall back to the A003 settings");
        assertEquals("16", reports.get(CheckType.K003).result("node-01").postgresVersion().serverMajorVer());

        ArgumentCaptor<CheckContext> context = ArgumentCaptor.forClass(CheckContext.class);
        verify(queryCheck).collect(context.capture());
        assertEquals(settings, context.getValue().settings());
        assertEquals(1_700_000_000L, context.getValue().nowS());
        assertEquals(List.of("db1"), context.getValue().databases());
        verify(validator, times(2)).validate(any(Report.class));
        verify(topologyService, never()).getAllNodes(anyString());
    }

    @Test
    void testGenerateAllReports_CombineNodes_CoversStandbys() {
        when(topologyService.getAllNodes("prod"))
                .thenReturn(Optional.of(new NodeTopology("pg-1", List.of("pg-2"))));

        Map<CheckType, Report> reports = orchestrator().generateAllReports("prod", "node-01", true);

        Report report = reports.get(CheckType.K003);
        assertEquals(List.of("pg-1", "pg-2"), List.copyOf(report.results().keySet()));
        assertEquals("pg-1", report.nodes().primary());
    }

    @Test
    void testGenerateAllReports_UnknownTopology_FallsBackToNode() {
        when(topologyService.getAllNodes("prod")).thenReturn(Optional.empty());

        Map<CheckType, Report> reports = orchestrator().generateAllReports("prod", "node-01", true);

        assertEquals(List.of("node-01"), List.copyOf(reports.get(CheckType.A003).results().keySet()));
    }

    @Test
    void testGenerateAllReports_CheckFailure_RecordsNodeError() throws Exception {
        // Setup
        when(queryCheck.collect(any())).thenThrow(new MetricSourceException("backend unavailable"));

        // Execute
        Map<CheckType, Report> reports = orchestrator().generateAllReports("prod", "node-01", false);

        // Verify
        NodeResult failed = reports.get(CheckType.K003).result("node-01");
        assertTrue(failed.hasError());
        assertEquals("backend unavailable", failed.error());
        assertEquals(Map.of(), failed.data());
        assertFalse(reports.get(CheckType.A003).result("node-01").hasError());
        verify(metrics).incrementReportError("K003");
    }

    @Test
    void testGenerateAllReports_ExceptionWithoutMessage_UsesClassName() throws Exception {
        when(queryCheck.collect(any())).thenThrow(new IllegalStateException());

        Map<CheckType, Report> reports = orchestrator().generateAllReports("prod", "node-01", false);

        assertEquals("IllegalStateException", reports.get(CheckType.K003).result("node-01").error());
    }

    @Test
    void testGenerateAllReports_ValidationFailure_Propagates() {
        doThrow(new ReportValidationException("A003 report failed schema validation"))
                .when(validator).validate(any(Report.class));

        CheckOrchestrator orchestrator = orchestrator();
        assertThrows(ReportValidationException.class,
                () -> orchestrator.generateAllReports("prod", "node-01", false));
    }

    @Test
    void testConstructor_DuplicateCheckType_Throws() {
        Check duplicate = mock(Check.class);
        when(duplicate.type()).thenReturn(CheckType.K003);

        assertThrows(IllegalStateException.class, () -> new CheckOrchestrator(List.of(queryCheck, duplicate),
                topologyService, versionService, assembler, validator, metrics));
    }

    @Test
    void testGetCheckCount() {
        assertEquals(2, orchestrator().getCheckCount());
    }

    @Test
    void testExtractPostgresVersionFromA003_ParsedJsonSettings() {
        Map<String, Object> data = Map.of(
                "server_version", Map.of("setting", "15.4", "unit", ""),
                "server_version_num", Map.of("setting", "150004", "unit", ""));
        Report report = new Report("A003", "Postgres settings", "", "1.0", "", "full",
                NodeTopology.single("pg-1"), Map.of("pg-1", new NodeResult(data, null, null)));

        PostgresVersion version = CheckOrchestrator.extractPostgresVersionFromA003(report, null);

        assertEquals("15.4", version.version());
        assertEquals("15", version.serverMajorVer());
        assertEquals("4", version.serverMinorVer());
    }

    @Test
    void testExtractPostgresVersionFromA003_FailedNode_ReturnsEmpty() {
        Report report = new Report("A003", "Postgres settings", "", "1.0", "", "full",
                NodeTopology.single("pg-1"), Map.of("pg-1", NodeResult.failed("down", null)));

        assertTrue(CheckOrchestrator.extractPostgresVersionFromA003(report, "pg-1").isEmpty());
        assertTrue(CheckOrchestrator.extractPostgresVersionFromA003(null, null).isEmpty());
        assertNull(report.result("pg-2"));
    }
}
