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
package ai.postgres.reporter.report;

import ai.postgres.reporter.aggregation.CounterWindowAggregator;
import ai.postgres.reporter.aggregation.HourlyTopKAggregator;
import ai.postgres.reporter.check.Check;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.check.bloat.F004HeapBloatCheck;
import ai.postgres.reporter.check.bloat.F005BtreeBloatCheck;
import ai.postgres.reporter.check.cluster.A004ClusterCheck;
import ai.postgres.reporter.check.hourly.K004TempBytesCheck;
import ai.postgres.reporter.check.hourly.K005WalBytesCheck;
import ai.postgres.reporter.check.hourly.K006SharedReadCheck;
import ai.postgres.reporter.check.hourly.K007SharedHitCheck;
import ai.postgres.reporter.check.hourly.M001MeanTimeCheck;
import ai.postgres.reporter.check.hourly.M002RowsCheck;
import ai.postgres.reporter.check.hourly.M003IoTimeCheck;
import ai.postgres.reporter.check.index.H001InvalidIndexesCheck;
import ai.postgres.reporter.check.index.H002UnusedIndexesCheck;
import ai.postgres.reporter.check.index.H004RedundantIndexesCheck;
import ai.postgres.reporter.check.query.K001QueryCallsCheck;
import ai.postgres.reporter.check.query.K003TopQueriesCheck;
import ai.postgres.reporter.check.settings.A003SettingsCheck;
import ai.postgres.reporter.check.settings.A007AlteredSettingsCheck;
import ai.postgres.reporter.check.settings.D004PgStatSettingsCheck;
import ai.postgres.reporter.check.settings.F001AutovacuumSettingsCheck;
import ai.postgres.reporter.check.settings.G001MemorySettingsCheck;
import ai.postgres.reporter.check.settings.S002SslSettingsCheck;
import ai.postgres.reporter.check.version.A002VersionCheck;
import ai.postgres.reporter.check.wait.N001WaitEventsCheck;
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.prometheus.FakeMetricSource;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.sink.SinkStore;
import ai.postgres.reporter.topology.PostgresVersionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Every check, run against a backend and sink that hold no data, still produces a report
 * that passes schema validation.
 */
class EmptyBackendReportsTest {

    private static final long NOW_S = 1_705_312_800L;

    private static ReportSchemaValidator validator;

    @BeforeAll
    static void loadSchemas() {
        validator = new ReportSchemaValidator(new ObjectMapper());
    }

    private static List<Check> allChecks() {
        ReporterConfig config = mock(ReporterConfig.class);
        when(config.hours()).thenReturn(24);
        when(config.topQueriesLimit()).thenReturn(50);
        when(config.useCurrentTime()).thenReturn(false);
        when(config.queryWindowMinutes()).thenReturn(60);

        FakeMetricSource source = new FakeMetricSource();
        MetricQueries queries = new MetricQueries(source, mock(ReporterMetrics.class));
        HourlyTopKAggregator hourly = new HourlyTopKAggregator(source);
        CounterWindowAggregator window = new CounterWindowAggregator(queries);
        SinkStore sink = mock(SinkStore.class);

        return List.of(
                new A002VersionCheck(new PostgresVersionService(queries)),
                new A003SettingsCheck(queries),
                new A004ClusterCheck(queries),
                new A007AlteredSettingsCheck(queries),
                new D004PgStatSettingsCheck(queries),
                new F001AutovacuumSettingsCheck(),
                new F004HeapBloatCheck(queries),
                new F005BtreeBloatCheck(queries),
                new G001MemorySettingsCheck(),
                new H001InvalidIndexesCheck(queries),
                new H002UnusedIndexesCheck(queries, sink),
                new H004RedundantIndexesCheck(queries, sink),
                new K001QueryCallsCheck(window, config),
                new K003TopQueriesCheck(window, config),
                new K004TempBytesCheck(hourly, config),
                new K005WalBytesCheck(hourly, config),
                new K006SharedReadCheck(hourly, config),
                new K007SharedHitCheck(hourly, config),
                new M001MeanTimeCheck(hourly, config),
                new M002RowsCheck(hourly, config),
                new M003IoTimeCheck(hourly, config),
                new N001WaitEventsCheck(queries, config),
                new S002SslSettingsCheck());
    }

    @Test
    void testAllChecks_CoverEveryCheckType() {
        Set<CheckType> covered = EnumSet.noneOf(CheckType.class);
        allChecks().forEach(check -> covered.add(check.type()));

        assertEquals(EnumSet.allOf(CheckType.class), covered);
    }

    @Test
    void testEmptyBackend_EveryReportValidates() throws Exception {
        // Setup
        ReportAssembler assembler = new ReportAssembler("1.0.0", "2024-01-15T10:00:00Z",
                Clock.fixed(Instant.ofEpochSecond(NOW_S), ZoneOffset.UTC));
        CheckContext context = new CheckContext("prod", "node-01", List.of("db1"), NOW_S)
                .withSettings(Map.of());

        for (Check check : allChecks()) {
            // Execute
            Object data = check.collect(context);
            Report report = assembler.formatReportData(check.type().id(), data, "node-01", null);

            // Verify
            assertFalse(report.result("node-01").hasError(), check.type().id());
            assertDoesNotThrow(() -> validator.validate(report), check.type().id());
        }
    }
}
