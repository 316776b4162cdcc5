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
package ai.postgres.reporter.check.settings;

import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.prometheus.FakeMetricSource;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.settings.SettingEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ai.postgres.reporter.prometheus.FakeMetricSource.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class SettingsChecksTest {

    @Mock
    private ReporterMetrics metrics;

    private static CheckContext context(Map<String, SettingEntry> settings) {
        return new CheckContext("prod", "node-01", List.of("db1"), 1_700_000_000L, settings);
    }

    private static SettingEntry entry(String name, String value, String unit) {
        return SettingEntry.fromLabels(name, Map.of("setting_value", value, "unit", unit), "Other");
    }

    @Test
    void testA003_BuildsSortedEntriesFromLabels() {
        // Setup
        FakeMetricSource source = new FakeMetricSource().onInstant("pgwatch_settings_configured{",
                sample(1, "setting_name", "work_mem", "setting_value", "4096", "unit", "kB",
                        "category", "Resource Usage / Memory", "context", "user", "vartype", "integer"),
                sample(1, "setting_name", "autovacuum_naptime", "setting_value", "60", "unit", ""),
                sample(1, "setting_value", "ignored"));
        A003SettingsCheck check = new A003SettingsCheck(new MetricQueries(source, metrics));

        // Execute
        Map<String, SettingEntry> settings = check.collect(context(Map.of()));

        // Verify
        assertEquals(List.of("autovacuum_naptime", "work_mem"), List.copyOf(settings.keySet()));
        SettingEntry workMem = settings.get("work_mem");
        assertEquals("4096", workMem.setting());
        assertEquals("kB", workMem.unit());
        assertEquals("Resource Usage / Memory", workMem.category());
        assertEquals("user", workMem.context());
        assertEquals("4096 kB", workMem.prettyValue());
        assertEquals("Other", settings.get("autovacuum_naptime").category());
        assertEquals("1 min", settings.get("autovacuum_naptime").prettyValue());
        assertTrue(source.instantQueries().get(0).contains("node_name=\"node-01\""));
    }

    @Test
    void testA007_ListsNonDefaultSettings() {
        FakeMetricSource source = new FakeMetricSource().onInstant("is_default",
                sample(0, "setting_name", "statement_timeout", "setting_value", "30000", "unit", "ms",
                        "category", "Client Connection Defaults"));
        A007AlteredSettingsCheck check = new A007AlteredSettingsCheck(new MetricQueries(source, metrics));

        Map<String, AlteredSetting> altered = check.collect(context(Map.of()));

        assertEquals(1, altered.size());
        assertEquals("30 s", altered.get("statement_timeout").prettyValue());
        assertTrue(source.instantQueries().get(0).endsWith(" < 1"));
    }

    @Test
    void testD004_ReportsExtensionStatus() {
        // Setup
        FakeMetricSource source = new FakeMetricSource()
                .onInstant("statements_calls{",
                        sample(10, "queryid", "1", "tag_user", "app", "datname", "db1"),
                        sample(5, "queryid", "2", "user", "batch", "datname", "db1"))
                .onInstant("exec_total_time{", sample(2.5, "queryid", "1"));
        D004PgStatSettingsCheck check = new D004PgStatSettingsCheck(new MetricQueries(source, metrics));
        Map<String, SettingEntry> settings = new LinkedHashMap<>();
        settings.put("pg_stat_statements.max", entry("pg_stat_statements.max", "5000", ""));
        settings.put("work_mem", entry("work_mem", "4096", "kB"));

        // Execute
        D004Data data = check.collect(context(settings));

        // Verify
        assertEquals(List.of("pg_stat_statements.max"), List.copyOf(data.settings().keySet()));
        assertTrue(data.pgStatStatementsStatus().extensionAvailable());
        assertEquals(2, data.pgStatStatementsStatus().metricsCount());
        assertEquals(15.0, data.pgStatStatementsStatus().totalCalls());
        assertEquals("app", data.pgStatStatementsStatus().sampleQueries().get(0).user());
        assertEquals("batch", data.pgStatStatementsStatus().sampleQueries().get(1).user());
        assertTrue(data.pgStatKcacheStatus().extensionAvailable());
        assertEquals(2.5, data.pgStatKcacheStatus().totalExecTime());
        assertEquals(0.0, data.pgStatKcacheStatus().totalUserTime());
    }

    @Test
    void testD004_NoMetrics_ReportsUnavailable() {
        D004PgStatSettingsCheck check = new D004PgStatSettingsCheck(
                new MetricQueries(new FakeMetricSource(), metrics));

        D004Data data = check.collect(context(Map.of()));

        assertEquals(PgStatStatementsStatus.UNAVAILABLE, data.pgStatStatementsStatus());
        assertFalse(data.pgStatKcacheStatus().extensionAvailable());
        assertTrue(data.pgStatKcacheStatus().sampleQueries().isEmpty());
    }

    @Test
    void testF001_KeepsAutovacuumSettings() {
        Map<String, SettingEntry> settings = new LinkedHashMap<>();
        settings.put("autovacuum_naptime", entry("autovacuum_naptime", "60", ""));
        settings.put("shared_buffers", entry("shared_buffers", "16384", "8kB"));

        Map<String, SettingEntry> result = new F001AutovacuumSettingsCheck().collect(context(settings));

        assertEquals(1, result.size());
        assertEquals("1 min", result.get("autovacuum_naptime").prettyValue());
    }

    @Test
    void testG001_AnalyzesMemory() {
        Map<String, SettingEntry> settings = new LinkedHashMap<>();
        settings.put("shared_buffers", entry("shared_buffers", "16384", "8kB"));
        settings.put("max_connections", entry("max_connections", "200", ""));
        settings.put("ssl", entry("ssl", "on", "bool"));

        G001Data data = new G001MemorySettingsCheck().collect(context(settings));

        assertEquals(List.of("shared_buffers", "max_connections"), List.copyOf(data.settings().keySet()));
        assertEquals(134_217_728L, data.analysis().estimatedTotalMemoryUsage().sharedBuffersBytes());
        assertEquals(200L * 4 * 1024 * 1024, data.analysis().estimatedTotalMemoryUsage().maxWorkMemUsageBytes());
    }

    @Test
    void testS002_CollectsSslSettings() {
        Map<String, SettingEntry> settings = new LinkedHashMap<>();
        settings.put("ssl", entry("ssl", "on", ""));
        settings.put("ssl_min_protocol_version", entry("ssl_min_protocol_version", "TLSv1.2", ""));
        settings.put("work_mem", entry("work_mem", "4096", "kB"));

        S002Data data = new S002SslSettingsCheck().collect(context(settings));

        assertTrue(data.sslEnabled());
        assertEquals(List.of("ssl", "ssl_min_protocol_version"), List.copyOf(data.settings().keySet()));
        assertFalse(new S002SslSettingsCheck().collect(context(Map.of())).sslEnabled());
    }
}
