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
package ai.postgres.reporter.topology;

import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.model.NodeTopology;
import ai.postgres.reporter.prometheus.FakeMetricSource;
import ai.postgres.reporter.prometheus.MetricQueries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static ai.postgres.reporter.prometheus.FakeMetricSource.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class TopologyServiceTest {

    @Mock
    private ReporterMetrics metrics;

    @Test
    void testGetAllClusters_DistinctAndSorted() {
        FakeMetricSource source = new FakeMetricSource().onInstant("setting_name=\"server_version\"",
                sample(1, "cluster", "staging", "node_name", "a"),
                sample(1, "cluster", "prod", "node_name", "a"),
                sample(1, "cluster", "prod", "node_name", "b"),
                sample(1, "node_name", "orphan"));
        TopologyService service = new TopologyService(new MetricQueries(source, metrics), List.of());

        assertEquals(List.of("prod", "staging"), service.getAllClusters());
    }

    @Test
    void testGetAllNodes_StandbyDetectedFromSettings() {
        // Setup
        FakeMetricSource source = new FakeMetricSource()
                .onInstant("in_hot_standby",
                        sample(1, "node_name", "pg-1", "setting_name", "in_hot_standby", "setting_value", "on"),
                        sample(1, "node_name", "pg-2", "setting_name", "in_hot_standby", "setting_value", "off"),
                        sample(1, "node_name", "pg-3", "setting_name", "transaction_read_only",
                                "setting_value", "on"))
                .onInstant("setting_name=\"server_version\"",
                        sample(1, "cluster", "prod", "node_name", "pg-3"),
                        sample(1, "cluster", "prod", "node_name", "pg-1"),
                        sample(1, "cluster", "prod", "node_name", "pg-2"));
        TopologyService service = new TopologyService(new MetricQueries(source, metrics), List.of());

        // Execute
        Optional<NodeTopology> topology = service.getAllNodes("prod");

        // Verify
        assertTrue(topology.isPresent());
        assertEquals("pg-2", topology.get().primary());
        assertEquals(List.of("pg-1", "pg-3"), topology.get().standbys());
        assertEquals(List.of("pg-2", "pg-1", "pg-3"), topology.get().allNodes());
    }

    @Test
    void testGetAllNodes_AllStandbys_FirstNodeIsPrimary() {
        FakeMetricSource source = new FakeMetricSource()
                .onInstant("in_hot_standby",
                        sample(1, "node_name", "pg-1", "setting_value", "on"),
                        sample(1, "node_name", "pg-2", "setting_value", "on"))
                .onInstant("setting_name=\"server_version\"",
                        sample(1, "node_name", "pg-2"),
                        sample(1, "node_name", "pg-1"));
        TopologyService service = new TopologyService(new MetricQueries(source, metrics), List.of());

        assertEquals("pg-1", service.getAllNodes("prod").orElseThrow().primary());
    }

    @Test
    void testGetAllNodes_NoNodes_Empty() {
        TopologyService service = new TopologyService(
                new MetricQueries(new FakeMetricSource(), metrics), List.of());

        assertTrue(service.getAllNodes("prod").isEmpty());
    }

    @Test
    void testGetAllDatabases_ExcludesTemplatesAndConfigured() {
        FakeMetricSource source = new FakeMetricSource().onInstant("pgwatch_db_size_size_b{",
                sample(1, "datname", "app"),
                sample(1, "datname", "template1"),
                sample(1, "datname", "scratch"),
                sample(1, "datname", "app"),
                sample(1, "datname", "postgres"));
        TopologyService service = new TopologyService(new MetricQueries(source, metrics), List.of(" scratch ", ""));

        assertEquals(List.of("app", "postgres"), service.getAllDatabases("prod", "pg-1"));
        assertTrue(service.excludedDatabases().contains("rdsadmin"));
    }

    @Test
    void testGetAllDatabases_FallsBackToDatabaseSizeMetric() {
        FakeMetricSource source = new FakeMetricSource().onInstant("pgwatch_pg_database_size_bytes{",
                sample(1, "datname", "app"));
        TopologyService service = new TopologyService(new MetricQueries(source, metrics), List.of());

        assertEquals(List.of("app"), service.getAllDatabases("prod", "pg-1"));
        assertEquals(2, source.instantQueries().size());
    }
}
