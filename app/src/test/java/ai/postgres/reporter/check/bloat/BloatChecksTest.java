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
package ai.postgres.reporter.check.bloat;

import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.prometheus.FakeMetricSource;
import ai.postgres.reporter.prometheus.MetricQueries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static ai.postgres.reporter.prometheus.FakeMetricSource.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class BloatChecksTest {

    @Mock
    private ReporterMetrics metrics;

    private static CheckContext context() {
        return new CheckContext("prod", "node-01", List.of("db1"), 1_700_000_000L);
    }

    @Test
    void testF004_JoinsColumnsPerTable() throws Exception {
        // Setup
        FakeMetricSource source = new FakeMetricSource()
                .onInstant("table_bloat_real_size_mib{",
                        sample(2, "schemaname", "public", "tblname", "orders"),
                        sample(1, "schemaname", "public", "tblname", "users"))
                .onInstant("table_bloat_bloat_pct{",
                        sample(10, "schemaname", "public", "tblname", "orders"),
                        sample(40, "schemaname", "public", "tblname", "users"))
                .onInstant("table_bloat_bloat_size{",
                        sample(1024, "schemaname", "public", "tblname", "orders"),
                        sample(2048, "schemaname", "public", "tblname", "users"))
                .onInstant("last_vacuum{",
                        sample(1_700_000_000L, "schemaname", "public", "relname", "orders"),
                        sample(0, "schemaname", "public", "relname", "users"))
                .onInstant("db_size_size_b{", sample(1_048_576));
        F004HeapBloatCheck check = new F004HeapBloatCheck(new MetricQueries(source, metrics));

        // Execute
        HeapBloat bloat = check.collect(context()).get("db1");

        // Verify
        assertEquals(2, bloat.totalCount());
        BloatedTable first = bloat.bloatedTables().get(0);
        assertEquals("users", first.tableName(), "Tables should be ordered by bloat percentage");
        assertEquals(1024.0 * 1024.0, first.realSize());
        assertEquals("1.00 MiB", first.realSizePretty());
        assertNull(first.lastVacuum(), "A zero vacuum epoch means never vacuumed");

        BloatedTable second = bloat.bloatedTables().get(1);
        assertEquals("orders", second.tableName());
        assertEquals("2023-11-14T22:13:20+00:00", second.lastVacuum());
        assertEquals(0.0, second.extraSize());

        assertEquals(3072.0, bloat.totalBloatSizeBytes());
        assertEquals("3.00 KiB", bloat.totalBloatSizePretty());
        assertEquals(1_048_576.0, bloat.databaseSizeBytes());
    }

    @Test
    void testF004_NoSamples_EmptyPayload() throws Exception {
        FakeMetricSource source = new FakeMetricSource();
        F004HeapBloatCheck check = new F004HeapBloatCheck(new MetricQueries(source, metrics));

        HeapBloat bloat = check.collect(context()).get("db1");

        assertTrue(bloat.bloatedTables().isEmpty());
        assertEquals("0 B", bloat.totalBloatSizePretty());
        assertTrue(source.instantQueries().stream().noneMatch(q -> q.contains("last_vacuum")),
                "Vacuum times should only be fetched when there are rows");
    }

    @Test
    void testF005_KeysRowsByIndex() throws Exception {
        FakeMetricSource source = new FakeMetricSource()
                .onInstant("btree_bloat_real_size_mib{",
                        sample(1, "schemaname", "public", "tblname", "orders", "idxname", "orders_pkey"),
                        sample(3, "schemaname", "public", "tblname", "orders", "idxname", "orders_created_idx"))
                .onInstant("btree_bloat_table_size_mib{",
                        sample(8, "schemaname", "public", "tblname", "orders", "idxname", "orders_pkey"))
                .onInstant("btree_bloat_bloat_pct{",
                        sample(55, "schemaname", "public", "tblname", "orders", "idxname", "orders_pkey"),
                        sample(5, "schemaname", "public", "tblname", "orders", "idxname", "orders_created_idx"));
        F005BtreeBloatCheck check = new F005BtreeBloatCheck(new MetricQueries(source, metrics));

        IndexBloat bloat = check.collect(context()).get("db1");

        assertEquals(2, bloat.totalCount());
        BloatedIndex pkey = bloat.bloatedIndexes().get(0);
        assertEquals("orders_pkey", pkey.indexName());
        assertEquals(8.0 * 1024 * 1024, pkey.tableSize());
        assertEquals("8.00 MiB", pkey.tableSizePretty());
        assertEquals(0.0, bloat.bloatedIndexes().get(1).tableSize());
    }
}
