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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.OptionalDouble;

import static ai.postgres.reporter.prometheus.FakeMetricSource.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MetricQueriesTest {

    @Mock
    private ReporterMetrics metrics;

    @Test
    void testInstant_FailureReturnsEmptyAndCounts() {
        // Setup
        FakeMetricSource source = new FakeMetricSource().failOn("broken");
        MetricQueries queries = new MetricQueries(source, metrics);

        // Execute & Verify
        assertTrue(queries.instant("broken_metric{}").isEmpty());
        assertTrue(queries.range("broken_metric{}", 0, 60, "30s").isEmpty());
        verify(metrics, times(2)).incrementMetricQueryErrors();
    }

    @Test
    void testScalar_FirstSampleValue() {
        FakeMetricSource source = new FakeMetricSource().onInstant("up", sample(3.0), sample(5.0));
        MetricQueries queries = new MetricQueries(source, metrics);

        OptionalDouble value = queries.scalar("up");

        assertTrue(value.isPresent());
        assertEquals(3.0, value.getAsDouble());
        verify(metrics, never()).incrementMetricQueryErrors();
    }

    @Test
    void testScalarOrZero_MissingAndNonFinite() {
        FakeMetricSource source = new FakeMetricSource().onInstant("nan_metric", sample(Double.NaN));
        MetricQueries queries = new MetricQueries(source, metrics);

        assertFalse(queries.scalar("missing").isPresent());
        assertEquals(0.0, queries.scalarOrZero("missing"));
        assertEquals(0.0, queries.scalarOrZero("nan_metric"));
    }
}
