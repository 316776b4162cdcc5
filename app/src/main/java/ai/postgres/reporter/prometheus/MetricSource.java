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

import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.model.MetricSeries;

import java.util.List;

/**
 * Read access to a Prometheus-compatible query API.
 *
 * <p>Expressions are passed through as-is; callers are responsible for building them
 * with {@link Selector} so label values are escaped. An empty list means the backend
 * answered successfully without data. Every failure is reported as a
 * {@link MetricSourceException}, never as an empty result.
 */
public interface MetricSource {

    /**
     * Evaluate an expression at the current time.
     *
     * @param expr Query expression
     * @return One sample per returned series
     * @throws MetricSourceException If the backend fails or rejects the query
     */
    List<MetricSample> queryInstant(String expr) throws MetricSourceException;

    /**
     * Evaluate an expression over a time range.
     *
     * @param expr   Query expression
     * @param startS Range start, epoch seconds
     * @param endS   Range end, epoch seconds
     * @param step   Resolution, e.g. "30s" or "3600s"
     * @return Returned series with their points
     * @throws MetricSourceException If the backend fails or rejects the query
     */
    List<MetricSeries> queryRange(String expr, long startS, long endS, String step) throws MetricSourceException;

    /**
     * Check that the backend answers its status endpoint.
     *
     * @return {@code true} if reachable
     */
    boolean testConnection();
}
