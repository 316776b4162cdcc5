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
package ai.postgres.reporter.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Connection settings for the Prometheus-compatible metrics backend.
 */
@ConfigMapping(prefix = "app.prometheus")
public interface PrometheusConfig {

    /**
     * Base URL of the backend, without the {@code /api/v1} suffix.
     *
     * @return Backend URL (default: http://sink-prometheus:9090)
     */
    @WithDefault("http://sink-prometheus:9090")
    String url();

    /**
     * Upper bound for every instant or range query.
     *
     * @return Request timeout (default: 10 seconds)
     */
    @WithDefault("10s")
    Duration timeout();

    /**
     * Request signing for Amazon Managed Service for Prometheus.
     */
    Amp amp();

    interface Amp {

        /**
         * @return true to sign every request with SigV4 (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        @WithDefault("us-east-1")
        String region();

        /**
         * Signing name of the managed service.
         *
         * @return Service name (default: aps)
         */
        @WithName("service")
        @WithDefault("aps")
        String serviceName();
    }
}
