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
package ai.postgres.reporter.health;

import ai.postgres.reporter.prometheus.MetricSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the metrics backend. Reports cannot be generated without it.
 */
@Readiness
@ApplicationScoped
public class MetricsBackendHealthCheck implements HealthCheck {

    private final MetricSource metricSource;

    @Inject
    public MetricsBackendHealthCheck(MetricSource metricSource) {
        this.metricSource = metricSource;
    }

    @Override
    public HealthCheckResponse call() {
        boolean reachable = metricSource.testConnection();

        return HealthCheckResponse.named("metrics-backend")
                .status(reachable)
                .withData("reachable", reachable)
                .build();
    }
}
