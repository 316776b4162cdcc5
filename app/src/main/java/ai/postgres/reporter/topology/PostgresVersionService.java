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

import ai.postgres.reporter.common.Constants;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.model.PostgresVersion;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.prometheus.Selector;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves and caches the server version of each (cluster, node).
 */
@Slf4j
@ApplicationScoped
public class PostgresVersionService {

    private final MetricQueries queries;
    private final Map<NodeKey, PostgresVersion> cache = new ConcurrentHashMap<>();

    @Inject
    public PostgresVersionService(MetricQueries queries) {
        this.queries = queries;
    }

    /**
     * Version of a node. Unknown versions are not cached, so a later call retries.
     *
     * @return Version, {@link PostgresVersion#EMPTY} when the settings are not collected
     */
    public PostgresVersion getPostgresVersionInfo(String cluster, String node) {
        NodeKey key = new NodeKey(cluster, node);
        PostgresVersion cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        PostgresVersion version = PostgresVersion.parse(
                setting(cluster, node, "server_version"),
                setting(cluster, node, "server_version_num"));
        if (!version.isEmpty()) {
            cache.put(key, version);
            log.debug("Node {}/{} runs PostgreSQL {}", cluster, node, version.version());
        }
        return version;
    }

    /**
     * Drop all cached versions; called at the start of each run.
     */
    public void clear() {
        cache.clear();
    }

    private String setting(String cluster, String node, String name) {
        String expr = Selector.of(Constants.METRIC_SETTINGS)
                .with(Constants.LABEL_CLUSTER, cluster)
                .with(Constants.LABEL_NODE, node)
                .with("setting_name", name)
                .build();
        List<MetricSample> samples = queries.instant(expr);
        return samples.isEmpty() ? "" : samples.get(0).label("setting_value", "");
    }

    private record NodeKey(String cluster, String node) {
    }
}
