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
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.model.NodeTopology;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.prometheus.Selector;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Discovers clusters, nodes and databases from the labels of collected metrics.
 */
@Slf4j
@ApplicationScoped
public class TopologyService {

    public static final Set<String> DEFAULT_EXCLUDED_DATABASES = Set.of("template0", "template1", "rdsadmin");

    static final String METRIC_DB_SIZE = "pgwatch_db_size_size_b";
    static final String METRIC_DB_SIZE_FALLBACK = "pgwatch_pg_database_size_bytes";

    private final MetricQueries queries;
    private final Set<String> excludedDatabases;

    @Inject
    public TopologyService(MetricQueries queries, ReporterConfig config) {
        this(queries, config.excludedDatabases().orElse(List.of()));
    }

    TopologyService(MetricQueries queries, List<String> extraExcluded) {
        this.queries = queries;
        Set<String> excluded = new LinkedHashSet<>(DEFAULT_EXCLUDED_DATABASES);
        extraExcluded.stream().map(String::trim).filter(s -> !s.isEmpty()).forEach(excluded::add);
        this.excludedDatabases = Set.copyOf(excluded);
    }

    /**
     * @return Distinct cluster names, sorted
     */
    public List<String> getAllClusters() {
        String expr = Selector.of(Constants.METRIC_SETTINGS)
                .with("setting_name", "server_version")
                .build();
        Set<String> clusters = new TreeSet<>();
        for (MetricSample sample : queries.instant(expr)) {
            String cluster = sample.label(Constants.LABEL_CLUSTER);
            if (cluster != null && !cluster.isEmpty()) {
                clusters.add(cluster);
            }
        }
        log.debug("Discovered clusters: {}", clusters);
        return new ArrayList<>(clusters);
    }

    /**
     * Nodes of a cluster. A node reporting {@code in_hot_standby} or
     * {@code transaction_read_only} as "on" is a standby; the first other node in
     * name order is the primary.
     *
     * @param cluster Cluster name
     * @return Topology, or empty if the cluster reports no nodes
     */
    public Optional<NodeTopology> getAllNodes(String cluster) {
        String nodesExpr = Selector.of(Constants.METRIC_SETTINGS)
                .with(Constants.LABEL_CLUSTER, cluster)
                .with("setting_name", "server_version")
                .build();
        Set<String> nodes = new TreeSet<>();
        for (MetricSample sample : queries.instant(nodesExpr)) {
            String node = sample.label(Constants.LABEL_NODE);
            if (node != null && !node.isEmpty()) {
                nodes.add(node);
            }
        }
        if (nodes.isEmpty()) {
            return Optional.empty();
        }

        String standbyExpr = Selector.of(Constants.METRIC_SETTINGS)
                .with(Constants.LABEL_CLUSTER, cluster)
                .withRegex("setting_name", "in_hot_standby|transaction_read_only")
                .build();
        Set<String> standbys = new TreeSet<>();
        for (MetricSample sample : queries.instant(standbyExpr)) {
            if ("on".equalsIgnoreCase(sample.label("setting_value", ""))) {
                standbys.add(sample.label(Constants.LABEL_NODE, ""));
            }
        }

        String primary = nodes.stream()
                .filter(n -> !standbys.contains(n))
                .findFirst()
                .orElse(nodes.iterator().next());
        List<String> others = nodes.stream().filter(n -> !n.equals(primary)).toList();
        log.debug("Cluster {}: primary {}, standbys {}", cluster, primary, others);
        return Optional.of(new NodeTopology(primary, others));
    }

    /**
     * Databases of a node, in discovery order, without excluded databases.
     */
    public List<String> getAllDatabases(String cluster, String node) {
        List<String> databases = databasesFrom(METRIC_DB_SIZE, cluster, node);
        if (databases.isEmpty()) {
            databases = databasesFrom(METRIC_DB_SIZE_FALLBACK, cluster, node);
        }
        return databases;
    }

    public Set<String> excludedDatabases() {
        return excludedDatabases;
    }

    private List<String> databasesFrom(String metric, String cluster, String node) {
        String expr = Selector.of(metric)
                .with(Constants.LABEL_CLUSTER, cluster)
                .with(Constants.LABEL_NODE, node)
                .build();
        Set<String> databases = new LinkedHashSet<>();
        for (MetricSample sample : queries.instant(expr)) {
            String db = sample.label(Constants.LABEL_DATABASE);
            if (db != null && !db.isEmpty() && !excludedDatabases.contains(db)) {
                databases.add(db);
            }
        }
        return new ArrayList<>(databases);
    }
}
