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
package ai.postgres.reporter.query;

import ai.postgres.reporter.common.Constants;
import ai.postgres.reporter.common.Timestamps;
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.model.NodeTopology;
import ai.postgres.reporter.output.ReportWriter;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.prometheus.Selector;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.report.Report;
import ai.postgres.reporter.report.ReportAssembler;
import ai.postgres.reporter.report.ReportSchemaValidator;
import ai.postgres.reporter.sink.SinkStore;
import ai.postgres.reporter.topology.TopologyService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Builds one document per query id found in a batch of reports.
 */
@Slf4j
@ApplicationScoped
public class PerQueryExporter {

    static final String FALLBACK_NODE = "node-01";

    /**
     * Document metric name to the pg_stat_statements counter summed over the window.
     */
    static final Map<String, String> QUERY_METRICS = queryMetrics();

    private static final Pattern FILE_SAFE_ID = Pattern.compile("^[-\\w]+$");

    private final MetricQueries queries;
    private final TopologyService topologyService;
    private final SinkStore sinkStore;
    private final QueryIdExtractor extractor;
    private final ReportAssembler assembler;
    private final ReportSchemaValidator validator;
    private final ReportWriter writer;
    private final Integer queryTextLimit;

    @Inject
    public PerQueryExporter(MetricQueries queries,
                            TopologyService topologyService,
                            SinkStore sinkStore,
                            QueryIdExtractor extractor,
                            ReportAssembler assembler,
                            ReportSchemaValidator validator,
                            ReportWriter writer,
                            ReporterConfig config) {
        this(queries, topologyService, sinkStore, extractor, assembler, validator, writer,
                config.queryTextLimit().orElse(null));
    }

    PerQueryExporter(MetricQueries queries,
                     TopologyService topologyService,
                     SinkStore sinkStore,
                     QueryIdExtractor extractor,
                     ReportAssembler assembler,
                     ReportSchemaValidator validator,
                     ReportWriter writer,
                     Integer queryTextLimit) {
        this.queries = queries;
        this.topologyService = topologyService;
        this.sinkStore = sinkStore;
        this.extractor = extractor;
        this.assembler = assembler;
        this.validator = validator;
        this.writer = writer;
        this.queryTextLimit = queryTextLimit;
    }

    private static Map<String, String> queryMetrics() {
        Map<String, String> metrics = new LinkedHashMap<>();
        metrics.put("calls", Constants.METRIC_PREFIX_PGSS + "calls");
        metrics.put("total_time", Constants.METRIC_PREFIX_PGSS + "exec_time_total");
        metrics.put("plan_time", Constants.METRIC_PREFIX_PGSS + "plan_time_total");
        metrics.put("rows", Constants.METRIC_PREFIX_PGSS + "rows");
        metrics.put("shared_hit_bytes", Constants.METRIC_PREFIX_PGSS + "shared_bytes_hit_total");
        metrics.put("shared_read_bytes", Constants.METRIC_PREFIX_PGSS + "shared_bytes_read_total");
        metrics.put("temp_bytes_written", Constants.METRIC_PREFIX_PGSS + "temp_bytes_written");
        metrics.put("wal_bytes", Constants.METRIC_PREFIX_PGSS + "wal_bytes");
        metrics.put("block_read_time", Constants.METRIC_PREFIX_PGSS + "block_read_total");
        metrics.put("block_write_time", Constants.METRIC_PREFIX_PGSS + "block_write_total");
        return Collections.unmodifiableMap(metrics);
    }

    /**
     * Generate the per-query documents of a cluster.
     *
     * @param reports              Reports of the cluster, scanned for query ids
     * @param cluster              Cluster name
     * @param node                 Single node to cover, or null for the whole topology
     * @param hours                Metric window
     * @param writeImmediately     true to write each document to the output directory
     * @param includeClusterPrefix true to prefix file names with the cluster
     * @return One artifact per query id, in query id order
     * @throws UncheckedIOException If a document cannot be written
     */
    public List<PerQueryArtifact> generatePerQueryJSONs(Map<CheckType, Report> reports,
                                                        String cluster,
                                                        String node,
                                                        int hours,
                                                        boolean writeImmediately,
                                                        boolean includeClusterPrefix) {
        Map<String, Set<String>> idsByDatabase = extractor.extractQueryIds(reports);
        if (idsByDatabase.isEmpty()) {
            log.info("No query ids found in reports of cluster {}", cluster);
            return List.of();
        }

        Map<String, Set<String>> databasesByQuery = new TreeMap<>();
        idsByDatabase.forEach((db, ids) -> ids.forEach(id ->
                databasesByQuery.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(db)));

        NodeTopology topology = node != null
                ? NodeTopology.single(node)
                : topologyService.getAllNodes(cluster).orElseGet(() -> NodeTopology.single(FALLBACK_NODE));
        Map<String, Map<String, String>> texts = sinkStore.getQueryTexts(idsByDatabase.keySet(), queryTextLimit);
        log.info("Generating {} per-query documents for cluster {} ({} nodes)",
                databasesByQuery.size(), cluster, topology.allNodes().size());

        List<PerQueryArtifact> artifacts = new ArrayList<>(databasesByQuery.size());
        for (Map.Entry<String, Set<String>> entry : databasesByQuery.entrySet()) {
            String queryId = entry.getKey();
            if (!FILE_SAFE_ID.matcher(queryId).matches()) {
                log.warn("Skipping query id that cannot be used in a file name: {}", queryId);
                continue;
            }
            PerQueryDocument document = buildDocument(cluster, queryId, entry.getValue(), topology, hours, texts);
            validator.validatePerQuery(document);
            String filename = fileName(cluster, queryId, includeClusterPrefix);
            artifacts.add(new PerQueryArtifact(filename, document,
                    writeImmediately ? write(filename, document) : null));
        }
        return artifacts;
    }

    private PerQueryDocument buildDocument(String cluster, String queryId, Set<String> databases,
                                           NodeTopology topology, int hours,
                                           Map<String, Map<String, String>> texts) {
        Map<String, Map<String, PerQueryDocument.DatabaseMetrics>> results = new LinkedHashMap<>();
        TimeRange timeRange = null;
        for (String n : topology.allNodes()) {
            Map<String, PerQueryDocument.DatabaseMetrics> byDatabase = new LinkedHashMap<>();
            for (String db : databases) {
                QueryMetricValues values = getQueryMetrics(cluster, n, db, queryId, hours);
                if (timeRange == null) {
                    timeRange = values.timeRange();
                }
                byDatabase.put(db, new PerQueryDocument.DatabaseMetrics(values.metrics()));
            }
            results.put(n, byDatabase);
        }
        if (timeRange == null) {
            timeRange = timeRange(hours);
        }
        return new PerQueryDocument(cluster, queryId, queryText(texts, databases, queryId),
                topology, results, timeRange, assembler.now());
    }

    /**
     * Sum each query counter over the last {@code hours} hours.
     *
     * <p>Failed lookups are skipped and zero values are dropped.
     */
    public QueryMetricValues getQueryMetrics(String cluster, String node, String database,
                                             String queryId, int hours) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (Map.Entry<String, String> metric : QUERY_METRICS.entrySet()) {
            String selector = Selector.of(metric.getValue())
                    .with(Constants.LABEL_CLUSTER, cluster)
                    .with(Constants.LABEL_NODE, node)
                    .with(Constants.LABEL_DATABASE, database)
                    .with(Constants.LABEL_QUERY_ID, queryId)
                    .range(hours + "h");
            OptionalDouble value = queries.scalar("sum(increase(" + selector + "))");
            if (value.isPresent() && Double.isFinite(value.getAsDouble()) && value.getAsDouble() != 0.0) {
                metrics.put(metric.getKey(), value.getAsDouble());
            }
        }
        return new QueryMetricValues(metrics, timeRange(hours));
    }

    private TimeRange timeRange(int hours) {
        long endS = assembler.clock().instant().getEpochSecond();
        return new TimeRange(hours, Timestamps.isoUtc(endS - hours * 3600L), Timestamps.isoUtc(endS));
    }

    /**
     * First text found for the query in any of its databases, null when the sink has none.
     */
    private static String queryText(Map<String, Map<String, String>> texts, Set<String> databases, String queryId) {
        for (String db : databases) {
            String text = texts.getOrDefault(db, Map.of()).get(queryId);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private Path write(String filename, PerQueryDocument document) {
        try {
            return writer.write(filename, document);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + filename, e);
        }
    }

    static String fileName(String cluster, String queryId, boolean includeClusterPrefix) {
        String base = "query_" + queryId + ".json";
        return includeClusterPrefix ? cluster + "_" + base : base;
    }
}
