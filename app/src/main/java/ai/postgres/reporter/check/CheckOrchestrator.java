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
package ai.postgres.reporter.check;

import ai.postgres.reporter.metrics.ReporterMetrics;
import ai.postgres.reporter.model.NodeTopology;
import ai.postgres.reporter.model.PostgresVersion;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.report.NodeResult;
import ai.postgres.reporter.report.Report;
import ai.postgres.reporter.report.ReportAssembler;
import ai.postgres.reporter.report.ReportSchemaValidator;
import ai.postgres.reporter.report.ReportValidationException;
import ai.postgres.reporter.settings.SettingEntry;
import ai.postgres.reporter.topology.PostgresVersionService;
import ai.postgres.reporter.topology.TopologyService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered check against the nodes of a cluster and assembles one
 * validated report per check.
 *
 * <p>A003 runs first on each node: its settings feed the settings-derived checks
 * and stand in for the server version when the version settings cannot be read
 * directly. A failing check only marks its own node result as failed; a report
 * that violates its schema aborts the whole generation.
 */
@Slf4j
@ApplicationScoped
public class CheckOrchestrator {

    private final Map<CheckType, Check> checks;
    private final TopologyService topologyService;
    private final PostgresVersionService versionService;
    private final ReportAssembler assembler;
    private final ReportSchemaValidator validator;
    private final ReporterMetrics metrics;

    @Inject
    public CheckOrchestrator(Instance<Check> checks,
                             TopologyService topologyService,
                             PostgresVersionService versionService,
                             ReportAssembler assembler,
                             ReportSchemaValidator validator,
                             ReporterMetrics metrics) {
        this(checks.stream().toList(), topologyService, versionService, assembler, validator, metrics);
    }

    CheckOrchestrator(List<Check> checks,
                      TopologyService topologyService,
                      PostgresVersionService versionService,
                      ReportAssembler assembler,
                      ReportSchemaValidator validator,
                      ReporterMetrics metrics) {
        this.checks = register(checks);
        this.topologyService = topologyService;
        this.versionService = versionService;
        this.assembler = assembler;
        this.validator = validator;
        this.metrics = metrics;
        log.info("Registered {} checks: {}", this.checks.size(), this.checks.keySet());
    }

    private static Map<CheckType, Check> register(List<Check> checks) {
        Map<CheckType, Check> registered = new EnumMap<>(CheckType.class);
        for (Check check : checks) {
            Check previous = registered.put(check.type(), check);
            if (previous != null) {
                throw new IllegalStateException("Two producers registered for check " + check.type() + ": "
                        + previous.getClass().getName() + " and " + check.getClass().getName());
            }
        }
        return registered;
    }

    /**
     * Generate every report for a cluster.
     *
     * @param cluster      Cluster name
     * @param node         Node to report on, also the fallback when the cluster topology is unknown
     * @param combineNodes true to cover the primary and all standbys
     * @return Reports in check order
     * @throws ReportValidationException If a report does not match its schema
     */
    public Map<CheckType, Report> generateAllReports(String cluster, String node, boolean combineNodes) {
        NodeTopology topology = combineNodes
                ? topologyService.getAllNodes(cluster).orElseGet(() -> NodeTopology.single(node))
                : NodeTopology.single(node);
        long nowS = assembler.clock().instant().getEpochSecond();
        log.info("Generating {} reports for cluster {} (nodes: {})", checks.size(), cluster, topology.allNodes());

        Map<CheckType, Map<String, NodeResult>> results = new EnumMap<>(CheckType.class);
        for (String n : topology.allNodes()) {
            collectNode(cluster, n, nowS, results);
        }

        Map<CheckType, Report> reports = new LinkedHashMap<>();
        for (Map.Entry<CheckType, Map<String, NodeResult>> entry : results.entrySet()) {
            Report report = assembler.formatReportData(entry.getKey().id(), entry.getValue(), topology);
            validator.validate(report);
            reports.put(entry.getKey(), report);
        }
        return reports;
    }

    public int getCheckCount() {
        return checks.size();
    }

    private void collectNode(String cluster, String node, long nowS,
                             Map<CheckType, Map<String, NodeResult>> results) {
        List<String> databases = topologyService.getAllDatabases(cluster, node);
        PostgresVersion version = versionService.getPostgresVersionInfo(cluster, node);
        CheckContext context = new CheckContext(cluster, node, databases, nowS);
        log.debug("Node {}/{}: {} databases", cluster, node, databases.size());

        Map<String, SettingEntry> settings = Map.of();
        Check settingsCheck = checks.get(CheckType.A003);
        if (settingsCheck != null) {
            NodeResult a003 = execute(settingsCheck, context, version);
            if (!a003.hasError()) {
                settings = SettingsFilter.settingsFrom(a003.data());
                if (version.isEmpty()) {
                    version = versionFromSettings(settings);
                    a003 = NodeResult.of(a003.data(), version);
                }
            }
            results.computeIfAbsent(CheckType.A003, k -> new LinkedHashMap<>()).put(node, a003);
        }

        CheckContext withSettings = context.withSettings(settings);
        for (Map.Entry<CheckType, Check> entry : checks.entrySet()) {
            if (entry.getKey() == CheckType.A003) {
                continue;
            }
            NodeResult result = execute(entry.getValue(), withSettings, version);
            results.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>()).put(node, result);
        }
    }

    private NodeResult execute(Check check, CheckContext context, PostgresVersion version) {
        long start = System.currentTimeMillis();
        try {
            log.debug("Running check {} on {}", check.type(), context.node());
            return NodeResult.of(check.collect(context), version);
        } catch (ReportValidationException e) {
            throw e;
        } catch (Exception e) {
            return handleCheckFailure(check, context, e, version);
        } finally {
            log.debug("Check {} on {} completed in {} ms",
                    check.type(), context.node(), System.currentTimeMillis() - start);
        }
    }

    private NodeResult handleCheckFailure(Check check, CheckContext context, Exception e, PostgresVersion version) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("Check {} failed on {}/{}: {}", check.type(), context.cluster(), context.node(), message, e);
        metrics.incrementReportError(check.type().id());
        return NodeResult.failed(message, version);
    }

    /**
     * Server version of a node of an A003 report: the attached version when present,
     * otherwise the version settings.
     *
     * @param a003 A003 report
     * @param node Node to read, null for the primary
     * @return Version, {@link PostgresVersion#EMPTY} when the report carries no version settings
     */
    public static PostgresVersion extractPostgresVersionFromA003(Report a003, String node) {
        if (a003 == null || a003.nodes() == null) {
            return PostgresVersion.EMPTY;
        }
        NodeResult result = a003.result(node != null ? node : a003.nodes().primary());
        if (result == null || result.hasError()) {
            return PostgresVersion.EMPTY;
        }
        if (result.postgresVersion() != null && !result.postgresVersion().isEmpty()) {
            return result.postgresVersion();
        }
        return versionFromSettings(SettingsFilter.settingsFrom(result.data()));
    }

    static PostgresVersion versionFromSettings(Map<String, SettingEntry> settings) {
        SettingEntry version = settings.get("server_version");
        SettingEntry versionNum = settings.get("server_version_num");
        if (version == null && versionNum == null) {
            return PostgresVersion.EMPTY;
        }
        return PostgresVersion.parse(
                version != null ? version.setting() : "",
                versionNum != null ? versionNum.setting() : "");
    }
}
