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
package ai.postgres.reporter.report;

import ai.postgres.reporter.common.Constants;
import ai.postgres.reporter.config.ReporterConfig;
import ai.postgres.reporter.model.NodeTopology;
import ai.postgres.reporter.model.PostgresVersion;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps check payloads into the {@link Report} envelope.
 */
@ApplicationScoped
public class ReportAssembler {

    private final String buildVersion;
    private final String buildTimestamp;
    private final Clock clock;

    @Inject
    public ReportAssembler(ReporterConfig config) {
        this(config.build().version(), config.build().timestamp(), Clock.systemUTC());
    }

    ReportAssembler(String buildVersion, String buildTimestamp, Clock clock) {
        this.buildVersion = buildVersion;
        this.buildTimestamp = buildTimestamp;
        this.clock = clock;
    }

    /**
     * Report for a single node acting as primary.
     *
     * @param checkId Check identifier
     * @param data    Check payload
     * @param node    Node name
     * @param version Server version of the node, may be null
     */
    public Report formatReportData(String checkId, Object data, String node, PostgresVersion version) {
        Map<String, NodeResult> results = new LinkedHashMap<>();
        results.put(node, NodeResult.of(data, version));
        return formatReportData(checkId, results, NodeTopology.single(node));
    }

    /**
     * Report covering an explicit topology.
     *
     * @param checkId Check identifier
     * @param results Per-node results in topology order
     * @param nodes   Primary and standbys
     */
    public Report formatReportData(String checkId, Map<String, NodeResult> results, NodeTopology nodes) {
        return new Report(
                checkId,
                CheckType.titleOf(checkId),
                now(),
                buildVersion,
                buildTimestamp,
                Constants.GENERATION_MODE_FULL,
                nodes,
                results);
    }

    /**
     * Current time as an RFC 3339 UTC timestamp.
     */
    public String now() {
        return DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.MILLIS));
    }

    public Clock clock() {
        return clock;
    }
}
