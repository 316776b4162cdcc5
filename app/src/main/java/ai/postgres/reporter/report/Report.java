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

import ai.postgres.reporter.model.NodeTopology;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope of a check report as written to {@code <cluster>_<checkId>.json}.
 */
@JsonPropertyOrder({"checkId", "checkTitle", "timestamptz", "version", "build_ts",
        "generation_mode", "nodes", "results"})
public record Report(
        String checkId,
        String checkTitle,
        String timestamptz,
        String version,
        @JsonProperty("build_ts") String buildTs,
        @JsonProperty("generation_mode") String generationMode,
        NodeTopology nodes,
        Map<String, NodeResult> results) {

    public Report {
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public NodeResult result(String node) {
        return results.get(node);
    }
}
