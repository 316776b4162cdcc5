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

import ai.postgres.reporter.model.NodeTopology;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Everything known about one query across the nodes and databases of a cluster.
 * {@code timestamptz} is always serialized last.
 */
@JsonPropertyOrder({"cluster_id", "query_id", "query_text", "nodes", "results", "time_range", "timestamptz"})
public record PerQueryDocument(
        @JsonProperty("cluster_id") String clusterId,
        @JsonProperty("query_id") String queryId,
        @JsonProperty("query_text") @JsonInclude(JsonInclude.Include.ALWAYS) String queryText,
        NodeTopology nodes,
        Map<String, Map<String, DatabaseMetrics>> results,
        @JsonProperty("time_range") TimeRange timeRange,
        String timestamptz) {

    public record DatabaseMetrics(Map<String, Double> metrics) {
    }
}
