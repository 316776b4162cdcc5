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
package ai.postgres.reporter.check.settings;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Whether pg_stat_kcache metrics are being collected for the node.
 */
@JsonPropertyOrder({"extension_available", "metrics_count", "total_exec_time", "total_user_time",
        "total_system_time", "sample_queries"})
public record PgStatKcacheStatus(
        @JsonProperty("extension_available") boolean extensionAvailable,
        @JsonProperty("metrics_count") int metricsCount,
        @JsonProperty("total_exec_time") double totalExecTime,
        @JsonProperty("total_user_time") double totalUserTime,
        @JsonProperty("total_system_time") double totalSystemTime,
        @JsonProperty("sample_queries") List<Sample> sampleQueries) {

    @JsonPropertyOrder({"queryid", "user", "exec_total_time"})
    public record Sample(
            String queryid,
            String user,
            @JsonProperty("exec_total_time") double execTotalTime) {
    }
}
