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

import ai.postgres.reporter.model.PostgresVersion;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Result of one check on one node.
 *
 * @param data            Check-specific payload, an empty object when the check failed
 * @param postgresVersion Server version of the node, omitted when unknown
 * @param error           Failure message, omitted on success
 */
@JsonPropertyOrder({"data", "postgres_version", "error"})
public record NodeResult(
        Object data,
        @JsonProperty("postgres_version") @JsonInclude(JsonInclude.Include.NON_NULL) PostgresVersion postgresVersion,
        @JsonInclude(JsonInclude.Include.NON_NULL) String error) {

    public static NodeResult of(Object data, PostgresVersion version) {
        return new NodeResult(data, version == null || version.isEmpty() ? null : version, null);
    }

    public static NodeResult failed(String error, PostgresVersion version) {
        return new NodeResult(Map.of(), version == null || version.isEmpty() ? null : version, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
