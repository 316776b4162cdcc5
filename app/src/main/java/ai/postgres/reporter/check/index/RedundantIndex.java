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
package ai.postgres.reporter.check.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An index whose columns are covered by another index of the same table.
 */
@JsonPropertyOrder({"schema_name", "table_name", "index_name", "relation_name", "access_method", "reason",
        "index_definition", "index_size_bytes", "table_size_bytes", "index_usage", "supports_fk",
        "index_size_pretty", "table_size_pretty"})
public record RedundantIndex(
        @JsonProperty("schema_name") String schemaName,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("index_name") String indexName,
        @JsonProperty("relation_name") String relationName,
        @JsonProperty("access_method") String accessMethod,
        String reason,
        @JsonProperty("index_definition") String indexDefinition,
        @JsonProperty("index_size_bytes") double indexSizeBytes,
        @JsonProperty("table_size_bytes") double tableSizeBytes,
        @JsonProperty("index_usage") double indexUsage,
        @JsonProperty("supports_fk") boolean supportsFk,
        @JsonProperty("index_size_pretty") String indexSizePretty,
        @JsonProperty("table_size_pretty") String tableSizePretty) {
}
