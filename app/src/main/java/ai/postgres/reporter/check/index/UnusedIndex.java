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
 * An index that has not been scanned since statistics were last reset.
 *
 * @param indexDefinition DDL from the sink store, null when unknown
 */
@JsonPropertyOrder({"schema_name", "table_name", "index_name", "index_definition", "reason", "idx_scan",
        "index_size_bytes", "idx_is_btree", "supports_fk", "index_size_pretty"})
public record UnusedIndex(
        @JsonProperty("schema_name") String schemaName,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("index_name") String indexName,
        @JsonProperty("index_definition") String indexDefinition,
        String reason,
        @JsonProperty("idx_scan") double idxScan,
        @JsonProperty("index_size_bytes") double indexSizeBytes,
        @JsonProperty("idx_is_btree") boolean idxIsBtree,
        @JsonProperty("supports_fk") boolean supportsFk,
        @JsonProperty("index_size_pretty") String indexSizePretty) {
}
