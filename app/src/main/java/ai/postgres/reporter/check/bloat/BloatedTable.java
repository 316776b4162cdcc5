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
package ai.postgres.reporter.check.bloat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Heap bloat estimate of one table. Sizes are in bytes.
 */
@JsonPropertyOrder({"schema_name", "table_name", "real_size", "extra_size", "extra_pct", "bloat_size",
        "bloat_pct", "fillfactor", "last_vacuum_epoch", "last_vacuum", "real_size_pretty",
        "extra_size_pretty", "bloat_size_pretty"})
public record BloatedTable(
        @JsonProperty("schema_name") String schemaName,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("real_size") double realSize,
        @JsonProperty("extra_size") double extraSize,
        @JsonProperty("extra_pct") double extraPct,
        @JsonProperty("bloat_size") double bloatSize,
        @JsonProperty("bloat_pct") double bloatPct,
        double fillfactor,
        @JsonProperty("last_vacuum_epoch") Double lastVacuumEpoch,
        @JsonProperty("last_vacuum") String lastVacuum,
        @JsonProperty("real_size_pretty") String realSizePretty,
        @JsonProperty("extra_size_pretty") String extraSizePretty,
        @JsonProperty("bloat_size_pretty") String bloatSizePretty) {
}
