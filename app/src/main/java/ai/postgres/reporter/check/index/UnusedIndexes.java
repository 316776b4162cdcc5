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

import java.util.List;

@JsonPropertyOrder({"unused_indexes", "total_count", "total_size_bytes", "total_size_pretty", "stats_reset"})
public record UnusedIndexes(
        @JsonProperty("unused_indexes") List<UnusedIndex> unusedIndexes,
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("total_size_bytes") double totalSizeBytes,
        @JsonProperty("total_size_pretty") String totalSizePretty,
        @JsonProperty("stats_reset") StatsReset statsReset) {
}
