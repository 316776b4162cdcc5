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
package ai.postgres.reporter.check.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Totals over the rows of a counter-window report.
 *
 * @param queryCount Number of rows; serialized as {@code total_queries} for K001 and
 *                   {@code queries_returned} for K003
 * @param limit      Row limit, only set for K003
 */
@JsonPropertyOrder({"total_queries", "queries_returned", "total_calls", "total_time_ms", "total_rows",
        "time_range_minutes", "start_time", "end_time", "limit"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryWindowSummary(
        @JsonProperty("total_queries") Integer totalQueries,
        @JsonProperty("queries_returned") Integer queriesReturned,
        @JsonProperty("total_calls") double totalCalls,
        @JsonProperty("total_time_ms") double totalTimeMs,
        @JsonProperty("total_rows") double totalRows,
        @JsonProperty("time_range_minutes") int timeRangeMinutes,
        @JsonProperty("start_time") String startTime,
        @JsonProperty("end_time") String endTime,
        Integer limit) {
}
