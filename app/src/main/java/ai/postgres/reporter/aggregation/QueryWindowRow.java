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
package ai.postgres.reporter.aggregation;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counter deltas of one query over a window. Metric columns follow the fixed
 * identity columns in the order they were added, each with its {@code _per_sec}
 * and {@code _per_call} companions.
 */
@JsonPropertyOrder({"queryid", "database", "user", "duration_seconds"})
public final class QueryWindowRow {

    private final String queryid;
    private final String database;
    private final String user;
    private final double durationSeconds;
    private final Map<String, Double> metrics = new LinkedHashMap<>();

    public QueryWindowRow(String queryid, String database, String user, double durationSeconds) {
        this.queryid = queryid;
        this.database = database;
        this.user = user;
        this.durationSeconds = durationSeconds;
    }

    @JsonProperty("queryid")
    public String queryid() {
        return queryid;
    }

    @JsonProperty("database")
    public String database() {
        return database;
    }

    @JsonProperty("user")
    public String user() {
        return user;
    }

    @JsonProperty("duration_seconds")
    public double durationSeconds() {
        return durationSeconds;
    }

    public void put(String column, double value) {
        metrics.put(column, value);
    }

    public double metric(String column) {
        return metrics.getOrDefault(column, 0.0);
    }

    @JsonAnyGetter
    public Map<String, Double> metrics() {
        return Collections.unmodifiableMap(metrics);
    }
}
