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

import ai.postgres.reporter.settings.SettingEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"settings", "pg_stat_statements_status", "pg_stat_kcache_status"})
public record D004Data(
        Map<String, SettingEntry> settings,
        @JsonProperty("pg_stat_statements_status") PgStatStatementsStatus pgStatStatementsStatus,
        @JsonProperty("pg_stat_kcache_status") PgStatKcacheStatus pgStatKcacheStatus) {
}
