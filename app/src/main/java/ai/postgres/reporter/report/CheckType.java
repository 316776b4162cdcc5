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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every check the reporter can produce, with the title shown in the UI.
 */
public enum CheckType {
    A002("Postgres major version"),
    A003("Postgres settings"),
    A004("Cluster information"),
    A007("Altered settings"),
    D004("pg_stat_statements and pg_stat_kcache settings"),
    F001("Autovacuum: current settings"),
    F004("Autovacuum: heap bloat (estimated)"),
    F005("Autovacuum: btree index bloat (estimated)"),
    G001("Memory-related settings"),
    H001("Invalid indexes"),
    H002("Unused indexes"),
    H004("Redundant indexes"),
    K001("Globally aggregated query metrics"),
    K003("Top queries by total time (total_exec_time + total_plan_time)"),
    K004("Top queries by temp bytes written"),
    K005("Top queries by WAL generation"),
    K006("Top queries by shared blocks read"),
    K007("Top queries by shared blocks hit"),
    M001("Top queries by mean execution time"),
    M002("Top queries by rows (I/O intensity)"),
    M003("Top queries by I/O time"),
    N001("Wait events grouped by type and query"),
    S002("SSL/TLS settings");

    private static final Map<String, CheckType> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(CheckType::name, Function.identity()));

    private final String title;

    CheckType(String title) {
        this.title = title;
    }

    public String id() {
        return name();
    }

    public String title() {
        return title;
    }

    /**
     * Settings-derived checks are built from the A003 result rather than queried.
     */
    public boolean isDerivedFromSettings() {
        return this == D004 || this == F001 || this == G001;
    }

    public static CheckType fromId(String id) {
        return id == null ? null : BY_ID.get(id.toUpperCase(Locale.ROOT));
    }

    /**
     * Title for any check id, including ids this build does not know.
     */
    public static String titleOf(String id) {
        CheckType type = fromId(id);
        return type != null ? type.title : "Check " + id;
    }
}
