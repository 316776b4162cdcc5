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
package ai.postgres.reporter.settings;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Settings shown by the settings-derived checks.
 */
@UtilityClass
public final class SettingsCatalog {

    public static final List<String> D004_SETTINGS = List.of(
            "pg_stat_statements.max",
            "pg_stat_statements.track",
            "pg_stat_statements.track_utility",
            "pg_stat_statements.save",
            "pg_stat_statements.track_planning",
            "shared_preload_libraries",
            "track_activities",
            "track_counts",
            "track_functions",
            "track_io_timing",
            "track_wal_io_timing");

    public static final List<String> F001_SETTINGS = List.of(
            "autovacuum",
            "autovacuum_analyze_scale_factor",
            "autovacuum_analyze_threshold",
            "autovacuum_freeze_max_age",
            "autovacuum_max_workers",
            "autovacuum_multixact_freeze_max_age",
            "autovacuum_naptime",
            "autovacuum_vacuum_cost_delay",
            "autovacuum_vacuum_cost_limit",
            "autovacuum_vacuum_scale_factor",
            "autovacuum_vacuum_threshold",
            "autovacuum_work_mem",
            "vacuum_cost_delay",
            "vacuum_cost_limit",
            "vacuum_cost_page_dirty",
            "vacuum_cost_page_hit",
            "vacuum_cost_page_miss",
            "vacuum_freeze_min_age",
            "vacuum_freeze_table_age",
            "vacuum_multixact_freeze_min_age",
            "vacuum_multixact_freeze_table_age");

    public static final List<String> G001_SETTINGS = List.of(
            "shared_buffers",
            "work_mem",
            "maintenance_work_mem",
            "effective_cache_size",
            "autovacuum_work_mem",
            "max_wal_size",
            "min_wal_size",
            "wal_buffers",
            "checkpoint_completion_target",
            "max_connections",
            "max_prepared_transactions",
            "max_locks_per_transaction",
            "max_pred_locks_per_transaction",
            "max_pred_locks_per_relation",
            "max_pred_locks_per_page",
            "logical_decoding_work_mem",
            "hash_mem_multiplier",
            "temp_buffers",
            "shared_preload_libraries",
            "dynamic_shared_memory_type",
            "huge_pages",
            "max_files_per_process",
            "max_stack_depth");

    /**
     * Prefix of the TLS settings reported by S002.
     */
    public static final String SSL_PREFIX = "ssl";
}
