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

import java.util.Locale;
import java.util.Set;

/**
 * Parsing and pretty-printing of PostgreSQL configuration values.
 */
@UtilityClass
public final class SettingsFormatter {

    private static final long KIB = 1024L;
    private static final long MIB = KIB * 1024;
    private static final long GIB = MIB * 1024;
    private static final long TIB = GIB * 1024;

    private static final String[] IEC_UNITS = {"B", "KiB", "MiB", "GiB", "TiB", "PiB"};

    private static final Set<String> KB_MEMORY_SETTINGS = Set.of(
            "shared_buffers", "effective_cache_size", "work_mem", "maintenance_work_mem",
            "autovacuum_work_mem", "logical_decoding_work_mem", "temp_buffers", "wal_buffers");
    private static final Set<String> MS_SETTINGS = Set.of(
            "log_min_duration_statement", "idle_in_transaction_session_timeout", "lock_timeout",
            "statement_timeout", "autovacuum_vacuum_cost_delay", "vacuum_cost_delay");
    private static final Set<String> COUNT_SETTINGS = Set.of(
            "max_connections", "max_prepared_transactions", "max_locks_per_transaction",
            "max_pred_locks_per_transaction", "max_pred_locks_per_relation",
            "max_pred_locks_per_page", "max_files_per_process");
    private static final Set<String> SCALE_FACTOR_SETTINGS = Set.of(
            "autovacuum_analyze_scale_factor", "autovacuum_vacuum_scale_factor");
    private static final Set<String> BOOLEAN_SETTINGS = Set.of(
            "autovacuum", "track_activities", "track_counts", "track_functions", "track_io_timing",
            "track_wal_io_timing", "pg_stat_statements.track_utility", "pg_stat_statements.save",
            "pg_stat_statements.track_planning");

    /**
     * Parse a memory setting into bytes.
     *
     * <p>Suffixes B, KB, MB, GB and TB are case-insensitive powers of 1024 and accept
     * decimals. A bare integer is taken as kilobytes. Empty input and "-1" give 0, as does
     * any other value without a recognised suffix.
     *
     * @param raw Value such as "128MB", "4gb" or "8192"
     * @return Size in bytes
     * @throws NumberFormatException If a suffix is present but the number before it is not
     */
    public static long parseMemoryValue(String raw) {
        if (raw == null) {
            return 0;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if (value.isEmpty() || "-1".equals(value)) {
            return 0;
        }

        if (value.endsWith("TB")) {
            return (long) (Double.parseDouble(value.substring(0, value.length() - 2)) * TIB);
        } else if (value.endsWith("GB")) {
            return (long) (Double.parseDouble(value.substring(0, value.length() - 2)) * GIB);
        } else if (value.endsWith("MB")) {
            return (long) (Double.parseDouble(value.substring(0, value.length() - 2)) * MIB);
        } else if (value.endsWith("KB")) {
            return (long) (Double.parseDouble(value.substring(0, value.length() - 2)) * KIB);
        } else if (value.endsWith("B")) {
            return (long) Double.parseDouble(value.substring(0, value.length() - 1));
        }

        try {
            return Long.parseLong(value) * KIB;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Render a byte count with IEC prefixes.
     *
     * @param bytes Byte count
     * @return e.g. "0 B", "1.50 KiB", "12.5 MiB", "128 GiB"
     */
    public static String formatBytes(double bytes) {
        if (bytes == 0) {
            return "0 B";
        }
        int unit = 0;
        double value = bytes;
        while (value >= 1024 && unit < IEC_UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        String pattern;
        if (value >= 100) {
            pattern = "%.0f %s";
        } else if (value >= 10) {
            pattern = "%.1f %s";
        } else {
            pattern = "%.2f %s";
        }
        return String.format(Locale.ROOT, pattern, value, IEC_UNITS[unit]);
    }

    /**
     * Render a setting for display.
     *
     * <p>The unit reported by the server wins; without one the setting name decides.
     * Values that cannot be parsed are returned unchanged.
     *
     * @param name  Setting name
     * @param value Raw value
     * @param unit  Base unit, may be empty
     * @return Display value
     */
    public static String formatSettingValue(String name, String value, String unit) {
        if (value == null) {
            return "";
        }
        try {
            if (unit != null && !unit.isEmpty()) {
                return formatWithUnit(value, unit);
            }
            return formatByName(name == null ? "" : name, value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static String formatWithUnit(String value, String unit) {
        switch (unit) {
            case "8kB": {
                long kib = Long.parseLong(value.trim()) * 8;
                if (kib >= 1024 && kib % 1024 == 0) {
                    return (kib / 1024) + " MiB";
                }
                return kib + " KiB";
            }
            case "ms": {
                long ms = Long.parseLong(value.trim());
                if (ms >= 1000 && ms % 1000 == 0) {
                    return (ms / 1000) + " s";
                }
                return ms + " ms";
            }
            default:
                return value + " " + unit;
        }
    }

    private static String formatByName(String name, String value) {
        if (KB_MEMORY_SETTINGS.contains(name) || "max_stack_depth".equals(name)) {
            long kib = Long.parseLong(value.trim());
            return kib >= 1024 ? (kib / 1024) + " MiB" : kib + " KiB";
        }
        if (MS_SETTINGS.contains(name)) {
            long ms = Long.parseLong(value.trim());
            return ms >= 1000 ? (ms / 1000) + " s" : ms + " ms";
        }
        if ("autovacuum_naptime".equals(name)) {
            long s = Long.parseLong(value.trim());
            return s >= 60 ? (s / 60) + " min" : s + " s";
        }
        if ("autovacuum_max_workers".equals(name)) {
            return value + " workers";
        }
        if ("pg_stat_statements.max".equals(name)) {
            return value + " statements";
        }
        if ("max_wal_size".equals(name) || "min_wal_size".equals(name)) {
            long mib = Long.parseLong(value.trim());
            return mib >= 1024 ? (mib / 1024) + " GiB" : mib + " MiB";
        }
        if ("checkpoint_completion_target".equals(name)) {
            return String.format(Locale.ROOT, "%.2f", Double.parseDouble(value));
        }
        if ("hash_mem_multiplier".equals(name)) {
            return String.format(Locale.ROOT, "%.1f", Double.parseDouble(value));
        }
        if (COUNT_SETTINGS.contains(name)) {
            return name.contains("connections") ? value + " connections" : value;
        }
        if (SCALE_FACTOR_SETTINGS.contains(name)) {
            return String.format(Locale.ROOT, "%.1f%%", Double.parseDouble(value) * 100);
        }
        if (BOOLEAN_SETTINGS.contains(name)) {
            String lower = value.toLowerCase(Locale.ROOT);
            return "on".equals(lower) || "true".equals(lower) || "1".equals(lower) ? "on" : "off";
        }
        return value;
    }
}
