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
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Estimates memory use from memory-related settings.
 *
 * <p>A missing setting falls back to the PostgreSQL default. A value that cannot be
 * parsed yields {@link MemoryEstimate#EMPTY}.
 */
@Slf4j
@UtilityClass
public final class MemoryAnalyzer {

    static final String DEFAULT_SHARED_BUFFERS = "128MB";
    static final String DEFAULT_WORK_MEM = "4MB";
    static final String DEFAULT_MAINTENANCE_WORK_MEM = "64MB";
    static final String DEFAULT_EFFECTIVE_CACHE_SIZE = "4GB";
    static final String DEFAULT_MAX_CONNECTIONS = "100";
    static final String DEFAULT_WAL_BUFFERS = "16MB";

    public static MemoryEstimate analyze(Map<String, SettingEntry> settings) {
        try {
            long sharedBuffers = bytes(settings.get("shared_buffers"), DEFAULT_SHARED_BUFFERS);
            long workMem = bytes(settings.get("work_mem"), DEFAULT_WORK_MEM);
            long maintenanceWorkMem = bytes(settings.get("maintenance_work_mem"), DEFAULT_MAINTENANCE_WORK_MEM);
            long effectiveCacheSize = bytes(settings.get("effective_cache_size"), DEFAULT_EFFECTIVE_CACHE_SIZE);
            long walBuffers = bytes(settings.get("wal_buffers"), DEFAULT_WAL_BUFFERS);
            SettingEntry connections = settings.get("max_connections");
            long maxConnections = Long.parseLong(
                    (connections == null ? DEFAULT_MAX_CONNECTIONS : connections.setting()).trim());

            return new MemoryEstimate(
                    sharedBuffers,
                    walBuffers,
                    workMem,
                    workMem * maxConnections,
                    maintenanceWorkMem,
                    effectiveCacheSize);
        } catch (NumberFormatException e) {
            log.warn("Could not analyze memory settings: {}", e.getMessage());
            return MemoryEstimate.EMPTY;
        }
    }

    /**
     * Convert a setting to bytes using its reported unit. A setting without a unit is
     * parsed by {@link SettingsFormatter#parseMemoryValue(String)}.
     */
    static long bytes(SettingEntry entry, String defaultValue) {
        if (entry == null) {
            return SettingsFormatter.parseMemoryValue(defaultValue);
        }
        String value = entry.setting() == null ? "" : entry.setting().trim();
        String unit = entry.unit() == null ? "" : entry.unit();
        if ("-1".equals(value)) {
            return 0;
        }
        return switch (unit) {
            case "8kB" -> Long.parseLong(value) * 8192L;
            case "kB" -> Long.parseLong(value) * 1024L;
            case "MB" -> Long.parseLong(value) * 1024L * 1024L;
            case "B" -> Long.parseLong(value);
            default -> SettingsFormatter.parseMemoryValue(value);
        };
    }
}
