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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Derived memory figures of a server. All fields are null in the empty estimate,
 * which serializes as {@code {}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "shared_buffers_bytes", "shared_buffers_pretty",
        "wal_buffers_bytes", "wal_buffers_pretty",
        "shared_memory_total_bytes", "shared_memory_total_pretty",
        "work_mem_per_connection_bytes", "work_mem_per_connection_pretty",
        "max_work_mem_usage_bytes", "max_work_mem_usage_pretty",
        "maintenance_work_mem_bytes", "maintenance_work_mem_pretty",
        "effective_cache_size_bytes", "effective_cache_size_pretty"})
public record MemoryEstimate(
        @JsonProperty("shared_buffers_bytes") Long sharedBuffersBytes,
        @JsonProperty("wal_buffers_bytes") Long walBuffersBytes,
        @JsonProperty("work_mem_per_connection_bytes") Long workMemPerConnectionBytes,
        @JsonProperty("max_work_mem_usage_bytes") Long maxWorkMemUsageBytes,
        @JsonProperty("maintenance_work_mem_bytes") Long maintenanceWorkMemBytes,
        @JsonProperty("effective_cache_size_bytes") Long effectiveCacheSizeBytes) {

    public static final MemoryEstimate EMPTY = new MemoryEstimate(null, null, null, null, null, null);

    @JsonIgnore
    public boolean isEmpty() {
        return sharedBuffersBytes == null;
    }

    @JsonProperty("shared_buffers_pretty")
    public String sharedBuffersPretty() {
        return pretty(sharedBuffersBytes);
    }

    @JsonProperty("wal_buffers_pretty")
    public String walBuffersPretty() {
        return pretty(walBuffersBytes);
    }

    @JsonProperty("shared_memory_total_bytes")
    public Long sharedMemoryTotalBytes() {
        return isEmpty() ? null : sharedBuffersBytes + walBuffersBytes;
    }

    @JsonProperty("shared_memory_total_pretty")
    public String sharedMemoryTotalPretty() {
        return pretty(sharedMemoryTotalBytes());
    }

    @JsonProperty("work_mem_per_connection_pretty")
    public String workMemPerConnectionPretty() {
        return pretty(workMemPerConnectionBytes);
    }

    @JsonProperty("max_work_mem_usage_pretty")
    public String maxWorkMemUsagePretty() {
        return pretty(maxWorkMemUsageBytes);
    }

    @JsonProperty("maintenance_work_mem_pretty")
    public String maintenanceWorkMemPretty() {
        return pretty(maintenanceWorkMemBytes);
    }

    @JsonProperty("effective_cache_size_pretty")
    public String effectiveCacheSizePretty() {
        return pretty(effectiveCacheSizeBytes);
    }

    private static String pretty(Long bytes) {
        return bytes == null ? null : SettingsFormatter.formatBytes(bytes);
    }
}
