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
package ai.postgres.reporter.check;

import ai.postgres.reporter.report.NodeResult;
import ai.postgres.reporter.report.Report;
import ai.postgres.reporter.settings.SettingEntry;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reuse of an A003 settings payload by the checks that only show a subset of it.
 */
@UtilityClass
public class SettingsFilter {

    /**
     * Keep the wanted settings, in the order of {@code wanted}. Names absent from
     * {@code settings} are skipped.
     *
     * @param settings A003 payload of one node
     * @param wanted   Setting names to keep
     * @return New map, possibly empty
     */
    public static Map<String, SettingEntry> filterA003Settings(Map<String, SettingEntry> settings,
                                                               Collection<String> wanted) {
        Map<String, SettingEntry> result = new LinkedHashMap<>();
        for (String name : wanted) {
            SettingEntry entry = settings.get(name);
            if (entry != null) {
                result.put(name, entry);
            }
        }
        return result;
    }

    /**
     * Same as {@link #filterA003Settings(Map, Collection)} applied to a finished A003 report.
     *
     * @param report A003 report
     * @param node   Node to read, null for the primary
     * @param wanted Setting names to keep
     * @return Filtered settings, empty when the node failed or is unknown
     */
    public static Map<String, SettingEntry> filterA003Settings(Report report, String node,
                                                               Collection<String> wanted) {
        return filterA003Settings(settingsOf(report, node), wanted);
    }

    /**
     * Settings payload of a node of an A003 report.
     */
    public static Map<String, SettingEntry> settingsOf(Report report, String node) {
        if (report == null) {
            return Map.of();
        }
        String target = node != null ? node : report.nodes().primary();
        NodeResult result = report.result(target);
        if (result == null || result.hasError()) {
            return Map.of();
        }
        return settingsFrom(result.data());
    }

    /**
     * Read an A003 payload built in process (entries) or parsed from JSON (maps).
     *
     * @param data Node data of an A003 result
     * @return Settings by name, empty when {@code data} is not a map
     */
    public static Map<String, SettingEntry> settingsFrom(Object data) {
        if (!(data instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, SettingEntry> settings = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof SettingEntry setting) {
                settings.put(String.valueOf(entry.getKey()), setting);
            } else if (value instanceof Map<?, ?> raw) {
                settings.put(String.valueOf(entry.getKey()), new SettingEntry(
                        string(raw.get("setting")),
                        string(raw.get("unit")),
                        string(raw.get("category")),
                        string(raw.get("context")),
                        string(raw.get("vartype")),
                        string(raw.get("pretty_value"))));
            }
        }
        return settings;
    }

    private static String string(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
