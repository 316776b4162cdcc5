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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * One GUC as reported by {@code pgwatch_settings_configured}.
 *
 * @param setting     Raw value in the setting's base unit
 * @param unit        Base unit, e.g. "8kB", "ms", or empty
 * @param category    pg_settings category
 * @param context     pg_settings context
 * @param vartype     pg_settings vartype
 * @param prettyValue Human-readable rendering of {@code setting}
 */
@JsonPropertyOrder({"setting", "unit", "category", "context", "vartype", "pretty_value"})
public record SettingEntry(
        String setting,
        String unit,
        String category,
        String context,
        String vartype,
        @JsonProperty("pretty_value") String prettyValue) {

    /**
     * Build an entry from the labels of a settings sample.
     *
     * @param name            Setting name, used for the pretty value
     * @param labels          Sample labels
     * @param defaultCategory Category used when the label is missing
     */
    public static SettingEntry fromLabels(String name, Map<String, String> labels, String defaultCategory) {
        String value = labels.getOrDefault("setting_value", "");
        String unit = labels.getOrDefault("unit", "");
        return new SettingEntry(
                value,
                unit,
                labels.getOrDefault("category", defaultCategory),
                labels.getOrDefault("context", ""),
                labels.getOrDefault("vartype", ""),
                SettingsFormatter.formatSettingValue(name, value, unit));
    }
}
