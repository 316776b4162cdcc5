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

import ai.postgres.reporter.check.Check;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.settings.SettingsFormatter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;
import java.util.TreeMap;

@ApplicationScoped
public class A007AlteredSettingsCheck implements Check {

    static final String METRIC_IS_DEFAULT = "pgwatch_settings_is_default";

    private final MetricQueries queries;

    @Inject
    public A007AlteredSettingsCheck(MetricQueries queries) {
        this.queries = queries;
    }

    @Override
    public CheckType type() {
        return CheckType.A007;
    }

    @Override
    public Map<String, AlteredSetting> collect(CheckContext context) {
        String expr = context.selector(METRIC_IS_DEFAULT).build() + " < 1";
        Map<String, AlteredSetting> altered = new TreeMap<>();
        for (MetricSample sample : queries.instant(expr)) {
            String name = sample.label(A003SettingsCheck.SETTING_NAME);
            if (name == null || name.isEmpty()) {
                continue;
            }
            String value = sample.label("setting_value", "");
            String unit = sample.label("unit", "");
            altered.put(name, new AlteredSetting(
                    value,
                    unit,
                    sample.label("category", "unknown"),
                    SettingsFormatter.formatSettingValue(name, value, unit)));
        }
        return altered;
    }
}
