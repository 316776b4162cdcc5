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
import ai.postgres.reporter.common.Constants;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.settings.SettingEntry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;
import java.util.TreeMap;

/**
 * All configured settings of a node, keyed by setting name.
 */
@ApplicationScoped
public class A003SettingsCheck implements Check {

    static final String SETTING_NAME = "setting_name";
    static final String DEFAULT_CATEGORY = "Other";

    private final MetricQueries queries;

    @Inject
    public A003SettingsCheck(MetricQueries queries) {
        this.queries = queries;
    }

    @Override
    public CheckType type() {
        return CheckType.A003;
    }

    @Override
    public Map<String, SettingEntry> collect(CheckContext context) {
        Map<String, SettingEntry> settings = new TreeMap<>();
        for (MetricSample sample : queries.instant(context.selector(Constants.METRIC_SETTINGS).build())) {
            String name = sample.label(SETTING_NAME);
            if (name == null || name.isEmpty()) {
                continue;
            }
            settings.put(name, SettingEntry.fromLabels(name, sample.labels(), DEFAULT_CATEGORY));
        }
        return settings;
    }
}
