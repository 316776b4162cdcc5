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
import ai.postgres.reporter.check.SettingsFilter;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.settings.SettingEntry;
import ai.postgres.reporter.settings.SettingsCatalog;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;

@ApplicationScoped
public class F001AutovacuumSettingsCheck implements Check {

    @Override
    public CheckType type() {
        return CheckType.F001;
    }

    @Override
    public Map<String, SettingEntry> collect(CheckContext context) {
        return SettingsFilter.filterA003Settings(context.settings(), SettingsCatalog.F001_SETTINGS);
    }
}
