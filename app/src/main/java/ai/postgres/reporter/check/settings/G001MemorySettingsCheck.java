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
import ai.postgres.reporter.settings.MemoryAnalyzer;
import ai.postgres.reporter.settings.SettingEntry;
import ai.postgres.reporter.settings.SettingsCatalog;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;

@ApplicationScoped
public class G001MemorySettingsCheck implements Check {

    @Override
    public CheckType type() {
        return CheckType.G001;
    }

    @Override
    public G001Data collect(CheckContext context) {
        Map<String, SettingEntry> memory =
                SettingsFilter.filterA003Settings(context.settings(), SettingsCatalog.G001_SETTINGS);
        return new G001Data(memory, new G001Data.Analysis(MemoryAnalyzer.analyze(memory)));
    }
}
