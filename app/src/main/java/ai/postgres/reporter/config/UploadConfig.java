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
package ai.postgres.reporter.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Settings for posting generated reports to the report-ingestion API.
 */
@ConfigMapping(prefix = "app.upload")
public interface UploadConfig {

    @WithDefault("false")
    boolean enabled();

    @WithDefault("https://postgres.ai/api/general")
    String apiUrl();

    /**
     * API access token. Upload is skipped when it is not set.
     *
     * @return Optional token
     */
    Optional<String> token();

    @WithDefault("postgres-ai-monitoring")
    String project();

    @WithDefault("1")
    String epoch();

    @WithDefault("30s")
    Duration timeout();
}
