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
import java.util.List;
import java.util.Optional;

/**
 * Configuration for report generation runs.
 */
@ConfigMapping(prefix = "app.reporter")
public interface ReporterConfig {

    /**
     * Cluster to report on. When absent every cluster known to the backend is processed.
     *
     * @return Optional cluster name
     */
    Optional<String> cluster();

    /**
     * Node to report on when nodes are not combined.
     *
     * @return Optional node name
     */
    Optional<String> nodeName();

    /**
     * Whether reports cover the primary and all standbys of a cluster.
     *
     * @return true to combine nodes (default: true)
     */
    @WithDefault("true")
    boolean combineNodes();

    /**
     * Directory that receives the generated JSON files.
     *
     * @return Output directory (default: reports)
     */
    @WithDefault("reports")
    String outputDir();

    /**
     * Delay before the first run after startup.
     *
     * @return Initial delay (default: 30 minutes)
     */
    @WithDefault("30m")
    Duration initialDelay();

    /**
     * Interval between two runs.
     *
     * @return Run interval (default: 24 hours)
     */
    @WithDefault("24h")
    Duration interval();

    /**
     * Anchor hourly timelines on the current time instead of the last full hour.
     *
     * @return true to skip hour alignment (default: false)
     */
    @WithDefault("false")
    boolean useCurrentTime();

    /**
     * Length of the hourly window for top-K reports and per-query documents.
     *
     * @return Number of hours (default: 24)
     */
    @WithDefault("24")
    int hours();

    /**
     * Window used by the counter-diff reports K001 and K003.
     *
     * @return Window length in minutes (default: 60)
     */
    @WithDefault("60")
    int queryWindowMinutes();

    /**
     * Number of top queries kept per database.
     *
     * @return Top-K size (default: 50)
     */
    @WithDefault("50")
    int topQueriesLimit();

    /**
     * Databases skipped in addition to template0, template1 and rdsadmin.
     *
     * @return Excluded database names
     */
    Optional<List<String>> excludedDatabases();

    /**
     * Maximum length of query texts taken from the sink store.
     *
     * @return Optional truncation length
     */
    Optional<Integer> queryTextLimit();

    PerQuery perQuery();

    /**
     * Number of connectivity attempts at startup before giving up.
     *
     * @return Number of attempts (default: 3)
     */
    @WithDefault("3")
    int connectionRetryAttempts();

    /**
     * Base delay between connectivity attempts, multiplied by the attempt number.
     *
     * @return Base retry delay (default: 1 second)
     */
    @WithDefault("1s")
    Duration connectionRetryDelay();

    Build build();

    interface PerQuery {

        @WithDefault("true")
        boolean enabled();

        /**
         * @return true to name files {@code <cluster>_query_<id>.json} (default: true)
         */
        @WithDefault("true")
        boolean includeClusterPrefix();
    }

    interface Build {

        @WithDefault("unknown")
        String version();

        /**
         * Build timestamp stamped into every report.
         *
         * @return Build timestamp (default: unknown)
         */
        @WithDefault("unknown")
        String timestamp();
    }
}
