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
package ai.postgres.reporter.common;

import lombok.experimental.UtilityClass;

/**
 * Global constants for the Postgres reporter
 */
@UtilityClass
public final class Constants {
    public static final String NAMESPACE = "pgreporter";
    public static final String SUBSYSTEM_REPORTER = "reporter";

    public static final String LABEL_CLUSTER = "cluster";
    public static final String LABEL_NODE = "node_name";
    public static final String LABEL_DATABASE = "datname";
    public static final String LABEL_QUERY_ID = "queryid";

    public static final String METRIC_PREFIX_PGSS = "pgwatch_pg_stat_statements_";
    public static final String METRIC_SETTINGS = "pgwatch_settings_configured";

    /**
     * Entity id used when a series carries no query id label.
     */
    public static final String SINGLE_SERIES = "__single__";

    public static final String GENERATION_MODE_FULL = "full";
    public static final long PG_BLOCK_SIZE = 8192L;
}
