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
package ai.postgres.reporter.check.index;

import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.prometheus.Selector;
import lombok.experimental.UtilityClass;

/**
 * Label conventions shared by the index exporters.
 */
@UtilityClass
class IndexLabels {

    static final String SCHEMA = "schema_name";
    static final String TABLE = "table_name";
    static final String INDEX = "index_name";
    static final String UNKNOWN = "unknown";

    static String schema(MetricSample sample) {
        return sample.label(SCHEMA, UNKNOWN);
    }

    static String table(MetricSample sample) {
        return sample.label(TABLE, UNKNOWN);
    }

    static String index(MetricSample sample) {
        return sample.label(INDEX, UNKNOWN);
    }

    /**
     * Selector for a companion metric of the index described by {@code sample}.
     */
    static Selector companion(CheckContext context, String database, String metric, MetricSample sample) {
        return context.selector(metric, database)
                .with(SCHEMA, schema(sample))
                .with(TABLE, table(sample))
                .with(INDEX, index(sample));
    }

    /**
     * Truthy label values as exported by the index queries: "1", "true", "t".
     */
    static boolean flag(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        return v.equals("1") || v.equalsIgnoreCase("true") || v.equalsIgnoreCase("t");
    }

    static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
