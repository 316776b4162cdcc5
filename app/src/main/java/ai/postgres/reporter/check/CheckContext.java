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

import ai.postgres.reporter.common.Constants;
import ai.postgres.reporter.prometheus.Selector;
import ai.postgres.reporter.settings.SettingEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a check needs to know about the node it reports on.
 *
 * @param cluster   Cluster label value
 * @param node      Node label value
 * @param databases Databases of the node, excluded ones already removed
 * @param nowS      Reference time of the run, epoch seconds
 * @param settings  A003 settings of the node, empty until A003 ran
 */
public record CheckContext(String cluster, String node, List<String> databases, long nowS,
                           Map<String, SettingEntry> settings) {

    public CheckContext {
        databases = List.copyOf(databases);
        settings = settings == null ? Map.of() : settings;
    }

    public CheckContext(String cluster, String node, List<String> databases, long nowS) {
        this(cluster, node, databases, nowS, Map.of());
    }

    public CheckContext withSettings(Map<String, SettingEntry> newSettings) {
        return new CheckContext(cluster, node, databases, nowS, newSettings);
    }

    public Map<String, String> labels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(Constants.LABEL_CLUSTER, cluster);
        labels.put(Constants.LABEL_NODE, node);
        return labels;
    }

    public Map<String, String> labels(String database) {
        Map<String, String> labels = labels();
        labels.put(Constants.LABEL_DATABASE, database);
        return labels;
    }

    public Selector selector(String metric) {
        return Selector.of(metric)
                .with(Constants.LABEL_CLUSTER, cluster)
                .with(Constants.LABEL_NODE, node);
    }

    public Selector selector(String metric, String database) {
        return selector(metric).with(Constants.LABEL_DATABASE, database);
    }
}
