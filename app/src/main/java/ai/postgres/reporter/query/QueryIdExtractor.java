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
package ai.postgres.reporter.query;

import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.report.Report;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collects the query ids referenced by a batch of reports, grouped by database.
 *
 * <p>Recognized shapes under {@code results.<node>.data.<database>}:
 * <ul>
 *   <li>{@code query_metrics[].queryid} (K001)</li>
 *   <li>{@code top_queries[].queryid} (K003 and the hourly reports)</li>
 *   <li>{@code wait_event_types.*.queries_list[].query_id} (N001)</li>
 * </ul>
 * D004 sample queries are not per-query data and are ignored.
 */
@Slf4j
@ApplicationScoped
public class QueryIdExtractor {

    private final ObjectMapper objectMapper;

    @Inject
    public QueryIdExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param reports Reports of one cluster
     * @return Database name to query ids, "0" and blank ids excluded
     */
    public Map<String, Set<String>> extractQueryIds(Map<CheckType, Report> reports) {
        Map<String, Set<String>> result = new TreeMap<>();
        for (Map.Entry<CheckType, Report> entry : reports.entrySet()) {
            if (entry.getKey() == CheckType.D004) {
                continue;
            }
            JsonNode results = objectMapper.valueToTree(entry.getValue()).path("results");
            for (JsonNode nodeResult : results) {
                JsonNode data = nodeResult.path("data");
                if (!data.isObject()) {
                    continue;
                }
                Iterator<Map.Entry<String, JsonNode>> databases = data.fields();
                while (databases.hasNext()) {
                    Map.Entry<String, JsonNode> db = databases.next();
                    collect(db.getKey(), db.getValue(), result);
                }
            }
        }
        log.debug("Extracted query ids for {} databases", result.size());
        return result;
    }

    private static void collect(String database, JsonNode payload, Map<String, Set<String>> into) {
        if (!payload.isObject()) {
            return;
        }
        addIds(database, payload.path("query_metrics"), "queryid", into);
        addIds(database, payload.path("top_queries"), "queryid", into);
        for (JsonNode type : payload.path("wait_event_types")) {
            addIds(database, type.path("queries_list"), "query_id", into);
        }
    }

    private static void addIds(String database, JsonNode rows, String field, Map<String, Set<String>> into) {
        if (!rows.isArray()) {
            return;
        }
        for (JsonNode row : rows) {
            JsonNode id = row.path(field);
            if (id.isMissingNode() || id.isNull()) {
                continue;
            }
            String value = id.asText().trim();
            if (value.isEmpty() || "0".equals(value)) {
                continue;
            }
            into.computeIfAbsent(database, k -> new LinkedHashSet<>()).add(value);
        }
    }
}
