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
package ai.postgres.reporter.sink;

import io.agroal.api.AgroalDataSource;
import io.smallrye.faulttolerance.api.CircuitBreakerName;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Timeout;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SinkStore} backed by the default datasource.
 *
 * <p>Both tables are partitioned by {@code dbname} and hold one JSON document per row
 * in {@code data}; the latest row per key wins.
 *
 * <p>SQL failures surface as {@link SinkStoreException} so the circuit breaker counts them;
 * the fallbacks then answer with empty maps.
 */
@Slf4j
@ApplicationScoped
public class PostgresSinkStore implements SinkStore {

    static final String INDEX_DEFINITIONS_SQL = """
            SELECT DISTINCT ON (dbname, data->>'indexrelname')
                   dbname, data->>'indexrelname' AS indexrelname, data->>'index_definition' AS index_definition
            FROM public.index_definitions
            %s
            ORDER BY dbname, data->>'indexrelname', time DESC""";

    static final String QUERY_TEXTS_SQL = """
            SELECT DISTINCT ON (dbname, data->>'queryid')
                   dbname, data->>'queryid' AS queryid, data->>'query' AS query
            FROM public.pgss_queryid_queries
            %s
            ORDER BY dbname, data->>'queryid', time DESC""";

    private final AgroalDataSource dataSource;

    @Inject
    public PostgresSinkStore(AgroalDataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    @Timeout(value = 30, unit = ChronoUnit.SECONDS)
    @CircuitBreaker(requestVolumeThreshold = 4, delay = 60, delayUnit = ChronoUnit.SECONDS)
    @CircuitBreakerName("sink-index-definitions")
    @Fallback(fallbackMethod = "noIndexDefinitions")
    public synchronized Map<String, String> getIndexDefinitions(String database) {
        String sql = INDEX_DEFINITIONS_SQL.formatted(database == null ? "" : "WHERE dbname = ?");
        Map<String, String> definitions = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (database != null) {
                stmt.setString(1, database);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String index = rs.getString("indexrelname");
                    String definition = rs.getString("index_definition");
                    if (index == null || definition == null) {
                        continue;
                    }
                    String key = database == null ? rs.getString("dbname") + "." + index : index;
                    definitions.put(key, definition);
                }
            }
        } catch (SQLException e) {
            log.warn("Could not read index definitions from sink: {}", e.getMessage());
            throw new SinkStoreException("Reading index definitions failed", e);
        }
        log.debug("Loaded {} index definitions for {}", definitions.size(), database == null ? "all databases" : database);
        return definitions;
    }

    @Override
    @Timeout(value = 30, unit = ChronoUnit.SECONDS)
    @CircuitBreaker(requestVolumeThreshold = 4, delay = 60, delayUnit = ChronoUnit.SECONDS)
    @CircuitBreakerName("sink-query-texts")
    @Fallback(fallbackMethod = "noQueryTexts")
    public synchronized Map<String, Map<String, String>> getQueryTexts(Collection<String> databases,
                                                                       Integer maxLength) {
        boolean filtered = databases != null && !databases.isEmpty();
        String sql = QUERY_TEXTS_SQL.formatted(filtered ? "WHERE dbname = ANY (?)" : "");
        Map<String, Map<String, String>> texts = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (filtered) {
                Array array = conn.createArrayOf("text", databases.toArray(new String[0]));
                stmt.setArray(1, array);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String db = rs.getString("dbname");
                    String queryId = rs.getString("queryid");
                    String text = rs.getString("query");
                    if (db == null || queryId == null || text == null) {
                        continue;
                    }
                    texts.computeIfAbsent(db, k -> new LinkedHashMap<>()).put(queryId, truncate(text, maxLength));
                }
            }
        } catch (SQLException e) {
            log.warn("Could not read query texts from sink: {}", e.getMessage());
            throw new SinkStoreException("Reading query texts failed", e);
        }
        return texts;
    }

    @Override
    public void close() {
        try {
            dataSource.flush(AgroalDataSource.FlushMode.IDLE);
        } catch (RuntimeException e) {
            log.debug("Flushing sink connections failed", e);
        }
    }

    Map<String, String> noIndexDefinitions(String database) {
        log.warn("Sink unavailable, continuing without index definitions");
        return Map.of();
    }

    Map<String, Map<String, String>> noQueryTexts(Collection<String> databases, Integer maxLength) {
        log.warn("Sink unavailable, continuing without query texts");
        return Map.of();
    }

    static String truncate(String text, Integer maxLength) {
        if (maxLength == null || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
