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
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Method;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostgresSinkStoreTest {

    @Mock
    private AgroalDataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private Array array;

    private PostgresSinkStore store;

    @BeforeEach
    void setUp() throws SQLException {
        lenient().when(dataSource.getConnection()).thenReturn(connection);
        lenient().when(connection.prepareStatement(anyString())).thenReturn(statement);
        lenient().when(statement.executeQuery()).thenReturn(resultSet);
        store = new PostgresSinkStore(dataSource);
    }

    @Test
    void testConstructor_NullDataSource() {
        assertThrows(NullPointerException.class, () -> new PostgresSinkStore(null));
    }

    @Test
    void testGetIndexDefinitions_FiltersByDatabase() throws SQLException {
        // Setup
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString("indexrelname")).thenReturn("orders_pkey", "orders_status_idx");
        when(resultSet.getString("index_definition"))
                .thenReturn("CREATE UNIQUE INDEX orders_pkey ON public.orders (id)", null);

        // Execute
        Map<String, String> definitions = store.getIndexDefinitions("db1");

        // Verify
        assertEquals(Map.of("orders_pkey", "CREATE UNIQUE INDEX orders_pkey ON public.orders (id)"), definitions);
        verify(connection).prepareStatement(contains("WHERE dbname = ?"));
        verify(statement).setString(1, "db1");
        verify(connection).close();
    }

    @Test
    void testGetIndexDefinitions_AllDatabases_KeysIncludeDatabase() throws SQLException {
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString("indexrelname")).thenReturn("orders_pkey");
        when(resultSet.getString("index_definition")).thenReturn("CREATE INDEX ...");
        when(resultSet.getString("dbname")).thenReturn("db1");

        Map<String, String> definitions = store.getIndexDefinitions(null);

        assertEquals(Map.of("db1.orders_pkey", "CREATE INDEX ..."), definitions);
        verify(statement, never()).setString(eq(1), any());
    }

    @Test
    void testGetIndexDefinitions_SqlError_Propagates() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        SinkStoreException e = assertThrows(SinkStoreException.class, () -> store.getIndexDefinitions("db1"));

        assertInstanceOf(SQLException.class, e.getCause());
        assertTrue(store.noIndexDefinitions("db1").isEmpty());
    }

    @Test
    void testGetQueryTexts_GroupsByDatabaseAndTruncates() throws SQLException {
        // Setup
        when(connection.createArrayOf(eq("text"), any())).thenReturn(array);
        when(resultSet.next()).thenReturn(true, true, true, false);
        when(resultSet.getString("dbname")).thenReturn("db1", "db2", "db2");
        when(resultSet.getString("queryid")).thenReturn("1", "2", null);
        when(resultSet.getString("query")).thenReturn("select 1", "select * from orders", "select 3");

        // Execute
        Map<String, Map<String, String>> texts = store.getQueryTexts(List.of("db1", "db2"), 10);

        // Verify
        assertEquals(Map.of("1", "select 1"), texts.get("db1"));
        assertEquals(Map.of("2", "select * f"), texts.get("db2"));
        verify(statement).setArray(1, array);
        verify(connection).prepareStatement(contains("ANY (?)"));
    }

    @Test
    void testGetQueryTexts_NoDatabases_Unfiltered() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        assertTrue(store.getQueryTexts(List.of(), null).isEmpty());
        verify(connection, never()).createArrayOf(anyString(), any());
    }

    @Test
    void testGetQueryTexts_SqlError_Propagates() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("relation does not exist"));

        assertThrows(SinkStoreException.class, () -> store.getQueryTexts(List.of("db1"), null));
        verify(connection).close();
        assertTrue(store.noQueryTexts(List.of("db1"), null).isEmpty());
    }

    @Test
    void testFaultTolerance_FallbacksMatchGuardedMethods() throws NoSuchMethodException {
        for (String name : List.of("getIndexDefinitions", "getQueryTexts")) {
            Method guarded = Arrays.stream(PostgresSinkStore.class.getDeclaredMethods())
                    .filter(m -> m.getName().equals(name))
                    .findFirst()
                    .orElseThrow();
            Fallback fallback = guarded.getAnnotation(Fallback.class);
            CircuitBreaker breaker = guarded.getAnnotation(CircuitBreaker.class);

            Method target = PostgresSinkStore.class.getDeclaredMethod(fallback.fallbackMethod(),
                    guarded.getParameterTypes());
            assertEquals(guarded.getGenericReturnType(), target.getGenericReturnType());
            assertNotNull(breaker);
            assertFalse(Arrays.asList(breaker.skipOn()).contains(SinkStoreException.class));
        }
    }

    @Test
    void testTruncate() {
        assertEquals("abc", PostgresSinkStore.truncate("abc", null));
        assertEquals("abc", PostgresSinkStore.truncate("abc", 0));
        assertEquals("ab", PostgresSinkStore.truncate("abc", 2));
    }

    @Test
    void testClose_FlushFailureIsNotFatal() {
        doThrow(new IllegalStateException("closed")).when(dataSource).flush(AgroalDataSource.FlushMode.IDLE);

        store.close();

        verify(dataSource).flush(AgroalDataSource.FlushMode.IDLE);
    }
}
