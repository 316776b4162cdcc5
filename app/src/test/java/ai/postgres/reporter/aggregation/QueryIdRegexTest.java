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
package ai.postgres.reporter.aggregation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryIdRegexTest {

    @Test
    void testBuild_KeepsInputOrder() {
        assertEquals("^(?:42|-7|1001)$", QueryIdRegex.build(List.of("42", "-7", "1001")));
    }

    @Test
    void testBuild_RejectsWholeBatchOnOneBadId() {
        InvalidQueryIdException e = assertThrows(InvalidQueryIdException.class,
                () -> QueryIdRegex.build(List.of("1", "2|.*", "3")));

        assertTrue(e.getMessage().startsWith("Unexpected queryid"));
    }

    @Test
    void testIsValid() {
        assertTrue(QueryIdRegex.isValid("-9223372036854775808"));
        assertFalse(QueryIdRegex.isValid(""));
        assertFalse(QueryIdRegex.isValid("--1"));
        assertFalse(QueryIdRegex.isValid("1\"}"));
        assertFalse(QueryIdRegex.isValid(null));
    }
}
