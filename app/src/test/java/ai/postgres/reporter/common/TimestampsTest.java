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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TimestampsTest {

    @Test
    void testIsoUtc() {
        assertEquals("2024-01-15T10:00:00+00:00", Timestamps.isoUtc(1705312800L));
        assertEquals("1970-01-01T00:00:00+00:00", Timestamps.isoUtc(0L));
    }

    @Test
    void testIsoUtcOrNull() {
        assertEquals("2024-01-15T10:00:00+00:00", Timestamps.isoUtcOrNull(1705312800.9));
        assertNull(Timestamps.isoUtcOrNull(null));
        assertNull(Timestamps.isoUtcOrNull(0.0));
        assertNull(Timestamps.isoUtcOrNull(Double.NaN));
    }
}
