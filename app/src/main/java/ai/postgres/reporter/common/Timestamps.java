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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Rendering of epoch seconds as ISO-8601 timestamps with an explicit {@code +00:00} offset.
 */
@UtilityClass
public class Timestamps {

    private static final DateTimeFormatter ISO_UTC =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx").withZone(ZoneOffset.UTC);

    public static String isoUtc(long epochS) {
        return ISO_UTC.format(Instant.ofEpochSecond(epochS));
    }

    /**
     * @return The formatted time, or null for a missing or non-positive epoch
     */
    public static String isoUtcOrNull(Double epochS) {
        if (epochS == null || !Double.isFinite(epochS) || epochS <= 0) {
            return null;
        }
        return isoUtc((long) Math.floor(epochS));
    }
}
