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

import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Builds the anchored alternation used to select a set of query ids with {@code =~}.
 */
@UtilityClass
public final class QueryIdRegex {

    private static final Pattern QUERY_ID = Pattern.compile("^-?\\d+$");

    /**
     * Build {@code ^(?:id1|id2|...)$} in input order.
     *
     * <p>Every id is checked before anything is built; a single malformed id fails the
     * whole call, so no regex or query syntax can be smuggled into a selector.
     *
     * @param ids Query ids as reported by pg_stat_statements
     * @return Anchored regex
     * @throws InvalidQueryIdException If any id is not an integer
     */
    public static String build(Collection<String> ids) {
        for (String id : ids) {
            if (!isValid(id)) {
                throw new InvalidQueryIdException(id);
            }
        }
        return "^(?:" + String.join("|", ids) + ")$";
    }

    public static boolean isValid(String id) {
        return id != null && QUERY_ID.matcher(id).matches();
    }
}
