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

import java.util.Collection;
import java.util.Map;

/**
 * Read-only lookups in the sink database that stores raw query texts and index DDL.
 *
 * <p>Callers see empty maps when the store is unavailable.
 */
public interface SinkStore extends AutoCloseable {

    /**
     * Index definitions.
     *
     * @param database Database to look in, or null for all databases
     * @return Index name to DDL; keys are {@code db.index} when {@code database} is null
     */
    Map<String, String> getIndexDefinitions(String database);

    /**
     * Query texts by database and query id.
     *
     * @param databases Databases to look in, null or empty for all
     * @param maxLength Truncate texts to this many characters, null for no limit
     * @return Database to (query id to text)
     */
    Map<String, Map<String, String>> getQueryTexts(Collection<String> databases, Integer maxLength);

    /**
     * Release connections held for lookups. The store can still be used afterwards.
     */
    @Override
    void close();
}
