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

import ai.postgres.reporter.prometheus.MetricSourceException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for checks whose payload is a map keyed by database name.
 *
 * <p>Databases are visited in the order given by the context. A database with nothing
 * to report still gets an entry, so consumers can tell "checked, empty" from "not checked".
 *
 * @param <T> Per-database payload
 */
@Slf4j
public abstract class AbstractPerDatabaseCheck<T> implements Check {

    @Override
    public final Map<String, T> collect(CheckContext context) throws MetricSourceException {
        Map<String, T> result = new LinkedHashMap<>();
        for (String database : context.databases()) {
            T data = collectDatabase(context, database);
            if (data == null) {
                throw new IllegalStateException(
                        "collectDatabase() must not return null for check " + type() + ", database " + database);
            }
            result.put(database, data);
        }
        log.debug("Check {} collected {} databases on {}/{}",
                type(), result.size(), context.cluster(), context.node());
        return result;
    }

    /**
     * Build the payload for one database.
     *
     * @param context  Node context
     * @param database Database name
     * @return Payload, never null
     * @throws MetricSourceException If an aggregation that cannot degrade fails
     */
    protected abstract T collectDatabase(CheckContext context, String database) throws MetricSourceException;
}
