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
import ai.postgres.reporter.report.CheckType;

/**
 * Producer of the {@code data} payload of one check for one node.
 *
 * <p>Implementations are discovered by the {@link CheckOrchestrator}; exactly one bean
 * per {@link CheckType} is expected.
 */
public interface Check {

    /**
     * Get the check this producer builds.
     *
     * @return Check type, never null
     */
    CheckType type();

    /**
     * Build the payload for the node described by {@code context}.
     *
     * <p>Failures of individual metric queries should degrade to missing values.
     * An exception thrown from here marks the node result of this check as failed.
     *
     * @param context Cluster, node, databases and settings of the node
     * @return Payload serialized into {@code results.<node>.data}, never null
     * @throws MetricSourceException If an aggregation that cannot degrade fails
     */
    Object collect(CheckContext context) throws MetricSourceException;
}
