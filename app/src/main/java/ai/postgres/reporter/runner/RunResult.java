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
package ai.postgres.reporter.runner;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one report run.
 *
 * @param timestamp      When the run started
 * @param skipped        Whether the run was skipped because another one was in progress
 * @param clusters       Clusters attempted
 * @param failedClusters Clusters that failed
 * @param files          Files written during the run
 */
public record RunResult(Instant timestamp, boolean skipped, int clusters, int failedClusters, List<Path> files) {

    public RunResult {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static RunResult skipped(Instant start) {
        return new RunResult(start, true, 0, 0, List.of());
    }

    public static RunResult completed(Instant start, int clusters, int failedClusters, List<Path> files) {
        return new RunResult(start, false, clusters, failedClusters, files);
    }

    /**
     * @return true if the run happened and no cluster failed
     */
    public boolean successful() {
        return !skipped && failedClusters == 0;
    }

    public Duration getAge() {
        return Duration.between(timestamp, Instant.now());
    }
}
