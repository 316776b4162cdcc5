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
package ai.postgres.reporter.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Hourly attribution of a counter to its top entities plus the "other" residual.
 *
 * <p>Every list is aligned to {@code timeline}. For each index {@code t},
 * {@code sum(perEntity[*][t]) + other[t]} matches the backend total within tolerance
 * and {@code other[t]} is never negative.
 *
 * @param perEntity Hourly values keyed by entity id, in top-K order
 * @param other     Hourly residual of all entities outside the top-K
 * @param timeline  Epoch seconds of every point
 */
public record TopKResult(Map<String, List<Double>> perEntity, List<Double> other, List<Long> timeline) {

    public static TopKResult empty(List<Long> timeline) {
        List<Double> zeros = Collections.nCopies(timeline.size(), 0.0);
        return new TopKResult(Map.of(), zeros, timeline);
    }

    public double entityTotal(String id) {
        List<Double> values = perEntity.get(id);
        return values == null ? 0.0 : values.stream().mapToDouble(Double::doubleValue).sum();
    }

    public double trackedTotal() {
        return perEntity.keySet().stream().mapToDouble(this::entityTotal).sum();
    }

    public double otherTotal() {
        return other.stream().mapToDouble(Double::doubleValue).sum();
    }
}
