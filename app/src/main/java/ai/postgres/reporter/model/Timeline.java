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

import java.util.List;

/**
 * Hour-aligned grid used to densify hourly series.
 *
 * @param startS First point, epoch seconds
 * @param stepS  Distance between points in seconds
 * @param points Strictly increasing epoch seconds, {@code hours + 1} of them
 */
public record Timeline(long startS, long stepS, List<Long> points) {

    public Timeline {
        points = List.copyOf(points);
    }

    public long endS() {
        return points.isEmpty() ? startS : points.get(points.size() - 1);
    }

    public int size() {
        return points.size();
    }
}
