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

import java.util.ArrayList;
import java.util.List;

/**
 * Primary and standby nodes of one cluster.
 *
 * @param primary  Primary node name
 * @param standbys Standby node names, possibly empty
 */
public record NodeTopology(String primary, List<String> standbys) {

    public NodeTopology {
        standbys = standbys == null ? List.of() : List.copyOf(standbys);
    }

    public static NodeTopology single(String node) {
        return new NodeTopology(node, List.of());
    }

    /**
     * @return primary first, then standbys in their declared order
     */
    public List<String> allNodes() {
        List<String> nodes = new ArrayList<>(standbys.size() + 1);
        nodes.add(primary);
        nodes.addAll(standbys);
        return nodes;
    }
}
