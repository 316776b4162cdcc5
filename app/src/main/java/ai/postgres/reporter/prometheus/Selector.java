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
package ai.postgres.reporter.prometheus;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a series selector such as {@code metric{cluster="c", node_name="n"}}.
 *
 * <p>Every label value is escaped so that a cluster, node, database or query id taken
 * from backend data can never terminate the string literal it is placed in.
 */
public final class Selector {

    private final String metric;
    private final List<String> matchers = new ArrayList<>();

    private Selector(String metric) {
        this.metric = metric;
    }

    public static Selector of(String metric) {
        return new Selector(metric);
    }

    public Selector with(String label, String value) {
        matchers.add(label + "=\"" + escape(value) + "\"");
        return this;
    }

    /**
     * Add a regex matcher. The pattern is escaped as a string literal but not
     * as a regex, so it must come from a trusted builder.
     */
    public Selector withRegex(String label, String pattern) {
        matchers.add(label + "=~\"" + escape(pattern) + "\"");
        return this;
    }

    public Selector withoutValue(String label, String value) {
        matchers.add(label + "!=\"" + escape(value) + "\"");
        return this;
    }

    public String build() {
        return metric + "{" + String.join(", ", matchers) + "}";
    }

    /**
     * Render the selector with a range suffix, e.g. {@code metric{...}[3600s]}.
     */
    public String range(String duration) {
        return build() + "[" + duration + "]";
    }

    @Override
    public String toString() {
        return build();
    }

    /**
     * Escape a value for use inside a double-quoted label matcher.
     *
     * @param value Raw value, null is treated as empty
     * @return Escaped value
     */
    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
