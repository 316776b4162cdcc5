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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Represents a PostgreSQL server version as reported by the
 * {@code server_version} and {@code server_version_num} settings.
 */
public record PostgresVersion(
        String version,
        @JsonProperty("server_version_num") String serverVersionNum,
        @JsonProperty("server_major_ver") String serverMajorVer,
        @JsonProperty("server_minor_ver") String serverMinorVer) {

    public static final PostgresVersion EMPTY = new PostgresVersion("", "", "", "");

    private static final Pattern VERSION_NUM = Pattern.compile("\\d{6,}");

    /**
     * Build a version from the two settings.
     *
     * <p>Major and minor are derived from {@code server_version_num}
     * (major = num / 10000, minor = num % 10000) when it holds six or more digits,
     * otherwise both are empty strings.
     *
     * @param version    Raw {@code server_version}, e.g. "15.3 (Debian 15.3-1)"
     * @param versionNum Raw {@code server_version_num}, e.g. "150003"
     * @return Parsed version, never null
     */
    public static PostgresVersion parse(String version, String versionNum) {
        String raw = version == null ? "" : version.trim();
        String num = versionNum == null ? "" : versionNum.trim();
        Matcher matcher = VERSION_NUM.matcher(num);
        if (!matcher.matches()) {
            return new PostgresVersion(raw, num, "", "");
        }
        long parsed = Long.parseLong(num);
        return new PostgresVersion(raw, num, String.valueOf(parsed / 10000), String.valueOf(parsed % 10000));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return version.isEmpty() && serverVersionNum.isEmpty();
    }
}
