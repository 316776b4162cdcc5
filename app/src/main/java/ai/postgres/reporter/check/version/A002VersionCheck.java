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
package ai.postgres.reporter.check.version;

import ai.postgres.reporter.check.Check;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.topology.PostgresVersionService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class A002VersionCheck implements Check {

    private final PostgresVersionService versionService;

    @Inject
    public A002VersionCheck(PostgresVersionService versionService) {
        this.versionService = versionService;
    }

    @Override
    public CheckType type() {
        return CheckType.A002;
    }

    @Override
    public A002Data collect(CheckContext context) {
        return new A002Data(versionService.getPostgresVersionInfo(context.cluster(), context.node()));
    }
}
