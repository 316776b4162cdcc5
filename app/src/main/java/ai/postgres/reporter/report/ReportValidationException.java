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
package ai.postgres.reporter.report;

import java.util.List;

/**
 * A generated document does not match its JSON Schema. This is a defect in the
 * generator, never a data problem, and is not caught by report generation.
 */
public class ReportValidationException extends RuntimeException {

    private final List<String> violations;

    public ReportValidationException(String subject, List<String> violations) {
        super(subject + " failed schema validation: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ReportValidationException(String message) {
        super(message);
        this.violations = List.of();
    }

    public List<String> getViolations() {
        return violations;
    }
}
