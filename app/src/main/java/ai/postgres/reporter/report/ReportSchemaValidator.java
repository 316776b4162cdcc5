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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates generated documents against the JSON Schemas shipped under {@code schemas/}.
 *
 * <p>A report is checked twice: the envelope against {@code envelope.schema.json}, then
 * the {@code data} of every successful node against {@code data/<checkId>.schema.json}.
 * Per-query documents are checked against {@code query.schema.json}.
 */
@Slf4j
@ApplicationScoped
public class ReportSchemaValidator {

    static final String ENVELOPE_SCHEMA = "schemas/envelope.schema.json";
    static final String QUERY_SCHEMA = "schemas/query.schema.json";
    static final String DATA_SCHEMA_DIR = "schemas/data/";

    private final ObjectMapper objectMapper;
    private final JsonSchema envelopeSchema;
    private final JsonSchema querySchema;
    private final Map<CheckType, JsonSchema> dataSchemas = new EnumMap<>(CheckType.class);

    @Inject
    public ReportSchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
        this.envelopeSchema = load(factory, ENVELOPE_SCHEMA);
        this.querySchema = load(factory, QUERY_SCHEMA);
        for (CheckType type : CheckType.values()) {
            dataSchemas.put(type, load(factory, DATA_SCHEMA_DIR + type.id() + ".schema.json"));
        }
        log.debug("Loaded {} report data schemas", dataSchemas.size());
    }

    /**
     * Validate a check report.
     *
     * @param report Report to check
     * @throws ReportValidationException If the envelope or any node payload is invalid
     */
    public void validate(Report report) {
        CheckType type = CheckType.fromId(report.checkId());
        if (type == null) {
            throw new ReportValidationException("No schema registered for check " + report.checkId());
        }

        JsonNode tree = objectMapper.valueToTree(report);
        List<String> violations = new ArrayList<>(messages("", envelopeSchema.validate(tree)));

        JsonSchema dataSchema = dataSchemas.get(type);
        for (Map.Entry<String, NodeResult> entry : report.results().entrySet()) {
            if (entry.getValue().hasError()) {
                continue;
            }
            JsonNode data = tree.path("results").path(entry.getKey()).path("data");
            violations.addAll(messages("results." + entry.getKey() + ".data", dataSchema.validate(data)));
        }

        if (!violations.isEmpty()) {
            throw new ReportValidationException("Report " + report.checkId(), violations);
        }
    }

    /**
     * Validate a per-query document.
     *
     * @param document Document, serialized with the application mapper
     * @throws ReportValidationException If the document is invalid
     */
    public void validatePerQuery(Object document) {
        JsonNode tree = objectMapper.valueToTree(document);
        List<String> violations = messages("", querySchema.validate(tree));
        if (!violations.isEmpty()) {
            throw new ReportValidationException("Per-query document " + tree.path("query_id").asText(), violations);
        }
    }

    private static List<String> messages(String prefix, Set<ValidationMessage> validation) {
        List<String> result = new ArrayList<>(validation.size());
        for (ValidationMessage message : validation) {
            result.add(prefix.isEmpty() ? message.getMessage() : prefix + ": " + message.getMessage());
        }
        return result;
    }

    private static JsonSchema load(JsonSchemaFactory factory, String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ReportSchemaValidator.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found: " + resource);
            }
            return factory.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read schema " + resource, e);
        }
    }
}
