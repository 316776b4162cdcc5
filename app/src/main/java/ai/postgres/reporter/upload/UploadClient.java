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
package ai.postgres.reporter.upload;

import ai.postgres.reporter.config.UploadConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Client of the checkup upload API.
 */
@Slf4j
@ApplicationScoped
public class UploadClient {

    static final String CREATE_ENDPOINT = "/rpc/checkup_report_create";
    static final String FILE_ENDPOINT = "/rpc/checkup_report_file_post";

    private final String apiUrl;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Inject
    public UploadClient(UploadConfig config, ObjectMapper objectMapper) {
        this(config.apiUrl(), config.timeout(), objectMapper,
                HttpClient.newBuilder().connectTimeout(config.timeout()).build());
    }

    UploadClient(String apiUrl, Duration timeout, ObjectMapper objectMapper, HttpClient httpClient) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    /**
     * Create a checkup report that files are attached to.
     *
     * @return Report id
     * @throws FeatureUnavailableException If the API answers 404
     * @throws UploadException             If the API does not return a report id
     */
    @Timeout(value = 60, unit = ChronoUnit.SECONDS)
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, retryOn = UploadTransportException.class)
    public long createReport(String token, String project, String epoch) throws UploadException {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("access_token", token);
        request.put("project", project);
        request.put("epoch", epoch);

        JsonNode response = post(CREATE_ENDPOINT, request);
        JsonNode reportId = response.path("report_id");
        if (reportId.isMissingNode() || reportId.isNull() || reportId.asLong(0) == 0) {
            throw new UploadException(response.path("message").asText("Cannot create report."));
        }
        log.info("Created checkup report {} for project {}", reportId.asLong(), project);
        return reportId.asLong();
    }

    /**
     * Attach a file to a checkup report.
     *
     * @param cluster Cluster prefix of the file name, removed before deriving the check id; may be null
     * @throws FeatureUnavailableException If the API answers 404
     * @throws UploadException             If the file cannot be read or the API rejects it
     */
    @Timeout(value = 60, unit = ChronoUnit.SECONDS)
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, retryOn = UploadTransportException.class)
    public void uploadReportFile(String token, long reportId, Path path, String cluster) throws UploadException {
        String fileName = path.getFileName().toString();
        String data;
        try {
            data = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UploadException("Cannot read " + path, e);
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("access_token", token);
        request.put("checkup_report_id", reportId);
        request.put("check_id", checkIdOf(fileName, cluster));
        request.put("filename", fileName);
        request.put("data", data);
        request.put("type", extensionOf(fileName));

        JsonNode response = post(FILE_ENDPOINT, request);
        if (response.has("message")) {
            throw new UploadException("Upload of " + fileName + " rejected: " + response.path("message").asText());
        }
        log.debug("Uploaded {} to report {}", fileName, reportId);
    }

    /**
     * Check id of a report file: the first four characters when followed by
     * {@code _} or {@code .}, after removing the cluster prefix.
     *
     * @return Check id, or an empty string for files that are not check reports
     */
    static String checkIdOf(String fileName, String cluster) {
        String name = fileName;
        if (cluster != null && !cluster.isEmpty() && name.startsWith(cluster + "_")) {
            name = name.substring(cluster.length() + 1);
        }
        if (name.length() > 4 && (name.charAt(4) == '_' || name.charAt(4) == '.')) {
            return name.substring(0, 4);
        }
        return "";
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private JsonNode post(String endpoint, Map<String, Object> body) throws UploadException {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(apiUrl + endpoint))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UploadTransportException("Request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UploadException("Request to " + endpoint + " interrupted", e);
        }

        if (response.statusCode() == 404) {
            throw new FeatureUnavailableException(endpoint);
        }
        if (response.statusCode() / 100 != 2) {
            throw new UploadException("Request to %s failed with status %d".formatted(endpoint, response.statusCode()));
        }
        String responseBody = response.body();
        if (responseBody == null || responseBody.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new UploadException("Malformed response from " + endpoint, e);
        }
    }
}
