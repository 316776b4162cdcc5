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

import ai.postgres.reporter.config.PrometheusConfig;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.model.MetricSeries;
import ai.postgres.reporter.model.SamplePoint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.Timeout;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the Prometheus query API ({@code /api/v1/query} and
 * {@code /api/v1/query_range}).
 *
 * <p>Every request is bounded by {@code app.prometheus.timeout}. Requests are signed
 * for Amazon Managed Service for Prometheus when {@code app.prometheus.amp.enabled}
 * is set.
 */
@Slf4j
@ApplicationScoped
public class PrometheusClient implements MetricSource {

    private static final int MAX_ERROR_BODY = 500;

    private final String baseUrl;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final AmpRequestSigner signer;

    @Inject
    public PrometheusClient(PrometheusConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper,
                HttpClient.newBuilder().connectTimeout(config.timeout()).build(),
                config.amp().enabled()
                        ? new AmpRequestSigner(config.amp().region(), config.amp().serviceName())
                        : null);
    }

    PrometheusClient(PrometheusConfig config, ObjectMapper objectMapper,
                     HttpClient httpClient, AmpRequestSigner signer) {
        this.baseUrl = stripTrailingSlash(config.url()) + "/api/v1";
        this.timeout = config.timeout();
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.signer = signer;
        if (signer != null) {
            log.info("Request signing enabled for managed Prometheus (region {})", config.amp().region());
        }
    }

    @Override
    public List<MetricSample> queryInstant(String expr) throws MetricSourceException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", expr);
        JsonNode data = execute("/query", params);

        List<MetricSample> samples = new ArrayList<>();
        for (JsonNode item : data.path("result")) {
            JsonNode value = item.path("value");
            if (!value.isArray() || value.size() < 2) {
                continue;
            }
            samples.add(new MetricSample(readLabels(item.path("metric")),
                    value.get(0).asDouble(), parseValue(value.get(1))));
        }
        return samples;
    }

    @Override
    public List<MetricSeries> queryRange(String expr, long startS, long endS, String step)
            throws MetricSourceException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", expr);
        params.put("start", Long.toString(startS));
        params.put("end", Long.toString(endS));
        params.put("step", step);
        JsonNode data = execute("/query_range", params);

        List<MetricSeries> series = new ArrayList<>();
        for (JsonNode item : data.path("result")) {
            List<SamplePoint> points = new ArrayList<>();
            for (JsonNode pair : item.path("values")) {
                if (pair.isArray() && pair.size() >= 2) {
                    points.add(new SamplePoint(pair.get(0).asDouble(), parseValue(pair.get(1))));
                }
            }
            series.add(new MetricSeries(readLabels(item.path("metric")), points));
        }
        return series;
    }

    @Override
    @Timeout(value = 15, unit = ChronoUnit.SECONDS)
    public boolean testConnection() {
        try {
            HttpResponse<String> response = send(buildUri("/status/config", Map.of()));
            if (response.statusCode() != 200) {
                log.warn("Backend status check returned HTTP {}", response.statusCode());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Backend connection failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private JsonNode execute(String path, Map<String, String> params) throws MetricSourceException {
        URI uri = buildUri(path, params);
        log.debug("Backend request {} query={}", path, params.get("query"));

        HttpResponse<String> response;
        try {
            response = send(uri);
        } catch (IOException e) {
            throw new MetricSourceException("Request to " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetricSourceException("Request to " + path + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new MetricSourceException("Query failed with status %d: %s"
                    .formatted(response.statusCode(), abbreviate(response.body())));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new MetricSourceException("Malformed response from " + path, e);
        }
        if (root == null || !"success".equals(root.path("status").asText())) {
            String error = root == null ? "empty body" : root.path("error").asText("unknown error");
            throw new MetricSourceException("Query was not successful: " + error);
        }
        return root.path("data");
    }

    private HttpResponse<String> send(URI uri) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (signer != null) {
            signer.sign(uri).forEach(builder::header);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI buildUri(String path, Map<String, String> params) {
        StringBuilder sb = new StringBuilder(baseUrl).append(path);
        char separator = '?';
        for (Map.Entry<String, String> param : params.entrySet()) {
            sb.append(separator)
                    .append(encode(param.getKey()))
                    .append('=')
                    .append(encode(param.getValue()));
            separator = '&';
        }
        return URI.create(sb.toString());
    }

    private static String encode(String value) {
        // SigV4 canonical form wants %20, not '+'
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static Map<String, String> readLabels(JsonNode metric) {
        Map<String, String> labels = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = metric.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            labels.put(field.getKey(), field.getValue().asText());
        }
        return labels;
    }

    static double parseValue(JsonNode node) {
        String text = node.asText();
        return switch (text) {
            case "NaN" -> Double.NaN;
            case "+Inf", "Inf" -> Double.POSITIVE_INFINITY;
            case "-Inf" -> Double.NEGATIVE_INFINITY;
            default -> {
                try {
                    yield Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    log.debug("Unparsable sample value '{}', using 0", text);
                    yield 0.0;
                }
            }
        };
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }
}
