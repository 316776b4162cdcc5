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

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpRequest;
import software.amazon.awssdk.http.auth.aws.signer.AwsV4HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.SignedRequest;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Signs backend GET requests with AWS Signature Version 4 for Amazon Managed Service
 * for Prometheus.
 *
 * <p>Credentials come from the default AWS provider chain. When they cannot be resolved
 * the request is sent unsigned and a single warning is logged.
 */
@Slf4j
public class AmpRequestSigner {

    private static final List<String> SKIPPED_HEADERS = List.of("host", "content-length");

    private final String region;
    private final String serviceName;
    private final AwsCredentialsProvider credentialsProvider;
    private final AwsV4HttpSigner signer;
    private final AtomicBoolean warned = new AtomicBoolean();

    public AmpRequestSigner(String region, String serviceName) {
        this(region, serviceName, DefaultCredentialsProvider.create());
    }

    AmpRequestSigner(String region, String serviceName, AwsCredentialsProvider credentialsProvider) {
        this.region = region;
        this.serviceName = serviceName;
        this.credentialsProvider = credentialsProvider;
        this.signer = AwsV4HttpSigner.create();
    }

    /**
     * Compute the signing headers for a GET request.
     *
     * @param uri Fully encoded request URI, including the query string
     * @return Headers to add to the request, empty when credentials are unavailable
     */
    public Map<String, String> sign(URI uri) {
        AwsCredentials credentials;
        try {
            credentials = credentialsProvider.resolveCredentials();
        } catch (RuntimeException e) {
            if (warned.compareAndSet(false, true)) {
                log.warn("AWS credentials could not be resolved, sending unsigned requests: {}", e.getMessage());
            }
            return Map.of();
        }

        SdkHttpRequest request = SdkHttpRequest.builder()
                .method(SdkHttpMethod.GET)
                .uri(uri)
                .build();

        SignedRequest signed = signer.sign(r -> r
                .identity(credentials)
                .request(request)
                .putProperty(AwsV4HttpSigner.SERVICE_SIGNING_NAME, serviceName)
                .putProperty(AwsV4HttpSigner.REGION_NAME, region));

        Map<String, String> headers = new LinkedHashMap<>();
        signed.request().headers().forEach((name, values) -> {
            if (!SKIPPED_HEADERS.contains(name.toLowerCase()) && !values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });
        return headers;
    }
}
