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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadClientTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    @TempDir
    Path tempDir;

    private UploadClient client;

    @BeforeEach
    void setUp() {
        client = new UploadClient("https://api.test/v1/", Duration.ofSeconds(5), new ObjectMapper(), httpClient);
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        if (status / 100 == 2) {
            when(response.body()).thenReturn(body);
        }
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    }

    @Test
    void testCreateReport_ReturnsId() throws Exception {
        // Setup
        respond(200, "{\"report_id\": 1234}");

        // Execute
        long id = client.createReport("token", "prod", "1");

        // Verify
        assertEquals(1234L, id);
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertEquals(URI.create("https://api.test/v1/rpc/checkup_report_create"), request.getValue().uri());
        assertEquals("POST", request.getValue().method());
        assertEquals("application/json", request.getValue().headers().firstValue("Content-Type").orElse(""));
        assertTrue(request.getValue().bodyPublisher().orElseThrow().contentLength() > 0);
    }

    @Test
    void testCreateReport_MissingId_UsesServerMessage() throws Exception {
        respond(200, "{\"message\": \"invalid token\"}");

        UploadException e = assertThrows(UploadException.class, () -> client.createReport("bad", "prod", "1"));
        assertEquals("invalid token", e.getMessage());
    }

    @Test
    void testCreateReport_ZeroId_DefaultMessage() throws Exception {
        respond(200, "{\"report_id\": 0}");

        UploadException e = assertThrows(UploadException.class, () -> client.createReport("t", "prod", "1"));
        assertEquals("Cannot create report.", e.getMessage());
    }

    @Test
    void testCreateReport_NotFound_FeatureUnavailable() throws Exception {
        respond(404, null);

        assertThrows(FeatureUnavailableException.class, () -> client.createReport("t", "prod", "1"));
    }

    @Test
    void testCreateReport_ServerError() throws Exception {
        respond(500, null);

        UploadException e = assertThrows(UploadException.class, () -> client.createReport("t", "prod", "1"));
        assertTrue(e.getMessage().contains("500"), e.getMessage());
    }

    @Test
    void testCreateReport_NetworkError_IsTransportFailure() throws Exception {
        doThrow(new ConnectException("refused")).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(UploadTransportException.class, () -> client.createReport("t", "prod", "1"));
    }

    @Test
    void testUploadReportFile_EmptyResponseAccepted() throws Exception {
        Path file = Files.writeString(tempDir.resolve("prod_K003.json"), "{\"checkId\":\"K003\"}");
        respond(200, "");

        assertDoesNotThrow(() -> client.uploadReportFile("t", 12L, file, "prod"));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertEquals(URI.create("https://api.test/v1/rpc/checkup_report_file_post"), request.getValue().uri());
    }

    @Test
    void testUploadReportFile_RejectedWithMessage() throws Exception {
        Path file = Files.writeString(tempDir.resolve("prod_K003.json"), "{}");
        respond(200, "{\"message\": \"report closed\"}");

        UploadException e = assertThrows(UploadException.class,
                () -> client.uploadReportFile("t", 12L, file, "prod"));
        assertTrue(e.getMessage().contains("report closed"));
    }

    @Test
    void testUploadReportFile_MissingFile() throws Exception {
        Path missing = tempDir.resolve("nope.json");

        assertThrows(UploadException.class, () -> client.uploadReportFile("t", 12L, missing, "prod"));
        verify(httpClient, never()).send(any(HttpRequest.class), any());
    }

    @Test
    void testCheckIdOf() {
        assertEquals("K003", UploadClient.checkIdOf("prod_K003.json", "prod"));
        assertEquals("K003", UploadClient.checkIdOf("K003_details.json", null));
        assertEquals("A002", UploadClient.checkIdOf("A002.json", ""));
        assertEquals("", UploadClient.checkIdOf("prod_query_123.json", "prod"));
        assertEquals("", UploadClient.checkIdOf("x.md", null));
    }

    @Test
    void testExtensionOf() {
        assertEquals("json", UploadClient.extensionOf("prod_K003.JSON"));
        assertEquals("", UploadClient.extensionOf("README"));
    }

    @Test
    void testTransportExceptionIsUploadException() {
        IOException cause = new IOException("reset");
        UploadException e = new UploadTransportException("failed", cause);
        assertEquals(cause, e.getCause());
    }
}
