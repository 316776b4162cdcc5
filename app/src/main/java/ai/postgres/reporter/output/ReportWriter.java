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
package ai.postgres.reporter.output;

import ai.postgres.reporter.config.ReporterConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes reports and per-query documents as pretty-printed JSON files.
 */
@Slf4j
@ApplicationScoped
public class ReportWriter {

    private final Path outputDir;
    private final ObjectWriter writer;

    @Inject
    public ReportWriter(ReporterConfig config, ObjectMapper objectMapper) {
        this(Path.of(config.outputDir()), objectMapper);
    }

    public ReportWriter(Path outputDir, ObjectMapper objectMapper) {
        this.outputDir = outputDir;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    /**
     * Write a document into the output directory, replacing an existing file.
     *
     * @param filename Plain file name, without directories
     * @param document Object serialized with the application mapper
     * @return Path of the written file
     * @throws IOException If the directory cannot be created or the file cannot be written
     */
    public Path write(String filename, Object document) throws IOException {
        if (filename.contains("/") || filename.contains("\\") || filename.startsWith(".")) {
            throw new IllegalArgumentException("Invalid report file name: " + filename);
        }
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(filename);
        byte[] bytes = writer.writeValueAsBytes(document);
        Files.write(target, bytes);
        log.debug("Wrote {} ({} bytes)", target, bytes.length);
        return target;
    }

    public Path outputDir() {
        return outputDir;
    }

    /**
     * File name of a check report: {@code <cluster>_<checkId>.json}.
     */
    public static String reportFileName(String cluster, String checkId) {
        return cluster + "_" + checkId + ".json";
    }
}
