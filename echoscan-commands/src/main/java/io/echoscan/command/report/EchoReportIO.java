package io.echoscan.command.report;

/*
 * Copyright (c) echoscan contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Reads and writes {@link EchoReport} JSON with one shared mapper.
public final class EchoReportIO {

    /// Shared JSON mapper with pretty printing.
    public static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private EchoReportIO() {
    }

    public static String toJson(EchoReport report) throws IOException {
        return MAPPER.writeValueAsString(report);
    }

    /// Writes the report, creating parent directories as needed.
    ///
    /// @param path destination
    /// @param report the report
    /// @throws IOException if the file cannot be written
    public static void write(Path path, EchoReport report) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(report) + System.lineSeparator(),
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    /// @param path a report written by {@link #write}, or any JSON object with the same field names
    /// @return the parsed report
    /// @throws IOException if the file is missing or not a report
    public static EchoReport read(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), EchoReport.class);
    }
}
