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

import io.echoscan.engine.DetectionConfig;
import io.echoscan.engine.DetectionResult;
import io.echoscan.engine.EchoDetectionEngine;
import io.echoscan.engine.Field;
import io.echoscan.engine.sampling.BoundaryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EchoReportIO")
class EchoReportIOTest {

    @TempDir
    Path tempDir;

    private static double[] quarterEcho() {
        double[] values = new double[4000];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.sin(i * 0.37) + Math.cos(i * 0.011 * (i % 7));
        }
        System.arraycopy(values, 0, values, 1000, 200);
        return values;
    }

    @Test
    @DisplayName("should write snake_case fields and read them back")
    void roundTrip() throws IOException {
        DetectionConfig config = DetectionConfig.builder().patchSize(200).boundaryPolicy(BoundaryPolicy.WRAP)
            .shiftAnglesDegrees(List.of(90.0)).build();
        DetectionResult result = new EchoDetectionEngine(config).detect(Field.of(quarterEcho()), new int[]{0});
        EchoReport report = EchoReport.of(EchoReport.REAL_ANALYSIS, "map.fits", config, result);
        Path file = tempDir.resolve("out/report.json");

        EchoReportIO.write(file, report);
        String json = Files.readString(file);
        EchoReport read = EchoReportIO.read(file);

        assertThat(json).contains("\"analysis_type\"", "\"top_matches\"", "\"separation_degrees\"",
            "\"detection_parameters\"", "\"boundary_policy\" : \"wrap\"");
        assertThat(read).isEqualTo(report);
        assertThat(read.topMatches()).hasSize(1);
        assertThat(read.topMatches().get(0).separationDegrees()).isEqualTo(90.0);
        assertThat(read.matchRecords()).containsExactlyElementsOf(result.topMatches());
    }

    @Test
    @DisplayName("undefined statistics should be written as null")
    void nanAsNull() throws IOException {
        DetectionConfig config = DetectionConfig.builder().patchSize(200).build();
        DetectionResult result = new EchoDetectionEngine(config).detect(new double[100]);
        EchoReport report = EchoReport.of(EchoReport.REAL_ANALYSIS, "tiny.fits", config, result);

        String json = EchoReportIO.toJson(report);
        EchoReport read = EchoReportIO.MAPPER.readValue(json, EchoReport.class);

        assertThat(json).contains("\"t_statistic\" : null", "\"p_value\" : null", "\"verdict\" : \"UNDEFINED\"");
        assertThat(read.significance().tStatistic()).isNull();
        assertThat(EchoReport.orNaN(read.significance().pValue())).isNaN();
        assertThat(read.topMatches()).isEmpty();
    }

    @Test
    @DisplayName("unknown fields should be ignored")
    void ignoresUnknownFields() throws IOException {
        EchoReport read = EchoReportIO.MAPPER.readValue(
            "{\"analysis_type\":\"x\",\"plot_file\":\"a.png\",\"top_matches\":[]}", EchoReport.class);

        assertThat(read.analysisType()).isEqualTo("x");
        assertThat(read.topMatches()).isEmpty();
    }
}
