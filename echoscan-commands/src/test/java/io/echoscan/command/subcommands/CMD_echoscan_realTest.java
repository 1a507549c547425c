package io.echoscan.command.subcommands;

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

import io.echoscan.command.report.EchoReport;
import io.echoscan.command.report.EchoReportIO;
import io.echoscan.engine.synthetic.SyntheticFieldGenerator;
import io.echoscan.fitsio.FitsArrayWriter;
import io.echoscan.fitsio.FitsElementType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CMD_echoscan_realTest {

    @TempDir
    Path tempDir;

    private Path noiseMap(int length) throws IOException {
        Path file = tempDir.resolve("noise.fits");
        double[] values = new SyntheticFieldGenerator(17L).gaussian(length, 1.0);
        new FitsArrayWriter(FitsElementType.FLOAT32).write(file, values);
        return file;
    }

    @Test
    public void testDetectionWritesReport() throws IOException {
        Path map = noiseMap(4000);
        Path reportFile = tempDir.resolve("report.json");

        CommandRun run = CommandRun.execute(new CMD_echoscan_real(), map.toString(),
            "--patch-size", "100", "--samples", "200", "--min-corr", "0.1", "-o", reportFile.toString());

        assertEquals(0, run.exitCode, "Command should exit with code 0");
        assertTrue(run.out.contains("Data points: 4000 (4000 valid)"), "Output should describe the field");
        assertTrue(run.out.contains("Matches found:"), "Output should contain the summary");
        assertTrue(run.out.contains("Verdict:"), "Output should contain the verdict annotation");

        EchoReport report = EchoReportIO.read(reportFile);
        assertThat(report.analysisType()).isEqualTo(EchoReport.REAL_ANALYSIS);
        assertThat(report.dataPoints()).isEqualTo(4000);
        assertThat(report.matchesFound()).isPositive();
        assertThat(report.topMatches()).hasSizeBetween(1, 20);
        assertThat(report.parameters().patchSize()).isEqualTo(100);
        assertThat(report.parameters().boundaryPolicy()).isEqualTo("clamp");
        assertThat(report.topMatches()).allSatisfy(m -> assertThat(Math.abs(m.correlation())).isGreaterThanOrEqualTo(0.1));
    }

    @Test
    public void testEmptyResultIsSuccess() throws IOException {
        Path map = noiseMap(4000);

        CommandRun run = CommandRun.execute(new CMD_echoscan_real(), map.toString(),
            "--patch-size", "200", "--samples", "100", "--min-corr", "0.95");

        assertEquals(0, run.exitCode, "An empty result is not an error");
        assertTrue(run.out.contains("No echo patterns detected"));
        assertTrue(run.out.contains("Matches found: 0"));
    }

    @Test
    public void testInsufficientDataIsSuccess() throws IOException {
        Path map = noiseMap(150);

        CommandRun run = CommandRun.execute(new CMD_echoscan_real(), map.toString(), "--patch-size", "100");

        assertEquals(0, run.exitCode);
        assertTrue(run.out.contains("Not enough valid data for analysis"));
        assertTrue(run.out.contains("No echo patterns detected"));
    }

    @Test
    public void testFormatErrorExitsWithOne() throws IOException {
        Path broken = tempDir.resolve("broken.fits");
        Files.write(broken, "not a fits file at all".repeat(10).getBytes(StandardCharsets.US_ASCII));

        CommandRun run = CommandRun.execute(new CMD_echoscan_real(), broken.toString());

        assertEquals(1, run.exitCode, "A read failure must be distinct from an empty result");
        assertTrue(run.err.contains("Error:"));
        assertThat(run.out).doesNotContain("No echo patterns detected");
    }

    @Test
    public void testMissingFileExitsWithOne() {
        CommandRun run = CommandRun.execute(new CMD_echoscan_real(), tempDir.resolve("absent.fits").toString());

        assertEquals(1, run.exitCode);
    }

    @Test
    public void testInvalidOptionsAreUsageErrors() throws IOException {
        Path map = noiseMap(1000);

        assertEquals(2, CommandRun.execute(new CMD_echoscan_real(), map.toString(), "--patch-size", "1").exitCode);
        assertEquals(2, CommandRun.execute(new CMD_echoscan_real(), map.toString(), "--boundary", "mirror").exitCode);
        assertEquals(2, CommandRun.execute(new CMD_echoscan_real(), map.toString(), "-s", "abc").exitCode);
    }

    @Test
    public void testExistingOutputNeedsForce() throws IOException {
        Path map = noiseMap(1000);
        Path reportFile = Files.writeString(tempDir.resolve("report.json"), "{}");

        CommandRun refused = CommandRun.execute(new CMD_echoscan_real(), map.toString(),
            "--patch-size", "100", "--samples", "10", "-o", reportFile.toString());
        CommandRun forced = CommandRun.execute(new CMD_echoscan_real(), map.toString(),
            "--patch-size", "100", "--samples", "10", "-o", reportFile.toString(), "--force");

        assertEquals(1, refused.exitCode);
        assertTrue(refused.err.contains("--force"));
        assertEquals(0, forced.exitCode);
        assertThat(EchoReportIO.read(reportFile).dataPoints()).isEqualTo(1000);
    }
}
