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

import io.echoscan.command.common.DetectionOptions;
import io.echoscan.command.common.OutputFileOption;
import io.echoscan.command.common.RandomSeedOption;
import io.echoscan.command.common.VerbosityOption;
import io.echoscan.command.report.EchoReport;
import io.echoscan.command.report.ReportPrinter;
import io.echoscan.engine.DetectionConfig;
import io.echoscan.engine.DetectionResult;
import io.echoscan.engine.DetectionStatus;
import io.echoscan.engine.EchoDetectionEngine;
import io.echoscan.engine.Field;
import io.echoscan.engine.stats.FieldStatistics;
import io.echoscan.fitsio.FitsArrayReader;
import io.echoscan.fitsio.FitsFormatException;
import io.echoscan.fitsio.FitsImage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Search a FITS map for echo pairs.
///
/// A file that cannot be read exits 1. A field with too few valid samples, or a search
/// that retains nothing, is a successful run with zero matches and exits 0.
@CommandLine.Command(name = "real",
    header = "Search a FITS map for correlated patch pairs",
    description = "Reads the primary array of FILE, samples patch pairs at fixed offsets and ranks them by correlation",
    exitCodeList = {"0: success, including runs with no matches", "1: read or format error", "2: invalid options"})
public class CMD_echoscan_real implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_echoscan_real.class);

    private static final int EXIT_ERROR = 1;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "FITS file holding a flat primary array")
    private Path file;

    @CommandLine.Mixin
    private DetectionOptions detectionOptions = new DetectionOptions();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        DetectionConfig config;
        try {
            verbosityOption.apply();
            config = detectionOptions.toConfig(randomSeedOption.getSeed());
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }
        try {
            outputFileOption.validate();
        } catch (IllegalStateException e) {
            System.err.printf("Error: %s%n", e.getMessage());
            return EXIT_ERROR;
        }

        System.out.printf("Reading %s%n", file);
        FitsImage image;
        try {
            image = new FitsArrayReader().read(file);
        } catch (FitsFormatException e) {
            logger.debug("Read failed", e);
            System.err.printf("Error: %s%n", e.getMessage());
            System.err.println("  Suggestion: Check that the file is a complete FITS image with a numeric primary array.");
            return EXIT_ERROR;
        }

        Field field = Field.of(image.data());
        ReportPrinter.printFieldStatistics(System.out, FieldStatistics.of(field), field.rawLength());

        DetectionResult result = new EchoDetectionEngine(config).detect(field);
        if (result.status() == DetectionStatus.INSUFFICIENT_DATA) {
            System.out.printf("Not enough valid data for analysis: %d valid samples, patch size %d needs %d%n",
                field.length(), config.patchSize(), 2L * config.patchSize());
        }

        EchoReport report = EchoReport.of(EchoReport.REAL_ANALYSIS, file.toString(), config, result);
        return SubcommandSupport.finish(report, result, verbosityOption, outputFileOption);
    }
}
