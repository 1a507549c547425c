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
import io.echoscan.engine.EchoDetectionEngine;
import io.echoscan.engine.Field;
import io.echoscan.engine.stats.FieldStatistics;
import io.echoscan.engine.synthetic.PlantedEcho;
import io.echoscan.engine.synthetic.SyntheticFieldGenerator;
import io.echoscan.fitsio.FitsArrayWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Plant antipodal echoes in Gaussian noise and run both searches over the result.
///
/// The fractional-wrap search uses the full sample count; the explicit-angle search
/// uses half of it. Their matches are merged into one ranking.
@CommandLine.Command(name = "synthetic",
    header = "Run the echo search on generated data with planted echoes",
    description = "Generates Gaussian noise, plants echo pairs half a domain apart and checks how many are recovered",
    exitCodeList = {"0: success", "1: output error", "2: invalid options"})
public class CMD_echoscan_synthetic implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_echoscan_synthetic.class);

    static final List<Double> DEFAULT_SHIFT_ANGLES = List.of(90.0, 180.0, 120.0);

    @CommandLine.Option(names = {"--length"},
        description = "Number of samples to generate (default: ${DEFAULT-VALUE})",
        defaultValue = "786432")
    private int length = 786432;

    @CommandLine.Option(names = {"--n-echoes"},
        description = "Echo pairs to plant (default: ${DEFAULT-VALUE})",
        defaultValue = "3")
    private int echoes = 3;

    @CommandLine.Option(names = {"--strength"},
        description = "Amplitude of each planted pattern (default: ${DEFAULT-VALUE})",
        defaultValue = "1.0")
    private double strength = 1.0;

    @CommandLine.Option(names = {"--noise"},
        description = "Standard deviation of the background noise (default: ${DEFAULT-VALUE})",
        defaultValue = "1.0")
    private double noise = 1.0;

    @CommandLine.Option(names = {"--save-map"},
        description = "Also write the generated samples to this FITS file")
    private Path saveMap;

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
        long seed = randomSeedOption.getSeed();
        DetectionConfig wrapConfig;
        DetectionConfig angleConfig;
        double[] samples;
        List<PlantedEcho> planted;
        try {
            verbosityOption.apply();
            DetectionConfig base = detectionOptions.toConfig(seed);
            List<Double> angles = detectionOptions.hasShiftAngles()
                ? detectionOptions.getShiftAngles() : DEFAULT_SHIFT_ANGLES;
            wrapConfig = base.toBuilder().shiftAnglesDegrees(List.of()).build();
            angleConfig = base.toBuilder().shiftAnglesDegrees(angles).sampleCount(base.sampleCount() / 2).build();

            SyntheticFieldGenerator generator = new SyntheticFieldGenerator(seed);
            samples = generator.gaussian(length, noise);
            planted = generator.plantEchoes(samples, base.patchSize(), echoes, strength, length / 2);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }
        try {
            outputFileOption.validate();
        } catch (IllegalStateException e) {
            System.err.printf("Error: %s%n", e.getMessage());
            return 1;
        }

        System.out.printf("Generated %d samples with %d planted echo pairs (seed %d)%n", length, planted.size(), seed);
        if (saveMap != null) {
            try {
                new FitsArrayWriter().write(saveMap, samples);
                System.out.printf("Map written to %s%n", saveMap);
            } catch (IOException e) {
                System.err.printf("Error: Failed to write map %s: %s%n", saveMap, e.getMessage());
                return 1;
            }
        }

        Field field = Field.of(samples);
        ReportPrinter.printFieldStatistics(System.out, FieldStatistics.of(field), field.rawLength());

        DetectionResult wrapResult = new EchoDetectionEngine(wrapConfig).detect(field);
        DetectionResult angleResult = new EchoDetectionEngine(angleConfig).detect(field);
        DetectionResult merged = DetectionResult.merge(wrapResult, angleResult);
        logger.debug("Fractional-wrap search kept {}, explicit-angle search kept {}",
            wrapResult.matchCount(), angleResult.matchCount());

        System.out.printf("Recovered %d/%d planted echoes%n", recovered(planted, merged), planted.size());

        DetectionConfig reported = wrapConfig.toBuilder().shiftAnglesDegrees(angleConfig.shiftAnglesDegrees()).build();
        String source = "synthetic(length=" + length + ", seed=" + seed + ")";
        EchoReport report = EchoReport.of(EchoReport.SYNTHETIC_ANALYSIS, source, reported, merged);
        return SubcommandSupport.finish(report, merged, verbosityOption, outputFileOption);
    }

    /// Counts planted pairs hit by at least one retained match at the planted offset whose
    /// first patch overlaps the planted pattern by more than half.
    static long recovered(List<PlantedEcho> planted, DetectionResult result) {
        return planted.stream()
            .filter(p -> result.matches().stream().anyMatch(m -> m.offset() == p.offset()
                && Math.abs(m.start1() - p.start1()) < p.patchSize() / 2))
            .count();
    }
}
