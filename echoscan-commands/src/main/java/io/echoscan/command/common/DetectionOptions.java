package io.echoscan.command.common;

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
import io.echoscan.engine.sampling.BoundaryPolicy;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/// Search parameters shared by the detection subcommands.
///
/// Each option maps one-to-one onto a {@link DetectionConfig} field; validation is
/// left to {@link DetectionConfig} so the command line and library agree on limits.
public class DetectionOptions {

    /// Converts {@code clamp}/{@code wrap} in any case.
    public static class BoundaryConverter implements CommandLine.ITypeConverter<BoundaryPolicy> {
        @Override
        public BoundaryPolicy convert(String value) {
            try {
                return BoundaryPolicy.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @CommandLine.Option(names = {"--patch-size"},
        description = "Samples per patch (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DetectionConfig.DEFAULT_PATCH_SIZE)
    private int patchSize = DetectionConfig.DEFAULT_PATCH_SIZE;

    @CommandLine.Option(names = {"--samples"},
        description = "Number of random patch starts (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DetectionConfig.DEFAULT_SAMPLE_COUNT)
    private int samples = DetectionConfig.DEFAULT_SAMPLE_COUNT;

    @CommandLine.Option(names = {"--min-corr"},
        description = "Minimum |r| for a pair to be kept (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DetectionConfig.DEFAULT_MIN_CORRELATION)
    private double minCorrelation = DetectionConfig.DEFAULT_MIN_CORRELATION;

    @CommandLine.Option(names = {"--strong"},
        description = "|r| above which a match counts as strong (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DetectionConfig.DEFAULT_STRONG_THRESHOLD)
    private double strongThreshold = DetectionConfig.DEFAULT_STRONG_THRESHOLD;

    @CommandLine.Option(names = {"--top"},
        description = "Matches to report and test (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DetectionConfig.DEFAULT_TOP_N)
    private int topN = DetectionConfig.DEFAULT_TOP_N;

    @CommandLine.Option(names = {"--shift-angles"}, split = ",", arity = "1..*",
        description = "Explicit shift angles in degrees; without them the quarter, half and three-quarter wraps are used")
    private List<Double> shiftAngles = new ArrayList<>();

    @CommandLine.Option(names = {"--boundary"},
        description = "Handling of a paired patch past the end: clamp or wrap (default: ${DEFAULT-VALUE})",
        defaultValue = "clamp",
        converter = BoundaryConverter.class)
    private BoundaryPolicy boundaryPolicy = BoundaryPolicy.CLAMP;

    /// @return true if {@code --shift-angles} was given
    public boolean hasShiftAngles() {
        return !shiftAngles.isEmpty();
    }

    public List<Double> getShiftAngles() {
        return List.copyOf(shiftAngles);
    }

    public int getSamples() {
        return samples;
    }

    /// Builds the engine configuration.
    ///
    /// @param seed sampling seed
    /// @return the configuration
    /// @throws IllegalArgumentException if a value is out of range
    public DetectionConfig toConfig(long seed) {
        return DetectionConfig.builder()
            .patchSize(patchSize)
            .sampleCount(samples)
            .minCorrelation(minCorrelation)
            .strongThreshold(strongThreshold)
            .topN(topN)
            .seed(seed)
            .shiftAnglesDegrees(shiftAngles)
            .boundaryPolicy(boundaryPolicy)
            .build();
    }
}
