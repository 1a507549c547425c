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
import picocli.CommandLine;

/**
 * Shared random seed option.
 * Detection runs are reproducible by default, so an absent seed means the documented
 * default rather than a time-based one.
 */
public class RandomSeedOption {

    /**
     * Picocli type converter that reports a readable error for malformed seeds.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Long> {

        @Override
        public Long convert(String value) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer.");
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for patch sampling and synthetic data (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DetectionConfig.DEFAULT_SEED,
        converter = SeedConverter.class
    )
    private long seed = DetectionConfig.DEFAULT_SEED;

    /**
     * Gets the seed value.
     */
    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return String.valueOf(seed);
    }
}
