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

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Shared report output option with force overwrite flag.
 * The report file is optional; without {@code -o} results only go to the console.
 */
public class OutputFileOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the JSON report to this file"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    /**
     * Gets the normalized output path, if one was given.
     */
    public Optional<Path> getOutputPath() {
        return Optional.ofNullable(outputPath).map(Path::normalize);
    }

    /**
     * Checks if force overwrite is enabled.
     */
    public boolean isForce() {
        return force;
    }

    /**
     * Checks if the output file already exists and force is not enabled.
     */
    public boolean outputExistsWithoutForce() {
        return outputPath != null && Files.exists(outputPath) && !force;
    }

    /**
     * Validates the output file, checking for existence without force flag.
     *
     * @throws IllegalStateException if the file exists and {@code --force} was not given
     */
    public void validate() {
        if (outputExistsWithoutForce()) {
            throw new IllegalStateException(
                "Output file already exists: " + outputPath + ". Use --force to overwrite."
            );
        }
    }

    @Override
    public String toString() {
        if (outputPath == null) {
            return "(console only)";
        }
        return force ? outputPath + " (force)" : outputPath.toString();
    }
}
