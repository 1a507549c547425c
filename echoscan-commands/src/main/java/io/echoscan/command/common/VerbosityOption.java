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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * {@code -v} raises the root log level to DEBUG so sampling progress and skip counts
 * show up; {@code -q} lowers it to ERROR and suppresses the match listing.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable debug logging"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors and the summary"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * @return true if the ranked match listing should be printed
     */
    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Validates the flags and applies the requested log level.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void apply() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
        if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
            Configurator.setLevel("io.echoscan", Level.DEBUG);
        } else if (quiet) {
            Configurator.setRootLevel(Level.ERROR);
            Configurator.setLevel("io.echoscan", Level.ERROR);
        }
    }
}
