package io.echoscan.command;

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

import io.echoscan.command.subcommands.CMD_echoscan_real;
import io.echoscan.command.subcommands.CMD_echoscan_significance;
import io.echoscan.command.subcommands.CMD_echoscan_synthetic;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The echoscan command searches sampled fields for correlated patch pairs
///
/// This is an umbrella command for the detection and reporting subcommands.
@CommandLine.Command(name = "echoscan",
    header = "Detect echo correlations in sampled fields",
    description = "Contains subcommands to search FITS maps or generated data for correlated patch pairs and to test saved reports",
    mixinStandardHelpOptions = true,
    version = "echoscan 0.1.0",
    subcommands = {
        CMD_echoscan_real.class,
        CMD_echoscan_synthetic.class,
        CMD_echoscan_significance.class
    })
public class CMD_echoscan implements Callable<Integer> {

    /// Run CMD_echoscan
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_echoscan()).execute(args));
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
