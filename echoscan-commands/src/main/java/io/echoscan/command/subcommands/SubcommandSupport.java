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

import io.echoscan.command.common.OutputFileOption;
import io.echoscan.command.common.VerbosityOption;
import io.echoscan.command.report.EchoReport;
import io.echoscan.command.report.EchoReportIO;
import io.echoscan.command.report.ReportPrinter;
import io.echoscan.engine.DetectionResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/// Output steps shared by the detection subcommands.
final class SubcommandSupport {

    private SubcommandSupport() {
    }

    /// Prints the ranked matches, summary and significance, then writes the report if
    /// {@code -o} was given.
    ///
    /// @return 0, or 1 if the report could not be written
    static int finish(EchoReport report, DetectionResult result, VerbosityOption verbosity, OutputFileOption output) {
        if (verbosity.showNormalOutput() || report.topMatches().isEmpty()) {
            ReportPrinter.printMatches(System.out, report.topMatches(), report.topMatches().size());
        }
        ReportPrinter.printSummary(System.out, report);
        ReportPrinter.printSignificance(System.out, result.significance());

        Optional<Path> path = output.getOutputPath();
        if (path.isPresent()) {
            try {
                EchoReportIO.write(path.get(), report);
                System.out.printf("Report written to %s%n", path.get());
            } catch (IOException e) {
                System.err.printf("Error: Failed to write report %s: %s%n", path.get(), e.getMessage());
                return 1;
            }
        }
        return 0;
    }
}
