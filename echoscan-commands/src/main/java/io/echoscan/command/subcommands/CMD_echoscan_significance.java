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

import com.fasterxml.jackson.core.JsonProcessingException;
import io.echoscan.command.common.VerbosityOption;
import io.echoscan.command.report.EchoReport;
import io.echoscan.command.report.EchoReportIO;
import io.echoscan.command.report.ReportPrinter;
import io.echoscan.engine.MatchRecord;
import io.echoscan.engine.stats.SignificanceSummary;
import io.echoscan.engine.stats.SignificanceTester;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Re-test the reported matches of a saved JSON report.
@CommandLine.Command(name = "significance",
    header = "Test the matches of a saved report for significance",
    description = "Runs a one-sample t-test on the correlation magnitudes in top_matches and counts matches near 90, 180 and 270 degrees",
    exitCodeList = {"0: success", "1: report missing or unreadable", "2: invalid options"})
public class CMD_echoscan_significance implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_echoscan_significance.class);

    @CommandLine.Parameters(index = "0", paramLabel = "REPORT", description = "JSON report written with -o")
    private Path reportFile;

    @CommandLine.Option(names = {"--top"},
        description = "Only test the first N reported matches (default: all)")
    private Integer top;

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            verbosityOption.apply();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }
        if (top != null && top < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: --top must be non-negative");
        }
        if (!Files.exists(reportFile)) {
            System.err.printf("Error: Report not found: %s%n", reportFile);
            return 1;
        }

        EchoReport report;
        try {
            report = EchoReportIO.read(reportFile);
        } catch (JsonProcessingException e) {
            logger.debug("Report parse failed", e);
            System.err.printf("Error: %s is not a valid report: %s%n", reportFile, e.getOriginalMessage());
            return 1;
        } catch (IOException e) {
            System.err.printf("Error: Failed to read %s: %s%n", reportFile, e.getMessage());
            return 1;
        }

        List<MatchRecord> matches = report.matchRecords();
        if (top != null && top < matches.size()) {
            matches = matches.subList(0, top);
        }
        System.out.printf("Report %s (%s, %s)%n", reportFile, report.analysisType(), report.dataFile());
        if (verbosityOption.showNormalOutput() || matches.isEmpty()) {
            ReportPrinter.printMatches(System.out, report.topMatches(), matches.size());
        }
        SignificanceSummary summary = SignificanceTester.test(matches);
        ReportPrinter.printSignificance(System.out, summary);
        return 0;
    }
}
