package io.echoscan.command.report;

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

import io.echoscan.engine.stats.AngularBin;
import io.echoscan.engine.stats.FieldStatistics;
import io.echoscan.engine.stats.SignificanceSummary;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/// Console rendering shared by the echoscan subcommands.
public final class ReportPrinter {

    private ReportPrinter() {
    }

    public static void printFieldStatistics(PrintStream out, FieldStatistics stats, int rawLength) {
        out.printf(Locale.ROOT, "Data points: %d (%d valid)%n", rawLength, stats.count());
        out.printf(Locale.ROOT, "  mean %.6g  std %.6g  min %.6g  max %.6g%n",
            stats.mean(), stats.standardDeviation(), stats.min(), stats.max());
    }

    public static void printMatches(PrintStream out, List<EchoReport.Match> matches, int limit) {
        if (matches.isEmpty()) {
            out.println("No echo patterns detected");
            return;
        }
        if (limit <= 0) {
            return;
        }
        int shown = Math.min(limit, matches.size());
        out.printf(Locale.ROOT, "Top %d matches:%n", shown);
        out.println("  rank  location1  location2  correlation  separation");
        for (int i = 0; i < shown; i++) {
            EchoReport.Match m = matches.get(i);
            out.printf(Locale.ROOT, "  %4d  %9d  %9d  %+11.4f  %6.1f° (%d px)%n",
                i + 1, m.location1(), m.location2(), m.correlation(), m.separationDegrees(), m.separationPixels());
        }
    }

    public static void printSummary(PrintStream out, EchoReport report) {
        out.printf(Locale.ROOT, "Matches found: %d%n", report.matchesFound());
        out.printf(Locale.ROOT, "Strong matches: %d%n", report.strongMatches());
        out.printf(Locale.ROOT, "Max |correlation|: %.4f%n", EchoReport.orNaN(report.maxCorrelation()));
        out.printf(Locale.ROOT, "Mean correlation: %.4f%n", EchoReport.orNaN(report.meanCorrelation()));
    }

    public static void printSignificance(PrintStream out, SignificanceSummary summary) {
        out.printf(Locale.ROOT, "Significance over %d matches:%n", summary.sampleSize());
        out.printf(Locale.ROOT, "  mean |r| %.4f  t %.4f  p %.3g%n",
            summary.meanMagnitude(), summary.tStatistic(), summary.pValue());
        for (AngularBin bin : AngularBin.values()) {
            out.printf(Locale.ROOT, "  %-10s %d%n", bin.label() + ":", summary.count(bin));
        }
        out.printf(Locale.ROOT, "  at predicted angles: %d/%d%n", summary.atPredictedAngles(), summary.sampleSize());
        out.printf(Locale.ROOT, "Verdict: %s (report annotation only)%n", summary.verdict().label());
    }
}
