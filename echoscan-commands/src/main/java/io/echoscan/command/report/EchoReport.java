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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.echoscan.engine.DetectionConfig;
import io.echoscan.engine.DetectionResult;
import io.echoscan.engine.MatchRecord;
import io.echoscan.engine.stats.AngularBin;
import io.echoscan.engine.stats.SignificanceSummary;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/// JSON form of a detection run.
///
/// Field names are snake_case. Non-finite numbers are stored as JSON {@code null}
/// and read back as NaN. Unknown fields are ignored, so reports that carry only
/// {@code top_matches} and the summary scalars can still be loaded.
@JsonIgnoreProperties(ignoreUnknown = true)
public record EchoReport(
    @JsonProperty("analysis_type") String analysisType,
    @JsonProperty("data_file") String dataFile,
    @JsonProperty("data_points") int dataPoints,
    @JsonProperty("valid_points") int validPoints,
    @JsonProperty("matches_found") int matchesFound,
    @JsonProperty("strong_matches") int strongMatches,
    @JsonProperty("max_correlation") Double maxCorrelation,
    @JsonProperty("mean_correlation") Double meanCorrelation,
    @JsonProperty("detection_parameters") Parameters parameters,
    @JsonProperty("significance") Significance significance,
    @JsonProperty("top_matches") List<Match> topMatches
) {

    public static final String REAL_ANALYSIS = "real_cmb_echo_detection";
    public static final String SYNTHETIC_ANALYSIS = "synthetic_echo_detection";

    public EchoReport {
        topMatches = topMatches == null ? List.of() : List.copyOf(topMatches);
    }

    /// Search parameters as run.
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Parameters(
        @JsonProperty("patch_size") int patchSize,
        @JsonProperty("n_samples") int sampleCount,
        @JsonProperty("min_correlation") double minCorrelation,
        @JsonProperty("seed") long seed,
        @JsonProperty("boundary_policy") String boundaryPolicy,
        @JsonProperty("shift_angles") List<Double> shiftAngles
    ) {
        public static Parameters of(DetectionConfig config) {
            return new Parameters(config.patchSize(), config.sampleCount(), config.minCorrelation(),
                config.seed(), config.boundaryPolicy().name().toLowerCase(Locale.ROOT), config.shiftAnglesDegrees());
        }
    }

    /// t-test and angular bin counts over the reported matches.
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Significance(
        @JsonProperty("t_statistic") Double tStatistic,
        @JsonProperty("p_value") Double pValue,
        @JsonProperty("verdict") String verdict,
        @JsonProperty("near_90") int near90,
        @JsonProperty("near_180") int near180,
        @JsonProperty("near_270") int near270
    ) {
        public static Significance of(SignificanceSummary summary) {
            return new Significance(finiteOrNull(summary.tStatistic()), finiteOrNull(summary.pValue()),
                summary.verdict().name(), summary.count(AngularBin.NEAR_90), summary.count(AngularBin.NEAR_180),
                summary.count(AngularBin.NEAR_270));
        }
    }

    /// One reported match.
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Match(
        @JsonProperty("location1") int location1,
        @JsonProperty("location2") int location2,
        @JsonProperty("correlation") double correlation,
        @JsonProperty("separation_pixels") int separationPixels,
        @JsonProperty("separation_degrees") double separationDegrees,
        @JsonProperty("patch_size") int patchSize
    ) {
        public static Match of(MatchRecord record) {
            return new Match(record.start1(), record.start2(), record.correlation(), record.offset(),
                record.angularSeparation(), record.patchSize());
        }

        public MatchRecord toMatchRecord() {
            return new MatchRecord(location1, location2, correlation, separationPixels, separationDegrees, patchSize);
        }
    }

    /// Builds the report for a finished run.
    ///
    /// @param analysisType {@link #REAL_ANALYSIS} or {@link #SYNTHETIC_ANALYSIS}
    /// @param dataFile source of the samples, or a description for generated data
    /// @param config configuration the run used
    /// @param result the run's result
    public static EchoReport of(String analysisType, String dataFile, DetectionConfig config, DetectionResult result) {
        return new EchoReport(
            analysisType,
            dataFile,
            result.rawLength(),
            result.validLength(),
            result.matchCount(),
            result.strongMatches(),
            finiteOrNull(result.maxCorrelation()),
            finiteOrNull(result.meanCorrelation()),
            Parameters.of(config),
            Significance.of(result.significance()),
            result.topMatches().stream().map(Match::of).collect(Collectors.toList()));
    }

    /// @return the reported matches as engine records, in report order
    public List<MatchRecord> matchRecords() {
        return topMatches.stream().map(Match::toMatchRecord).collect(Collectors.toList());
    }

    static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    /// @return the value, or NaN for a null field
    public static double orNaN(Double value) {
        return value == null ? Double.NaN : value;
    }
}
