package io.echoscan.engine;

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

import io.echoscan.engine.sampling.OffsetPolicy;
import io.echoscan.engine.stats.SignificanceSummary;
import io.echoscan.engine.stats.SignificanceTester;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/// Everything a detection run produced.
///
/// {@code matches} holds every retained pair in rank order; {@code topMatches} is its
/// reporting prefix. Scalars over an empty match list are 0.
///
/// @param status whether the search ran
/// @param searches offset policies that contributed, in run order
/// @param rawLength samples before the validity filter
/// @param validLength valid samples N
/// @param samplesDrawn number of patch starts used
/// @param pairsScored pairs whose correlation was defined
/// @param degenerateSkips pairs skipped because a patch had zero variance
/// @param matches all retained pairs, ranked
/// @param topMatches the first {@code topN} ranked pairs
/// @param maxCorrelation largest magnitude among {@code matches}
/// @param meanCorrelation mean signed coefficient among {@code matches}
/// @param strongMatches count of {@code matches} with magnitude above {@code strongThreshold}
/// @param strongThreshold threshold used for {@code strongMatches}
/// @param topN size limit of {@code topMatches}
public record DetectionResult(
    DetectionStatus status,
    List<OffsetPolicy> searches,
    int rawLength,
    int validLength,
    long samplesDrawn,
    long pairsScored,
    long degenerateSkips,
    List<MatchRecord> matches,
    List<MatchRecord> topMatches,
    double maxCorrelation,
    double meanCorrelation,
    int strongMatches,
    double strongThreshold,
    int topN
) {

    public DetectionResult {
        searches = List.copyOf(searches);
        matches = List.copyOf(matches);
        topMatches = List.copyOf(topMatches);
    }

    /// Ranks the retained pairs and derives the summary scalars.
    public static DetectionResult of(
        DetectionStatus status,
        List<OffsetPolicy> searches,
        int rawLength,
        int validLength,
        long samplesDrawn,
        long pairsScored,
        long degenerateSkips,
        List<MatchRecord> retained,
        int topN,
        double strongThreshold
    ) {
        List<MatchRecord> ranked = MatchAggregator.rank(retained);
        double max = 0.0;
        double sum = 0.0;
        int strong = 0;
        for (MatchRecord match : ranked) {
            max = Math.max(max, match.magnitude());
            sum += match.correlation();
            if (match.magnitude() > strongThreshold) {
                strong++;
            }
        }
        double mean = ranked.isEmpty() ? 0.0 : sum / ranked.size();
        List<MatchRecord> top = ranked.subList(0, Math.min(topN, ranked.size()));
        return new DetectionResult(status, searches, rawLength, validLength, samplesDrawn, pairsScored,
            degenerateSkips, ranked, top, max, mean, strong, strongThreshold, topN);
    }

    /// A zero-match result for a field too short to hold two patches.
    public static DetectionResult insufficient(DetectionConfig config, Field field) {
        return of(DetectionStatus.INSUFFICIENT_DATA, List.of(config.offsetPolicy()), field.rawLength(),
            field.length(), 0, 0, 0, List.of(), config.topN(), config.strongThreshold());
    }

    /// @return the number of retained pairs
    public int matchCount() {
        return matches.size();
    }

    /// @return true when no pair was retained
    public boolean isEmpty() {
        return matches.isEmpty();
    }

    /// @return the t-test and angular bin counts over {@link #topMatches()}
    public SignificanceSummary significance() {
        return SignificanceTester.test(topMatches);
    }

    /// Combines runs over the same field into one ranking.
    ///
    /// Matches of all parts are re-ranked together; ties keep the order of the parts.
    /// Counters are summed, {@code topN} and {@code strongThreshold} come from the first
    /// part, and the status is {@code COMPLETED} if any part completed.
    ///
    /// @param parts results to combine, at least one
    /// @return the merged result
    public static DetectionResult merge(List<DetectionResult> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        DetectionResult first = parts.get(0);
        LinkedHashSet<OffsetPolicy> searches = new LinkedHashSet<>();
        List<MatchRecord> union = new ArrayList<>();
        DetectionStatus status = DetectionStatus.INSUFFICIENT_DATA;
        long samples = 0;
        long scored = 0;
        long skipped = 0;
        for (DetectionResult part : parts) {
            if (part.status() == DetectionStatus.COMPLETED) {
                status = DetectionStatus.COMPLETED;
            }
            searches.addAll(part.searches());
            union.addAll(part.matches());
            samples += part.samplesDrawn();
            scored += part.pairsScored();
            skipped += part.degenerateSkips();
        }
        return of(status, new ArrayList<>(searches), first.rawLength(), first.validLength(), samples, scored,
            skipped, union, first.topN(), first.strongThreshold());
    }

    /// @see #merge(List)
    public static DetectionResult merge(DetectionResult first, DetectionResult... rest) {
        List<DetectionResult> parts = new ArrayList<>();
        parts.add(first);
        parts.addAll(List.of(rest));
        return merge(parts);
    }
}
