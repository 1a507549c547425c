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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Collects scored pairs above a magnitude threshold and ranks them.
///
/// Ranking is by descending {@link MatchRecord#magnitude()}. The sort is stable, so
/// records of equal magnitude stay in the order they were offered. Nothing is
/// deduplicated; the same region may appear under several offsets.
public class MatchAggregator {

    /// Ranking order shared by the aggregator and {@link DetectionResult#merge}.
    public static final Comparator<MatchRecord> BY_MAGNITUDE_DESC =
        Comparator.comparingDouble(MatchRecord::magnitude).reversed();

    private final double minCorrelation;
    private final List<MatchRecord> retained = new ArrayList<>();
    private long offered;

    /// @param minCorrelation minimum {@code |r|} for a record to be kept, in {@code [0, 1]}
    public MatchAggregator(double minCorrelation) {
        if (!(minCorrelation >= 0.0 && minCorrelation <= 1.0)) {
            throw new IllegalArgumentException("minCorrelation must be in [0, 1]: " + minCorrelation);
        }
        this.minCorrelation = minCorrelation;
    }

    /// Keeps the record iff {@code |correlation| >= minCorrelation}.
    ///
    /// @param record a scored pair
    /// @return true if retained
    public boolean offer(MatchRecord record) {
        offered++;
        if (record.magnitude() >= minCorrelation) {
            retained.add(record);
            return true;
        }
        return false;
    }

    /// @return number of records offered so far
    public long offered() {
        return offered;
    }

    /// @return number of records retained so far
    public int size() {
        return retained.size();
    }

    public double minCorrelation() {
        return minCorrelation;
    }

    /// @return every retained record, best first
    public List<MatchRecord> ranked() {
        return rank(retained);
    }

    /// @param n maximum number of records
    /// @return the first {@code min(n, size())} ranked records
    public List<MatchRecord> top(int n) {
        List<MatchRecord> ranked = ranked();
        return List.copyOf(ranked.subList(0, Math.min(Math.max(n, 0), ranked.size())));
    }

    static List<MatchRecord> rank(List<MatchRecord> records) {
        List<MatchRecord> sorted = new ArrayList<>(records);
        // List.sort is a stable merge sort
        sorted.sort(BY_MAGNITUDE_DESC);
        return List.copyOf(sorted);
    }
}
