package io.echoscan.engine.stats;

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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only projection of a detection result's reporting subset.
 *
 * @param sampleSize number of correlation magnitudes tested
 * @param meanMagnitude mean absolute correlation, NaN when the subset is empty
 * @param tStatistic one-sample t statistic against mean 0, NaN when undefined
 * @param pValue two-sided p-value, NaN when undefined
 * @param binCounts count of matches in each angular window; every bin is present
 * @param verdict display band for {@code pValue}
 */
public record SignificanceSummary(
    int sampleSize,
    double meanMagnitude,
    double tStatistic,
    double pValue,
    Map<AngularBin, Integer> binCounts,
    SignificanceVerdict verdict
) {

    public SignificanceSummary {
        EnumMap<AngularBin, Integer> counts = new EnumMap<>(AngularBin.class);
        for (AngularBin bin : AngularBin.values()) {
            counts.put(bin, binCounts.getOrDefault(bin, 0));
        }
        binCounts = Collections.unmodifiableMap(counts);
    }

    /**
     * @param bin an angular window
     * @return matches counted in that window
     */
    public int count(AngularBin bin) {
        return binCounts.get(bin);
    }

    /**
     * @return matches falling in any of the predicted windows
     */
    public int atPredictedAngles() {
        return binCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * @return true when a p-value could be computed
     */
    public boolean isDefined() {
        return verdict != SignificanceVerdict.UNDEFINED;
    }
}
