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

import io.echoscan.engine.MatchRecord;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.inference.TTest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One-sample t-test of correlation magnitudes against a population mean of zero,
 * together with angular bin counts.
 * <p>
 * Magnitudes are non-negative, so this tests whether any correlation is present
 * at all. It does not test for echoes at particular angles; the bin counts are
 * reported alongside for that reading.
 * <p>
 * Callers pass the top-N reporting subset. The test never throws: with fewer than
 * two magnitudes, or when every magnitude is zero, the statistic and p-value are
 * NaN and the verdict is {@link SignificanceVerdict#UNDEFINED}. Identical non-zero
 * magnitudes give an infinite statistic and a p-value of 0.
 */
public final class SignificanceTester {

    private static final Logger logger = LogManager.getLogger(SignificanceTester.class);

    private static final TTest T_TEST = new TTest();

    private SignificanceTester() {
    }

    public static SignificanceSummary test(List<MatchRecord> matches) {
        Map<AngularBin, Integer> bins = new EnumMap<>(AngularBin.class);
        SummaryStatistics stats = new SummaryStatistics();
        double[] magnitudes = new double[matches.size()];
        for (int i = 0; i < magnitudes.length; i++) {
            MatchRecord match = matches.get(i);
            magnitudes[i] = match.magnitude();
            stats.addValue(magnitudes[i]);
            AngularBin.classify(match.angularSeparation()).ifPresent(bin -> bins.merge(bin, 1, Integer::sum));
        }

        double mean = magnitudes.length == 0 ? Double.NaN : stats.getMean();
        double t = Double.NaN;
        double p = Double.NaN;
        if (magnitudes.length < 2) {
            logger.debug("Significance undefined for {} magnitude(s)", magnitudes.length);
        } else if (stats.getMax() == 0.0) {
            logger.debug("Significance undefined: all {} magnitudes are zero", magnitudes.length);
        } else {
            t = T_TEST.t(0.0, stats);
            p = T_TEST.tTest(0.0, stats);
        }
        return new SignificanceSummary(magnitudes.length, mean, t, p, bins, SignificanceVerdict.of(p));
    }
}
