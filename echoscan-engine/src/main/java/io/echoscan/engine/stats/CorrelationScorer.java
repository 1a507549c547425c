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

import java.util.OptionalDouble;

/**
 * Pearson correlation between equal-length patches, and the offset-to-angle map.
 *
 * <p>A patch with zero variance has no defined correlation. Such pairs come back
 * empty rather than as an error so the caller can skip and count them.
 */
public final class CorrelationScorer {

    /** Degrees in the full closed domain. */
    public static final double FULL_TURN_DEGREES = 360.0;

    private CorrelationScorer() {
        // Utility class
    }

    /**
     * Computes the Pearson linear correlation coefficient.
     *
     * @param a first patch
     * @param b second patch, same length as {@code a}
     * @return the coefficient clamped to {@code [-1, 1]}, or empty when either patch is
     *         constant, empty, or the result is not finite
     * @throws IllegalArgumentException if the lengths differ
     */
    public static OptionalDouble pearson(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Mismatched patch lengths: " + a.length + " vs " + b.length);
        }
        int n = a.length;
        if (n == 0 || isConstant(a) || isConstant(b)) {
            return OptionalDouble.empty();
        }

        double meanA = 0;
        double meanB = 0;
        for (int i = 0; i < n; i++) {
            meanA += a[i];
            meanB += b[i];
        }
        meanA /= n;
        meanB /= n;

        double sxx = 0;
        double syy = 0;
        double sxy = 0;
        for (int i = 0; i < n; i++) {
            double da = a[i] - meanA;
            double db = b[i] - meanB;
            sxx += da * da;
            syy += db * db;
            sxy += da * db;
        }
        if (sxx <= 0 || syy <= 0) {
            return OptionalDouble.empty();
        }

        double r = sxy / Math.sqrt(sxx * syy);
        if (!Double.isFinite(r)) {
            return OptionalDouble.empty();
        }
        // Clamp to [-1, 1]
        return OptionalDouble.of(Math.max(-1.0, Math.min(1.0, r)));
    }

    /**
     * Maps a pixel offset to an angular separation under the linear domain-to-angle map.
     *
     * @param offset offset in samples
     * @param length field length N, positive
     * @return {@code 360 * offset / N}, normalised into {@code [0, 360)}
     */
    public static double angularSeparation(long offset, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Field length must be positive: " + length);
        }
        double degrees = FULL_TURN_DEGREES * offset / length;
        degrees %= FULL_TURN_DEGREES;
        if (degrees < 0) {
            degrees += FULL_TURN_DEGREES;
        }
        return degrees >= FULL_TURN_DEGREES ? 0.0 : degrees;
    }

    /**
     * @param values a patch
     * @return true when every element equals the first
     */
    public static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) {
                return false;
            }
        }
        return true;
    }
}
