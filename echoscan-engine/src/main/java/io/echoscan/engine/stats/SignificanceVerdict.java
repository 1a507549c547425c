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

/**
 * Display bands for a p-value. The thresholds are fixed report policy and are
 * an annotation on the output, not a scientific conclusion.
 */
public enum SignificanceVerdict {
    HIGHLY_SIGNIFICANT("highly significant (p < 0.001)"),
    SIGNIFICANT("significant (p < 0.05)"),
    NOT_SIGNIFICANT("not significant"),
    UNDEFINED("undefined (too few or all-zero magnitudes)");

    /** Upper bound (exclusive) of the highly significant band. */
    public static final double HIGHLY_SIGNIFICANT_P = 0.001;
    /** Upper bound (exclusive) of the significant band. */
    public static final double SIGNIFICANT_P = 0.05;

    private final String label;

    SignificanceVerdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @param pValue a two-sided p-value, possibly NaN
     * @return the band it falls in
     */
    public static SignificanceVerdict of(double pValue) {
        if (Double.isNaN(pValue)) {
            return UNDEFINED;
        }
        if (pValue < HIGHLY_SIGNIFICANT_P) {
            return HIGHLY_SIGNIFICANT;
        }
        if (pValue < SIGNIFICANT_P) {
            return SIGNIFICANT;
        }
        return NOT_SIGNIFICANT;
    }
}
