package io.echoscan.engine.sampling;

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

import java.util.List;

/**
 * Candidate pairing offsets for a field of length N.
 *
 * <p>Offsets are always in {@code [0, N)}. The angle of an offset is
 * {@code 360 * offset / N} degrees.
 */
public final class OffsetGenerator {

    private OffsetGenerator() {
        // Utility class
    }

    /**
     * Quarter, antipodal and three-quarter wraps.
     *
     * @param length field length N, positive
     * @return {@code [N/4, N/2, 3N/4]} using integer division
     */
    public static int[] fractionalWraps(int length) {
        requirePositive(length);
        return new int[]{
            length / 4,
            length / 2,
            (int) (3L * length / 4)
        };
    }

    /**
     * Converts explicit angles to offsets.
     *
     * @param length field length N, positive
     * @param anglesDegrees shift angles in degrees, any sign or magnitude
     * @return {@code round(N * angle / 360)} reduced into {@code [0, N)}, in input order
     */
    public static int[] fromAngles(int length, List<Double> anglesDegrees) {
        requirePositive(length);
        int[] offsets = new int[anglesDegrees.size()];
        for (int i = 0; i < offsets.length; i++) {
            double angle = anglesDegrees.get(i);
            if (!Double.isFinite(angle)) {
                throw new IllegalArgumentException("Shift angle must be finite: " + angle);
            }
            long raw = Math.round(length * angle / 360.0);
            offsets[i] = (int) Math.floorMod(raw, (long) length);
        }
        return offsets;
    }

    /**
     * Chooses offsets by {@link OffsetPolicy#forAngles}.
     *
     * @param length field length N
     * @param anglesDegrees explicit angles, or null/empty for fractional wraps
     * @return the offsets
     */
    public static int[] offsets(int length, List<Double> anglesDegrees) {
        return switch (OffsetPolicy.forAngles(anglesDegrees)) {
            case FRACTIONAL_WRAP -> fractionalWraps(length);
            case EXPLICIT_ANGLES -> fromAngles(length, anglesDegrees);
        };
    }

    private static void requirePositive(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Field length must be positive: " + length);
        }
    }
}
