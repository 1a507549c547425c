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

import java.util.Optional;

/**
 * Named angular windows around the separations a toroidal topology predicts.
 * Both window ends are inclusive.
 */
public enum AngularBin {
    NEAR_90("near 90°", 85.0, 95.0),
    NEAR_180("near 180°", 175.0, 185.0),
    NEAR_270("near 270°", 265.0, 275.0);

    private final String label;
    private final double lowerDegrees;
    private final double upperDegrees;

    AngularBin(String label, double lowerDegrees, double upperDegrees) {
        this.label = label;
        this.lowerDegrees = lowerDegrees;
        this.upperDegrees = upperDegrees;
    }

    public String label() {
        return label;
    }

    public double lowerDegrees() {
        return lowerDegrees;
    }

    public double upperDegrees() {
        return upperDegrees;
    }

    /**
     * @param degrees an angular separation
     * @return true if {@code lower <= degrees <= upper}
     */
    public boolean contains(double degrees) {
        return degrees >= lowerDegrees && degrees <= upperDegrees;
    }

    /**
     * @param degrees an angular separation
     * @return the bin holding it, or empty when it falls between windows
     */
    public static Optional<AngularBin> classify(double degrees) {
        for (AngularBin bin : values()) {
            if (bin.contains(degrees)) {
                return Optional.of(bin);
            }
        }
        return Optional.empty();
    }
}
