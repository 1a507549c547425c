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

import io.echoscan.engine.sampling.BoundaryPolicy;
import io.echoscan.engine.sampling.OffsetPolicy;

import java.util.List;
import java.util.Objects;

/// Immutable parameters of one detection run.
///
/// Use {@link #builder()} for the documented defaults:
///
/// | parameter          | default |
/// |--------------------|---------|
/// | patchSize          | 1000    |
/// | sampleCount        | 5000    |
/// | minCorrelation     | 0.1     |
/// | strongThreshold    | 0.2     |
/// | topN               | 20      |
/// | seed               | 42      |
/// | shiftAnglesDegrees | none    |
/// | boundaryPolicy     | CLAMP   |
///
/// @param patchSize patch length P, at least 2
/// @param sampleCount requested number of patch starts K, non-negative
/// @param minCorrelation magnitude threshold for retaining a pair, in {@code [0, 1]}
/// @param strongThreshold magnitude above which a match counts as strong, in {@code [0, 1]}
/// @param topN size of the reporting subset, non-negative
/// @param seed seed for start sampling
/// @param shiftAnglesDegrees explicit shift angles; empty selects the fractional wraps
/// @param boundaryPolicy how a paired patch past the array end is handled
public record DetectionConfig(
    int patchSize,
    int sampleCount,
    double minCorrelation,
    double strongThreshold,
    int topN,
    long seed,
    List<Double> shiftAnglesDegrees,
    BoundaryPolicy boundaryPolicy
) {

    public static final int DEFAULT_PATCH_SIZE = 1000;
    public static final int DEFAULT_SAMPLE_COUNT = 5000;
    public static final double DEFAULT_MIN_CORRELATION = 0.1;
    public static final double DEFAULT_STRONG_THRESHOLD = 0.2;
    public static final int DEFAULT_TOP_N = 20;
    public static final long DEFAULT_SEED = 42L;

    public DetectionConfig {
        if (patchSize < 2) {
            throw new IllegalArgumentException("patchSize must be at least 2: " + patchSize);
        }
        if (sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be non-negative: " + sampleCount);
        }
        requireUnit("minCorrelation", minCorrelation);
        requireUnit("strongThreshold", strongThreshold);
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be non-negative: " + topN);
        }
        shiftAnglesDegrees = shiftAnglesDegrees == null ? List.of() : List.copyOf(shiftAnglesDegrees);
        for (Double angle : shiftAnglesDegrees) {
            if (!Double.isFinite(angle)) {
                throw new IllegalArgumentException("Shift angles must be finite: " + shiftAnglesDegrees);
            }
        }
        Objects.requireNonNull(boundaryPolicy, "boundaryPolicy cannot be null");
    }

    /// @return the offset policy implied by {@link #shiftAnglesDegrees()}
    public OffsetPolicy offsetPolicy() {
        return OffsetPolicy.forAngles(shiftAnglesDegrees);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder pre-filled with this configuration
    public Builder toBuilder() {
        return new Builder()
            .patchSize(patchSize)
            .sampleCount(sampleCount)
            .minCorrelation(minCorrelation)
            .strongThreshold(strongThreshold)
            .topN(topN)
            .seed(seed)
            .shiftAnglesDegrees(shiftAnglesDegrees)
            .boundaryPolicy(boundaryPolicy);
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + value);
        }
    }

    /// Fluent builder; {@link #build()} validates.
    public static final class Builder {
        private int patchSize = DEFAULT_PATCH_SIZE;
        private int sampleCount = DEFAULT_SAMPLE_COUNT;
        private double minCorrelation = DEFAULT_MIN_CORRELATION;
        private double strongThreshold = DEFAULT_STRONG_THRESHOLD;
        private int topN = DEFAULT_TOP_N;
        private long seed = DEFAULT_SEED;
        private List<Double> shiftAnglesDegrees = List.of();
        private BoundaryPolicy boundaryPolicy = BoundaryPolicy.CLAMP;

        private Builder() {
        }

        public Builder patchSize(int patchSize) {
            this.patchSize = patchSize;
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder minCorrelation(double minCorrelation) {
            this.minCorrelation = minCorrelation;
            return this;
        }

        public Builder strongThreshold(double strongThreshold) {
            this.strongThreshold = strongThreshold;
            return this;
        }

        public Builder topN(int topN) {
            this.topN = topN;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder shiftAnglesDegrees(List<Double> shiftAnglesDegrees) {
            this.shiftAnglesDegrees = shiftAnglesDegrees;
            return this;
        }

        public Builder boundaryPolicy(BoundaryPolicy boundaryPolicy) {
            this.boundaryPolicy = boundaryPolicy;
            return this;
        }

        public DetectionConfig build() {
            return new DetectionConfig(patchSize, sampleCount, minCorrelation, strongThreshold, topN, seed,
                shiftAnglesDegrees, boundaryPolicy);
        }
    }
}
