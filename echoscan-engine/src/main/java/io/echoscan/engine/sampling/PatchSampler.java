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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Draws reproducible patch start positions.
///
/// Starts are drawn uniformly without replacement from {@code [0, N - P]}. A fresh
/// generator is seeded on every call, so the same seed and arguments always return the
/// same starts in the same order.
public class PatchSampler {

    private static final Logger logger = LogManager.getLogger(PatchSampler.class);

    private final long seed;

    /// @param seed seed for every draw made by this sampler
    public PatchSampler(long seed) {
        this.seed = seed;
    }

    /// @return the seed
    public long seed() {
        return seed;
    }

    /// Number of distinct starts that fit a patch of {@code patchSize} in {@code length}.
    ///
    /// @param length field length N
    /// @param patchSize patch size P
    /// @return {@code max(0, N - P + 1)}
    public static int validStartCount(int length, int patchSize) {
        return Math.max(0, length - patchSize + 1);
    }

    /// Draws start indices.
    ///
    /// @param length field length N
    /// @param patchSize patch size P, positive
    /// @param samples requested count K; clamped to the number of valid starts
    /// @return {@code min(K, N - P + 1)} distinct starts in draw order
    public int[] sampleStarts(int length, int patchSize, int samples) {
        if (patchSize <= 0) {
            throw new IllegalArgumentException("patchSize must be positive: " + patchSize);
        }
        int available = validStartCount(length, patchSize);
        int k = Math.min(Math.max(samples, 0), available);
        if (k < samples) {
            logger.debug("Requested {} samples but only {} starts fit; clamping", samples, available);
        }
        if (k == 0) {
            return new int[0];
        }
        UniformRandomProvider rng = RandomGenerators.create(seed);
        return RandomGenerators.distinct(rng, available, k);
    }
}
