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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.GaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Seeded random sources for sampling and synthetic data.
 * Every generator is created from an explicit seed so that independent runs with the
 * same seed draw identical sequences; no process-wide generator exists.
 */
public final class RandomGenerators {

    /**
     * PRNG algorithms available to callers.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ - 256-bit state, the default.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * SplitMix64 - 64-bit state.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister, for comparison with MT-based reference runs.
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a generator with the given algorithm and seed.
     *
     * @param algorithm the PRNG algorithm
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a generator with the default algorithm (XO_SHI_RO_256_PP).
     *
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Creates a normal sampler with the given mean and standard deviation.
     *
     * @param rng the random number generator
     * @param mean distribution mean
     * @param sigma standard deviation
     * @return a Gaussian sampler
     */
    public static ContinuousSampler createGaussianSampler(UniformRandomProvider rng, double mean, double sigma) {
        return GaussianSampler.of(ZigguratSampler.NormalizedGaussian.of(rng), mean, sigma);
    }

    /**
     * Draws {@code k} distinct integers from {@code [0, bound)} using Floyd's algorithm.
     * Runs in O(k) time and space regardless of {@code bound}. The result is in draw
     * order and is identical for identical generator state.
     *
     * @param rng the random number generator
     * @param bound exclusive upper bound, must be positive
     * @param k number of values, {@code 0 <= k <= bound}
     * @return the distinct values
     */
    public static int[] distinct(UniformRandomProvider rng, int bound, int k) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        if (k < 0 || k > bound) {
            throw new IllegalArgumentException("k must be in [0, " + bound + "]: " + k);
        }
        Set<Integer> chosen = new LinkedHashSet<>(Math.max(16, k * 2));
        for (int j = bound - k; j < bound; j++) {
            int t = rng.nextInt(j + 1);
            if (!chosen.add(t)) {
                chosen.add(j);
            }
        }
        int[] result = new int[k];
        int i = 0;
        for (int value : chosen) {
            result[i++] = value;
        }
        return result;
    }
}
