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
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RandomGeneratorsTest {

    @ParameterizedTest
    @EnumSource(RandomGenerators.Algorithm.class)
    @DisplayName("each algorithm should be reproducible from its seed")
    void reproducible(RandomGenerators.Algorithm algorithm) {
        UniformRandomProvider a = RandomGenerators.create(algorithm, 99L);
        UniformRandomProvider b = RandomGenerators.create(algorithm, 99L);

        for (int i = 0; i < 100; i++) {
            assertThat(a.nextLong()).isEqualTo(b.nextLong());
        }
    }

    @Test
    @DisplayName("distinct should yield a permutation when k equals the bound")
    void distinctFullPermutation() {
        int[] values = RandomGenerators.distinct(RandomGenerators.create(3L), 50, 50);

        assertThat(values).containsExactlyInAnyOrder(IntStream.range(0, 50).toArray());
    }

    @Test
    @DisplayName("distinct should validate its bounds")
    void distinctValidates() {
        UniformRandomProvider rng = RandomGenerators.create(3L);

        assertThatThrownBy(() -> RandomGenerators.distinct(rng, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RandomGenerators.distinct(rng, 5, 6)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RandomGenerators.distinct(rng, 5, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(RandomGenerators.distinct(rng, 5, 0)).isEmpty();
    }

    @Test
    @DisplayName("gaussian sampler should honour mean and sigma")
    void gaussianMoments() {
        ContinuousSampler sampler = RandomGenerators.createGaussianSampler(RandomGenerators.create(11L), 5.0, 2.0);
        int n = 200_000;
        double sum = 0;
        double sumSq = 0;
        for (int i = 0; i < n; i++) {
            double x = sampler.sample();
            sum += x;
            sumSq += x * x;
        }
        double mean = sum / n;
        double sd = Math.sqrt(sumSq / n - mean * mean);

        assertThat(mean).isBetween(4.95, 5.05);
        assertThat(sd).isBetween(1.95, 2.05);
    }
}
