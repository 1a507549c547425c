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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PatchSampler")
class PatchSamplerTest {

    @Nested
    @DisplayName("sampleStarts")
    class SampleStarts {

        @Test
        @DisplayName("should return the same starts for the same seed")
        void deterministicForSeed() {
            int[] first = new PatchSampler(42).sampleStarts(12288, 1000, 5000);
            int[] second = new PatchSampler(42).sampleStarts(12288, 1000, 5000);

            assertThat(first).hasSize(5000).containsExactly(second);
        }

        @Test
        @DisplayName("should draw different starts for different seeds")
        void seedChangesStarts() {
            int[] a = new PatchSampler(1).sampleStarts(1_000_000, 100, 50);
            int[] b = new PatchSampler(2).sampleStarts(1_000_000, 100, 50);

            assertThat(a).isNotEqualTo(b);
        }

        @Test
        @DisplayName("should draw distinct starts inside [0, N - P]")
        void distinctAndInRange() {
            int[] starts = new PatchSampler(7).sampleStarts(5000, 1200, 3000);

            assertThat(starts).hasSize(3000).doesNotHaveDuplicates();
            assertThat(Arrays.stream(starts).min().getAsInt()).isGreaterThanOrEqualTo(0);
            assertThat(Arrays.stream(starts).max().getAsInt()).isLessThanOrEqualTo(5000 - 1200);
        }

        @Test
        @DisplayName("should clamp the count to the number of valid starts")
        void clampsCount() {
            int[] starts = new PatchSampler(42).sampleStarts(10, 4, 100);

            assertThat(starts).hasSize(7).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6);
        }

        @Test
        @DisplayName("should return nothing for zero samples or a patch longer than the field")
        void emptyCases() {
            PatchSampler sampler = new PatchSampler(42);

            assertThat(sampler.sampleStarts(100, 10, 0)).isEmpty();
            assertThat(sampler.sampleStarts(100, 10, -3)).isEmpty();
            assertThat(sampler.sampleStarts(5, 10, 10)).isEmpty();
        }

        @Test
        @DisplayName("should reject a non-positive patch size")
        void rejectsBadPatchSize() {
            assertThatThrownBy(() -> new PatchSampler(42).sampleStarts(100, 0, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("patchSize");
        }
    }

    @Test
    @DisplayName("should count valid starts as N - P + 1")
    void validStartCount() {
        assertThat(PatchSampler.validStartCount(10, 4)).isEqualTo(7);
        assertThat(PatchSampler.validStartCount(4, 4)).isEqualTo(1);
        assertThat(PatchSampler.validStartCount(3, 4)).isZero();
    }
}
