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
import io.echoscan.engine.stats.AngularBin;
import io.echoscan.engine.stats.SignificanceSummary;
import io.echoscan.engine.stats.SignificanceVerdict;
import io.echoscan.engine.synthetic.SyntheticFieldGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("EchoDetectionEngine")
class EchoDetectionEngineTest {

    /// Noise of length 4000 with one pattern copied at 0 and again at 1000 (90 degrees).
    private static double[] quarterEchoField() {
        SyntheticFieldGenerator generator = new SyntheticFieldGenerator(5L);
        double[] field = generator.gaussian(4000, 1.0);
        double[] pattern = generator.gaussian(200, 1.0);
        System.arraycopy(pattern, 0, field, 0, 200);
        System.arraycopy(pattern, 0, field, 1000, 200);
        return field;
    }

    private static DetectionConfig.Builder config() {
        return DetectionConfig.builder().patchSize(200).minCorrelation(0.1);
    }

    @Nested
    @DisplayName("detection")
    class Detection {

        @Test
        @DisplayName("should find a copied pattern at a quarter wrap")
        void findsQuarterEcho() {
            EchoDetectionEngine engine = new EchoDetectionEngine(config().build());
            DetectionResult result = engine.detect(Field.of(quarterEchoField()), new int[]{0});

            assertThat(result.status()).isEqualTo(DetectionStatus.COMPLETED);
            assertThat(result.searches()).containsExactly(OffsetPolicy.FRACTIONAL_WRAP);
            assertThat(result.samplesDrawn()).isEqualTo(1);
            assertThat(result.pairsScored()).isEqualTo(3);
            MatchRecord best = result.topMatches().get(0);
            assertThat(best.start1()).isZero();
            assertThat(best.start2()).isEqualTo(1000);
            assertThat(best.offset()).isEqualTo(1000);
            assertThat(best.correlation()).isCloseTo(1.0, within(1e-9));
            assertThat(best.angularSeparation()).isEqualTo(90.0);
            assertThat(best.patchSize()).isEqualTo(200);
            assertThat(result.maxCorrelation()).isCloseTo(1.0, within(1e-9));
            assertThat(result.strongMatches()).isGreaterThanOrEqualTo(1);
        }

        @Test
        @DisplayName("should find nothing in pure noise at a high threshold")
        void noiseAtHighThreshold() {
            double[] noise = new SyntheticFieldGenerator(9L).gaussian(10_000, 1.0);
            DetectionConfig cfg = DetectionConfig.builder().minCorrelation(0.9).sampleCount(500).build();
            DetectionResult result = new EchoDetectionEngine(cfg).detect(noise);

            assertThat(result.status()).isEqualTo(DetectionStatus.COMPLETED);
            assertThat(result.samplesDrawn()).isEqualTo(500);
            assertThat(result.pairsScored()).isEqualTo(1500);
            assertThat(result.isEmpty()).isTrue();
            assertThat(result.maxCorrelation()).isZero();
            assertThat(result.meanCorrelation()).isZero();
            assertThat(result.strongMatches()).isZero();

            SignificanceSummary significance = result.significance();
            assertThat(significance.sampleSize()).isZero();
            assertThat(significance.pValue()).isNaN();
            assertThat(significance.verdict()).isEqualTo(SignificanceVerdict.UNDEFINED);
        }

        @Test
        @DisplayName("exact copies in a silent field should be highly significant")
        void exactCopiesInSilentField() {
            double[] field = new double[4000];
            double[] pattern = new SyntheticFieldGenerator(21L).gaussian(200, 1.0);
            System.arraycopy(pattern, 0, field, 0, 200);
            System.arraycopy(pattern, 0, field, 1000, 200);
            int[] everyStart = IntStream.rangeClosed(0, 3800).toArray();

            DetectionResult result = new EchoDetectionEngine(config().build()).detect(Field.of(field), everyStart);

            assertThat(result.topMatches()).hasSize(20).allSatisfy(m -> {
                assertThat(m.correlation()).isCloseTo(1.0, within(1e-9));
                assertThat(m.angularSeparation()).isEqualTo(90.0);
            });
            SignificanceSummary significance = result.significance();
            assertThat(significance.sampleSize()).isEqualTo(20);
            assertThat(significance.pValue()).isLessThan(SignificanceVerdict.HIGHLY_SIGNIFICANT_P);
            assertThat(significance.verdict()).isEqualTo(SignificanceVerdict.HIGHLY_SIGNIFICANT);
            assertThat(significance.count(AngularBin.NEAR_90)).isEqualTo(20);
        }

        @Test
        @DisplayName("should be deterministic for a fixed seed")
        void deterministic() {
            double[] noise = new SyntheticFieldGenerator(3L).gaussian(6000, 1.0);
            DetectionConfig cfg = config().sampleCount(300).build();

            DetectionResult first = new EchoDetectionEngine(cfg).detect(noise);
            DetectionResult second = new EchoDetectionEngine(cfg).detect(noise);

            assertThat(first.matches()).isNotEmpty().isEqualTo(second.matches());
            assertThat(first.meanCorrelation()).isEqualTo(second.meanCorrelation());
        }

        @Test
        @DisplayName("should keep every pair when the threshold is zero")
        void zeroThresholdKeepsAll() {
            double[] noise = new SyntheticFieldGenerator(4L).gaussian(2000, 1.0);
            DetectionConfig cfg = config().minCorrelation(0.0).sampleCount(40).topN(5).build();
            DetectionResult result = new EchoDetectionEngine(cfg).detect(noise);

            assertThat(result.matchCount()).isEqualTo(120);
            assertThat(result.topMatches()).hasSize(5).isEqualTo(result.matches().subList(0, 5));
            double mean = result.matches().stream().mapToDouble(MatchRecord::correlation).average().orElseThrow();
            assertThat(result.meanCorrelation()).isCloseTo(mean, within(1e-12));
        }

        @Test
        @DisplayName("explicit angles should replace the fractional wraps")
        void explicitAngles() {
            double[] noise = new SyntheticFieldGenerator(6L).gaussian(3600, 1.0);
            DetectionConfig cfg = config().minCorrelation(0.0).shiftAnglesDegrees(List.of(120.0)).build();
            DetectionResult result = new EchoDetectionEngine(cfg).detect(Field.of(noise), new int[]{0, 100});

            assertThat(result.searches()).containsExactly(OffsetPolicy.EXPLICIT_ANGLES);
            assertThat(result.matches()).hasSize(2)
                .allSatisfy(m -> {
                    assertThat(m.offset()).isEqualTo(1200);
                    assertThat(m.angularSeparation()).isEqualTo(120.0);
                });
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCases {

        @Test
        @DisplayName("a field shorter than two patches should yield an insufficient-data result")
        void insufficientData() {
            double[] raw = new double[500];
            Arrays.fill(raw, 0, 150, Double.NaN);
            DetectionResult result = new EchoDetectionEngine(config().build()).detect(raw);

            assertThat(result.status()).isEqualTo(DetectionStatus.INSUFFICIENT_DATA);
            assertThat(result.rawLength()).isEqualTo(500);
            assertThat(result.validLength()).isEqualTo(350);
            assertThat(result.isEmpty()).isTrue();
            assertThat(result.samplesDrawn()).isZero();
        }

        @Test
        @DisplayName("constant patches should be skipped and counted")
        void degeneratePairs() {
            DetectionResult result = new EchoDetectionEngine(config().patchSize(100).build())
                .detect(Field.of(new double[1000]), new int[]{0, 100});

            assertThat(result.degenerateSkips()).isEqualTo(6);
            assertThat(result.pairsScored()).isZero();
            assertThat(result.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("boundary policy should decide where an overrunning pair starts")
        void boundaryPolicies() {
            double[] noise = new SyntheticFieldGenerator(8L).gaussian(1000, 1.0);
            DetectionConfig.Builder builder = config().patchSize(100).minCorrelation(0.0).shiftAnglesDegrees(List.of(90.0));

            MatchRecord clamped = new EchoDetectionEngine(builder.boundaryPolicy(BoundaryPolicy.CLAMP).build())
                .detect(Field.of(noise), new int[]{700}).matches().get(0);
            MatchRecord wrapped = new EchoDetectionEngine(builder.boundaryPolicy(BoundaryPolicy.WRAP).build())
                .detect(Field.of(noise), new int[]{700}).matches().get(0);

            assertThat(clamped.start2()).isEqualTo(900);
            assertThat(wrapped.start2()).isEqualTo(950);
            assertThat(clamped.angularSeparation()).isEqualTo(90.0);
            assertThat(wrapped.angularSeparation()).isEqualTo(90.0);
        }

        @Test
        @DisplayName("wrap should correlate a pattern split across the seam")
        void wrapAcrossSeam() {
            SyntheticFieldGenerator generator = new SyntheticFieldGenerator(12L);
            double[] field = generator.gaussian(1000, 1.0);
            double[] pattern = generator.gaussian(100, 1.0);
            System.arraycopy(pattern, 0, field, 200, 100);
            // (200 + 750) mod 1000 = 950: fifty samples at the end, fifty at the start
            System.arraycopy(pattern, 0, field, 950, 50);
            System.arraycopy(pattern, 50, field, 0, 50);
            DetectionConfig cfg = config().patchSize(100).shiftAnglesDegrees(List.of(270.0))
                .boundaryPolicy(BoundaryPolicy.WRAP).build();

            DetectionResult result = new EchoDetectionEngine(cfg).detect(Field.of(field), new int[]{200});

            assertThat(result.matches().get(0).correlation()).isCloseTo(1.0, within(1e-9));
            assertThat(result.matches().get(0).angularSeparation()).isEqualTo(270.0);
        }

        @Test
        @DisplayName("starts outside [0, N - P] should be rejected")
        void rejectsBadStarts() {
            EchoDetectionEngine engine = new EchoDetectionEngine(config().build());
            Field field = Field.of(new double[1000]);

            assertThatThrownBy(() -> engine.detect(field, new int[]{801}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        }
    }

    @Test
    @DisplayName("merge should re-rank the union and sum the counters")
    void merge() {
        double[] field = quarterEchoField();
        DetectionResult fractional = new EchoDetectionEngine(config().sampleCount(50).build()).detect(field);
        DetectionResult toroidal = new EchoDetectionEngine(
            config().sampleCount(25).shiftAnglesDegrees(List.of(90.0, 180.0, 120.0)).build())
            .detect(Field.of(field), new int[]{0});

        DetectionResult merged = DetectionResult.merge(fractional, toroidal);

        assertThat(merged.searches()).containsExactly(OffsetPolicy.FRACTIONAL_WRAP, OffsetPolicy.EXPLICIT_ANGLES);
        assertThat(merged.samplesDrawn()).isEqualTo(51);
        assertThat(merged.pairsScored()).isEqualTo(fractional.pairsScored() + toroidal.pairsScored());
        assertThat(merged.matchCount()).isEqualTo(fractional.matchCount() + toroidal.matchCount());
        assertThat(merged.matches()).isSortedAccordingTo(MatchAggregator.BY_MAGNITUDE_DESC);
        assertThat(merged.topMatches().get(0).correlation()).isCloseTo(1.0, within(1e-9));
        assertThat(merged.topN()).isEqualTo(20);
        assertThatThrownBy(() -> DetectionResult.merge(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
