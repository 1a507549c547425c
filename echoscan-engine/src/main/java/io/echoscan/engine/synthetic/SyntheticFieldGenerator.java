package io.echoscan.engine.synthetic;

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
import io.echoscan.engine.sampling.PatchSampler;
import io.echoscan.engine.sampling.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds test fields with known echoes.
 * <p>
 * One generator owns one seeded random stream, so a fixed seed and a fixed sequence of
 * calls reproduce the same fields and planted positions.
 */
public class SyntheticFieldGenerator {

    private static final Logger logger = LogManager.getLogger(SyntheticFieldGenerator.class);

    private final UniformRandomProvider rng;
    private final ContinuousSampler unitNormal;

    /**
     * @param seed seed for every draw made by this generator
     */
    public SyntheticFieldGenerator(long seed) {
        this.rng = RandomGenerators.create(seed);
        this.unitNormal = RandomGenerators.createGaussianSampler(rng, 0.0, 1.0);
    }

    /**
     * Draws i.i.d. normal noise.
     *
     * @param length number of samples
     * @param sigma standard deviation, non-negative
     * @return the samples
     */
    public double[] gaussian(int length, double sigma) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        if (!(sigma >= 0.0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("sigma must be finite and non-negative: " + sigma);
        }
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = sigma * unitNormal.sample();
        }
        return values;
    }

    /**
     * Adds {@code pairs} echo pairs to {@code field} in place. Each pair gets its own
     * unit-variance random pattern, scaled by {@code strength} and added at a random start
     * and again {@code offset} samples later. A second copy that would run past the end is
     * pulled back to end at the last sample.
     *
     * @param field the field to modify
     * @param patchSize pattern length, at most half the field
     * @param pairs number of pairs, clamped to the number of distinct starts
     * @param strength pattern amplitude
     * @param offset offset between the two copies, in {@code [0, N)}
     * @return the planted pairs in planting order
     */
    public List<PlantedEcho> plantEchoes(double[] field, int patchSize, int pairs, double strength, int offset) {
        int length = field.length;
        if (patchSize <= 0 || 2L * patchSize > length) {
            throw new IllegalArgumentException(
                "patchSize must be in [1, " + (length / 2) + "] for a field of " + length + ": " + patchSize);
        }
        if (offset < 0 || offset >= length) {
            throw new IllegalArgumentException("offset must be in [0, " + length + "): " + offset);
        }
        int available = PatchSampler.validStartCount(length, patchSize);
        int count = Math.min(Math.max(pairs, 0), available);
        int[] starts = RandomGenerators.distinct(rng, available, count);

        List<PlantedEcho> planted = new ArrayList<>(count);
        for (int start1 : starts) {
            int start2 = BoundaryPolicy.CLAMP.pairedStart(start1, offset, length, patchSize);
            for (int j = 0; j < patchSize; j++) {
                double value = strength * unitNormal.sample();
                field[start1 + j] += value;
                field[start2 + j] += value;
            }
            planted.add(new PlantedEcho(start1, start2, offset, patchSize));
        }
        logger.debug("Planted {} echo pairs at offset {}", planted.size(), offset);
        return planted;
    }
}
