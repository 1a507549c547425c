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
import io.echoscan.engine.sampling.OffsetGenerator;
import io.echoscan.engine.sampling.PatchSampler;
import io.echoscan.engine.stats.CorrelationScorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/// Searches a field for pairs of patches that correlate across a fixed offset.
///
/// ```
/// raw -> Field (valid samples) -> starts (PatchSampler)
///     -> for each start, for each offset: pair -> Pearson r -> MatchAggregator
///     -> DetectionResult (ranked, top-N, summary scalars)
/// ```
///
/// The engine is single-threaded and holds no state between calls; identical inputs and
/// configuration give identical results.
public class EchoDetectionEngine {

    private static final Logger logger = LogManager.getLogger(EchoDetectionEngine.class);

    /// Starts between debug progress lines.
    static final int PROGRESS_INTERVAL = 500;

    private final DetectionConfig config;

    public EchoDetectionEngine(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public DetectionConfig config() {
        return config;
    }

    /// Filters the raw samples and runs a sampled search.
    ///
    /// @param raw samples, possibly containing NaN or infinities
    /// @return the result; status {@code INSUFFICIENT_DATA} when too few samples are valid
    public DetectionResult detect(double[] raw) {
        return detect(Field.of(raw));
    }

    /// Runs a sampled search over a filtered field.
    public DetectionResult detect(Field field) {
        if (!hasCapacity(field)) {
            return DetectionResult.insufficient(config, field);
        }
        PatchSampler sampler = new PatchSampler(config.seed());
        int[] starts = sampler.sampleStarts(field.length(), config.patchSize(), config.sampleCount());
        return detect(field, starts);
    }

    /// Runs the search from caller-chosen starts, in the given order.
    ///
    /// @param field the filtered field
    /// @param starts first-patch starts, each in {@code [0, N - P]}
    /// @return the result
    /// @throws IllegalArgumentException if a start is out of range
    public DetectionResult detect(Field field, int[] starts) {
        if (!hasCapacity(field)) {
            return DetectionResult.insufficient(config, field);
        }
        int length = field.length();
        int patchSize = config.patchSize();
        BoundaryPolicy boundary = config.boundaryPolicy();
        for (int start : starts) {
            if (start < 0 || start > length - patchSize) {
                throw new IllegalArgumentException(
                    "Start " + start + " out of range [0, " + (length - patchSize) + "]");
            }
        }

        int[] offsets = OffsetGenerator.offsets(length, config.shiftAnglesDegrees());
        logger.info("Scanning {} starts x {} offsets {} (patch size {}, {} boundary) over {} valid samples",
            starts.length, offsets.length, Arrays.toString(offsets), patchSize, boundary, length);

        MatchAggregator aggregator = new MatchAggregator(config.minCorrelation());
        long scored = 0;
        long degenerate = 0;
        for (int i = 0; i < starts.length; i++) {
            if (i > 0 && i % PROGRESS_INTERVAL == 0) {
                logger.debug("Processed {}/{} starts, {} matches so far", i, starts.length, aggregator.size());
            }
            int start1 = starts[i];
            double[] patch1 = field.window(start1, patchSize);
            for (int offset : offsets) {
                int start2 = boundary.pairedStart(start1, offset, length, patchSize);
                double[] patch2 = boundary.readsCircularly()
                    ? field.wrappedWindow(start2, patchSize)
                    : field.window(start2, patchSize);
                OptionalDouble r = CorrelationScorer.pearson(patch1, patch2);
                if (r.isEmpty()) {
                    degenerate++;
                    continue;
                }
                scored++;
                aggregator.offer(new MatchRecord(start1, start2, r.getAsDouble(), offset,
                    CorrelationScorer.angularSeparation(offset, length), patchSize));
            }
        }
        if (degenerate > 0) {
            logger.debug("Skipped {} pairs with a zero-variance patch", degenerate);
        }

        DetectionResult result = DetectionResult.of(DetectionStatus.COMPLETED, List.of(config.offsetPolicy()),
            field.rawLength(), length, starts.length, scored, degenerate, aggregator.ranked(), config.topN(),
            config.strongThreshold());
        logger.info("Found {} matches ({} strong) from {} scored pairs",
            result.matchCount(), result.strongMatches(), scored);
        return result;
    }

    private boolean hasCapacity(Field field) {
        try {
            field.requireCapacity(config.patchSize());
            return true;
        } catch (InsufficientDataException e) {
            logger.warn(e.getMessage());
            return false;
        }
    }
}
