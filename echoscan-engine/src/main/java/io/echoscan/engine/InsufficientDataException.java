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

/// Thrown when a field holds fewer than twice the patch size in valid samples.
///
/// {@link EchoDetectionEngine} converts this into a zero-match result with status
/// {@link DetectionStatus#INSUFFICIENT_DATA}; callers of the engine never see it.
public class InsufficientDataException extends RuntimeException {

    private final int validLength;
    private final int patchSize;

    /// @param validLength number of finite samples in the field
    /// @param patchSize requested patch size
    public InsufficientDataException(int validLength, int patchSize) {
        super("Not enough valid data for analysis: " + validLength
            + " valid samples, need at least " + (2L * patchSize) + " for patch size " + patchSize);
        this.validLength = validLength;
        this.patchSize = patchSize;
    }

    /// @return number of finite samples in the field
    public int getValidLength() {
        return validLength;
    }

    /// @return requested patch size
    public int getPatchSize() {
        return patchSize;
    }
}
