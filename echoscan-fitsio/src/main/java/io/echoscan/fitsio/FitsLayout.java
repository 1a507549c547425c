package io.echoscan.fitsio;

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

/// Declared and resolved layout of a FITS primary array.
///
/// @param elementCount number of elements decoded from the payload
/// @param axisCount declared {@code NAXIS}, 0 when absent
/// @param firstAxisLength declared {@code NAXIS1}, 0 when absent
/// @param bitsPerElement declared {@code BITPIX}, 0 when absent
/// @param elementType type used to decode the payload
/// @param headerBytes bytes occupied by the cards before block padding
/// @param dataOffset byte offset of the payload (header rounded up to a whole block)
public record FitsLayout(
    int elementCount,
    int axisCount,
    int firstAxisLength,
    int bitsPerElement,
    FitsElementType elementType,
    long headerBytes,
    long dataOffset
) {

    /// FITS logical record size; header and data both start on a multiple of this.
    public static final int BLOCK_SIZE = 2880;

    /// @param bytes a byte count
    /// @return {@code bytes} rounded up to the next multiple of {@link #BLOCK_SIZE}
    public static long roundToBlock(long bytes) {
        return ((bytes + BLOCK_SIZE - 1) / BLOCK_SIZE) * BLOCK_SIZE;
    }

    /// @return true when the declared code was not one of the supported types
    public boolean usedFallbackType() {
        return elementType.bitpix() != bitsPerElement;
    }
}
