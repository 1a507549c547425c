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

/// A decoded FITS primary array: its flat values, the layout they were decoded with, and
/// the header table they came from.
///
/// @param layout resolved layout
/// @param header parsed header cards
/// @param data flat element values, widened to double
public record FitsImage(FitsLayout layout, FitsHeader header, double[] data) {

    /// @return number of decoded elements
    public int size() {
        return data.length;
    }
}
