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

/// One retained pair of correlated patches.
///
/// @param start1 start of the first patch
/// @param start2 start of the second patch, after the boundary policy was applied
/// @param correlation signed Pearson coefficient in {@code [-1, 1]}
/// @param offset nominal pairing offset in samples
/// @param angularSeparation {@code 360 * offset / N}, in {@code [0, 360)}
/// @param patchSize patch length P
public record MatchRecord(
    int start1,
    int start2,
    double correlation,
    int offset,
    double angularSeparation,
    int patchSize
) {

    /// @return {@code |correlation|}, the ranking key
    public double magnitude() {
        return Math.abs(correlation);
    }
}
