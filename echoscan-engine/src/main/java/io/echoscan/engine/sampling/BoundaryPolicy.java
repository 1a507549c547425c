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

import java.util.Locale;

/// What happens when the paired patch would run past the end of the stored array.
///
/// ```
/// N = 10, P = 4, start1 = 5, offset = 3  ->  start1 + offset = 8
///
/// CLAMP: start2 = N - P = 6   reads [6, 7, 8, 9]
/// WRAP:  start2 = 8           reads [8, 9, 0, 1]
/// ```
///
/// {@code CLAMP} is the reference behavior. It shortens the effective offset for late
/// starts, which biases those pairs; {@code WRAP} treats the domain as truly circular.
public enum BoundaryPolicy {

    /// Pull the second patch back so it ends at the last stored sample.
    CLAMP {
        @Override
        public int pairedStart(int start1, int offset, int length, int patchSize) {
            int start2 = wrapped(start1, offset, length);
            if (start2 + patchSize > length) {
                start2 = length - patchSize;
            }
            return start2;
        }
    },

    /// Keep the wrapped start; the second patch reads across the seam.
    WRAP {
        @Override
        public int pairedStart(int start1, int offset, int length, int patchSize) {
            return wrapped(start1, offset, length);
        }
    };

    /// Computes the start of the second patch of a pair.
    ///
    /// @param start1 start of the first patch
    /// @param offset pairing offset in samples
    /// @param length field length N
    /// @param patchSize patch size P
    /// @return start of the second patch
    public abstract int pairedStart(int start1, int offset, int length, int patchSize);

    /// @return true if the second patch may cross the end of the array
    public boolean readsCircularly() {
        return this == WRAP;
    }

    /// Parses a policy name case-insensitively.
    ///
    /// @param name {@code clamp} or {@code wrap}
    /// @return the policy
    public static BoundaryPolicy parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown boundary policy '" + name + "', expected clamp or wrap", e);
        }
    }

    private static int wrapped(int start1, int offset, int length) {
        return (int) (((long) start1 + offset) % length);
    }
}
