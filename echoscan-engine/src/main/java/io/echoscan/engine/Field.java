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

import java.util.Arrays;
import java.util.Objects;

/// A sampled scalar field over a closed domain, stored as a flat sequence.
///
/// Non-finite samples are dropped when the field is built, so every index in
/// {@code [0, length())} holds a finite value. Index {@code length()} is conceptually
/// index 0 again; {@link #wrappedWindow(int, int)} reads across that seam while
/// {@link #window(int, int)} stays inside the stored array.
public final class Field {

    private final double[] values;
    private final int rawLength;

    private Field(double[] values, int rawLength) {
        this.values = values;
        this.rawLength = rawLength;
    }

    /// Builds a field from raw samples, discarding NaN and infinite entries in order.
    ///
    /// @param raw the raw samples, not modified
    /// @return the filtered field
    public static Field of(double[] raw) {
        Objects.requireNonNull(raw, "raw samples cannot be null");
        double[] valid = Arrays.stream(raw).filter(Double::isFinite).toArray();
        return new Field(valid, raw.length);
    }

    /// @return number of samples before filtering
    public int rawLength() {
        return rawLength;
    }

    /// @return number of valid samples, N
    public int length() {
        return values.length;
    }

    /// @return number of samples removed by the validity filter
    public int invalidCount() {
        return rawLength - values.length;
    }

    /// @param index sample index in {@code [0, length())}
    /// @return the sample value
    public double get(int index) {
        return values[index];
    }

    /// @return a copy of the valid samples
    public double[] values() {
        return values.clone();
    }

    /// Copies the contiguous patch starting at {@code start}.
    ///
    /// @param start first index
    /// @param size patch length
    /// @return the patch
    /// @throws IndexOutOfBoundsException if the patch does not fit inside the array
    public double[] window(int start, int size) {
        Objects.checkFromIndexSize(start, size, values.length);
        return Arrays.copyOfRange(values, start, start + size);
    }

    /// Copies a patch reading circularly, so indices past the end continue at 0.
    ///
    /// @param start first index in {@code [0, length())}
    /// @param size patch length, at most {@code length()}
    /// @return the patch
    public double[] wrappedWindow(int start, int size) {
        Objects.checkIndex(start, values.length);
        if (size < 0 || size > values.length) {
            throw new IndexOutOfBoundsException("Patch size " + size + " out of range for length " + values.length);
        }
        double[] patch = new double[size];
        int head = Math.min(size, values.length - start);
        System.arraycopy(values, start, patch, 0, head);
        System.arraycopy(values, 0, patch, head, size - head);
        return patch;
    }

    /// Checks that the field can hold two disjoint patches of {@code patchSize}.
    ///
    /// @param patchSize requested patch size
    /// @throws InsufficientDataException if {@code length() < 2 * patchSize}
    public void requireCapacity(int patchSize) {
        if ((long) values.length < 2L * patchSize) {
            throw new InsufficientDataException(values.length, patchSize);
        }
    }

    @Override
    public String toString() {
        return "Field{length=" + values.length + ", rawLength=" + rawLength + "}";
    }
}
