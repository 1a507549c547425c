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

import java.nio.ByteBuffer;
import java.util.Optional;

/// Element encodings selected by the {@code BITPIX} header code. All payloads are big-endian.
public enum FitsElementType {

    /// {@code BITPIX = -32}
    FLOAT32(-32, 4) {
        @Override
        double read(ByteBuffer buffer) {
            return buffer.getFloat();
        }

        @Override
        void write(ByteBuffer buffer, double value) {
            buffer.putFloat((float) value);
        }
    },

    /// {@code BITPIX = -64}
    FLOAT64(-64, 8) {
        @Override
        double read(ByteBuffer buffer) {
            return buffer.getDouble();
        }

        @Override
        void write(ByteBuffer buffer, double value) {
            buffer.putDouble(value);
        }
    },

    /// {@code BITPIX = 32}
    INT32(32, 4) {
        @Override
        double read(ByteBuffer buffer) {
            return buffer.getInt();
        }

        @Override
        void write(ByteBuffer buffer, double value) {
            buffer.putInt((int) Math.round(value));
        }
    };

    private final int bitpix;
    private final int width;

    FitsElementType(int bitpix, int width) {
        this.bitpix = bitpix;
        this.width = width;
    }

    /// @return the header code for this type
    public int bitpix() {
        return bitpix;
    }

    /// @return element width in bytes
    public int width() {
        return width;
    }

    abstract double read(ByteBuffer buffer);

    abstract void write(ByteBuffer buffer, double value);

    /// Looks up the type for a header code without applying the fallback.
    ///
    /// @param bitpix the declared code
    /// @return the matching type, or empty when the code is not one of the supported three
    public static Optional<FitsElementType> lookup(int bitpix) {
        for (FitsElementType type : values()) {
            if (type.bitpix == bitpix) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /// Resolves a header code, falling back to {@link #FLOAT32} for anything unrecognized.
    ///
    /// @param bitpix the declared code
    /// @return the resolved type
    public static FitsElementType forBitpix(int bitpix) {
        return lookup(bitpix).orElse(FLOAT32);
    }
}
