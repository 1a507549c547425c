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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// Builds raw FITS byte images with arbitrary cards for reader tests.
final class FitsTestFiles {

    private FitsTestFiles() {
    }

    /// @return an 80-byte card image of {@code text}, space padded
    static String card(String text) {
        StringBuilder sb = new StringBuilder(text);
        while (sb.length() < FitsHeader.CARD_LENGTH) {
            sb.append(' ');
        }
        return sb.substring(0, FitsHeader.CARD_LENGTH);
    }

    /// Concatenates cards, pads to a whole block, then appends the payload verbatim.
    static byte[] image(byte[] payload, String... cards) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StringBuilder header = new StringBuilder();
        for (String c : cards) {
            header.append(card(c));
        }
        byte[] headerBytes = header.toString().getBytes(StandardCharsets.US_ASCII);
        byte[] block = new byte[(int) FitsLayout.roundToBlock(headerBytes.length)];
        Arrays.fill(block, (byte) ' ');
        System.arraycopy(headerBytes, 0, block, 0, headerBytes.length);
        out.writeBytes(block);
        out.writeBytes(payload);
        return out.toByteArray();
    }
}
