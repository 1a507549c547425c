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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/// Writes a flat array as a single-HDU FITS file that {@link FitsArrayReader} reads back.
///
/// ```
/// SIMPLE  =                    T
/// BITPIX  =                  -64
/// NAXIS   =                    1
/// NAXIS1  =                 4000
/// END
/// <spaces to 2880> <big-endian values> <zeros to 2880>
/// ```
public class FitsArrayWriter {

    private static final Logger logger = LogManager.getLogger(FitsArrayWriter.class);

    private final FitsElementType elementType;

    /// @param elementType encoding for the payload
    public FitsArrayWriter(FitsElementType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType cannot be null");
    }

    /// Creates a writer that stores 64-bit floats.
    public FitsArrayWriter() {
        this(FitsElementType.FLOAT64);
    }

    /// Writes {@code data} to {@code path}, replacing any existing file.
    ///
    /// @param path destination
    /// @param data values to store
    /// @throws IOException if the file cannot be written
    public void write(Path path, double[] data) throws IOException {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            write(out, data);
        }
        logger.info("Wrote {} values as {} to {}", data.length, elementType, path);
    }

    /// Writes header and payload to a stream. The stream is flushed but not closed.
    ///
    /// @param out destination stream
    /// @param data values to store
    /// @throws IOException if the stream rejects the write
    public void write(OutputStream out, double[] data) throws IOException {
        Objects.requireNonNull(data, "data cannot be null");
        out.write(header(data.length));

        ByteBuffer buffer = ByteBuffer.allocate(data.length * elementType.width()).order(ByteOrder.BIG_ENDIAN);
        for (double value : data) {
            elementType.write(buffer, value);
        }
        out.write(buffer.array());

        int padding = (int) (FitsLayout.roundToBlock(buffer.capacity()) - buffer.capacity());
        out.write(new byte[padding]);
        out.flush();
    }

    /// Renders the padded header block for an array of {@code length} elements.
    ///
    /// @param length element count written as NAXIS1
    /// @return header bytes, a whole number of blocks long
    public byte[] header(int length) {
        StringBuilder sb = new StringBuilder();
        sb.append(card("SIMPLE", "T"));
        sb.append(card(FitsArrayReader.BITPIX, Integer.toString(elementType.bitpix())));
        sb.append(card(FitsArrayReader.NAXIS, "1"));
        sb.append(card(FitsArrayReader.NAXIS1, Integer.toString(length)));
        sb.append(pad(FitsHeader.END_KEYWORD));

        byte[] cards = sb.toString().getBytes(StandardCharsets.US_ASCII);
        byte[] block = new byte[(int) FitsLayout.roundToBlock(cards.length)];
        Arrays.fill(block, (byte) ' ');
        System.arraycopy(cards, 0, block, 0, cards.length);
        return block;
    }

    static String card(String key, String value) {
        return pad(String.format(Locale.ROOT, "%-8s= %20s", key, value));
    }

    private static String pad(String text) {
        return String.format(Locale.ROOT, "%-" + FitsHeader.CARD_LENGTH + "s", text);
    }
}
