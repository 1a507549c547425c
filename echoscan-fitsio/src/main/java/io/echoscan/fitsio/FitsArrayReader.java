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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Reads the primary array of a FITS file as a flat sequence of doubles.
///
/// Only the parts of the format needed to locate and decode one flat array are handled:
///
/// ```
/// ┌──────────────────────────────┐
/// │ 80-byte cards ... END        │  read until a card starts with END
/// │ (padded to 2880-byte block)  │
/// ├──────────────────────────────┤ ← dataOffset = roundToBlock(cards * 80)
/// │ big-endian payload           │  BITPIX picks float32 / float64 / int32
/// │ ... to end of stream         │  truncated to NAXIS1 when declared
/// └──────────────────────────────┘
/// ```
///
/// Every failure, including plain I/O errors, surfaces as {@link FitsFormatException}.
public class FitsArrayReader {

    private static final Logger logger = LogManager.getLogger(FitsArrayReader.class);

    /// Axis count keyword.
    public static final String NAXIS = "NAXIS";
    /// First axis extent keyword.
    public static final String NAXIS1 = "NAXIS1";
    /// Bits-per-element keyword.
    public static final String BITPIX = "BITPIX";

    /// Creates a reader. Readers hold no state between calls.
    public FitsArrayReader() {
    }

    /// Reads a FITS file from disk.
    ///
    /// @param path the file to read
    /// @return the decoded image
    /// @throws FitsFormatException if the file cannot be read or interpreted
    public FitsImage read(Path path) throws FitsFormatException {
        Objects.requireNonNull(path, "path cannot be null");
        logger.debug("Reading FITS file: {}", path);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return read(in);
        } catch (FitsFormatException e) {
            throw new FitsFormatException(path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FitsFormatException("Failed to read FITS file " + path + ": " + e.getMessage(), e);
        }
    }

    /// Reads a FITS stream. The stream is consumed to its end but not closed.
    ///
    /// @param in the stream positioned at the first header card
    /// @return the decoded image
    /// @throws FitsFormatException if the stream cannot be read or interpreted
    public FitsImage read(InputStream in) throws FitsFormatException {
        Objects.requireNonNull(in, "input stream cannot be null");
        try {
            List<String> cards = readCards(in);
            FitsHeader header = FitsHeader.parse(cards);

            int axisCount = header.getInt(NAXIS, 0);
            int firstAxisLength = header.getInt(NAXIS1, 0);
            int bitpix = header.getInt(BITPIX, 0);
            FitsElementType type = FitsElementType.forBitpix(bitpix);
            if (FitsElementType.lookup(bitpix).isEmpty()) {
                logger.warn("Unrecognized BITPIX {}; decoding payload as {}", bitpix, type);
            }
            logger.debug("FITS info: NAXIS={}, NAXIS1={}, BITPIX={}", axisCount, firstAxisLength, bitpix);

            long headerBytes = (long) cards.size() * FitsHeader.CARD_LENGTH;
            long dataOffset = FitsLayout.roundToBlock(headerBytes);
            skipFully(in, dataOffset - headerBytes);

            byte[] payload = in.readAllBytes();
            int available = payload.length / type.width();
            if (available < 1) {
                throw new FitsFormatException("Insufficient payload: " + payload.length
                    + " bytes after offset " + dataOffset + ", need at least " + type.width());
            }
            int count = (firstAxisLength > 0) ? Math.min(firstAxisLength, available) : available;

            double[] data = new double[count];
            ByteBuffer buffer = ByteBuffer.wrap(payload).order(ByteOrder.BIG_ENDIAN);
            for (int i = 0; i < count; i++) {
                data[i] = type.read(buffer);
            }

            FitsLayout layout = new FitsLayout(count, axisCount, firstAxisLength, bitpix, type, headerBytes, dataOffset);
            logger.info("Read {} data points ({} from {} header cards)", count, type, cards.size());
            return new FitsImage(layout, header, data);
        } catch (FitsFormatException e) {
            throw e;
        } catch (IOException e) {
            throw new FitsFormatException("Failed to read FITS stream: " + e.getMessage(), e);
        }
    }

    private List<String> readCards(InputStream in) throws IOException {
        List<String> cards = new ArrayList<>();
        byte[] card = new byte[FitsHeader.CARD_LENGTH];
        while (true) {
            int n = in.readNBytes(card, 0, card.length);
            if (n == 0) {
                throw new FitsFormatException("Header terminator END not found after " + cards.size() + " cards");
            }
            if (n < card.length) {
                throw new FitsFormatException("Truncated header card #" + (cards.size() + 1)
                    + ": " + n + " of " + card.length + " bytes");
            }
            String text = new String(card, StandardCharsets.US_ASCII);
            cards.add(text);
            if (FitsHeader.isEndCard(text)) {
                return cards;
            }
        }
    }

    private void skipFully(InputStream in, long bytes) throws IOException {
        long remaining = bytes;
        while (remaining > 0) {
            long skipped = in.skip(remaining);
            if (skipped <= 0) {
                if (in.read() < 0) {
                    return;
                }
                skipped = 1;
            }
            remaining -= skipped;
        }
    }
}
