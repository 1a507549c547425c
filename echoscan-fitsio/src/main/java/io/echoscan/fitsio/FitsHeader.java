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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/// Keyed view over the 80-byte cards of a FITS header.
///
/// A card contributes an entry when it has the form {@code KEY = value / comment}, where
/// {@code KEY} is a single token. The value runs from the {@code =} to the first {@code /}
/// that is outside a quoted string. Keys match exactly after trimming; whitespace around
/// the key, the {@code =} and the value is ignored. When a key repeats, the last card wins.
///
/// ```
/// NAXIS   =                    1 / number of data axes
/// ^^^^^     ^^^^^^^^^^^^^^^^^^^^   ^^^^^^^^^^^^^^^^^^^^
///  key             value               comment (dropped)
/// ```
public final class FitsHeader {

    /// Fixed card width in bytes.
    public static final int CARD_LENGTH = 80;

    /// Keyword that terminates the header.
    public static final String END_KEYWORD = "END";

    private final Map<String, String> values;
    private final int cardCount;

    private FitsHeader(Map<String, String> values, int cardCount) {
        this.values = values;
        this.cardCount = cardCount;
    }

    /// Builds a header table from raw card text, including the terminating END card.
    ///
    /// @param cards the card images in file order
    /// @return the parsed table
    public static FitsHeader parse(List<String> cards) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String card : cards) {
            int eq = card.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = card.substring(0, eq).trim();
            if (key.isEmpty() || containsWhitespace(key)) {
                continue;
            }
            values.put(key, stripComment(card.substring(eq + 1)).trim());
        }
        return new FitsHeader(Collections.unmodifiableMap(values), cards.size());
    }

    /// @return true when the card image begins with the END keyword
    public static boolean isEndCard(String card) {
        return card.startsWith(END_KEYWORD)
            && (card.length() == END_KEYWORD.length() || card.charAt(END_KEYWORD.length()) == ' ');
    }

    /// @param key the exact keyword
    /// @return true if a card declares this key
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /// Returns the textual value, with surrounding quotes and trailing blanks removed for
    /// string literals.
    ///
    /// @param key the exact keyword
    /// @return the value, or empty if the key is absent
    public Optional<String> getString(String key) {
        String raw = values.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        if (raw.length() >= 2 && raw.startsWith("'") && raw.endsWith("'")) {
            return Optional.of(raw.substring(1, raw.length() - 1).replace("''", "'").stripTrailing());
        }
        return Optional.of(raw);
    }

    /// @param key the exact keyword
    /// @return the integer value, or empty if the key is absent
    /// @throws FitsFormatException if the key is present but its value is not an integer
    public OptionalInt getInt(String key) throws FitsFormatException {
        String raw = values.get(key);
        if (raw == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            throw new FitsFormatException("Header value for " + key + " is not an integer: '" + raw + "'", e);
        }
    }

    /// @param key the exact keyword
    /// @param fallback value returned when the key is absent
    /// @return the integer value or the fallback
    /// @throws FitsFormatException if the key is present but its value is not an integer
    public int getInt(String key, int fallback) throws FitsFormatException {
        return getInt(key).orElse(fallback);
    }

    /// @return number of cards read, including the END card
    public int cardCount() {
        return cardCount;
    }

    /// @return declared keys in first-seen order
    public Set<String> keys() {
        return values.keySet();
    }

    private static String stripComment(String valueField) {
        boolean quoted = false;
        for (int i = 0; i < valueField.length(); i++) {
            char c = valueField.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == '/' && !quoted) {
                return valueField.substring(0, i);
            }
        }
        return valueField;
    }

    private static boolean containsWhitespace(String key) {
        for (int i = 0; i < key.length(); i++) {
            if (Character.isWhitespace(key.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "FitsHeader{cards=" + cardCount + ", keys=" + values.keySet() + "}";
    }
}
