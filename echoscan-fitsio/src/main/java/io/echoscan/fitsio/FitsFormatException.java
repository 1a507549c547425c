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

import java.io.IOException;

/// Raised when a FITS stream cannot be interpreted: the END card is missing, a header
/// value does not parse, or the payload is too short to hold a single element.
///
/// Any lower-level {@link IOException} met while reading is wrapped in this type, so
/// callers only need to handle one failure kind per source file.
public class FitsFormatException extends IOException {

    /// @param message description of the format problem
    public FitsFormatException(String message) {
        super(message);
    }

    /// @param message description of the format problem
    /// @param cause the underlying read failure
    public FitsFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
