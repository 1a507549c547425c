/// Minimal FITS primary-array access.
///
/// Only what is needed to pull one flat numeric array out of a FITS file is supported:
/// fixed 80-byte header cards terminated by {@code END}, 2880-byte block alignment, and
/// big-endian payloads selected by {@code BITPIX}.
///
/// ## Key Components
///
/// - {@link io.echoscan.fitsio.FitsArrayReader}: decode a file or stream into a {@link io.echoscan.fitsio.FitsImage}
/// - {@link io.echoscan.fitsio.FitsHeader}: keyed, typed access to header card values
/// - {@link io.echoscan.fitsio.FitsElementType}: the BITPIX code table
/// - {@link io.echoscan.fitsio.FitsArrayWriter}: write a flat array as a single-HDU file
///
/// ## Usage Example
///
/// ```java
/// FitsImage image = new FitsArrayReader().read(Path.of("map.fits"));
/// double[] values = image.data();
/// ```
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
