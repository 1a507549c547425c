package io.echoscan.engine.synthetic;

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

/// A pattern planted twice in a synthetic field.
///
/// @param start1 start of the first copy
/// @param start2 start of the second copy
/// @param offset nominal offset between the copies
/// @param patchSize pattern length
public record PlantedEcho(int start1, int start2, int offset, int patchSize) {
}
