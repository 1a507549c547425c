/// Echo-correlation detection over a one-dimensional sampled field.
///
/// The field is treated as a closed domain mapped linearly onto 0 to 360 degrees. Patches
/// are sampled at random starts, paired with the patch a fixed offset away, and scored by
/// Pearson correlation. Pairs above a magnitude threshold are ranked and summarised.
///
/// ## Key Components
///
/// - {@link io.echoscan.engine.EchoDetectionEngine}: runs a search for one {@link io.echoscan.engine.DetectionConfig}
/// - {@link io.echoscan.engine.DetectionResult}: ranked matches, summary scalars and {@code merge}
/// - {@link io.echoscan.engine.sampling}: start sampling, offsets and boundary handling
/// - {@link io.echoscan.engine.stats}: correlation, angular bins and the t-test
///
/// ## Usage Example
///
/// ```java
/// DetectionConfig config = DetectionConfig.builder().patchSize(200).build();
/// DetectionResult result = new EchoDetectionEngine(config).detect(values);
/// SignificanceSummary summary = result.significance();
/// ```
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
