package io.echoscan.engine.sampling;

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

import java.util.Collection;

/// How candidate pairing offsets are chosen.
public enum OffsetPolicy {

    /// Quarter, half and three-quarter wraps of the whole domain.
    FRACTIONAL_WRAP("fractional-wrap"),

    /// Caller-supplied angular shifts in degrees (toroidal search).
    EXPLICIT_ANGLES("explicit-angles");

    private final String label;

    OffsetPolicy(String label) {
        this.label = label;
    }

    /// @return short name used in reports
    public String label() {
        return label;
    }

    /// @param angles explicit shift angles, possibly null or empty
    /// @return {@link #FRACTIONAL_WRAP} when no angles are given, otherwise {@link #EXPLICIT_ANGLES}
    public static OffsetPolicy forAngles(Collection<Double> angles) {
        return (angles == null || angles.isEmpty()) ? FRACTIONAL_WRAP : EXPLICIT_ANGLES;
    }
}
