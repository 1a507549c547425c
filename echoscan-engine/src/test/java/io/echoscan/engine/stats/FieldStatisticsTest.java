package io.echoscan.engine.stats;

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

import io.echoscan.engine.Field;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldStatisticsTest {

    @Test
    void summarisesValidSamples() {
        FieldStatistics stats = FieldStatistics.of(Field.of(new double[]{1, 2, Double.NaN, 3, 4}));

        assertEquals(4, stats.count());
        assertEquals(2.5, stats.mean());
        assertEquals(Math.sqrt(5.0 / 3.0), stats.standardDeviation(), 1e-12);
        assertEquals(1.0, stats.min());
        assertEquals(4.0, stats.max());
    }

    @Test
    void emptyFieldIsNaN() {
        FieldStatistics stats = FieldStatistics.of(Field.of(new double[0]));

        assertEquals(0, stats.count());
        assertTrue(Double.isNaN(stats.mean()));
        assertTrue(Double.isNaN(stats.max()));
    }
}
