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
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/// Summary of a field's valid samples, printed before a search.
///
/// All values are NaN for an empty field.
///
/// @param count number of valid samples
/// @param mean sample mean
/// @param standardDeviation sample standard deviation
/// @param min smallest sample
/// @param max largest sample
public record FieldStatistics(long count, double mean, double standardDeviation, double min, double max) {

    public static FieldStatistics of(Field field) {
        SummaryStatistics stats = new SummaryStatistics();
        for (int i = 0; i < field.length(); i++) {
            stats.addValue(field.get(i));
        }
        return new FieldStatistics(
            stats.getN(), stats.getMean(), stats.getStandardDeviation(), stats.getMin(), stats.getMax());
    }
}
