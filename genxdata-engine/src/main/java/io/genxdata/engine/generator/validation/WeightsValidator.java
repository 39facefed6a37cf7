package io.genxdata.engine.generator.validation;

/*
 * Copyright (c) nosqlbench
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

import io.genxdata.engine.errors.InvalidConfigParamException;

import java.math.BigDecimal;
import java.util.Collection;

/// Checks on categorical and range weights, which are percentages that must total 100.
public final class WeightsValidator {

    public static final BigDecimal TOTAL = BigDecimal.valueOf(100);

    private WeightsValidator() {
    }

    /// Requires a weight in {@code (0, 100]}.
    public static void requireWeight(String name, Number weight) {
        if (weight == null) {
            throw new InvalidConfigParamException(name, "Distribution weight (null) must be between 1 and 100");
        }
        BigDecimal value = NumericRangeValidator.toDecimal(weight);
        if (value.signum() <= 0 || value.compareTo(TOTAL) > 0) {
            throw new InvalidConfigParamException(name,
                "Distribution weight (" + weight + ") must be between 1 and 100");
        }
    }

    public static void requireTotal(String name, Collection<? extends Number> weights) {
        if (weights.isEmpty()) {
            throw new InvalidConfigParamException(name, "'" + name + "' must not be empty");
        }
        BigDecimal total = BigDecimal.ZERO;
        for (Number weight : weights) {
            requireWeight(name, weight);
            total = total.add(NumericRangeValidator.toDecimal(weight));
        }
        if (total.compareTo(TOTAL) != 0) {
            throw new InvalidConfigParamException(name,
                "Distribution weights must sum to 100, got " + total.stripTrailingZeros().toPlainString());
        }
    }
}
