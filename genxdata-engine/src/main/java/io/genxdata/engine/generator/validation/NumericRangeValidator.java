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
import java.math.BigInteger;

/// Checks on numeric parameters.
public final class NumericRangeValidator {

    private NumericRangeValidator() {
    }

    public static Number requireNumber(String name, Number value) {
        if (value == null) {
            throw new InvalidConfigParamException(name, "'" + name + "' must be a number");
        }
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidConfigParamException(name, "'" + name + "' must be finite, got " + value);
            }
        }
        return value;
    }

    /// Requires {@code lower < upper}.
    public static void requireLessThan(String lowerName, Number lower, String upperName, Number upper) {
        requireNumber(lowerName, lower);
        requireNumber(upperName, upper);
        if (toDecimal(lower).compareTo(toDecimal(upper)) >= 0) {
            throw new InvalidConfigParamException(lowerName,
                "'" + lowerName + "' (" + lower + ") must be less than '" + upperName + "' (" + upper + ")");
        }
    }

    public static void requirePositive(String name, Number value) {
        requireNumber(name, value);
        if (toDecimal(value).signum() <= 0) {
            throw new InvalidConfigParamException(name, "'" + name + "' must be positive, got " + value);
        }
    }

    public static void requireNonNegative(String name, Number value) {
        requireNumber(name, value);
        if (toDecimal(value).signum() < 0) {
            throw new InvalidConfigParamException(name, "'" + name + "' cannot be negative, got " + value);
        }
    }

    /// @return true for integral boxed types
    public static boolean isIntegral(Number value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger;
    }

    public static BigDecimal toDecimal(Number value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(value.doubleValue());
        }
        return new BigDecimal(value.toString());
    }
}
