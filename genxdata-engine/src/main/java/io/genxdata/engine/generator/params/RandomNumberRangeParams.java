package io.genxdata.engine.generator.params;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import io.genxdata.engine.generator.validation.NumericRangeValidator;

/**
 * Uniform numbers in {@code [start, end)}.
 *
 * @param start lower bound, inclusive
 * @param end upper bound, exclusive
 * @param step spacing of integer values
 * @param precision decimal places kept for non-integer ranges
 * @param unique whether values must be distinct
 */
public record RandomNumberRangeParams(
    @JsonProperty("start") Number start,
    @JsonProperty("end") Number end,
    @JsonProperty("step") Number step,
    @JsonProperty("precision") Integer precision,
    @JsonProperty("unique") Boolean unique
) implements StrategyParams {

    public RandomNumberRangeParams {
        start = start == null ? Integer.valueOf(0) : start;
        end = end == null ? Integer.valueOf(99) : end;
        step = step == null ? Integer.valueOf(1) : step;
        precision = precision == null ? 0 : precision;
        unique = unique != null && unique;
    }

    /// @return true when both bounds are integers, so integers are produced
    public boolean integral() {
        return NumericRangeValidator.isIntegral(start) && NumericRangeValidator.isIntegral(end);
    }

    @Override
    public void validate() {
        NumericRangeValidator.requireLessThan("start", start, "end", end);
        NumericRangeValidator.requirePositive("step", step);
        NumericRangeValidator.requireNonNegative("precision", precision);
    }
}
