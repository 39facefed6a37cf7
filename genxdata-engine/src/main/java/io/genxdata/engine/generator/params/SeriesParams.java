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

/// An arithmetic series {@code start, start + step, ...}.
public record SeriesParams(
    @JsonProperty("start") Number start,
    @JsonProperty("step") Number step
) implements StrategyParams {

    public SeriesParams {
        start = start == null ? Integer.valueOf(1) : start;
        step = step == null ? Integer.valueOf(1) : step;
    }

    public boolean integral() {
        return NumericRangeValidator.isIntegral(start) && NumericRangeValidator.isIntegral(step);
    }

    @Override
    public void validate() {
        NumericRangeValidator.requireNumber("start", start);
        NumericRangeValidator.requireNumber("step", step);
    }
}
