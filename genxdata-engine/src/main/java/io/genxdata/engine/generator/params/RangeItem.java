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
import io.genxdata.engine.generator.validation.WeightsValidator;

/// One weighted numeric range.
public record RangeItem(
    @JsonProperty("start") Number start,
    @JsonProperty("end") Number end,
    @JsonProperty("distribution") Number distribution
) {

    public RangeItem {
        start = start == null ? Integer.valueOf(10) : start;
        end = end == null ? Integer.valueOf(50) : end;
    }

    public boolean integral() {
        return NumericRangeValidator.isIntegral(start) && NumericRangeValidator.isIntegral(end);
    }

    void validate() {
        NumericRangeValidator.requireLessThan("start", start, "end", end);
        WeightsValidator.requireWeight("distribution", distribution);
    }
}
