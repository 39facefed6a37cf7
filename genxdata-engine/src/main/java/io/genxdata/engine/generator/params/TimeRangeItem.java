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
import io.genxdata.engine.generator.validation.DateRangeValidator;
import io.genxdata.engine.generator.validation.WeightsValidator;

/// One weighted time-of-day range.
public record TimeRangeItem(
    @JsonProperty("start") String start,
    @JsonProperty("end") String end,
    @JsonProperty("format") String format,
    @JsonProperty("distribution") Number distribution
) {

    public TimeRangeItem {
        start = start == null ? "00:00:00" : start;
        end = end == null ? "23:59:59" : end;
        format = format == null ? "%H:%M:%S" : format;
    }

    void validate() {
        DateRangeValidator.requireTimeRange("start", start, "end", end, format);
        WeightsValidator.requireWeight("distribution", distribution);
    }
}
