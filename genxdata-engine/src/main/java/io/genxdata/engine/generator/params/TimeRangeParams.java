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

/// Uniform times of day between two bounds; a start after the end wraps past midnight.
public record TimeRangeParams(
    @JsonProperty("start_time") String startTime,
    @JsonProperty("end_time") String endTime,
    @JsonProperty("format") String format,
    @JsonProperty("output_format") String outputFormat
) implements StrategyParams {

    public TimeRangeParams {
        startTime = startTime == null ? "00:00:00" : startTime;
        endTime = endTime == null ? "23:59:59" : endTime;
        format = format == null ? "%H:%M:%S" : format;
        outputFormat = outputFormat == null || outputFormat.isBlank() ? "%H:%M:%S" : outputFormat;
    }

    @Override
    public void validate() {
        DateRangeValidator.requireTimeRange("start_time", startTime, "end_time", endTime, format);
        DateRangeValidator.requireFormat("output_format", outputFormat);
    }
}
