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

/// One weighted date range.
public record DateRangeItem(
    @JsonProperty("start_date") String startDate,
    @JsonProperty("end_date") String endDate,
    @JsonProperty("format") String format,
    @JsonProperty("output_format") String outputFormat,
    @JsonProperty("distribution") Number distribution
) {

    public DateRangeItem {
        startDate = startDate == null ? "2020-01-01" : startDate;
        endDate = endDate == null ? "2020-12-31" : endDate;
        format = format == null ? "%Y-%m-%d" : format;
        outputFormat = outputFormat == null || outputFormat.isBlank() ? format : outputFormat;
    }

    void validate() {
        DateRangeValidator.requireDateRange("start_date", startDate, "end_date", endDate, format);
        DateRangeValidator.requireFormat("output_format", outputFormat);
        WeightsValidator.requireWeight("distribution", distribution);
    }
}
