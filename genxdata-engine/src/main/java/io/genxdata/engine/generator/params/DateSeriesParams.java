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
import io.genxdata.engine.errors.InvalidConfigParamException;
import io.genxdata.engine.generator.validation.DateRangeValidator;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A contiguous series of dates.
 *
 * @param freq step between values: an optional multiplier and one of {@code s}, {@code min}
 *     (or {@code T}), {@code h}, {@code D}, {@code B} (business days), {@code W}, {@code M}
 *     (or {@code MS}), {@code Y} (or {@code A})
 */
public record DateSeriesParams(
    @JsonProperty("start_date") String startDate,
    @JsonProperty("freq") String freq,
    @JsonProperty("format") String format,
    @JsonProperty("output_format") String outputFormat
) implements StrategyParams {

    private static final Pattern FREQUENCY = Pattern.compile("^\\s*(\\d*)\\s*([A-Za-z]+)\\s*$");

    /// A parsed frequency.
    public enum Unit { SECOND, MINUTE, HOUR, DAY, BUSINESS_DAY, WEEK, MONTH, YEAR }

    public record Frequency(int multiplier, Unit unit) {
    }

    public DateSeriesParams {
        startDate = startDate == null ? "2024-01-01" : startDate;
        freq = freq == null || freq.isBlank() ? "D" : freq;
        format = format == null ? "%Y-%m-%d" : format;
        outputFormat = outputFormat == null || outputFormat.isBlank() ? format : outputFormat;
    }

    public LocalDateTime start() {
        return DateRangeValidator.parseDate("start_date", startDate, format);
    }

    public Frequency frequency() {
        Matcher matcher = FREQUENCY.matcher(freq);
        if (!matcher.matches()) {
            throw new InvalidConfigParamException("freq", "Invalid frequency '" + freq + "'");
        }
        int multiplier = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
        if (multiplier <= 0) {
            throw new InvalidConfigParamException("freq", "Frequency multiplier must be positive in '" + freq + "'");
        }
        String unit = matcher.group(2);
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "s":
                return new Frequency(multiplier, Unit.SECOND);
            case "min":
            case "t":
                return new Frequency(multiplier, Unit.MINUTE);
            case "h":
                return new Frequency(multiplier, Unit.HOUR);
            case "d":
                return new Frequency(multiplier, Unit.DAY);
            case "b":
                return new Frequency(multiplier, Unit.BUSINESS_DAY);
            case "w":
                return new Frequency(multiplier, Unit.WEEK);
            case "m":
            case "ms":
                return new Frequency(multiplier, Unit.MONTH);
            case "y":
            case "ys":
            case "a":
            case "as":
                return new Frequency(multiplier, Unit.YEAR);
            default:
                throw new InvalidConfigParamException("freq", "Unsupported frequency unit '" + unit + "' in '" + freq + "'");
        }
    }

    @Override
    public void validate() {
        start();
        frequency();
        DateRangeValidator.requireFormat("output_format", outputFormat);
    }
}
