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

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/// Checks on date and time parameters.
public final class DateRangeValidator {

    private DateRangeValidator() {
    }

    public static void requireFormat(String name, String format) {
        TextPatternValidator.requireNonBlank(name, format);
        try {
            DateFormats.parser(format);
            DateFormats.printer(format);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigParamException(name, "Invalid date format '" + format + "': " + e.getMessage(), e);
        }
    }

    public static LocalDateTime parseDate(String name, String value, String format) {
        requireFormat("format", format);
        TextPatternValidator.requireNonBlank(name, value);
        try {
            return DateFormats.parseDateTime(value, format);
        } catch (DateTimeParseException e) {
            throw new InvalidConfigParamException(name,
                "Invalid date format for " + name + " '" + value + "'. Expected " + format, e);
        }
    }

    public static LocalTime parseTime(String name, String value, String format) {
        requireFormat("format", format);
        TextPatternValidator.requireNonBlank(name, value);
        try {
            return DateFormats.parseTime(value, format);
        } catch (DateTimeParseException e) {
            throw new InvalidConfigParamException(name,
                "Invalid time format for " + name + " '" + value + "'. Expected " + format, e);
        }
    }

    /// Requires the start date to lie strictly before the end date.
    public static void requireDateRange(String startName, String start, String endName, String end, String format) {
        LocalDateTime from = parseDate(startName, start, format);
        LocalDateTime to = parseDate(endName, end, format);
        if (!from.isBefore(to)) {
            throw new InvalidConfigParamException(startName,
                "Start date (" + start + ") must be before end date (" + end + ")");
        }
    }

    /**
     * Requires distinct start and end times. A start after the end describes a range that
     * wraps past midnight and is accepted.
     */
    public static void requireTimeRange(String startName, String start, String endName, String end, String format) {
        LocalTime from = parseTime(startName, start, format);
        LocalTime to = parseTime(endName, end, format);
        if (from.equals(to)) {
            throw new InvalidConfigParamException(startName,
                "Start time (" + start + ") must be before end time (" + end + ")");
        }
    }
}
