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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Date and time patterns for strategy parameters.
 *
 * <p>Patterns containing {@code %} are strftime patterns ({@code %Y-%m-%d}) and are
 * translated; anything else is a {@link DateTimeFormatter} pattern. Parsing accepts
 * non-padded fields ({@code 2020-1-31}), formatting always pads.
 */
public final class DateFormats {

    private static final Map<String, DateTimeFormatter> PARSERS = new ConcurrentHashMap<>();
    private static final Map<String, DateTimeFormatter> PRINTERS = new ConcurrentHashMap<>();

    private DateFormats() {
    }

    /// @throws IllegalArgumentException for unknown directives or invalid patterns
    public static DateTimeFormatter parser(String pattern) {
        return PARSERS.computeIfAbsent(pattern, p -> DateTimeFormatter.ofPattern(translate(p, true), Locale.ENGLISH));
    }

    /// @throws IllegalArgumentException for unknown directives or invalid patterns
    public static DateTimeFormatter printer(String pattern) {
        return PRINTERS.computeIfAbsent(pattern, p -> DateTimeFormatter.ofPattern(translate(p, false), Locale.ENGLISH));
    }

    /// Parses a date, a date-time, or a time; missing parts default to midnight and 1900-01-01.
    public static LocalDateTime parseDateTime(String text, String pattern) {
        TemporalAccessor parsed = parser(pattern).parse(text.trim());
        LocalDate date = parsed.query(TemporalQueries.localDate());
        LocalTime time = parsed.query(TemporalQueries.localTime());
        return LocalDateTime.of(date != null ? date : LocalDate.of(1900, 1, 1),
            time != null ? time : LocalTime.MIDNIGHT);
    }

    public static LocalTime parseTime(String text, String pattern) {
        return parseDateTime(text, pattern).toLocalTime();
    }

    public static String format(LocalDateTime value, String pattern) {
        return printer(pattern).format(value);
    }

    static String translate(String pattern, boolean forParsing) {
        if (pattern.indexOf('%') < 0) {
            return pattern;
        }
        StringBuilder out = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        boolean afterDirective = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%') {
                literal.append(c);
                afterDirective = false;
                continue;
            }
            if (i + 1 >= pattern.length()) {
                throw new IllegalArgumentException("Dangling '%' at end of pattern '" + pattern + "'");
            }
            char directive = pattern.charAt(++i);
            if (directive == '%') {
                literal.append('%');
                afterDirective = false;
                continue;
            }
            flushLiteral(out, literal);
            // digits run together when directives touch, so widths must be fixed
            boolean adjacent = afterDirective || i + 1 < pattern.length() && pattern.charAt(i + 1) == '%';
            boolean variableWidth = forParsing && !adjacent;
            out.append(directive(directive, variableWidth, pattern));
            afterDirective = true;
        }
        flushLiteral(out, literal);
        return out.toString();
    }

    private static String directive(char directive, boolean variableWidth, String pattern) {
        switch (directive) {
            case 'Y':
                return "yyyy";
            case 'y':
                return "yy";
            case 'm':
                return variableWidth ? "M" : "MM";
            case 'd':
                return variableWidth ? "d" : "dd";
            case 'H':
                return variableWidth ? "H" : "HH";
            case 'I':
                return variableWidth ? "h" : "hh";
            case 'M':
                return variableWidth ? "m" : "mm";
            case 'S':
                return variableWidth ? "s" : "ss";
            case 'f':
                return "SSSSSS";
            case 'p':
                return "a";
            case 'b':
                return "MMM";
            case 'B':
                return "MMMM";
            case 'a':
                return "EEE";
            case 'A':
                return "EEEE";
            case 'j':
                return "DDD";
            default:
                throw new IllegalArgumentException("Unsupported directive '%" + directive + "' in pattern '" + pattern + "'");
        }
    }

    private static void flushLiteral(StringBuilder out, StringBuilder literal) {
        if (literal.length() == 0) {
            return;
        }
        out.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }
}
