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

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Checks on textual parameters: regular expressions, required strings and enumerated options.
public final class TextPatternValidator {

    private TextPatternValidator() {
    }

    public static Pattern requireRegex(String name, String regex) {
        requireNonBlank(name, regex);
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidConfigParamException(name, "Invalid regular expression: " + regex, e);
        }
    }

    public static String requireNonBlank(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigParamException(name, "'" + name + "' must be provided");
        }
        return value;
    }

    /// @return the value lower-cased, when it is one of the allowed options
    public static String requireOneOf(String name, String value, Collection<String> allowed) {
        String normalized = value == null ? null : value.trim().toLowerCase(Locale.ROOT);
        if (normalized == null || !allowed.contains(normalized)) {
            throw new InvalidConfigParamException(name,
                "'" + name + "' must be one of " + allowed + ", got '" + value + "'");
        }
        return normalized;
    }
}
