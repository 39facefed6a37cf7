package io.genxdata.engine.errors;

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

/// Broad classes of failure, each with the prefix used for its error codes.
public enum ErrorCategory {
    CONFIGURATION("CFG"),
    VALIDATION("VAL"),
    STRATEGY("STR"),
    PROCESSING("PRC"),
    IO("IO");

    private final String codePrefix;

    ErrorCategory(String codePrefix) {
        this.codePrefix = codePrefix;
    }

    public String codePrefix() {
        return codePrefix;
    }

    /// @param number the numeric part of the code
    /// @return a code such as {@code CFG001}
    public String code(int number) {
        return String.format("%s%03d", codePrefix, number);
    }
}
