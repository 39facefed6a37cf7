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

/**
 * Raised when a strategy parameter, or a mask expression, fails validation.
 *
 * <p>The offending parameter name is kept so that tooling can point at it.
 */
public class InvalidConfigParamException extends ConfigurationException {

    private final String parameter;

    public InvalidConfigParamException(String parameter, String message) {
        this(parameter, message, null);
    }

    public InvalidConfigParamException(String parameter, String message, Throwable cause) {
        super(ErrorCategory.VALIDATION, ErrorCategory.VALIDATION.code(1), message, cause);
        this.parameter = parameter;
    }

    /// @return the name of the parameter that failed validation, or null when not attributable
    public String getParameter() {
        return parameter;
    }
}
