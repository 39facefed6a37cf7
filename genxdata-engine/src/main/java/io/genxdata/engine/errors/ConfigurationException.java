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

/// Raised when a dataset or run configuration is structurally invalid.
/// Always raised before any rows are generated.
public class ConfigurationException extends GenXDataException {

    public ConfigurationException(String message) {
        super(ErrorCategory.CONFIGURATION, ErrorCategory.CONFIGURATION.code(1), message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCategory.CONFIGURATION, ErrorCategory.CONFIGURATION.code(1), message, cause);
    }

    protected ConfigurationException(ErrorCategory category, String errorCode, String message, Throwable cause) {
        super(category, errorCode, message, cause);
    }
}
