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

/// Raised when a configuration names a strategy that is not registered.
public class UnsupportedStrategyException extends ConfigurationException {

    private final String strategyName;

    public UnsupportedStrategyException(String strategyName) {
        super(ErrorCategory.CONFIGURATION, ErrorCategory.CONFIGURATION.code(2),
            "Unsupported strategy: " + strategyName, null);
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
