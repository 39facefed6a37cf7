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
import io.genxdata.engine.generator.validation.TextPatternValidator;

/// Random strings matching a regular expression.
public record PatternParams(@JsonProperty("regex") String regex) implements StrategyParams {

    public PatternParams {
        regex = regex == null ? "^[A-Za-z0-9]+$" : regex;
    }

    @Override
    public void validate() {
        TextPatternValidator.requireRegex("regex", regex);
    }
}
