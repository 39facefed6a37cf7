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
import io.genxdata.engine.generator.validation.WeightsValidator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Categorical values with percentage weights, e.g. {@code {A: 70, B: 30}}.
public record DistributedChoiceParams(
    @JsonProperty("choices") Map<String, Number> choices
) implements StrategyParams {

    public DistributedChoiceParams {
        choices = choices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(choices));
    }

    @Override
    public void validate() {
        if (choices.isEmpty()) {
            throw new InvalidConfigParamException("choices", "At least one choice must be specified");
        }
        WeightsValidator.requireTotal("choices", choices.values());
    }
}
