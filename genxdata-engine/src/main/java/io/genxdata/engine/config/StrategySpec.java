package io.genxdata.engine.config;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code strategy} block of a column entry.
 *
 * @param name registered strategy name, e.g. {@code SERIES_STRATEGY}
 * @param params raw parameters, decoded by the strategy's parameter record
 * @param unique whether written values must be distinct
 */
public record StrategySpec(
    @JsonProperty("name") String name,
    @JsonProperty("params") Map<String, Object> params,
    @JsonProperty("unique") Boolean unique
) {

    public StrategySpec {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        unique = unique != null && unique;
    }

    /// @return true when uniqueness is requested on the strategy or in its parameters
    public boolean isUnique() {
        return unique || Boolean.TRUE.equals(params.get("unique"));
    }
}
