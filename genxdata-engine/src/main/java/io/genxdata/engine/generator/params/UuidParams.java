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

/**
 * UUID strings.
 *
 * @param version 4 for random UUIDs, 5 for name-based UUIDs derived from a per-column
 *     namespace and a running counter
 * @param numbersOnly render the 128-bit value as a decimal number
 */
public record UuidParams(
    @JsonProperty("hyphens") Boolean hyphens,
    @JsonProperty("uppercase") Boolean uppercase,
    @JsonProperty("prefix") String prefix,
    @JsonProperty("numbers_only") Boolean numbersOnly,
    @JsonProperty("version") Integer version,
    @JsonProperty("unique") Boolean unique
) implements StrategyParams {

    public UuidParams {
        hyphens = hyphens == null || hyphens;
        uppercase = uppercase != null && uppercase;
        prefix = prefix == null ? "" : prefix;
        numbersOnly = numbersOnly != null && numbersOnly;
        version = version == null ? 5 : version;
        unique = unique != null && unique;
    }

    @Override
    public void validate() {
        if (version != 4 && version != 5) {
            throw new InvalidConfigParamException("version", "UUID version must be 4 or 5, got " + version);
        }
    }
}
