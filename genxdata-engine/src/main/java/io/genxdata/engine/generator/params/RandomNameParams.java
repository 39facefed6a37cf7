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

import java.util.List;

/**
 * Person names.
 *
 * @param nameType {@code first}, {@code last} or {@code full}
 * @param gender {@code male}, {@code female} or {@code any}
 * @param letterCase {@code title}, {@code upper} or {@code lower}
 */
public record RandomNameParams(
    @JsonProperty("name_type") String nameType,
    @JsonProperty("gender") String gender,
    @JsonProperty("case") String letterCase
) implements StrategyParams {

    public static final List<String> NAME_TYPES = List.of("first", "last", "full");
    public static final List<String> GENDERS = List.of("male", "female", "any");
    public static final List<String> CASES = List.of("title", "upper", "lower");

    public RandomNameParams {
        nameType = nameType == null ? "first" : nameType.trim().toLowerCase();
        gender = gender == null ? "any" : gender.trim().toLowerCase();
        letterCase = letterCase == null ? "title" : letterCase.trim().toLowerCase();
    }

    @Override
    public void validate() {
        TextPatternValidator.requireOneOf("name_type", nameType, NAME_TYPES);
        TextPatternValidator.requireOneOf("gender", gender, GENDERS);
        TextPatternValidator.requireOneOf("case", letterCase, CASES);
    }
}
