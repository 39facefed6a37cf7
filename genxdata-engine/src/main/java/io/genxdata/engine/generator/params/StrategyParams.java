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

/**
 * Typed, validated parameters of one strategy kind.
 *
 * <p>Each record supplies its defaults in its compact constructor, so a missing
 * configuration key and an explicit null mean the same thing. {@link #validate()} is
 * called once by {@link ParamsDecoder} right after decoding.
 */
public sealed interface StrategyParams permits
    RandomNumberRangeParams,
    DistributedNumberRangeParams,
    RandomDateRangeParams,
    DateSeriesParams,
    DistributedDateRangeParams,
    PatternParams,
    SeriesParams,
    DistributedChoiceParams,
    TimeRangeParams,
    DistributedTimeRangeParams,
    ReplacementParams,
    ConcatParams,
    RandomNameParams,
    DeleteParams,
    MappingParams,
    UuidParams {

    /// @throws io.genxdata.engine.errors.InvalidConfigParamException when a parameter is invalid
    void validate();
}
