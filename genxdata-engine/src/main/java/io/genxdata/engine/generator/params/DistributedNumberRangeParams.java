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

import java.util.List;
import java.util.stream.Collectors;

/// Numbers drawn from several ranges, picked by percentage weight.
public record DistributedNumberRangeParams(
    @JsonProperty("ranges") List<RangeItem> ranges
) implements StrategyParams {

    public DistributedNumberRangeParams {
        ranges = ranges == null ? List.of() : List.copyOf(ranges);
    }

    @Override
    public void validate() {
        if (ranges.isEmpty()) {
            throw new InvalidConfigParamException("ranges", "At least one range must be specified");
        }
        ranges.forEach(RangeItem::validate);
        WeightsValidator.requireTotal("ranges",
            ranges.stream().map(RangeItem::distribution).collect(Collectors.toList()));
    }
}
