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

import java.util.List;

/**
 * One entry of the {@code configs} list: a strategy applied to one or more columns.
 *
 * @param columnNames target columns, each populated with its own generator
 * @param strategy the strategy and its parameters
 * @param mask optional row filter
 * @param intermediate whether the columns are removed before writing
 * @param disabled whether the entry is skipped
 */
public record ColumnConfig(
    @JsonProperty("column_names") List<String> columnNames,
    @JsonProperty("strategy") StrategySpec strategy,
    @JsonProperty("mask") String mask,
    @JsonProperty("intermediate") Boolean intermediate,
    @JsonProperty("disabled") Boolean disabled
) {

    public ColumnConfig {
        columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
        intermediate = intermediate != null && intermediate;
        disabled = disabled != null && disabled;
    }

    public boolean hasMask() {
        return mask != null && !mask.isBlank();
    }
}
