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
import io.genxdata.engine.generator.validation.TextPatternValidator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps values of a sibling column through a lookup table, given inline or loaded from a
 * CSV or JSON file.
 *
 * @param mapFrom the sibling column holding the lookup keys
 * @param mapping inline table
 * @param source file holding the table
 * @param sourceColumn column of the file holding the mapped values
 * @param sourceMapFrom column of the file holding the keys, defaults to {@code map_from}
 */
public record MappingParams(
    @JsonProperty("map_from") String mapFrom,
    @JsonProperty("mapping") Map<String, Object> mapping,
    @JsonProperty("source") String source,
    @JsonProperty("source_column") String sourceColumn,
    @JsonProperty("source_map_from") String sourceMapFrom
) implements StrategyParams {

    public MappingParams {
        mapFrom = mapFrom == null ? "" : mapFrom;
        mapping = mapping == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
        source = source == null ? "" : source;
        sourceColumn = sourceColumn == null ? "" : sourceColumn;
        sourceMapFrom = sourceMapFrom == null || sourceMapFrom.isBlank() ? mapFrom : sourceMapFrom;
    }

    public boolean fileBacked() {
        return !source.isBlank() && !sourceColumn.isBlank();
    }

    @Override
    public void validate() {
        TextPatternValidator.requireNonBlank("map_from", mapFrom);
        boolean inline = !mapping.isEmpty();
        if (fileBacked() && !Files.isRegularFile(Path.of(source))) {
            throw new InvalidConfigParamException("source", "Source file '" + source + "' does not exist");
        }
        if (inline && fileBacked()) {
            throw new InvalidConfigParamException("mapping",
                "Provide either 'mapping' (inline) or ('source' and 'source_column'), not both");
        }
        if (!inline && !fileBacked()) {
            throw new InvalidConfigParamException("mapping",
                "Provide 'mapping' dict or ('source' and 'source_column') for file mapping");
        }
    }
}
