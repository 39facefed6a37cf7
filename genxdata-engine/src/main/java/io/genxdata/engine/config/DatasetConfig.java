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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.genxdata.engine.errors.ConfigurationException;

import java.util.List;
import java.util.Map;

/**
 * A dataset definition.
 *
 * <pre>{@code
 * metadata: {name: employees}
 * column_name: [id, name]
 * num_of_rows: 100
 * shuffle: false
 * configs:
 *   - column_names: [id]
 *     strategy: {name: SERIES_STRATEGY, params: {start: 1}}
 * file_writer: {type: CSV_WRITER, params: {output_path: out/employees.csv}}
 * }</pre>
 *
 * <p>Instances are decoded from the map a loader produced and are not validated on
 * construction; see {@link ConfigValidator}.
 */
public record DatasetConfig(
    @JsonProperty("metadata") Metadata metadata,
    @JsonProperty("column_name") List<String> columnNames,
    @JsonProperty("num_of_rows") Integer numOfRows,
    @JsonProperty("shuffle") Boolean shuffle,
    @JsonProperty("configs") List<ColumnConfig> configs,
    @JsonProperty("file_writer") WriterSpec fileWriter
) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /// @param name dataset name used in results and log messages
    public record Metadata(@JsonProperty("name") String name) {
    }

    public DatasetConfig {
        columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
        configs = configs == null ? List.of() : List.copyOf(configs);
    }

    /**
     * Decodes a loaded configuration map.
     *
     * @throws ConfigurationException if the map does not have the expected shape
     */
    public static DatasetConfig fromMap(Map<String, ?> raw) {
        if (raw == null) {
            throw new ConfigurationException("Configuration is empty");
        }
        try {
            return MAPPER.convertValue(raw, DatasetConfig.class);
        } catch (IllegalArgumentException e) {
            String message = e.getMessage() == null ? "" : e.getMessage().split("\n", 2)[0];
            throw new ConfigurationException("Malformed dataset configuration: " + message, e);
        }
    }

    /// @return the dataset name, or {@code unnamed}
    public String name() {
        return metadata == null || metadata.name() == null || metadata.name().isBlank()
            ? "unnamed" : metadata.name();
    }

    public boolean shuffleEnabled(GenerationSettings settings) {
        return shuffle != null ? shuffle : settings.shuffle();
    }

    public int rows() {
        return numOfRows == null ? 0 : numOfRows;
    }
}
