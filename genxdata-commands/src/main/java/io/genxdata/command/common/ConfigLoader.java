package io.genxdata.command.common;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.genxdata.engine.config.DatasetConfig;
import io.genxdata.engine.errors.ConfigurationException;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/// Reads configuration files into maps: YAML ({@code .yaml}, {@code .yml}) with
/// SnakeYAML Engine, JSON ({@code .json}) with Jackson.
public final class ConfigLoader {

    private static final LoadSettings loadSettings = LoadSettings.builder().build();
    private static final ObjectMapper json = new ObjectMapper();

    private ConfigLoader() {
    }

    /// @throws ConfigurationException if the file is missing, unreadable, of an unknown type or not a mapping
    public static Map<String, Object> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read config file " + path + ": " + e.getMessage(), e);
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return fromYaml(path, content);
        }
        if (name.endsWith(".json")) {
            return fromJson(path, content);
        }
        throw new ConfigurationException("Unsupported config file format: " + path + " (expected .yaml, .yml or .json)");
    }

    public static DatasetConfig loadDataset(Path path) {
        return DatasetConfig.fromMap(load(path));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> fromYaml(Path path, String content) {
        Object loaded;
        try {
            loaded = new Load(loadSettings).loadFromString(content);
        } catch (YamlEngineException e) {
            throw new ConfigurationException("Invalid YAML in " + path + ": " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Config file " + path + " must contain a mapping at the top level");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        ((Map<Object, Object>) loaded).forEach((k, v) -> map.put(String.valueOf(k), v));
        return map;
    }

    private static Map<String, Object> fromJson(Path path, String content) {
        try {
            Map<String, Object> map = json.readValue(content, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            if (map == null) {
                throw new ConfigurationException("Config file " + path + " is empty");
            }
            return map;
        } catch (IOException e) {
            throw new ConfigurationException("Invalid JSON in " + path + ": " + e.getMessage(), e);
        }
    }
}
