package io.genxdata.writers;

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

import io.genxdata.engine.errors.ConfigurationException;

import java.util.List;
import java.util.Locale;

/// Output file formats and the writer type names that select them.
public enum FileFormat {
    CSV(".csv", ".txt"),
    JSON(".json"),
    JSONL(".jsonl", ".ndjson");

    private final List<String> extensions;

    FileFormat(String... extensions) {
        this.extensions = List.of(extensions);
    }

    /// @return accepted extensions, the default first
    public List<String> extensions() {
        return extensions;
    }

    public String defaultExtension() {
        return extensions.get(0);
    }

    /**
     * Resolves a writer type such as {@code CSV_WRITER}, {@code csv} or {@code JSONL}.
     *
     * @throws ConfigurationException for unsupported types
     */
    public static FileFormat fromType(String type) {
        if (type == null || type.isBlank()) {
            throw new ConfigurationException("File writer type is required");
        }
        String normalized = type.trim().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("_WRITER")) {
            normalized = normalized.substring(0, normalized.length() - "_WRITER".length());
        }
        for (FileFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new ConfigurationException("Unsupported file writer type: " + type
            + ". Supported: CSV_WRITER, JSON_WRITER, JSONL_WRITER");
    }
}
