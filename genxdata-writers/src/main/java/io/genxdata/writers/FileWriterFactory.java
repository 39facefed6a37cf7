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

import io.genxdata.engine.config.WriterSpec;

import java.util.Map;

/// Creates file writers from {@code file_writer} configuration blocks.
public final class FileWriterFactory {

    private FileWriterFactory() {
    }

    public static AbstractFileWriter create(WriterSpec spec) {
        return create(spec.type(), spec.params());
    }

    /**
     * @param type a writer type such as {@code CSV_WRITER} or {@code json}
     * @throws io.genxdata.engine.errors.ConfigurationException for unsupported types or missing paths
     */
    public static AbstractFileWriter create(String type, Map<String, Object> params) {
        FileFormat format = FileFormat.fromType(type);
        switch (format) {
            case CSV:
                return new CsvFileWriter(params);
            case JSON:
                return new JsonFileWriter(params);
            case JSONL:
                return JsonFileWriter.jsonLines(params);
            default:
                throw new IllegalStateException("Unhandled format " + format);
        }
    }
}
