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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.genxdata.engine.frame.Frame;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes frames as JSON with Jackson, either as one pretty-printed array of records or,
 * for the JSONL format or with {@code lines: true}, as one record per line.
 */
public class JsonFileWriter extends AbstractFileWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    private final boolean lines;

    public JsonFileWriter(Map<String, Object> params) {
        this(FileFormat.JSON, params);
    }

    JsonFileWriter(FileFormat format, Map<String, Object> params) {
        super(format, params);
        Object linesParam = this.params.get("lines");
        this.lines = format == FileFormat.JSONL
            || Boolean.TRUE.equals(linesParam)
            || "true".equalsIgnoreCase(String.valueOf(linesParam));
    }

    /// A writer producing one JSON record per line.
    public static JsonFileWriter jsonLines(Map<String, Object> params) {
        return new JsonFileWriter(FileFormat.JSONL, params);
    }

    public boolean isLines() {
        return lines;
    }

    @Override
    protected void writeFile(Frame frame, Path path) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            if (lines) {
                ObjectWriter writer = MAPPER.writer();
                for (int row = 0; row < frame.size(); row++) {
                    writer.writeValue(out, frame.row(row));
                    out.newLine();
                }
            } else {
                MAPPER.writer(SerializationFeature.INDENT_OUTPUT).writeValue(out, frame.toRecords());
            }
        }
    }
}
