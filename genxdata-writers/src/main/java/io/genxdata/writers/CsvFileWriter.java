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

import de.siegmar.fastcsv.writer.CsvWriter;
import io.genxdata.engine.errors.ConfigurationException;
import io.genxdata.engine.frame.Frame;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes frames as CSV with FastCSV.
 *
 * <p>Parameters besides the output path: {@code sep} (or {@code separator}), a single
 * character, default {@code ,}; {@code header}, default true.
 */
public class CsvFileWriter extends AbstractFileWriter {

    private final char separator;
    private final boolean header;

    public CsvFileWriter(Map<String, Object> params) {
        super(FileFormat.CSV, params);
        Object sep = this.params.getOrDefault("sep", this.params.getOrDefault("separator", ","));
        String sepText = String.valueOf(sep);
        if (sepText.length() != 1) {
            throw new ConfigurationException("CSV separator must be a single character, got '" + sepText + "'");
        }
        this.separator = sepText.charAt(0);
        this.header = !Boolean.FALSE.equals(this.params.get("header"))
            && !"false".equalsIgnoreCase(String.valueOf(this.params.get("header")));
    }

    @Override
    protected void writeFile(Frame frame, Path path) throws IOException {
        List<String> columns = frame.columnNames();
        try (CsvWriter csv = CsvWriter.builder().fieldSeparator(separator).build(path)) {
            if (header) {
                csv.writeRecord(columns);
            }
            List<String> fields = new ArrayList<>(columns.size());
            for (int row = 0; row < frame.size(); row++) {
                fields.clear();
                for (String column : columns) {
                    fields.add(text(frame.get(column, row)));
                }
                csv.writeRecord(fields);
            }
        }
    }
}
