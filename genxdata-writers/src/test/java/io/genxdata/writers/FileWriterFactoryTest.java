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
import io.genxdata.engine.errors.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FileWriterFactoryTest {

    private static final Map<String, Object> PARAMS = Map.of("output_path", "out/data.csv");

    @Test
    public void testWriterTypeNames() {
        assertThat(FileFormat.fromType("CSV_WRITER")).isEqualTo(FileFormat.CSV);
        assertThat(FileFormat.fromType("csv")).isEqualTo(FileFormat.CSV);
        assertThat(FileFormat.fromType("JSON_WRITER")).isEqualTo(FileFormat.JSON);
        assertThat(FileFormat.fromType(" jsonl ")).isEqualTo(FileFormat.JSONL);
    }

    @Test
    public void testUnsupportedType() {
        assertThatThrownBy(() -> FileFormat.fromType("PARQUET_WRITER"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Unsupported file writer type: PARQUET_WRITER");
        assertThatThrownBy(() -> FileFormat.fromType(""))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    public void testCreatesWriterForEachFormat() {
        assertThat(FileWriterFactory.create("CSV_WRITER", PARAMS)).isInstanceOf(CsvFileWriter.class);
        assertThat(FileWriterFactory.create("JSON_WRITER", PARAMS))
            .isInstanceOfSatisfying(JsonFileWriter.class, w -> assertThat(w.isLines()).isFalse());
        assertThat(FileWriterFactory.create("JSONL_WRITER", PARAMS))
            .isInstanceOfSatisfying(JsonFileWriter.class, w -> assertThat(w.isLines()).isTrue());
    }

    @Test
    public void testCreatesFromSpecWithDefaultType() {
        AbstractFileWriter writer = FileWriterFactory.create(new WriterSpec(null, PARAMS));
        assertThat(writer).isInstanceOf(CsvFileWriter.class);
        assertThat(writer.pathTemplate()).isEqualTo("out/data.csv");
    }
}
