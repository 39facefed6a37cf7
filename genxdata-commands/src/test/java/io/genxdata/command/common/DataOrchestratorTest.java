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

import io.genxdata.engine.config.DatasetConfig;
import io.genxdata.engine.config.GenerationSettings;
import io.genxdata.engine.processing.ProcessingResult;
import io.genxdata.engine.processing.ProcessorType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class DataOrchestratorTest {

    static Path writeDataset(Path dir, int rows) throws IOException {
        return Files.writeString(dir.resolve("people.yaml"), String.format("""
            metadata:
              name: people
            column_name: [id, dept]
            num_of_rows: %d
            configs:
              - column_names: [id]
                strategy:
                  name: SERIES_STRATEGY
                  params: {start: 1}
              - column_names: [dept]
                strategy:
                  name: DISTRIBUTED_CHOICE_STRATEGY
                  params:
                    choices: {eng: 50, ops: 50}
            file_writer:
              type: CSV_WRITER
              params:
                output_path: '%s'
            """, rows, dir.resolve("people.csv")));
    }

    @Test
    public void testNormalRunWritesDatasetWriter(@TempDir Path tempDir) throws IOException {
        DatasetConfig config = ConfigLoader.loadDataset(writeDataset(tempDir, 6));

        ProcessingResult result = new DataOrchestrator(config, null, null, null).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.processorType()).isEqualTo(ProcessorType.NORMAL);
        assertThat(result.rowsGenerated()).isEqualTo(6);
        List<String> lines = Files.readAllLines(tempDir.resolve("people.csv"));
        assertThat(lines).hasSize(7);
        assertThat(lines.get(0)).isEqualTo("id,dept");
        assertThat(lines.get(1)).startsWith("1,");
    }

    @Test
    public void testBatchRunWritesOneFilePerChunk(@TempDir Path tempDir) throws IOException {
        DatasetConfig config = ConfigLoader.loadDataset(writeDataset(tempDir, 10));
        Path batch = Files.writeString(tempDir.resolve("batch.yaml"), String.format("""
            batch:
              chunk_size: 4
              file_writer:
                type: CSV_WRITER
                params:
                  output_path: '%s'
            """, tempDir.resolve("out/people.csv")));

        ProcessingResult result = new DataOrchestrator(config, GenerationSettings.defaults(), null, batch).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.processorType()).isEqualTo(ProcessorType.STREAMING);
        assertThat(result.chunksProcessed()).isEqualTo(3);
        assertThat(tempDir.resolve("out/people_batch_0.csv")).isRegularFile();
        assertThat(Files.readAllLines(tempDir.resolve("out/people_batch_1.csv")).get(1)).startsWith("5,");
        assertThat(Files.readAllLines(tempDir.resolve("out/people_batch_2.csv"))).hasSize(3);
        assertThat(result.writerSummary()).containsEntry("total_batches_written", 3);
    }

    @Test
    public void testStreamAndBatchTogether(@TempDir Path tempDir) throws IOException {
        DatasetConfig config = ConfigLoader.loadDataset(writeDataset(tempDir, 5));

        ProcessingResult result = new DataOrchestrator(config, null,
            tempDir.resolve("stream.yaml"), tempDir.resolve("batch.yaml")).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.processorType()).isEqualTo(ProcessorType.STREAMING);
        assertThat(result.errorCode()).isEqualTo("CFG003");
        assertThat(result.error()).contains("cannot be used together");
        assertThat(tempDir.resolve("people.csv")).doesNotExist();
    }

    @Test
    public void testBatchFileWithoutBatchSection(@TempDir Path tempDir) throws IOException {
        DatasetConfig config = ConfigLoader.loadDataset(writeDataset(tempDir, 5));
        Path batch = Files.writeString(tempDir.resolve("batch.yaml"), "chunk_size: 2\n");

        ProcessingResult result = new DataOrchestrator(config, null, null, batch).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorCode()).isEqualTo("CFG001");
        assertThat(result.error()).contains("'batch' section");
    }

    @Test
    public void testStreamWithoutSupportedQueue(@TempDir Path tempDir) throws IOException {
        DatasetConfig config = ConfigLoader.loadDataset(writeDataset(tempDir, 5));
        Path stream = Files.writeString(tempDir.resolve("stream.yaml"), """
            amqp:
              url: amqp://localhost
              queue: rows
            """);

        ProcessingResult result = new DataOrchestrator(config, null, stream, null).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.processorType()).isEqualTo(ProcessorType.STREAMING);
        assertThat(result.error()).contains("AMQP");
    }

    @Test
    public void testNonNumericChunkSize(@TempDir Path tempDir) throws IOException {
        DatasetConfig config = ConfigLoader.loadDataset(writeDataset(tempDir, 5));
        Path batch = Files.writeString(tempDir.resolve("batch.yaml"), "batch:\n  chunk_size: lots\n");

        ProcessingResult result = new DataOrchestrator(config, null, null, batch).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).contains("'chunk_size' must be an integer");
    }
}
