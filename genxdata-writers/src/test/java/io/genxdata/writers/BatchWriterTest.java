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
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.sink.ChunkMetadata;
import io.genxdata.engine.sink.WriteResult;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class BatchWriterTest {

    @Test
    public void testPlaceholderInjectedBeforeExtension() {
        assertThat(BatchWriter.withBatchPlaceholder(Map.of("output_path", "out/data.csv")))
            .containsEntry("output_path", "out/data_batch_{batch_index}.csv");
        assertThat(BatchWriter.withBatchPlaceholder(Map.of("output_path", "out.d/data")))
            .containsEntry("output_path", "out.d/data_batch_{batch_index}");
    }

    @Test
    public void testExistingPlaceholderKept() {
        Map<String, Object> params = Map.of("output_path", "out/{batch_index}-part.csv", "sep", ";");
        assertThat(BatchWriter.withBatchPlaceholder(params)).isEqualTo(params);
    }

    @Test
    public void testOneFilePerBatch(@TempDir Path tempDir) throws IOException {
        BatchWriter writer = new BatchWriter(new WriterSpec("CSV_WRITER",
            Map.of("output_path", tempDir.resolve("data.csv").toString())));

        WriteResult first = writer.write(ids(1, 2), ChunkMetadata.of(0, 2, 2));
        writer.write(ids(3), ChunkMetadata.of(1, 1, 2));

        Path batch0 = tempDir.resolve("data_batch_0.csv");
        Path batch1 = tempDir.resolve("data_batch_1.csv");
        assertThat(first.details()).containsEntry("batch_index", 0);
        assertThat(Files.readAllLines(batch0)).containsExactly("id", "1", "2");
        assertThat(Files.readAllLines(batch1)).containsExactly("id", "3");
        assertThat(writer.writtenPaths()).containsExactly(batch0.toString(), batch1.toString());
    }

    @Test
    public void testSummary(@TempDir Path tempDir) {
        BatchWriter writer = new BatchWriter(new WriterSpec("JSON_WRITER",
            Map.of("output_path", tempDir.resolve("data.json").toString())));
        writer.write(ids(1, 2, 3), null);
        writer.write(ids(4), null);

        Map<String, Object> summary = writer.finish();

        assertThat(summary)
            .containsEntry("writer_type", "batch")
            .containsEntry("total_rows_written", 4L)
            .containsEntry("total_batches_written", 2)
            .containsEntry("writer_implementation_type", "JsonFileWriter");
        assertThat(summary.get("written_paths")).asInstanceOf(InstanceOfAssertFactories.LIST)
            .containsExactly(tempDir.resolve("data_batch_0.json").toString(),
                tempDir.resolve("data_batch_1.json").toString());
        assertThat(summary.get("writer_implementation_summary")).asInstanceOf(InstanceOfAssertFactories.MAP)
            .containsEntry("files_written", 2);
    }

    private static Frame ids(Integer... values) {
        Frame frame = Frame.empty(values.length);
        frame.setColumn("id", List.of(values));
        return frame;
    }
}
