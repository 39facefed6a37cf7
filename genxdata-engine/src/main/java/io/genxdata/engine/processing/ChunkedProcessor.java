package io.genxdata.engine.processing;

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
import io.genxdata.engine.errors.ConfigurationException;
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.generator.ExecutionMode;
import io.genxdata.engine.generator.SharedGenerationState;
import io.genxdata.engine.sink.ChunkMetadata;
import io.genxdata.engine.sink.FrameSink;

import java.util.List;

/**
 * Generates the dataset in bounded chunks and hands each one to the sink as soon as it
 * is complete.
 *
 * <p>The generator pool and shared state are created once per run, so sequence
 * generators continue across chunk boundaries. Chunks already written when a later
 * chunk fails stay written.
 */
public class ChunkedProcessor extends AbstractConfigProcessor {

    private final int chunkSize;
    private final int batchSize;

    /**
     * @param chunkSize rows generated per chunk, null for the settings' batch size
     * @param batchSize rows per sink write, null for the settings' batch size
     */
    public ChunkedProcessor(DatasetConfig config, FrameSink sink, GenerationSettings settings,
                            Integer chunkSize, Integer batchSize) {
        super(config, sink, settings);
        this.batchSize = batchSize == null ? this.settings.batchSize() : batchSize;
        this.chunkSize = chunkSize == null ? this.batchSize : chunkSize;
    }

    @Override
    protected void validate() {
        requirePositive("batch_size", batchSize);
        requirePositive("chunk_size", chunkSize);
        super.validate();
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new ConfigurationException("'" + name + "' must be positive, got " + value);
        }
    }

    @Override
    public ProcessorType type() {
        return ProcessorType.STREAMING;
    }

    /// Rows per chunk after applying the batch size bound.
    public int effectiveChunkSize() {
        return Math.min(chunkSize, batchSize);
    }

    @Override
    public ProcessingResult process() {
        try {
            validate();
            int target = targetRows();
            int size = effectiveChunkSize();
            int totalChunks = (target + size - 1) / size;
            logger.info("Generating {} rows for '{}' in {} chunks of up to {} rows",
                target, config.name(), totalChunks, size);

            ColumnProcessor columns = newColumnProcessor();
            SharedGenerationState state = new SharedGenerationState();
            long generated = 0;
            int chunks = 0;
            List<String> lastColumns = List.of();
            while (generated < target) {
                int rows = (int) Math.min(size, target - generated);
                ChunkMetadata metadata = ChunkMetadata.of(chunks, rows, totalChunks);
                Frame frame = report.time("chunk_processing", () -> {
                    Frame chunk = generateFrame(columns, rows, ExecutionMode.STREAM_OR_BATCH, state);
                    report.time("file_writing", () -> sink.write(chunk, metadata));
                    return chunk;
                });
                generated += rows;
                chunks++;
                lastColumns = frame.columnNames();
                logger.debug("Chunk {}/{} written ({} rows, {} total)", metadata.chunkIndex(), totalChunks, rows, generated);
            }

            return ProcessingResult.success(type(), config.name())
                .rowsGenerated(generated)
                .columnNames(lastColumns)
                .chunks(chunks, chunkSize, batchSize)
                .writerSummary(sink.finish())
                .performanceReport(performanceSummary())
                .build();
        } catch (RuntimeException e) {
            finishAfterFailure(e);
            return failure(e);
        }
    }
}
