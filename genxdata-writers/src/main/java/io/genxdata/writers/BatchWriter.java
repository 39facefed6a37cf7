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
import io.genxdata.engine.sink.FrameSink;
import io.genxdata.engine.sink.WriteResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes every chunk of a chunked run to its own file.
 *
 * <p>When the configured output path has no {@code {batch_index}} placeholder one is
 * inserted before the extension, so {@code out/data.csv} becomes
 * {@code out/data_batch_{batch_index}.csv}.
 */
public class BatchWriter implements FrameSink {

    private static final Logger logger = LogManager.getLogger(BatchWriter.class);

    static final String BATCH_PLACEHOLDER = "{batch_index}";

    private final AbstractFileWriter delegate;
    private final List<String> writtenPaths = new ArrayList<>();
    private long totalRowsWritten;
    private int batchesWritten;

    public BatchWriter(WriterSpec spec) {
        this(FileWriterFactory.create(spec.type(), withBatchPlaceholder(spec.params())));
    }

    public BatchWriter(AbstractFileWriter delegate) {
        this.delegate = delegate;
        if (!delegate.pathTemplate().contains(BATCH_PLACEHOLDER)) {
            logger.warn("Output path '{}' has no {} placeholder; every batch overwrites the same file",
                delegate.pathTemplate(), BATCH_PLACEHOLDER);
        }
        logger.debug("BatchWriter initialized with {}", delegate.getClass().getSimpleName());
    }

    static Map<String, Object> withBatchPlaceholder(Map<String, Object> params) {
        Map<String, Object> adjusted = new LinkedHashMap<>(params);
        Object path = adjusted.get("output_path");
        if (path != null && !path.toString().contains(BATCH_PLACEHOLDER)) {
            String template = path.toString();
            int slash = Math.max(template.lastIndexOf('/'), template.lastIndexOf('\\'));
            int dot = template.lastIndexOf('.');
            adjusted.put("output_path", dot > slash
                ? template.substring(0, dot) + "_batch_" + BATCH_PLACEHOLDER + template.substring(dot)
                : template + "_batch_" + BATCH_PLACEHOLDER);
        }
        return adjusted;
    }

    @Override
    public WriteResult write(Frame frame, ChunkMetadata metadata) {
        ChunkMetadata batch = metadata != null ? metadata : ChunkMetadata.of(batchesWritten, frame.size(), 0);
        WriteResult result = delegate.write(frame, batch);
        writtenPaths.add(result.destination());
        totalRowsWritten += result.rowsWritten();
        batchesWritten++;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("batch_index", batch.batchIndex());
        return new WriteResult(result.rowsWritten(), result.destination(), details);
    }

    public List<String> writtenPaths() {
        return List.copyOf(writtenPaths);
    }

    @Override
    public Map<String, Object> finish() {
        logger.info("Finalizing batch writer. Total batches: {}, Total rows: {}", batchesWritten, totalRowsWritten);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("writer_type", "batch");
        summary.put("total_rows_written", totalRowsWritten);
        summary.put("total_batches_written", batchesWritten);
        summary.put("writer_implementation_type", delegate.getClass().getSimpleName());
        summary.put("writer_implementation_summary", delegate.finish());
        summary.put("written_paths", List.copyOf(writtenPaths));
        return summary;
    }
}
