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
import io.genxdata.engine.config.WriterSpec;
import io.genxdata.engine.errors.ConfigurationException;
import io.genxdata.engine.errors.GenXDataException;
import io.genxdata.engine.errors.InvalidRunningModeException;
import io.genxdata.engine.processing.AbstractConfigProcessor;
import io.genxdata.engine.processing.ChunkedProcessor;
import io.genxdata.engine.processing.ProcessingResult;
import io.genxdata.engine.processing.ProcessorType;
import io.genxdata.engine.processing.SinglePassProcessor;
import io.genxdata.engine.sink.FrameSink;
import io.genxdata.writers.BatchWriter;
import io.genxdata.writers.FileWriterFactory;
import io.genxdata.writers.stream.StreamWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Map;

/**
 * Chooses the pipeline and sink for a run.
 *
 * <ul>
 *   <li>No stream or batch file: single pass, written with the dataset's {@code file_writer}
 *   (CSV when absent).</li>
 *   <li>A batch file: chunked, one file per chunk through a {@link BatchWriter}.</li>
 *   <li>A stream file: chunked, one message per chunk through a {@link StreamWriter}.</li>
 *   <li>Both: an error result.</li>
 * </ul>
 */
public class DataOrchestrator {

    private static final Logger logger = LogManager.getLogger(DataOrchestrator.class);

    private final DatasetConfig config;
    private final GenerationSettings settings;
    private final Path stream;
    private final Path batch;

    public DataOrchestrator(DatasetConfig config, GenerationSettings settings, Path stream, Path batch) {
        this.config = config;
        this.settings = settings == null ? GenerationSettings.defaults() : settings;
        this.stream = stream;
        this.batch = batch;
    }

    public ProcessingResult run() {
        logger.info("Starting data generation for '{}'", config.name());
        ProcessorType type = stream != null || batch != null ? ProcessorType.STREAMING : ProcessorType.NORMAL;
        try {
            return createProcessor().process();
        } catch (GenXDataException e) {
            logger.error("Error during processing: {}", e.getMessage());
            return ProcessingResult.error(type, config.name(), e.getMessage()).errorCode(e.getErrorCode()).build();
        } catch (RuntimeException e) {
            logger.error("Error during processing: {}", e.getMessage(), e);
            return ProcessingResult.error(type, config.name(), e.getMessage()).build();
        }
    }

    AbstractConfigProcessor createProcessor() {
        if (stream != null && batch != null) {
            throw new InvalidRunningModeException("Stream and batch modes cannot be used together; choose one of --stream or --batch");
        }
        if (batch != null) {
            Map<String, Object> batchConfig = ConfigLoader.load(batch);
            Map<String, Object> section = section(batchConfig, "batch");
            if (section == null) {
                throw new ConfigurationException("Batch config " + batch + " must contain a 'batch' section");
            }
            logger.info("Processing batch config {}", batch);
            Integer batchSize = size(section, "batch_size", settings.batchSize());
            Integer chunkSize = size(section, "chunk_size", batchSize);
            FrameSink sink = new BatchWriter(writerSpec(section.get("file_writer")));
            return new ChunkedProcessor(config, sink, settings, chunkSize, batchSize);
        }
        if (stream != null) {
            Map<String, Object> streamConfig = ConfigLoader.load(stream);
            logger.info("Processing streaming config {}", stream);
            Map<String, Object> streaming = section(streamConfig, "streaming");
            Map<String, Object> sizes = streaming != null ? streaming : streamConfig;
            Integer batchSize = size(sizes, "batch_size", size(streamConfig, "batch_size", settings.batchSize()));
            Integer chunkSize = size(sizes, "chunk_size", size(streamConfig, "chunk_size", batchSize));
            return new ChunkedProcessor(config, StreamWriter.fromConfig(streamConfig), settings, chunkSize, batchSize);
        }
        logger.info("Processing normal config");
        WriterSpec spec = config.fileWriter() != null ? config.fileWriter()
            : new WriterSpec("CSV_WRITER", Map.of("output_path", "output/" + config.name() + ".csv"));
        return new SinglePassProcessor(config, FileWriterFactory.create(spec), settings);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private static Integer size(Map<String, Object> config, String key, Integer fallback) {
        Object value = config.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static WriterSpec writerSpec(Object raw) {
        if (!(raw instanceof Map)) {
            return new WriterSpec("CSV_WRITER", Map.of("output_path", "output/batch_{batch_index}.csv"));
        }
        Map<String, Object> map = (Map<String, Object>) raw;
        Object params = map.get("params");
        return new WriterSpec(map.get("type") == null ? null : map.get("type").toString(),
            params instanceof Map ? (Map<String, Object>) params : Map.of());
    }
}
