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

import io.genxdata.engine.config.ConfigValidator;
import io.genxdata.engine.config.DatasetConfig;
import io.genxdata.engine.config.GenerationSettings;
import io.genxdata.engine.errors.GenXDataException;
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.generator.ConditionalApplicator;
import io.genxdata.engine.generator.ExecutionMode;
import io.genxdata.engine.generator.GeneratorFactory;
import io.genxdata.engine.generator.GeneratorPool;
import io.genxdata.engine.generator.SharedGenerationState;
import io.genxdata.engine.generator.UniquenessEnforcer;
import io.genxdata.engine.random.RandomGenerators;
import io.genxdata.engine.sink.FrameSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Shared flow of the processing pipelines: validation, frame construction, the column
 * loop, shuffling and removal of intermediate columns.
 *
 * <p>Each {@link #process()} call works with a fresh generator pool and shared state.
 * Failures are reported as an error {@link ProcessingResult}, never thrown.
 */
public abstract class AbstractConfigProcessor {

    protected final Logger logger = LogManager.getLogger(getClass());

    protected final DatasetConfig config;
    protected final FrameSink sink;
    protected final GenerationSettings settings;
    protected final PerformanceReport report;

    protected AbstractConfigProcessor(DatasetConfig config, FrameSink sink, GenerationSettings settings) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.settings = settings == null ? GenerationSettings.defaults() : settings;
        this.report = new PerformanceReport();
    }

    /// Runs the pipeline to completion.
    public abstract ProcessingResult process();

    public abstract ProcessorType type();

    protected void validate() {
        new ConfigValidator(logger).validate(config);
    }

    /// @return the configured row count, raised to the configured minimum
    protected int targetRows() {
        int rows = config.rows();
        if (rows < settings.minimumRows()) {
            logger.warn("Requested rows ({}) below minimum allowed ({}). Using minimum.", rows, settings.minimumRows());
            return settings.minimumRows();
        }
        return rows;
    }

    /// A column loop bound to a fresh generator pool.
    protected ColumnProcessor newColumnProcessor() {
        GeneratorPool pool = new GeneratorPool(new GeneratorFactory(logger), logger);
        ConditionalApplicator applicator = new ConditionalApplicator(
            new UniquenessEnforcer(settings.uniquenessAttempts(), logger), logger);
        return new ColumnProcessor(config.configs(), pool, applicator, report, logger);
    }

    /// Builds a frame of {@code size} rows, populates it and prepares it for the sink.
    protected Frame generateFrame(ColumnProcessor columns, int size, ExecutionMode mode, SharedGenerationState state) {
        Frame populated = columns.process(Frame.empty(size, config.columnNames()), mode, state);
        Frame ordered = config.shuffleEnabled(settings)
            ? report.time("shuffle_data", () -> populated.shuffled(RandomGenerators.create((Long) null)))
            : populated;
        return report.time("filter_intermediate_columns", ordered::withoutIntermediateColumns);
    }

    protected ProcessingResult failure(RuntimeException e) {
        logger.error("Processing of '{}' failed: {}", config.name(), e.getMessage(), e);
        ProcessingResult.Builder result = ProcessingResult.error(type(), config.name(), e.getMessage());
        if (e instanceof GenXDataException) {
            result.errorCode(((GenXDataException) e).getErrorCode());
        }
        return result.build();
    }

    /// Finishes the sink after a failed run; a second failure is logged and reported on the original.
    protected void finishAfterFailure(RuntimeException cause) {
        try {
            sink.finish();
        } catch (RuntimeException e) {
            logger.warn("Writer cleanup after failure of '{}' also failed: {}", config.name(), e.getMessage());
            cause.addSuppressed(e);
        }
    }

    protected Map<String, Map<String, Object>> performanceSummary() {
        if (!settings.perfReport()) {
            return null;
        }
        logger.info("\n{}", report.generateReport());
        return report.summary();
    }

    public PerformanceReport report() {
        return report;
    }
}
