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

import io.genxdata.engine.config.ColumnConfig;
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.ColumnRequest;
import io.genxdata.engine.generator.ConditionalApplicator;
import io.genxdata.engine.generator.ExecutionMode;
import io.genxdata.engine.generator.GeneratorPool;
import io.genxdata.engine.generator.SharedGenerationState;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Walks the configured column entries in order and populates a frame.
 *
 * <p>Disabled entries are skipped. Every column of an entry gets its own pooled generator.
 * A failure while populating a column is logged with the column name and rethrown.
 */
public final class ColumnProcessor {

    private final List<ColumnConfig> configs;
    private final GeneratorPool pool;
    private final ConditionalApplicator applicator;
    private final PerformanceReport report;
    private final Logger logger;

    public ColumnProcessor(List<ColumnConfig> configs, GeneratorPool pool, ConditionalApplicator applicator,
                           PerformanceReport report, Logger logger) {
        this.configs = List.copyOf(configs);
        this.pool = Objects.requireNonNull(pool, "pool");
        this.applicator = Objects.requireNonNull(applicator, "applicator");
        this.report = Objects.requireNonNull(report, "report");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /// Populates {@code frame} in place.
    public Frame process(Frame frame, ExecutionMode mode, SharedGenerationState sharedState) {
        logger.debug("Processing {} column configurations over {} rows", configs.size(), frame.size());
        report.time("data_generation", () -> {
            for (ColumnConfig config : configs) {
                processEntry(frame, config, mode, sharedState);
            }
        });
        return frame;
    }

    private void processEntry(Frame frame, ColumnConfig config, ExecutionMode mode, SharedGenerationState sharedState) {
        for (String column : config.columnNames()) {
            if (config.disabled()) {
                logger.info("Column {} is disabled, skipping", column);
                continue;
            }
            String strategyName = config.strategy().name();
            try {
                ColumnRequest request = new ColumnRequest(frame, column, frame.size(), config.strategy().params(),
                    config.strategy().isUnique(), config.mask(), sharedState);
                ColumnGenerator<?> generator = pool.getOrCreate(mode, strategyName, request);
                int written = report.time("strategy." + strategyName + "." + column, () -> applicator.apply(generator));
                if (config.intermediate()) {
                    frame.markIntermediate(column);
                }
                logger.trace("Column {} - {} wrote {} rows", column, strategyName, written);
            } catch (RuntimeException e) {
                logger.error("Column {} - Error: {}", column, e.getMessage());
                throw e;
            }
        }
    }
}
