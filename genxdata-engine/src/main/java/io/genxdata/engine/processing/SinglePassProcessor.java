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
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.generator.ExecutionMode;
import io.genxdata.engine.generator.SharedGenerationState;
import io.genxdata.engine.sink.FrameSink;
import io.genxdata.engine.sink.WriteResult;

import java.util.LinkedHashMap;
import java.util.Map;

/// Generates the whole dataset in one frame and writes it once.
public class SinglePassProcessor extends AbstractConfigProcessor {

    public SinglePassProcessor(DatasetConfig config, FrameSink sink, GenerationSettings settings) {
        super(config, sink, settings);
    }

    @Override
    public ProcessorType type() {
        return ProcessorType.NORMAL;
    }

    @Override
    public ProcessingResult process() {
        try {
            validate();
            int rows = targetRows();
            logger.info("Generating {} rows for '{}'", rows, config.name());

            Frame frame = generateFrame(newColumnProcessor(), rows, ExecutionMode.NORMAL, new SharedGenerationState());
            WriteResult written = report.time("file_writing", () -> sink.write(frame, null));
            Map<String, Object> summary = new LinkedHashMap<>(sink.finish());
            summary.putIfAbsent("destination", written.destination());
            logger.info("Wrote {} rows of '{}' to {}", written.rowsWritten(), config.name(), written.destination());

            return ProcessingResult.success(type(), config.name())
                .rowsGenerated(frame.size())
                .columnNames(frame.columnNames())
                .writerSummary(summary)
                .performanceReport(performanceSummary())
                .build();
        } catch (RuntimeException e) {
            finishAfterFailure(e);
            return failure(e);
        }
    }
}
