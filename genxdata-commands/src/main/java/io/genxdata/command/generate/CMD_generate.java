package io.genxdata.command.generate;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.genxdata.command.common.ConfigLoader;
import io.genxdata.command.common.DataOrchestrator;
import io.genxdata.command.common.LogLevelOption;
import io.genxdata.engine.config.DatasetConfig;
import io.genxdata.engine.config.GenerationSettings;
import io.genxdata.engine.errors.GenXDataException;
import io.genxdata.engine.processing.ProcessingResult;
import io.genxdata.engine.processing.ProcessorType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Generate a dataset from a YAML or JSON configuration file and print the result as JSON.
@CommandLine.Command(name = "generate",
    header = "Generate synthetic data from a configuration file",
    description = "Runs a dataset configuration in one pass, or in chunks when a stream or batch " +
                  "configuration is given, and prints the processing result as JSON.",
    exitCodeList = {"0: success", "2: generation failed"})
public class CMD_generate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_generate.class);
    private static final ObjectMapper json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Parameters(index = "0", description = "Dataset configuration file (.yaml, .yml or .json)")
    private Path config;

    @CommandLine.Option(names = "--stream", description = "Streaming configuration file; chunks are published to a message queue")
    private Path stream;

    @CommandLine.Option(names = "--batch", description = "Batch configuration file; chunks are written to one file each")
    private Path batch;

    @CommandLine.Option(names = "--perf-report", description = "Attach stage timings to the result")
    private boolean perfReport;

    @CommandLine.Option(names = "--shuffle", description = "Shuffle rows when the configuration does not say otherwise")
    private boolean shuffle;

    @CommandLine.Mixin
    private LogLevelOption logLevel = new LogLevelOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public CMD_generate() {
    }

    @Override
    public Integer call() {
        logLevel.apply();
        GenerationSettings settings = GenerationSettings.builder()
            .perfReport(perfReport)
            .shuffle(shuffle)
            .build();

        ProcessingResult result;
        try {
            DatasetConfig dataset = ConfigLoader.loadDataset(config);
            result = new DataOrchestrator(dataset, settings, stream, batch).run();
        } catch (GenXDataException e) {
            logger.error("Could not load {}: {}", config, e.getMessage());
            result = ProcessingResult.error(stream != null || batch != null ? ProcessorType.STREAMING : ProcessorType.NORMAL,
                String.valueOf(config.getFileName()), e.getMessage()).errorCode(e.getErrorCode()).build();
        }

        try {
            spec.commandLine().getOut().println(json.writeValueAsString(result.toMap()));
        } catch (JsonProcessingException e) {
            logger.error("Could not render result: {}", e.getMessage());
            spec.commandLine().getOut().println(result);
        }
        spec.commandLine().getOut().flush();
        return result.isSuccess() ? 0 : 2;
    }
}
