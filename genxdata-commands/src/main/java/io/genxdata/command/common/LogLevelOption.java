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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared {@code --log-level} option.
 * Applies the requested level to the root logger and the {@code genxdata} loggers.
 */
public class LogLevelOption {

    @CommandLine.Option(
        names = {"-l", "--log-level"},
        description = "Logging level: TRACE, DEBUG, INFO, WARN, ERROR (default: ${DEFAULT-VALUE})",
        defaultValue = "INFO"
    )
    private String logLevel = "INFO";

    public Level level() {
        Level level = Level.toLevel(logLevel, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level: " + logLevel);
        }
        return level;
    }

    /// Sets the configured level on the running Log4j configuration.
    public void apply() {
        Level level = level();
        Configurator.setRootLevel(level);
        Configurator.setLevel("genxdata", level);
        Configurator.setLevel("io.genxdata", level);
    }
}
