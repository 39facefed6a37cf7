package io.genxdata.command;

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

import io.genxdata.command.generate.CMD_generate;
import io.genxdata.command.strategies.CMD_strategies;
import picocli.CommandLine;

/// Synthetic tabular data generation.
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "genxdata",
    mixinStandardHelpOptions = true,
    version = "genxdata 0.1.0",
    subcommands = {CommandLine.HelpCommand.class, CMD_generate.class, CMD_strategies.class})
public class CMD_genxdata {

    /// run a genxdata command
    /// @param args command line args
    public static void main(String[] args) {
        int exitCode = new CommandLine(new CMD_genxdata()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }
}
