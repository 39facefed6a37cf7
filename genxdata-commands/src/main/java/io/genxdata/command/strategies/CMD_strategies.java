package io.genxdata.command.strategies;

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

import io.genxdata.engine.generator.GeneratorRegistry;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// List the registered column strategies.
@CommandLine.Command(name = "strategies",
    header = "List available column strategies",
    description = "Prints every registered strategy name with its aliases and parameter type.",
    exitCodeList = {"0: success"})
public class CMD_strategies implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public CMD_strategies() {
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        for (GeneratorRegistry.Registration registration : GeneratorRegistry.getAll()) {
            StringBuilder line = new StringBuilder(String.format("%-36s %s",
                registration.kind().strategyName(), registration.paramsType().getSimpleName()));
            if (!registration.kind().aliases().isEmpty()) {
                line.append("  (aliases: ").append(String.join(", ", registration.kind().aliases())).append(')');
            }
            out.println(line);
        }
        out.flush();
        return 0;
    }
}
