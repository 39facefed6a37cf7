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

import io.genxdata.command.CMD_genxdata;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_strategiesTest {

    @Test
    public void testListsStrategies() {
        StringWriter sw = new StringWriter();
        CommandLine cmd = new CommandLine(new CMD_genxdata());
        cmd.setOut(new PrintWriter(sw));

        int exitCode = cmd.execute("strategies");

        assertThat(exitCode).isEqualTo(0);
        String output = sw.toString();
        assertThat(output.lines().count()).isEqualTo(16);
        assertThat(output).contains("SERIES_STRATEGY", "UUID_STRATEGY", "DISTRIBUTED_CHOICE_STRATEGY");
        assertThat(output).contains("aliases:");
    }
}
