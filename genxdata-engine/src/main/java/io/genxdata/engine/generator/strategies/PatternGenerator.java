package io.genxdata.engine.generator.strategies;

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

import com.google.auto.service.AutoService;
import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.GeneratorKind;
import io.genxdata.engine.generator.ParamsType;
import io.genxdata.engine.generator.StrategyKind;
import io.genxdata.engine.generator.params.PatternParams;
import net.datafaker.Faker;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/// Random strings matching {@code regex}, produced by Datafaker's regexify.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.PATTERN)
@ParamsType(PatternParams.class)
public class PatternGenerator extends AbstractRandomGenerator<PatternParams> {

    private Faker faker;
    private String template;

    @Override
    protected void configure() {
        if (faker == null) {
            faker = new Faker(new Random(effectiveSeed()));
        }
        template = stripAnchors(params.regex());
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(faker.regexify(template));
        }
        return values;
    }

    // regexify produces whole strings, anchors are implied
    static String stripAnchors(String regex) {
        String stripped = regex;
        if (stripped.startsWith("^")) {
            stripped = stripped.substring(1);
        }
        if (stripped.endsWith("$") && !stripped.endsWith("\\$")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }
}
