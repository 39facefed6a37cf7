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
import io.genxdata.engine.generator.params.RandomNameParams;
import net.datafaker.Faker;
import net.datafaker.providers.base.Name;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/// Person names from Datafaker, filtered by gender and rendered in the configured case.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.RANDOM_NAME)
@ParamsType(RandomNameParams.class)
public class RandomNameGenerator extends AbstractRandomGenerator<RandomNameParams> {

    private Faker faker;

    @Override
    protected void configure() {
        if (faker == null) {
            faker = new Faker(new Random(effectiveSeed()));
        }
    }

    @Override
    public List<Object> generateChunk(int count) {
        Name names = faker.name();
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String name;
            switch (params.nameType()) {
                case "last":
                    name = names.lastName();
                    break;
                case "full":
                    name = firstName(names) + " " + names.lastName();
                    break;
                default:
                    name = firstName(names);
            }
            values.add(applyCase(name));
        }
        return values;
    }

    private String firstName(Name names) {
        switch (params.gender()) {
            case "male":
                return names.malefirstName();
            case "female":
                return names.femaleFirstName();
            default:
                return rng().nextBoolean() ? names.malefirstName() : names.femaleFirstName();
        }
    }

    private String applyCase(String name) {
        switch (params.letterCase()) {
            case "upper":
                return name.toUpperCase(Locale.ROOT);
            case "lower":
                return name.toLowerCase(Locale.ROOT);
            default:
                return titleCase(name);
        }
    }

    static String titleCase(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean startOfWord = true;
        for (char c : name.toCharArray()) {
            sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
            startOfWord = Character.isWhitespace(c) || c == '-' || c == '\'';
        }
        return sb.toString();
    }
}
