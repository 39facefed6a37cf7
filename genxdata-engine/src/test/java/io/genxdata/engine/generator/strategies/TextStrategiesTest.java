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

import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.GeneratorFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

public class TextStrategiesTest {

    @Test
    public void testPatternMatchesRegex() {
        ColumnGenerator<?> codes = GeneratorFixtures.create("PATTERN_STRATEGY", "code", 50,
            Map.of("regex", "^[A-Z]{3}-[0-9]{4}$", "seed", 12));
        assertThat(codes.generateChunk(50)).allSatisfy(v -> assertThat((String) v).matches("[A-Z]{3}-[0-9]{4}"));
    }

    @Test
    public void testPatternAnchorsAreStripped() {
        assertThat(PatternGenerator.stripAnchors("^abc$")).isEqualTo("abc");
        assertThat(PatternGenerator.stripAnchors("price\\$")).isEqualTo("price\\$");
    }

    @Test
    public void testUuidVersion5IsDeterministicAndContinues() {
        Map<String, Object> params = Map.of("seed", 1);
        ColumnGenerator<?> first = GeneratorFixtures.create("UUID_STRATEGY", "id", 4, params);
        ColumnGenerator<?> second = GeneratorFixtures.create("UUID_STRATEGY", "id", 4, params);

        List<Object> whole = first.generateChunk(4);
        List<Object> chunked = new ArrayList<>(second.generateChunk(2));
        chunked.addAll(second.generateChunk(2));

        assertThat(chunked).isEqualTo(whole);
        assertThat(new HashSet<>(whole)).hasSize(4);
        assertThat(UUID.fromString((String) whole.get(0)).version()).isEqualTo(5);
    }

    @Test
    public void testUuidNamespaceDependsOnColumn() {
        Object a = GeneratorFixtures.create("UUID_STRATEGY", "a", 1, Map.of("seed", 1)).generateChunk(1).get(0);
        Object b = GeneratorFixtures.create("UUID_STRATEGY", "b", 1, Map.of("seed", 1)).generateChunk(1).get(0);
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    public void testUuidKnownNameBasedValue() {
        assertThat(UuidGenerator.nameBased(UuidGenerator.NAMESPACE_DNS, "www.example.com"))
            .isEqualTo(UUID.fromString("2ed6657d-e927-568b-95e1-2665a8aea6a2"));
    }

    @Test
    public void testUuidRendering() {
        ColumnGenerator<?> plain = GeneratorFixtures.create("UUID_STRATEGY", "id", 3,
            Map.of("hyphens", false, "uppercase", true, "prefix", "ID-", "version", 4, "seed", 3));
        assertThat(plain.generateChunk(3)).allSatisfy(v -> assertThat((String) v).matches("ID-[0-9A-F]{32}"));

        ColumnGenerator<?> digits = GeneratorFixtures.create("UUID_STRATEGY", "id", 3, Map.of("numbers_only", true));
        assertThat(digits.generateChunk(3)).allSatisfy(v -> {
            assertThat((String) v).matches("\\d+");
            assertThat(new BigInteger((String) v).bitLength()).isLessThanOrEqualTo(128);
        });
    }

    @Test
    public void testRandomNames() {
        ColumnGenerator<?> names = GeneratorFixtures.create("RANDOM_NAME_STRATEGY", "name", 20,
            Map.of("name_type", "full", "case", "upper", "seed", 21));
        assertThat(names.generateChunk(20)).allSatisfy(v -> {
            String name = (String) v;
            assertThat(name).contains(" ");
            assertThat(name).isEqualTo(name.toUpperCase());
        });
    }

    @Test
    public void testRandomNamesAreSeeded() {
        Map<String, Object> params = Map.of("gender", "female", "seed", 77);
        assertThat(GeneratorFixtures.create("RANDOM_NAME_STRATEGY", "n", 10, params).generateChunk(10))
            .isEqualTo(GeneratorFixtures.create("RANDOM_NAME_STRATEGY", "n", 10, params).generateChunk(10));
    }

    @Test
    public void testGenderedFirstNames() {
        for (String gender : List.of("male", "female")) {
            ColumnGenerator<?> names = GeneratorFixtures.create("RANDOM_NAME_STRATEGY", "first", 15,
                Map.of("gender", gender, "seed", 5));
            assertThat(names.generateChunk(15)).hasSize(15).allSatisfy(v -> {
                String name = (String) v;
                assertThat(name).isNotBlank();
                assertThat(Character.isUpperCase(name.charAt(0))).isTrue();
            });
        }
    }

    @Test
    public void testTitleCase() {
        assertThat(RandomNameGenerator.titleCase("mary-JANE o'neil")).isEqualTo("Mary-Jane O'Neil");
    }
}
