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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class NumericStrategiesTest {

    @Test
    public void testSeriesDefaults() {
        ColumnGenerator<?> series = GeneratorFixtures.create("SERIES_STRATEGY", "id", 4, Map.of());
        assertThat(series.generateChunk(4)).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    public void testSeriesWithFractionalStep() {
        ColumnGenerator<?> series = GeneratorFixtures.create("SERIES_STRATEGY", "v", 3,
            Map.of("start", 0.5, "step", 0.25));
        assertThat(series.generateChunk(3)).containsExactly(0.5, 0.75, 1.0);
    }

    @Test
    public void testSeriesChunksMatchSingleGeneration() {
        ColumnGenerator<?> chunked = GeneratorFixtures.create("SERIES_STRATEGY", "v", 5, Map.of("start", -3, "step", 2));
        ColumnGenerator<?> whole = GeneratorFixtures.create("SERIES_STRATEGY", "v", 5, Map.of("start", -3, "step", 2));
        List<Object> combined = new ArrayList<>(chunked.generateChunk(2));
        combined.addAll(chunked.generateChunk(3));
        assertThat(combined).isEqualTo(whole.generateChunk(5));
    }

    @Test
    public void testSeriesStateSnapshot() {
        ColumnGenerator<?> series = GeneratorFixtures.create("SERIES_STRATEGY", "id", 3, Map.of("start", 5));
        series.generateChunk(3);
        assertThat(series.currentState().stateful()).isTrue();
        assertThat(series.currentState().details()).containsEntry("next_value", 8L).containsEntry("step", 1L);
    }

    @Test
    public void testRandomNumberRangeStaysOnGrid() {
        ColumnGenerator<?> numbers = GeneratorFixtures.create("RANDOM_NUMBER_RANGE_STRATEGY", "n", 200,
            Map.of("start", 10, "end", 20, "step", 5, "seed", 1));
        assertThat(numbers.generateChunk(200)).allSatisfy(v -> assertThat(v).isIn(10L, 15L));
    }

    @Test
    public void testRandomNumberRangeDecimalPrecision() {
        ColumnGenerator<?> numbers = GeneratorFixtures.create("RANDOM_NUMBER_RANGE_STRATEGY", "n", 100,
            Map.of("start", 0.0, "end", 1.0, "precision", 2, "seed", 3));
        for (Object value : numbers.generateChunk(100)) {
            double d = (Double) value;
            assertThat(d).isBetween(0.0, 1.0);
            assertThat(Math.round(d * 100) / 100.0).isEqualTo(d);
        }
    }

    @Test
    public void testSeedMakesRandomOutputReproducible() {
        Map<String, Object> params = Map.of("start", 0, "end", 1000, "seed", 42);
        List<Object> a = GeneratorFixtures.create("RANDOM_NUMBER_RANGE_STRATEGY", "n", 20, params).generateChunk(20);
        List<Object> b = GeneratorFixtures.create("RANDOM_NUMBER_RANGE_STRATEGY", "n", 20, params).generateChunk(20);
        assertThat(a).isEqualTo(b);
    }

    @Test
    public void testDistributedNumberRangeHonorsRanges() {
        ColumnGenerator<?> numbers = GeneratorFixtures.create("DISTRIBUTED_NUMBER_RANGE_STRATEGY", "n", 500,
            Map.of("seed", 9, "ranges", List.of(
                Map.of("start", 1, "end", 5, "distribution", 50),
                Map.of("start", 100, "end", 105, "distribution", 50))));
        List<Object> values = numbers.generateChunk(500);
        assertThat(values).allSatisfy(v -> {
            long n = (Long) v;
            assertThat(n >= 1 && n <= 5 || n >= 100 && n <= 105).isTrue();
        });
        assertThat(values).anySatisfy(v -> assertThat((Long) v).isLessThanOrEqualTo(5L));
        assertThat(values).anySatisfy(v -> assertThat((Long) v).isGreaterThanOrEqualTo(100L));
    }

    @Test
    public void testDistributedChoiceExactProportions() {
        ColumnGenerator<?> choice = GeneratorFixtures.create("DISTRIBUTED_CHOICE_STRATEGY", "tier", 100,
            Map.of("choices", Map.of("gold", 20, "silver", 30, "bronze", 50), "seed", 5));
        List<Object> values = choice.generateChunk(100);
        assertThat(Collections.frequency(values, "gold")).isEqualTo(20);
        assertThat(Collections.frequency(values, "silver")).isEqualTo(30);
        assertThat(Collections.frequency(values, "bronze")).isEqualTo(50);
    }

    @Test
    public void testDistributedChoiceFillsRemainder() {
        ColumnGenerator<?> choice = GeneratorFixtures.create("DISTRIBUTED_CHOICE_STRATEGY", "flag", 7,
            Map.of("choices", Map.of("Y", 50, "N", 50)));
        List<Object> values = choice.generateChunk(7);
        assertThat(values).hasSize(7).containsOnly("Y", "N");
        assertThat(Collections.frequency(values, "Y")).isBetween(3, 4);
    }
}
