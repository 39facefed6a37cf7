package io.genxdata.engine.generator;

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

import io.genxdata.engine.errors.UnsupportedStrategyException;
import io.genxdata.engine.generator.params.DateSeriesParams;
import io.genxdata.engine.generator.params.RandomDateRangeParams;
import io.genxdata.engine.generator.strategies.RandomDateRangeGenerator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class GeneratorRegistryTest {

    @Test
    public void testEveryStrategyIsRegistered() {
        assertThat(GeneratorRegistry.getAvailableNames()).containsExactlyElementsOf(
            Arrays.stream(StrategyKind.values()).map(StrategyKind::strategyName).collect(Collectors.toList()));
        assertThat(GeneratorRegistry.getAll()).hasSize(16);
    }

    @Test
    public void testRegistrationCarriesAnnotations() {
        GeneratorRegistry.Registration registration = GeneratorRegistry.resolve("RANDOM_DATE_RANGE_STRATEGY");
        assertThat(registration.kind()).isEqualTo(StrategyKind.RANDOM_DATE_RANGE);
        assertThat(registration.type()).isEqualTo(RandomDateRangeGenerator.class);
        assertThat(registration.paramsType()).isEqualTo(RandomDateRangeParams.class);
        assertThat(registration.newInstance()).isNotSameAs(registration.newInstance());
    }

    @Test
    public void testLegacyAliasResolvesToSameStrategy() {
        assertThat(GeneratorRegistry.resolve("DATE_GENERATOR_STRATEGY").kind())
            .isEqualTo(StrategyKind.RANDOM_DATE_RANGE);
        assertThat(GeneratorRegistry.isAvailable("DATE_GENERATOR_STRATEGY")).isTrue();
        assertThat(GeneratorRegistry.find(StrategyKind.DATE_SERIES).orElseThrow().paramsType())
            .isEqualTo(DateSeriesParams.class);
    }

    @Test
    public void testUnknownStrategy() {
        assertThat(GeneratorRegistry.isAvailable("NOPE_STRATEGY")).isFalse();
        assertThatThrownBy(() -> GeneratorRegistry.resolve("NOPE_STRATEGY"))
            .isInstanceOf(UnsupportedStrategyException.class)
            .hasMessage("Unsupported strategy: NOPE_STRATEGY");
    }
}
