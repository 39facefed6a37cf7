package io.genxdata.engine.config;

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

import io.genxdata.engine.errors.ConfigurationException;
import io.genxdata.engine.errors.InvalidConfigParamException;
import io.genxdata.engine.errors.UnsupportedStrategyException;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator(LogManager.getLogger(ConfigValidatorTest.class));

    @Test
    public void testValidConfig() {
        assertThatCode(() -> validator.validate(config(10, entry(List.of("id"), "SERIES_STRATEGY", Map.of(), null))))
            .doesNotThrowAnyException();
    }

    @Test
    public void testStructure() {
        assertThatThrownBy(() -> validator.validate(new DatasetConfig(null, List.of(), 1, null,
            List.of(entry(List.of("id"), "SERIES_STRATEGY", Map.of(), null)), null)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("column_name");
        assertThatThrownBy(() -> validator.validate(config(null, entry(List.of("id"), "SERIES_STRATEGY", Map.of(), null))))
            .hasMessageContaining("num_of_rows");
        assertThatThrownBy(() -> validator.validate(config(-1, entry(List.of("id"), "SERIES_STRATEGY", Map.of(), null))))
            .hasMessageContaining("cannot be negative");
        assertThatThrownBy(() -> validator.validate(new DatasetConfig(null, List.of("id"), 1, null, List.of(), null)))
            .hasMessageContaining("configs");
        assertThatThrownBy(() -> validator.validate(config(1, entry(List.of(), "SERIES_STRATEGY", Map.of(), null))))
            .hasMessageContaining("column_names");
        assertThatThrownBy(() -> validator.validate(config(1, new ColumnConfig(List.of("id"), null, null, null, null))))
            .hasMessageContaining("no strategy name");
    }

    @Test
    public void testUnknownStrategy() {
        assertThatThrownBy(() -> validator.validate(config(1, entry(List.of("id"), "FOO_STRATEGY", Map.of(), null))))
            .isInstanceOf(UnsupportedStrategyException.class);
    }

    @Test
    public void testInvalidParamsNameTheColumns() {
        assertThatThrownBy(() -> validator.validate(config(1,
            entry(List.of("age"), "RANDOM_NUMBER_RANGE_STRATEGY", Map.of("start", 9, "end", 1), null))))
            .isInstanceOf(InvalidConfigParamException.class)
            .hasMessageContaining("[age]");
    }

    @Test
    public void testInvalidMask() {
        assertThatThrownBy(() -> validator.validate(config(1, entry(List.of("id"), "SERIES_STRATEGY", Map.of(), "id >"))))
            .isInstanceOf(InvalidConfigParamException.class);
    }

    @Test
    public void testDisabledEntriesAreNotResolved() {
        ColumnConfig disabled = new ColumnConfig(List.of("id"), new StrategySpec("FOO_STRATEGY", null, null),
            null, null, true);
        assertThatCode(() -> validator.validate(config(1, disabled))).doesNotThrowAnyException();
    }

    private static DatasetConfig config(Integer rows, ColumnConfig entry) {
        return new DatasetConfig(null, List.of("id"), rows, null, List.of(entry), null);
    }

    private static ColumnConfig entry(List<String> columns, String strategy, Map<String, Object> params, String mask) {
        return new ColumnConfig(columns, new StrategySpec(strategy, params, null), mask, null, null);
    }
}
