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
import io.genxdata.engine.generator.GeneratorRegistry;
import io.genxdata.engine.generator.params.ParamsDecoder;
import io.genxdata.engine.mask.MaskExpression;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks a {@link DatasetConfig} before any rows are generated.
 *
 * <p>Structure is checked first, then every enabled entry's strategy is resolved, its
 * parameters decoded and validated, and its mask parsed. The first problem found is
 * thrown.
 */
public final class ConfigValidator {

    private final Logger logger;

    public ConfigValidator(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * @throws ConfigurationException for structural problems
     * @throws InvalidConfigParamException for invalid parameters or masks
     * @throws io.genxdata.engine.errors.UnsupportedStrategyException for unknown strategies
     */
    public void validate(DatasetConfig config) {
        if (config.columnNames().isEmpty()) {
            throw new ConfigurationException("'column_name' must list at least one column");
        }
        if (config.numOfRows() == null) {
            throw new ConfigurationException("'num_of_rows' is required");
        }
        if (config.numOfRows() < 0) {
            throw new ConfigurationException("'num_of_rows' cannot be negative, got " + config.numOfRows());
        }
        if (config.configs().isEmpty()) {
            throw new ConfigurationException("'configs' must contain at least one entry");
        }

        Set<String> declared = new HashSet<>(config.columnNames());
        List<ColumnConfig> entries = config.configs();
        for (int i = 0; i < entries.size(); i++) {
            validateEntry(i, entries.get(i), declared);
        }
        logger.debug("Configuration '{}' is valid: {} columns, {} entries",
            config.name(), config.columnNames().size(), entries.size());
    }

    private void validateEntry(int index, ColumnConfig entry, Set<String> declared) {
        if (entry.columnNames().isEmpty()) {
            throw new ConfigurationException("Each config entry must include 'column_names' (entry " + index + ")");
        }
        if (entry.strategy() == null || entry.strategy().name() == null || entry.strategy().name().isBlank()) {
            throw new ConfigurationException("Config entry for " + entry.columnNames() + " has no strategy name");
        }
        if (entry.disabled()) {
            return;
        }

        GeneratorRegistry.Registration registration = GeneratorRegistry.resolve(entry.strategy().name());
        try {
            ParamsDecoder.decode(registration.kind().strategyName(), registration.paramsType(),
                entry.strategy().params());
        } catch (InvalidConfigParamException e) {
            throw new InvalidConfigParamException(e.getParameter(),
                "Column(s) " + entry.columnNames() + ": " + e.getMessage(), e);
        }
        if (entry.hasMask()) {
            MaskExpression.compile(entry.mask());
        }
        for (String column : entry.columnNames()) {
            if (!entry.intermediate() && !declared.contains(column)) {
                logger.warn("Column '{}' is generated but not listed in 'column_name'; it will be written last",
                    column);
            }
        }
    }
}
