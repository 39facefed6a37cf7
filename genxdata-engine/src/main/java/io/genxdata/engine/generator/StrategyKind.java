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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of column strategies, each with the configuration name it is
 * requested by and any legacy aliases.
 */
public enum StrategyKind {
    RANDOM_NUMBER_RANGE("RANDOM_NUMBER_RANGE_STRATEGY"),
    DISTRIBUTED_NUMBER_RANGE("DISTRIBUTED_NUMBER_RANGE_STRATEGY"),
    RANDOM_DATE_RANGE("RANDOM_DATE_RANGE_STRATEGY", "DATE_GENERATOR_STRATEGY"),
    DATE_SERIES("DATE_SERIES_STRATEGY"),
    DISTRIBUTED_DATE_RANGE("DISTRIBUTED_DATE_RANGE_STRATEGY"),
    PATTERN("PATTERN_STRATEGY"),
    SERIES("SERIES_STRATEGY"),
    DISTRIBUTED_CHOICE("DISTRIBUTED_CHOICE_STRATEGY"),
    TIME_RANGE("TIME_RANGE_STRATEGY"),
    DISTRIBUTED_TIME_RANGE("DISTRIBUTED_TIME_RANGE_STRATEGY"),
    REPLACEMENT("REPLACEMENT_STRATEGY"),
    CONCAT("CONCAT_STRATEGY"),
    RANDOM_NAME("RANDOM_NAME_STRATEGY"),
    DELETE("DELETE_STRATEGY"),
    MAPPING("MAPPING_STRATEGY"),
    UUID("UUID_STRATEGY");

    private final String strategyName;
    private final List<String> aliases;

    StrategyKind(String strategyName, String... aliases) {
        this.strategyName = strategyName;
        this.aliases = List.of(aliases);
    }

    /// @return the name used in configuration files, e.g. {@code SERIES_STRATEGY}
    public String strategyName() {
        return strategyName;
    }

    public List<String> aliases() {
        return aliases;
    }

    /// @return the name of the logger handed to generators of this kind
    public String loggerName() {
        return "genxdata.strategies." + name().toLowerCase(Locale.ROOT);
    }

    /// Looks up a kind by configuration name or alias, ignoring case and surrounding blanks.
    public static Optional<StrategyKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toUpperCase(Locale.ROOT);
        for (StrategyKind kind : values()) {
            if (kind.strategyName.equals(wanted) || kind.aliases.contains(wanted)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return strategyName;
    }
}
