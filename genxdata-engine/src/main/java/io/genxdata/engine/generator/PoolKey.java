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

import java.util.Objects;

/**
 * Identity of a pooled generator and of its entry in {@link SharedGenerationState}.
 *
 * @param kind the strategy kind
 * @param column the column the generator populates
 */
public record PoolKey(StrategyKind kind, String column) {

    public PoolKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(column, "column");
    }

    @Override
    public String toString() {
        return kind.strategyName() + ":" + column;
    }
}
