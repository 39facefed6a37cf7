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

import io.genxdata.engine.generator.params.StrategyParams;

import java.util.List;

/**
 * Produces the values of one column, chunk by chunk.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}, must have a
 * public no-argument constructor, and must be annotated with {@link GeneratorKind} and
 * {@link ParamsType}. The factory constructs them, then calls
 * {@link #initialize(GeneratorContext, StrategyParams)} exactly once.
 *
 * <h2>Continuation</h2>
 * {@link #generateChunk(int)} never resets. For sequence generators, generating
 * {@code a} values and then {@code b} values yields the same values as generating
 * {@code a + b} at once. {@link #generateData(int)} is what the conditional layer calls:
 * in {@link ExecutionMode#NORMAL} it resets first, in
 * {@link ExecutionMode#STREAM_OR_BATCH} it never does.
 *
 * <h2>Errors</h2>
 * Parameter problems are reported while the parameter record is decoded, before the
 * generator exists. Generation itself does not validate.
 *
 * @param <P> the parameter record type
 */
public interface ColumnGenerator<P extends StrategyParams> {

    /// Binds the generator to its context and validated parameters and derives its initial state.
    void initialize(GeneratorContext context, P params);

    /// Replaces the parameters of a pooled generator without touching its sequence state.
    void updateParams(P params);

    GeneratorContext context();

    P params();

    /// @return exactly {@code count} values, continuing from the current state
    List<Object> generateChunk(int count);

    /// Generation entry point used by the conditional layer; resets first in normal mode.
    List<Object> generateData(int count);

    /// Extra candidate values for uniqueness backfill.
    default List<Object> sampleMore(int count) {
        return generateChunk(count);
    }

    /// Restores the initial, configuration-derived state.
    void resetState();

    StateSnapshot currentState();

    /// Records the values just written in the shared state.
    void syncState(List<?> values);

    /// @return false when the generator's values are distinct by construction and the unique flag is ignored
    default boolean honorsUniqueness() {
        return true;
    }
}
