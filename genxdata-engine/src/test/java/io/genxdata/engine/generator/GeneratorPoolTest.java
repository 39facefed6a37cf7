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

import io.genxdata.engine.errors.InvalidConfigParamException;
import io.genxdata.engine.errors.UnsupportedStrategyException;
import io.genxdata.engine.frame.Frame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class GeneratorPoolTest {

    private GeneratorPool pool;
    private ConditionalApplicator applicator;
    private SharedGenerationState state;

    @BeforeEach
    public void setUp() {
        pool = GeneratorFixtures.pool();
        applicator = GeneratorFixtures.applicator();
        state = new SharedGenerationState();
    }

    @Test
    public void testSeriesContinuesAcrossChunks() {
        Map<String, Object> params = Map.of("start", 1, "step", 1);

        Frame first = Frame.empty(3);
        ColumnGenerator<?> generator = pool.getOrCreate(ExecutionMode.STREAM_OR_BATCH, "SERIES_STRATEGY",
            ColumnRequest.of(first, "id", params, state));
        applicator.apply(generator);

        Frame second = Frame.empty(3);
        ColumnGenerator<?> reused = pool.getOrCreate(ExecutionMode.STREAM_OR_BATCH, "SERIES_STRATEGY",
            ColumnRequest.of(second, "id", params, state));
        applicator.apply(reused);

        assertThat(reused).isSameAs(generator);
        assertThat(pool.size()).isEqualTo(1);
        assertThat(first.column("id")).containsExactly(1L, 2L, 3L);
        assertThat(second.column("id")).containsExactly(4L, 5L, 6L);

        GenerationState recorded = state.get(new PoolKey(StrategyKind.SERIES, "id")).orElseThrow();
        assertThat(recorded.getLastValue()).isEqualTo(6L);
        assertThat(recorded.getLastIndex()).isEqualTo(6L);
    }

    @Test
    public void testNormalModeRestartsEveryGeneration() {
        Map<String, Object> params = Map.of("start", 10, "step", 5);
        Frame first = Frame.empty(2);
        applicator.apply(pool.getOrCreate(ExecutionMode.NORMAL, "SERIES_STRATEGY",
            ColumnRequest.of(first, "n", params, state)));
        Frame second = Frame.empty(2);
        applicator.apply(pool.getOrCreate(ExecutionMode.NORMAL, "SERIES_STRATEGY",
            ColumnRequest.of(second, "n", params, state)));

        assertThat(first.column("n")).containsExactly(10L, 15L);
        assertThat(second.column("n")).containsExactly(10L, 15L);
    }

    @Test
    public void testChangedParametersKeepSequenceState() {
        Frame first = Frame.empty(2);
        ColumnGenerator<?> generator = pool.getOrCreate(ExecutionMode.STREAM_OR_BATCH, "SERIES_STRATEGY",
            ColumnRequest.of(first, "n", Map.of("start", 1, "step", 1), state));
        applicator.apply(generator);

        Frame second = Frame.empty(2);
        ColumnGenerator<?> updated = pool.getOrCreate(ExecutionMode.STREAM_OR_BATCH, "SERIES_STRATEGY",
            ColumnRequest.of(second, "n", Map.of("start", 1, "step", 10), state));
        applicator.apply(updated);

        assertThat(updated).isSameAs(generator);
        assertThat(updated.context().params()).containsEntry("step", 10);
        assertThat(second.column("n")).containsExactly(3L, 13L);
    }

    @Test
    public void testSameStrategyOnDifferentColumnsIsPooledSeparately() {
        Frame frame = Frame.empty(2);
        ColumnGenerator<?> a = pool.getOrCreate(ExecutionMode.STREAM_OR_BATCH, "SERIES_STRATEGY",
            ColumnRequest.of(frame, "a", Map.of(), state));
        ColumnGenerator<?> b = pool.getOrCreate(ExecutionMode.STREAM_OR_BATCH, "SERIES_STRATEGY",
            ColumnRequest.of(frame, "b", Map.of(), state));
        assertThat(a).isNotSameAs(b);
        assertThat(pool.contains(new PoolKey(StrategyKind.SERIES, "a"))).isTrue();
        assertThat(pool.contains(new PoolKey(StrategyKind.SERIES, "b"))).isTrue();
    }

    @Test
    public void testFreshPoolResumesFromSharedState() {
        Map<String, Object> params = Map.of("start", 1);
        Frame first = Frame.empty(4);
        applicator.apply(pool.getOrCreate(ExecutionMode.STREAM_OR_BATCH, "SERIES_STRATEGY",
            ColumnRequest.of(first, "id", params, state)));

        GeneratorPool restarted = GeneratorFixtures.pool();
        Frame second = Frame.empty(2);
        applicator.apply(restarted.getOrCreate(ExecutionMode.STREAM_OR_BATCH, "SERIES_STRATEGY",
            ColumnRequest.of(second, "id", params, state)));

        assertThat(second.column("id")).containsExactly(5L, 6L);
    }

    @Test
    public void testErrorsSurfaceBeforeGeneration() {
        Frame frame = Frame.empty(1);
        assertThatThrownBy(() -> pool.getOrCreate(ExecutionMode.NORMAL, "MISSING_STRATEGY",
            ColumnRequest.of(frame, "x", Map.of(), state)))
            .isInstanceOf(UnsupportedStrategyException.class);
        assertThatThrownBy(() -> pool.getOrCreate(ExecutionMode.NORMAL, "RANDOM_NUMBER_RANGE_STRATEGY",
            ColumnRequest.of(frame, "x", Map.of("start", 5, "end", 1), state)))
            .isInstanceOf(InvalidConfigParamException.class);
        assertThat(pool.size()).isZero();
        assertThat(frame.columnNames()).isEqualTo(List.of());
    }
}
