package io.genxdata.engine.processing;

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

import io.genxdata.engine.config.ColumnConfig;
import io.genxdata.engine.config.DatasetConfig;
import io.genxdata.engine.config.GenerationSettings;
import io.genxdata.engine.config.StrategySpec;
import io.genxdata.engine.frame.Frame;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class SinglePassProcessorTest {

    static ColumnConfig column(String name, String strategy, Map<String, Object> params) {
        return new ColumnConfig(List.of(name), new StrategySpec(strategy, params, null), null, null, null);
    }

    static DatasetConfig employees(int rows) {
        return new DatasetConfig(new DatasetConfig.Metadata("employees"), List.of("id", "name", "dept"), rows, null,
            List.of(
                column("id", "SERIES_STRATEGY", Map.of("start", 1)),
                new ColumnConfig(List.of("first"), new StrategySpec("RANDOM_NAME_STRATEGY", Map.of("seed", 3), null),
                    null, true, null),
                column("name", "CONCAT_STRATEGY", Map.of("lhs_col", "first", "prefix", "Dr. ")),
                column("dept", "DISTRIBUTED_CHOICE_STRATEGY", Map.of("choices", Map.of("eng", 60, "ops", 40)))),
            null);
    }

    @Test
    public void testIntermediateColumnsAreNotWritten() {
        RecordingSink sink = new RecordingSink();
        ProcessingResult result = new SinglePassProcessor(employees(100), sink, GenerationSettings.defaults()).process();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.processorType()).isEqualTo(ProcessorType.NORMAL);
        assertThat(result.rowsGenerated()).isEqualTo(100);
        assertThat(result.columnNames()).containsExactly("id", "name", "dept");
        assertThat(result.columnsGenerated()).isEqualTo(3);
        assertThat(result.writerSummary()).containsEntry("writer_type", "memory").containsEntry("destination", "memory");
        assertThat(result.performanceReport()).isNull();

        assertThat(sink.frames).hasSize(1);
        assertThat(sink.metadata).hasSize(1);
        assertThat(sink.metadata.get(0)).isNull();
        assertThat(sink.finishCalls).isEqualTo(1);
        Frame written = sink.frames.get(0);
        assertThat(written.hasColumn("first")).isFalse();
        assertThat(written.get("id", 99)).isEqualTo(100L);
        assertThat((String) written.get("name", 0)).startsWith("Dr. ");
    }

    @Test
    public void testShuffleKeepsEveryRow() {
        DatasetConfig shuffled = new DatasetConfig(null, List.of("id"), 50, true,
            List.of(column("id", "SERIES_STRATEGY", Map.of())), null);
        RecordingSink sink = new RecordingSink();

        ProcessingResult result = new SinglePassProcessor(shuffled, sink, null).process();

        assertThat(result.isSuccess()).isTrue();
        assertThat(new HashSet<>(sink.column("id"))).hasSize(50);
        assertThat(result.configName()).isEqualTo("unnamed");
    }

    @Test
    public void testRowCountRaisedToMinimum() {
        RecordingSink sink = new RecordingSink();
        GenerationSettings settings = GenerationSettings.builder().minimumRows(5).build();
        ProcessingResult result = new SinglePassProcessor(employees(2), sink, settings).process();
        assertThat(result.rowsGenerated()).isEqualTo(5);
    }

    @Test
    public void testPerformanceReport() {
        RecordingSink sink = new RecordingSink();
        GenerationSettings settings = GenerationSettings.builder().perfReport(true).build();
        ProcessingResult result = new SinglePassProcessor(employees(10), sink, settings).process();

        assertThat(result.performanceReport())
            .containsKeys("data_generation", "file_writing", "filter_intermediate_columns",
                "strategy.SERIES_STRATEGY.id", "strategy.RANDOM_NAME_STRATEGY.first");
        assertThat(result.performanceReport().get("data_generation")).containsEntry("count", 1L);
        assertThat(result.toMap()).containsKey("performance_report");
    }

    @Test
    public void testInvalidConfigurationBecomesErrorResult() {
        DatasetConfig broken = new DatasetConfig(null, List.of("id"), 10, null,
            List.of(column("id", "NOT_A_STRATEGY", Map.of())), null);
        RecordingSink sink = new RecordingSink();

        ProcessingResult result = new SinglePassProcessor(broken, sink, null).process();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isEqualTo("Unsupported strategy: NOT_A_STRATEGY");
        assertThat(result.errorCode()).isEqualTo("CFG002");
        assertThat(result.toMap()).containsOnlyKeys("status", "processor_type", "config_name", "error", "error_code");
        assertThat(result.toMap()).containsEntry("status", "error");
        assertThat(sink.frames).isEmpty();
    }

    @Test
    public void testUniquenessFailureIsReported() {
        DatasetConfig narrow = new DatasetConfig(null, List.of("n"), 10, null,
            List.of(new ColumnConfig(List.of("n"),
                new StrategySpec("RANDOM_NUMBER_RANGE_STRATEGY", Map.of("start", 0, "end", 3), true),
                null, null, null)),
            null);
        ProcessingResult result = new SinglePassProcessor(narrow, new RecordingSink(), null).process();
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorCode()).isEqualTo("STR001");
    }
}
