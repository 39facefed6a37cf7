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

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class PerformanceReportTest {

    @Test
    public void testStagesAreCountedAndSorted() {
        PerformanceReport report = new PerformanceReport();
        int value = report.time("b_stage", () -> 42);
        report.time("a_stage", () -> { });
        report.time("a_stage", () -> { });

        assertThat(value).isEqualTo(42);
        Map<String, Map<String, Object>> summary = report.summary();
        assertThat(summary.keySet()).containsExactly("a_stage", "b_stage");
        assertThat(summary.get("a_stage")).containsEntry("count", 2L).containsKeys("total_ms", "mean_ms", "max_ms");
        assertThat(report.generateReport()).contains("GenXData Performance Report").contains("a_stage");
    }

    @Test
    public void testEmptyReport() {
        assertThat(new PerformanceReport().summary()).isEmpty();
    }
}
