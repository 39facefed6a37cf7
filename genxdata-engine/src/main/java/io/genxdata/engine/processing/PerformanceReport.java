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

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/// Stage timings of one pipeline run, recorded as Micrometer timers.
///
/// Stage names in use:
/// - `data_generation`: the column loop over one frame
/// - `strategy.<STRATEGY_NAME>.<column>`: one column application
/// - `shuffle_data`, `filter_intermediate_columns`
/// - `file_writing`: one sink write
/// - `chunk_processing`: one whole chunk of a chunked run
public class PerformanceReport {

    static final String PREFIX = "genxdata.";

    private final MeterRegistry meterRegistry;

    public PerformanceReport() {
        this(new SimpleMeterRegistry());
    }

    /// @param meterRegistry the registry timers are recorded in
    public PerformanceReport(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public <T> T time(String stage, Supplier<T> work) {
        return timer(stage).record(work);
    }

    public void time(String stage, Runnable work) {
        timer(stage).record(work);
    }

    private Timer timer(String stage) {
        return Timer.builder(PREFIX + stage)
            .description("GenXData stage " + stage)
            .register(meterRegistry);
    }

    /// @return per stage: count, total_ms, mean_ms and max_ms, sorted by stage name
    public Map<String, Map<String, Object>> summary() {
        Map<String, Map<String, Object>> summary = new TreeMap<>();
        for (Meter meter : meterRegistry.getMeters()) {
            String name = meter.getId().getName();
            if (meter instanceof Timer && name.startsWith(PREFIX)) {
                summary.put(name.substring(PREFIX.length()), stats((Timer) meter));
            }
        }
        return new LinkedHashMap<>(summary);
    }

    private static Map<String, Object> stats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("count", timer.count());
        stats.put("total_ms", round(timer.totalTime(TimeUnit.MILLISECONDS)));
        stats.put("mean_ms", round(timer.mean(TimeUnit.MILLISECONDS)));
        stats.put("max_ms", round(timer.max(TimeUnit.MILLISECONDS)));
        return stats;
    }

    private static double round(double millis) {
        return Math.round(millis * 1000.0) / 1000.0;
    }

    /// Human-readable table of the recorded stages.
    public String generateReport() {
        StringBuilder report = new StringBuilder("=== GenXData Performance Report ===\n");
        summary().forEach((stage, stats) -> report.append(String.format("  %-40s %6d calls  total %10.3f ms  mean %8.3f ms%n",
            stage, (Long) stats.get("count"), (Double) stats.get("total_ms"), (Double) stats.get("mean_ms"))));
        return report.toString();
    }
}
