package io.genxdata.engine.generator.strategies;

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

import com.google.auto.service.AutoService;
import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.GeneratorKind;
import io.genxdata.engine.generator.ParamsType;
import io.genxdata.engine.generator.StrategyKind;
import io.genxdata.engine.generator.params.TimeRangeParams;
import io.genxdata.engine.generator.validation.DateFormats;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/// Uniform times of day between {@code start_time} and {@code end_time}, both inclusive.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.TIME_RANGE)
@ParamsType(TimeRangeParams.class)
public class TimeRangeGenerator extends AbstractRandomGenerator<TimeRangeParams> {

    static final LocalDate EPOCH_DAY = LocalDate.of(1900, 1, 1);

    private TimeOfDaySpan span;

    @Override
    protected void configure() {
        span = TimeOfDaySpan.of(
            DateFormats.parseTime(params.startTime(), params.format()),
            DateFormats.parseTime(params.endTime(), params.format()));
        if (span.overnight()) {
            logger.debug("Time range {} - {} for '{}' wraps past midnight",
                params.startTime(), params.endTime(), context.column());
        }
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(DateFormats.format(LocalDateTime.of(EPOCH_DAY, span.sample(this::nextLong)),
                params.outputFormat()));
        }
        return values;
    }
}
