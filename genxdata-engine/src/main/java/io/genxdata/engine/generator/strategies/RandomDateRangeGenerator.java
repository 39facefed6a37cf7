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
import io.genxdata.engine.generator.params.RandomDateRangeParams;
import io.genxdata.engine.generator.validation.DateFormats;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/// Uniform dates between {@code start_date} and {@code end_date}, both inclusive.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.RANDOM_DATE_RANGE)
@ParamsType(RandomDateRangeParams.class)
public class RandomDateRangeGenerator extends AbstractRandomGenerator<RandomDateRangeParams> {

    private DateSpan span;

    @Override
    protected void configure() {
        span = DateSpan.of(
            DateFormats.parseDateTime(params.startDate(), params.format()),
            DateFormats.parseDateTime(params.endDate(), params.format()));
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            LocalDateTime date = span.sample(this::nextLong);
            values.add(DateFormats.format(date, params.outputFormat()));
        }
        return values;
    }
}
