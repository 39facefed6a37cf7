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
import io.genxdata.engine.generator.AbstractColumnGenerator;
import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.GenerationState;
import io.genxdata.engine.generator.GeneratorKind;
import io.genxdata.engine.generator.ParamsType;
import io.genxdata.engine.generator.StrategyKind;
import io.genxdata.engine.generator.params.DateSeriesParams;
import io.genxdata.engine.generator.validation.DateFormats;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A contiguous series of dates starting at {@code start_date}, one {@code freq} apart.
 * The position in the series carries over between chunks.
 */
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.DATE_SERIES)
@ParamsType(DateSeriesParams.class)
public class DateSeriesGenerator extends AbstractColumnGenerator<DateSeriesParams> {

    private LocalDateTime start;
    private DateSeriesParams.Frequency frequency;
    private long position;
    private LocalDateTime businessCursor;

    @Override
    protected void configure() {
        start = params.start();
        frequency = params.frequency();
    }

    @Override
    public void resetState() {
        position = 0;
        businessCursor = rollToBusinessDay(start);
    }

    @Override
    protected void resumeFrom(GenerationState state) {
        advanceTo(state.getLastIndex());
        logger.debug("Resuming date series for '{}' at position {}", context.column(), position);
    }

    @Override
    protected boolean isSequential() {
        return true;
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(DateFormats.format(current(), params.outputFormat()));
            advanceTo(position + 1);
        }
        return values;
    }

    private LocalDateTime current() {
        long steps = position * frequency.multiplier();
        switch (frequency.unit()) {
            case SECOND:
                return start.plusSeconds(steps);
            case MINUTE:
                return start.plusMinutes(steps);
            case HOUR:
                return start.plusHours(steps);
            case DAY:
                return start.plusDays(steps);
            case WEEK:
                return start.plusWeeks(steps);
            case MONTH:
                return start.plusMonths(steps);
            case YEAR:
                return start.plusYears(steps);
            case BUSINESS_DAY:
                return businessCursor;
            default:
                throw new IllegalStateException("Unexpected unit " + frequency.unit());
        }
    }

    private void advanceTo(long target) {
        if (frequency.unit() == DateSeriesParams.Unit.BUSINESS_DAY) {
            while (position < target) {
                for (int i = 0; i < frequency.multiplier(); i++) {
                    businessCursor = rollToBusinessDay(businessCursor.plusDays(1));
                }
                position++;
            }
        } else {
            position = target;
        }
    }

    private static LocalDateTime rollToBusinessDay(LocalDateTime date) {
        LocalDateTime rolled = date;
        while (rolled.getDayOfWeek() == DayOfWeek.SATURDAY || rolled.getDayOfWeek() == DayOfWeek.SUNDAY) {
            rolled = rolled.plusDays(1);
        }
        return rolled;
    }

    @Override
    protected void describeState(Map<String, Object> details) {
        details.put("position", position);
        details.put("next_value", DateFormats.format(current(), params.outputFormat()));
    }
}
