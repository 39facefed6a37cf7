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
import io.genxdata.engine.generator.params.SeriesParams;
import io.genxdata.engine.generator.validation.NumericRangeValidator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The arithmetic series {@code start, start + step, ...}.
 *
 * <p>Integer parameters yield longs. Decimal parameters are accumulated exactly and
 * emitted as doubles, so the series does not drift. The next value carries over
 * between chunks; a fresh generator meeting an existing state for its column resumes
 * one step after the last recorded value.
 */
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.SERIES)
@ParamsType(SeriesParams.class)
public class SeriesGenerator extends AbstractColumnGenerator<SeriesParams> {

    private BigDecimal step;
    private boolean integral;
    private BigDecimal next;

    @Override
    protected void configure() {
        integral = params.integral();
        step = NumericRangeValidator.toDecimal(params.step());
    }

    @Override
    public void resetState() {
        next = NumericRangeValidator.toDecimal(params.start());
    }

    @Override
    protected void resumeFrom(GenerationState state) {
        if (state.getLastValue() instanceof Number) {
            next = NumericRangeValidator.toDecimal((Number) state.getLastValue()).add(step);
        } else {
            next = NumericRangeValidator.toDecimal(params.start())
                .add(step.multiply(BigDecimal.valueOf(state.getLastIndex())));
        }
        logger.debug("Resuming series for '{}' at {}", context.column(), next);
    }

    @Override
    protected boolean isSequential() {
        return true;
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(integral ? (Object) next.longValueExact() : (Object) next.doubleValue());
            next = next.add(step);
        }
        return values;
    }

    @Override
    protected void describeState(Map<String, Object> details) {
        details.put("next_value", integral ? (Object) next.longValueExact() : (Object) next.doubleValue());
        details.put("step", integral ? (Object) step.longValueExact() : (Object) step.doubleValue());
    }
}
