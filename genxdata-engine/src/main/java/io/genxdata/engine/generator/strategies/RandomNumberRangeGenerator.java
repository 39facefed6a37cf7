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
import io.genxdata.engine.generator.params.RandomNumberRangeParams;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Uniform numbers in {@code [start, end)}. Integer bounds produce longs on the
 * {@code step} grid; other bounds produce doubles rounded to {@code precision} places.
 */
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.RANDOM_NUMBER_RANGE)
@ParamsType(RandomNumberRangeParams.class)
public class RandomNumberRangeGenerator extends AbstractRandomGenerator<RandomNumberRangeParams> {

    private boolean integral;
    private long start;
    private long step;
    private long slots;
    private double lower;
    private double upper;

    @Override
    protected void configure() {
        integral = params.integral();
        if (integral) {
            start = params.start().longValue();
            step = Math.max(1L, params.step().longValue());
            long span = params.end().longValue() - start;
            slots = (span + step - 1) / step;
        } else {
            lower = params.start().doubleValue();
            upper = params.end().doubleValue();
        }
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (integral) {
                values.add(start + nextLong(slots) * step);
            } else {
                double raw = lower + rng().nextDouble() * (upper - lower);
                values.add(BigDecimal.valueOf(raw).setScale(params.precision(), RoundingMode.HALF_UP).doubleValue());
            }
        }
        return values;
    }
}
