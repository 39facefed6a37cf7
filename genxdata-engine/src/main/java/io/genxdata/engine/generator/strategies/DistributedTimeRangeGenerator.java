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
import io.genxdata.engine.generator.params.DistributedTimeRangeParams;
import io.genxdata.engine.generator.params.TimeRangeItem;
import io.genxdata.engine.generator.validation.DateFormats;
import io.genxdata.engine.random.RandomGenerators;
import org.apache.commons.rng.sampling.DiscreteProbabilityCollectionSampler;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/// Picks a time range by weight for every value, then a uniform time inside it,
/// formatted with that range's format.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.DISTRIBUTED_TIME_RANGE)
@ParamsType(DistributedTimeRangeParams.class)
public class DistributedTimeRangeGenerator extends AbstractRandomGenerator<DistributedTimeRangeParams> {

    private record WeightedSpan(TimeOfDaySpan span, String format) {
    }

    private DiscreteProbabilityCollectionSampler<WeightedSpan> spans;

    @Override
    protected void configure() {
        List<WeightedSpan> items = new ArrayList<>();
        double[] weights = new double[params.ranges().size()];
        for (int i = 0; i < weights.length; i++) {
            TimeRangeItem range = params.ranges().get(i);
            items.add(new WeightedSpan(TimeOfDaySpan.of(
                DateFormats.parseTime(range.start(), range.format()),
                DateFormats.parseTime(range.end(), range.format())), range.format()));
            weights[i] = range.distribution().doubleValue();
        }
        spans = RandomGenerators.weighted(items, weights, rng());
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            WeightedSpan chosen = spans.sample();
            values.add(DateFormats.format(
                LocalDateTime.of(TimeRangeGenerator.EPOCH_DAY, chosen.span().sample(this::nextLong)),
                chosen.format()));
        }
        return values;
    }
}
