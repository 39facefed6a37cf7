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
import io.genxdata.engine.generator.params.DateRangeItem;
import io.genxdata.engine.generator.params.DistributedDateRangeParams;
import io.genxdata.engine.generator.validation.DateFormats;
import io.genxdata.engine.random.RandomGenerators;
import org.apache.commons.rng.sampling.DiscreteProbabilityCollectionSampler;

import java.util.ArrayList;
import java.util.List;

/// Picks a date range by weight for every value, then a uniform date inside it,
/// formatted with that range's output format.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.DISTRIBUTED_DATE_RANGE)
@ParamsType(DistributedDateRangeParams.class)
public class DistributedDateRangeGenerator extends AbstractRandomGenerator<DistributedDateRangeParams> {

    private record WeightedSpan(DateSpan span, String outputFormat) {
    }

    private DiscreteProbabilityCollectionSampler<WeightedSpan> spans;

    @Override
    protected void configure() {
        List<WeightedSpan> items = new ArrayList<>();
        double[] weights = new double[params.ranges().size()];
        for (int i = 0; i < weights.length; i++) {
            DateRangeItem range = params.ranges().get(i);
            items.add(new WeightedSpan(
                DateSpan.of(DateFormats.parseDateTime(range.startDate(), range.format()),
                    DateFormats.parseDateTime(range.endDate(), range.format())),
                range.outputFormat()));
            weights[i] = range.distribution().doubleValue();
        }
        spans = RandomGenerators.weighted(items, weights, rng());
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            WeightedSpan chosen = spans.sample();
            values.add(DateFormats.format(chosen.span().sample(this::nextLong), chosen.outputFormat()));
        }
        return values;
    }
}
