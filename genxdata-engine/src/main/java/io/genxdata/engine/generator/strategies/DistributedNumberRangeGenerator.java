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
import io.genxdata.engine.generator.params.DistributedNumberRangeParams;
import io.genxdata.engine.generator.params.RangeItem;
import io.genxdata.engine.random.RandomGenerators;
import org.apache.commons.rng.sampling.DiscreteProbabilityCollectionSampler;

import java.util.ArrayList;
import java.util.List;

/// Picks a range by weight for every value, then a uniform number inside it.
/// Integer ranges include their upper bound.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.DISTRIBUTED_NUMBER_RANGE)
@ParamsType(DistributedNumberRangeParams.class)
public class DistributedNumberRangeGenerator extends AbstractRandomGenerator<DistributedNumberRangeParams> {

    private DiscreteProbabilityCollectionSampler<RangeItem> ranges;

    @Override
    protected void configure() {
        List<RangeItem> items = params.ranges();
        double[] weights = new double[items.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = items.get(i).distribution().doubleValue();
        }
        ranges = RandomGenerators.weighted(items, weights, rng());
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            RangeItem range = ranges.sample();
            if (range.integral()) {
                long lo = range.start().longValue();
                values.add(lo + nextLong(range.end().longValue() - lo + 1));
            } else {
                double lo = range.start().doubleValue();
                values.add(lo + rng().nextDouble() * (range.end().doubleValue() - lo));
            }
        }
        return values;
    }
}
