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
import io.genxdata.engine.generator.params.DistributedChoiceParams;
import io.genxdata.engine.random.RandomGenerators;
import org.apache.commons.rng.sampling.DiscreteProbabilityCollectionSampler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Categorical values allocated in proportion to their weights.
 *
 * <p>Each chunk receives {@code floor(weight / total * count)} copies of every choice;
 * the remaining slots are drawn by weight. The chunk is then shuffled.
 */
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.DISTRIBUTED_CHOICE)
@ParamsType(DistributedChoiceParams.class)
public class DistributedChoiceGenerator extends AbstractRandomGenerator<DistributedChoiceParams> {

    private List<String> choices;
    private double[] weights;
    private double total;
    private DiscreteProbabilityCollectionSampler<String> remainder;

    @Override
    protected void configure() {
        choices = new ArrayList<>(params.choices().keySet());
        weights = new double[choices.size()];
        total = 0;
        int i = 0;
        for (Map.Entry<String, Number> entry : params.choices().entrySet()) {
            weights[i++] = entry.getValue().doubleValue();
            total += entry.getValue().doubleValue();
        }
        remainder = RandomGenerators.weighted(choices, weights, rng());
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < choices.size(); i++) {
            int copies = (int) Math.floor(weights[i] * count / total);
            for (int c = 0; c < copies && values.size() < count; c++) {
                values.add(choices.get(i));
            }
        }
        while (values.size() < count) {
            values.add(remainder.sample());
        }
        RandomGenerators.shuffle(values, rng());
        return values;
    }
}
