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

import io.genxdata.engine.generator.AbstractColumnGenerator;
import io.genxdata.engine.generator.params.StrategyParams;
import io.genxdata.engine.random.RandomGenerators;
import org.apache.commons.rng.RestorableUniformRandomProvider;

import java.util.Map;

/**
 * Base for generators drawing from a random source.
 *
 * <p>The source is seeded from the {@code seed} parameter when present and created once
 * per generator. It is not rewound on reset, so consecutive chunks keep drawing fresh
 * values.
 */
abstract class AbstractRandomGenerator<P extends StrategyParams> extends AbstractColumnGenerator<P> {

    private RestorableUniformRandomProvider rng;
    private long effectiveSeed;

    protected RestorableUniformRandomProvider rng() {
        if (rng == null) {
            Long seed = context.seed();
            effectiveSeed = seed != null ? seed : RandomGenerators.newSeed();
            rng = RandomGenerators.create(effectiveSeed);
        }
        return rng;
    }

    /// @return the seed actually used, configured or drawn
    protected long effectiveSeed() {
        rng();
        return effectiveSeed;
    }

    /// Uniform long in {@code [0, bound)}.
    protected long nextLong(long bound) {
        return rng().nextLong(bound);
    }

    @Override
    protected void describeState(Map<String, Object> details) {
        details.put("seeded", context.seed() != null);
    }
}
