package io.genxdata.engine.generator;

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

import io.genxdata.engine.generator.params.DecodedParams;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps one generator per {@link PoolKey} for the duration of a run.
 *
 * <p>The first request for a key creates the generator through the
 * {@link GeneratorFactory}. Later requests return the same instance after rebinding its
 * frame, row count, uniqueness flag, mask and shared-state reference. When the raw
 * parameters differ from those last decoded they are decoded again and handed to the
 * generator; sequence state is never reset by reuse.
 */
public final class GeneratorPool {

    private final GeneratorFactory factory;
    private final Logger logger;
    private final Map<PoolKey, Entry> generators = new LinkedHashMap<>();

    private static final class Entry {
        private final ColumnGenerator<?> generator;
        private Map<String, Object> rawParams;

        private Entry(ColumnGenerator<?> generator, Map<String, Object> rawParams) {
            this.generator = generator;
            this.rawParams = rawParams;
        }
    }

    public GeneratorPool(GeneratorFactory factory, Logger logger) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Returns the pooled generator for the strategy and column, creating it on first use.
     *
     * @throws io.genxdata.engine.errors.UnsupportedStrategyException for unknown strategies
     * @throws io.genxdata.engine.errors.InvalidConfigParamException for invalid parameters
     */
    public ColumnGenerator<?> getOrCreate(ExecutionMode mode, String strategyName, ColumnRequest request) {
        GeneratorRegistry.Registration registration = GeneratorRegistry.resolve(strategyName);
        PoolKey key = new PoolKey(registration.kind(), request.column());
        Entry entry = generators.get(key);
        if (entry == null) {
            ColumnGenerator<?> generator = factory.create(mode, strategyName, request);
            generators.put(key, new Entry(generator, request.params()));
            return generator;
        }

        GeneratorContext context = entry.generator.context();
        context.refresh(request);
        if (!Objects.equals(entry.rawParams, request.params())) {
            DecodedParams decoded = factory.decode(registration, request);
            context.params(decoded.normalized());
            GeneratorFactory.update(entry.generator, decoded.params());
            entry.rawParams = request.params();
        }
        logger.trace("Reusing generator for {}", key);
        return entry.generator;
    }

    public boolean contains(PoolKey key) {
        return generators.containsKey(key);
    }

    public int size() {
        return generators.size();
    }

    public void clear() {
        generators.clear();
    }
}
