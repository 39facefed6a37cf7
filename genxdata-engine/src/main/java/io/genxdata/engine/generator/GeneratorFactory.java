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
import io.genxdata.engine.generator.params.ParamsDecoder;
import io.genxdata.engine.generator.params.StrategyParams;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Function;

/**
 * Builds initialized generators from strategy names and column requests.
 *
 * <p>Parameters are decoded and validated before the generator is instantiated, so an
 * invalid configuration never yields a generator. Each generator receives a logger
 * named after its strategy kind, see {@link StrategyKind#loggerName()}.
 */
public final class GeneratorFactory {

    private final Logger logger;
    private final Function<StrategyKind, Logger> generatorLoggers;

    public GeneratorFactory(Logger logger) {
        this(logger, kind -> LogManager.getLogger(kind.loggerName()));
    }

    public GeneratorFactory(Logger logger, Function<StrategyKind, Logger> generatorLoggers) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.generatorLoggers = Objects.requireNonNull(generatorLoggers, "generatorLoggers");
    }

    /**
     * Creates and initializes a generator.
     *
     * @throws io.genxdata.engine.errors.UnsupportedStrategyException for unknown strategies
     * @throws io.genxdata.engine.errors.InvalidConfigParamException for invalid parameters
     */
    public ColumnGenerator<?> create(ExecutionMode mode, String strategyName, ColumnRequest request) {
        GeneratorRegistry.Registration registration = GeneratorRegistry.resolve(strategyName);
        DecodedParams decoded = decode(registration, request);
        PoolKey key = new PoolKey(registration.kind(), request.column());
        GeneratorContext context = new GeneratorContext(key, mode, generatorLoggers.apply(registration.kind()),
            request, decoded.normalized());

        ColumnGenerator<?> generator = registration.newInstance();
        initialize(generator, context, decoded.params());
        if (request.unique() && mode != ExecutionMode.NORMAL) {
            logger.warn("Column '{}' is marked unique; uniqueness is not enforced across chunks in {} mode",
                request.column(), mode);
        }
        logger.debug("Created {} for column '{}'", registration.kind(), request.column());
        return generator;
    }

    /// Decodes and validates the raw parameters of a request for the given strategy.
    public DecodedParams decode(GeneratorRegistry.Registration registration, ColumnRequest request) {
        return ParamsDecoder.decode(registration.kind().strategyName(), registration.paramsType(), request.params());
    }

    @SuppressWarnings("unchecked")
    private static <P extends StrategyParams> void initialize(ColumnGenerator<P> generator,
                                                              GeneratorContext context, StrategyParams params) {
        generator.initialize(context, (P) params);
    }

    @SuppressWarnings("unchecked")
    static <P extends StrategyParams> void update(ColumnGenerator<P> generator, StrategyParams params) {
        generator.updateParams((P) params);
    }
}
