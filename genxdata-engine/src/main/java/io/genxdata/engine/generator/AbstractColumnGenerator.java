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

import io.genxdata.engine.generator.params.StrategyParams;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base for column generators.
 *
 * <p>Subclasses derive their working configuration in {@link #configure()}, which runs on
 * initialization and again whenever the pool hands them new parameters. Sequence
 * generators additionally override {@link #resetState()} and
 * {@link #resumeFrom(GenerationState)}.
 */
public abstract class AbstractColumnGenerator<P extends StrategyParams> implements ColumnGenerator<P> {

    protected GeneratorContext context;
    protected P params;
    protected Logger logger;

    @Override
    public final void initialize(GeneratorContext context, P params) {
        if (this.context != null) {
            throw new IllegalStateException("Generator for " + this.context.key() + " is already initialized");
        }
        this.context = Objects.requireNonNull(context, "context");
        this.params = Objects.requireNonNull(params, "params");
        this.logger = context.logger();
        configure();
        resetState();
        if (context.mode().isContinuous()) {
            context.sharedState().get(context.key())
                .filter(state -> state.getLastIndex() > 0)
                .ifPresent(this::resumeFrom);
        }
        logger.debug("Initialized {} with {}", context.key(), params);
    }

    @Override
    public void updateParams(P params) {
        this.params = Objects.requireNonNull(params, "params");
        configure();
        logger.debug("Parameters of {} updated to {}", context.key(), params);
    }

    /// Derives working configuration from {@link #params}. Must not touch sequence state.
    protected void configure() {
    }

    /**
     * Continues from a state recorded by an earlier instance for the same key. Only
     * called in continuous mode when such a state exists.
     */
    protected void resumeFrom(GenerationState state) {
    }

    /// @return whether this generator carries sequence state between chunks
    protected boolean isSequential() {
        return false;
    }

    /// Adds generator-specific entries to the diagnostics snapshot.
    protected void describeState(Map<String, Object> details) {
    }

    @Override
    public GeneratorContext context() {
        return context;
    }

    @Override
    public P params() {
        return params;
    }

    @Override
    public List<Object> generateData(int count) {
        if (context.mode() == ExecutionMode.NORMAL) {
            resetState();
        }
        return generateChunk(count);
    }

    @Override
    public void resetState() {
    }

    @Override
    public void syncState(List<?> values) {
        if (values.isEmpty()) {
            return;
        }
        Object last = values.get(values.size() - 1);
        context.sharedState().getOrCreate(context.key()).record(last, values.size(), dtypeOf(values));
    }

    @Override
    public StateSnapshot currentState() {
        Map<String, Object> details = new LinkedHashMap<>();
        describeState(details);
        GenerationState state = context.sharedState().get(context.key()).orElse(null);
        if (state == null) {
            return new StateSnapshot(context.kind().strategyName(), context.column(), isSequential(),
                context.seed(), null, null, 0L, 0, details);
        }
        return new StateSnapshot(context.kind().strategyName(), context.column(), isSequential(),
            context.seed(), state.getDtype(), state.getLastValue(), state.getLastIndex(),
            state.getUniqueValues().size(), details);
    }

    private static String dtypeOf(List<?> values) {
        for (int i = values.size() - 1; i >= 0; i--) {
            Object value = values.get(i);
            if (value != null) {
                return value.getClass().getSimpleName();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + (context == null ? "uninitialized" : context.key()) + "}";
    }
}
