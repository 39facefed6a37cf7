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

import io.genxdata.engine.frame.Frame;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The binding between a pooled generator and the chunk it is currently filling.
 *
 * <p>Key, mode and logger are fixed for the life of the generator. The frame, row count,
 * parameters, uniqueness flag, mask and shared-state reference are refreshed each time
 * the pool hands the generator out again.
 */
public final class GeneratorContext {

    private final PoolKey key;
    private final ExecutionMode mode;
    private final Logger logger;

    private Frame frame;
    private int rows;
    private Map<String, Object> params;
    private boolean unique;
    private String mask;
    private SharedGenerationState sharedState;
    private int[] targetRows;

    public GeneratorContext(PoolKey key, ExecutionMode mode, Logger logger,
                            ColumnRequest request, Map<String, Object> params) {
        this.key = Objects.requireNonNull(key, "key");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.logger = Objects.requireNonNull(logger, "logger");
        refresh(request);
        this.params = copy(params);
    }

    /// Rebinds the volatile fields to a new request. Parameters are replaced separately.
    void refresh(ColumnRequest request) {
        this.frame = request.frame();
        this.rows = request.rows();
        this.unique = request.unique();
        this.mask = request.mask();
        this.sharedState = request.sharedState();
        this.targetRows = null;
    }

    void params(Map<String, Object> params) {
        this.params = copy(params);
    }

    public PoolKey key() {
        return key;
    }

    public StrategyKind kind() {
        return key.kind();
    }

    public String column() {
        return key.column();
    }

    public ExecutionMode mode() {
        return mode;
    }

    public Logger logger() {
        return logger;
    }

    public Frame frame() {
        return frame;
    }

    public int rows() {
        return rows;
    }

    /// @return the normalized parameter map, including extra keys such as {@code seed}
    public Map<String, Object> params() {
        return params;
    }

    public boolean unique() {
        return unique;
    }

    public String mask() {
        return mask;
    }

    public SharedGenerationState sharedState() {
        return sharedState;
    }

    /// @return the configured seed, or null when generation should not be reproducible
    public Long seed() {
        Object seed = params.get("seed");
        if (seed instanceof Number) {
            return ((Number) seed).longValue();
        }
        if (seed instanceof String && !((String) seed).isBlank()) {
            try {
                return Long.parseLong(((String) seed).trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric seed '{}' for column {}", seed, key.column());
            }
        }
        return null;
    }

    /// Sets the frame positions the next generation will be written to.
    public void targetRows(int[] rows) {
        this.targetRows = rows;
    }

    /**
     * Frame positions targeted by the current generation. When none were set, the first
     * {@code count} rows of the frame are assumed.
     */
    public int[] targetRows(int count) {
        if (targetRows != null) {
            return targetRows;
        }
        int size = frame == null ? 0 : Math.min(count, frame.size());
        int[] head = new int[size];
        for (int i = 0; i < size; i++) {
            head[i] = i;
        }
        return head;
    }

    private static Map<String, Object> copy(Map<String, Object> params) {
        return params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    @Override
    public String toString() {
        return "GeneratorContext{" + key + ", mode=" + mode + ", rows=" + rows + ", unique=" + unique
            + (mask != null && !mask.isBlank() ? ", mask='" + mask + "'" : "") + "}";
    }
}
