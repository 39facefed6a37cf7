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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run map of generation state, passed by reference through every chunk.
 * Created once before the first chunk; never shared between runs.
 */
public final class SharedGenerationState {

    private final Map<PoolKey, GenerationState> states = new LinkedHashMap<>();

    public Optional<GenerationState> get(PoolKey key) {
        return Optional.ofNullable(states.get(key));
    }

    public GenerationState getOrCreate(PoolKey key) {
        return states.computeIfAbsent(key, k -> new GenerationState());
    }

    public boolean contains(PoolKey key) {
        return states.containsKey(key);
    }

    public int size() {
        return states.size();
    }

    public Map<PoolKey, GenerationState> asMap() {
        return Collections.unmodifiableMap(states);
    }
}
