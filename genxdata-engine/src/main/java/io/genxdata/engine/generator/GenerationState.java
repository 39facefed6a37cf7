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
import java.util.HashSet;
import java.util.Set;

/**
 * Running state recorded for one {@link PoolKey} across the chunks of a run.
 *
 * <p>{@code lastValue} is the last value written; {@code lastIndex} counts every value
 * emitted so far. The unique value set is only tracked in
 * {@link ExecutionMode#NORMAL} runs.
 */
public final class GenerationState {

    private Object lastValue;
    private long lastIndex;
    private String dtype;
    private final Set<Object> uniqueValues = new HashSet<>();

    public Object getLastValue() {
        return lastValue;
    }

    public long getLastIndex() {
        return lastIndex;
    }

    public String getDtype() {
        return dtype;
    }

    public Set<Object> getUniqueValues() {
        return Collections.unmodifiableSet(uniqueValues);
    }

    /// Adds written values to the running unique set; nulls are not tracked.
    public void addUniqueValues(Iterable<?> values) {
        for (Object value : values) {
            if (value != null) {
                uniqueValues.add(value);
            }
        }
    }

    /// Records a freshly written batch of values.
    public void record(Object lastValue, int count, String dtype) {
        this.lastValue = lastValue;
        this.lastIndex += count;
        if (dtype != null) {
            this.dtype = dtype;
        }
    }

    @Override
    public String toString() {
        return "GenerationState{lastValue=" + lastValue + ", lastIndex=" + lastIndex
            + ", dtype=" + dtype + ", unique=" + uniqueValues.size() + "}";
    }
}
