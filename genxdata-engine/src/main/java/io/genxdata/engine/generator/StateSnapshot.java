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

/**
 * Diagnostic view of a generator's state.
 *
 * @param strategy the strategy name
 * @param column the bound column
 * @param stateful whether the generator carries sequence state between chunks
 * @param seed the configured seed, if any
 * @param dtype simple type name of the last value written, null before the first write
 * @param lastValue the last value written
 * @param lastIndex how many values have been written
 * @param uniqueCount size of the running unique value set
 * @param details generator-specific entries, such as a counter position
 */
public record StateSnapshot(
    String strategy,
    String column,
    boolean stateful,
    Long seed,
    String dtype,
    Object lastValue,
    long lastIndex,
    int uniqueCount,
    Map<String, Object> details
) {
    public StateSnapshot {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
