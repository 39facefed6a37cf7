package io.genxdata.engine.sink;

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
 * Outcome of one {@link FrameSink#write} call.
 *
 * @param rowsWritten rows accepted by the sink
 * @param destination file path, topic or other target description
 * @param details sink specific entries
 */
public record WriteResult(int rowsWritten, String destination, Map<String, Object> details) {

    public WriteResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static WriteResult of(int rowsWritten, String destination) {
        return new WriteResult(rowsWritten, destination, Map.of());
    }
}
