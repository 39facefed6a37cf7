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

import java.util.Map;
import java.util.Objects;

/**
 * Everything the column loop hands to the pool for one column of one chunk.
 *
 * @param frame the frame being filled
 * @param column target column
 * @param rows number of rows in the frame
 * @param params raw strategy parameters as configured
 * @param unique whether written values must be distinct
 * @param mask optional row filter, null or blank for all rows
 * @param sharedState state shared across the chunks of the run
 */
public record ColumnRequest(
    Frame frame,
    String column,
    int rows,
    Map<String, Object> params,
    boolean unique,
    String mask,
    SharedGenerationState sharedState
) {

    public ColumnRequest {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(column, "column");
        params = params == null ? Map.of() : params;
        sharedState = sharedState == null ? new SharedGenerationState() : sharedState;
    }

    /// A request covering every row of the frame, without mask or uniqueness.
    public static ColumnRequest of(Frame frame, String column, Map<String, Object> params,
                                   SharedGenerationState sharedState) {
        return new ColumnRequest(frame, column, frame.size(), params, false, null, sharedState);
    }

    public boolean hasMask() {
        return mask != null && !mask.isBlank();
    }
}
