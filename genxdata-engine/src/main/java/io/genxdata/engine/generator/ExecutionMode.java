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

/// How a generator is being driven.
public enum ExecutionMode {
    /// The whole dataset is produced in one pass; sequence state is reset before each generation.
    NORMAL,
    /// The dataset is produced chunk by chunk; sequence state carries over between chunks.
    STREAM_OR_BATCH;

    public boolean isContinuous() {
        return this == STREAM_OR_BATCH;
    }
}
