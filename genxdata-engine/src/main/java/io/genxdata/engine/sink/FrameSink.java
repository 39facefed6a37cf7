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

import io.genxdata.engine.frame.Frame;

import java.util.Map;

/**
 * Receives generated frames.
 *
 * <p>A single-pass run calls {@link #write} once with null metadata; a chunked run calls
 * it once per chunk. {@link #finish()} is called once after the last write, also when the
 * run failed part way.
 */
public interface FrameSink {

    /**
     * @param frame the frame to write, intermediate columns already removed
     * @param metadata chunk position, or null for single-pass runs
     * @throws io.genxdata.engine.errors.WriterException if the frame could not be written
     */
    WriteResult write(Frame frame, ChunkMetadata metadata);

    /// Flushes and releases resources.
    /// @return a summary of everything written, e.g. paths and totals
    Map<String, Object> finish();
}
