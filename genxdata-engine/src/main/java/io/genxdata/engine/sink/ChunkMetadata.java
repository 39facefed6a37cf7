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

import java.time.Instant;

/**
 * Position of a chunk within a chunked run.
 *
 * @param batchIndex 0-based index of the chunk
 * @param chunkIndex 1-based index of the chunk, as reported to users
 * @param rowsInChunk rows in this chunk
 * @param totalChunks chunks the run will produce
 * @param timestamp when the chunk was handed to the sink
 */
public record ChunkMetadata(int batchIndex, int chunkIndex, int rowsInChunk, int totalChunks, Instant timestamp) {

    public static ChunkMetadata of(int batchIndex, int rowsInChunk, int totalChunks) {
        return new ChunkMetadata(batchIndex, batchIndex + 1, rowsInChunk, totalChunks, Instant.now());
    }

    public boolean isLast() {
        return chunkIndex >= totalChunks;
    }
}
