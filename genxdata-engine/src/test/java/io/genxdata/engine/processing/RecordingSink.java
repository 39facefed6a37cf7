package io.genxdata.engine.processing;

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

import io.genxdata.engine.errors.WriterException;
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.sink.ChunkMetadata;
import io.genxdata.engine.sink.FrameSink;
import io.genxdata.engine.sink.WriteResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Keeps every written frame in memory.
class RecordingSink implements FrameSink {

    final List<Frame> frames = new ArrayList<>();
    final List<ChunkMetadata> metadata = new ArrayList<>();
    int finishCalls;
    int failOnWrite = -1;

    @Override
    public WriteResult write(Frame frame, ChunkMetadata chunk) {
        if (frames.size() == failOnWrite) {
            throw new WriterException("disk full");
        }
        frames.add(frame);
        metadata.add(chunk);
        return WriteResult.of(frame.size(), "memory");
    }

    @Override
    public Map<String, Object> finish() {
        finishCalls++;
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("writer_type", "memory");
        summary.put("frames", frames.size());
        return summary;
    }

    List<Object> column(String name) {
        List<Object> values = new ArrayList<>();
        for (Frame frame : frames) {
            values.addAll(frame.column(name));
        }
        return values;
    }
}
