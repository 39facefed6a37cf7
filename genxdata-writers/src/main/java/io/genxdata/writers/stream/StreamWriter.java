package io.genxdata.writers.stream;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.genxdata.engine.errors.WriterException;
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.sink.ChunkMetadata;
import io.genxdata.engine.sink.FrameSink;
import io.genxdata.engine.sink.WriteResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends each chunk to a message queue as one JSON message:
 * {@code {"metadata": {...}, "data": [records]}}.
 */
public class StreamWriter implements FrameSink {

    private static final Logger logger = LogManager.getLogger(StreamWriter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final MessagePublisher publisher;
    private long totalRowsWritten;
    private int totalBatchesSent;

    public StreamWriter(MessagePublisher publisher) {
        this.publisher = publisher;
    }

    public static StreamWriter fromConfig(Map<String, Object> config) {
        return new StreamWriter(PublisherFactory.fromConfig(config));
    }

    @Override
    public WriteResult write(Frame frame, ChunkMetadata metadata) {
        if (frame.size() == 0) {
            logger.warn("Received empty frame, skipping write");
            return WriteResult.of(0, publisher.destination());
        }
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("rows", frame.size());
        info.put("columns", frame.columnNames());
        if (metadata != null) {
            info.put("batch_index", metadata.batchIndex());
            info.put("chunk_index", metadata.chunkIndex());
            info.put("total_chunks", metadata.totalChunks());
            info.put("timestamp", metadata.timestamp().toString());
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("metadata", info);
        message.put("data", frame.toRecords());

        String payload;
        try {
            payload = MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new WriterException("Could not serialize chunk for " + publisher.destination(), e);
        }
        String key = metadata == null ? Integer.toString(totalBatchesSent) : Integer.toString(metadata.batchIndex());
        publisher.publish(key, payload);
        totalRowsWritten += frame.size();
        totalBatchesSent++;
        logger.info("Sent {} rows to {}", frame.size(), publisher.destination());
        return new WriteResult(frame.size(), publisher.destination(), info);
    }

    @Override
    public Map<String, Object> finish() {
        logger.info("Finalizing stream writer. Total rows sent: {}", totalRowsWritten);
        publisher.close();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("writer_type", "stream");
        summary.put("queue_type", publisher.type());
        summary.put("destination", publisher.destination());
        summary.put("total_rows_written", totalRowsWritten);
        summary.put("total_batches_sent", totalBatchesSent);
        return summary;
    }
}
