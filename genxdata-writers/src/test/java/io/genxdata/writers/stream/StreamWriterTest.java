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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.genxdata.engine.errors.WriterException;
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.sink.ChunkMetadata;
import io.genxdata.engine.sink.WriteResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StreamWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void testPublishesMetadataAndRecords() throws Exception {
        InMemoryPublisher publisher = new InMemoryPublisher();
        StreamWriter writer = new StreamWriter(publisher);

        WriteResult result = writer.write(frame(3), ChunkMetadata.of(2, 3, 5));

        assertThat(result.rowsWritten()).isEqualTo(3);
        assertThat(result.destination()).isEqualTo("memory/test");
        assertThat(publisher.keys).containsExactly("2");
        JsonNode message = MAPPER.readTree(publisher.payloads.get(0));
        assertThat(message.get("metadata").get("rows").asInt()).isEqualTo(3);
        assertThat(message.get("metadata").get("batch_index").asInt()).isEqualTo(2);
        assertThat(message.get("metadata").get("chunk_index").asInt()).isEqualTo(3);
        assertThat(message.get("metadata").get("total_chunks").asInt()).isEqualTo(5);
        assertThat(message.get("metadata").get("columns").get(0).asText()).isEqualTo("id");
        assertThat(message.get("data")).hasSize(3);
        assertThat(message.get("data").get(2).get("id").asInt()).isEqualTo(3);
    }

    @Test
    public void testEmptyFrameSkipped() {
        InMemoryPublisher publisher = new InMemoryPublisher();
        StreamWriter writer = new StreamWriter(publisher);

        WriteResult result = writer.write(Frame.empty(0, List.of("id")), ChunkMetadata.of(0, 0, 1));

        assertThat(result.rowsWritten()).isZero();
        assertThat(publisher.payloads).isEmpty();
    }

    @Test
    public void testKeyFallsBackToSendCount() {
        InMemoryPublisher publisher = new InMemoryPublisher();
        StreamWriter writer = new StreamWriter(publisher);

        writer.write(frame(1), null);
        writer.write(frame(1), null);

        assertThat(publisher.keys).containsExactly("0", "1");
    }

    @Test
    public void testFinishClosesPublisher() {
        InMemoryPublisher publisher = new InMemoryPublisher();
        StreamWriter writer = new StreamWriter(publisher);
        writer.write(frame(4), ChunkMetadata.of(0, 4, 2));
        writer.write(frame(2), ChunkMetadata.of(1, 2, 2));

        Map<String, Object> summary = writer.finish();

        assertThat(publisher.closed).isTrue();
        assertThat(summary)
            .containsEntry("writer_type", "stream")
            .containsEntry("queue_type", "memory")
            .containsEntry("destination", "memory/test")
            .containsEntry("total_rows_written", 6L)
            .containsEntry("total_batches_sent", 2);
    }

    @Test
    public void testPublishFailurePropagates() {
        InMemoryPublisher publisher = new InMemoryPublisher();
        publisher.fail = true;
        StreamWriter writer = new StreamWriter(publisher);

        assertThatThrownBy(() -> writer.write(frame(1), null))
            .isInstanceOf(WriterException.class)
            .hasMessageContaining("broker unavailable");
    }

    private static Frame frame(int rows) {
        Frame frame = Frame.empty(rows);
        List<Object> ids = new ArrayList<>();
        for (int i = 1; i <= rows; i++) {
            ids.add(i);
        }
        frame.setColumn("id", ids);
        return frame;
    }

    private static class InMemoryPublisher implements MessagePublisher {
        final List<String> keys = new ArrayList<>();
        final List<String> payloads = new ArrayList<>();
        boolean closed;
        boolean fail;

        @Override
        public String type() {
            return "memory";
        }

        @Override
        public String destination() {
            return "memory/test";
        }

        @Override
        public void connect() {
        }

        @Override
        public void publish(String key, String payload) {
            if (fail) {
                throw new WriterException("broker unavailable");
            }
            keys.add(key);
            payloads.add(payload);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
