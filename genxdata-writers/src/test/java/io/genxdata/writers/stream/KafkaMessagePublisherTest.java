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

import io.genxdata.engine.errors.ConfigurationException;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class KafkaMessagePublisherTest {

    private static final Map<String, Object> SECTION = Map.of(
        "bootstrap_servers", "localhost:9092",
        "topic", "rows",
        "client_id", "genxdata-test",
        "producer", Map.of("linger.ms", 5));

    @Test
    public void testPublishesToTopic() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaMessagePublisher publisher = new KafkaMessagePublisher(SECTION, props -> producer);

        publisher.publish("0", "{\"data\":[]}");
        publisher.publish("1", "{\"data\":[{}]}");

        List<ProducerRecord<String, String>> history = producer.history();
        assertThat(history).hasSize(2);
        assertThat(history.get(0).topic()).isEqualTo("rows");
        assertThat(history.get(1).key()).isEqualTo("1");
        assertThat(history.get(1).value()).isEqualTo("{\"data\":[{}]}");
    }

    @Test
    public void testProducerProperties() {
        AtomicReference<Properties> seen = new AtomicReference<>();
        KafkaMessagePublisher publisher = new KafkaMessagePublisher(SECTION, props -> {
            seen.set(props);
            return new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        });

        publisher.connect();

        assertThat(seen.get())
            .containsEntry(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, "localhost:9092")
            .containsEntry(ProducerConfig.ACKS_CONFIG, "all")
            .containsEntry(ProducerConfig.CLIENT_ID_CONFIG, "genxdata-test")
            .containsEntry("linger.ms", "5");
    }

    @Test
    public void testConnectsOnceAndCloses() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        int[] created = new int[1];
        KafkaMessagePublisher publisher = new KafkaMessagePublisher(SECTION, props -> {
            created[0]++;
            return producer;
        });

        publisher.connect();
        publisher.publish("0", "{}");
        publisher.close();

        assertThat(created[0]).isEqualTo(1);
        assertThat(producer.closed()).isTrue();
    }

    @Test
    public void testDestinationAndType() {
        KafkaMessagePublisher publisher = new KafkaMessagePublisher(SECTION,
            props -> new MockProducer<>(true, new StringSerializer(), new StringSerializer()));
        assertThat(publisher.type()).isEqualTo("kafka");
        assertThat(publisher.topic()).isEqualTo("rows");
        assertThat(publisher.destination()).isEqualTo("localhost:9092/rows");
    }

    @Test
    public void testRequiredFields() {
        assertThatThrownBy(() -> new KafkaMessagePublisher(Map.of("topic", "rows")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Stream writer config missing required field for kafka: bootstrap_servers");
        assertThatThrownBy(() -> new KafkaMessagePublisher(Map.of("bootstrap_servers", "localhost:9092")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Stream writer config missing required field for kafka: topic");
    }
}
