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
import io.genxdata.engine.errors.WriterException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Publishes messages to a Kafka topic.
 *
 * <p>Recognized keys of the {@code kafka} section: {@code bootstrap_servers} and
 * {@code topic} (both required), {@code client_id}, {@code acks}, and a
 * {@code producer} map passed through as raw producer properties.
 */
public class KafkaMessagePublisher implements MessagePublisher {

    private static final Logger logger = LogManager.getLogger(KafkaMessagePublisher.class);

    private final String bootstrapServers;
    private final String topic;
    private final Properties properties;
    private final Function<Properties, Producer<String, String>> producerFactory;
    private Producer<String, String> producer;

    public KafkaMessagePublisher(Map<String, Object> section) {
        this(section, props -> new KafkaProducer<>(props, new StringSerializer(), new StringSerializer()));
    }

    KafkaMessagePublisher(Map<String, Object> section, Function<Properties, Producer<String, String>> producerFactory) {
        this.bootstrapServers = required(section, "bootstrap_servers");
        this.topic = required(section, "topic");
        this.producerFactory = producerFactory;
        this.properties = new Properties();
        properties.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        properties.put(ProducerConfig.ACKS_CONFIG, String.valueOf(section.getOrDefault("acks", "all")));
        if (section.get("client_id") != null) {
            properties.put(ProducerConfig.CLIENT_ID_CONFIG, section.get("client_id").toString());
        }
        Object extra = section.get("producer");
        if (extra instanceof Map) {
            ((Map<?, ?>) extra).forEach((k, v) -> properties.put(String.valueOf(k), String.valueOf(v)));
        }
    }

    private static String required(Map<String, Object> section, String key) {
        Object value = section.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new ConfigurationException("Stream writer config missing required field for kafka: " + key);
        }
        return value.toString();
    }

    @Override
    public String type() {
        return "kafka";
    }

    @Override
    public String destination() {
        return bootstrapServers + "/" + topic;
    }

    public String topic() {
        return topic;
    }

    @Override
    public void connect() {
        if (producer == null) {
            producer = producerFactory.apply(properties);
            logger.info("Connected Kafka producer to {}", destination());
        }
    }

    @Override
    public void publish(String key, String payload) {
        connect();
        try {
            producer.send(new ProducerRecord<>(topic, key, payload)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WriterException("Interrupted while publishing to " + destination(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new WriterException("Failed to publish to " + destination() + ": " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        if (producer != null) {
            producer.close();
            producer = null;
            logger.info("Disconnected Kafka producer from {}", destination());
        }
    }
}
