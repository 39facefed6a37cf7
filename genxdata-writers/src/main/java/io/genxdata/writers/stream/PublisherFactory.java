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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a {@link MessagePublisher} from a stream configuration.
 *
 * <p>Both the nested form, {@code kafka: {bootstrap_servers: ..., topic: ...}}, and the
 * flat form, {@code type: kafka, bootstrap_servers: ..., topic: ...}, are accepted.
 */
public final class PublisherFactory {

    private PublisherFactory() {
    }

    /// @throws ConfigurationException when no supported queue section is present
    public static MessagePublisher fromConfig(Map<String, Object> config) {
        Map<String, Object> kafka = kafkaSection(config);
        if (kafka != null) {
            return new KafkaMessagePublisher(kafka);
        }
        if (config.get("amqp") != null || "amqp".equalsIgnoreCase(String.valueOf(config.get("type")))) {
            throw new ConfigurationException("AMQP streaming is not available; configure a 'kafka' section instead");
        }
        throw new ConfigurationException(
            "Stream writer config must include a supported queue section (nested 'kafka' or flat 'type: kafka')");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> kafkaSection(Map<String, Object> config) {
        Object nested = config.get("kafka");
        if (nested instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) nested);
        }
        Object type = config.get("type");
        if (type != null && "kafka".equals(type.toString().toLowerCase(Locale.ROOT))) {
            return config;
        }
        return null;
    }
}
