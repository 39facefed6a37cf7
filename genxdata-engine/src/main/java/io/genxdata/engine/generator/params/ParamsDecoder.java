package io.genxdata.engine.generator.params;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.genxdata.engine.errors.InvalidConfigParamException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes raw configuration maps into {@link StrategyParams} records with Jackson.
 *
 * <p>Decoding happens once per generator (and again only when a pooled generator receives
 * different parameters). Keys unknown to the record are kept in
 * {@link DecodedParams#normalized()} so generators can read them, {@code seed} being the
 * usual one.
 */
public final class ParamsDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private ParamsDecoder() {
    }

    /**
     * @param strategyName used in error messages
     * @param type the record type to decode into
     * @param raw the configured parameters, may be null
     * @throws InvalidConfigParamException if the map cannot be decoded or fails validation
     */
    public static DecodedParams decode(String strategyName, Class<? extends StrategyParams> type, Map<String, Object> raw) {
        Map<String, Object> source = raw == null ? Map.of() : raw;
        StrategyParams params;
        try {
            params = MAPPER.convertValue(source, type);
        } catch (IllegalArgumentException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new InvalidConfigParamException(null,
                "Invalid parameters for " + strategyName + ": " + firstLine(cause.getMessage()), e);
        }
        if (params == null) {
            throw new InvalidConfigParamException(null, "Missing parameters for " + strategyName);
        }
        params.validate();

        Map<String, Object> normalized = MAPPER.convertValue(params, MAP_TYPE);
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            normalized.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return new DecodedParams(params, normalized);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unreadable value";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
