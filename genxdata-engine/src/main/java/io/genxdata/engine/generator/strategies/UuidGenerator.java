package io.genxdata.engine.generator.strategies;

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

import com.google.auto.service.AutoService;
import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.GenerationState;
import io.genxdata.engine.generator.GeneratorKind;
import io.genxdata.engine.generator.ParamsType;
import io.genxdata.engine.generator.StrategyKind;
import io.genxdata.engine.generator.params.UuidParams;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * UUID strings.
 *
 * <p>Version 5 values are derived from a namespace bound to the column and seed, and a
 * running counter, so they are distinct by construction and continue across chunks.
 * Version 4 values are drawn from the seeded random source.
 */
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.UUID)
@ParamsType(UuidParams.class)
public class UuidGenerator extends AbstractRandomGenerator<UuidParams> {

    static final UUID NAMESPACE_DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    private UUID namespace;
    private long counter;

    @Override
    protected void configure() {
        Long seed = context.seed();
        namespace = nameBased(NAMESPACE_DNS, "genxdata:" + context.column() + ":" + (seed == null ? "no-seed" : seed));
    }

    @Override
    public void resetState() {
        counter = 0;
    }

    @Override
    protected void resumeFrom(GenerationState state) {
        counter = state.getLastIndex();
    }

    @Override
    protected boolean isSequential() {
        return params.version() == 5;
    }

    @Override
    public List<Object> generateChunk(int count) {
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            UUID uuid = params.version() == 5 ? nameBased(namespace, Long.toString(counter++)) : randomBased();
            values.add(render(uuid));
        }
        return values;
    }

    @Override
    public boolean honorsUniqueness() {
        return false;
    }

    private String render(UUID uuid) {
        String text = uuid.toString();
        if (!params.hyphens()) {
            text = text.replace("-", "");
        }
        if (params.uppercase()) {
            text = text.toUpperCase(Locale.ROOT);
        }
        if (params.numbersOnly()) {
            text = new BigInteger(1, toBytes(uuid)).toString();
        }
        return params.prefix() + text;
    }

    private UUID randomBased() {
        long msb = (rng().nextLong() & 0xffffffffffff0fffL) | 0x0000000000004000L;
        long lsb = (rng().nextLong() & 0x3fffffffffffffffL) | 0x8000000000000000L;
        return new UUID(msb, lsb);
    }

    /// RFC 4122 version 5 (SHA-1, name-based) UUID.
    static UUID nameBased(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
        sha1.update(toBytes(namespace));
        byte[] hash = sha1.digest(name.getBytes(StandardCharsets.UTF_8));
        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);
        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    private static byte[] toBytes(UUID uuid) {
        return ByteBuffer.allocate(16)
            .putLong(uuid.getMostSignificantBits())
            .putLong(uuid.getLeastSignificantBits())
            .array();
    }

    @Override
    protected void describeState(Map<String, Object> details) {
        super.describeState(details);
        details.put("version", params.version());
        details.put("counter", counter);
    }
}
