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

/**
 * A message-queue transport used by {@link StreamWriter}.
 *
 * <p>{@link #publish} blocks until the broker has accepted the message.
 */
public interface MessagePublisher extends AutoCloseable {

    /// Short transport name such as {@code kafka}.
    String type();

    /// Where messages go, e.g. the broker list and topic; never contains credentials.
    String destination();

    void connect();

    /**
     * @throws io.genxdata.engine.errors.WriterException if the message was not accepted
     */
    void publish(String key, String payload);

    @Override
    void close();
}
