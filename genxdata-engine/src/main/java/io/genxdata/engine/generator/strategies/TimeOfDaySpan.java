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

import java.time.LocalTime;
import java.util.function.LongUnaryOperator;

/// An inclusive range of seconds within a day; wraps past midnight when start is after end.
record TimeOfDaySpan(int startSecond, int endSecond) {

    private static final int SECONDS_PER_DAY = 24 * 60 * 60;

    static TimeOfDaySpan of(LocalTime start, LocalTime end) {
        return new TimeOfDaySpan(start.toSecondOfDay(), end.toSecondOfDay());
    }

    boolean overnight() {
        return startSecond > endSecond;
    }

    /// @param uniform returns a uniform value in {@code [0, bound)}
    LocalTime sample(LongUnaryOperator uniform) {
        int length = overnight()
            ? SECONDS_PER_DAY - startSecond + endSecond
            : endSecond - startSecond;
        long offset = uniform.applyAsLong(length + 1L);
        return LocalTime.ofSecondOfDay((startSecond + offset) % SECONDS_PER_DAY);
    }
}
