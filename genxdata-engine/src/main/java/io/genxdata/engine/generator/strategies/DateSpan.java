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

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.function.LongUnaryOperator;

/// An inclusive span of dates, sampled by whole days when both ends fall on midnight.
record DateSpan(LocalDateTime start, long units, ChronoUnit unit) {

    static DateSpan of(LocalDateTime start, LocalDateTime end) {
        if (start.toLocalTime().equals(LocalTime.MIDNIGHT) && end.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return new DateSpan(start, ChronoUnit.DAYS.between(start, end), ChronoUnit.DAYS);
        }
        return new DateSpan(start, Duration.between(start, end).getSeconds(), ChronoUnit.SECONDS);
    }

    /// @param uniform returns a uniform value in {@code [0, bound)}
    LocalDateTime sample(LongUnaryOperator uniform) {
        return start.plus(uniform.applyAsLong(units + 1), unit);
    }
}
