package io.genxdata.engine.generator;

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

import io.genxdata.engine.errors.UniquenessExhaustedException;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Makes a batch of generated values distinct, both within itself and against the values
 * already written for the column.
 *
 * <p>Duplicates are dropped in order. The shortfall is backfilled from
 * {@link ColumnGenerator#sampleMore(int)}, asking for twice the missing count on each
 * attempt, for at most {@link #DEFAULT_MAX_ATTEMPTS} attempts.
 */
public final class UniquenessEnforcer {

    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    private final int maxAttempts;
    private final Logger logger;

    public UniquenessEnforcer(Logger logger) {
        this(DEFAULT_MAX_ATTEMPTS, logger);
    }

    public UniquenessEnforcer(int maxAttempts, Logger logger) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * @param generator source of extra candidates
     * @param values the freshly generated batch
     * @param seen values already written for this column
     * @return {@code values.size()} distinct values, none of them in {@code seen}
     * @throws UniquenessExhaustedException if the attempts run out first
     */
    public List<Object> enforce(ColumnGenerator<?> generator, List<Object> values, Set<Object> seen) {
        int wanted = values.size();
        Set<Object> accepted = new LinkedHashSet<>(wanted * 2);
        offer(values, seen, accepted, wanted);

        int attempts = 0;
        while (accepted.size() < wanted && attempts < maxAttempts) {
            attempts++;
            int needed = wanted - accepted.size();
            offer(generator.sampleMore(needed * 2), seen, accepted, wanted);
            logger.trace("Uniqueness attempt {} for column '{}': {} of {} values",
                attempts, generator.context().column(), accepted.size(), wanted);
        }
        if (accepted.size() < wanted) {
            throw new UniquenessExhaustedException(generator.context().column(), wanted - accepted.size());
        }
        if (attempts > 0) {
            logger.debug("Column '{}' needed {} resampling attempts to reach {} unique values",
                generator.context().column(), attempts, wanted);
        }
        return new ArrayList<>(accepted);
    }

    private static void offer(List<Object> candidates, Set<Object> seen, Set<Object> accepted, int wanted) {
        for (Object candidate : candidates) {
            if (accepted.size() >= wanted) {
                return;
            }
            if (!seen.contains(candidate)) {
                accepted.add(candidate);
            }
        }
    }
}
