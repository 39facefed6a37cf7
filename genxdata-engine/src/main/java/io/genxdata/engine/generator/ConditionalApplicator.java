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

import io.genxdata.engine.errors.InvalidConfigParamException;
import io.genxdata.engine.errors.MaskEvaluationException;
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.mask.MaskExpression;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Writes a generator's values into its bound frame, honoring the mask and the
 * uniqueness flag.
 *
 * <ul>
 *   <li>A missing column is first added with every row null.</li>
 *   <li>Without a mask every row is generated; with one, only the selected rows are.</li>
 *   <li>A mask selecting nothing generates nothing and logs a warning.</li>
 *   <li>A mask that cannot be evaluated logs a warning and falls back to every row.</li>
 *   <li>Uniqueness is enforced only in {@link ExecutionMode#NORMAL}.</li>
 * </ul>
 */
public final class ConditionalApplicator {

    private final UniquenessEnforcer uniquenessEnforcer;
    private final Logger logger;

    public ConditionalApplicator(Logger logger) {
        this(new UniquenessEnforcer(logger), logger);
    }

    public ConditionalApplicator(UniquenessEnforcer uniquenessEnforcer, Logger logger) {
        this.uniquenessEnforcer = Objects.requireNonNull(uniquenessEnforcer, "uniquenessEnforcer");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /// @return the number of rows written
    public int apply(ColumnGenerator<?> generator) {
        GeneratorContext context = generator.context();
        Frame frame = context.frame();
        String column = context.column();
        if (!frame.hasColumn(column)) {
            frame.addColumn(column);
        }

        int[] rows = selectRows(context);
        if (rows.length == 0) {
            return 0;
        }
        context.targetRows(rows);

        List<Object> values = generator.generateData(rows.length);
        boolean enforceUnique = context.unique() && generator.honorsUniqueness()
            && context.mode() == ExecutionMode.NORMAL;
        GenerationState state = context.sharedState().getOrCreate(context.key());
        if (enforceUnique) {
            values = uniquenessEnforcer.enforce(generator, values, state.getUniqueValues());
        }
        if (values.size() != rows.length) {
            throw new IllegalStateException(context.key() + " produced " + values.size()
                + " values for " + rows.length + " rows");
        }

        frame.setRows(column, rows, values);
        if (enforceUnique) {
            state.addUniqueValues(values);
        }
        generator.syncState(values);
        return rows.length;
    }

    private int[] selectRows(GeneratorContext context) {
        Frame frame = context.frame();
        if (context.mask() == null || context.mask().isBlank()) {
            return allRows(frame.size());
        }
        int[] rows;
        try {
            rows = MaskExpression.compile(context.mask()).select(frame);
        } catch (MaskEvaluationException | InvalidConfigParamException e) {
            logger.warn("Mask '{}' for column '{}' could not be applied ({}); generating all {} rows",
                context.mask(), context.column(), e.getMessage(), frame.size());
            return allRows(frame.size());
        }
        if (rows.length == 0) {
            logger.warn("Mask '{}' for column '{}' matched no rows", context.mask(), context.column());
        } else {
            logger.debug("Mask '{}' for column '{}' selected {} of {} rows",
                context.mask(), context.column(), rows.length, frame.size());
        }
        return rows;
    }

    private static int[] allRows(int size) {
        int[] rows = new int[size];
        for (int i = 0; i < size; i++) {
            rows[i] = i;
        }
        return rows;
    }
}
