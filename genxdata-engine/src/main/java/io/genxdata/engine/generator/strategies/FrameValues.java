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

import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.generator.GeneratorContext;
import io.genxdata.engine.generator.validation.NumericRangeValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Reads sibling column values for generators derived from existing data.
final class FrameValues {

    private FrameValues() {
    }

    /**
     * Values of {@code column} at the rows targeted by the current generation. When more
     * values than targeted rows are requested, the targets are cycled.
     *
     * @throws IllegalStateException if the column does not exist
     */
    static List<Object> read(GeneratorContext context, String column, int count) {
        Frame frame = context.frame();
        if (frame == null || !frame.hasColumn(column)) {
            throw new IllegalStateException(context.kind().strategyName() + " for column '" + context.column()
                + "' references missing column '" + column + "'");
        }
        int[] rows = context.targetRows(count);
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(rows.length == 0 ? null : frame.get(column, rows[i % rows.length]));
        }
        return values;
    }

    static boolean exists(GeneratorContext context, String column) {
        return context.frame() != null && context.frame().hasColumn(column);
    }

    static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    /// Equality that treats numbers of different boxed types as equal when their values are.
    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return NumericRangeValidator.toDecimal((Number) a).compareTo(NumericRangeValidator.toDecimal((Number) b)) == 0;
        }
        return Objects.equals(a, b);
    }
}
