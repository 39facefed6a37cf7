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
import io.genxdata.engine.generator.AbstractColumnGenerator;
import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.GeneratorKind;
import io.genxdata.engine.generator.ParamsType;
import io.genxdata.engine.generator.StrategyKind;
import io.genxdata.engine.generator.params.ConcatParams;

import java.util.ArrayList;
import java.util.List;

/// {@code prefix + lhs + separator + rhs + suffix} from sibling columns; missing values
/// render as empty strings. With only one column configured the separator is omitted.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.CONCAT)
@ParamsType(ConcatParams.class)
public class ConcatGenerator extends AbstractColumnGenerator<ConcatParams> {

    @Override
    public List<Object> generateChunk(int count) {
        boolean hasLeft = !params.lhsCol().isBlank();
        boolean hasRight = !params.rhsCol().isBlank();
        List<Object> left = hasLeft ? FrameValues.read(context, params.lhsCol(), count) : null;
        List<Object> right = hasRight ? FrameValues.read(context, params.rhsCol(), count) : null;

        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            StringBuilder sb = new StringBuilder(params.prefix());
            if (hasLeft) {
                sb.append(FrameValues.text(left.get(i)));
            }
            if (hasLeft && hasRight) {
                sb.append(params.separator());
            }
            if (hasRight) {
                sb.append(FrameValues.text(right.get(i)));
            }
            values.add(sb.append(params.suffix()).toString());
        }
        return values;
    }
}
