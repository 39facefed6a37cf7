package io.genxdata.engine.mask;

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

import io.genxdata.engine.errors.MaskEvaluationException;
import io.genxdata.engine.frame.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// One side of a mask comparison.
public sealed interface Operand permits Operand.ColumnRef, Operand.Literal, Operand.ListLiteral {

  Object resolve(Frame frame, int row);

  /// A reference to another column of the frame.
  record ColumnRef(String name) implements Operand {
    @Override
    public Object resolve(Frame frame, int row) {
      if (!frame.hasColumn(name)) {
        throw new MaskEvaluationException("Mask references unknown column '" + name + "'");
      }
      return frame.get(name, row);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /// A constant: number, string, boolean or null.
  record Literal(Object value) implements Operand {
    @Override
    public Object resolve(Frame frame, int row) {
      return value;
    }

    @Override
    public String toString() {
      return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
  }

  /// A bracketed list of constants, the right side of {@code in} / {@code not in}.
  record ListLiteral(List<Object> values) implements Operand {
    public ListLiteral {
      values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public Object resolve(Frame frame, int row) {
      return values;
    }

    @Override
    public String toString() {
      return values.toString();
    }
  }
}
