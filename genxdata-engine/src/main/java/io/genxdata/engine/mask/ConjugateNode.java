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

import io.genxdata.engine.frame.Frame;

import java.util.List;

/// Combines child nodes with {@code and}, {@code or}, or negates a single child with {@code not}.
public record ConjugateNode(ConjugateType type, List<MaskNode> values) implements MaskNode {

  public ConjugateNode {
    if (type == ConjugateType.PRED) {
      throw new IllegalArgumentException("A conjugate node cannot have type PRED");
    }
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("Conjugate node must have at least one child node");
    }
    if (type == ConjugateType.NOT && values.size() != 1) {
      throw new IllegalArgumentException("NOT takes exactly one child node");
    }
    values = List.copyOf(values);
  }

  public static ConjugateNode not(MaskNode node) {
    return new ConjugateNode(ConjugateType.NOT, List.of(node));
  }

  @Override
  public boolean test(Frame frame, int row) {
    switch (type) {
      case AND:
        for (MaskNode value : values) {
          if (!value.test(frame, row)) {
            return false;
          }
        }
        return true;
      case OR:
        for (MaskNode value : values) {
          if (value.test(frame, row)) {
            return true;
          }
        }
        return false;
      case NOT:
        return !values.get(0).test(frame, row);
      default:
        throw new IllegalStateException("Unexpected conjugate type " + type);
    }
  }

  @Override
  public String toString() {
    if (type == ConjugateType.NOT) {
      return "not (" + values.get(0) + ")";
    }
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(' ').append(type.name().toLowerCase()).append(' ');
      }
      sb.append(values.get(i));
    }
    return sb.append(')').toString();
  }
}
