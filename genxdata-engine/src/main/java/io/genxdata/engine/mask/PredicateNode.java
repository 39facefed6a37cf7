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

import java.math.BigDecimal;
import java.util.List;

/**
 * A single comparison between two operands.
 *
 * <p>Numbers compare by value regardless of their boxed type. Ordering comparisons
 * involving a null are false; equality with null is true only for null. Ordering a
 * number against a string cannot be evaluated and raises {@link MaskEvaluationException}.
 */
public record PredicateNode(Operand left, OpType op, Operand right) implements MaskNode {

  @Override
  public ConjugateType type() {
    return ConjugateType.PRED;
  }

  @Override
  public boolean test(Frame frame, int row) {
    Object lhs = left.resolve(frame, row);
    Object rhs = right.resolve(frame, row);
    switch (op) {
      case EQ:
        return valueEquals(lhs, rhs);
      case NE:
        return !valueEquals(lhs, rhs);
      case IN:
        return contains(rhs, lhs);
      case NOT_IN:
        return !contains(rhs, lhs);
      default:
        if (lhs == null || rhs == null) {
          return false;
        }
        int cmp = compare(lhs, rhs);
        switch (op) {
          case GT:
            return cmp > 0;
          case LT:
            return cmp < 0;
          case GE:
            return cmp >= 0;
          case LE:
            return cmp <= 0;
          default:
            throw new IllegalStateException("Unexpected operator " + op);
        }
    }
  }

  private boolean contains(Object list, Object value) {
    if (!(list instanceof List<?>)) {
      throw new MaskEvaluationException("Operator '" + op.symbol() + "' needs a list on its right side");
    }
    for (Object candidate : (List<?>) list) {
      if (valueEquals(value, candidate)) {
        return true;
      }
    }
    return false;
  }

  static boolean valueEquals(Object a, Object b) {
    if (a == null || b == null) {
      return a == b;
    }
    if (a instanceof Number && b instanceof Number) {
      return toDecimal((Number) a).compareTo(toDecimal((Number) b)) == 0;
    }
    if (a instanceof Number || b instanceof Number) {
      return false;
    }
    return a.equals(b);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private int compare(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      return toDecimal((Number) a).compareTo(toDecimal((Number) b));
    }
    if (a instanceof String && b instanceof String) {
      return ((String) a).compareTo((String) b);
    }
    if (a instanceof Comparable && a.getClass() == b.getClass()) {
      return ((Comparable) a).compareTo(b);
    }
    throw new MaskEvaluationException("Cannot compare " + a.getClass().getSimpleName() + " '" + a
        + "' with " + b.getClass().getSimpleName() + " '" + b + "' using '" + op.symbol() + "'");
  }

  private static BigDecimal toDecimal(Number n) {
    if (n instanceof BigDecimal) {
      return (BigDecimal) n;
    }
    if (n instanceof Double || n instanceof Float) {
      double d = n.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new MaskEvaluationException("Cannot compare non-finite value " + d);
      }
      return BigDecimal.valueOf(d);
    }
    return new BigDecimal(n.toString());
  }

  @Override
  public String toString() {
    return left + " " + op.symbol() + " " + right;
  }
}
