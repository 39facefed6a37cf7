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

/// Comparison operators usable in a mask predicate.
public enum OpType {
  EQ("=="),
  NE("!="),
  GT(">"),
  LT("<"),
  GE(">="),
  LE("<="),
  IN("in"),
  NOT_IN("not in");

  private final String symbol;

  OpType(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return this.symbol;
  }

  /// @return the operator for a comparison symbol; {@code =} is accepted as {@code ==}
  public static OpType fromSymbol(String symbol) {
    if ("=".equals(symbol)) {
      return EQ;
    }
    for (OpType type : values()) {
      if (type.symbol.equals(symbol)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown operator: " + symbol);
  }
}
