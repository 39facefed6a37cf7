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

import java.util.Arrays;

/// A parsed mask, ready to select rows from a frame.
public final class MaskExpression {

  private final String source;
  private final MaskNode root;

  private MaskExpression(String source, MaskNode root) {
    this.source = source;
    this.root = root;
  }

  /// @throws io.genxdata.engine.errors.InvalidConfigParamException if the expression is malformed
  public static MaskExpression compile(String expression) {
    return new MaskExpression(expression, MaskParser.parse(expression));
  }

  public String source() {
    return source;
  }

  public MaskNode root() {
    return root;
  }

  /**
   * Evaluates the mask for every row.
   *
   * @return the matching row positions in ascending order
   * @throws io.genxdata.engine.errors.MaskEvaluationException if a row cannot be evaluated
   */
  public int[] select(Frame frame) {
    int[] rows = new int[frame.size()];
    int count = 0;
    for (int row = 0; row < frame.size(); row++) {
      if (root.test(frame, row)) {
        rows[count++] = row;
      }
    }
    return Arrays.copyOf(rows, count);
  }

  @Override
  public String toString() {
    return source;
  }
}
