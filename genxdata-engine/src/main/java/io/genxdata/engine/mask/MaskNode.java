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

/// A node of a parsed mask expression, evaluated against one row of a frame.
public sealed interface MaskNode permits ConjugateNode, PredicateNode {

  ConjugateType type();

  /// @return true when the row satisfies this node
  boolean test(Frame frame, int row);
}
