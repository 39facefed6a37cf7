package io.genxdata.engine.generator.params;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import io.genxdata.engine.errors.InvalidConfigParamException;

/// {@code prefix + lhs + separator + rhs + suffix}, read from sibling columns.
public record ConcatParams(
    @JsonProperty("lhs_col") String lhsCol,
    @JsonProperty("rhs_col") String rhsCol,
    @JsonProperty("separator") String separator,
    @JsonProperty("prefix") String prefix,
    @JsonProperty("suffix") String suffix
) implements StrategyParams {

    public ConcatParams {
        lhsCol = lhsCol == null ? "" : lhsCol;
        rhsCol = rhsCol == null ? "" : rhsCol;
        separator = separator == null ? "" : separator;
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    @Override
    public void validate() {
        if (lhsCol.isBlank() && rhsCol.isBlank()) {
            throw new InvalidConfigParamException("lhs_col", "At least one column must be specified for concatenation");
        }
    }
}
