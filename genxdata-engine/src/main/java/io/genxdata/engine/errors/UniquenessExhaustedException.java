package io.genxdata.engine.errors;

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

/**
 * Raised when a column marked unique cannot be filled with distinct values within
 * the bounded number of resampling attempts.
 */
public class UniquenessExhaustedException extends GenXDataException {

    private final String column;
    private final int missing;

    public UniquenessExhaustedException(String column, int missing) {
        super(ErrorCategory.STRATEGY, ErrorCategory.STRATEGY.code(1),
            "Unable to generate " + missing + " additional unique values for column '" + column
                + "'. Consider disabling unique or expanding the domain.");
        this.column = column;
        this.missing = missing;
    }

    public String getColumn() {
        return column;
    }

    /// @return how many additional distinct values could not be produced
    public int getMissing() {
        return missing;
    }
}
