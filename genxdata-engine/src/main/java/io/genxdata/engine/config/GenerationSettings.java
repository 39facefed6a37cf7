package io.genxdata.engine.config;

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

import io.genxdata.engine.generator.UniquenessEnforcer;

/// Process-wide defaults applied when a dataset configuration does not say otherwise.
///
/// Defaults:
/// - shuffle: false
/// - perfReport: false
/// - minimumRows: 1
/// - batchSize: 1000
/// - uniquenessAttempts: 10
public final class GenerationSettings {

    private final boolean shuffle;
    private final boolean perfReport;
    private final int minimumRows;
    private final int batchSize;
    private final int uniquenessAttempts;

    private GenerationSettings(Builder builder) {
        this.shuffle = builder.shuffle;
        this.perfReport = builder.perfReport;
        this.minimumRows = builder.minimumRows;
        this.batchSize = builder.batchSize;
        this.uniquenessAttempts = builder.uniquenessAttempts;
    }

    /// Whether datasets are shuffled when their configuration does not set {@code shuffle}.
    public boolean shuffle() {
        return shuffle;
    }

    /// Whether a performance report is attached to results.
    public boolean perfReport() {
        return perfReport;
    }

    /// Row counts below this are raised to it.
    public int minimumRows() {
        return minimumRows;
    }

    /// Default rows per batch or stream message when the run does not say otherwise.
    public int batchSize() {
        return batchSize;
    }

    public int uniquenessAttempts() {
        return uniquenessAttempts;
    }

    public static GenerationSettings defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .shuffle(shuffle)
            .perfReport(perfReport)
            .minimumRows(minimumRows)
            .batchSize(batchSize)
            .uniquenessAttempts(uniquenessAttempts);
    }

    @Override
    public String toString() {
        return "GenerationSettings{" +
            "shuffle=" + shuffle +
            ", perfReport=" + perfReport +
            ", minimumRows=" + minimumRows +
            ", batchSize=" + batchSize +
            ", uniquenessAttempts=" + uniquenessAttempts +
            '}';
    }

    /// Builder for GenerationSettings.
    public static final class Builder {
        private boolean shuffle = false;
        private boolean perfReport = false;
        private int minimumRows = 1;
        private int batchSize = 1000;
        private int uniquenessAttempts = UniquenessEnforcer.DEFAULT_MAX_ATTEMPTS;

        Builder() {
        }

        public Builder shuffle(boolean shuffle) {
            this.shuffle = shuffle;
            return this;
        }

        public Builder perfReport(boolean perfReport) {
            this.perfReport = perfReport;
            return this;
        }

        /// @throws IllegalArgumentException if rows < 1
        public Builder minimumRows(int rows) {
            if (rows < 1) {
                throw new IllegalArgumentException("Minimum rows must be >= 1, got: " + rows);
            }
            this.minimumRows = rows;
            return this;
        }

        /// @throws IllegalArgumentException if size < 1
        public Builder batchSize(int size) {
            if (size < 1) {
                throw new IllegalArgumentException("Batch size must be >= 1, got: " + size);
            }
            this.batchSize = size;
            return this;
        }

        /// @throws IllegalArgumentException if attempts < 1
        public Builder uniquenessAttempts(int attempts) {
            if (attempts < 1) {
                throw new IllegalArgumentException("Uniqueness attempts must be >= 1, got: " + attempts);
            }
            this.uniquenessAttempts = attempts;
            return this;
        }

        public GenerationSettings build() {
            return new GenerationSettings(this);
        }
    }
}
