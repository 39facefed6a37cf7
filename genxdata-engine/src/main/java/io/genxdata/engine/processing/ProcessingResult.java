package io.genxdata.engine.processing;

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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a pipeline run. Pipelines report failures through this type rather than by
 * throwing.
 */
public final class ProcessingResult {

    public enum Status {
        SUCCESS, ERROR;

        public String label() {
            return name().toLowerCase();
        }
    }

    private final Status status;
    private final ProcessorType processorType;
    private final String configName;
    private final long rowsGenerated;
    private final int columnsGenerated;
    private final List<String> columnNames;
    private final Map<String, Object> writerSummary;
    private final Map<String, Map<String, Object>> performanceReport;
    private final String error;
    private final String errorCode;
    private final Integer chunksProcessed;
    private final Integer chunkSize;
    private final Integer batchSize;

    private ProcessingResult(Builder builder) {
        this.status = builder.status;
        this.processorType = builder.processorType;
        this.configName = builder.configName;
        this.rowsGenerated = builder.rowsGenerated;
        this.columnsGenerated = builder.columnNames == null ? 0 : builder.columnNames.size();
        this.columnNames = builder.columnNames == null ? List.of() : List.copyOf(builder.columnNames);
        this.writerSummary = builder.writerSummary;
        this.performanceReport = builder.performanceReport;
        this.error = builder.error;
        this.errorCode = builder.errorCode;
        this.chunksProcessed = builder.chunksProcessed;
        this.chunkSize = builder.chunkSize;
        this.batchSize = builder.batchSize;
    }

    public static Builder success(ProcessorType type, String configName) {
        return new Builder(Status.SUCCESS, type, configName);
    }

    public static Builder error(ProcessorType type, String configName, String message) {
        Builder builder = new Builder(Status.ERROR, type, configName);
        builder.error = message;
        return builder;
    }

    public Status status() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public ProcessorType processorType() {
        return processorType;
    }

    public String configName() {
        return configName;
    }

    public long rowsGenerated() {
        return rowsGenerated;
    }

    public int columnsGenerated() {
        return columnsGenerated;
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public Map<String, Object> writerSummary() {
        return writerSummary;
    }

    public Map<String, Map<String, Object>> performanceReport() {
        return performanceReport;
    }

    public String error() {
        return error;
    }

    public String errorCode() {
        return errorCode;
    }

    public Integer chunksProcessed() {
        return chunksProcessed;
    }

    public Integer chunkSize() {
        return chunkSize;
    }

    public Integer batchSize() {
        return batchSize;
    }

    /// Snake-case view for JSON output. Absent optional entries are omitted.
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.label());
        map.put("processor_type", processorType.label());
        map.put("config_name", configName);
        if (status == Status.ERROR) {
            map.put("error", error);
            if (errorCode != null) {
                map.put("error_code", errorCode);
            }
            return map;
        }
        map.put("rows_generated", rowsGenerated);
        map.put("columns_generated", columnsGenerated);
        map.put("column_names", columnNames);
        if (chunksProcessed != null) {
            map.put("chunks_processed", chunksProcessed);
            map.put("chunk_size", chunkSize);
            map.put("batch_size", batchSize);
        }
        map.put("writer_summary", writerSummary == null ? Map.of() : writerSummary);
        if (performanceReport != null) {
            map.put("performance_report", performanceReport);
        }
        return map;
    }

    @Override
    public String toString() {
        return "ProcessingResult" + toMap();
    }

    public static final class Builder {
        private final Status status;
        private final ProcessorType processorType;
        private final String configName;
        private long rowsGenerated;
        private List<String> columnNames;
        private Map<String, Object> writerSummary;
        private Map<String, Map<String, Object>> performanceReport;
        private String error;
        private String errorCode;
        private Integer chunksProcessed;
        private Integer chunkSize;
        private Integer batchSize;

        private Builder(Status status, ProcessorType processorType, String configName) {
            this.status = status;
            this.processorType = processorType;
            this.configName = configName;
        }

        public Builder rowsGenerated(long rows) {
            this.rowsGenerated = rows;
            return this;
        }

        public Builder columnNames(List<String> columnNames) {
            this.columnNames = columnNames;
            return this;
        }

        public Builder writerSummary(Map<String, Object> writerSummary) {
            this.writerSummary = writerSummary;
            return this;
        }

        public Builder performanceReport(Map<String, Map<String, Object>> report) {
            this.performanceReport = report;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder chunks(int chunksProcessed, int chunkSize, int batchSize) {
            this.chunksProcessed = chunksProcessed;
            this.chunkSize = chunkSize;
            this.batchSize = batchSize;
            return this;
        }

        public ProcessingResult build() {
            return new ProcessingResult(this);
        }
    }
}
