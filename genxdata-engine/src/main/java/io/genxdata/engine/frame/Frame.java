package io.genxdata.engine.frame;

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

import io.genxdata.engine.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A columnar, row-aligned container for one chunk of generated data.
 *
 * <p>The row count is fixed when the frame is created. Columns are added lazily, in
 * order, and every column always holds exactly {@link #size()} values, where
 * {@code null} marks a missing value. A side set records which columns are
 * intermediate so that they can be dropped before the frame reaches a sink; this
 * set survives {@link #shuffled(UniformRandomProvider)}.
 */
public final class Frame {

    private final int size;
    private final LinkedHashMap<String, Object[]> columns = new LinkedHashMap<>();
    private final LinkedHashSet<String> intermediateColumns = new LinkedHashSet<>();

    private Frame(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Frame size cannot be negative: " + size);
        }
        this.size = size;
    }

    /// Creates a frame of {@code size} rows with the given columns, all null.
    public static Frame empty(int size, List<String> columnNames) {
        Frame frame = new Frame(size);
        if (columnNames != null) {
            for (String name : columnNames) {
                frame.addColumn(name);
            }
        }
        return frame;
    }

    /// Creates a frame of {@code size} rows without columns.
    public static Frame empty(int size) {
        return new Frame(size);
    }

    public int size() {
        return size;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    /// Adds a null-filled column if it does not exist yet.
    public void addColumn(String name) {
        Objects.requireNonNull(name, "column name");
        columns.computeIfAbsent(name, n -> new Object[size]);
    }

    public Object get(String column, int row) {
        return requireColumn(column)[checkRow(row)];
    }

    public void set(String column, int row, Object value) {
        requireColumn(column)[checkRow(row)] = value;
    }

    /// @return an unmodifiable view of the column's values
    public List<Object> column(String name) {
        return Collections.unmodifiableList(Arrays.asList(requireColumn(name)));
    }

    /**
     * Replaces every value of a column, creating it when needed.
     *
     * @throws IllegalArgumentException when the number of values differs from the frame size
     */
    public void setColumn(String name, List<?> values) {
        if (values.size() != size) {
            throw new IllegalArgumentException("Column '" + name + "' needs " + size
                + " values but got " + values.size());
        }
        addColumn(name);
        Object[] target = columns.get(name);
        for (int i = 0; i < size; i++) {
            target[i] = values.get(i);
        }
    }

    /**
     * Assigns {@code values[i]} to {@code rows[i]} of a column, leaving other rows untouched.
     */
    public void setRows(String name, int[] rows, List<?> values) {
        if (values.size() != rows.length) {
            throw new IllegalArgumentException("Column '" + name + "' targets " + rows.length
                + " rows but got " + values.size() + " values");
        }
        addColumn(name);
        Object[] target = columns.get(name);
        for (int i = 0; i < rows.length; i++) {
            target[checkRow(rows[i])] = values.get(i);
        }
    }

    public void markIntermediate(String name) {
        requireColumn(name);
        intermediateColumns.add(name);
    }

    public boolean isIntermediate(String name) {
        return intermediateColumns.contains(name);
    }

    public Set<String> intermediateColumns() {
        return Collections.unmodifiableSet(intermediateColumns);
    }

    /// @return a new frame with the same columns and intermediate markers, rows reordered
    public Frame shuffled(UniformRandomProvider rng) {
        int[] order = RandomGenerators.permutation(size, rng);
        Frame result = new Frame(size);
        for (Map.Entry<String, Object[]> entry : columns.entrySet()) {
            Object[] source = entry.getValue();
            Object[] target = new Object[size];
            for (int i = 0; i < size; i++) {
                target[i] = source[order[i]];
            }
            result.columns.put(entry.getKey(), target);
        }
        result.intermediateColumns.addAll(intermediateColumns);
        return result;
    }

    /// @return a new frame holding only the columns that are not intermediate
    public Frame withoutIntermediateColumns() {
        Frame result = new Frame(size);
        for (Map.Entry<String, Object[]> entry : columns.entrySet()) {
            if (!intermediateColumns.contains(entry.getKey())) {
                result.columns.put(entry.getKey(), entry.getValue().clone());
            }
        }
        return result;
    }

    /// @return the values of one row keyed by column name, in column order
    public Map<String, Object> row(int row) {
        checkRow(row);
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object[]> entry : columns.entrySet()) {
            values.put(entry.getKey(), entry.getValue()[row]);
        }
        return values;
    }

    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            records.add(row(i));
        }
        return records;
    }

    private Object[] requireColumn(String name) {
        Object[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "', available: " + columns.keySet());
        }
        return values;
    }

    private int checkRow(int row) {
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " outside frame of size " + size);
        }
        return row;
    }

    @Override
    public String toString() {
        return "Frame{rows=" + size + ", columns=" + columns.keySet()
            + ", intermediate=" + intermediateColumns + "}";
    }
}
