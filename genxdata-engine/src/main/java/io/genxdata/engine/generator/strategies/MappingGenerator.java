package io.genxdata.engine.generator.strategies;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auto.service.AutoService;
import de.siegmar.fastcsv.reader.CsvReader;
import de.siegmar.fastcsv.reader.NamedCsvRecord;
import io.genxdata.engine.errors.InvalidConfigParamException;
import io.genxdata.engine.generator.AbstractColumnGenerator;
import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.GeneratorKind;
import io.genxdata.engine.generator.ParamsType;
import io.genxdata.engine.generator.StrategyKind;
import io.genxdata.engine.generator.params.MappingParams;
import io.genxdata.engine.generator.validation.NumericRangeValidator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Looks up the value of the {@code map_from} column in a table and writes the result.
 *
 * <p>The table is either given inline or read from a CSV or JSON (array of records)
 * file. Keys are compared by their text, with integral numbers rendered without a
 * fraction. Rows without a mapping keep the value already present in the target column.
 */
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.MAPPING)
@ParamsType(MappingParams.class)
public class MappingGenerator extends AbstractColumnGenerator<MappingParams> {

    private static final ObjectMapper JSON = new ObjectMapper();

    private Map<String, Object> table;

    @Override
    protected void configure() {
        Map<String, Object> lookup = new HashMap<>();
        if (params.fileBacked()) {
            loadSource(Path.of(params.source()), lookup);
        } else {
            params.mapping().forEach((key, value) -> lookup.put(keyOf(key), value));
        }
        table = Collections.unmodifiableMap(lookup);
        logger.debug("Mapping for '{}' from '{}' has {} entries ({})", context.column(), params.mapFrom(),
            table.size(), params.fileBacked() ? params.source() : "inline");
    }

    @Override
    public List<Object> generateChunk(int count) {
        if (!FrameValues.exists(context, params.mapFrom())) {
            logger.warn("Mapping source column '{}' is missing for '{}'; writing nulls",
                params.mapFrom(), context.column());
            return new ArrayList<>(Collections.nCopies(count, null));
        }
        List<Object> keys = FrameValues.read(context, params.mapFrom(), count);
        List<Object> existing = FrameValues.exists(context, context.column())
            ? FrameValues.read(context, context.column(), count)
            : Collections.nCopies(count, null);

        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Object key = keys.get(i);
            Object mapped = key == null ? null : table.get(keyOf(key));
            values.add(mapped != null ? mapped : existing.get(i));
        }
        return values;
    }

    private void loadSource(Path path, Map<String, Object> lookup) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (name.endsWith(".json")) {
                loadJson(path, lookup);
            } else {
                if (!name.endsWith(".csv")) {
                    logger.debug("Unknown extension for mapping source '{}', reading it as CSV", path);
                }
                loadCsv(path, lookup);
            }
        } catch (IOException e) {
            throw new InvalidConfigParamException("source",
                "Failed to load mapping from '" + path + "': " + e.getMessage(), e);
        }
    }

    private void loadCsv(Path path, Map<String, Object> lookup) throws IOException {
        try (CsvReader<NamedCsvRecord> reader = CsvReader.builder().ofNamedCsvRecord(path)) {
            boolean checked = false;
            for (NamedCsvRecord record : reader) {
                if (!checked) {
                    requireColumns(record.getHeader());
                    checked = true;
                }
                String key = record.getField(params.sourceMapFrom());
                if (!key.isEmpty()) {
                    lookup.put(key, record.getField(params.sourceColumn()));
                }
            }
        }
    }

    private void loadJson(Path path, Map<String, Object> lookup) throws IOException {
        JsonNode root = JSON.readTree(path.toFile());
        if (root == null || !root.isArray()) {
            throw new InvalidConfigParamException("source",
                "Mapping source '" + path + "' must hold a JSON array of records");
        }
        for (JsonNode record : root) {
            JsonNode key = record.get(params.sourceMapFrom());
            JsonNode value = record.get(params.sourceColumn());
            if (key == null || value == null) {
                throw new InvalidConfigParamException("source_column", "Mapping source '" + path
                    + "' records need fields '" + params.sourceMapFrom() + "' and '" + params.sourceColumn() + "'");
            }
            if (!key.isNull()) {
                lookup.put(keyOf(JSON.treeToValue(key, Object.class)), JSON.treeToValue(value, Object.class));
            }
        }
    }

    private void requireColumns(List<String> header) {
        if (!header.contains(params.sourceMapFrom()) || !header.contains(params.sourceColumn())) {
            throw new InvalidConfigParamException("source_column", "Required columns not found in mapping source. "
                + "Needed: '" + params.sourceMapFrom() + "', '" + params.sourceColumn() + "'. Found: " + header);
        }
    }

    static String keyOf(Object key) {
        if (key instanceof Number) {
            return NumericRangeValidator.toDecimal((Number) key).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(key);
    }
}
