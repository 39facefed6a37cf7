package io.genxdata.writers;

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

import io.genxdata.engine.errors.ConfigurationException;
import io.genxdata.engine.errors.WriterException;
import io.genxdata.engine.frame.Frame;
import io.genxdata.engine.sink.ChunkMetadata;
import io.genxdata.engine.sink.FrameSink;
import io.genxdata.engine.sink.WriteResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base for sinks writing one file per {@link #write} call.
 *
 * <p>The output path comes from the {@code output_path} parameter ({@code path} and
 * {@code path_or_buf} are accepted too). It may contain {@code {batch_index}} and
 * {@code {timestamp}} placeholders, which are filled from the chunk metadata. The
 * format's default extension is appended when the path has none of the accepted ones,
 * and parent directories are created.
 */
public abstract class AbstractFileWriter implements FrameSink {

    private static final List<String> PATH_KEYS = List.of("output_path", "path_or_buf", "path");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
        .withZone(ZoneOffset.UTC);

    protected final Logger logger = LogManager.getLogger(getClass());

    protected final FileFormat format;
    protected final Map<String, Object> params;
    private final String pathTemplate;

    private Path lastWrittenPath;
    private long rowsWritten;
    private int filesWritten;

    protected AbstractFileWriter(FileFormat format, Map<String, Object> params) {
        this.format = format;
        this.params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.pathTemplate = extractPath(this.params);
    }

    private static String extractPath(Map<String, Object> params) {
        for (String key : PATH_KEYS) {
            Object value = params.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        throw new ConfigurationException("Missing output path parameter. Please use 'output_path'");
    }

    /// Writes the frame to {@code path}, replacing any existing file.
    protected abstract void writeFile(Frame frame, Path path) throws IOException;

    @Override
    public WriteResult write(Frame frame, ChunkMetadata metadata) {
        Path path = resolvePath(metadata);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            writeFile(frame, path);
        } catch (IOException e) {
            throw new WriterException("Failed to write " + format + " file " + path + ": " + e.getMessage(), e);
        }
        lastWrittenPath = path;
        rowsWritten += frame.size();
        filesWritten++;
        logger.debug("Wrote {} rows to {}", frame.size(), path);
        return WriteResult.of(frame.size(), path.toString());
    }

    /// The concrete file path for a write, placeholders filled and extension normalized.
    public Path resolvePath(ChunkMetadata metadata) {
        String path = pathTemplate;
        if (metadata != null) {
            path = path.replace("{batch_index}", Integer.toString(metadata.batchIndex()))
                .replace("{timestamp}", TIMESTAMP.format(metadata.timestamp()));
        }
        return Path.of(normalizeExtension(path));
    }

    String normalizeExtension(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String extension : format.extensions()) {
            if (lower.endsWith(extension)) {
                return path;
            }
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        String stem = dot > slash ? path.substring(0, dot) : path;
        return stem + format.defaultExtension();
    }

    public String pathTemplate() {
        return pathTemplate;
    }

    public Path lastWrittenPath() {
        return lastWrittenPath;
    }

    @Override
    public Map<String, Object> finish() {
        Path path = lastWrittenPath != null ? lastWrittenPath : resolvePath(null);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("writer_type", format.name().toLowerCase(Locale.ROOT));
        summary.put("output_path", path.toString());
        summary.put("files_written", filesWritten);
        summary.put("total_rows_written", rowsWritten);
        boolean exists = Files.isRegularFile(path);
        summary.put("exists", exists);
        if (exists) {
            try {
                summary.put("size_bytes", Files.size(path));
            } catch (IOException e) {
                logger.warn("Could not read size of {}: {}", path, e.getMessage());
            }
        }
        return summary;
    }

    /// Text form of a cell value; null becomes the empty string.
    protected static String text(Object value) {
        return value == null ? "" : value.toString();
    }
}
