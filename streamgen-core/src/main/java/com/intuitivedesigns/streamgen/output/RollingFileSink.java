/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamgen.config.RollingPeriod;
import com.intuitivedesigns.streamgen.core.OutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * Appends newline-delimited JSON to a file that rotates on an hourly or daily boundary.
 *
 * <p>Records always go to the configured path. When the period changes, the finished file is
 * renamed to {@code <base>_<period><ext>} (the period it covered) and a fresh file is opened at
 * the configured path. Parent directories are created on open.</p>
 */
public final class RollingFileSink implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(RollingFileSink.class);

    private final Path path;
    private final RollingPeriod rolling;
    private final ObjectMapper mapper;
    private final Clock clock;

    // Guarded by this
    private BufferedWriter writer;
    private String currentPeriod;

    public RollingFileSink(Path path, RollingPeriod rolling) {
        this(path, rolling, new ObjectMapper(), Clock.systemDefaultZone());
    }

    public RollingFileSink(Path path, RollingPeriod rolling, ObjectMapper mapper, Clock clock) {
        this.path = Objects.requireNonNull(path, "path");
        this.rolling = Objects.requireNonNull(rolling, "rolling");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        log.info("RollingFileSink active. path='{}' rolling={}", path, rolling);
    }

    @Override
    public synchronized boolean send(Map<String, Object> record) {
        try {
            String line = mapper.writeValueAsString(record);
            ensureWriter();
            writer.write(line);
            writer.newLine();
            return true;
        } catch (IOException e) {
            log.warn("File write failed path={}: {}", path, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized int flush() {
        if (writer == null) return 0;
        try {
            writer.flush();
        } catch (IOException e) {
            log.warn("File flush failed path={}: {}", path, e.getMessage());
        }
        return 0;
    }

    @Override
    public synchronized void close() {
        if (writer == null) return;
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("File close failed path={}: {}", path, e.getMessage());
        } finally {
            writer = null;
        }
    }

    @Override
    public String id() {
        return "file:" + path;
    }

    public Path path() {
        return path;
    }

    /**
     * @return the name a file covering {@code period} is renamed to on rotation
     */
    Path rotatedPath(String period) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = (dot > 0) ? fileName.substring(0, dot) : fileName;
        String ext = (dot > 0) ? fileName.substring(dot) : "";
        return path.resolveSibling(base + "_" + period + ext);
    }

    // Caller holds this
    private void ensureWriter() throws IOException {
        String period = rolling.periodKey(LocalDateTime.now(clock));
        if (writer != null && period.equals(currentPeriod)) return;

        if (writer != null) {
            writer.close();
            writer = null;
            Path rotated = rotatedPath(currentPeriod);
            Files.move(path, rotated, StandardCopyOption.REPLACE_EXISTING);
            log.info("Rotated {} -> {}", path, rotated);
        }

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        currentPeriod = period;
    }
}
