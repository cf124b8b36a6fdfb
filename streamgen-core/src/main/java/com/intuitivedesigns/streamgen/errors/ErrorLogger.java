/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.errors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.streamgen.config.ErrorLogConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * Appends producer errors and refused records as JSON lines to {@code errors_<period>.json}.
 *
 * <p>Writes never throw; a failed write is logged and reported as {@code false}. When the
 * configuration is disabled every write is a successful no-op.</p>
 */
public final class ErrorLogger {

    private static final Logger log = LoggerFactory.getLogger(ErrorLogger.class);

    private static final String FILE_PREFIX = "errors_";
    private static final String FILE_SUFFIX = ".json";

    private final ErrorLogConfig config;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ErrorLogger(ErrorLogConfig config) {
        this(config, new ObjectMapper(), Clock.systemDefaultZone());
    }

    public ErrorLogger(ErrorLogConfig config, ObjectMapper mapper, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean enabled() {
        return config.enabled();
    }

    /**
     * @param details extra context, may be null
     */
    public boolean logError(String producer, String message, Map<String, ?> details) {
        ObjectNode entry = newEntry(producer);
        entry.put("error", message);
        return attach(entry, "details", details == null ? Map.of() : details) && append(entry);
    }

    public boolean logDroppedData(String producer, Map<String, ?> record, String reason) {
        ObjectNode entry = newEntry(producer);
        entry.put("reason", reason);
        return attach(entry, "data", record) && append(entry);
    }

    /**
     * Delete error log files last modified more than {@code max_age_days} ago.
     *
     * @return number of files deleted
     */
    public int cleanupOldLogs() {
        Path dir = config.directory();
        if (!Files.isDirectory(dir)) return 0;

        Instant cutoff = clock.instant().minus(Duration.ofDays(config.maxAgeDays()));
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        Files.deleteIfExists(file);
                        deleted++;
                    }
                } catch (IOException e) {
                    log.warn("Could not remove old error log {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Error log cleanup failed in {}: {}", dir, e.getMessage());
        }
        if (deleted > 0) {
            log.info("Removed {} error log file(s) older than {} days", deleted, config.maxAgeDays());
        }
        return deleted;
    }

    /**
     * @return the file the next entry is appended to
     */
    public Path currentFile() {
        String period = config.rolling().periodKey(LocalDateTime.now(clock));
        return config.directory().resolve(FILE_PREFIX + period + FILE_SUFFIX);
    }

    private ObjectNode newEntry(String producer) {
        ObjectNode entry = mapper.createObjectNode();
        entry.put("timestamp", LocalDateTime.now(clock).toString());
        entry.put("producer", producer);
        return entry;
    }

    private boolean attach(ObjectNode entry, String field, Object value) {
        try {
            entry.set(field, mapper.valueToTree(value));
            return true;
        } catch (IllegalArgumentException e) {
            log.warn("Unserializable error log {}: {}", field, e.getMessage());
            return false;
        }
    }

    private synchronized boolean append(ObjectNode entry) {
        if (!config.enabled()) return true;
        Path file = currentFile();
        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(mapper.writeValueAsString(entry));
                w.newLine();
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed writing error log {}: {}", file, e.getMessage());
            return false;
        }
    }
}
