/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamgen.config.ErrorLogConfig;
import com.intuitivedesigns.streamgen.config.RollingPeriod;
import com.intuitivedesigns.streamgen.testing.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorLoggerTest {

    private static final Instant T0 = Instant.parse("2025-03-14T09:26:53Z");

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(T0);

    @Test
    void testErrorAndDroppedEntries() throws Exception {
        ErrorLogger logger = new ErrorLogger(new ErrorLogConfig(true, dir.resolve("logs"), RollingPeriod.DAILY, 7), mapper, clock);

        assertTrue(logger.logError("orders", "Output send failed", Map.of("attempt", 2)));
        assertTrue(logger.logDroppedData("orders", Map.of("id", 5), "sink refused"));

        Path file = dir.resolve("logs").resolve("errors_20250314.json");
        assertEquals(file, logger.currentFile());
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());

        JsonNode error = mapper.readTree(lines.get(0));
        assertEquals("orders", error.get("producer").asText());
        assertEquals("Output send failed", error.get("error").asText());
        assertEquals(2, error.get("details").get("attempt").asInt());
        assertEquals("2025-03-14T09:26:53", error.get("timestamp").asText());

        JsonNode dropped = mapper.readTree(lines.get(1));
        assertEquals("sink refused", dropped.get("reason").asText());
        assertEquals(5, dropped.get("data").get("id").asInt());
    }

    @Test
    void testHourlyFilesRoll() {
        ErrorLogger logger = new ErrorLogger(new ErrorLogConfig(true, dir, RollingPeriod.HOURLY, 7), mapper, clock);

        logger.logError("p", "a", null);
        clock.advance(Duration.ofHours(1));
        logger.logError("p", "b", null);

        assertTrue(Files.exists(dir.resolve("errors_20250314_09.json")));
        assertTrue(Files.exists(dir.resolve("errors_20250314_10.json")));
    }

    @Test
    void testDisabledWritesNothing() {
        ErrorLogger logger = new ErrorLogger(new ErrorLogConfig(false, dir.resolve("off"), RollingPeriod.DAILY, 7), mapper, clock);

        assertTrue(logger.logError("p", "ignored", Map.of()));
        assertFalse(logger.enabled());
        assertFalse(Files.exists(dir.resolve("off")));
    }

    @Test
    void testCleanupRemovesOnlyOldErrorLogs() throws Exception {
        Path old = Files.writeString(dir.resolve("errors_20250101.json"), "{}\n");
        Path fresh = Files.writeString(dir.resolve("errors_20250313.json"), "{}\n");
        Path other = Files.writeString(dir.resolve("orders.json"), "{}\n");
        Files.setLastModifiedTime(old, FileTime.from(T0.minus(Duration.ofDays(30))));
        Files.setLastModifiedTime(fresh, FileTime.from(T0.minus(Duration.ofDays(1))));
        Files.setLastModifiedTime(other, FileTime.from(T0.minus(Duration.ofDays(30))));

        ErrorLogger logger = new ErrorLogger(new ErrorLogConfig(true, dir, RollingPeriod.DAILY, 7), mapper, clock);

        assertEquals(1, logger.cleanupOldLogs());
        assertFalse(Files.exists(old));
        assertTrue(Files.exists(fresh));
        assertTrue(Files.exists(other));
    }

    @Test
    void testCleanupOfMissingDirectory() {
        ErrorLogger logger = new ErrorLogger(new ErrorLogConfig(true, dir.resolve("absent"), RollingPeriod.DAILY, 7), mapper, clock);
        assertEquals(0, logger.cleanupOldLogs());
    }
}
