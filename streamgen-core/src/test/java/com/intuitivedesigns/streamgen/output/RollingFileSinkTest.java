/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.FieldSpec;
import com.intuitivedesigns.streamgen.config.FieldType;
import com.intuitivedesigns.streamgen.config.FileOutputConfig;
import com.intuitivedesigns.streamgen.config.OutputKind;
import com.intuitivedesigns.streamgen.config.ProducerSpec;
import com.intuitivedesigns.streamgen.config.RollingPeriod;
import com.intuitivedesigns.streamgen.testing.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RollingFileSinkTest {

    @TempDir
    Path dir;

    @Test
    void testAppendsJsonLines() throws Exception {
        Path file = dir.resolve("nested").resolve("out.json");
        RollingFileSink sink = new RollingFileSink(file, RollingPeriod.DAILY);

        assertTrue(sink.send(Map.of("id", 1)));
        assertTrue(sink.send(Map.of("id", 2)));
        sink.close();

        assertEquals(List.of("{\"id\":1}", "{\"id\":2}"), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    void testReopenAfterCloseAppends() throws Exception {
        Path file = dir.resolve("out.json");
        RollingFileSink sink = new RollingFileSink(file, RollingPeriod.DAILY);

        sink.send(Map.of("id", 1));
        sink.close();
        sink.send(Map.of("id", 2));
        sink.close();

        assertEquals(2, Files.readAllLines(file).size());
    }

    @Test
    void testRotatesWhenPeriodChanges() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-14T09:59:00Z"));
        Path file = dir.resolve("orders.json");
        RollingFileSink sink = new RollingFileSink(file, RollingPeriod.HOURLY, new ObjectMapper(), clock);

        sink.send(Map.of("id", 1));
        sink.send(Map.of("id", 2));
        clock.advance(Duration.ofMinutes(2));
        sink.send(Map.of("id", 3));
        sink.close();

        Path rotated = dir.resolve("orders_20250314_09.json");
        assertEquals(rotated, sink.rotatedPath("20250314_09"));
        assertEquals(2, Files.readAllLines(rotated).size());
        assertEquals(List.of("{\"id\":3}"), Files.readAllLines(file));
    }

    @Test
    void testPluginPathResolution() {
        FileOutputConfig fileOutput = new FileOutputConfig(dir, RollingPeriod.DAILY);
        List<FieldSpec> fields = List.of(FieldSpec.constant("a", FieldType.INT, 1));

        ProducerSpec byName = new ProducerSpec("orders", OutputKind.FILE, fields, null, null, null);
        ProducerSpec explicit = new ProducerSpec("orders", OutputKind.FILE, fields, null, null, " /tmp/x.json ");

        assertEquals(dir.resolve("orders.json"), FileSinkPlugin.resolvePath(byName, fileOutput));
        assertEquals(Path.of("/tmp/x.json"), FileSinkPlugin.resolvePath(explicit, fileOutput));

        RollingFileSink sink = (RollingFileSink) new FileSinkPlugin()
                .create(AppConfig.forProducer(byName).withFileOutput(fileOutput), null);
        assertEquals("file:" + dir.resolve("orders.json"), sink.id());
    }
}
