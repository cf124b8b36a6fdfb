/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleSinkTest {

    @Test
    void testOneJsonLinePerRecord() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleSink sink = new ConsoleSink(new PrintStream(buffer, true, StandardCharsets.UTF_8), new ObjectMapper());

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", 7);
        record.put("name", "alpha");

        assertTrue(sink.send(record));
        assertTrue(sink.send(Map.of("id", 8)));
        assertEquals(0, sink.flush());

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(2, lines.length);
        assertEquals("{\"id\":7,\"name\":\"alpha\"}", lines[0]);
        assertEquals("console", sink.id());
    }
}
