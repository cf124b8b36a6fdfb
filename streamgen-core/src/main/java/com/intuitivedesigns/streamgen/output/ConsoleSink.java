/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamgen.core.OutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Map;
import java.util.Objects;

/**
 * Prints one JSON line per record.
 */
public final class ConsoleSink implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(ConsoleSink.class);

    private final PrintStream out;
    private final ObjectMapper mapper;

    public ConsoleSink() {
        this(System.out, new ObjectMapper());
    }

    public ConsoleSink(PrintStream out, ObjectMapper mapper) {
        this.out = Objects.requireNonNull(out, "out");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public boolean send(Map<String, Object> record) {
        try {
            out.println(mapper.writeValueAsString(record));
            return !out.checkError();
        } catch (JsonProcessingException e) {
            log.warn("Console serialization failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public int flush() {
        out.flush();
        return 0;
    }

    @Override
    public String id() {
        return "console";
    }
}
