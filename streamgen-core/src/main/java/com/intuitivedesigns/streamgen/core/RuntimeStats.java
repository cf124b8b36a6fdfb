/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for one producer run. Written by the emission loop, read by status queries.
 */
public final class RuntimeStats {

    private final Instant startTime;
    private final LongAdder messagesSent = new LongAdder();
    private final AtomicReference<Instant> lastMessageTime = new AtomicReference<>();

    public RuntimeStats(Instant startTime) {
        this.startTime = startTime;
    }

    public void recordSent(Instant at) {
        messagesSent.increment();
        lastMessageTime.set(at);
    }

    public Instant startTime() {
        return startTime;
    }

    public long messagesSent() {
        return messagesSent.sum();
    }

    /**
     * @return time of the last delivered record, null if none yet
     */
    public Instant lastMessageTime() {
        return lastMessageTime.get();
    }
}
