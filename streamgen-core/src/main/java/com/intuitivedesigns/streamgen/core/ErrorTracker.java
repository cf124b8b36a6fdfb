/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-producer error count and last error message.
 *
 * <p>{@link #reset(String)} zeroes the count but keeps the last message, so an operator can still
 * see what went wrong before a restart. Unknown names report {@link ErrorStats#EMPTY}.</p>
 */
public final class ErrorTracker {

    private final Map<String, ErrorStats> stats = new ConcurrentHashMap<>();

    public void increment(String name) {
        stats.merge(name, new ErrorStats(1L, null), (old, one) -> new ErrorStats(old.count() + 1, old.lastError()));
    }

    public void setLast(String name, String message) {
        stats.merge(name, new ErrorStats(0L, message), (old, upd) -> new ErrorStats(old.count(), message));
    }

    /**
     * Convenience for the common increment-then-setLast pair, applied atomically.
     */
    public void record(String name, String message) {
        stats.merge(name, new ErrorStats(1L, message), (old, upd) -> new ErrorStats(old.count() + 1, message));
    }

    public void reset(String name) {
        stats.computeIfPresent(name, (k, old) -> new ErrorStats(0L, old.lastError()));
    }

    public ErrorStats stats(String name) {
        return stats.getOrDefault(name, ErrorStats.EMPTY);
    }
}
