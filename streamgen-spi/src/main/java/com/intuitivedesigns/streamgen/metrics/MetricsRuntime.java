/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.metrics;

/**
 * The vendor-agnostic contract for producer metrics.
 *
 * Every method defaults to a no-op so callers never need to null-check the runtime.
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = new MetricsRuntime() {};

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage, or null.
     */
    default Object registry() { return null; }

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    default void counter(String name) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
