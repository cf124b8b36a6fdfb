/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

import java.util.Map;

/**
 * A pluggable destination for generated records.
 *
 * Examples:
 * - Console (one JSON line per record)
 * - Rolling file writer
 * - Message broker producer
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #send(Map)} reports failure by returning {@code false}; it does not throw.</li>
 * <li>The producer loop calls {@code send} from a single thread, strictly in generation order.</li>
 * <li>{@link #flush()} may be called between runs; the sink must remain usable afterwards.</li>
 * </ul>
 */
public interface OutputSink extends AutoCloseable {

    /**
     * Deliver one record.
     *
     * @param record ordered field name to value mapping
     * @return true if the record was accepted for delivery
     */
    boolean send(Map<String, Object> record);

    /**
     * Forces buffered records out to the target.
     *
     * @return number of records still undelivered when the flush gave up, 0 if none
     */
    default int flush() {
        return 0;
    }

    /**
     * Returns a unique identifier for this sink instance.
     * Useful for logging and metrics tagging (e.g., "file:/data/events.json").
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    /**
     * Release underlying resources. Flushes first.
     */
    @Override
    default void close() {
        flush();
    }
}
