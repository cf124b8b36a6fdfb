/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

/**
 * Point-in-time error counters for one producer.
 *
 * @param count     errors since the last reset
 * @param lastError most recent error message, null if none was ever recorded
 */
public record ErrorStats(long count, String lastError) {

    public static final ErrorStats EMPTY = new ErrorStats(0L, null);
}
