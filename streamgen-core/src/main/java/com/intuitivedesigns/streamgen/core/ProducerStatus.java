/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

import java.time.Instant;

/**
 * Snapshot of a producer for the control plane.
 *
 * @param name            producer name
 * @param running         whether the emission loop is alive
 * @param status          "running", "paused" or "stopped"
 * @param output          output kind id
 * @param rate            configured rate, null when pacing by interval
 * @param interval        configured interval, null when pacing by rate
 * @param uptimeSeconds   seconds since the current run started, 0 if never started
 * @param messagesSent    records delivered in the current run
 * @param currentRate     throughput implied by the configuration
 * @param measuredRate    trailing 60 s average of measured throughput
 * @param paused          whether pacing is paused
 * @param errorCount      errors since the last restart
 * @param lastError       most recent error message, may predate the last restart
 * @param lastMessageTime time of the last delivered record, null if none
 */
public record ProducerStatus(
        String name,
        boolean running,
        String status,
        String output,
        Integer rate,
        String interval,
        long uptimeSeconds,
        long messagesSent,
        double currentRate,
        double measuredRate,
        boolean paused,
        long errorCount,
        String lastError,
        Instant lastMessageTime
) {}
