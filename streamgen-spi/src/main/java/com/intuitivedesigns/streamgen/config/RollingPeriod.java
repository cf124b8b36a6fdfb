/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * File rotation period for rolling file output and error logs.
 */
public enum RollingPeriod {
    HOURLY(DateTimeFormatter.ofPattern("yyyyMMdd_HH")),
    DAILY(DateTimeFormatter.ofPattern("yyyyMMdd"));

    private final DateTimeFormatter format;

    RollingPeriod(DateTimeFormatter format) {
        this.format = format;
    }

    /**
     * @return the period key for the given local time, e.g. {@code 20250314_09} for hourly
     */
    public String periodKey(LocalDateTime time) {
        return format.format(time);
    }

    public static RollingPeriod fromId(String raw) {
        return EnumIds.parse(RollingPeriod.class, raw, "rolling period");
    }
}
