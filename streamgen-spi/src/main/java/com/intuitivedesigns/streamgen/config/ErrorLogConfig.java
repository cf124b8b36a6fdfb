/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for the JSON error log of dropped records and producer errors.
 *
 * @param enabled    whether errors are written to disk at all
 * @param directory  target directory
 * @param rolling    rotation period
 * @param maxAgeDays age after which rotated files are deleted by cleanup
 */
public record ErrorLogConfig(boolean enabled, Path directory, RollingPeriod rolling, int maxAgeDays) {

    public ErrorLogConfig {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(rolling, "rolling");
        if (maxAgeDays < 1) {
            throw new ConfigurationException("error_log.max_age_days must be >= 1: " + maxAgeDays);
        }
    }

    public static ErrorLogConfig defaults() {
        return new ErrorLogConfig(true, Path.of("./logs"), RollingPeriod.DAILY, 7);
    }

    public static ErrorLogConfig disabled() {
        return new ErrorLogConfig(false, Path.of("./logs"), RollingPeriod.DAILY, 7);
    }
}
