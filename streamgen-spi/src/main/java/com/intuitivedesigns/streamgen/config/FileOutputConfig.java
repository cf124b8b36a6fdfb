/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Global settings for file output.
 *
 * @param directory default directory for producers without an explicit file path
 * @param rolling   rotation period
 */
public record FileOutputConfig(Path directory, RollingPeriod rolling) {

    public FileOutputConfig {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(rolling, "rolling");
    }

    public static FileOutputConfig defaults() {
        return new FileOutputConfig(Path.of("./data"), RollingPeriod.HOURLY);
    }
}
