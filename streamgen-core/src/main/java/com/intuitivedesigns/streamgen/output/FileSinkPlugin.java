/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.output;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.FileOutputConfig;
import com.intuitivedesigns.streamgen.config.ProducerSpec;
import com.intuitivedesigns.streamgen.core.OutputSink;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgen.spi.SinkPlugin;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Rolling newline-delimited JSON file. Without an explicit {@code file_path} the producer
 * writes to {@code <file_output.directory>/<producer name>.json}.
 * <p>
 * ID: FILE
 */
public final class FileSinkPlugin implements SinkPlugin {

    public static final String ID = "FILE";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink create(AppConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        FileOutputConfig fileOutput = config.fileOutput();
        return new RollingFileSink(resolvePath(config.producer(), fileOutput), fileOutput.rolling());
    }

    static Path resolvePath(ProducerSpec producer, FileOutputConfig fileOutput) {
        String explicit = producer.filePath();
        if (explicit != null && !explicit.isBlank()) {
            return Path.of(explicit.trim());
        }
        return fileOutput.directory().resolve(producer.name() + ".json");
    }
}
