/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.output;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.core.OutputSink;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgen.spi.SinkPlugin;

/**
 * ID: CONSOLE
 */
public final class ConsoleSinkPlugin implements SinkPlugin {

    public static final String ID = "CONSOLE";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink create(AppConfig config, MetricsRuntime metrics) {
        return new ConsoleSink();
    }
}
