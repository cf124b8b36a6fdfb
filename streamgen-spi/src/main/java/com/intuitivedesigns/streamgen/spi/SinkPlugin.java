/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.spi;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.core.OutputSink;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;

/**
 * SPI Definition for record sinks, discovered with {@link java.util.ServiceLoader}.
 * The plugin id matches an {@link com.intuitivedesigns.streamgen.config.OutputKind} name.
 */
public interface SinkPlugin extends ServicePlugin {

    @Override
    String id(); // "CONSOLE", "FILE", "BROKER"

    /**
     * Build the sink for the configured producer.
     *
     * @throws com.intuitivedesigns.streamgen.config.ConfigurationException if required settings are absent
     * @throws Exception if the underlying client cannot be created
     */
    OutputSink create(AppConfig config, MetricsRuntime metrics) throws Exception;
}
