/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;

/**
 * Builds the sink for a producer. {@link SinkFactory#create} is the production implementation;
 * tests supply their own.
 */
@FunctionalInterface
public interface SinkProvider {

    OutputSink create(AppConfig config, MetricsRuntime metrics);
}
