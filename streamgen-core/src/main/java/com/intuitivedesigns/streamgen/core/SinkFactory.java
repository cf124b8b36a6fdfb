/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgen.spi.ServicePluginRegistry;
import com.intuitivedesigns.streamgen.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Resolves the producer's output kind to a {@link SinkPlugin} discovered on the classpath.
 */
public final class SinkFactory {

    private static final Logger log = LoggerFactory.getLogger(SinkFactory.class);

    private static final ServicePluginRegistry<SinkPlugin> SINKS = new ServicePluginRegistry<>(SinkPlugin.class);

    private SinkFactory() {}

    /**
     * @throws ConfigurationException if no plugin serves the output kind, or the plugin rejects the configuration
     * @throws RuntimeException       wrapping any other creation failure, tagged with the plugin id
     */
    public static OutputSink create(AppConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = config.producer().output().name();
        final SinkPlugin plugin = SINKS.get(id).orElseThrow(() -> new ConfigurationException(
                "No sink plugin for output '" + config.producer().output().id() + "'. Available: " + SINKS.availableIds()));
        return createSafe(plugin, config, metrics);
    }

    public static Set<String> availableIds() {
        return SINKS.availableIds();
    }

    public static void logAvailablePlugins() {
        log.info("Sink plugins: {}", SINKS.availableIds());
    }

    private static OutputSink createSafe(SinkPlugin plugin, AppConfig config, MetricsRuntime metrics) {
        try {
            return plugin.create(config, metrics);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed creating Sink [" + plugin.id() + "]", e);
        }
    }
}
