/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-backed runtime holding producer counters and gauges in memory.
 *
 * Every meter carries the common tags given at construction (the producer name in practice).
 * Gauges are set by value; each name is bound once to a holder that the registry polls.
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();

    // Double bits, keyed by gauge name
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime(Map<String, String> commonTags) {
        registry.add(new SimpleMeterRegistry());
        commonTags.forEach((k, v) -> registry.config().commonTags(Tags.of(k, v)));
        log.info("Micrometer metrics enabled (tags={})", commonTags);
    }

    /**
     * @return a Micrometer runtime when {@code enabled}, otherwise {@link MetricsRuntime#NOOP}
     */
    public static MetricsRuntime createIfEnabled(boolean enabled, String producerName) {
        if (!enabled) {
            log.info("Metrics disabled");
            return NOOP;
        }
        return new MicrometerMetricsRuntime(Map.of("producer", producerName));
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void gauge(String name, double value) {
        gauges.computeIfAbsent(name, this::bindGauge).set(Double.doubleToLongBits(value));
    }

    private AtomicLong bindGauge(String name) {
        final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0d));
        Gauge.builder(name, bits, b -> Double.longBitsToDouble(b.get())).register(registry);
        return bits;
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics runtime closed");
    }
}
