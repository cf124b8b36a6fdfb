/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRuntimeTest {

    @Test
    void testDisabledIsNoop() {
        MetricsRuntime metrics = MicrometerMetricsRuntime.createIfEnabled(false, "p");

        assertSame(MetricsRuntime.NOOP, metrics);
        assertFalse(metrics.enabled());
        assertNull(metrics.registry());
    }

    @Test
    void testCountersCarryProducerTag() {
        MicrometerMetricsRuntime metrics = (MicrometerMetricsRuntime) MicrometerMetricsRuntime.createIfEnabled(true, "orders");
        metrics.counter("streamgen_records_sent_total");
        metrics.counter("streamgen_records_sent_total");

        MeterRegistry registry = metrics.registry();
        assertEquals(2.0, registry.get("streamgen_records_sent_total").tag("producer", "orders").counter().count());
        metrics.close();
    }

    @Test
    void testGaugeKeepsLatestValue() {
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime(Map.of());

        metrics.gauge("streamgen_measured_rate", 12.5);
        metrics.gauge("streamgen_measured_rate", 48.25);

        Gauge gauge = metrics.registry().get("streamgen_measured_rate").gauge();
        assertEquals(48.25, gauge.value());
        assertEquals(1, metrics.registry().find("streamgen_measured_rate").gauges().size());
        metrics.close();
    }
}
