/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.FieldSpec;
import com.intuitivedesigns.streamgen.config.FieldType;
import com.intuitivedesigns.streamgen.config.OutputKind;
import com.intuitivedesigns.streamgen.config.ProducerSpec;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgen.output.ConsoleSink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SinkFactoryTest {

    @Test
    void testBuiltInPluginsAreDiscovered() {
        assertTrue(SinkFactory.availableIds().containsAll(List.of("CONSOLE", "FILE")));
    }

    @Test
    void testConsoleOutputResolves() {
        OutputSink sink = SinkFactory.create(config(OutputKind.CONSOLE), MetricsRuntime.NOOP);
        assertInstanceOf(ConsoleSink.class, sink);
    }

    @Test
    void testBrokerWithoutPluginOnClasspath() {
        // the broker plugin lives in the kafka module
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> SinkFactory.create(config(OutputKind.BROKER), MetricsRuntime.NOOP));
        assertTrue(e.getMessage().contains("broker"));
    }

    private static AppConfig config(OutputKind output) {
        return AppConfig.forProducer(new ProducerSpec("p", output,
                List.of(FieldSpec.constant("a", FieldType.INT, 1)), null, null, null));
    }
}
