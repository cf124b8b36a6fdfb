/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.plugins;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.BrokerConfig;
import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.FieldSpec;
import com.intuitivedesigns.streamgen.config.FieldType;
import com.intuitivedesigns.streamgen.config.OutputKind;
import com.intuitivedesigns.streamgen.config.ProducerSpec;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgen.spi.ServicePluginRegistry;
import com.intuitivedesigns.streamgen.spi.SinkPlugin;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KafkaSinkPluginTest {

    @Test
    void testRegisteredUnderBrokerId() {
        ServicePluginRegistry<SinkPlugin> registry = new ServicePluginRegistry<>(SinkPlugin.class);

        assertInstanceOf(KafkaSinkPlugin.class, registry.get("broker").orElseThrow());
    }

    @Test
    void testMissingBrokerSection() {
        AppConfig config = AppConfig.forProducer(producer(null));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new KafkaSinkPlugin().create(config, MetricsRuntime.NOOP));
        assertEquals("Broker configuration required for broker output", e.getMessage());
    }

    @Test
    void testTopicResolution() {
        BrokerConfig broker = BrokerConfig.of("localhost:9092", "fallback");

        assertEquals("orders", KafkaSinkPlugin.resolveTopic(producer(" orders "), broker));
        assertEquals("fallback", KafkaSinkPlugin.resolveTopic(producer(null), broker));
        assertEquals(BrokerConfig.DEFAULT_TOPIC, KafkaSinkPlugin.resolveTopic(producer(""), BrokerConfig.of("h:1", null)));
    }

    private static ProducerSpec producer(String topic) {
        return new ProducerSpec("p", OutputKind.BROKER, List.of(FieldSpec.constant("a", FieldType.INT, 1)), null, topic, null);
    }
}
