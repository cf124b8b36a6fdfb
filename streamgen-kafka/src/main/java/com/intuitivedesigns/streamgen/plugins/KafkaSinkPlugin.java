/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.plugins;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.BrokerConfig;
import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.ProducerSpec;
import com.intuitivedesigns.streamgen.core.OutputSink;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgen.output.KafkaSink;
import com.intuitivedesigns.streamgen.spi.SinkPlugin;

import java.util.Objects;

/**
 * ID: BROKER
 */
public final class KafkaSinkPlugin implements SinkPlugin {

    public static final String ID = "BROKER";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink create(AppConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final BrokerConfig broker = config.broker();
        if (broker == null) {
            throw new ConfigurationException("Broker configuration required for broker output");
        }
        final ProducerSpec producer = config.producer();
        return KafkaSink.fromConfig(broker, resolveTopic(producer, broker), producer.name(), metrics);
    }

    static String resolveTopic(ProducerSpec producer, BrokerConfig broker) {
        final String topic = producer.topic();
        return (topic != null && !topic.isBlank()) ? topic.trim() : broker.defaultTopic();
    }
}
