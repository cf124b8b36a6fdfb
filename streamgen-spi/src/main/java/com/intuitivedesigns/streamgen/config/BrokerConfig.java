/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global message broker settings, required when a producer's output is {@link OutputKind#BROKER}.
 *
 * @param bootstrapServers broker bootstrap address list
 * @param defaultTopic     topic used when the producer names none
 * @param securityProtocol e.g. PLAINTEXT, SASL_PLAINTEXT, SASL_SSL
 * @param saslMechanism    e.g. PLAIN, SCRAM-SHA-256
 * @param saslUsername     SASL user
 * @param saslPassword     SASL secret (masked in {@link #toString()})
 * @param keyField         field (or comma-separated fields) used by the key strategy
 * @param keyStrategy      field, composite, random, timestamp or none
 * @param properties       additional client properties passed through verbatim
 */
public record BrokerConfig(
        String bootstrapServers,
        String defaultTopic,
        String securityProtocol,
        String saslMechanism,
        String saslUsername,
        String saslPassword,
        String keyField,
        String keyStrategy,
        Map<String, String> properties
) {

    public static final String DEFAULT_TOPIC = "telemetry";
    public static final String DEFAULT_SECURITY_PROTOCOL = "PLAINTEXT";
    public static final String DEFAULT_KEY_STRATEGY = "field";

    public BrokerConfig {
        if (bootstrapServers == null || bootstrapServers.isBlank()) {
            throw new ConfigurationException("broker.bootstrap_servers is required");
        }
        defaultTopic = normalize(defaultTopic, DEFAULT_TOPIC);
        securityProtocol = normalize(securityProtocol, DEFAULT_SECURITY_PROTOCOL);
        keyStrategy = normalize(keyStrategy, DEFAULT_KEY_STRATEGY);
        properties = (properties == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static BrokerConfig of(String bootstrapServers, String defaultTopic) {
        return new BrokerConfig(bootstrapServers, defaultTopic, null, null, null, null, null, null, null);
    }

    @Override
    public String toString() {
        return "BrokerConfig{" +
                "bootstrapServers='" + bootstrapServers + '\'' +
                ", defaultTopic='" + defaultTopic + '\'' +
                ", securityProtocol='" + securityProtocol + '\'' +
                ", saslMechanism='" + saslMechanism + '\'' +
                ", saslUsername='" + saslUsername + '\'' +
                ", saslPassword=" + mask(saslPassword) +
                ", keyField='" + keyField + '\'' +
                ", keyStrategy='" + keyStrategy + '\'' +
                ", properties=" + properties.keySet() +
                '}';
    }

    private static String normalize(String s, String def) {
        return (s == null || s.isBlank()) ? def : s.trim();
    }

    private static String mask(String secret) {
        if (secret == null || secret.length() <= 4) return "****";
        return "****" + secret.substring(secret.length() - 4);
    }
}
