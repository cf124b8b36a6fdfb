/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.output;

import com.intuitivedesigns.streamgen.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Strategy for deriving the Kafka message key of a record. A null key lets the client's
 * default partitioner spread records.
 */
@FunctionalInterface
public interface KeyStrategy {

    Logger LOG = LoggerFactory.getLogger(KeyStrategy.class);

    /**
     * @param record the generated record
     * @return the message key, or null for no key
     */
    String keyFor(Map<String, Object> record);

    // --- FACTORY METHODS ---

    static KeyStrategy none() {
        return record -> null;
    }

    /**
     * The string value of one field. A record without the field gets no key.
     */
    static KeyStrategy field(String fieldName) {
        return record -> {
            if (!record.containsKey(fieldName)) {
                LOG.warn("Key field '{}' not found in record", fieldName);
                return null;
            }
            return String.valueOf(record.get(fieldName));
        };
    }

    /**
     * Values of several fields joined with {@code _}. A record missing any of them gets no key.
     */
    static KeyStrategy composite(List<String> fieldNames) {
        final List<String> names = List.copyOf(fieldNames);
        return record -> {
            StringJoiner key = new StringJoiner("_");
            for (String name : names) {
                if (!record.containsKey(name)) {
                    LOG.warn("Composite key field '{}' not found in record", name);
                    return null;
                }
                key.add(String.valueOf(record.get(name)));
            }
            return key.toString();
        };
    }

    static KeyStrategy random() {
        return record -> UUID.randomUUID().toString();
    }

    /**
     * Current epoch milliseconds.
     */
    static KeyStrategy timestamp(Clock clock) {
        return record -> Long.toString(clock.millis());
    }

    /**
     * Build the strategy named in the broker configuration.
     *
     * @param name     field, composite, random, timestamp or none; null means field
     * @param keyField field name, or comma-separated names for composite; field and composite
     *                 without it produce no key
     * @throws ConfigurationException for an unknown strategy name
     */
    static KeyStrategy fromConfig(String name, String keyField, Clock clock) {
        final String id = (name == null || name.isBlank()) ? "field" : name.trim().toLowerCase(Locale.ROOT);
        final boolean hasField = keyField != null && !keyField.isBlank();
        switch (id) {
            case "none":
                return none();
            case "random":
                return random();
            case "timestamp":
                return timestamp(clock);
            case "field":
                return hasField ? field(keyField.trim()) : none();
            case "composite": {
                if (!hasField) return none();
                List<String> names = new ArrayList<>();
                for (String part : keyField.split(",")) {
                    if (!part.isBlank()) names.add(part.trim());
                }
                return composite(names);
            }
            default:
                throw new ConfigurationException("Unknown key_strategy '" + name + "'. Valid: field, composite, random, timestamp, none");
        }
    }
}
