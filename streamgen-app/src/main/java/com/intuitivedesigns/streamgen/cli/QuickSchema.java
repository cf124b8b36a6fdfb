/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.cli;

import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.FieldSpec;
import com.intuitivedesigns.streamgen.config.FieldType;

import java.util.ArrayList;
import java.util.List;

/**
 * Inline schema of the form {@code name:type,name:type,...}.
 *
 * <p>Numeric fields draw from 1..100, strings from value1..value3, booleans from true/false.</p>
 */
public final class QuickSchema {

    private QuickSchema() {}

    /**
     * @throws ConfigurationException on a malformed entry or unknown type
     */
    public static List<FieldSpec> parse(String schema) {
        if (schema == null || schema.isBlank()) {
            throw new ConfigurationException("Schema must not be empty");
        }
        List<FieldSpec> fields = new ArrayList<>();
        for (String def : schema.split(",")) {
            int colon = def.indexOf(':');
            if (colon < 0) {
                throw new ConfigurationException("Invalid field definition: " + def.trim());
            }
            String name = def.substring(0, colon).trim();
            if (name.isEmpty()) {
                throw new ConfigurationException("Invalid field definition: " + def.trim());
            }
            fields.add(fieldFor(name, FieldType.fromId(def.substring(colon + 1).trim())));
        }
        return fields;
    }

    private static FieldSpec fieldFor(String name, FieldType type) {
        switch (type) {
            case INT:
            case LONG:
                return FieldSpec.range(name, type, 1L, 100L);
            case DOUBLE:
                return FieldSpec.range(name, type, 1.0d, 100.0d);
            case STRING:
                return FieldSpec.fromList(name, type, List.of("value1", "value2", "value3"));
            case BOOLEAN:
                return FieldSpec.fromList(name, type, List.of(true, false));
            default:
                throw new ConfigurationException("Unsupported field type: " + type.id());
        }
    }
}
