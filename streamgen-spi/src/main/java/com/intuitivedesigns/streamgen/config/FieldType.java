/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.util.Locale;

/**
 * Value type of a generated field.
 */
public enum FieldType {
    INT,
    LONG,
    DOUBLE,
    STRING,
    BOOLEAN;

    public boolean isIntegral() {
        return this == INT || this == LONG;
    }

    public boolean isNumeric() {
        return isIntegral() || this == DOUBLE;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FieldType fromId(String raw) {
        return EnumIds.parse(FieldType.class, raw, "field type");
    }
}
