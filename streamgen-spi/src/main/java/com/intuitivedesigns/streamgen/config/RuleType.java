/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.util.Locale;

/**
 * Generation strategy assigned to a field.
 */
public enum RuleType {
    RANDOM_RANGE,
    RANDOM_FROM_LIST,
    RANDOM_FROM_DICTIONARY,
    NOW,
    CONSTANT;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RuleType fromId(String raw) {
        return EnumIds.parse(RuleType.class, raw, "rule");
    }
}
