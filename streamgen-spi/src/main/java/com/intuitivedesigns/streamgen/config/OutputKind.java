/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.util.Locale;

/**
 * Delivery target of a producer. The constant name doubles as the sink plugin id.
 */
public enum OutputKind {
    CONSOLE,
    FILE,
    BROKER;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts {@code kafka} as a legacy alias for {@link #BROKER}.
     */
    public static OutputKind fromId(String raw) {
        if (raw != null && "kafka".equalsIgnoreCase(raw.trim())) {
            return BROKER;
        }
        return EnumIds.parse(OutputKind.class, raw, "output");
    }
}
