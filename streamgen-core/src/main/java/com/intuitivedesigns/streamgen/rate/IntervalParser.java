/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.rate;

import com.intuitivedesigns.streamgen.config.ConfigurationException;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval shorthand: a non-negative decimal number followed by {@code ms}, {@code s},
 * {@code m} or {@code h}, e.g. {@code 500ms}, {@code 1.5s}, {@code 1m}, {@code 2h}.
 */
public final class IntervalParser {

    private static final Pattern FORMAT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)");

    private IntervalParser() {}

    /**
     * @throws ConfigurationException if the text does not match the shorthand format
     */
    public static Duration parse(String interval) {
        if (interval == null) {
            throw new ConfigurationException("Invalid interval format: null");
        }
        Matcher m = FORMAT.matcher(interval.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new ConfigurationException("Invalid interval format: " + interval);
        }
        double amount = Double.parseDouble(m.group(1));
        double nanosPerUnit = switch (m.group(2)) {
            case "ms" -> 1_000_000d;
            case "s" -> 1_000_000_000d;
            case "m" -> 60_000_000_000d;
            case "h" -> 3_600_000_000_000d;
            default -> throw new ConfigurationException("Invalid interval format: " + interval);
        };
        return Duration.ofNanos(Math.round(amount * nanosPerUnit));
    }
}
