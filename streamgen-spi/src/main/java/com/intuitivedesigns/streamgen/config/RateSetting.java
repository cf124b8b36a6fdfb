/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

/**
 * Rate control setting of a producer: a target rate in messages per second or a fixed
 * interval such as {@code 500ms}, {@code 5s}, {@code 1m}, {@code 2h}. At most one is set.
 *
 * @param rate     messages per second, or null
 * @param interval interval shorthand, or null
 */
public record RateSetting(Integer rate, String interval) {

    private static final RateSetting NONE = new RateSetting(null, null);

    public RateSetting {
        if (rate != null && interval != null) {
            throw new ConfigurationException("rate and interval are mutually exclusive (rate=" + rate + ", interval=" + interval + ")");
        }
        if (rate != null && rate < 0) {
            throw new ConfigurationException("rate must be positive: " + rate);
        }
    }

    public static RateSetting none() {
        return NONE;
    }

    public static RateSetting ofRate(int rate) {
        return new RateSetting(rate, null);
    }

    public static RateSetting ofInterval(String interval) {
        return new RateSetting(null, interval);
    }
}
