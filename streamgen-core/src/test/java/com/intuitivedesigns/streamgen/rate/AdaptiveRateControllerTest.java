/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.rate;

import com.intuitivedesigns.streamgen.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveRateControllerTest {

    @Test
    void testAverageOfEmptyWindowIsZero() {
        AdaptiveRateController rc = new AdaptiveRateController(5, null);
        assertEquals(0d, rc.averageActualRate());
    }

    @Test
    void testSamplesOutsideWindowAreEvicted() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        AdaptiveRateController rc = new AdaptiveRateController(5, null, n -> {}, clock);

        rc.recordActualRate(10d);
        clock.advance(Duration.ofSeconds(30));
        rc.recordActualRate(20d);

        assertEquals(2, rc.sampleCount());
        assertEquals(15d, rc.averageActualRate(), 1e-9);

        // first sample is now exactly 60s old
        clock.advance(Duration.ofSeconds(30));
        rc.recordActualRate(30d);

        assertEquals(2, rc.sampleCount());
        assertEquals(25d, rc.averageActualRate(), 1e-9);
    }

    @Test
    void testSamplesDoNotChangePacing() {
        MutableClock clock = new MutableClock(Instant.EPOCH);
        AdaptiveRateController rc = new AdaptiveRateController(4, null, n -> {}, clock);

        rc.recordActualRate(1_000d);

        assertEquals(4d, rc.configuredRate());
    }
}
