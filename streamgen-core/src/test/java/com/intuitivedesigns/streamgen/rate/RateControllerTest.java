/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.rate;

import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.RateSetting;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class RateControllerTest {

    @Test
    void testRateSpacesWaitsEvenly() {
        List<Long> sleeps = new ArrayList<>();
        RateController rc = new RateController(10, null, sleeps::add);

        for (int i = 0; i < 5; i++) {
            assertTrue(rc.waitForNext());
        }

        assertEquals(5, sleeps.size());
        sleeps.forEach(n -> assertEquals(TimeUnit.MILLISECONDS.toNanos(100), n));
    }

    @Test
    void testIntervalDelay() {
        List<Long> sleeps = new ArrayList<>();
        RateController rc = new RateController(null, "250ms", sleeps::add);

        rc.waitForNext();

        assertEquals(List.of(TimeUnit.MILLISECONDS.toNanos(250)), sleeps);
        assertEquals(4.0d, rc.configuredRate(), 1e-9);
    }

    @Test
    void testUnpacedStillYields() {
        List<Long> sleeps = new ArrayList<>();
        RateController rc = new RateController(0, null, sleeps::add);

        rc.waitForNext();

        assertEquals(List.of(RateController.IDLE_DELAY_NANOS), sleeps);
        assertEquals(0d, rc.configuredRate());
    }

    @Test
    void testRealTimePacing() {
        RateController rc = new RateController(10, null);

        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            assertTrue(rc.waitForNext());
        }
        double seconds = (System.nanoTime() - start) / 1e9;

        assertTrue(seconds >= 0.4 && seconds < 1.5, "elapsed " + seconds);
    }

    @Test
    void testSetRateClearsInterval() {
        RateController rc = new RateController(null, "5s");

        rc.setRate(20);
        assertEquals(new RateSetting(20, null), rc.currentSetting());

        rc.setInterval("1m");
        assertEquals(new RateSetting(null, "1m"), rc.currentSetting());
    }

    @Test
    void testBadIntervalLeavesSettingUntouched() {
        RateController rc = new RateController(5, null);

        assertThrows(ConfigurationException.class, () -> rc.setInterval("soon"));
        assertThrows(IllegalArgumentException.class, () -> rc.setRate(-3));
        assertEquals(RateSetting.ofRate(5), rc.currentSetting());
    }

    @Test
    void testConflictingConstructorArgs() {
        assertThrows(ConfigurationException.class, () -> new RateController(5, "1s"));
        assertThrows(ConfigurationException.class, () -> new RateController(null, "fast"));
    }

    @Test
    void testStopIsTerminal() {
        RateController rc = new RateController(1000, null, n -> {});
        rc.stop();

        assertFalse(rc.waitForNext());
        assertFalse(rc.waitForNext());
        assertTrue(rc.isStopped());
    }

    @Test
    void testStopWakesPausedWaiter() throws Exception {
        RateController rc = new RateController(1000, null);
        rc.pause();

        CountDownLatch entered = new CountDownLatch(1);
        AtomicBoolean result = new AtomicBoolean(true);
        Thread waiter = new Thread(() -> {
            entered.countDown();
            result.set(rc.waitForNext());
        });
        waiter.start();
        assertTrue(entered.await(1, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertTrue(waiter.isAlive());

        rc.stop();
        waiter.join(2_000);

        assertFalse(waiter.isAlive());
        assertFalse(result.get());
    }

    @Test
    void testResumeReleasesPausedWaiter() throws Exception {
        RateController rc = new RateController(1000, null);
        rc.pause();
        assertTrue(rc.isPaused());

        AtomicBoolean result = new AtomicBoolean(false);
        Thread waiter = new Thread(() -> result.set(rc.waitForNext()));
        waiter.start();
        Thread.sleep(100);

        rc.resume();
        waiter.join(2_000);

        assertFalse(waiter.isAlive());
        assertTrue(result.get());
    }

    @Test
    void testStopCutsLongDelayShort() throws Exception {
        RateController rc = new RateController(null, "1h");

        AtomicBoolean result = new AtomicBoolean(true);
        Thread waiter = new Thread(() -> result.set(rc.waitForNext()));
        waiter.start();
        Thread.sleep(100);

        rc.stop();
        waiter.join(2_000);

        assertFalse(waiter.isAlive());
        assertFalse(result.get());
    }

    @Test
    void testBackoffObservesStop() {
        RateController rc = new RateController(1, null);
        rc.stop();

        assertFalse(rc.sleepUnlessStopped(Duration.ofSeconds(30)));
    }
}
