/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.rate;

import com.intuitivedesigns.streamgen.config.RateSetting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pausable, stoppable timing gate that paces an emission loop.
 *
 * <p>Exactly one of rate (messages per second) or interval is active; setting one clears the
 * other. With neither (or a rate of 0) the gate still waits 1 ms per
 * cycle so the loop never spins.</p>
 *
 * <p>Configuration changes made while a caller is inside {@link #waitForNext()} apply from the
 * next cycle. {@link #stop()} is terminal and wakes every waiter, including one that is paused.
 * When no {@link ThreadSleep} is supplied the per-cycle delay is itself a condition wait, so a
 * stop also cuts short a delay already in progress.</p>
 */
public class RateController {

    private static final Logger log = LoggerFactory.getLogger(RateController.class);

    static final long IDLE_DELAY_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    // Injected sleeper, null means condition-based waits that observe stop()
    private final ThreadSleep sleeper;

    // Guarded by lock
    private Integer rate;
    private String interval;
    private long intervalNanos;
    private boolean paused;
    private boolean stopped;

    public RateController(Integer rate, String interval) {
        this(rate, interval, null);
    }

    /**
     * @param sleeper performs the per-cycle delay; null to use an internal wait that {@link #stop()} interrupts
     * @throws com.intuitivedesigns.streamgen.config.ConfigurationException if both are set or the interval is malformed
     */
    public RateController(Integer rate, String interval, ThreadSleep sleeper) {
        RateSetting setting = new RateSetting(rate, interval);
        this.sleeper = sleeper;
        this.rate = setting.rate();
        if (setting.interval() != null) {
            this.intervalNanos = IntervalParser.parse(setting.interval()).toNanos();
            this.interval = setting.interval();
        }
    }

    public static RateController from(RateSetting setting) {
        return new RateController(setting.rate(), setting.interval());
    }

    /**
     * Wait until the next message is due.
     *
     * @return false if the controller was stopped (before or during the wait), true otherwise
     */
    public boolean waitForNext() {
        final long delayNanos;
        lock.lock();
        try {
            if (stopped) return false;
            while (paused && !stopped) {
                stateChanged.await();
            }
            if (stopped) return false;
            delayNanos = currentDelayNanos();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
        return delay(delayNanos);
    }

    /**
     * Waits for the given period unless stopped first. Used by callers for error backoff.
     *
     * @return false if stopped, true if the full period elapsed
     */
    public boolean sleepUnlessStopped(Duration period) {
        return delay(period.toNanos());
    }

    public void pause() {
        lock.lock();
        try {
            paused = true;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminal: every current and future {@link #waitForNext()} returns false.
     */
    public void stop() {
        lock.lock();
        try {
            stopped = true;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Set the target rate. A non-null rate clears the interval.
     *
     * @throws IllegalArgumentException if the rate is negative
     */
    public void setRate(Integer newRate) {
        if (newRate != null && newRate < 0) {
            throw new IllegalArgumentException("rate must be positive: " + newRate);
        }
        lock.lock();
        try {
            this.rate = newRate;
            if (newRate != null) {
                this.interval = null;
                this.intervalNanos = 0L;
            }
        } finally {
            lock.unlock();
        }
        log.debug("Rate set to {} msg/s", newRate);
    }

    /**
     * Set the interval. A non-null interval clears the rate.
     *
     * @throws com.intuitivedesigns.streamgen.config.ConfigurationException if the interval is malformed
     */
    public void setInterval(String newInterval) {
        // Parse outside the lock so a bad value leaves the current setting untouched
        long parsed = (newInterval != null) ? IntervalParser.parse(newInterval).toNanos() : 0L;
        lock.lock();
        try {
            this.interval = newInterval;
            if (newInterval != null) {
                this.intervalNanos = parsed;
                this.rate = null;
            }
        } finally {
            lock.unlock();
        }
        log.debug("Interval set to {}", newInterval);
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    public boolean isStopped() {
        lock.lock();
        try {
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    public RateSetting currentSetting() {
        lock.lock();
        try {
            return new RateSetting(rate, interval);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return messages per second implied by the configuration (not measured), 0 when unpaced
     */
    public double configuredRate() {
        lock.lock();
        try {
            if (rate != null && rate > 0) return rate;
            if (interval != null && intervalNanos > 0) return 1_000_000_000d / intervalNanos;
            return 0d;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private long currentDelayNanos() {
        if (rate != null && rate > 0) {
            return 1_000_000_000L / rate;
        }
        if (interval != null && intervalNanos > 0) {
            return intervalNanos;
        }
        return IDLE_DELAY_NANOS;
    }

    private boolean delay(long nanos) {
        try {
            if (sleeper != null) {
                if (nanos > 0) sleeper.waitForNanos(nanos);
                return true;
            }
            return awaitUnlessStopped(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean awaitUnlessStopped(long nanos) throws InterruptedException {
        lock.lock();
        try {
            long remaining = nanos;
            while (!stopped && remaining > 0) {
                // Pause/resume and config signals also wake us; keep waiting out the remainder
                remaining = stateChanged.awaitNanos(remaining);
            }
            return !stopped;
        } finally {
            lock.unlock();
        }
    }
}
