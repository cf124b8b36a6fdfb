/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.rate;

import com.intuitivedesigns.streamgen.config.RateSetting;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rate controller that also keeps timestamped samples of the measured throughput over a
 * trailing 60 second window. Samples are for monitoring only; they do not alter pacing.
 */
public class AdaptiveRateController extends RateController {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final Clock clock;
    private final Deque<Sample> samples = new ArrayDeque<>();

    public AdaptiveRateController(Integer rate, String interval) {
        this(rate, interval, null, Clock.systemUTC());
    }

    public AdaptiveRateController(Integer rate, String interval, ThreadSleep sleeper, Clock clock) {
        super(rate, interval, sleeper);
        this.clock = clock;
    }

    public static AdaptiveRateController from(RateSetting setting) {
        return new AdaptiveRateController(setting.rate(), setting.interval());
    }

    /**
     * Record one measured throughput sample (messages per second) and evict samples older than the window.
     */
    public synchronized void recordActualRate(double actualRate) {
        Instant now = clock.instant();
        samples.addLast(new Sample(now, actualRate));
        Instant cutoff = now.minus(WINDOW);
        while (!samples.isEmpty() && !samples.peekFirst().at().isAfter(cutoff)) {
            samples.removeFirst();
        }
    }

    /**
     * @return mean of the retained samples, 0 if there are none
     */
    public synchronized double averageActualRate() {
        if (samples.isEmpty()) return 0d;
        double sum = 0d;
        for (Sample s : samples) {
            sum += s.rate();
        }
        return sum / samples.size();
    }

    synchronized int sampleCount() {
        return samples.size();
    }

    private record Sample(Instant at, double rate) {}
}
