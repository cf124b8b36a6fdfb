/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.rate;

import java.util.concurrent.TimeUnit;

/**
 * Waits for a number of nanoseconds. The default implementation is {@code TimeUnit.sleep}.
 */
@FunctionalInterface
public interface ThreadSleep {

    ThreadSleep REAL_TIME = TimeUnit.NANOSECONDS::sleep;

    /**
     * Wait for the specified period.
     *
     * @param  nanos                nanoseconds to wait for
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void waitForNanos(long nanos) throws InterruptedException;
}
