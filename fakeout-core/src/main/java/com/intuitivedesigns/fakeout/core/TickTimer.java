/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import java.time.Clock;
import java.time.Instant;

/**
 * Source of time and waits for every scheduled context.
 */
public interface TickTimer {

    Clock clock();

    default Instant now() {
        return clock().instant();
    }

    /**
     * Blocks until {@code deadline} or until {@code stop} fires, whichever comes first.
     *
     * @return true if the deadline was reached, false if stopped
     */
    boolean awaitUntil(Instant deadline, StopSignal stop) throws InterruptedException;
}
