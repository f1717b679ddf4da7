/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public final class SystemTickTimer implements TickTimer {

    private final Clock clock;

    public SystemTickTimer() {
        this(Clock.systemUTC());
    }

    public SystemTickTimer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public boolean awaitUntil(Instant deadline, StopSignal stop) throws InterruptedException {
        while (true) {
            if (stop.isFired()) return false;
            final Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isZero() || remaining.isNegative()) return true;
            if (stop.await(remaining)) return false;
            // timed wait may return slightly early; loop re-checks the clock
        }
    }
}
