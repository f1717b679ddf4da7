/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Virtual time for tests. Time only moves in {@link #advanceTo}, which steps from one
 * sleeper deadline to the next and waits until every context is parked again, so
 * minutes of schedule run in milliseconds and always in the same order.
 */
final class VirtualTickTimer implements TickTimer {

    private static final long QUIESCE_TIMEOUT_MS = 10_000L;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<Thread, Instant> sleepers = new HashMap<>();
    private final Set<StopSignal> watched = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Clock clock;

    private Instant now;

    VirtualTickTimer(Instant start) {
        this.now = start;
        this.clock = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return VirtualTickTimer.this.now();
            }
        };
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public Instant now() {
        lock.lock();
        try {
            return now;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean awaitUntil(Instant deadline, StopSignal stop) throws InterruptedException {
        lock.lock();
        try {
            if (watched.add(stop)) {
                stop.onFire(this::wakeAll);
            }
            final Thread me = Thread.currentThread();
            sleepers.put(me, deadline);
            changed.signalAll();
            try {
                while (true) {
                    if (stop.isFired()) return false;
                    if (!now.isBefore(deadline)) return true;
                    changed.await();
                }
            } finally {
                sleepers.remove(me);
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves time to {@code target}, letting every context run each deadline it passes.
     *
     * @param participants contexts expected to be parked between steps
     */
    void advanceTo(Instant target, int participants) throws InterruptedException {
        lock.lock();
        try {
            awaitQuiescent(participants);
            while (true) {
                Instant earliest = null;
                for (Instant d : sleepers.values()) {
                    if (earliest == null || d.isBefore(earliest)) earliest = d;
                }
                if (earliest == null || earliest.isAfter(target)) {
                    now = target;
                    changed.signalAll();
                    awaitQuiescent(participants);
                    return;
                }
                now = earliest;
                changed.signalAll();
                awaitQuiescent(participants);
            }
        } finally {
            lock.unlock();
        }
    }

    void advance(Duration step, int participants) throws InterruptedException {
        advanceTo(now().plus(step), participants);
    }

    /** Waits until {@code participants} contexts are parked on future deadlines. */
    void awaitQuiescent(int participants) throws InterruptedException {
        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(QUIESCE_TIMEOUT_MS);
            while (!quiescent(participants)) {
                if (remaining <= 0) {
                    throw new IllegalStateException("Contexts did not park: expected " + participants
                            + ", parked " + sleepers.size() + " at " + now);
                }
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean quiescent(int participants) {
        if (sleepers.size() < participants) return false;
        for (Instant d : sleepers.values()) {
            if (!d.isAfter(now)) return false;
        }
        return true;
    }

    private void wakeAll() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
