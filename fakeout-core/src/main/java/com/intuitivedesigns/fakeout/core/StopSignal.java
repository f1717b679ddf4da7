/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot broadcast observed by every context of a coordinator.
 */
public final class StopSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return true on the first call only
     */
    public boolean fire() {
        if (!fired.compareAndSet(false, true)) return false;
        latch.countDown();
        for (Runnable l : listeners) {
            l.run();
        }
        return true;
    }

    public boolean isFired() {
        return fired.get();
    }

    /**
     * @return true if the signal fired within {@code timeout}
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Runs {@code listener} on fire, or immediately if already fired. Listeners must be idempotent. */
    public void onFire(Runnable listener) {
        listeners.add(listener);
        if (isFired() && listeners.remove(listener)) {
            listener.run();
        }
    }
}
