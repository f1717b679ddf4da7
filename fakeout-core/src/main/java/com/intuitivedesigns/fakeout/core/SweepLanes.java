/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * One single-thread executor per pipeline, so a slow delete on one backend never
 * delays the sweep of another pipeline.
 */
public abstract class SweepLanes implements AutoCloseable {

    static final Duration DEFAULT_CLOSE_WAIT = Duration.ofSeconds(2);

    public abstract Executor lane(String pipeline);

    /**
     * Stops every lane and waits at most {@code wait} in total for running sweeps.
     *
     * @return pipelines whose lane was still busy when the wait ran out
     */
    public abstract List<String> shutdown(Duration wait);

    @Override
    public final void close() {
        shutdown(DEFAULT_CLOSE_WAIT);
    }

    /** Lazily created daemon lanes named {@code fakeout-sweep-<pipeline>}. */
    public static SweepLanes threaded() {
        return new Threaded();
    }

    /** Runs every sweep on the caller thread. */
    public static SweepLanes inline() {
        return new Inline();
    }

    private static final class Threaded extends SweepLanes {
        private static final Logger log = LoggerFactory.getLogger(SweepLanes.class);

        private final Map<String, ExecutorService> lanes = new ConcurrentHashMap<>();

        @Override
        public Executor lane(String pipeline) {
            return lanes.computeIfAbsent(pipeline, p -> Executors.newSingleThreadExecutor(r -> {
                final Thread t = new Thread(r, "fakeout-sweep-" + p);
                t.setDaemon(true);
                return t;
            }));
        }

        @Override
        public List<String> shutdown(Duration wait) {
            for (ExecutorService lane : lanes.values()) {
                lane.shutdownNow();
            }
            final long deadline = System.nanoTime() + Math.max(0L, wait.toNanos());
            final List<String> busy = new ArrayList<>();
            boolean interrupted = false;
            for (Map.Entry<String, ExecutorService> e : lanes.entrySet()) {
                final long remaining = deadline - System.nanoTime();
                try {
                    if (!interrupted && remaining > 0 && e.getValue().awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                        continue;
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                }
                if (!e.getValue().isTerminated()) {
                    busy.add(e.getKey());
                    log.warn("Sweep lane for pipeline={} still busy after {}ms; abandoned", e.getKey(), wait.toMillis());
                }
            }
            return busy;
        }
    }

    private static final class Inline extends SweepLanes {
        @Override
        public Executor lane(String pipeline) {
            return Runnable::run;
        }

        @Override
        public List<String> shutdown(Duration wait) {
            return List.of();
        }
    }
}
