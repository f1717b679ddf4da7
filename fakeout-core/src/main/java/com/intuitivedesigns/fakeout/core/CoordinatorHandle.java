/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifetime control for a running coordinator.
 */
public final class CoordinatorHandle {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorHandle.class);

    private final List<PipelineRunner> runners;
    private final RetentionSweeper sweeper;
    private final ArtifactRegistry registry;
    private final StopSignal stop;
    private final SweepLanes lanes;
    private final Duration defaultTimeout;

    private final Map<Thread, PipelineRunner> threads = new LinkedHashMap<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    CoordinatorHandle(List<PipelineRunner> runners,
                      RetentionSweeper sweeper,
                      ArtifactRegistry registry,
                      StopSignal stop,
                      SweepLanes lanes,
                      Duration defaultTimeout) {
        this.runners = List.copyOf(runners);
        this.sweeper = sweeper;
        this.registry = registry;
        this.stop = stop;
        this.lanes = lanes;
        this.defaultTimeout = defaultTimeout;
    }

    void startAll() {
        for (PipelineRunner r : runners) {
            threads.put(newThread(r, "fakeout-" + r.config().kind().id() + "-" + r.name()), r);
        }
        if (sweeper != null) {
            threads.put(newThread(sweeper, "fakeout-sweeper"), null);
        }
        for (Thread t : threads.keySet()) {
            t.start();
        }
    }

    private static Thread newThread(Runnable r, String name) {
        final Thread t = new Thread(r, name);
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((th, e) -> log.error("Context {} crashed", th.getName(), e));
        return t;
    }

    public void stop() {
        stop(defaultTimeout);
    }

    /**
     * Broadcasts stop, waits for every context, shuts the sweep lanes and closes all
     * sinks, all within {@code timeout}. Whatever is still running when the budget is
     * spent is abandoned and reported. Safe to call more than once.
     */
    public void stop(Duration timeout) {
        if (!stopped.compareAndSet(false, true)) return;

        log.info("Stop requested; waiting up to {}ms for {} context(s)", timeout.toMillis(), threads.size());
        stop.fire();

        final long deadline = System.nanoTime() + timeout.toNanos();
        final List<String> abandoned = new ArrayList<>();
        try {
            for (Map.Entry<Thread, PipelineRunner> e : threads.entrySet()) {
                final long remaining = deadline - System.nanoTime();
                if (remaining > 0) {
                    TimeUnit.NANOSECONDS.timedJoin(e.getKey(), remaining);
                }
                if (e.getKey().isAlive()) {
                    abandon(e, abandoned);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            for (Map.Entry<Thread, PipelineRunner> e : threads.entrySet()) {
                if (e.getKey().isAlive() && !abandoned.contains(e.getKey().getName())) {
                    abandon(e, abandoned);
                }
            }
        }

        for (String pipeline : lanes.shutdown(remaining(deadline))) {
            abandoned.add("fakeout-sweep-" + pipeline);
        }
        abandoned.addAll(closeSinks(remaining(deadline)));

        if (!abandoned.isEmpty()) {
            log.warn("Shutdown timed out", new ShutdownTimeoutException(abandoned, timeout.toMillis()));
        }
        log.info("Coordinator stopped");
    }

    private static void abandon(Map.Entry<Thread, PipelineRunner> e, List<String> abandoned) {
        abandoned.add(e.getKey().getName());
        e.getKey().interrupt();
        if (e.getValue() != null) e.getValue().abandon();
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    /**
     * Closes sinks in order on a daemon thread and waits at most {@code budget} for it.
     *
     * @return {@code sink-close:<pipeline>} for every sink not closed in time
     */
    private List<String> closeSinks(Duration budget) {
        final Set<String> pending = Collections.synchronizedSet(new LinkedHashSet<>());
        for (PipelineRunner r : runners) {
            pending.add(r.name());
        }

        final Thread closer = newThread(() -> {
            for (PipelineRunner r : runners) {
                closeQuietly(r.name(), r.sink());
                pending.remove(r.name());
            }
        }, "fakeout-sink-closer");
        closer.start();

        try {
            TimeUnit.NANOSECONDS.timedJoin(closer, budget.toNanos());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }

        final List<String> late = new ArrayList<>();
        synchronized (pending) {
            for (String pipeline : pending) {
                late.add("sink-close:" + pipeline);
            }
        }
        return late;
    }

    /**
     * Waits for every context to finish on its own (e.g. after stop or a fatal error).
     *
     * @return true if all finished within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread t : threads.keySet()) {
            final long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return !anyAlive();
            TimeUnit.NANOSECONDS.timedJoin(t, remaining);
        }
        return !anyAlive();
    }

    public boolean isRunning() {
        return !stopped.get() && anyAlive();
    }

    private boolean anyAlive() {
        for (Thread t : threads.keySet()) {
            if (t.isAlive()) return true;
        }
        return false;
    }

    /** Snapshot per pipeline, in configuration order. */
    public Map<String, PipelineStats> stats() {
        final Map<String, PipelineStats> out = new LinkedHashMap<>();
        for (PipelineRunner r : runners) {
            out.put(r.name(), r.stats());
        }
        return out;
    }

    public PipelineStats stats(String pipeline) {
        for (PipelineRunner r : runners) {
            if (r.name().equals(pipeline)) return r.stats();
        }
        throw new IllegalArgumentException("Unknown pipeline '" + pipeline + "'");
    }

    public List<Artifact> artifacts(String pipeline) {
        return registry.live(pipeline);
    }

    /** Pipelines plus the sweeper, if one runs. */
    public int contextCount() {
        return threads.size();
    }

    public boolean sweeperEnabled() {
        return sweeper != null;
    }

    static void closeQuietly(String pipeline, RecordSink sink) {
        try {
            sink.close();
        } catch (Exception e) {
            log.warn("pipeline={} error closing sink {}", pipeline, sink.id(), e);
        }
    }
}
