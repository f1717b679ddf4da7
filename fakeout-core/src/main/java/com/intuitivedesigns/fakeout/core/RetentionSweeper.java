/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Periodically deletes artifacts older than their pipeline's retention.
 *
 * <p>An artifact leaves the registry only after its sink confirmed the delete; failed
 * deletes are retried on the next sweep.</p>
 */
public final class RetentionSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    static final String METRIC_DELETED = "fakeout_artifacts_deleted_total";
    static final String METRIC_DELETE_FAILURES = "fakeout_artifact_delete_failures_total";

    /** A batch pipeline with cleanup enabled. */
    public record Target(String pipeline, Duration retention, RecordSink sink) {
        public Target {
            Objects.requireNonNull(pipeline, "pipeline");
            Objects.requireNonNull(sink, "sink");
            if (retention == null || retention.isZero() || retention.isNegative()) {
                throw new IllegalArgumentException("retention must be > 0 for pipeline " + pipeline);
            }
        }
    }

    private final List<Target> targets;
    private final ArtifactRegistry registry;
    private final TickTimer timer;
    private final StopSignal stop;
    private final Duration period;
    private final SweepLanes lanes;
    private final MetricsRuntime metrics;

    private final Map<String, AtomicBoolean> busy = new ConcurrentHashMap<>();
    private final LongAdder deleted = new LongAdder();
    private final LongAdder deleteFailures = new LongAdder();
    private final LongAdder skippedBusy = new LongAdder();

    public RetentionSweeper(List<Target> targets,
                            ArtifactRegistry registry,
                            TickTimer timer,
                            StopSignal stop,
                            Duration sweepInterval,
                            SweepLanes lanes,
                            MetricsRuntime metrics) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("RetentionSweeper needs at least one target");
        }
        this.targets = List.copyOf(targets);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.stop = Objects.requireNonNull(stop, "stop");
        this.lanes = Objects.requireNonNull(lanes, "lanes");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;
        this.period = periodFor(this.targets, Objects.requireNonNull(sweepInterval, "sweepInterval"));
        for (Target t : this.targets) {
            busy.put(t.pipeline(), new AtomicBoolean(false));
        }
    }

    /** Never longer than the smallest retention. */
    static Duration periodFor(List<Target> targets, Duration sweepInterval) {
        Duration p = sweepInterval;
        for (Target t : targets) {
            if (t.retention().compareTo(p) < 0) p = t.retention();
        }
        return p;
    }

    @Override
    public void run() {
        final Instant start = timer.now();
        final long periodNanos = period.toNanos();
        log.info("Retention sweeper started period={} pipelines={}", period, targets.stream().map(Target::pipeline).toList());

        try {
            long k = 1;
            while (timer.awaitUntil(start.plusNanos(k * periodNanos), stop)) {
                final Instant now = timer.now();
                sweep(now);
                // re-anchor on the grid if the dispatch itself ran late
                final long elapsed = Duration.between(start, timer.now()).toNanos();
                k = Math.max(k + 1, elapsed / periodNanos + 1);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retention sweeper interrupted");
        } finally {
            log.info("Retention sweeper stopped deleted={} deleteFailures={} skippedBusy={}",
                    deleted.sum(), deleteFailures.sum(), skippedBusy.sum());
        }
    }

    /** Dispatches one sweep per target to its lane. */
    void sweep(Instant now) {
        for (Target target : targets) {
            if (stop.isFired()) return;

            final AtomicBoolean laneBusy = busy.get(target.pipeline());
            if (!laneBusy.compareAndSet(false, true)) {
                skippedBusy.increment();
                log.debug("pipeline={} sweep={} previous sweep still running; skipped", target.pipeline(), now);
                continue;
            }
            try {
                lanes.lane(target.pipeline()).execute(() -> {
                    try {
                        sweepPipeline(target, now);
                    } finally {
                        laneBusy.set(false);
                    }
                });
            } catch (RejectedExecutionException e) {
                laneBusy.set(false);
                log.debug("pipeline={} sweep lane closed", target.pipeline());
            }
        }
    }

    private void sweepPipeline(Target target, Instant now) {
        final List<Artifact> expired = registry.expired(target.pipeline(), now, target.retention());
        for (Artifact artifact : expired) {
            if (stop.isFired()) return;
            try {
                target.sink().delete(artifact.location());
                registry.release(artifact);
                deleted.increment();
                metrics.counter(METRIC_DELETED, 1.0, "pipeline", target.pipeline());
                log.info("pipeline={} sweep={} deleted {} (age {}s)", target.pipeline(), now,
                        artifact.location(), Duration.between(artifact.createdAt(), now).toSeconds());
            } catch (SinkDeleteException | RuntimeException e) {
                deleteFailures.increment();
                metrics.counter(METRIC_DELETE_FAILURES, 1.0, "pipeline", target.pipeline());
                log.warn("pipeline={} sweep={} delete of {} failed, retrying next sweep: {}",
                        target.pipeline(), now, artifact.location(), e.getMessage(), e);
            }
        }
    }

    public Duration period() {
        return period;
    }

    public long deleted() {
        return deleted.sum();
    }

    public long deleteFailures() {
        return deleteFailures.sum();
    }

    public long skippedBusy() {
        return skippedBusy.sum();
    }
}
