/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.config.PipelineConfig;
import com.intuitivedesigns.fakeout.config.PipelineKind;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import com.intuitivedesigns.fakeout.synth.RecordSynthesizer;
import com.intuitivedesigns.fakeout.synth.SynthesisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Execution unit of one pipeline: waits for each tick on an absolute schedule, generates
 * a batch and hands it to the sink in one call.
 *
 * <p>Tick {@code k} is scheduled at {@code start + k * interval}. A tick that finishes
 * after the next slot triggers one immediate tick (logged and counted as an overrun);
 * the schedule then continues on the slot grid, so missed slots are skipped rather
 * than queued.</p>
 *
 * <p>Stop is observed while waiting and after each delivery; an in-flight sink call
 * is allowed to finish.</p>
 */
public final class PipelineRunner implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    static final String METRIC_TICKS = "fakeout_ticks_total";
    static final String METRIC_RECORDS = "fakeout_records_generated_total";
    static final String METRIC_OVERRUNS = "fakeout_tick_overruns_total";
    static final String METRIC_LATENCY = "fakeout_delivery_latency";

    private final PipelineConfig config;
    private final RecordSink sink;
    private final RecordSynthesizer synthesizer;
    private final ArtifactRegistry registry;
    private final TickTimer timer;
    private final StopSignal stop;
    private final MetricsRuntime metrics;

    private final long intervalNanos;

    private volatile PipelineState state = PipelineState.IDLE;
    private volatile String lastError;

    private final LongAdder ticks = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder overruns = new LongAdder();
    private final LongAdder records = new LongAdder();

    public PipelineRunner(PipelineConfig config,
                          RecordSink sink,
                          RecordSynthesizer synthesizer,
                          ArtifactRegistry registry,
                          TickTimer timer,
                          StopSignal stop,
                          MetricsRuntime metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.stop = Objects.requireNonNull(stop, "stop");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;
        this.intervalNanos = config.interval().toNanos();
    }

    @Override
    public void run() {
        final Instant start = timer.now();
        log.info("pipeline={} kind={} started interval={} size={} sink={}",
                config.name(), config.kind().id(), config.interval(), config.size(), sink.id());

        try {
            Instant next = start.plusNanos(intervalNanos);
            while (true) {
                state = PipelineState.IDLE;
                if (!timer.awaitUntil(next, stop)) break;

                final Instant scheduled = next;
                tick(scheduled);
                if (stop.isFired()) break;

                final Instant now = timer.now();
                final Instant following = nextSlotAfter(start, scheduled);
                if (following.isAfter(now)) {
                    next = following;
                } else {
                    overrun(scheduled, following, now);
                    next = now;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("pipeline={} interrupted", config.name());
        } catch (SynthesisException e) {
            lastError = e.getMessage();
            state = PipelineState.FAILED;
            log.error("pipeline={} record generation failed; pipeline stops", config.name(), e);
        } finally {
            state = PipelineState.STOPPED;
            log.info("pipeline={} stopped ticks={} delivered={} failures={} overruns={}",
                    config.name(), ticks.sum(), delivered.sum(), failures.sum(), overruns.sum());
        }
    }

    private void tick(Instant scheduled) {
        ticks.increment();
        state = PipelineState.TICKING;

        final List<SyntheticRecord> batch = synthesizer.generate(config.schema(), config.size());
        records.add(batch.size());
        metrics.counter(METRIC_RECORDS, batch.size(), "pipeline", config.name());

        state = PipelineState.DELIVERING;
        final long t0 = System.nanoTime();
        try {
            final Optional<ArtifactLocation> location = sink.deliver(config.name(), batch);
            metrics.timer(METRIC_LATENCY, System.nanoTime() - t0, "pipeline", config.name());
            delivered.increment();
            metrics.counter(METRIC_TICKS, 1.0, "pipeline", config.name(), "outcome", "delivered");

            if (config.kind() == PipelineKind.BATCH) {
                if (location.isPresent() && stop.isFired()) {
                    log.info("pipeline={} tick={} wrote {} after stop; left for the next run to pick up",
                            config.name(), scheduled, location.get());
                } else if (location.isPresent()) {
                    final Artifact artifact = Artifact.of(config.name(), timer.now(), location.get());
                    registry.register(artifact);
                    log.debug("pipeline={} tick={} wrote {}", config.name(), scheduled, artifact.location());
                } else {
                    log.warn("pipeline={} tick={} sink {} returned no artifact location; nothing to clean up",
                            config.name(), scheduled, sink.id());
                }
            }
        } catch (SinkDeliveryException | RuntimeException e) {
            state = PipelineState.FAILED;
            failures.increment();
            lastError = String.valueOf(e.getMessage());
            metrics.counter(METRIC_TICKS, 1.0, "pipeline", config.name(), "outcome", "failed");
            log.warn("pipeline={} tick={} delivery to {} failed: {}", config.name(), scheduled, sink.id(), e.getMessage(), e);
        }
    }

    private void overrun(Instant scheduled, Instant missedSlot, Instant now) {
        overruns.increment();
        metrics.counter(METRIC_OVERRUNS, 1.0, "pipeline", config.name());
        final long behindNanos = Duration.between(missedSlot, now).toNanos();
        final long skipped = behindNanos / intervalNanos;
        log.warn("pipeline={} tick={} overran its interval by {}ms; firing now, skipping {} slot(s)",
                config.name(), scheduled, Duration.between(missedSlot, now).toMillis(), skipped);
    }

    /** First slot of the {@code start + k * interval} grid strictly after {@code t}. */
    private Instant nextSlotAfter(Instant start, Instant t) {
        final long elapsed = Duration.between(start, t).toNanos();
        final long k = Math.floorDiv(elapsed, intervalNanos) + 1;
        return start.plusNanos(k * intervalNanos);
    }

    /** Marks a context that ignored the stop signal and was abandoned. */
    void abandon() {
        state = PipelineState.STOPPED;
    }

    public String name() {
        return config.name();
    }

    public PipelineConfig config() {
        return config;
    }

    public RecordSink sink() {
        return sink;
    }

    public PipelineState state() {
        return state;
    }

    public PipelineStats stats() {
        return new PipelineStats(
                config.name(),
                config.kind(),
                state,
                ticks.sum(),
                delivered.sum(),
                failures.sum(),
                overruns.sum(),
                records.sum(),
                lastError);
    }
}
