/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.config.PipelineFactory;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Collaborators of a {@link Coordinator}. Defaults: ServiceLoader-backed sink factory,
 * wall-clock timer, no metrics, threaded sweep lanes, unseeded generators.
 */
public final class CoordinatorOptions {

    private final SinkFactory sinkFactory;
    private final TickTimer timer;
    private final MetricsRuntime metrics;
    private final Supplier<SweepLanes> lanes;
    private final Long seed;

    private CoordinatorOptions(Builder b) {
        this.sinkFactory = (b.sinkFactory != null) ? b.sinkFactory : new PipelineFactory();
        this.timer = (b.timer != null) ? b.timer : new SystemTickTimer();
        this.metrics = (b.metrics != null) ? b.metrics : MetricsRuntime.NOOP;
        this.lanes = (b.lanes != null) ? b.lanes : SweepLanes::threaded;
        this.seed = b.seed;
    }

    public static CoordinatorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public SinkFactory sinkFactory() {
        return sinkFactory;
    }

    public TickTimer timer() {
        return timer;
    }

    public MetricsRuntime metrics() {
        return metrics;
    }

    public SweepLanes newSweepLanes() {
        return lanes.get();
    }

    /** Base seed for per-pipeline generators, or null for random seeding. */
    public Long seed() {
        return seed;
    }

    public static final class Builder {
        private SinkFactory sinkFactory;
        private TickTimer timer;
        private MetricsRuntime metrics;
        private Supplier<SweepLanes> lanes;
        private Long seed;

        private Builder() {}

        public Builder sinkFactory(SinkFactory sinkFactory) {
            this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory");
            return this;
        }

        public Builder timer(TickTimer timer) {
            this.timer = Objects.requireNonNull(timer, "timer");
            return this;
        }

        public Builder metrics(MetricsRuntime metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder sweepLanes(Supplier<SweepLanes> lanes) {
            this.lanes = Objects.requireNonNull(lanes, "lanes");
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public CoordinatorOptions build() {
            return new CoordinatorOptions(this);
        }
    }
}
