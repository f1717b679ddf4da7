/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Wraps any MeterRegistry (Simple, Prometheus)
 * - Stateful "Push" Gauges (maps generic gauge calls to atomic state holders)
 * - Tag support through alternating key/value strings
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final MeterRegistry registry;
    private final String type;
    private final AutoCloseable onClose;

    // State storage for "Push" gauges (Micrometer defaults to "Pull/Poll" gauges)
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime(MeterRegistry registry, String type) {
        this(registry, type, null);
    }

    /**
     * @param onClose extra resource released after the registry (e.g., a scrape endpoint)
     */
    public MicrometerMetricsRuntime(MeterRegistry registry, String type, AutoCloseable onClose) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.type = Objects.requireNonNull(type, "type");
        this.onClose = onClose;
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void counter(String name, double increment, String... tags) {
        if (increment > 0) {
            registry.counter(name, MetricsUtil.toTags(tags)).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationNanos, String... tags) {
        registry.timer(name, MetricsUtil.toTags(tags)).record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
    }

    @Override
    public void gauge(String name, double value, String... tags) {
        final Tags t = MetricsUtil.toTags(tags);
        // computeIfAbsent is atomic: the gauge is registered exactly once per name+tags
        AtomicDouble state = gaugeState.computeIfAbsent(name + t, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(name, newState, AtomicDouble::get)
                    .tags(t)
                    .register(registry);
            return newState;
        });
        state.set(value);
    }

    @Override
    public void close() {
        registry.close();
        if (onClose != null) {
            try {
                onClose.close();
            } catch (Exception e) {
                log.warn("Error closing metrics resources for {}", type, e);
            }
        }
        log.info("Metrics Runtime Closed ({}).", type);
    }

    /**
     * Lightweight Mutable Double for Gauge State.
     */
    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
