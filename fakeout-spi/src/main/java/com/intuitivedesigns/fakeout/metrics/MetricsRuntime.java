/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.metrics;

/**
 * The vendor-agnostic contract for pipeline observability.
 *
 * <p>Lets the core and the sinks record metrics without a compile-time dependency on
 * Micrometer. Every method has a NOOP default, so an absent provider costs nothing.</p>
 *
 * <p>Tags are passed as alternating key/value strings, e.g.
 * {@code counter("fakeout_ticks_total", 1, "pipeline", "sensors", "outcome", "ok")}.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = new MetricsRuntime() {};

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage,
     * or {@code null} when metrics are disabled.
     */
    default Object registry() { return null; }

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "PROMETHEUS", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void counter(String name, double increment, String... tags) {}

    default void timer(String name, long durationNanos, String... tags) {}

    default void gauge(String name, double value, String... tags) {}

    @Override
    default void close() {
        // no-op by default
    }
}
