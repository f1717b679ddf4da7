/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed view over the {@code runtime} block of the configuration file.
 */
public final class RuntimeSettings {

    public static final String KEY_STREAMING_MAX = "pipelines.streaming.max";
    public static final String KEY_BATCH_MAX = "pipelines.batch.max";
    public static final String KEY_SHUTDOWN_TIMEOUT_MS = "shutdown.timeout.ms";
    public static final String KEY_SWEEP_INTERVAL_MS = "retention.sweep.interval.ms";
    public static final String KEY_RUN_DURATION_SECONDS = "run.duration.seconds";
    public static final String KEY_STATUS_INTERVAL_SECONDS = "status.log.interval.seconds";

    public static final int DEFAULT_PIPELINE_MAX = 5;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_STATUS_INTERVAL_SECONDS = 30L;

    private final Settings settings;

    public RuntimeSettings(Settings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public int maxStreaming() {
        return Math.max(0, settings.getInt(KEY_STREAMING_MAX, DEFAULT_PIPELINE_MAX));
    }

    public int maxBatch() {
        return Math.max(0, settings.getInt(KEY_BATCH_MAX, DEFAULT_PIPELINE_MAX));
    }

    public Duration shutdownTimeout() {
        return Duration.ofMillis(positive(settings.getLong(KEY_SHUTDOWN_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS), DEFAULT_SHUTDOWN_TIMEOUT_MS));
    }

    public Duration sweepInterval() {
        return Duration.ofMillis(positive(settings.getLong(KEY_SWEEP_INTERVAL_MS, DEFAULT_SWEEP_INTERVAL_MS), DEFAULT_SWEEP_INTERVAL_MS));
    }

    /** Zero means run until signalled. */
    public Duration runDuration() {
        return Duration.ofSeconds(Math.max(0L, settings.getLong(KEY_RUN_DURATION_SECONDS, 0L)));
    }

    /** Zero disables the periodic status line. */
    public Duration statusInterval() {
        return Duration.ofSeconds(Math.max(0L, settings.getLong(KEY_STATUS_INTERVAL_SECONDS, DEFAULT_STATUS_INTERVAL_SECONDS)));
    }

    public Settings raw() {
        return settings;
    }

    private static long positive(long v, long fallback) {
        return v > 0 ? v : fallback;
    }
}
