/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.time.Duration;

/**
 * Definition shared by streaming and batch pipelines.
 *
 * <p>The name is the pipeline's identity: it keys logs, metrics, artifact names and the
 * artifact tracker, and must be unique across the whole configuration.</p>
 */
public interface PipelineConfig {

    String name();

    PipelineKind kind();

    /** Time between ticks, always positive. */
    Duration interval();

    /** Records per tick, at least 1. */
    int size();

    /** Accepted for compatibility; output is always in generation order. */
    boolean randomise();

    Schema schema();

    SinkConfig sink();

    static void validateCommon(String name, Duration interval, int size, Schema schema, SinkConfig sink) {
        if (name == null || name.isBlank()) {
            throw new ConfigException("Pipeline name must not be blank");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ConfigException("Pipeline '" + name + "': interval must be > 0");
        }
        if (size < 1) {
            throw new ConfigException("Pipeline '" + name + "': size must be >= 1, got " + size);
        }
        if (schema == null) {
            throw new ConfigException("Pipeline '" + name + "': data_description is required");
        }
        if (sink == null) {
            throw new ConfigException("Pipeline '" + name + "': connection is required");
        }
    }
}
