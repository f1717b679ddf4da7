/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import com.intuitivedesigns.fakeout.codec.RecordFormat;

import java.time.Duration;
import java.util.Objects;

/**
 * @param filetype     encoding of every artifact this pipeline writes
 * @param cleanupAfter artifacts at least this old are deleted; {@link Duration#ZERO} disables cleanup
 */
public record BatchPipelineConfig(
        String name,
        Duration interval,
        int size,
        boolean randomise,
        RecordFormat filetype,
        Duration cleanupAfter,
        Schema schema,
        SinkConfig sink
) implements PipelineConfig {

    public BatchPipelineConfig {
        PipelineConfig.validateCommon(name, interval, size, schema, sink);
        name = name.trim();
        Objects.requireNonNull(filetype, "filetype");
        cleanupAfter = Objects.requireNonNullElse(cleanupAfter, Duration.ZERO);
        if (cleanupAfter.isNegative()) {
            throw new ConfigException("Pipeline '" + name + "': cleanup_after must be >= 0");
        }
    }

    @Override
    public PipelineKind kind() {
        return PipelineKind.BATCH;
    }

    public boolean cleanupEnabled() {
        return !cleanupAfter.isZero();
    }
}
