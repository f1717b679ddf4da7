/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.time.Duration;

public record StreamingPipelineConfig(
        String name,
        Duration interval,
        int size,
        boolean randomise,
        Schema schema,
        SinkConfig sink
) implements PipelineConfig {

    public StreamingPipelineConfig {
        PipelineConfig.validateCommon(name, interval, size, schema, sink);
        name = name.trim();
    }

    @Override
    public PipelineKind kind() {
        return PipelineKind.STREAMING;
    }
}
