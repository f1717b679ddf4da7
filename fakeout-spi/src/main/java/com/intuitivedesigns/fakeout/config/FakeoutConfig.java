/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Whole configuration file: runtime settings plus every pipeline definition.
 */
public record FakeoutConfig(
        String version,
        Settings runtime,
        List<StreamingPipelineConfig> streaming,
        List<BatchPipelineConfig> batch
) {

    public FakeoutConfig {
        runtime = Objects.requireNonNullElse(runtime, Settings.empty());
        streaming = (streaming == null) ? List.of() : List.copyOf(streaming);
        batch = (batch == null) ? List.of() : List.copyOf(batch);
    }

    /** Streaming pipelines first, then batch, each in file order. */
    public List<PipelineConfig> pipelines() {
        final List<PipelineConfig> all = new ArrayList<>(streaming.size() + batch.size());
        all.addAll(streaming);
        all.addAll(batch);
        return all;
    }
}
