/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.spi;

import com.intuitivedesigns.fakeout.codec.RecordFormat;
import com.intuitivedesigns.fakeout.config.PipelineKind;
import com.intuitivedesigns.fakeout.config.Settings;

import java.util.Objects;

/**
 * Everything a {@link SinkPlugin} needs to build the sink of one pipeline.
 *
 * @param pipelineName owning pipeline
 * @param kind         streaming or batch
 * @param format       artifact encoding; {@code null} for streaming pipelines
 * @param connection   the pipeline's {@code connection} block
 */
public record SinkContext(String pipelineName, PipelineKind kind, RecordFormat format, Settings connection) {

    public SinkContext {
        Objects.requireNonNull(pipelineName, "pipelineName");
        Objects.requireNonNull(kind, "kind");
        connection = Objects.requireNonNullElse(connection, Settings.empty());
    }

    /** Owner label for {@link Settings#require} messages. */
    public String owner() {
        return "pipeline '" + pipelineName + "' connection";
    }
}
