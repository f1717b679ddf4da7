/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.config.PipelineKind;

/**
 * Point-in-time counters of one pipeline.
 *
 * @param lastError message of the most recent failure, or null
 */
public record PipelineStats(
        String pipeline,
        PipelineKind kind,
        PipelineState state,
        long ticksStarted,
        long delivered,
        long failures,
        long overruns,
        long recordsGenerated,
        String lastError
) {
}
