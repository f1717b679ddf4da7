/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.config.PipelineConfig;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;

/**
 * Builds the sink a pipeline delivers to.
 */
@FunctionalInterface
public interface SinkFactory {

    /**
     * @throws com.intuitivedesigns.fakeout.config.ConfigException if the sink cannot be created for this pipeline
     */
    RecordSink create(PipelineConfig config, MetricsRuntime metrics);
}
