/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.spi;

import com.intuitivedesigns.fakeout.config.PipelineKind;
import com.intuitivedesigns.fakeout.core.RecordSink;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;

import java.util.EnumSet;
import java.util.Set;

/**
 * SPI Definition for pipeline sinks.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.fakeout.spi.SinkPlugin}. The config's
 * {@code connection.service} value selects the plugin by {@link #id()}.</p>
 */
public interface SinkPlugin {

    String id(); // e.g. "KAFKA", "GOOGLE_CLOUD_STORAGE", "LOCAL", "LOG"

    /**
     * Pipeline kinds this sink can serve. Selecting it for another kind is a config error.
     */
    default Set<PipelineKind> kinds() {
        return EnumSet.allOf(PipelineKind.class);
    }

    RecordSink create(SinkContext context, MetricsRuntime metrics) throws Exception;
}
