/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.plugins;

import com.intuitivedesigns.fakeout.config.PipelineKind;
import com.intuitivedesigns.fakeout.core.RecordSink;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import com.intuitivedesigns.fakeout.output.GcsSink;
import com.intuitivedesigns.fakeout.spi.SinkContext;
import com.intuitivedesigns.fakeout.spi.SinkPlugin;

import java.util.EnumSet;
import java.util.Set;

public final class GcsSinkPlugin implements SinkPlugin {

    public static final String ID = "GOOGLE_CLOUD_STORAGE";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<PipelineKind> kinds() {
        return EnumSet.of(PipelineKind.BATCH);
    }

    @Override
    public RecordSink create(SinkContext context, MetricsRuntime metrics) {
        return GcsSink.fromContext(context);
    }
}
