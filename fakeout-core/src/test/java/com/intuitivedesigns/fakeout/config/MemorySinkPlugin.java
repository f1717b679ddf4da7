/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import com.intuitivedesigns.fakeout.core.ArtifactLocation;
import com.intuitivedesigns.fakeout.core.RecordSink;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import com.intuitivedesigns.fakeout.spi.SinkContext;
import com.intuitivedesigns.fakeout.spi.SinkPlugin;

import java.util.List;
import java.util.Optional;

/**
 * Registered through META-INF/services in the test classpath to exercise discovery.
 */
public final class MemorySinkPlugin implements SinkPlugin {

    @Override
    public String id() {
        return "MEMORY";
    }

    @Override
    public RecordSink create(SinkContext context, MetricsRuntime metrics) {
        final String bucket = context.connection().require("bucket", context.owner());
        return new MemorySink(context, bucket);
    }

    public static final class MemorySink implements RecordSink {
        private final SinkContext context;
        private final String bucket;

        MemorySink(SinkContext context, String bucket) {
            this.context = context;
            this.bucket = bucket;
        }

        public SinkContext context() {
            return context;
        }

        @Override
        public Optional<ArtifactLocation> deliver(String pipelineName, List<SyntheticRecord> batch) {
            return Optional.of(new ArtifactLocation("mem://" + bucket + "/" + pipelineName));
        }

        @Override
        public String id() {
            return "memory:" + bucket;
        }
    }
}
