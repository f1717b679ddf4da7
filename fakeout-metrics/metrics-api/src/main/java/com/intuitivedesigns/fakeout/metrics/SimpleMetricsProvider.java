/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * In-memory Micrometer registry. Useful for local runs and tests; nothing is exported.
 */
public final class SimpleMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "SIMPLE";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsUtil.applyCommonTags(registry, s);
        return new MicrometerMetricsRuntime(registry, id());
    }
}
