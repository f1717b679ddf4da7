/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeSettingsTest {

    @Test
    void testDefaults() {
        RuntimeSettings rt = new RuntimeSettings(Settings.empty());

        assertEquals(5, rt.maxStreaming());
        assertEquals(5, rt.maxBatch());
        assertEquals(Duration.ofSeconds(10), rt.shutdownTimeout());
        assertEquals(Duration.ofSeconds(5), rt.sweepInterval());
        assertEquals(Duration.ZERO, rt.runDuration());
        assertEquals(Duration.ofSeconds(30), rt.statusInterval());
    }

    @Test
    void testOverridesAndFallbacks() {
        RuntimeSettings rt = new RuntimeSettings(Settings.of(Map.of(
                "pipelines.streaming.max", 8,
                "pipelines.batch.max", "2",
                "shutdown.timeout.ms", 0,
                "retention.sweep.interval.ms", 250,
                "run.duration.seconds", -3,
                "status.log.interval.seconds", 0)));

        assertEquals(8, rt.maxStreaming());
        assertEquals(2, rt.maxBatch());
        assertEquals(Duration.ofSeconds(10), rt.shutdownTimeout(), "non-positive timeout falls back to the default");
        assertEquals(Duration.ofMillis(250), rt.sweepInterval());
        assertEquals(Duration.ZERO, rt.runDuration());
        assertEquals(Duration.ZERO, rt.statusInterval());
    }
}
