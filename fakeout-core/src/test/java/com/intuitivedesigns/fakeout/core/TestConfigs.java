/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.codec.RecordFormat;
import com.intuitivedesigns.fakeout.config.BatchPipelineConfig;
import com.intuitivedesigns.fakeout.config.DataType;
import com.intuitivedesigns.fakeout.config.FieldSpec;
import com.intuitivedesigns.fakeout.config.Schema;
import com.intuitivedesigns.fakeout.config.SinkConfig;
import com.intuitivedesigns.fakeout.config.Settings;
import com.intuitivedesigns.fakeout.config.StreamingPipelineConfig;

import java.time.Duration;
import java.util.List;

final class TestConfigs {

    static final Schema SCHEMA = Schema.of(
            FieldSpec.of("site", DataType.CATEGORY, List.of("north", "south")),
            FieldSpec.of("reading", DataType.FLOAT, List.of(0.0, 10.0)),
            FieldSpec.of("count", DataType.INTEGER, List.of(1, 5)));

    private TestConfigs() {}

    static StreamingPipelineConfig streaming(String name, Duration interval, int size) {
        return new StreamingPipelineConfig(name, interval, size, false, SCHEMA, new SinkConfig("recording", Settings.empty()));
    }

    static BatchPipelineConfig batch(String name, Duration interval, int size, Duration cleanupAfter) {
        return new BatchPipelineConfig(name, interval, size, false, RecordFormat.JSON, cleanupAfter, SCHEMA,
                new SinkConfig("recording", Settings.empty()));
    }
}
