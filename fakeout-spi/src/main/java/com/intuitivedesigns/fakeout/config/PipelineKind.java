/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.util.Locale;

public enum PipelineKind {
    STREAMING,
    BATCH;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
