/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

public enum PipelineState {
    IDLE,
    TICKING,
    DELIVERING,
    FAILED,
    STOPPED;

    public boolean terminal() {
        return this == STOPPED;
    }
}
