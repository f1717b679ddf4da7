/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import java.util.List;

/**
 * Contexts that did not finish within the shutdown timeout and were abandoned.
 */
public class ShutdownTimeoutException extends RuntimeException {

    private final List<String> abandoned;

    public ShutdownTimeoutException(List<String> abandoned, long timeoutMs) {
        super("Contexts did not stop within " + timeoutMs + "ms and were abandoned: " + abandoned);
        this.abandoned = List.copyOf(abandoned);
    }

    public List<String> abandoned() {
        return abandoned;
    }
}
