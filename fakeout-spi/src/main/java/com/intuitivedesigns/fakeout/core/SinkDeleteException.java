/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

/**
 * An artifact could not be deleted. The artifact stays tracked and is retried next sweep.
 */
public class SinkDeleteException extends Exception {

    public SinkDeleteException(String message) {
        super(message);
    }

    public SinkDeleteException(String message, Throwable cause) {
        super(message, cause);
    }
}
