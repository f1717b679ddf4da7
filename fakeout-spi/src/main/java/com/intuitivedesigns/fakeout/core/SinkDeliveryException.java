/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

/**
 * A batch was not accepted by a sink. Recoverable and local to one pipeline tick.
 */
public class SinkDeliveryException extends Exception {

    public SinkDeliveryException(String message) {
        super(message);
    }

    public SinkDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
