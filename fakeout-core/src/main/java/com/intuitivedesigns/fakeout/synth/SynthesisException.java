/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.synth;

/**
 * Record generation failed for a schema that passed validation. Always a bug.
 */
public class SynthesisException extends RuntimeException {

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
