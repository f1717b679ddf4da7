/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

/**
 * Where a sink put one artifact. Opaque to the coordinator; only the sink that returned
 * it interprets the value (a file path, {@code gs://bucket/object}, ...).
 */
public record ArtifactLocation(String uri) {

    public ArtifactLocation {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("Artifact location must not be blank");
        }
    }

    @Override
    public String toString() {
        return uri;
    }
}
