/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A batch file written by a sink and owned by one pipeline until it is deleted.
 *
 * @param id        file name, e.g. {@code batch_1_20241101T093000.123456Z.json}
 * @param createdAt coordinator time at which delivery completed
 */
public record Artifact(String id, String pipeline, Instant createdAt, ArtifactLocation location) {

    public Artifact {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(location, "location");
    }

    public static Artifact of(String pipeline, Instant createdAt, ArtifactLocation location) {
        final String uri = location.uri();
        final int slash = uri.lastIndexOf('/');
        final String id = (slash >= 0 && slash < uri.length() - 1) ? uri.substring(slash + 1) : uri;
        return new Artifact(id, pipeline, createdAt, location);
    }

    public boolean expired(Instant now, Duration retention) {
        return Duration.between(createdAt, now).compareTo(retention) >= 0;
    }
}
