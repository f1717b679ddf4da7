/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Coordinator-side ledger of live artifacts. Pipelines register what they wrote; the
 * retention sweeper queries and releases.
 */
public interface ArtifactRegistry {

    void register(Artifact artifact);

    /**
     * @return artifacts of {@code pipeline} with {@code now - createdAt >= retention}, oldest first
     */
    List<Artifact> expired(String pipeline, Instant now, Duration retention);

    /**
     * Drops an artifact after its delete succeeded.
     *
     * @return false if it was not tracked
     */
    boolean release(Artifact artifact);

    /** Snapshot of live artifacts, oldest first. */
    List<Artifact> live(String pipeline);
}
