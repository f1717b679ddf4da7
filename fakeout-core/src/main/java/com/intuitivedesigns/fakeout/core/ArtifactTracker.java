/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-guarded {@link ArtifactRegistry}. Owned by the coordinator; pipelines and the
 * sweeper only see the interface.
 */
final class ArtifactTracker implements ArtifactRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArtifactTracker.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<Artifact>> byPipeline = new HashMap<>();

    @Override
    public void register(Artifact artifact) {
        Objects.requireNonNull(artifact, "artifact");
        lock.lock();
        try {
            byPipeline.computeIfAbsent(artifact.pipeline(), k -> new ArrayList<>()).add(artifact);
        } finally {
            lock.unlock();
        }
        log.debug("pipeline={} artifact={} registered", artifact.pipeline(), artifact.id());
    }

    @Override
    public List<Artifact> expired(String pipeline, Instant now, Duration retention) {
        lock.lock();
        try {
            final List<Artifact> live = byPipeline.get(pipeline);
            if (live == null) return List.of();
            final List<Artifact> out = new ArrayList<>();
            for (Artifact a : live) {
                if (a.expired(now, retention)) out.add(a);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean release(Artifact artifact) {
        lock.lock();
        try {
            final List<Artifact> live = byPipeline.get(artifact.pipeline());
            return live != null && live.remove(artifact);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Artifact> live(String pipeline) {
        lock.lock();
        try {
            final List<Artifact> live = byPipeline.get(pipeline);
            return live == null ? List.of() : List.copyOf(live);
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            int n = 0;
            for (List<Artifact> l : byPipeline.values()) n += l.size();
            return n;
        } finally {
            lock.unlock();
        }
    }
}
