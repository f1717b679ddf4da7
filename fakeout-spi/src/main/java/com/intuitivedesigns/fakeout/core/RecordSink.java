/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * A pluggable destination for generated batches.
 *
 * Examples:
 * - Kafka topic (streaming)
 * - Google Cloud Storage bucket (batch)
 * - Local folder served over HTTP (batch)
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #deliver} is atomic from the caller's view: the whole batch is accepted, or the
 * call throws and nothing is visible.</li>
 * <li>Calls may block for as long as the backend takes; the caller owns the thread.</li>
 * <li>Each instance is owned by exactly one pipeline, so implementations need not be
 * thread-safe for concurrent deliveries. {@link #delete} may run on the sweeper's thread
 * while a delivery is in progress.</li>
 * </ul>
 */
public interface RecordSink extends AutoCloseable {

    /**
     * Deliver one tick's batch as a single unit.
     *
     * @param pipelineName owning pipeline, used for naming and logs
     * @param batch        every record of the tick, in generation order
     * @return where the artifact was written, or empty for sinks that keep no artifacts
     * @throws SinkDeliveryException if the backend rejected or never acknowledged the batch
     */
    Optional<ArtifactLocation> deliver(String pipelineName, List<SyntheticRecord> batch) throws SinkDeliveryException;

    /**
     * Remove an artifact previously returned by {@link #deliver}.
     * Must be idempotent: deleting an absent artifact is not an error.
     *
     * @throws SinkDeleteException if the backend refused the delete
     */
    default void delete(ArtifactLocation location) throws SinkDeleteException {
        throw new SinkDeleteException(id() + " does not manage artifacts: " + location);
    }

    /**
     * Artifacts already present at the destination that this pipeline wrote in an earlier
     * run, so they can be tracked and expired after a restart. Locations must be
     * accepted by {@link #delete}.
     *
     * @throws IOException if the backend could not be listed
     */
    default List<ArtifactLocation> existingArtifacts(String pipelineName) throws IOException {
        return List.of();
    }

    /**
     * Returns an identifier for logging (e.g., "kafka:events").
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    /**
     * Release clients, servers and connections.
     */
    @Override
    default void close() throws Exception {
        // no-op by default
    }
}
