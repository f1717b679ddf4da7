/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.intuitivedesigns.fakeout.codec.RecordCodec;
import com.intuitivedesigns.fakeout.core.ArtifactLocation;
import com.intuitivedesigns.fakeout.core.RecordSink;
import com.intuitivedesigns.fakeout.core.SinkDeliveryException;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streaming sink for local runs: each batch becomes one INFO line.
 */
public final class LogSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(LogSink.class);

    private final RecordCodec codec = RecordCodec.shared();
    private final AtomicLong batches = new AtomicLong();

    @Override
    public Optional<ArtifactLocation> deliver(String pipelineName, List<SyntheticRecord> batch) throws SinkDeliveryException {
        final String message;
        try {
            message = codec.encodeMessage(batch);
        } catch (JsonProcessingException e) {
            throw new SinkDeliveryException("Cannot encode batch for pipeline " + pipelineName, e);
        }
        log.info("pipeline={} batch={} records={} {}", pipelineName, batches.incrementAndGet(), batch.size(), message);
        return Optional.empty();
    }

    public long batches() {
        return batches.get();
    }

    @Override
    public String id() {
        return "log";
    }
}
