/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.intuitivedesigns.fakeout.codec.RecordCodec;
import com.intuitivedesigns.fakeout.config.Settings;
import com.intuitivedesigns.fakeout.core.ArtifactLocation;
import com.intuitivedesigns.fakeout.core.RecordSink;
import com.intuitivedesigns.fakeout.core.SinkDeliveryException;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import com.intuitivedesigns.fakeout.spi.SinkContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Streaming sink: publishes each tick's batch as one JSON-array message keyed by the
 * pipeline name, and waits for the broker acknowledgement before returning.
 *
 * Features:
 * - Synchronous ack with a bounded wait (send_timeout_ms)
 * - Rate-limited error logging
 * - Optional Micrometer counters/timer
 */
public final class KafkaSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaSink.class);

    // ---- connection keys ----
    static final String KEY_TOPIC = "topic";
    static final String KEY_BOOTSTRAP = "bootstrap_servers";
    static final String KEY_CLIENT_ID = "client_id";
    static final String KEY_ACKS = "acks";
    static final String KEY_COMPRESSION = "compression";
    static final String KEY_SEND_TIMEOUT_MS = "send_timeout_ms";
    static final String KAFKA_PASSTHROUGH_PREFIX = "kafka.";

    // ---- Defaults ----
    private static final String DEFAULT_BOOTSTRAP = "localhost:9092";
    private static final String DEFAULT_ACKS = "all";
    private static final String DEFAULT_COMPRESSION = "lz4";
    private static final long DEFAULT_SEND_TIMEOUT_MS = 10_000L;
    private static final long ERROR_LOG_INTERVAL_MS = 1_000L;

    private final Producer<String, String> producer;
    private final String topic;
    private final String pipelineName;
    private final Duration sendTimeout;
    private final RecordCodec codec;

    // Fast counters (always on)
    private final LongAdder sentOk = new LongAdder();
    private final LongAdder sentFail = new LongAdder();

    // Micrometer (optional)
    private final Counter okCounter;
    private final Counter failCounter;
    private final Timer sendLatencyTimer;

    // Rate-limited error logging
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public KafkaSink(String topic,
                     Producer<String, String> producer,
                     Duration sendTimeout,
                     MetricsRuntime metrics,
                     String pipelineName) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
        this.pipelineName = Objects.requireNonNull(pipelineName, "pipelineName");
        this.codec = RecordCodec.shared();

        // Metrics wiring (optional)
        final MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr)
                ? mr
                : null;

        if (registry != null) {
            this.okCounter = registry.counter("fakeout_kafka_send_ok_total", "pipeline", pipelineName, "topic", topic);
            this.failCounter = registry.counter("fakeout_kafka_send_fail_total", "pipeline", pipelineName, "topic", topic);
            this.sendLatencyTimer = registry.timer("fakeout_kafka_send_latency", "pipeline", pipelineName, "topic", topic);
        } else {
            this.okCounter = null;
            this.failCounter = null;
            this.sendLatencyTimer = null;
        }

        log.info("KafkaSink active. pipeline='{}' topic='{}' send_timeout={}ms", pipelineName, topic, sendTimeout.toMillis());
    }

    public static KafkaSink fromContext(SinkContext context, MetricsRuntime metrics) {
        Objects.requireNonNull(context, "context");
        final Settings conn = context.connection();

        final String topic = conn.require(KEY_TOPIC, context.owner());
        final long timeoutMs = Math.max(1L, conn.getLong(KEY_SEND_TIMEOUT_MS, DEFAULT_SEND_TIMEOUT_MS));
        final Properties props = buildProducerProps(context);

        return new KafkaSink(topic, new KafkaProducer<>(props), Duration.ofMillis(timeoutMs), metrics, context.pipelineName());
    }

    static Properties buildProducerProps(SinkContext context) {
        final Settings conn = context.connection();
        final Properties props = new Properties();

        // Connectivity
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, conn.getString(KEY_BOOTSTRAP, DEFAULT_BOOTSTRAP));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, conn.getString(KEY_CLIENT_ID, "fakeout-" + context.pipelineName()));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        // Durability
        props.put(ProducerConfig.ACKS_CONFIG, conn.getString(KEY_ACKS, DEFAULT_ACKS));
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, conn.getString(KEY_COMPRESSION, DEFAULT_COMPRESSION));

        // kafka.ssl.truststore.location -> ssl.truststore.location
        for (String key : conn.keys()) {
            if (key.startsWith(KAFKA_PASSTHROUGH_PREFIX) && key.length() > KAFKA_PASSTHROUGH_PREFIX.length()) {
                props.put(key.substring(KAFKA_PASSTHROUGH_PREFIX.length()), conn.getString(key, ""));
            }
        }
        return props;
    }

    @Override
    public Optional<ArtifactLocation> deliver(String pipelineName, List<SyntheticRecord> batch) throws SinkDeliveryException {
        final String message;
        try {
            message = codec.encodeMessage(batch);
        } catch (JsonProcessingException e) {
            markFail(0L, e);
            throw new SinkDeliveryException("Cannot encode batch for topic " + topic, e);
        }

        final long startNs = System.nanoTime();
        try {
            final RecordMetadata md = producer.send(new ProducerRecord<>(topic, pipelineName, message))
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            markOk(startNs);
            if (log.isDebugEnabled()) {
                log.debug("pipeline={} published {} records to {}-{}@{}", pipelineName, batch.size(), md.topic(), md.partition(), md.offset());
            }
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markFail(startNs, e);
            throw new SinkDeliveryException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            final Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            markFail(startNs, cause);
            throw new SinkDeliveryException("Broker rejected batch for topic " + topic + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            markFail(startNs, e);
            throw new SinkDeliveryException("No acknowledgement from topic " + topic + " within " + sendTimeout.toMillis() + "ms", e);
        } catch (KafkaException | IllegalStateException e) {
            markFail(startNs, e);
            throw new SinkDeliveryException("Kafka send failed for topic " + topic + ": " + e.getMessage(), e);
        }
    }

    // ---- Metrics & Logging ----

    private void markOk(long startNanos) {
        sentOk.increment();
        if (okCounter != null) okCounter.increment();
        if (sendLatencyTimer != null) {
            sendLatencyTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    private void markFail(long startNanos, Throwable exception) {
        sentFail.increment();
        if (failCounter != null) failCounter.increment();
        if (sendLatencyTimer != null && startNanos != 0L) {
            sendLatencyTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
        logRateLimited("Kafka send failed topic=" + topic, exception);
    }

    private void logRateLimited(String context, Throwable ex) {
        final long now = System.currentTimeMillis();
        final long last = lastErrorLogMs.get();

        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            final long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.error("{} (suppressed {} similar errors): {}", context, suppressed, ex.getMessage());
            } else {
                log.error("{}: {}", context, ex.getMessage());
            }
        } else {
            suppressedErrorLogs.increment();
        }
    }

    // ---- Introspection ----

    public long sentOkTotal() { return sentOk.sum(); }
    public long sentFailTotal() { return sentFail.sum(); }

    @Override
    public String id() {
        return "kafka:" + topic;
    }

    // ---- Lifecycle ----

    @Override
    public void close() {
        log.info("Closing KafkaSink (topic={})...", topic);
        try {
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("KafkaSink close failed", e);
        }
    }
}
