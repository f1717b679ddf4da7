/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.config.BatchPipelineConfig;
import com.intuitivedesigns.fakeout.config.ConfigException;
import com.intuitivedesigns.fakeout.config.ConfigValidator;
import com.intuitivedesigns.fakeout.config.FakeoutConfig;
import com.intuitivedesigns.fakeout.config.PipelineConfig;
import com.intuitivedesigns.fakeout.config.RuntimeSettings;
import com.intuitivedesigns.fakeout.synth.RecordSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Starts one execution unit per configured pipeline plus the retention sweeper, each
 * on its own platform thread, and returns a handle that controls their lifetime.
 *
 * <p>The coordinator owns the artifact ledger; runners and the sweeper only reach it
 * through {@link ArtifactRegistry}.</p>
 */
public final class Coordinator {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private Coordinator() {}

    public static CoordinatorHandle start(FakeoutConfig config) {
        return start(config, CoordinatorOptions.defaults());
    }

    /**
     * @throws ConfigException if validation or sink creation fails; nothing is left running
     */
    public static CoordinatorHandle start(FakeoutConfig config, CoordinatorOptions options) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(options, "options");

        ConfigValidator.validate(config);
        final RuntimeSettings runtime = new RuntimeSettings(config.runtime());

        final Map<PipelineConfig, RecordSink> sinks = createSinks(config, options);

        final ArtifactTracker tracker = new ArtifactTracker();
        final StopSignal stop = new StopSignal();
        final TickTimer timer = options.timer();

        final List<PipelineRunner> runners = new ArrayList<>(sinks.size());
        final List<RetentionSweeper.Target> targets = new ArrayList<>();
        for (Map.Entry<PipelineConfig, RecordSink> e : sinks.entrySet()) {
            final PipelineConfig p = e.getKey();
            runners.add(new PipelineRunner(p, e.getValue(), synthesizer(p, timer, options.seed()),
                    tracker, timer, stop, options.metrics()));
            if (p instanceof BatchPipelineConfig b && b.cleanupEnabled()) {
                targets.add(new RetentionSweeper.Target(b.name(), b.cleanupAfter(), e.getValue()));
                recoverArtifacts(b.name(), e.getValue(), tracker);
            }
        }

        final SweepLanes lanes = options.newSweepLanes();
        final RetentionSweeper sweeper = targets.isEmpty()
                ? null
                : new RetentionSweeper(targets, tracker, timer, stop, runtime.sweepInterval(), lanes, options.metrics());

        final CoordinatorHandle handle = new CoordinatorHandle(runners, sweeper, tracker, stop, lanes, runtime.shutdownTimeout());
        handle.startAll();

        log.info("Coordinator started streaming={} batch={} sweeper={}",
                config.streaming().size(), config.batch().size(),
                sweeper == null ? "off" : "period=" + sweeper.period());
        return handle;
    }

    private static Map<PipelineConfig, RecordSink> createSinks(FakeoutConfig config, CoordinatorOptions options) {
        final Map<PipelineConfig, RecordSink> sinks = new LinkedHashMap<>();
        try {
            for (PipelineConfig p : config.pipelines()) {
                sinks.put(p, options.sinkFactory().create(p, options.metrics()));
            }
            return sinks;
        } catch (RuntimeException e) {
            for (Map.Entry<PipelineConfig, RecordSink> created : sinks.entrySet()) {
                CoordinatorHandle.closeQuietly(created.getKey().name(), created.getValue());
            }
            if (e instanceof ConfigException ce) throw ce;
            throw new ConfigException("Sink creation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Tracks files left by an earlier run so the sweeper expires them by the time encoded
     * in their names. A failed listing only costs the leftovers.
     */
    static int recoverArtifacts(String pipeline, RecordSink sink, ArtifactRegistry registry) {
        final List<ArtifactLocation> locations;
        try {
            locations = sink.existingArtifacts(pipeline);
        } catch (IOException | RuntimeException e) {
            log.warn("pipeline={} could not list existing artifacts on {}; leftovers stay untracked",
                    pipeline, sink.id(), e);
            return 0;
        }

        final List<Artifact> recovered = new ArrayList<>(locations.size());
        for (ArtifactLocation location : locations) {
            final String uri = location.uri();
            ArtifactNames.parse(pipeline, uri.substring(uri.lastIndexOf('/') + 1))
                    .ifPresent(createdAt -> recovered.add(Artifact.of(pipeline, createdAt, location)));
        }
        recovered.sort(Comparator.comparing(Artifact::createdAt));
        for (Artifact a : recovered) {
            registry.register(a);
        }
        if (!recovered.isEmpty()) {
            log.info("pipeline={} tracking {} artifact(s) from a previous run", pipeline, recovered.size());
        }
        return recovered.size();
    }

    private static RecordSynthesizer synthesizer(PipelineConfig p, TickTimer timer, Long seed) {
        return (seed == null)
                ? new RecordSynthesizer(timer.clock())
                : new RecordSynthesizer(timer.clock(), seed * 31 + p.name().hashCode());
    }
}
