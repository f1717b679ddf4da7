/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import com.intuitivedesigns.fakeout.core.RecordSink;
import com.intuitivedesigns.fakeout.core.SinkFactory;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import com.intuitivedesigns.fakeout.spi.ServicePluginRegistry;
import com.intuitivedesigns.fakeout.spi.SinkContext;
import com.intuitivedesigns.fakeout.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves {@code connection.service} to a {@link SinkPlugin} discovered through
 * {@link java.util.ServiceLoader} and creates the pipeline's sink.
 */
public final class PipelineFactory implements SinkFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private static final String KEY_SERVICE = "connection.service";

    private final ServicePluginRegistry<SinkPlugin> sinks;

    public PipelineFactory() {
        this(resolveClassLoader());
    }

    public PipelineFactory(ClassLoader cl) {
        this.sinks = new ServicePluginRegistry<>(SinkPlugin.class, SinkPlugin::id, cl);
    }

    public PipelineFactory(Iterable<SinkPlugin> plugins) {
        this.sinks = new ServicePluginRegistry<>(SinkPlugin.class, SinkPlugin::id, plugins);
    }

    @Override
    public RecordSink create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final SinkPlugin plugin;
        try {
            plugin = sinks.require(config.sink().service(), KEY_SERVICE);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Pipeline '" + config.name() + "': " + e.getMessage(), e);
        }

        if (!plugin.kinds().contains(config.kind())) {
            throw new ConfigException("Pipeline '" + config.name() + "': sink " + plugin.id()
                    + " cannot serve " + config.kind().id() + " pipelines (supports " + plugin.kinds() + ")");
        }

        final SinkContext context = new SinkContext(
                config.name(),
                config.kind(),
                (config instanceof BatchPipelineConfig b) ? b.filetype() : null,
                config.sink().connection());

        final RecordSink sink = createSafe(plugin, context, metrics);
        log.info("pipeline={} sink={} created", config.name(), sink.id());
        return sink;
    }

    public void logAvailablePlugins() {
        log.info("Sink plugins loaded: {}", sinks.availableIds());
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineFactory.class.getClassLoader();
    }

    private static RecordSink createSafe(SinkPlugin plugin, SinkContext context, MetricsRuntime metrics) {
        try {
            final RecordSink sink = plugin.create(context, metrics);
            if (sink == null) {
                throw new ConfigException("Sink plugin [" + plugin.id() + "] returned null for " + context.owner());
            }
            return sink;
        } catch (ConfigException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigException("Failed creating sink [" + plugin.id() + "] for " + context.owner() + ": " + e.getMessage(), e);
        }
    }
}
