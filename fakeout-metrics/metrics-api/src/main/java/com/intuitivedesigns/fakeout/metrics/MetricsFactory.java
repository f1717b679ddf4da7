/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        // Context classloader supports containers and shaded launchers.
        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, resolveClassLoader());

        for (MetricsProvider p : loader) {
            try {
                // Providers check settings.providerId and return null if they don't match.
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics Runtime initialized: {} ({})", p.id(), p.getClass().getName());
                    return rt;
                }
            } catch (Throwable t) {
                // Throwable, not Exception: a provider with missing dependencies fails with LinkageError.
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), t.getMessage());
                log.debug("Provider init stack trace:", t);
            }
        }

        log.info("Metrics disabled or no provider matches '{}' (NOOP active).", settings.providerId);
        return MetricsRuntime.NOOP;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
