/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.app;

import com.intuitivedesigns.fakeout.config.ConfigException;
import com.intuitivedesigns.fakeout.config.ConfigLoader;
import com.intuitivedesigns.fakeout.config.FakeoutConfig;
import com.intuitivedesigns.fakeout.config.PipelineFactory;
import com.intuitivedesigns.fakeout.config.RuntimeSettings;
import com.intuitivedesigns.fakeout.core.Coordinator;
import com.intuitivedesigns.fakeout.core.CoordinatorHandle;
import com.intuitivedesigns.fakeout.core.CoordinatorOptions;
import com.intuitivedesigns.fakeout.core.PipelineStats;
import com.intuitivedesigns.fakeout.metrics.MetricsFactory;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import com.intuitivedesigns.fakeout.metrics.MetricsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

public final class FakeoutApp {

    private static final Logger log = LoggerFactory.getLogger(FakeoutApp.class);

    // --- Config path sources, in precedence order after argv[0] ---
    static final String PROP_CONFIG_PATH = "fakeout.config.path";
    static final String ENV_CONFIG_PATH = "FAKEOUT_CONFIG_PATH";
    static final String DEFAULT_CONFIG_PATH = "config.json";

    // --- Exit codes ---
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_CONFIG = 2;

    private FakeoutApp() {}

    public static void main(String[] args) {
        final int status = run(args, System::getProperty, System::getenv);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Boots the coordinator and blocks until the run duration elapses or the JVM is
     * asked to shut down.
     *
     * @return process exit status
     */
    static int run(String[] args, UnaryOperator<String> properties, UnaryOperator<String> environment) {
        log.info("=== Booting FakeOut ===");

        MetricsRuntime metrics = null;
        CoordinatorHandle handle = null;
        ScheduledExecutorService statusScheduler = null;
        Thread hook = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Load and validate configuration
            final Path configPath = resolveConfigPath(args, properties, environment);
            log.info("Loading configuration from {}", configPath.toAbsolutePath());
            final FakeoutConfig config = ConfigLoader.load(configPath);
            final RuntimeSettings runtime = new RuntimeSettings(config.runtime());

            log.info("CONFIG: streaming={} (max {}) | batch={} (max {}) | shutdown={}ms | duration={}",
                    config.streaming().size(), runtime.maxStreaming(),
                    config.batch().size(), runtime.maxBatch(),
                    runtime.shutdownTimeout().toMillis(),
                    runtime.runDuration().isZero() ? "until signalled" : runtime.runDuration().getSeconds() + "s");

            // 2. Initialize Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config.runtime()));

            // 3. Sinks (SPI) and coordinator
            final PipelineFactory sinks = new PipelineFactory();
            sinks.logAvailablePlugins();

            handle = Coordinator.start(config, CoordinatorOptions.builder()
                    .sinkFactory(sinks)
                    .metrics(metrics)
                    .build());

            // 4. Status line
            final Duration statusInterval = runtime.statusInterval();
            if (!statusInterval.isZero()) {
                statusScheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("fakeout-status"));
                startStatusLog(statusScheduler, handle, statusInterval);
            }

            // 5. Shutdown hook
            final CoordinatorHandle finalHandle = handle;
            final MetricsRuntime finalMetrics = metrics;
            final ScheduledExecutorService finalStatusScheduler = statusScheduler;
            hook = new Thread(() -> {
                log.info("Shutdown signal received.");
                shutdown(shutdownStarted, finalStatusScheduler, finalHandle, finalMetrics);
                shutdownLatch.countDown();
            }, "fakeout-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            // 6. Run
            final Duration duration = runtime.runDuration();
            if (duration.isZero()) {
                shutdownLatch.await();
            } else if (!shutdownLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Run duration of {}s elapsed", duration.getSeconds());
                shutdown(shutdownStarted, statusScheduler, handle, metrics);
                logStatus(handle);
            }
            removeHook(hook);
            return EXIT_OK;
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage(), e);
            shutdown(shutdownStarted, statusScheduler, handle, metrics);
            removeHook(hook);
            return EXIT_CONFIG;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(shutdownStarted, statusScheduler, handle, metrics);
            removeHook(hook);
            return EXIT_OK;
        } catch (Throwable t) {
            log.error("Fatal application error", t);
            shutdown(shutdownStarted, statusScheduler, handle, metrics);
            removeHook(hook);
            return EXIT_FATAL;
        }
    }

    static Path resolveConfigPath(String[] args, UnaryOperator<String> properties, UnaryOperator<String> environment) {
        if (args != null && args.length > 0 && !isBlank(args[0])) {
            return Path.of(args[0].trim());
        }
        final String prop = properties.apply(PROP_CONFIG_PATH);
        if (!isBlank(prop)) {
            return Path.of(prop.trim());
        }
        final String env = environment.apply(ENV_CONFIG_PATH);
        if (!isBlank(env)) {
            return Path.of(env.trim());
        }
        return Path.of(DEFAULT_CONFIG_PATH);
    }

    private static void shutdown(AtomicBoolean started,
                                 ScheduledExecutorService statusScheduler,
                                 CoordinatorHandle handle,
                                 MetricsRuntime metrics) {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            if (statusScheduler != null) {
                statusScheduler.shutdownNow();
            }
            if (handle != null) {
                handle.stop();
            }
        } finally {
            closeQuietly(metrics);
        }
    }

    private static void removeHook(Thread hook) {
        if (hook == null) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook runs on its own
            log.debug("Shutdown hook not removed: {}", e.getMessage());
        }
    }

    private static void startStatusLog(ScheduledExecutorService scheduler, CoordinatorHandle handle, Duration interval) {
        log.info("Status log active ({}s window)", interval.getSeconds());
        final long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                logStatus(handle);
            } catch (Throwable t) {
                log.warn("Status log error", t);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private static void logStatus(CoordinatorHandle handle) {
        for (Map.Entry<String, PipelineStats> e : handle.stats().entrySet()) {
            final PipelineStats s = e.getValue();
            log.info("pipeline={} kind={} state={} ticks={} delivered={} failed={} overruns={} records={} artifacts={}",
                    s.pipeline(), s.kind(), s.state(), s.ticksStarted(), s.delivered(), s.failures(),
                    s.overruns(), s.recordsGenerated(), handle.artifacts(e.getKey()).size());
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed closing {}", resource.getClass().getSimpleName(), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
