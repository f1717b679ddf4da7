/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class RetentionSweeperTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration RETENTION = Duration.ofSeconds(60);

    private final ArtifactTracker tracker = new ArtifactTracker();
    private final StopSignal stop = new StopSignal();
    private final RecordingSink sink = RecordingSink.batch(Clock.fixed(T0, ZoneOffset.UTC));

    private RetentionSweeper sweeper(SweepLanes lanes) {
        return new RetentionSweeper(List.of(new RetentionSweeper.Target("files", RETENTION, sink)),
                tracker, new SystemTickTimer(), stop, Duration.ofSeconds(5), lanes, MetricsRuntime.NOOP);
    }

    private Artifact registered(String file, Instant at) {
        Artifact a = Artifact.of("files", at, new ArtifactLocation("mem://files/" + file));
        tracker.register(a);
        return a;
    }

    @Test
    void testArtifactPresentBeforeRetentionAndGoneAtRetention() {
        RetentionSweeper sweeper = sweeper(SweepLanes.inline());
        Artifact a = registered("a.json", T0);

        sweeper.sweep(T0.plusSeconds(30));
        sweeper.sweep(T0.plusMillis(59_999));
        assertEquals(List.of(a), tracker.live("files"));
        assertTrue(sink.deleted().isEmpty());

        sweeper.sweep(T0.plusSeconds(60));
        assertTrue(tracker.live("files").isEmpty());
        assertEquals(List.of(a.location()), sink.deleted());
        assertEquals(1, sweeper.deleted());
    }

    @Test
    void testFailedDeleteKeepsArtifactForNextSweep() {
        RetentionSweeper sweeper = sweeper(SweepLanes.inline());
        Artifact a = registered("a.json", T0);

        sink.failDeletes(true);
        sweeper.sweep(T0.plusSeconds(61));
        assertEquals(List.of(a), tracker.live("files"));
        assertEquals(1, sweeper.deleteFailures());

        sink.failDeletes(false);
        sweeper.sweep(T0.plusSeconds(66));
        assertTrue(tracker.live("files").isEmpty());
        assertEquals(1, sweeper.deleted());
    }

    @Test
    void testBusyLaneIsSkipped() {
        ManualLanes lanes = new ManualLanes();
        RetentionSweeper sweeper = sweeper(lanes);
        registered("a.json", T0);

        sweeper.sweep(T0.plusSeconds(60));
        sweeper.sweep(T0.plusSeconds(65));
        assertEquals(1, lanes.queued.size());

        lanes.runAll();
        assertTrue(tracker.live("files").isEmpty());

        registered("b.json", T0.plusSeconds(10));
        sweeper.sweep(T0.plusSeconds(70));
        assertEquals(1, lanes.queued.size());
    }

    @Test
    void testBlockedDeleteOnOnePipelineDoesNotHoldBackAnother() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        RecordingSink slow = RecordingSink.batch(Clock.fixed(T0, ZoneOffset.UTC)).blockDeletesOn(gate);
        RecordingSink fast = RecordingSink.batch(Clock.fixed(T0, ZoneOffset.UTC));
        SweepLanes lanes = SweepLanes.threaded();
        RetentionSweeper sweeper = new RetentionSweeper(List.of(
                new RetentionSweeper.Target("slow", RETENTION, slow),
                new RetentionSweeper.Target("fast", RETENTION, fast)),
                tracker, new SystemTickTimer(), stop, Duration.ofSeconds(5), lanes, MetricsRuntime.NOOP);

        try {
            Artifact stuck = Artifact.of("slow", T0, new ArtifactLocation("mem://slow/a.json"));
            Artifact first = Artifact.of("fast", T0, new ArtifactLocation("mem://fast/a.json"));
            tracker.register(stuck);
            tracker.register(first);

            sweeper.sweep(T0.plusSeconds(60));
            awaitDeleted(fast, first.location());

            Artifact second = Artifact.of("fast", T0.plusSeconds(5), new ArtifactLocation("mem://fast/b.json"));
            tracker.register(second);
            sweeper.sweep(T0.plusSeconds(65));
            awaitDeleted(fast, second.location());

            assertTrue(tracker.live("fast").isEmpty());
            assertEquals(List.of(stuck), tracker.live("slow"));
            assertTrue(slow.deleted().isEmpty());
            assertEquals(1, sweeper.skippedBusy());
        } finally {
            gate.countDown();
            lanes.close();
        }
    }

    private static void awaitDeleted(RecordingSink sink, ArtifactLocation location) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!sink.deleted().contains(location) && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(sink.deleted().contains(location), sink.deleted().toString());
    }

    @Test
    void testPeriodNeverExceedsSmallestRetention() {
        List<RetentionSweeper.Target> targets = List.of(
                new RetentionSweeper.Target("a", Duration.ofSeconds(60), sink),
                new RetentionSweeper.Target("b", Duration.ofSeconds(2), sink));

        assertEquals(Duration.ofSeconds(2), RetentionSweeper.periodFor(targets, Duration.ofSeconds(5)));
        assertEquals(Duration.ofSeconds(1), RetentionSweeper.periodFor(targets, Duration.ofSeconds(1)));
    }

    @Test
    void testTargetRequiresPositiveRetention() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionSweeper.Target("a", Duration.ZERO, sink));
    }

    /** Queues sweeps until the test runs them. */
    private static final class ManualLanes extends SweepLanes {
        final Deque<Runnable> queued = new ArrayDeque<>();

        @Override
        public Executor lane(String pipeline) {
            return queued::add;
        }

        void runAll() {
            while (!queued.isEmpty()) queued.poll().run();
        }

        @Override
        public List<String> shutdown(Duration wait) {
            return List.of();
        }
    }
}
