/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.contrib.nio.testing.LocalStorageHelper;
import com.intuitivedesigns.fakeout.codec.RecordCodec;
import com.intuitivedesigns.fakeout.codec.RecordFormat;
import com.intuitivedesigns.fakeout.config.ConfigException;
import com.intuitivedesigns.fakeout.config.PipelineKind;
import com.intuitivedesigns.fakeout.config.Settings;
import com.intuitivedesigns.fakeout.core.ArtifactLocation;
import com.intuitivedesigns.fakeout.core.SinkDeleteException;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import com.intuitivedesigns.fakeout.plugins.GcsSinkPlugin;
import com.intuitivedesigns.fakeout.spi.SinkContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GcsSinkTest {

    private static final Instant AT = Instant.parse("2024-11-01T09:30:00Z");

    private Storage storage;

    @BeforeEach
    void setUp() {
        storage = LocalStorageHelper.getOptions().getService();
    }

    private static List<SyntheticRecord> batch() {
        return List.of(
                new SyntheticRecord(AT, Map.of("site", "north")),
                new SyntheticRecord(AT, Map.of("site", "south")),
                new SyntheticRecord(AT, Map.of("site", "east")));
    }

    private GcsSink sink(String folder, RecordFormat format) {
        return new GcsSink(storage, "fakeout-bucket", folder, format, Clock.fixed(AT, ZoneOffset.UTC));
    }

    @Test
    void testUploadsUnderFolderWithContentType() throws Exception {
        GcsSink sink = sink("/exports/", RecordFormat.JSON);

        ArtifactLocation loc = sink.deliver("batch_1", batch()).orElseThrow();

        assertEquals("gs://fakeout-bucket/exports/batch_1_20241101T093000.000000Z.json", loc.uri());
        Blob blob = storage.get(BlobId.of("fakeout-bucket", "exports/batch_1_20241101T093000.000000Z.json"));
        assertNotNull(blob);
        assertEquals("application/json", blob.getContentType());

        JsonNode rows = RecordCodec.shared().jsonMapper().readTree(blob.getContent());
        assertEquals(3, rows.size());
        assertEquals("south", rows.get(1).get("site").asText());
    }

    @Test
    void testCsvObjectHasHeader() throws Exception {
        GcsSink sink = sink("", RecordFormat.CSV);

        ArtifactLocation loc = sink.deliver("batch_2", batch()).orElseThrow();

        assertEquals("gs://fakeout-bucket/batch_2_20241101T093000.000000Z.csv", loc.uri());
        Blob blob = storage.get(BlobId.of("fakeout-bucket", "batch_2_20241101T093000.000000Z.csv"));
        assertEquals("text/csv", blob.getContentType());
        String text = new String(blob.getContent(), StandardCharsets.UTF_8);
        assertTrue(text.startsWith("datetime,site"), text);
    }

    @Test
    void testDeleteIsIdempotent() throws Exception {
        GcsSink sink = sink("exports", RecordFormat.JSON);
        ArtifactLocation loc = sink.deliver("batch_1", batch()).orElseThrow();

        sink.delete(loc);
        assertNull(storage.get(sink.toBlobId(loc)));

        assertDoesNotThrow(() -> sink.delete(loc));
    }

    @Test
    void testDeleteRejectsForeignLocation() {
        GcsSink sink = sink("exports", RecordFormat.JSON);
        assertThrows(SinkDeleteException.class,
                () -> sink.delete(new ArtifactLocation("gs://other-bucket/exports/x.json")));
        assertThrows(SinkDeleteException.class,
                () -> sink.delete(new ArtifactLocation("/tmp/x.json")));
    }

    @Test
    void testExistingArtifactsListsOnlyThisPipelinesObjects() throws Exception {
        GcsSink sink = sink("exports", RecordFormat.JSON);
        ArtifactLocation own = sink.deliver("batch", batch()).orElseThrow();
        sink.deliver("batch_1", batch());
        sink("", RecordFormat.JSON).deliver("batch", batch());
        storage.create(BlobInfo.newBuilder(BlobId.of("fakeout-bucket", "exports/batch_readme.txt")).build(),
                "keep".getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of(own), sink.existingArtifacts("batch"));
        assertEquals(1, sink.existingArtifacts("batch_1").size());
    }

    @Test
    void testPluginRequiresBucket() {
        GcsSinkPlugin plugin = new GcsSinkPlugin();
        assertEquals("GOOGLE_CLOUD_STORAGE", plugin.id());
        assertFalse(plugin.kinds().contains(PipelineKind.STREAMING));

        SinkContext ctx = new SinkContext("batch_1", PipelineKind.BATCH, RecordFormat.JSON,
                Settings.of(Map.of("folder_path", "exports")));
        ConfigException ex = assertThrows(ConfigException.class, () -> plugin.create(ctx, MetricsRuntime.NOOP));
        assertTrue(ex.getMessage().contains("bucket_name"));
    }
}
