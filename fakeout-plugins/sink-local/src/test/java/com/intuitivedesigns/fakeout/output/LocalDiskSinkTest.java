/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.fakeout.codec.RecordCodec;
import com.intuitivedesigns.fakeout.codec.RecordFormat;
import com.intuitivedesigns.fakeout.config.ConfigException;
import com.intuitivedesigns.fakeout.config.PipelineKind;
import com.intuitivedesigns.fakeout.config.Settings;
import com.intuitivedesigns.fakeout.core.ArtifactLocation;
import com.intuitivedesigns.fakeout.core.RecordSink;
import com.intuitivedesigns.fakeout.core.SinkDeleteException;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;
import com.intuitivedesigns.fakeout.metrics.MetricsRuntime;
import com.intuitivedesigns.fakeout.plugins.LocalSinkPlugin;
import com.intuitivedesigns.fakeout.spi.SinkContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LocalDiskSinkTest {

    private static final Instant AT = Instant.parse("2024-11-01T09:30:00Z");
    private static final Clock CLOCK = Clock.fixed(AT, ZoneOffset.UTC);

    @TempDir
    Path dir;

    private static List<SyntheticRecord> batch() {
        return List.of(
                new SyntheticRecord(AT, Map.of("site", "north", "count", 3L)),
                new SyntheticRecord(AT, Map.of("site", "south", "count", 4L)));
    }

    @Test
    void testDeliverWritesNamedFileAndNoTempLeftovers() throws Exception {
        Path folder = dir.resolve("public");
        LocalDiskSink sink = new LocalDiskSink(folder, RecordFormat.JSON, CLOCK);

        ArtifactLocation loc = sink.deliver("batch_1", batch()).orElseThrow();

        Path file = folder.resolve("batch_1_20241101T093000.000000Z.json");
        assertTrue(Files.isRegularFile(file));
        assertEquals(file.toUri().toString(), loc.uri());

        JsonNode rows = RecordCodec.shared().jsonMapper().readTree(file.toFile());
        assertEquals(2, rows.size());
        assertEquals(4, rows.get(1).get("count").asInt());

        try (Stream<Path> files = Files.list(folder)) {
            assertEquals(1, files.count(), "temp file must be moved into place");
        }
    }

    @Test
    void testCsvFormat() throws Exception {
        LocalDiskSink sink = new LocalDiskSink(dir, RecordFormat.CSV, CLOCK);

        sink.deliver("batch_2", batch());

        List<String> lines = Files.readAllLines(dir.resolve("batch_2_20241101T093000.000000Z.csv"));
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("datetime,"), lines.get(0));
    }

    @Test
    void testDeleteIsIdempotent() throws Exception {
        LocalDiskSink sink = new LocalDiskSink(dir, RecordFormat.JSON, CLOCK);
        ArtifactLocation loc = sink.deliver("batch_1", batch()).orElseThrow();

        sink.delete(loc);
        assertFalse(Files.exists(sink.toPath(loc)));
        assertDoesNotThrow(() -> sink.delete(loc));
    }

    @Test
    void testDeleteRefusesFilesOutsideFolder() throws Exception {
        LocalDiskSink sink = new LocalDiskSink(dir.resolve("a"), RecordFormat.JSON, CLOCK);
        Path foreign = Files.writeString(dir.resolve("keep.json"), "[]");

        assertThrows(SinkDeleteException.class, () -> sink.delete(new ArtifactLocation(foreign.toUri().toString())));
        assertThrows(SinkDeleteException.class, () -> sink.delete(new ArtifactLocation("gs://bucket/keep.json")));
        assertTrue(Files.exists(foreign));
    }

    @Test
    void testExistingArtifactsListsOnlyThisPipelinesFiles() throws Exception {
        LocalDiskSink sink = new LocalDiskSink(dir, RecordFormat.JSON, CLOCK);
        ArtifactLocation own = sink.deliver("batch", batch()).orElseThrow();
        new LocalDiskSink(dir, RecordFormat.JSON, CLOCK).deliver("batch_1", batch());
        Files.writeString(dir.resolve(".batch_inflight.tmp"), "partial");
        Files.writeString(dir.resolve("batch_notes.txt"), "keep");
        Files.createDirectory(dir.resolve("batch_20241101T093000.000000Z.json.d"));

        List<ArtifactLocation> found = sink.existingArtifacts("batch");

        assertEquals(List.of(own), found);
        sink.delete(found.get(0));
        assertTrue(Files.exists(dir.resolve("batch_notes.txt")));
        assertTrue(sink.existingArtifacts("batch").isEmpty());
        assertEquals(1, sink.existingArtifacts("batch_1").size());
    }

    @Test
    void testFileServerListsAndServesExports() throws Exception {
        try (LocalDiskSink sink = new LocalDiskSink(dir, RecordFormat.JSON, CLOCK, 0, "batch_1")) {
            sink.deliver("batch_1", batch());
            Files.writeString(dir.resolve(".batch_1_inflight.tmp"), "partial");

            HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
            String base = "http://localhost:" + sink.port();

            HttpResponse<String> listing = client.send(HttpRequest.newBuilder(URI.create(base + "/")).build(),
                    HttpResponse.BodyHandlers.ofString());
            assertEquals(200, listing.statusCode());
            JsonNode names = RecordCodec.shared().jsonMapper().readTree(listing.body());
            assertEquals(1, names.size());
            assertEquals("batch_1_20241101T093000.000000Z.json", names.get(0).asText());

            HttpResponse<String> file = client.send(
                    HttpRequest.newBuilder(URI.create(base + "/batch_1_20241101T093000.000000Z.json")).build(),
                    HttpResponse.BodyHandlers.ofString());
            assertEquals(200, file.statusCode());
            assertTrue(file.body().contains("north"));

            HttpResponse<String> hidden = client.send(
                    HttpRequest.newBuilder(URI.create(base + "/.batch_1_inflight.tmp")).build(),
                    HttpResponse.BodyHandlers.ofString());
            assertEquals(404, hidden.statusCode());

            HttpResponse<String> post = client.send(
                    HttpRequest.newBuilder(URI.create(base + "/")).POST(HttpRequest.BodyPublishers.noBody()).build(),
                    HttpResponse.BodyHandlers.ofString());
            assertEquals(405, post.statusCode());
        }
    }

    @Test
    void testPluginBuildsFromConnection() throws Exception {
        LocalSinkPlugin plugin = new LocalSinkPlugin();
        assertEquals("LOCAL", plugin.id());
        assertFalse(plugin.kinds().contains(PipelineKind.STREAMING));

        Path folder = dir.resolve("exports");
        SinkContext ctx = new SinkContext("batch_1", PipelineKind.BATCH, RecordFormat.CSV,
                Settings.of(Map.of("service", "local", "folder_path", folder.toString())));
        try (RecordSink sink = plugin.create(ctx, MetricsRuntime.NOOP)) {
            assertTrue(Files.isDirectory(folder));
            assertEquals(-1, ((LocalDiskSink) sink).port());
        }
    }

    @Test
    void testPluginRejectsBadPort() {
        SinkContext ctx = new SinkContext("batch_1", PipelineKind.BATCH, RecordFormat.JSON,
                Settings.of(Map.of("folder_path", dir.toString(), "port", "eighty")));
        ConfigException ex = assertThrows(ConfigException.class, () -> new LocalSinkPlugin().create(ctx, MetricsRuntime.NOOP));
        assertTrue(ex.getMessage().contains("port"));
    }
}
