/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.intuitivedesigns.fakeout.codec.RecordCodec;
import com.intuitivedesigns.fakeout.codec.RecordFormat;
import com.intuitivedesigns.fakeout.config.ConfigException;
import com.intuitivedesigns.fakeout.config.Settings;
import com.intuitivedesigns.fakeout.core.ArtifactLocation;
import com.intuitivedesigns.fakeout.core.ArtifactNames;
import com.intuitivedesigns.fakeout.core.RecordSink;
import com.intuitivedesigns.fakeout.core.SinkDeleteException;
import com.intuitivedesigns.fakeout.core.SinkDeliveryException;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;
import com.intuitivedesigns.fakeout.spi.SinkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Batch sink writing one file per tick into a local folder. Files appear
 * atomically: readers never observe a partially written export.
 */
public final class LocalDiskSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(LocalDiskSink.class);

    static final String KEY_FOLDER = "folder_path";
    static final String KEY_PORT = "port";

    private static final String DEFAULT_FOLDER = "public";

    private final Path folder;
    private final RecordFormat format;
    private final Clock clock;
    private final FolderHttpServer server;
    private final RecordCodec codec = RecordCodec.shared();

    public LocalDiskSink(Path folder, RecordFormat format, Clock clock) throws IOException {
        this(folder, format, clock, -1, "local");
    }

    /**
     * @param port {@code < 0} disables the file server, {@code 0} binds an ephemeral port
     */
    public LocalDiskSink(Path folder, RecordFormat format, Clock clock, int port, String owner) throws IOException {
        this.folder = Files.createDirectories(Objects.requireNonNull(folder, "folder")).toAbsolutePath().normalize();
        this.format = Objects.requireNonNull(format, "format");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.server = (port >= 0) ? FolderHttpServer.start(this.folder, port, owner) : null;
    }

    public static LocalDiskSink fromContext(SinkContext context) {
        final Settings conn = context.connection();
        final Path folder = Path.of(conn.getString(KEY_FOLDER, DEFAULT_FOLDER));
        final RecordFormat format = (context.format() != null) ? context.format() : RecordFormat.JSON;

        final int port;
        try {
            port = conn.hasPath(KEY_PORT) ? Integer.parseInt(conn.getString(KEY_PORT, "").trim()) : -1;
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid port '" + conn.getString(KEY_PORT, "") + "' for " + context.owner(), e);
        }
        if (port > 65535) {
            throw new ConfigException("Port " + port + " out of range for " + context.owner());
        }

        try {
            final LocalDiskSink sink = new LocalDiskSink(folder, format, Clock.systemUTC(), port, context.pipelineName());
            log.info("LocalDiskSink active. pipeline='{}' folder='{}' format={} http={}",
                    context.pipelineName(), sink.folder, format.extension(), (port >= 0) ? sink.port() : "off");
            return sink;
        } catch (IOException e) {
            throw new ConfigException("Cannot create folder_path '" + folder + "' for " + context.owner(), e);
        }
    }

    @Override
    public Optional<ArtifactLocation> deliver(String pipelineName, List<SyntheticRecord> batch) throws SinkDeliveryException {
        final String fileName = ArtifactNames.fileName(pipelineName, clock.instant(), format);
        final Path target = folder.resolve(fileName);

        final byte[] payload;
        try {
            payload = codec.encode(batch, format);
        } catch (JsonProcessingException e) {
            throw new SinkDeliveryException("Cannot encode batch for " + target, e);
        }

        Path tmp = null;
        try {
            tmp = Files.createTempFile(folder, "." + pipelineName + "_", ".tmp");
            Files.write(tmp, payload);
            moveIntoPlace(tmp, target);
            log.debug("pipeline={} wrote {} records to {}", pipelineName, batch.size(), target);
            return Optional.of(new ArtifactLocation(target.toUri().toString()));
        } catch (IOException e) {
            final SinkDeliveryException failure = new SinkDeliveryException("Cannot write " + target + ": " + e.getMessage(), e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void delete(ArtifactLocation location) throws SinkDeleteException {
        final Path file = toPath(location);
        try {
            if (!Files.deleteIfExists(file)) {
                log.debug("File already absent: {}", file);
            }
        } catch (IOException e) {
            throw new SinkDeleteException("Cannot delete " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ArtifactLocation> existingArtifacts(String pipelineName) throws IOException {
        final List<ArtifactLocation> found = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(folder, pipelineName + "_*")) {
            for (Path file : files) {
                if (Files.isRegularFile(file)
                        && ArtifactNames.parse(pipelineName, file.getFileName().toString()).isPresent()) {
                    found.add(new ArtifactLocation(file.toUri().toString()));
                }
            }
        }
        return found;
    }

    Path toPath(ArtifactLocation location) throws SinkDeleteException {
        final Path file;
        try {
            file = Path.of(URI.create(location.uri())).toAbsolutePath().normalize();
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            throw new SinkDeleteException("Not a local file location: " + location, e);
        }
        if (!folder.equals(file.getParent())) {
            throw new SinkDeleteException(id() + " does not own " + location);
        }
        return file;
    }

    public Path folder() {
        return folder;
    }

    /** Bound port of the file server, or -1 when it is off. */
    public int port() {
        return (server != null) ? server.port() : -1;
    }

    @Override
    public String id() {
        return "local:" + folder;
    }

    @Override
    public void close() {
        if (server != null) {
            server.close();
        }
    }
}
