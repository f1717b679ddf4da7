/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.cloud.storage.StorageOptions;
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
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Batch sink writing one object per tick to a Google Cloud Storage bucket.
 * Locations are reported as {@code gs://<bucket>/<object>}.
 */
public final class GcsSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(GcsSink.class);

    static final String KEY_BUCKET = "bucket_name";
    static final String KEY_FOLDER = "folder_path";
    static final String KEY_PROJECT = "project_id";
    static final String KEY_CREDENTIALS = "credentials_path";

    private static final String SCHEME = "gs://";

    private final Storage storage;
    private final String bucket;
    private final String folder;
    private final RecordFormat format;
    private final Clock clock;
    private final RecordCodec codec = RecordCodec.shared();

    public GcsSink(Storage storage, String bucket, String folder, RecordFormat format, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.folder = trimSlashes(folder);
        this.format = Objects.requireNonNull(format, "format");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static GcsSink fromContext(SinkContext context) {
        final Settings conn = context.connection();
        final String bucket = conn.require(KEY_BUCKET, context.owner());
        final RecordFormat format = (context.format() != null) ? context.format() : RecordFormat.JSON;

        final StorageOptions.Builder options = StorageOptions.newBuilder();
        final String project = conn.getString(KEY_PROJECT, null);
        if (project != null && !project.isBlank()) {
            options.setProjectId(project.trim());
        }
        final String credentials = conn.getString(KEY_CREDENTIALS, null);
        if (credentials != null && !credentials.isBlank()) {
            options.setCredentials(loadCredentials(Path.of(credentials.trim()), context));
        }

        log.info("GcsSink active. pipeline='{}' bucket='{}' folder='{}' format={}",
                context.pipelineName(), bucket, conn.getString(KEY_FOLDER, ""), format.extension());
        return new GcsSink(options.build().getService(), bucket, conn.getString(KEY_FOLDER, ""), format, Clock.systemUTC());
    }

    private static GoogleCredentials loadCredentials(Path path, SinkContext context) {
        try (InputStream in = Files.newInputStream(path)) {
            return GoogleCredentials.fromStream(in);
        } catch (IOException e) {
            throw new ConfigException("Cannot read credentials_path '" + path + "' for " + context.owner(), e);
        }
    }

    @Override
    public Optional<ArtifactLocation> deliver(String pipelineName, List<SyntheticRecord> batch) throws SinkDeliveryException {
        final String objectName = objectName(ArtifactNames.fileName(pipelineName, clock.instant(), format));
        final String uri = SCHEME + bucket + "/" + objectName;

        try {
            final byte[] payload = codec.encode(batch, format);
            final BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, objectName))
                    .setContentType(format.contentType())
                    .build();
            storage.create(blobInfo, payload);
            log.debug("pipeline={} uploaded {} records ({} bytes) to {}", pipelineName, batch.size(), payload.length, uri);
            return Optional.of(new ArtifactLocation(uri));
        } catch (JsonProcessingException e) {
            throw new SinkDeliveryException("Cannot encode batch for " + uri, e);
        } catch (StorageException e) {
            throw new SinkDeliveryException("Upload to " + uri + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(ArtifactLocation location) throws SinkDeleteException {
        final BlobId blobId = toBlobId(location);
        try {
            if (!storage.delete(blobId)) {
                log.debug("Object already absent: {}", location);
            }
        } catch (StorageException e) {
            throw new SinkDeleteException("Delete of " + location + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ArtifactLocation> existingArtifacts(String pipelineName) throws IOException {
        final String prefix = objectName(pipelineName + "_");
        final List<ArtifactLocation> found = new ArrayList<>();
        try {
            for (Blob blob : storage.list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll()) {
                final String name = blob.getName();
                final String file = name.substring(name.lastIndexOf('/') + 1);
                if (name.equals(objectName(file)) && ArtifactNames.parse(pipelineName, file).isPresent()) {
                    found.add(new ArtifactLocation(SCHEME + bucket + "/" + name));
                }
            }
        } catch (StorageException e) {
            throw new IOException("Listing " + SCHEME + bucket + "/" + prefix + " failed: " + e.getMessage(), e);
        }
        return found;
    }

    BlobId toBlobId(ArtifactLocation location) throws SinkDeleteException {
        final String uri = location.uri();
        final String prefix = SCHEME + bucket + "/";
        if (!uri.startsWith(prefix) || uri.length() == prefix.length()) {
            throw new SinkDeleteException(id() + " does not own " + location);
        }
        return BlobId.of(bucket, uri.substring(prefix.length()));
    }

    private String objectName(String fileName) {
        return folder.isEmpty() ? fileName : folder + "/" + fileName;
    }

    private static String trimSlashes(String folder) {
        if (folder == null) return "";
        String f = folder.trim();
        while (f.startsWith("/")) f = f.substring(1);
        while (f.endsWith("/")) f = f.substring(0, f.length() - 1);
        return f;
    }

    @Override
    public String id() {
        return "gcs:" + bucket;
    }

    @Override
    public void close() throws Exception {
        if (storage instanceof AutoCloseable) {
            storage.close();
        }
    }
}
