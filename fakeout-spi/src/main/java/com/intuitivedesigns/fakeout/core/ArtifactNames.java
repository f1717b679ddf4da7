/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.codec.RecordFormat;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * File naming shared by the storage sinks: {@code <pipeline>_<yyyyMMdd'T'HHmmss.SSSSSS'Z'>.<ext>}.
 */
public final class ArtifactNames {

    public static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private ArtifactNames() {}

    public static String stem(String pipelineName, Instant at) {
        Objects.requireNonNull(pipelineName, "pipelineName");
        Objects.requireNonNull(at, "at");
        return pipelineName + "_" + STAMP.format(at);
    }

    public static String fileName(String pipelineName, Instant at, RecordFormat format) {
        Objects.requireNonNull(format, "format");
        return stem(pipelineName, at) + "." + format.extension();
    }

    /**
     * Reads the creation time back out of a name produced by {@link #fileName}.
     *
     * @return empty unless {@code fileName} is exactly {@code <pipelineName>_<stamp>.<ext>}
     *         with a known extension
     */
    public static Optional<Instant> parse(String pipelineName, String fileName) {
        Objects.requireNonNull(pipelineName, "pipelineName");
        if (fileName == null) return Optional.empty();

        final String prefix = pipelineName + "_";
        final int dot = fileName.lastIndexOf('.');
        if (!fileName.startsWith(prefix) || dot <= prefix.length()) return Optional.empty();

        final String ext = fileName.substring(dot + 1);
        boolean known = false;
        for (RecordFormat f : RecordFormat.values()) {
            if (f.extension().equals(ext)) known = true;
        }
        if (!known) return Optional.empty();

        try {
            return Optional.of(Instant.from(STAMP.parse(fileName.substring(prefix.length(), dot))));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
