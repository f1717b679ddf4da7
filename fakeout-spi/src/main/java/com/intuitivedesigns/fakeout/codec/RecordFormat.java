/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.codec;

import com.intuitivedesigns.fakeout.config.ConfigException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Artifact encodings a batch pipeline can write ({@code filetype} in the config).
 */
public enum RecordFormat {
    JSON("json", "application/json"),
    CSV("csv", "text/csv");

    private final String extension;
    private final String contentType;

    RecordFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }

    public static RecordFormat fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigException("filetype must not be blank");
        }
        final String id = raw.trim().toLowerCase(Locale.ROOT);
        for (RecordFormat f : values()) {
            if (f.extension.equals(id)) return f;
        }
        throw new ConfigException("Unsupported filetype '" + raw + "'. Available options: "
                + Arrays.stream(values()).map(RecordFormat::extension).toList());
    }
}
