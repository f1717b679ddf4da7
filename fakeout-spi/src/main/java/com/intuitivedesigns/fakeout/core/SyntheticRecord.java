/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.core;

import com.intuitivedesigns.fakeout.config.Schema;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One generated record.
 *
 * Design Principles:
 * - Immutability: produced once by the synthesizer, never mutated afterwards.
 * - Ordering: fields keep schema order; the timestamp key always comes first.
 * - Nulls: field values may be null (null injection), so the map is not a {@code Map.of} copy.
 *
 * @param generatedAt generation instant (sub-second precision)
 * @param fields      field name to value, in schema order
 */
public record SyntheticRecord(Instant generatedAt, Map<String, Object> fields) {

    /** {@code 20241101 093000 123456 +0000}: UTC, microseconds, explicit offset. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd HHmmss SSSSSS Z").withZone(ZoneOffset.UTC);

    public SyntheticRecord {
        Objects.requireNonNull(generatedAt, "generatedAt");
        fields = (fields == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String timestamp() {
        return TIMESTAMP_FORMAT.format(generatedAt);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Flattened view handed to codecs: the timestamp key followed by every field.
     */
    public Map<String, Object> asMap() {
        final Map<String, Object> out = new LinkedHashMap<>(fields.size() + 1);
        out.put(Schema.TIMESTAMP_KEY, timestamp());
        out.putAll(fields);
        return Collections.unmodifiableMap(out);
    }
}
