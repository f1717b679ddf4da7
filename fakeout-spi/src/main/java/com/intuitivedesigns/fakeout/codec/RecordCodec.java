/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serialises batches of {@link SyntheticRecord}s.
 *
 * <p>Dates are written as ISO strings, nulls as JSON {@code null} or empty CSV cells.
 * Instances are immutable and thread-safe; share {@link #shared()}.</p>
 */
public final class RecordCodec {

    private static final RecordCodec SHARED = new RecordCodec();

    private final ObjectMapper json;
    private final CsvMapper csv;

    public RecordCodec() {
        this.json = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        final CsvMapper csvMapper = new CsvMapper();
        csvMapper.registerModule(new JavaTimeModule());
        csvMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.csv = csvMapper;
    }

    public static RecordCodec shared() {
        return SHARED;
    }

    /**
     * Artifact encoding: pretty-printed JSON array, or CSV with a header row.
     */
    public byte[] encode(List<SyntheticRecord> batch, RecordFormat format) throws JsonProcessingException {
        Objects.requireNonNull(format, "format");
        final List<Map<String, Object>> rows = rows(batch);

        switch (format) {
            case JSON:
                return json.writerWithDefaultPrettyPrinter().writeValueAsBytes(rows);
            case CSV:
                return csv.writer(csvSchema(rows)).writeValueAsBytes(rows);
            default:
                throw new IllegalArgumentException("Unsupported format " + format);
        }
    }

    /**
     * Message encoding: the whole batch as one compact JSON array.
     */
    public String encodeMessage(List<SyntheticRecord> batch) throws JsonProcessingException {
        return json.writeValueAsString(rows(batch));
    }

    public ObjectMapper jsonMapper() {
        return json;
    }

    private static List<Map<String, Object>> rows(List<SyntheticRecord> batch) {
        Objects.requireNonNull(batch, "batch");
        final List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (SyntheticRecord r : batch) {
            rows.add(r.asMap());
        }
        return rows;
    }

    private static CsvSchema csvSchema(List<Map<String, Object>> rows) {
        final CsvSchema.Builder builder = CsvSchema.builder().setUseHeader(true);
        if (!rows.isEmpty()) {
            for (String column : rows.get(0).keySet()) {
                builder.addColumn(column);
            }
        }
        return builder.build();
    }
}
