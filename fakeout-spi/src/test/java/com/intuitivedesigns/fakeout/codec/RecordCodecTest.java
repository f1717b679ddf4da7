/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.fakeout.config.ConfigException;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    private static final Instant AT = Instant.parse("2024-11-01T09:30:00.123456Z");

    private static SyntheticRecord record(String site, Object reading) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("site", site);
        f.put("reading", reading);
        f.put("day", LocalDate.of(2023, 5, 17));
        f.put("seen", LocalDateTime.of(2023, 5, 17, 8, 15, 0));
        return new SyntheticRecord(AT, f);
    }

    private final RecordCodec codec = RecordCodec.shared();

    @Test
    void testJsonArtifactIsArrayOfObjects() throws Exception {
        byte[] bytes = codec.encode(List.of(record("north", 1.5), record("south", null)), RecordFormat.JSON);

        JsonNode tree = codec.jsonMapper().readTree(bytes);
        assertTrue(tree.isArray());
        assertEquals(2, tree.size());
        assertEquals("20241101 093000 123456 +0000", tree.get(0).get("datetime").asText());
        assertEquals("north", tree.get(0).get("site").asText());
        assertEquals("2023-05-17", tree.get(0).get("day").asText());
        assertEquals("2023-05-17T08:15:00", tree.get(0).get("seen").asText());
        assertTrue(tree.get(1).get("reading").isNull());
    }

    @Test
    void testCsvHasHeaderAndOneRowPerRecord() throws Exception {
        String csv = new String(codec.encode(List.of(record("north", 1.5), record("south", null)), RecordFormat.CSV),
                StandardCharsets.UTF_8);

        String[] lines = csv.trim().split("\\R");
        assertEquals(3, lines.length);
        assertEquals("datetime,site,reading,day,seen", lines[0]);
        assertTrue(lines[1].contains("20241101 093000 123456 +0000"), lines[1]);
        assertTrue(lines[1].contains(",north,1.5,2023-05-17,2023-05-17T08:15:00"), lines[1]);
        assertTrue(lines[2].contains(",south,,"), lines[2]);
    }

    @Test
    void testMessageIsCompactJson() throws Exception {
        String msg = codec.encodeMessage(List.of(record("north", 2.0)));
        assertFalse(msg.contains("\n"));
        assertTrue(msg.startsWith("[{\"datetime\":"));
    }

    @Test
    void testFormatIds() {
        assertEquals(RecordFormat.JSON, RecordFormat.fromId("JSON"));
        assertEquals("text/csv", RecordFormat.CSV.contentType());
        assertThrows(ConfigException.class, () -> RecordFormat.fromId("parquet"));
    }
}
