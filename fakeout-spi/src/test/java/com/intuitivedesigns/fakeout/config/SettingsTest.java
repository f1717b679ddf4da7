/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsTest {

    @Test
    void testTypedGettersFallBackToDefaults() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("port", 8080);
        raw.put("ratio", "not-a-number");
        raw.put("enabled", true);
        raw.put("skipped", null);
        Settings s = Settings.of(raw);

        assertEquals(8080, s.getInt("port", 0));
        assertEquals(8080L, s.getLong("port", 0L));
        assertEquals(7, s.getInt("ratio", 7));
        assertTrue(s.getBoolean("enabled", false));
        assertTrue(s.getBoolean("missing", true));
        assertEquals("dflt", s.getString("missing", "dflt"));
        assertFalse(s.hasPath("skipped"));
    }

    @Test
    void testRequireRejectsMissingAndBlank() {
        Settings s = Settings.of(Map.of("topic", "  events ", "blank", " "));

        assertEquals("events", s.require("topic", "pipeline 'a' connection"));
        ConfigException e = assertThrows(ConfigException.class, () -> s.require("blank", "pipeline 'a' connection"));
        assertTrue(e.getMessage().contains("'blank'"));
        assertTrue(e.getMessage().contains("pipeline 'a' connection"));
        assertThrows(ConfigException.class, () -> s.require("bucket_name", "x"));
    }

    @Test
    void testImmutableAndValueEquality() {
        Settings a = Settings.of(Map.of("k", "v"));
        Settings b = Settings.of(Map.of("k", "v"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertThrows(UnsupportedOperationException.class, () -> a.asMap().put("x", "y"));
        assertSame(Settings.empty(), Settings.of(Map.of()));
    }
}
