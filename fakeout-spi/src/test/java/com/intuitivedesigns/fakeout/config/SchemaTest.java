/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaTest {

    private static final FieldSpec SITE = FieldSpec.of("site", DataType.CATEGORY, List.of("a", "b"));
    private static final FieldSpec OK = FieldSpec.of("ok", DataType.BOOL, List.of());

    @Test
    void testKeepsDeclaredOrder() {
        Schema s = Schema.of(OK, SITE);
        assertEquals(List.of("ok", "site"), s.fieldNames());
        assertEquals(2, s.size());
    }

    @Test
    void testRejectsEmptyDuplicateAndReservedNames() {
        assertThrows(ConfigException.class, () -> new Schema(List.of()));
        assertThrows(ConfigException.class, () -> Schema.of(SITE, FieldSpec.of("site", DataType.BOOL, List.of())));
        ConfigException e = assertThrows(ConfigException.class,
                () -> Schema.of(FieldSpec.of(Schema.TIMESTAMP_KEY, DataType.BOOL, List.of())));
        assertTrue(e.getMessage().contains("reserved"));
    }
}
