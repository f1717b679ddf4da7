/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.util.Arrays;
import java.util.Locale;

public enum DataType {
    CATEGORY,
    FLOAT,
    INTEGER,
    BOOL,
    DATE,
    DATETIME;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DataType fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigException("data_type must not be blank");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown data_type '" + raw + "'. Available options: "
                    + Arrays.stream(values()).map(DataType::id).toList());
        }
    }
}
