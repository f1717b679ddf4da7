/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable flat key/value view used for runtime tuning and sink connection blocks.
 *
 * <p>Values are stored as strings (numbers and booleans from the JSON file are
 * stringified by the loader). Typed getters fall back to the supplied default when
 * the key is missing or the value does not parse.</p>
 */
public final class Settings {

    private static final Settings EMPTY = new Settings(Map.of());

    private final Map<String, String> values;

    private Settings(Map<String, String> values) {
        this.values = values;
    }

    public static Settings empty() {
        return EMPTY;
    }

    public static Settings of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;

        final Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : raw.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            copy.put(e.getKey().trim(), String.valueOf(e.getValue()));
        }
        return new Settings(Collections.unmodifiableMap(copy));
    }

    public String getString(String key, String defaultValue) {
        final String v = values.get(key);
        return v != null ? v : defaultValue;
    }

    /**
     * Like {@link #getString} but rejects missing or blank values.
     *
     * @throws ConfigException naming the key and the owning block
     */
    public String require(String key, String owner) {
        final String v = values.get(key);
        if (v == null || v.isBlank()) {
            throw new ConfigException("Missing required setting '" + key + "' for " + owner);
        }
        return v.trim();
    }

    public int getInt(String key, int defaultValue) {
        final String val = values.get(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        final String val = values.get(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        final String val = values.get(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return values.containsKey(key);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Settings other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Settings" + values.keySet();
    }
}
