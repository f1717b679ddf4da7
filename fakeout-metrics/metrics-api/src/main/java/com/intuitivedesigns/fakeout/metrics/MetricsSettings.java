/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.metrics;

import com.intuitivedesigns.fakeout.config.Settings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for the Metrics Runtime, read from the
 * {@code runtime} block of the config file.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_PROM_PORT = 9090;

    public final String providerId;
    public final Map<String, String> commonTags;
    public final int prometheusPort;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
    }

    public static MetricsSettings from(Settings runtime) {
        Objects.requireNonNull(runtime, "runtime");

        final String provider = normalizeUpper(runtime.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        // metrics.tag.env=dev -> commonTag env=dev
        final Map<String, String> tags = new LinkedHashMap<>();
        for (String k : runtime.keys()) {
            if (!k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String val = normalize(runtime.getString(k, null));
            if (tagKey.isEmpty() || val == null) continue;

            tags.put(tagKey, val);
        }

        final int promPort = clampInt(runtime.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);

        return new MetricsSettings(provider, Collections.unmodifiableMap(tags), promPort);
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", prometheusPort=" + prometheusPort +
                '}';
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : DEFAULT_PROVIDER;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
