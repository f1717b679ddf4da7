/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.spi;

import java.util.Locale;

public final class PluginIds {
    private PluginIds() {}

    /** "google_cloud_storage", " Local " and "LOCAL" all resolve the same plugin. */
    public static String normalize(String s) {
        return s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
    }
}
