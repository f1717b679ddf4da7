/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.util.Objects;

/**
 * The {@code connection} block of a pipeline: which sink plugin to use and its settings.
 *
 * @param service    plugin id (e.g. "kafka", "google_cloud_storage", "local")
 * @param connection every key of the block, {@code service} included
 */
public record SinkConfig(String service, Settings connection) {

    public SinkConfig {
        if (service == null || service.isBlank()) {
            throw new ConfigException("connection.service must not be blank");
        }
        service = service.trim();
        connection = Objects.requireNonNullElse(connection, Settings.empty());
    }
}
