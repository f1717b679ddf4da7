/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Cross-pipeline checks that a single pipeline record cannot make on its own.
 */
public final class ConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    private ConfigValidator() {}

    /**
     * @throws ConfigException on duplicate pipeline names or pipeline counts over the ceilings
     */
    public static void validate(FakeoutConfig config) {
        final RuntimeSettings runtime = new RuntimeSettings(config.runtime());

        if (config.streaming().size() > runtime.maxStreaming()) {
            throw new ConfigException("Too many streaming pipelines: " + config.streaming().size()
                    + " configured, " + RuntimeSettings.KEY_STREAMING_MAX + "=" + runtime.maxStreaming());
        }
        if (config.batch().size() > runtime.maxBatch()) {
            throw new ConfigException("Too many batch pipelines: " + config.batch().size()
                    + " configured, " + RuntimeSettings.KEY_BATCH_MAX + "=" + runtime.maxBatch());
        }

        final Set<String> names = new HashSet<>();
        for (PipelineConfig p : config.pipelines()) {
            if (!names.add(p.name())) {
                throw new ConfigException("Duplicate pipeline name '" + p.name() + "'. Names must be unique across streaming and batch");
            }
            if (p.randomise()) {
                log.warn("pipeline={} randomise=true is ignored; records are delivered in generation order", p.name());
            }
        }
    }
}
