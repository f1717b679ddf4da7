/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry for SPI discovery.
 *
 * <p>Performs the ServiceLoader classpath scan <b>once</b> at construction and caches the
 * results by normalized id.</p>
 *
 * @param <T> The SPI interface type (e.g., SinkPlugin.class)
 */
public final class ServicePluginRegistry<T> {
    private final Class<T> spiType;
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType, Function<T, String> idOf) {
        // Use the thread's context classloader (standard for containers/frameworks)
        this(spiType, idOf, Thread.currentThread().getContextClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, Function<T, String> idOf, ClassLoader cl) {
        this(spiType, idOf, ServiceLoader.load(spiType, cl));
    }

    /**
     * Builds a registry from explicit instances (used by tests and embedded callers).
     */
    public ServicePluginRegistry(Class<T> spiType, Function<T, String> idOf, Iterable<T> plugins) {
        this.spiType = spiType;
        Map<String, T> tmp = new LinkedHashMap<>();
        for (T plugin : plugins) {
            String id = PluginIds.normalize(idOf.apply(plugin));
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName() + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    /**
     * @throws IllegalArgumentException listing the available ids when none matches
     */
    public T require(String id, String configKeyName) {
        String key = PluginIds.normalize(id);
        T plugin = byId.get(key);
        if (plugin == null) {
            throw new IllegalArgumentException("No " + spiType.getSimpleName() + " found for '" + configKeyName + "=" + id + "'. " + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }
}
