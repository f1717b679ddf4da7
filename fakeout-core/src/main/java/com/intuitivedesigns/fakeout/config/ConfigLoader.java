/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.fakeout.codec.RecordFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reads the JSON configuration file into a validated {@link FakeoutConfig}.
 *
 * <p>Every structural error names its JSON path, e.g.
 * {@code batch[1].data_description[0].allowable_values}.</p>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {}

    public static FakeoutConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            final FakeoutConfig config = fromTree(MAPPER.readTree(in));
            log.info("Loaded configuration from {} (streaming={}, batch={})",
                    path.toAbsolutePath(), config.streaming().size(), config.batch().size());
            return config;
        } catch (NoSuchFileException e) {
            throw new ConfigException("Configuration file not found: " + path.toAbsolutePath(), e);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Configuration file " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Cannot read configuration file " + path, e);
        }
    }

    public static FakeoutConfig parse(String json) {
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigException("Configuration is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static FakeoutConfig fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigException("$: configuration root must be a JSON object");
        }

        final String version = root.hasNonNull("version") ? root.get("version").asText() : null;
        final Settings runtime = runtime(root.get("runtime"));
        final List<StreamingPipelineConfig> streaming = pipelines(root, "streaming", ConfigLoader::streaming);
        final List<BatchPipelineConfig> batch = pipelines(root, "batch", ConfigLoader::batch);

        final FakeoutConfig config = new FakeoutConfig(version, runtime, streaming, batch);
        ConfigValidator.validate(config);
        return config;
    }

    // --- Sections ---

    private static Settings runtime(JsonNode node) {
        if (node == null || node.isNull()) return Settings.empty();
        if (!node.isObject()) {
            throw new ConfigException("runtime: must be an object");
        }
        final Map<String, Object> flat = new LinkedHashMap<>();
        flatten("", node, flat);
        return Settings.of(flat);
    }

    private static void flatten(String prefix, JsonNode node, Map<String, Object> out) {
        final Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> e = it.next();
            final String key = prefix.isEmpty() ? e.getKey() : prefix + "." + e.getKey();
            final JsonNode v = e.getValue();
            if (v.isObject()) {
                flatten(key, v, out);
            } else if (!v.isNull()) {
                out.put(key, v.isValueNode() ? v.asText() : v.toString());
            }
        }
    }

    private static <T> List<T> pipelines(JsonNode root, String section, Function<Node, T> mapper) {
        final JsonNode arr = root.get(section);
        if (arr == null || arr.isNull()) return List.of();
        if (!arr.isArray()) {
            throw new ConfigException(section + ": must be an array");
        }
        final List<T> out = new ArrayList<>(arr.size());
        for (int i = 0; i < arr.size(); i++) {
            final Node n = new Node(section + "[" + i + "]", arr.get(i));
            out.add(n.wrap(() -> mapper.apply(n)));
        }
        return out;
    }

    private static StreamingPipelineConfig streaming(Node n) {
        n.requireObject();
        return new StreamingPipelineConfig(
                n.text("name", true),
                n.seconds("interval", true),
                n.integer("size", 1),
                n.bool("randomise", false),
                schema(n.child("data_description")),
                sink(n.child("connection")));
    }

    private static BatchPipelineConfig batch(Node n) {
        n.requireObject();
        final Node filetype = n.child("filetype");
        return new BatchPipelineConfig(
                n.text("name", true),
                n.seconds("interval", true),
                n.integer("size", 1),
                n.bool("randomise", false),
                filetype.wrap(() -> RecordFormat.fromId(n.text("filetype", true))),
                n.has("cleanup_after") ? n.seconds("cleanup_after", false) : Duration.ZERO,
                schema(n.child("data_description")),
                sink(n.child("connection")));
    }

    private static SinkConfig sink(Node n) {
        if (n.node == null || n.node.isNull()) {
            throw new ConfigException(n.path + ": is required");
        }
        n.requireObject();
        final Map<String, Object> connection = new LinkedHashMap<>();
        flatten("", n.node, connection);
        final Object service = connection.remove("service");
        return n.wrap(() -> new SinkConfig(service == null ? null : service.toString(), Settings.of(connection)));
    }

    private static Schema schema(Node n) {
        if (n.node == null || !n.node.isArray()) {
            throw new ConfigException(n.path + ": must be an array of field descriptions");
        }
        final List<FieldSpec> fields = new ArrayList<>(n.node.size());
        for (int i = 0; i < n.node.size(); i++) {
            fields.add(field(new Node(n.path + "[" + i + "]", n.node.get(i))));
        }
        return n.wrap(() -> new Schema(fields));
    }

    private static FieldSpec field(Node n) {
        n.requireObject();
        final String name = n.text("name", true);
        final DataType type = n.child("data_type").wrap(() -> DataType.fromId(n.text("data_type", true)));

        final List<Object> allowable = new ArrayList<>();
        final JsonNode values = n.node.get("allowable_values");
        if (values != null && !values.isNull()) {
            if (!values.isArray()) {
                throw new ConfigException(n.path + ".allowable_values: must be an array");
            }
            for (JsonNode v : values) {
                allowable.add(scalar(v));
            }
        }
        final double nulls = n.number("proportion_nulls", 0.0);
        return n.wrap(() -> new FieldSpec(name, type, allowable, nulls));
    }

    private static Object scalar(JsonNode v) {
        if (v == null || v.isNull()) return null;
        if (v.isIntegralNumber()) return v.longValue();
        if (v.isNumber()) return v.doubleValue();
        if (v.isBoolean()) return v.booleanValue();
        return v.asText();
    }

    /** A JSON node together with its path, for error messages. */
    private static final class Node {
        private final String path;
        private final JsonNode node;

        Node(String path, JsonNode node) {
            this.path = path;
            this.node = node;
        }

        Node child(String key) {
            return new Node(path + "." + key, node == null ? null : node.get(key));
        }

        boolean has(String key) {
            return node.hasNonNull(key);
        }

        void requireObject() {
            if (node == null || !node.isObject()) {
                throw new ConfigException(path + ": must be an object");
            }
        }

        String text(String key, boolean required) {
            final JsonNode v = node.get(key);
            if (v == null || v.isNull()) {
                if (required) throw new ConfigException(path + "." + key + ": is required");
                return null;
            }
            if (!v.isValueNode()) {
                throw new ConfigException(path + "." + key + ": must be a string");
            }
            return v.asText();
        }

        int integer(String key, int defaultValue) {
            final JsonNode v = node.get(key);
            if (v == null || v.isNull()) return defaultValue;
            if (!v.isIntegralNumber() || !v.canConvertToInt()) {
                throw new ConfigException(path + "." + key + ": must be an integer, got " + v);
            }
            return v.intValue();
        }

        double number(String key, double defaultValue) {
            final JsonNode v = node.get(key);
            if (v == null || v.isNull()) return defaultValue;
            if (!v.isNumber()) {
                throw new ConfigException(path + "." + key + ": must be a number, got " + v);
            }
            return v.doubleValue();
        }

        boolean bool(String key, boolean defaultValue) {
            final JsonNode v = node.get(key);
            if (v == null || v.isNull()) return defaultValue;
            if (!v.isBoolean()) {
                throw new ConfigException(path + "." + key + ": must be true or false, got " + v);
            }
            return v.booleanValue();
        }

        /** Seconds, decimals allowed. */
        Duration seconds(String key, boolean required) {
            final JsonNode v = node.get(key);
            if (v == null || v.isNull()) {
                if (required) throw new ConfigException(path + "." + key + ": is required");
                return Duration.ZERO;
            }
            if (!v.isNumber()) {
                throw new ConfigException(path + "." + key + ": must be a number of seconds, got " + v);
            }
            if (v.isIntegralNumber()) {
                return Duration.ofSeconds(v.longValue());
            }
            final double secs = v.doubleValue();
            if (Double.isNaN(secs) || Double.isInfinite(secs)) {
                throw new ConfigException(path + "." + key + ": must be finite, got " + v);
            }
            return Duration.ofNanos(Math.round(secs * 1_000_000_000d));
        }

        /** Prefixes record-level validation errors with this node's path. */
        <T> T wrap(Supplier<T> build) {
            try {
                return build.get();
            } catch (ConfigException e) {
                if (e.getMessage() != null && e.getMessage().startsWith(path)) throw e;
                throw new ConfigException(path + ": " + e.getMessage(), e.getCause());
            }
        }
    }
}
