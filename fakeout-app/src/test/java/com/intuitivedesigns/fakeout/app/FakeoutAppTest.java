/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FakeoutAppTest {

    private static final UnaryOperator<String> NONE = k -> null;

    @TempDir
    Path dir;

    private static UnaryOperator<String> lookup(Map<String, String> values) {
        return values::get;
    }

    @Test
    void testConfigPathPrecedence() {
        UnaryOperator<String> props = lookup(Map.of(FakeoutApp.PROP_CONFIG_PATH, "from-prop.json"));
        UnaryOperator<String> env = lookup(Map.of(FakeoutApp.ENV_CONFIG_PATH, "from-env.json"));

        assertEquals(Path.of("from-arg.json"), FakeoutApp.resolveConfigPath(new String[]{"from-arg.json"}, props, env));
        assertEquals(Path.of("from-prop.json"), FakeoutApp.resolveConfigPath(new String[0], props, env));
        assertEquals(Path.of("from-env.json"), FakeoutApp.resolveConfigPath(new String[]{" "}, NONE, env));
        assertEquals(Path.of("config.json"), FakeoutApp.resolveConfigPath(null, NONE, NONE));
    }

    @Test
    void testMissingConfigExitsWithConfigStatus() {
        String missing = dir.resolve("nope.json").toString();
        assertEquals(FakeoutApp.EXIT_CONFIG, FakeoutApp.run(new String[]{missing}, NONE, NONE));
    }

    @Test
    void testInvalidConfigExitsWithConfigStatus() throws Exception {
        Path cfg = Files.writeString(dir.resolve("bad.json"), """
                {
                  "streaming": [
                    { "name": "dup", "interval": 1, "size": 1, "connection": { "service": "log" }, "data_description": [] }
                  ],
                  "batch": [
                    { "name": "dup", "interval": 1, "size": 1, "filetype": "json",
                      "connection": { "service": "local", "folder_path": "out" }, "data_description": [] }
                  ]
                }
                """);
        assertEquals(FakeoutApp.EXIT_CONFIG, FakeoutApp.run(new String[]{cfg.toString()}, NONE, NONE));
    }

    @Test
    void testFixedDurationRunWritesBatchFiles() throws Exception {
        Path out = dir.resolve("public");
        String json = """
                {
                  "runtime": { "run.duration.seconds": 1, "status.log.interval.seconds": 0, "shutdown.timeout.ms": 2000 },
                  "streaming": [
                    { "name": "streaming_1", "interval": 0.2, "size": 2,
                      "connection": { "service": "log" },
                      "data_description": [ { "name": "site", "data_type": "category", "allowable_values": ["a", "b"] } ] }
                  ],
                  "batch": [
                    { "name": "batch_1", "interval": 0.25, "size": 10, "filetype": "json",
                      "connection": { "service": "local", "folder_path": "%s" },
                      "data_description": [ { "name": "n", "data_type": "integer", "allowable_values": [1, 9] } ] }
                  ]
                }
                """.formatted(out.toString().replace("\\", "\\\\"));
        Path cfg = Files.writeString(dir.resolve("config.json"), json);

        assertEquals(FakeoutApp.EXIT_OK, FakeoutApp.run(new String[0], lookup(Map.of(FakeoutApp.PROP_CONFIG_PATH, cfg.toString())), NONE));

        List<String> files;
        try (Stream<Path> s = Files.list(out)) {
            files = s.map(p -> p.getFileName().toString()).collect(Collectors.toList());
        }
        assertFalse(files.isEmpty(), "batch pipeline should have written at least one file");
        assertTrue(files.stream().allMatch(f -> f.startsWith("batch_1_") && f.endsWith(".json")), files.toString());
    }
}
