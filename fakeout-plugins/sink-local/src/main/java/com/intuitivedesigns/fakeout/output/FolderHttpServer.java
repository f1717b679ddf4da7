/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.fakeout.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.intuitivedesigns.fakeout.codec.RecordCodec;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only HTTP view of an export folder: {@code GET /} lists finished files as a
 * JSON array, {@code GET /<file>} returns one of them.
 */
final class FolderHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FolderHttpServer.class);

    private final Path root;
    private final HttpServer server;
    private final ExecutorService executor;

    private FolderHttpServer(Path root, HttpServer server, ExecutorService executor) {
        this.root = root;
        this.server = server;
        this.executor = executor;
    }

    static FolderHttpServer start(Path folder, int port, String owner) {
        Objects.requireNonNull(folder, "folder");
        final Path root = folder.toAbsolutePath().normalize();

        try {
            final HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);

            final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "fakeout-files-" + owner);
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            final FolderHttpServer handle = new FolderHttpServer(root, server, executor);
            server.createContext("/", handle::handle);
            server.start();

            log.info("Serving {} on port {}", root, handle.port());
            return handle;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start file server for " + root + " on port " + port, e);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                respond(exchange, 405, "text/plain; charset=utf-8", "Method Not Allowed".getBytes(StandardCharsets.UTF_8));
                return;
            }

            final String path = exchange.getRequestURI().getPath();
            if (path == null || path.equals("/")) {
                respond(exchange, 200, "application/json", listing());
                return;
            }

            final Path file = root.resolve(path.substring(1)).normalize();
            if (!file.startsWith(root) || !file.getParent().equals(root) || !isPublished(file) || !Files.isRegularFile(file)) {
                respond(exchange, 404, "text/plain; charset=utf-8", "Not Found".getBytes(StandardCharsets.UTF_8));
                return;
            }

            final String type = Files.probeContentType(file);
            respond(exchange, 200, (type != null) ? type : "application/octet-stream", Files.readAllBytes(file));
        } catch (IOException e) {
            log.warn("File server request {} failed: {}", exchange.getRequestURI(), e.getMessage());
            respond(exchange, 500, "text/plain; charset=utf-8", "Internal Server Error".getBytes(StandardCharsets.UTF_8));
        } finally {
            exchange.close();
        }
    }

    private byte[] listing() throws IOException {
        final List<String> names;
        try (Stream<Path> files = Files.list(root)) {
            names = files.filter(Files::isRegularFile)
                    .filter(FolderHttpServer::isPublished)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        }
        try {
            return RecordCodec.shared().jsonMapper().writeValueAsBytes(names);
        } catch (JsonProcessingException e) {
            throw new IOException("Cannot encode listing", e);
        }
    }

    // in-flight temp files are dot-prefixed
    private static boolean isPublished(Path file) {
        return !file.getFileName().toString().startsWith(".");
    }

    private static void respond(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
