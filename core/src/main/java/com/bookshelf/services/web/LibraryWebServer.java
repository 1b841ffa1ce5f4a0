package com.bookshelf.services.web;

import com.bookshelf.core.config.Configuration;
import com.google.gson.Gson;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * HTTP server the plugins hang their routes on. Each request runs on a worker of
 * a fixed pool; protected routes require the configured admin token.
 */
public class LibraryWebServer implements com.bookshelf.api.WebServer {
    private static final Logger logger = LoggerFactory.getLogger(LibraryWebServer.class);

    private final Configuration config;
    private final Gson gson = new Gson();
    private HttpServer server;
    private ExecutorService executor;

    // Map to track registered contexts for unregistering
    private final Map<String, HttpContext> registeredContexts = new ConcurrentHashMap<>();

    public LibraryWebServer(Configuration config) {
        this.config = config;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(config.port), 0);
        executor = Executors.newFixedThreadPool(config.serverThreads);
        server.setExecutor(executor);
        server.start();
        logger.info("🌐 Library web server running on port {}", getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
        registeredContexts.clear();
        logger.info("Library web server stopped");
    }

    @Override
    public int getPort() {
        return server != null ? server.getAddress().getPort() : config.port;
    }

    @Override
    public void registerRoute(String path, HttpHandler handler, boolean isProtected) {
        if (server == null) {
            logger.warn("Web server not started, cannot register {}", path);
            return;
        }

        // Remove existing if present to avoid "Context already exists"
        unregisterRoute(path);

        HttpHandler finalHandler = isProtected ? new AuthWrapper(handler) : handler;
        HttpContext context = server.createContext(path, finalHandler);
        registeredContexts.put(path, context);

        String visibility = isProtected ? "PROTECTED" : "PUBLIC";
        logger.info("Registering {} context: {}", visibility, path);
    }

    @Override
    public void unregisterRoute(String path) {
        if (server == null)
            return;
        HttpContext context = registeredContexts.remove(path);
        if (context != null) {
            server.removeContext(path);
            logger.info("Unregistered context: {}", path);
        }
    }

    /**
     * Checks the admin token from "Authorization: Bearer", "X-Auth-Token" or the
     * "token" query parameter. Without a configured token every request passes.
     */
    private class AuthWrapper implements HttpHandler {
        private final HttpHandler inner;

        AuthWrapper(HttpHandler inner) {
            this.inner = inner;
        }

        @Override
        public void handle(HttpExchange ex) throws IOException {
            String expected = config.adminToken;
            if (expected == null || expected.isBlank()) {
                inner.handle(ex);
                return;
            }

            String token = null;
            String authHeader = ex.getRequestHeaders().getFirst("Authorization");
            // other schemes (Basic, ...) belong to something else, fall through to the next source
            if (authHeader != null && authHeader.regionMatches(true, 0, "Bearer ", 0, 7)) {
                token = authHeader.substring(7).trim();
            }
            if (token == null || token.isEmpty()) {
                token = ex.getRequestHeaders().getFirst("X-Auth-Token");
            }
            if (token == null || token.isEmpty()) {
                token = parseQuery(ex.getRequestURI().getRawQuery()).get("token");
            }

            if (token != null && MessageDigest.isEqual(
                    token.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
                inner.handle(ex);
                return;
            }

            logger.warn("Auth failed: token invalid or missing. Path: {}", ex.getRequestURI().getPath());
            sendJsonError(ex, 401, "Unauthorized");
        }
    }

    private void sendJsonError(HttpExchange ex, int code, String message) throws IOException {
        Map<String, Object> body = new HashMap<>();
        body.put("status", "error");
        body.put("code", code);
        body.put("error", message);
        byte[] bytes = gson.toJson(body).getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    public static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty())
            return params;

        for (String pair : rawQuery.split("&")) {
            String[] kv = pair.split("=", 2);
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            String value = kv.length == 2 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
            params.putIfAbsent(key, value);
        }
        return params;
    }
}
