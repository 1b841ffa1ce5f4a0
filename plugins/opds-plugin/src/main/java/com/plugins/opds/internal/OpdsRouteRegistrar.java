package com.plugins.opds.internal;

import com.bookshelf.api.WebServer;
import com.bookshelf.core.library.LibraryIndex;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registers the catalog, file, health and admin routes on the WebServer.
 */
public class OpdsRouteRegistrar {
    private static final Logger logger = LoggerFactory.getLogger(OpdsRouteRegistrar.class);

    private static final List<String> ROUTES = List.of(
            "/", "/opds", OpdsFeedWriter.STYLESHEET_PATH, "/download/", "/cover/", "/health",
            "/api/admin/refresh");
    private static final String STYLESHEET_RESOURCE = "/opds/opds_to_html.xslt";

    private final WebServer webServer;
    private final LibraryIndex index;
    private final OpdsCatalogHandler catalogHandler;
    private final BookFileHandler fileHandler;
    private final OpdsFeedWriter writer;

    public OpdsRouteRegistrar(WebServer webServer, LibraryIndex index, OpdsCatalogHandler catalogHandler,
            BookFileHandler fileHandler, OpdsFeedWriter writer) {
        this.webServer = webServer;
        this.index = index;
        this.catalogHandler = catalogHandler;
        this.fileHandler = fileHandler;
        this.writer = writer;
    }

    public void registerRoutes() {
        // --- Public catalog routes ---
        webServer.registerRoute("/", this::handleRoot, false);
        webServer.registerRoute("/opds", catalogHandler, false);
        webServer.registerRoute(OpdsFeedWriter.STYLESHEET_PATH, this::handleStylesheet, false);
        webServer.registerRoute("/download/", fileHandler::handleDownload, false);
        webServer.registerRoute("/cover/", fileHandler::handleCover, false);
        webServer.registerRoute("/health", this::handleHealth, false);

        // --- Admin ---
        webServer.registerRoute("/api/admin/refresh", this::handleRefresh, true);

        logger.info("📖 OPDS routes registered on WebServer");
    }

    public void unregisterRoutes() {
        for (String route : ROUTES) {
            webServer.unregisterRoute(route);
        }
    }

    // "/" is the catch-all context, anything unmatched lands here
    private void handleRoot(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            Responses.sendError(exchange, writer, 404, "Not found");
            return;
        }
        exchange.getResponseHeaders().set("Location", "/opds");
        exchange.sendResponseHeaders(302, -1);
        exchange.close();
    }

    private void handleStylesheet(HttpExchange exchange) throws IOException {
        if (!OpdsFeedWriter.STYLESHEET_PATH.equals(exchange.getRequestURI().getPath())) {
            Responses.sendError(exchange, writer, 404, "Not found");
            return;
        }
        if (!Responses.isReadMethod(exchange)) {
            Responses.sendError(exchange, writer, 405, "Method not allowed");
            return;
        }

        byte[] stylesheet;
        try (InputStream in = OpdsRouteRegistrar.class.getResourceAsStream(STYLESHEET_RESOURCE)) {
            if (in == null) {
                logger.warn("Stylesheet resource {} missing from the plugin jar", STYLESHEET_RESOURCE);
                Responses.sendError(exchange, writer, 404, "Stylesheet not found");
                return;
            }
            stylesheet = in.readAllBytes();
        }
        Responses.send(exchange, 200, Responses.XML_TYPE, stylesheet);
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        Responses.sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleRefresh(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            Responses.sendError(exchange, writer, 405, "Method not allowed");
            return;
        }

        index.invalidate();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("message", "Library cache invalidated");
        Responses.sendJson(exchange, 200, body);
    }
}
