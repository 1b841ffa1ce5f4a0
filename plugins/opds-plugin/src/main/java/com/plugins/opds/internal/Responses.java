package com.plugins.opds.internal;

import com.google.gson.Gson;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Response writers shared by the OPDS handlers.
 */
final class Responses {
    static final String XML_TYPE = "application/xml; charset=utf-8";

    private static final Gson gson = new Gson();

    private Responses() {
    }

    static void send(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if ("HEAD".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    static void sendXml(HttpExchange exchange, int status, String contentType, String xml) throws IOException {
        send(exchange, status, contentType, xml.getBytes(StandardCharsets.UTF_8));
    }

    static void sendError(HttpExchange exchange, OpdsFeedWriter writer, int status, String message)
            throws IOException {
        sendXml(exchange, status, XML_TYPE, writer.writeError(status, message));
    }

    static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        send(exchange, status, "application/json; charset=utf-8",
                gson.toJson(body).getBytes(StandardCharsets.UTF_8));
    }

    static boolean isReadMethod(HttpExchange exchange) {
        String method = exchange.getRequestMethod();
        return "GET".equals(method) || "HEAD".equals(method);
    }
}
