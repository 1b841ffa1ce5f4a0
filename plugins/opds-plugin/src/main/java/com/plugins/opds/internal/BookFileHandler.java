package com.plugins.opds.internal;

import com.bookshelf.common.security.ContentGuard;
import com.bookshelf.core.library.metadata.CoverImage;
import com.bookshelf.core.library.metadata.MetadataExtractor;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Serves book files and their embedded covers from the library root.
 */
public class BookFileHandler {
    private static final Logger logger = LoggerFactory.getLogger(BookFileHandler.class);

    private static final String DOWNLOAD_PREFIX = "/download/";
    private static final String COVER_PREFIX = "/cover/";

    private final Path root;
    private final ContentGuard guard;
    private final MetadataExtractor extractor;
    private final OpdsFeedWriter writer;
    private final long coverCacheSeconds;

    public BookFileHandler(Path root, ContentGuard guard, MetadataExtractor extractor,
            OpdsFeedWriter writer, long coverCacheSeconds) {
        this.root = root;
        this.guard = guard;
        this.extractor = extractor;
        this.writer = writer;
        this.coverCacheSeconds = coverCacheSeconds;
    }

    public void handleDownload(HttpExchange exchange) throws IOException {
        Path book = resolveBook(exchange, DOWNLOAD_PREFIX);
        if (book == null) {
            return;
        }

        long length = Files.size(book);
        exchange.getResponseHeaders().set("Content-Type", CatalogLinks.EPUB_TYPE);
        exchange.getResponseHeaders().set("Content-Disposition", contentDisposition(book.getFileName().toString()));
        if ("HEAD".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
            return;
        }

        exchange.sendResponseHeaders(200, length);
        try (OutputStream os = exchange.getResponseBody()) {
            Files.copy(book, os);
        }
        logger.debug("Served {} ({} bytes)", book, length);
    }

    public void handleCover(HttpExchange exchange) throws IOException {
        Path book = resolveBook(exchange, COVER_PREFIX);
        if (book == null) {
            return;
        }

        Optional<CoverImage> cover = extractor.extractCover(book);
        if (cover.isEmpty()) {
            Responses.sendError(exchange, writer, 404, "Cover not found");
            return;
        }

        exchange.getResponseHeaders().set("Cache-Control", "public, max-age=" + coverCacheSeconds);
        Responses.send(exchange, 200, cover.get().mimeType(), cover.get().data());
    }

    /**
     * Maps the request path to a book file below the root, or answers the
     * request with 403/404/405 and returns null.
     */
    private Path resolveBook(HttpExchange exchange, String prefix) throws IOException {
        if (!Responses.isReadMethod(exchange)) {
            Responses.sendError(exchange, writer, 405, "Method not allowed");
            return null;
        }

        String path = exchange.getRequestURI().getPath();
        String relative = path.length() > prefix.length() ? path.substring(prefix.length()) : "";

        if (relative.isEmpty() || guard.hasTraversal(relative)) {
            logger.warn("Rejected suspicious file request: {}", path);
            Responses.sendError(exchange, writer, 403, "Access denied");
            return null;
        }

        Path file = root.resolve(relative).normalize();
        if (!guard.contains(root, file)) {
            logger.warn("Rejected request outside the library: {}", path);
            Responses.sendError(exchange, writer, 403, "Access denied");
            return null;
        }

        if (!Files.isRegularFile(file) || !file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".epub")) {
            Responses.sendError(exchange, writer, 404, "File not found");
            return null;
        }
        return file;
    }

    static String contentDisposition(String fileName) {
        if (isPlainAscii(fileName)) {
            return "attachment; filename=\"" + fileName + "\"";
        }

        StringBuilder fallback = new StringBuilder();
        for (char c : fileName.toCharArray()) {
            fallback.append(c >= 0x20 && c < 0x7f && c != '"' && c != '\\' ? c : '_');
        }
        return "attachment; filename=\"" + fallback + "\"; filename*=UTF-8''"
                + CatalogLinks.encodeSegment(fileName);
    }

    private static boolean isPlainAscii(String value) {
        for (char c : value.toCharArray()) {
            if (c < 0x20 || c >= 0x7f || c == '"' || c == '\\') {
                return false;
            }
        }
        return StandardCharsets.US_ASCII.newEncoder().canEncode(value);
    }
}
