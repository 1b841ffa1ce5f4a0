package com.plugins.opds.internal;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * URL and id helpers for catalog entries.
 */
final class CatalogLinks {
    static final String ACQUISITION_REL = "http://opds-spec.org/acquisition/open-access";
    static final String IMAGE_REL = "http://opds-spec.org/image";
    static final String THUMBNAIL_REL = "http://opds-spec.org/image/thumbnail";
    static final String SUBSECTION_REL = "subsection";
    static final String START_REL = "start";
    static final String SEARCH_REL = "search";

    static final String EPUB_TYPE = "application/epub+zip";

    private CatalogLinks() {
    }

    /**
     * Percent-encodes every segment of a relative path, keeping the slashes.
     */
    static String encodePath(String relativePath) {
        String[] segments = relativePath.replace('\\', '/').split("/", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(encodeSegment(segments[i]));
        }
        return sb.toString();
    }

    static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String downloadHref(String relativePath) {
        return "/download/" + encodePath(relativePath);
    }

    static String coverHref(String relativePath) {
        return "/cover/" + encodePath(relativePath);
    }

    static String folderHref(String relativePath) {
        return "/opds/folder/" + encodePath(relativePath);
    }

    static String yearHref(String year) {
        return "/opds/years/" + encodeSegment(year);
    }

    static String letterHref(String letter) {
        return "/opds/authors/letter/" + encodeSegment(letter);
    }

    static String authorHref(String author) {
        return "/opds/authors/name/" + encodeSegment(author);
    }

    // Stable across restarts: derived from the kind and the key only
    static String uuidId(String kind, String key) {
        return "urn:uuid:" + UUID.nameUUIDFromBytes((kind + ":" + key).getBytes(StandardCharsets.UTF_8));
    }

    static String folderId(String relativePath) {
        return "urn:folder:" + UUID.nameUUIDFromBytes(relativePath.getBytes(StandardCharsets.UTF_8));
    }
}
