package com.bookshelf.core.library.metadata;

/**
 * Cover image bytes extracted from a book archive.
 */
public record CoverImage(byte[] data, String mimeType) {
}
