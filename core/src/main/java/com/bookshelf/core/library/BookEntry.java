package com.bookshelf.core.library;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A fully hydrated book record.
 *
 * @param absolutePath    Location on disk
 * @param relativePath    Root-relative path with "/" separators; the identity key
 * @param title           Title from metadata, or the file name
 * @param author          Creator from metadata, or "Unknown"
 * @param publicationYear Four digit year, or "Unknown"
 * @param lastModified    File modification time
 */
public record BookEntry(
        Path absolutePath,
        String relativePath,
        String title,
        String author,
        String publicationYear,
        Instant lastModified) {
}
