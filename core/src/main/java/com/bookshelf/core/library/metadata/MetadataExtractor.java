package com.bookshelf.core.library.metadata;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads bibliographic metadata from book files.
 *
 * Implementations never throw: a malformed or unreadable file yields
 * {@link BookMetadata#EMPTY} (or an empty cover). Callers decide on display
 * fallbacks (file name as title, "Unknown" as author).
 */
public interface MetadataExtractor {

    BookMetadata extract(Path path);

    Optional<CoverImage> extractCover(Path path);
}
