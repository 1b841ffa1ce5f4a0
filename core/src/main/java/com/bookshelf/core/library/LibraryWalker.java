package com.bookshelf.core.library;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Recursive walk over the content root reporting every book file.
 * Hidden entries are skipped; unreadable directories are logged and skipped
 * without aborting the walk.
 */
class LibraryWalker {
    private static final Logger logger = LoggerFactory.getLogger(LibraryWalker.class);

    static final String BOOK_EXTENSION = ".epub";

    record BookFile(Path path, Instant lastModified) {
    }

    private final Path root;

    LibraryWalker(Path root) {
        this.root = root;
    }

    static boolean isBookFile(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(BOOK_EXTENSION);
    }

    static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    void walk(Consumer<BookFile> sink) {
        if (!Files.isDirectory(root)) {
            logger.warn("Library root {} is not a directory, nothing to scan", root);
            return;
        }

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !isHidden(file) && isBookFile(file)) {
                        sink.accept(new BookFile(file, attrs.lastModifiedTime().toInstant()));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    logger.warn("Skipping unreadable path {}: {}", file, e.toString());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException e) {
                    if (e != null) {
                        logger.warn("Directory listing of {} aborted: {}", dir, e.toString());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            // the visitor swallows per-entry failures, only a root-level failure lands here
            logger.error("Library walk of {} failed", root, e);
        }
    }
}
