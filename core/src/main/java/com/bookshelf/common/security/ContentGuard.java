package com.bookshelf.common.security;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Security guard for library paths to prevent path traversal attacks.
 * Ensures every served file stays within the content root.
 *
 * Both checks fail closed: anything that cannot be resolved is treated as
 * outside the root / suspicious.
 */
public class ContentGuard {

    // Patterns that are never allowed anywhere in a client supplied path
    private static final List<String> DANGEROUS_PATTERNS = Arrays.asList("..", "~");

    /**
     * Checks whether a candidate path lies within the root directory.
     *
     * @param root      The content root
     * @param candidate The path to check (absolute or relative to the working dir)
     * @return true if the canonical candidate equals the root or is nested below it
     */
    public boolean contains(Path root, Path candidate) {
        if (root == null || candidate == null) {
            return false;
        }
        try {
            Path canonicalRoot = canonicalize(root);
            Path canonicalCandidate = canonicalize(candidate);

            if (canonicalCandidate.equals(canonicalRoot)) {
                return true;
            }

            String rootPrefix = canonicalRoot.toString();
            if (!rootPrefix.endsWith(canonicalRoot.getFileSystem().getSeparator())) {
                rootPrefix = rootPrefix + canonicalRoot.getFileSystem().getSeparator();
            }
            return canonicalCandidate.toString().startsWith(rootPrefix);
        } catch (IOException | InvalidPathException | SecurityException e) {
            return false;
        }
    }

    /**
     * Checks a root-relative path for traversal sequences.
     *
     * @param relativePath The path provided by the client (or computed from the root)
     * @return true if the path contains "..", "~" or a segment starting with "."
     */
    public boolean hasTraversal(String relativePath) {
        if (relativePath == null) {
            return true;
        }

        for (String pattern : DANGEROUS_PATTERNS) {
            if (relativePath.contains(pattern)) {
                return true;
            }
        }

        String[] segments = relativePath.replace("\\", "/").split("/");
        for (String segment : segments) {
            if (segment.startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    // Real path when the file exists (resolves symlinks), otherwise normalized absolute path
    private Path canonicalize(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        if (Files.exists(absolute)) {
            return absolute.toRealPath();
        }
        Path parent = absolute.getParent();
        if (parent != null && Files.exists(parent)) {
            return parent.toRealPath().resolve(absolute.getFileName());
        }
        return absolute;
    }
}
