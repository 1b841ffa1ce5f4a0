package com.bookshelf.core.library;

/**
 * Thrown when a folder listing is requested for a path that is missing,
 * not a directory, or not allowed (traversal / outside the library).
 */
public class FolderNotFoundException extends RuntimeException {

    public FolderNotFoundException(String folderPath, String reason) {
        super("Folder not found or access denied: " + folderPath + " (" + reason + ")");
    }
}
