package com.bookshelf.core.library;

/**
 * One row of a folder listing: either a subfolder or a book.
 */
public interface FolderItem {

    enum Kind {
        FOLDER, BOOK
    }

    Kind kind();

    /**
     * Display name: the folder name or the book title.
     */
    String name();

    String relativePath();

    record Folder(String name, String relativePath) implements FolderItem {
        @Override
        public Kind kind() {
            return Kind.FOLDER;
        }
    }

    record Book(BookEntry book) implements FolderItem {
        @Override
        public Kind kind() {
            return Kind.BOOK;
        }

        @Override
        public String name() {
            return book.title();
        }

        @Override
        public String relativePath() {
            return book.relativePath();
        }
    }
}
