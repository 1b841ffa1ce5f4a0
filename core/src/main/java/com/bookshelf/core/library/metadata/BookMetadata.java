package com.bookshelf.core.library.metadata;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bibliographic fields read from a book's package descriptor.
 * Every field may be null, which means "unknown" rather than an error.
 */
public record BookMetadata(
        String title,
        String author,
        String date) {

    public static final String UNKNOWN = "Unknown";

    public static final BookMetadata EMPTY = new BookMetadata(null, null, null);

    private static final Pattern YEAR = Pattern.compile("^\\s*(\\d{4})");

    public boolean isEmpty() {
        return title == null && author == null && date == null;
    }

    /**
     * Leading four digit year of the date element, or "Unknown".
     * Handles "2001", "2001-05-12" and "2001-05-12T00:00:00Z".
     */
    public String publicationYear() {
        if (date == null) {
            return UNKNOWN;
        }
        Matcher m = YEAR.matcher(date);
        return m.find() ? m.group(1) : UNKNOWN;
    }

    public String authorOrUnknown() {
        return author != null ? author : UNKNOWN;
    }
}
