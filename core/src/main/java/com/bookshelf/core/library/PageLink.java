package com.bookshelf.core.library;

/**
 * Pagination link relation and target.
 */
public record PageLink(String rel, String href, int page) {

    public static final String SELF = "self";
    public static final String FIRST = "first";
    public static final String NEXT = "next";
    public static final String PREVIOUS = "previous";
    public static final String LAST = "last";
}
