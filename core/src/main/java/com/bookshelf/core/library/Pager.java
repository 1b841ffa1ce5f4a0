package com.bookshelf.core.library;

import java.util.ArrayList;
import java.util.List;

/**
 * Page arithmetic and pagination link relations shared by every catalog query.
 * Pages are 1-based.
 */
public final class Pager {

    private Pager() {
    }

    public static int totalPages(int count, int size) {
        requirePositive(size);
        if (count <= 0) {
            return 1;
        }
        return (int) Math.max(1, ((long) count + size - 1) / size);
    }

    public static int clampPage(int page, int cap) {
        return Math.max(1, Math.min(page, Math.max(1, cap)));
    }

    /**
     * Parses a page query parameter; missing or garbage input means page 1.
     */
    public static int parsePage(String value, int cap) {
        if (value == null || value.isBlank()) {
            return 1;
        }
        try {
            return clampPage(Integer.parseInt(value.trim()), cap);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    /**
     * Returns items [(page-1)*size, page*size) of the list; empty when out of range.
     */
    public static <T> List<T> slice(List<T> items, int page, int size) {
        requirePositive(size);
        long start = (long) (Math.max(1, page) - 1) * size;
        if (start >= items.size()) {
            return List.of();
        }
        int end = (int) Math.min(items.size(), start + size);
        return items.subList((int) start, end);
    }

    /**
     * Link relations for a paginated view. Order: self, first, next, previous, last.
     */
    public static List<PageLink> links(String basePath, int page, int size, int count) {
        int totalPages = totalPages(count, size);
        List<PageLink> links = new ArrayList<>();

        links.add(link(PageLink.SELF, basePath, page));
        if (totalPages > 1) {
            links.add(link(PageLink.FIRST, basePath, 1));
        }
        if (page < totalPages) {
            links.add(link(PageLink.NEXT, basePath, page + 1));
        }
        if (page > 1) {
            links.add(link(PageLink.PREVIOUS, basePath, page - 1));
        }
        if (totalPages > 1) {
            links.add(link(PageLink.LAST, basePath, totalPages));
        }
        return links;
    }

    private static PageLink link(String rel, String basePath, int page) {
        String separator = basePath.contains("?") ? "&" : "?";
        return new PageLink(rel, basePath + separator + "page=" + page, page);
    }

    private static void requirePositive(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + size);
        }
    }
}
