package com.bookshelf.core.library;

import java.util.List;

/**
 * One page of a query result plus the size of the whole result.
 */
public record PageResult<T>(List<T> items, int total) {

    public PageResult {
        items = List.copyOf(items);
    }

    public static <T> PageResult<T> empty() {
        return new PageResult<>(List.of(), 0);
    }
}
