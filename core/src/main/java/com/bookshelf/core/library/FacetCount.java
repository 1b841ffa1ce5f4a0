package com.bookshelf.core.library;

/**
 * A browse facet (year or author) with the number of books under it.
 */
public record FacetCount(String name, int count) {
}
