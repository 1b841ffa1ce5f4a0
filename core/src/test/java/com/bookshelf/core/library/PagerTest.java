package com.bookshelf.core.library;

import com.bookshelf.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PagerTest extends TestBase {

    @Test
    void testTotalPages() {
        assertEquals(1, Pager.totalPages(0, 25));
        assertEquals(1, Pager.totalPages(25, 25));
        assertEquals(2, Pager.totalPages(26, 25));
        assertEquals(4, Pager.totalPages(10, 3));
        assertThrows(IllegalArgumentException.class, () -> Pager.totalPages(10, 0));
    }

    @Test
    void testParsePage() {
        assertEquals(1, Pager.parsePage(null, 100));
        assertEquals(1, Pager.parsePage("", 100));
        assertEquals(1, Pager.parsePage("abc", 100));
        assertEquals(1, Pager.parsePage("-4", 100));
        assertEquals(7, Pager.parsePage(" 7 ", 100));
        assertEquals(100, Pager.parsePage("99999", 100));
    }

    @Test
    void testSlice() {
        List<Integer> items = List.of(1, 2, 3, 4, 5);
        assertEquals(List.of(1, 2), Pager.slice(items, 1, 2));
        assertEquals(List.of(5), Pager.slice(items, 3, 2));
        assertTrue(Pager.slice(items, 4, 2).isEmpty());
        assertTrue(Pager.slice(List.of(), 1, 2).isEmpty());
    }

    @Test
    void testLinksMiddlePage() {
        List<PageLink> links = Pager.links("/opds/books", 2, 10, 35);
        assertEquals(List.of("self", "first", "next", "previous", "last"),
                links.stream().map(PageLink::rel).collect(Collectors.toList()));
        assertEquals("/opds/books?page=2", links.get(0).href());
        assertEquals(3, links.get(2).page());
        assertEquals(1, links.get(3).page());
        assertEquals("/opds/books?page=4", links.get(4).href());
    }

    @Test
    void testLinksSinglePageAndQueryBase() {
        List<PageLink> single = Pager.links("/opds/books", 1, 10, 3);
        assertEquals(1, single.size());
        assertEquals(PageLink.SELF, single.get(0).rel());

        List<PageLink> search = Pager.links("/opds/search?q=dune", 1, 1, 2);
        assertEquals("/opds/search?q=dune&page=1", search.get(0).href());
        assertEquals(List.of("self", "first", "next", "last"),
                search.stream().map(PageLink::rel).collect(Collectors.toList()));
    }
}
