package com.plugins.opds.internal;

import com.bookshelf.core.config.Configuration;
import com.bookshelf.core.library.BookEntry;
import com.bookshelf.core.library.FacetCount;
import com.bookshelf.core.library.FolderItem;
import com.bookshelf.core.library.FolderNotFoundException;
import com.bookshelf.core.library.LibraryIndex;
import com.bookshelf.core.library.PageLink;
import com.bookshelf.core.library.PageResult;
import com.bookshelf.core.library.Pager;
import com.bookshelf.core.library.metadata.BookMetadata;
import com.bookshelf.services.web.LibraryWebServer;
import com.plugins.opds.internal.model.Feed;
import com.plugins.opds.internal.model.FeedEntry;
import com.plugins.opds.internal.model.FeedLink;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serves every feed below {@code /opds}.
 */
public class OpdsCatalogHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(OpdsCatalogHandler.class);

    private static final String PREFIX = "/opds";
    private static final String ROOT_HREF = "/opds";

    private final LibraryIndex index;
    private final Configuration config;
    private final OpdsFeedWriter writer;

    public OpdsCatalogHandler(LibraryIndex index, Configuration config, OpdsFeedWriter writer) {
        this.index = index;
        this.config = config;
        this.writer = writer;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!Responses.isReadMethod(exchange)) {
            Responses.sendError(exchange, writer, 405, "Method not allowed");
            return;
        }

        String path = exchange.getRequestURI().getPath();
        Map<String, String> params = LibraryWebServer.parseQuery(exchange.getRequestURI().getRawQuery());
        int page = Pager.parsePage(params.get("page"), config.maxPage);

        Feed feed;
        try {
            feed = route(path, params, page);
        } catch (FolderNotFoundException e) {
            logger.debug("Folder request rejected: {}", e.getMessage());
            Responses.sendError(exchange, writer, 404, "Folder not found or access denied");
            return;
        } catch (RuntimeException e) {
            logger.error("Failed to build feed for {}", path, e);
            Responses.sendError(exchange, writer, 500, "Internal server error");
            return;
        }

        if (feed == null) {
            Responses.sendError(exchange, writer, 404, "Not found");
            return;
        }
        Responses.sendXml(exchange, 200, feed.kind().contentType(), writer.write(feed));
    }

    private Feed route(String path, Map<String, String> params, int page) {
        if (!path.startsWith(PREFIX)) {
            return null;
        }
        String rest = path.substring(PREFIX.length());

        if (rest.isEmpty() || rest.equals("/")) {
            return rootFeed();
        }
        if (rest.equals("/books")) {
            return allBooksFeed(page);
        }
        if (rest.equals("/recent")) {
            return recentFeed();
        }
        if (rest.startsWith("/folder/")) {
            return folderFeed(rest.substring("/folder/".length()), page);
        }
        if (rest.equals("/years")) {
            return yearsFeed();
        }
        if (rest.startsWith("/years/")) {
            return yearFeed(rest.substring("/years/".length()), page);
        }
        if (rest.equals("/authors")) {
            return authorLettersFeed();
        }
        if (rest.startsWith("/authors/letter/")) {
            return authorsByLetterFeed(rest.substring("/authors/letter/".length()), page);
        }
        if (rest.startsWith("/authors/name/")) {
            return authorFeed(rest.substring("/authors/name/".length()), page);
        }
        if (rest.equals("/search")) {
            return searchFeed(params.getOrDefault("q", ""), page);
        }
        return null;
    }

    // ======================== NAVIGATION FEEDS ========================

    private Feed rootFeed() {
        List<FeedLink> links = new ArrayList<>();
        links.add(new FeedLink(PageLink.SELF, ROOT_HREF, Feed.Kind.NAVIGATION.linkType()));
        links.add(startLink());
        links.add(new FeedLink(CatalogLinks.SEARCH_REL, "/opds/search?q={searchTerms}",
                "application/atom+xml"));

        List<FeedEntry> entries = new ArrayList<>();
        entries.add(navigation("urn:all-books", "All Books", "Every book in the library",
                "/opds/books?page=1", Feed.Kind.ACQUISITION));
        entries.add(navigation("urn:recent-books", "Recent Books", "Most recently added books",
                "/opds/recent", Feed.Kind.ACQUISITION));
        entries.add(navigation("urn:by-year", "By Year", "Books grouped by publication year",
                "/opds/years", Feed.Kind.NAVIGATION));
        entries.add(navigation("urn:by-author", "By Author", "Books grouped by author",
                "/opds/authors", Feed.Kind.NAVIGATION));

        for (FolderItem.Folder folder : index.getSubfolders("")) {
            entries.add(folderEntry(folder));
        }

        return new Feed("urn:library-root", config.catalogTitle, Feed.Kind.NAVIGATION, links, entries);
    }

    private Feed yearsFeed() {
        List<FeedEntry> entries = new ArrayList<>();
        for (FacetCount year : index.getYearsWithCounts()) {
            entries.add(navigation(CatalogLinks.uuidId("year", year.name()), year.name(),
                    countSummary(year.count()), CatalogLinks.yearHref(year.name()) + "?page=1",
                    Feed.Kind.ACQUISITION));
        }
        return new Feed("urn:by-year", "By Year", Feed.Kind.NAVIGATION,
                selfAndStart("/opds/years", Feed.Kind.NAVIGATION), entries);
    }

    private Feed authorLettersFeed() {
        List<FeedEntry> entries = new ArrayList<>();
        for (String letter : index.getAuthorLetters()) {
            entries.add(navigation(CatalogLinks.uuidId("letter", letter), letter,
                    "Authors starting with " + letter, CatalogLinks.letterHref(letter) + "?page=1",
                    Feed.Kind.NAVIGATION));
        }
        return new Feed("urn:by-author", "By Author", Feed.Kind.NAVIGATION,
                selfAndStart("/opds/authors", Feed.Kind.NAVIGATION), entries);
    }

    private Feed authorsByLetterFeed(String letter, int page) {
        int size = config.pageSize;
        PageResult<FacetCount> result = index.getAuthorsByLetter(letter, page, size);

        List<FeedEntry> entries = new ArrayList<>();
        for (FacetCount author : result.items()) {
            entries.add(navigation(CatalogLinks.uuidId("author", author.name()), author.name(),
                    countSummary(author.count()), CatalogLinks.authorHref(author.name()) + "?page=1",
                    Feed.Kind.ACQUISITION));
        }

        String title = "Authors: " + letter + pageSuffix(page, size, result.total());
        return new Feed(CatalogLinks.uuidId("letter", letter), title, Feed.Kind.NAVIGATION,
                paginationLinks(CatalogLinks.letterHref(letter), page, size, result.total(), Feed.Kind.NAVIGATION),
                entries);
    }

    // ======================== ACQUISITION FEEDS ========================

    private Feed allBooksFeed(int page) {
        int size = config.pageSize;
        PageResult<BookEntry> result = index.getAllBooksPaginated(page, size);
        String title = "All Books (Page " + page + " of " + Pager.totalPages(result.total(), size) + ")";
        return new Feed("urn:all-books", title, Feed.Kind.ACQUISITION,
                paginationLinks("/opds/books", page, size, result.total(), Feed.Kind.ACQUISITION),
                bookEntries(result.items()));
    }

    private Feed recentFeed() {
        List<BookEntry> books = index.scanRecent(config.recentLimit);
        return new Feed("urn:recent-books", "Recent Books", Feed.Kind.ACQUISITION,
                selfAndStart("/opds/recent", Feed.Kind.ACQUISITION), bookEntries(books));
    }

    private Feed folderFeed(String folderPath, int page) {
        int size = config.pageSize;
        PageResult<FolderItem> result = index.getFolderContentPaginated(folderPath, page, size);

        List<FeedEntry> entries = new ArrayList<>();
        for (FolderItem item : result.items()) {
            if (item.kind() == FolderItem.Kind.BOOK) {
                entries.add(bookEntry(((FolderItem.Book) item).book()));
            } else {
                entries.add(folderEntry((FolderItem.Folder) item));
            }
        }

        String trimmed = trimSlashes(folderPath);
        String name = trimmed.isEmpty() ? "Library" : trimmed.substring(trimmed.lastIndexOf('/') + 1);
        String title = name + pageSuffix(page, size, result.total());

        return new Feed(CatalogLinks.folderId(trimmed), title, Feed.Kind.ACQUISITION,
                paginationLinks(CatalogLinks.folderHref(trimmed), page, size, result.total(), Feed.Kind.ACQUISITION),
                entries);
    }

    private Feed yearFeed(String year, int page) {
        int size = config.pageSize;
        PageResult<BookEntry> result = index.getBooksForYear(year, page, size);
        String title = "Year: " + year + pageSuffix(page, size, result.total());
        return new Feed(CatalogLinks.uuidId("year", year), title, Feed.Kind.ACQUISITION,
                paginationLinks(CatalogLinks.yearHref(year), page, size, result.total(), Feed.Kind.ACQUISITION),
                bookEntries(result.items()));
    }

    private Feed authorFeed(String author, int page) {
        int size = config.pageSize;
        PageResult<BookEntry> result = index.getBooksForAuthor(author, page, size);
        String title = author + pageSuffix(page, size, result.total());
        return new Feed(CatalogLinks.uuidId("author", author), title, Feed.Kind.ACQUISITION,
                paginationLinks(CatalogLinks.authorHref(author), page, size, result.total(), Feed.Kind.ACQUISITION),
                bookEntries(result.items()));
    }

    private Feed searchFeed(String query, int page) {
        int size = config.pageSize;
        PageResult<BookEntry> result = index.searchBooks(query, page, size);
        String title = (query.isBlank() ? "Search" : "Search: " + query.trim())
                + pageSuffix(page, size, result.total());
        String base = "/opds/search?q=" + CatalogLinks.encodeSegment(query);
        return new Feed(CatalogLinks.uuidId("search", query.trim()), title, Feed.Kind.ACQUISITION,
                paginationLinks(base, page, size, result.total(), Feed.Kind.ACQUISITION),
                bookEntries(result.items()));
    }

    // ======================== ENTRIES & LINKS ========================

    private List<FeedEntry> bookEntries(List<BookEntry> books) {
        List<FeedEntry> entries = new ArrayList<>(books.size());
        for (BookEntry book : books) {
            entries.add(bookEntry(book));
        }
        return entries;
    }

    private FeedEntry bookEntry(BookEntry book) {
        String cover = CatalogLinks.coverHref(book.relativePath());
        List<FeedLink> links = List.of(
                new FeedLink(CatalogLinks.ACQUISITION_REL, CatalogLinks.downloadHref(book.relativePath()),
                        CatalogLinks.EPUB_TYPE),
                new FeedLink(CatalogLinks.IMAGE_REL, cover, "image/jpeg"),
                new FeedLink(CatalogLinks.THUMBNAIL_REL, cover, "image/jpeg"));

        String issued = BookMetadata.UNKNOWN.equals(book.publicationYear()) ? null : book.publicationYear();
        return new FeedEntry(CatalogLinks.uuidId("book", book.relativePath()), book.title(), book.author(),
                issued, null, book.lastModified(), links);
    }

    private FeedEntry folderEntry(FolderItem.Folder folder) {
        return navigation(CatalogLinks.folderId(folder.relativePath()), folder.name(), null,
                CatalogLinks.folderHref(folder.relativePath()) + "?page=1", Feed.Kind.ACQUISITION);
    }

    private FeedEntry navigation(String id, String title, String summary, String href, Feed.Kind target) {
        return FeedEntry.navigation(id, title, summary,
                new FeedLink(CatalogLinks.SUBSECTION_REL, href, target.linkType()));
    }

    private List<FeedLink> paginationLinks(String base, int page, int size, int total, Feed.Kind kind) {
        List<FeedLink> links = new ArrayList<>();
        for (PageLink link : Pager.links(base, page, size, total)) {
            links.add(new FeedLink(link.rel(), link.href(), kind.linkType()));
        }
        links.add(startLink());
        return links;
    }

    private List<FeedLink> selfAndStart(String href, Feed.Kind kind) {
        return List.of(new FeedLink(PageLink.SELF, href, kind.linkType()), startLink());
    }

    private FeedLink startLink() {
        return new FeedLink(CatalogLinks.START_REL, ROOT_HREF, Feed.Kind.NAVIGATION.linkType());
    }

    private static String pageSuffix(int page, int size, int total) {
        int totalPages = Pager.totalPages(total, size);
        return totalPages > 1 ? " (Page " + page + " of " + totalPages + ")" : "";
    }

    private static String countSummary(int count) {
        return count == 1 ? "1 book" : count + " books";
    }

    private static String trimSlashes(String path) {
        String trimmed = path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
