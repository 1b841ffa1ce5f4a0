package com.bookshelf.core.library;

import com.bookshelf.common.security.ContentGuard;
import com.bookshelf.core.library.metadata.BookMetadata;
import com.bookshelf.core.library.metadata.MetadataExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory index over the book files below the content root.
 *
 * Cached structures (file list, year/author indexes, recent books) are built
 * lazily on first use and dropped as a whole by {@link #invalidate()}. Queries
 * use the cheap path indexes to pick a page and only then extract full metadata
 * for the books on that page.
 *
 * Thread safety: every cache has its own build lock so that at most one thread
 * rebuilds it, the published values are immutable, and a generation counter keeps
 * a build that overlapped an invalidation from publishing its result.
 */
public class LibraryIndex {
    private static final Logger logger = LoggerFactory.getLogger(LibraryIndex.class);

    public static final Duration DEFAULT_RECENT_TTL = Duration.ofSeconds(300);
    public static final String NON_ALPHA_LETTER = "#";

    private static final Comparator<Path> FILENAME_ORDER = Comparator
            .comparing((Path p) -> p.getFileName().toString().toLowerCase(Locale.ROOT))
            .thenComparing(Path::toString);

    private static final Comparator<FacetCount> YEAR_ORDER = (a, b) -> {
        boolean aUnknown = BookMetadata.UNKNOWN.equals(a.name());
        boolean bUnknown = BookMetadata.UNKNOWN.equals(b.name());
        if (aUnknown || bUnknown) {
            return Boolean.compare(aUnknown, bUnknown);
        }
        return Integer.compare(Integer.parseInt(b.name()), Integer.parseInt(a.name()));
    };

    private static final Comparator<FacetCount> AUTHOR_ORDER = (a, b) -> {
        boolean aUnknown = BookMetadata.UNKNOWN.equals(a.name());
        boolean bUnknown = BookMetadata.UNKNOWN.equals(b.name());
        if (aUnknown || bUnknown) {
            return Boolean.compare(aUnknown, bUnknown);
        }
        int cmp = String.CASE_INSENSITIVE_ORDER.compare(a.name(), b.name());
        return cmp != 0 ? cmp : a.name().compareTo(b.name());
    };

    private final Path root;
    private final MetadataExtractor extractor;
    private final ContentGuard guard;
    private final Duration recentTtl;
    private final Clock clock;
    private final LibraryWalker walker;

    private final AtomicLong generation = new AtomicLong();
    private final Object stateLock = new Object();
    private final Object pathsLock = new Object();
    private final Object facetLock = new Object();
    private final Object recentLock = new Object();

    private volatile List<Path> allPaths;
    private volatile FacetIndex facets;
    private volatile RecentSnapshot recent;

    private record FacetIndex(Map<String, List<Path>> byYear, Map<String, List<Path>> byAuthor) {
    }

    private record RecentSnapshot(List<BookEntry> entries, int limit, Instant expiresAt) {
    }

    private record RecentCandidate(Path path, Instant lastModified, long sequence) {
    }

    public LibraryIndex(Path contentRoot, MetadataExtractor extractor, ContentGuard guard) {
        this(contentRoot, extractor, guard, DEFAULT_RECENT_TTL, Clock.systemUTC());
    }

    public LibraryIndex(Path contentRoot, MetadataExtractor extractor, ContentGuard guard,
            Duration recentTtl, Clock clock) {
        this.root = contentRoot.toAbsolutePath().normalize();
        this.extractor = extractor;
        this.guard = guard;
        this.recentTtl = recentTtl;
        this.clock = clock;
        this.walker = new LibraryWalker(this.root);
    }

    public Path getContentRoot() {
        return root;
    }

    // =================================================================================
    // CACHE LIFECYCLE
    // =================================================================================

    /**
     * Drops every cached structure. The next query rebuilds from a fresh walk.
     */
    public void invalidate() {
        synchronized (stateLock) {
            generation.incrementAndGet();
            allPaths = null;
            facets = null;
            recent = null;
        }
        logger.info("♻️ Library cache invalidated");
    }

    private void publish(long expectedGeneration, Runnable assignment) {
        synchronized (stateLock) {
            if (generation.get() == expectedGeneration) {
                assignment.run();
            } else {
                logger.debug("Discarding cache build that overlapped an invalidation");
            }
        }
    }

    /**
     * All book files below the root, sorted by file name (case-insensitive).
     */
    public List<Path> enumerate() {
        List<Path> cached = allPaths;
        if (cached != null) {
            return cached;
        }

        synchronized (pathsLock) {
            cached = allPaths;
            if (cached != null) {
                return cached;
            }

            long gen = generation.get();
            long started = System.nanoTime();

            List<Path> paths = new ArrayList<>();
            walker.walk(file -> paths.add(file.path()));
            paths.sort(FILENAME_ORDER);
            List<Path> snapshot = Collections.unmodifiableList(paths);

            publish(gen, () -> allPaths = snapshot);
            logger.info("📚 Enumerated {} books under {} in {} ms",
                    snapshot.size(), root, (System.nanoTime() - started) / 1_000_000);
            return snapshot;
        }
    }

    // =================================================================================
    // QUERIES
    // =================================================================================

    public PageResult<BookEntry> getAllBooksPaginated(int page, int size) {
        List<Path> paths = enumerate();
        return new PageResult<>(hydrateAll(Pager.slice(paths, page, size)), paths.size());
    }

    /**
     * Immediate subfolders (sorted by name) followed by immediate books (sorted by title),
     * paginated as one combined sequence.
     *
     * @throws FolderNotFoundException if the folder is missing or not allowed
     */
    public PageResult<FolderItem> getFolderContentPaginated(String folderPath, int page, int size) {
        Path folder = resolveFolder(folderPath);

        List<FolderItem> items = new ArrayList<>(listSubfolders(folder));

        List<BookEntry> books = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path child : stream) {
                if (!LibraryWalker.isHidden(child) && LibraryWalker.isBookFile(child)
                        && Files.isRegularFile(child)) {
                    hydrate(child).ifPresent(books::add);
                }
            }
        } catch (IOException e) {
            logger.warn("Could not list books in {}: {}", folder, e.toString());
        }

        books.sort(Comparator.comparing((BookEntry b) -> b.title().toLowerCase(Locale.ROOT))
                .thenComparing(BookEntry::relativePath));
        for (BookEntry book : books) {
            items.add(new FolderItem.Book(book));
        }

        return new PageResult<>(Pager.slice(items, page, size), items.size());
    }

    /**
     * Non-hidden immediate subfolders of a library folder, sorted by name.
     *
     * @throws FolderNotFoundException if the folder is missing or not allowed
     */
    public List<FolderItem.Folder> getSubfolders(String folderPath) {
        return listSubfolders(resolveFolder(folderPath));
    }

    /**
     * The {@code limit} most recently modified books, newest first.
     * Selection uses a bounded min-heap; the result is cached for the recent TTL.
     */
    public List<BookEntry> scanRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }

        RecentSnapshot snapshot = recent;
        if (isServable(snapshot, limit)) {
            return head(snapshot.entries(), limit);
        }

        synchronized (recentLock) {
            snapshot = recent;
            if (isServable(snapshot, limit)) {
                return head(snapshot.entries(), limit);
            }

            long gen = generation.get();
            // Head is the entry to evict: oldest, and among equally old the last one walked
            PriorityQueue<RecentCandidate> heap = new PriorityQueue<>(limit,
                    Comparator.comparing(RecentCandidate::lastModified)
                            .thenComparing(Comparator.comparingLong(RecentCandidate::sequence).reversed()));
            AtomicLong sequence = new AtomicLong();

            walker.walk(file -> {
                RecentCandidate candidate = new RecentCandidate(
                        file.path(), file.lastModified(), sequence.getAndIncrement());
                if (heap.size() < limit) {
                    heap.offer(candidate);
                } else if (candidate.lastModified().isAfter(heap.peek().lastModified())) {
                    heap.poll();
                    heap.offer(candidate);
                }
            });

            List<RecentCandidate> newestFirst = new ArrayList<>(heap);
            newestFirst.sort(Comparator.comparing(RecentCandidate::lastModified).reversed()
                    .thenComparingLong(RecentCandidate::sequence));

            List<BookEntry> entries = new ArrayList<>();
            for (RecentCandidate candidate : newestFirst) {
                hydrate(candidate.path()).ifPresent(entries::add);
            }

            List<BookEntry> frozen = List.copyOf(entries);
            Instant expiresAt = clock.instant().plus(recentTtl);
            publish(gen, () -> recent = new RecentSnapshot(frozen, limit, expiresAt));
            return frozen;
        }
    }

    /**
     * Builds the year and author indexes in one pass. No-op when both exist.
     */
    public void buildYearAuthorIndexes() {
        facetIndex();
    }

    public List<FacetCount> getYearsWithCounts() {
        return counts(facetIndex().byYear(), YEAR_ORDER);
    }

    public List<FacetCount> getAuthorsWithCounts() {
        return counts(facetIndex().byAuthor(), AUTHOR_ORDER);
    }

    /**
     * Distinct upper-case initials of all authors, with "#" (unknown or
     * non-alphabetic) sorted last.
     */
    public List<String> getAuthorLetters() {
        TreeSet<String> letters = new TreeSet<>();
        boolean hasOther = false;
        for (String author : facetIndex().byAuthor().keySet()) {
            String letter = letterOf(author);
            if (NON_ALPHA_LETTER.equals(letter)) {
                hasOther = true;
            } else {
                letters.add(letter);
            }
        }
        List<String> result = new ArrayList<>(letters);
        if (hasOther) {
            result.add(NON_ALPHA_LETTER);
        }
        return result;
    }

    /**
     * Authors whose name starts with the given letter (case-insensitive). The "#"
     * letter selects "Unknown" and names starting with a non-alphabetic character.
     */
    public PageResult<FacetCount> getAuthorsByLetter(String letter, int page, int size) {
        if (letter == null || letter.isBlank()) {
            return PageResult.empty();
        }
        String wanted = letter.trim();
        wanted = NON_ALPHA_LETTER.equals(wanted)
                ? NON_ALPHA_LETTER
                : new String(Character.toChars(Character.toUpperCase(wanted.codePointAt(0))));

        List<FacetCount> matching = new ArrayList<>();
        for (FacetCount author : getAuthorsWithCounts()) {
            if (wanted.equals(letterOf(author.name()))) {
                matching.add(author);
            }
        }
        return new PageResult<>(Pager.slice(matching, page, size), matching.size());
    }

    public PageResult<BookEntry> getBooksForYear(String year, int page, int size) {
        return pageOf(facetIndex().byYear().getOrDefault(year, List.of()), page, size);
    }

    public PageResult<BookEntry> getBooksForAuthor(String author, int page, int size) {
        return pageOf(facetIndex().byAuthor().getOrDefault(author, List.of()), page, size);
    }

    /**
     * Case-insensitive substring search over title and author. A blank query
     * lists all books.
     */
    public PageResult<BookEntry> searchBooks(String query, int page, int size) {
        if (query == null || query.isBlank()) {
            return getAllBooksPaginated(page, size);
        }

        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<Path> matches = new ArrayList<>();
        boolean stale = false;
        for (Path path : enumerate()) {
            if (!Files.exists(path)) {
                stale = true;
                continue;
            }
            BookMetadata metadata = extractor.extract(path);
            String title = metadata.title() != null ? metadata.title() : fileName(path);
            if (title.toLowerCase(Locale.ROOT).contains(needle)
                    || metadata.authorOrUnknown().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(path);
            }
        }

        if (stale) {
            invalidateForMissing("search");
        }

        logger.debug("Search '{}' matched {} books", query, matches.size());
        return pageOf(matches, page, size);
    }

    // =================================================================================
    // INTERNALS
    // =================================================================================

    private FacetIndex facetIndex() {
        FacetIndex cached = facets;
        if (cached != null) {
            return cached;
        }

        synchronized (facetLock) {
            cached = facets;
            if (cached != null) {
                return cached;
            }

            long gen = generation.get();
            long started = System.nanoTime();
            List<Path> paths = enumerate();

            // Only author and date are needed here; titles are read at hydration time
            Map<String, List<Path>> byYear = new HashMap<>();
            Map<String, List<Path>> byAuthor = new HashMap<>();
            boolean stale = false;
            for (Path path : paths) {
                if (!Files.exists(path)) {
                    stale = true;
                    continue;
                }
                BookMetadata metadata = extractor.extract(path);
                byYear.computeIfAbsent(metadata.publicationYear(), k -> new ArrayList<>()).add(path);
                byAuthor.computeIfAbsent(metadata.authorOrUnknown(), k -> new ArrayList<>()).add(path);
            }

            // paths come in file name order, so every value list already is too
            FacetIndex built = new FacetIndex(freeze(byYear), freeze(byAuthor));
            if (stale) {
                // bumps the generation, so this build is returned but never published
                invalidateForMissing("year/author index build");
            }
            publish(gen, () -> facets = built);
            logger.info("🗂️ Built year/author indexes: {} years, {} authors in {} ms",
                    byYear.size(), byAuthor.size(), (System.nanoTime() - started) / 1_000_000);
            return built;
        }
    }

    private void invalidateForMissing(String phase) {
        logger.info("Cached book list is stale (file missing during {}), invalidating library cache", phase);
        invalidate();
    }

    private boolean isServable(RecentSnapshot snapshot, int limit) {
        if (snapshot == null || snapshot.limit() < limit || !clock.instant().isBefore(snapshot.expiresAt())) {
            return false;
        }
        for (BookEntry entry : snapshot.entries()) {
            if (!Files.exists(entry.absolutePath())) {
                logger.info("Recent book {} disappeared", entry.relativePath());
                invalidate();
                return false;
            }
        }
        return true;
    }

    private PageResult<BookEntry> pageOf(List<Path> paths, int page, int size) {
        return new PageResult<>(hydrateAll(Pager.slice(paths, page, size)), paths.size());
    }

    private List<BookEntry> hydrateAll(List<Path> paths) {
        List<BookEntry> entries = new ArrayList<>(paths.size());
        for (Path path : paths) {
            hydrate(path).ifPresent(entries::add);
        }
        return entries;
    }

    /**
     * Reads full metadata for one file. A file whose modification time can no longer be read
     * invalidates the whole index and is left out of the result.
     */
    private Optional<BookEntry> hydrate(Path path) {
        String relative = relativize(path);
        if (guard.hasTraversal(relative) || !guard.contains(root, path)) {
            logger.warn("Refusing to serve {}: outside library or suspicious path", path);
            return Optional.empty();
        }

        Instant lastModified;
        try {
            lastModified = Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            logger.info("Cached book {} is gone ({}), invalidating library cache",
                    relative, e.getClass().getSimpleName());
            invalidate();
            return Optional.empty();
        }

        BookMetadata metadata = extractor.extract(path);
        String title = metadata.title() != null ? metadata.title() : fileName(path);
        return Optional.of(new BookEntry(path, relative, title,
                metadata.authorOrUnknown(), metadata.publicationYear(), lastModified));
    }

    private Path resolveFolder(String folderPath) {
        String relative = folderPath == null ? "" : folderPath.replace('\\', '/');
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        while (relative.endsWith("/")) {
            relative = relative.substring(0, relative.length() - 1);
        }

        if (guard.hasTraversal(relative)) {
            throw new FolderNotFoundException(folderPath, "invalid path");
        }
        Path folder = relative.isEmpty() ? root : root.resolve(relative).normalize();
        if (!guard.contains(root, folder)) {
            throw new FolderNotFoundException(folderPath, "outside library");
        }
        if (!Files.isDirectory(folder)) {
            throw new FolderNotFoundException(folderPath, "not a directory");
        }
        return folder;
    }

    private List<FolderItem.Folder> listSubfolders(Path folder) {
        List<FolderItem.Folder> folders = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path child : stream) {
                if (!LibraryWalker.isHidden(child) && Files.isDirectory(child)) {
                    folders.add(new FolderItem.Folder(fileName(child), relativize(child)));
                }
            }
        } catch (IOException e) {
            logger.warn("Could not list folders in {}: {}", folder, e.toString());
        }
        folders.sort(Comparator.comparing(FolderItem.Folder::name, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(FolderItem.Folder::name));
        return folders;
    }

    private String relativize(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    private static String letterOf(String author) {
        if (author.isEmpty() || BookMetadata.UNKNOWN.equals(author)) {
            return NON_ALPHA_LETTER;
        }
        int first = author.codePointAt(0);
        if (!Character.isLetter(first)) {
            return NON_ALPHA_LETTER;
        }
        return new String(Character.toChars(Character.toUpperCase(first)));
    }

    private static List<FacetCount> counts(Map<String, List<Path>> index, Comparator<FacetCount> order) {
        List<FacetCount> counts = new ArrayList<>(index.size());
        for (Map.Entry<String, List<Path>> entry : index.entrySet()) {
            counts.add(new FacetCount(entry.getKey(), entry.getValue().size()));
        }
        counts.sort(order);
        return counts;
    }

    private static Map<String, List<Path>> freeze(Map<String, List<Path>> index) {
        Map<String, List<Path>> frozen = new LinkedHashMap<>();
        index.forEach((key, paths) -> frozen.put(key, List.copyOf(paths)));
        return Collections.unmodifiableMap(frozen);
    }

    private static <T> List<T> head(List<T> items, int limit) {
        return items.size() <= limit ? items : items.subList(0, limit);
    }
}
