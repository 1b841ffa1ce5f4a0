package com.bookshelf.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Base class for all unit tests.
 * Provides a temporary library root and helpers to write EPUB fixtures into it.
 */
public abstract class TestBase {
    protected static final Logger logger = LoggerFactory.getLogger(TestBase.class);

    protected static final byte[] PNG_BYTES = { (byte) 0x89, 'P', 'N', 'G', 0x0d, 0x0a, 0x1a, 0x0a };

    @TempDir
    protected Path tempDir;

    @BeforeEach
    void setUp(TestInfo testInfo) {
        logger.info("🧪 Starting test: {}", testInfo.getDisplayName());
    }

    @AfterEach
    void tearDown(TestInfo testInfo) {
        logger.info("✅ Finished test: {}", testInfo.getDisplayName());
    }

    /**
     * Writes a minimal EPUB (container.xml + OPF in OEBPS/). Null fields are left out
     * of the OPF; a non-null cover is stored as OEBPS/images/cover.png.
     */
    protected static Path writeEpub(Path file, String title, String author, String date, byte[] cover)
            throws IOException {
        Files.createDirectories(file.getParent());

        StringBuilder metadata = new StringBuilder();
        if (title != null)
            metadata.append("<dc:title>").append(title).append("</dc:title>");
        if (author != null)
            metadata.append("<dc:creator>").append(author).append("</dc:creator>");
        if (date != null)
            metadata.append("<dc:date>").append(date).append("</dc:date>");
        if (cover != null)
            metadata.append("<meta name=\"cover\" content=\"cover-img\"/>");

        String manifest = cover != null
                ? "<item id=\"cover-img\" href=\"images/cover.png\" media-type=\"image/png\"/>"
                : "";

        String opf = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<package xmlns=\"http://www.idpf.org/2007/opf\" version=\"2.0\">"
                + "<metadata xmlns:dc=\"http://purl.org/dc/elements/1.1/\">" + metadata + "</metadata>"
                + "<manifest>" + manifest + "</manifest>"
                + "</package>";

        String container = "<?xml version=\"1.0\"?>"
                + "<container version=\"1.0\" xmlns=\"urn:oasis:names:tc:opendocument:xmlns:container\">"
                + "<rootfiles><rootfile full-path=\"OEBPS/content.opf\" "
                + "media-type=\"application/oebps-package+xml\"/></rootfiles></container>";

        try (OutputStream out = Files.newOutputStream(file);
                ZipOutputStream zip = new ZipOutputStream(out)) {
            putEntry(zip, "mimetype", "application/epub+zip".getBytes(StandardCharsets.US_ASCII));
            putEntry(zip, "META-INF/container.xml", container.getBytes(StandardCharsets.UTF_8));
            putEntry(zip, "OEBPS/content.opf", opf.getBytes(StandardCharsets.UTF_8));
            if (cover != null) {
                putEntry(zip, "OEBPS/images/cover.png", cover);
            }
        }
        return file;
    }

    protected static Path writeEpub(Path file, String title, String author, String date) throws IOException {
        return writeEpub(file, title, author, date, null);
    }

    protected static void setModified(Path file, Instant instant) throws IOException {
        Files.setLastModifiedTime(file, FileTime.from(instant));
    }

    private static void putEntry(ZipOutputStream zip, String name, byte[] data) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(data);
        zip.closeEntry();
    }
}
