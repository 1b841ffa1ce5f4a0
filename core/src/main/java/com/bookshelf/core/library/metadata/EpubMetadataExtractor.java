package com.bookshelf.core.library.metadata;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts title, creator, date and cover from EPUB archives.
 *
 * Lookup chain: META-INF/container.xml -> rootfile (OPF package) -> dc:* elements
 * inside the package metadata. Namespace prefixes are ignored, only local names count.
 */
public class EpubMetadataExtractor implements MetadataExtractor {
    private static final Logger logger = LoggerFactory.getLogger(EpubMetadataExtractor.class);

    private static final String CONTAINER_PATH = "META-INF/container.xml";
    private static final String PACKAGE_MEDIA_TYPE = "application/oebps-package+xml";

    private static final Map<String, String> IMAGE_TYPES = Map.of(
            ".jpg", "image/jpeg",
            ".jpeg", "image/jpeg",
            ".png", "image/png",
            ".gif", "image/gif",
            ".webp", "image/webp");

    @Override
    public BookMetadata extract(Path path) {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            PackageDocument opf = readPackage(zip);
            if (opf == null) {
                return BookMetadata.EMPTY;
            }

            Element metadata = firstByLocalName(opf.document(), "metadata");
            if (metadata == null) {
                return BookMetadata.EMPTY;
            }

            return new BookMetadata(
                    textOf(metadata, "title"),
                    textOf(metadata, "creator"),
                    textOf(metadata, "date"));
        } catch (Exception e) {
            logger.debug("Could not read metadata from {}: {}", path, e.getMessage());
            return BookMetadata.EMPTY;
        }
    }

    @Override
    public Optional<CoverImage> extractCover(Path path) {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            PackageDocument opf = readPackage(zip);
            if (opf == null) {
                return Optional.empty();
            }

            Element coverItem = findCoverItem(opf.document());
            if (coverItem == null || coverItem.attr("href").isBlank()) {
                return Optional.empty();
            }

            String href = coverItem.attr("href");
            ZipEntry entry = findEntry(zip, opf.resolve(href));
            if (entry == null) {
                return Optional.empty();
            }

            byte[] data;
            try (InputStream in = zip.getInputStream(entry)) {
                data = in.readAllBytes();
            }

            String mimeType = coverItem.attr("media-type");
            if (mimeType.isBlank()) {
                mimeType = guessImageType(href);
            }
            return Optional.of(new CoverImage(data, mimeType));
        } catch (Exception e) {
            logger.debug("Could not read cover from {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private PackageDocument readPackage(ZipFile zip) throws IOException {
        String containerXml = readEntry(zip, CONTAINER_PATH);
        if (containerXml == null) {
            return null;
        }

        Document container = Jsoup.parse(containerXml, "", Parser.xmlParser());
        String opfPath = null;
        for (Element rootfile : container.getAllElements()) {
            if ("rootfile".equals(localName(rootfile))
                    && PACKAGE_MEDIA_TYPE.equals(rootfile.attr("media-type"))) {
                opfPath = rootfile.attr("full-path");
                break;
            }
        }
        if (opfPath == null || opfPath.isBlank()) {
            return null;
        }

        String opfXml = readEntry(zip, opfPath);
        if (opfXml == null) {
            return null;
        }

        int slash = opfPath.lastIndexOf('/');
        String opfDir = slash >= 0 ? opfPath.substring(0, slash) : "";
        return new PackageDocument(Jsoup.parse(opfXml, "", Parser.xmlParser()), opfDir);
    }

    // EPUB 2: <meta name="cover" content="id"/>, EPUB 3: <item properties="cover-image"/>
    private Element findCoverItem(Document opf) {
        String coverId = null;
        for (Element meta : opf.getAllElements()) {
            if ("meta".equals(localName(meta)) && "cover".equals(meta.attr("name"))) {
                coverId = meta.attr("content");
                break;
            }
        }

        for (Element item : opf.getAllElements()) {
            if (!"item".equals(localName(item))) {
                continue;
            }
            if (coverId != null && !coverId.isBlank() && coverId.equals(item.attr("id"))) {
                return item;
            }
        }

        for (Element item : opf.getAllElements()) {
            if ("item".equals(localName(item))
                    && item.attr("properties").contains("cover-image")) {
                return item;
            }
        }
        return null;
    }

    private ZipEntry findEntry(ZipFile zip, String name) {
        ZipEntry entry = zip.getEntry(name);
        if (entry == null) {
            // hrefs may be percent-encoded
            String decoded = URLDecoder.decode(name.replace("+", "%2B"), StandardCharsets.UTF_8);
            entry = zip.getEntry(decoded);
        }
        return entry;
    }

    private String readEntry(ZipFile zip, String name) throws IOException {
        ZipEntry entry = zip.getEntry(name);
        if (entry == null) {
            return null;
        }
        try (InputStream in = zip.getInputStream(entry)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String textOf(Element metadata, String localName) {
        Element element = firstByLocalName(metadata, localName);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private Element firstByLocalName(Element parent, String localName) {
        for (Element element : parent.getAllElements()) {
            if (localName.equals(localName(element))) {
                return element;
            }
        }
        return null;
    }

    private static String localName(Element element) {
        String name = element.tagName();
        int colon = name.indexOf(':');
        return (colon >= 0 ? name.substring(colon + 1) : name).toLowerCase(Locale.ROOT);
    }

    private static String guessImageType(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot < 0) {
            return "image/jpeg";
        }
        return IMAGE_TYPES.getOrDefault(lower.substring(dot), "image/jpeg");
    }

    private record PackageDocument(Document document, String directory) {
        String resolve(String href) {
            String joined = directory.isEmpty() ? href : directory + "/" + href;
            return Path.of(joined).normalize().toString().replace('\\', '/');
        }
    }
}
