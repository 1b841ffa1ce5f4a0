package com.plugins.opds.internal;

import com.plugins.opds.internal.model.Feed;
import com.plugins.opds.internal.model.FeedEntry;
import com.plugins.opds.internal.model.FeedLink;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ProcessingInstruction;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpdsFeedWriterTest {

    private final OpdsFeedWriter writer = new OpdsFeedWriter(
            Clock.fixed(Instant.parse("2024-06-01T12:00:00.123Z"), ZoneOffset.UTC));

    private static Document parse(String xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testAcquisitionFeed() throws Exception {
        FeedEntry book = new FeedEntry("urn:uuid:1", "Tom & Jerry <Annotated>", "Ann", "2001", null,
                Instant.parse("2023-01-02T03:04:05Z"),
                List.of(new FeedLink(CatalogLinks.ACQUISITION_REL, "/download/a%20b.epub", CatalogLinks.EPUB_TYPE)));
        Feed feed = new Feed("urn:all-books", "All Books (Page 1 of 1)", Feed.Kind.ACQUISITION,
                List.of(new FeedLink("self", "/opds/books?page=1", Feed.Kind.ACQUISITION.linkType())),
                List.of(book));

        Document doc = parse(writer.write(feed));
        Element root = doc.getDocumentElement();

        assertEquals("feed", root.getLocalName());
        assertEquals(OpdsFeedWriter.ATOM_NS, root.getNamespaceURI());
        assertEquals("2024-06-01T12:00:00Z",
                root.getElementsByTagNameNS(OpdsFeedWriter.ATOM_NS, "updated").item(0).getTextContent());

        NodeList entries = root.getElementsByTagNameNS(OpdsFeedWriter.ATOM_NS, "entry");
        assertEquals(1, entries.getLength());
        Element entry = (Element) entries.item(0);
        assertEquals("Tom & Jerry <Annotated>",
                entry.getElementsByTagNameNS(OpdsFeedWriter.ATOM_NS, "title").item(0).getTextContent());
        assertEquals("2001", entry.getElementsByTagNameNS(OpdsFeedWriter.DC_NS, "issued").item(0).getTextContent());
        assertEquals("2023-01-02T03:04:05Z",
                entry.getElementsByTagNameNS(OpdsFeedWriter.ATOM_NS, "updated").item(0).getTextContent());

        Element link = (Element) entry.getElementsByTagNameNS(OpdsFeedWriter.ATOM_NS, "link").item(0);
        assertEquals(CatalogLinks.ACQUISITION_REL, link.getAttribute("rel"));
        assertEquals("/download/a%20b.epub", link.getAttribute("href"));
        assertEquals("application/epub+zip", link.getAttribute("type"));
    }

    @Test
    void testNavigationEntryOmitsOptionalFields() throws Exception {
        FeedEntry nav = FeedEntry.navigation("urn:by-year", "By Year", null,
                new FeedLink("subsection", "/opds/years", Feed.Kind.NAVIGATION.linkType()));
        Feed feed = new Feed("urn:library-root", "My Library", Feed.Kind.NAVIGATION, List.of(), List.of(nav));

        Element entry = (Element) parse(writer.write(feed)).getElementsByTagNameNS(OpdsFeedWriter.ATOM_NS, "entry")
                .item(0);
        assertEquals(0, entry.getElementsByTagNameNS(OpdsFeedWriter.ATOM_NS, "author").getLength());
        assertEquals(0, entry.getElementsByTagNameNS(OpdsFeedWriter.ATOM_NS, "content").getLength());
        assertEquals(0, entry.getElementsByTagNameNS(OpdsFeedWriter.DC_NS, "issued").getLength());
    }

    @Test
    void testFeedReferencesBrowserStylesheet() throws Exception {
        Feed feed = new Feed("urn:library-root", "My Library", Feed.Kind.NAVIGATION, List.of(), List.of());

        Document doc = parse(writer.write(feed));
        Node first = doc.getFirstChild();
        assertEquals(Node.PROCESSING_INSTRUCTION_NODE, first.getNodeType());
        ProcessingInstruction stylesheet = (ProcessingInstruction) first;
        assertEquals("xml-stylesheet", stylesheet.getTarget());
        assertEquals("type=\"text/xsl\" href=\"/opds_to_html.xslt\"", stylesheet.getData());
        assertEquals("feed", doc.getDocumentElement().getLocalName());

        assertFalse(writer.writeError(500, "Boom").contains("xml-stylesheet"), "Error documents stay bare");
    }

    @Test
    void testErrorDocument() throws Exception {
        Element error = parse(writer.writeError(404, "Folder not found")).getDocumentElement();
        assertEquals("error", error.getTagName());
        assertEquals("404", error.getElementsByTagName("code").item(0).getTextContent());
        assertEquals("Folder not found", error.getElementsByTagName("message").item(0).getTextContent());
    }

    @Test
    void testKindContentTypes() {
        assertEquals("application/xml;profile=opds-catalog;kind=navigation", Feed.Kind.NAVIGATION.contentType());
        assertEquals("application/atom+xml;profile=opds-catalog;kind=acquisition",
                Feed.Kind.ACQUISITION.linkType());
    }

    @Test
    void testPathEncoding() {
        assertEquals("Jules%20Verne/Le%20Tour%20%2B%20monde.epub", CatalogLinks.encodePath("Jules Verne/Le Tour + monde.epub"));
        assertEquals("%23", CatalogLinks.encodeSegment("#"));
        assertEquals(CatalogLinks.uuidId("book", "a.epub"), CatalogLinks.uuidId("book", "a.epub"));
        assertNotEquals(CatalogLinks.uuidId("book", "a.epub"), CatalogLinks.uuidId("author", "a.epub"));
        assertTrue(CatalogLinks.folderId("shelf").startsWith("urn:folder:"));
    }

    @Test
    void testContentDisposition() {
        assertEquals("attachment; filename=\"plain.epub\"", BookFileHandler.contentDisposition("plain.epub"));
        assertEquals("attachment; filename=\"_t_.epub\"; filename*=UTF-8''%C3%89t%C3%A9.epub",
                BookFileHandler.contentDisposition("Été.epub"));
    }
}
