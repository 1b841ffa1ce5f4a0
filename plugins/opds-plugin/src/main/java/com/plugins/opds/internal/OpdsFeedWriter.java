package com.plugins.opds.internal;

import com.plugins.opds.internal.model.Feed;
import com.plugins.opds.internal.model.FeedEntry;
import com.plugins.opds.internal.model.FeedLink;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Renders {@link Feed}s as Atom/OPDS 1.2 XML.
 */
public class OpdsFeedWriter {
    static final String ATOM_NS = "http://www.w3.org/2005/Atom";
    static final String OPDS_NS = "http://opds-spec.org/2010/catalog";
    static final String DC_NS = "http://purl.org/dc/terms/";
    static final String STYLESHEET_PATH = "/opds_to_html.xslt";

    private final XMLOutputFactory factory = XMLOutputFactory.newFactory();
    private final Clock clock;

    public OpdsFeedWriter(Clock clock) {
        this.clock = clock;
    }

    public String write(Feed feed) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = factory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            // browsers render the feed through the stylesheet, OPDS readers ignore it
            xml.writeProcessingInstruction("xml-stylesheet",
                    "type=\"text/xsl\" href=\"" + STYLESHEET_PATH + "\"");
            xml.writeStartElement("feed");
            xml.writeDefaultNamespace(ATOM_NS);
            xml.writeNamespace("opds", OPDS_NS);
            xml.writeNamespace("dc", DC_NS);

            element(xml, "id", feed.id());
            element(xml, "title", feed.title());
            element(xml, "updated", timestamp(clock.instant()));

            xml.writeStartElement("author");
            element(xml, "name", "BookShelf");
            xml.writeEndElement();

            for (FeedLink link : feed.links()) {
                link(xml, link);
            }
            for (FeedEntry entry : feed.entries()) {
                entry(xml, entry);
            }

            xml.writeEndElement();
            xml.writeEndDocument();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to render feed " + feed.id(), e);
        }
        return out.toString();
    }

    /**
     * Small XML error document: {@code <error><code/><message/></error>}.
     */
    public String writeError(int code, String message) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = factory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("error");
            element(xml, "code", String.valueOf(code));
            element(xml, "message", message);
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to render error " + code, e);
        }
        return out.toString();
    }

    private void entry(XMLStreamWriter xml, FeedEntry entry) throws XMLStreamException {
        xml.writeStartElement("entry");
        element(xml, "title", entry.title());
        element(xml, "id", entry.id());
        element(xml, "updated", timestamp(entry.updated() != null ? entry.updated() : clock.instant()));

        if (entry.author() != null) {
            xml.writeStartElement("author");
            element(xml, "name", entry.author());
            xml.writeEndElement();
        }
        if (entry.issued() != null) {
            xml.writeStartElement("dc", "issued", DC_NS);
            xml.writeCharacters(entry.issued());
            xml.writeEndElement();
        }
        if (entry.summary() != null) {
            xml.writeStartElement("content");
            xml.writeAttribute("type", "text");
            xml.writeCharacters(entry.summary());
            xml.writeEndElement();
        }
        for (FeedLink link : entry.links()) {
            link(xml, link);
        }
        xml.writeEndElement();
    }

    private void link(XMLStreamWriter xml, FeedLink link) throws XMLStreamException {
        xml.writeEmptyElement("link");
        xml.writeAttribute("rel", link.rel());
        xml.writeAttribute("href", link.href());
        xml.writeAttribute("type", link.type());
    }

    private void element(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeCharacters(text != null ? text : "");
        xml.writeEndElement();
    }

    private static String timestamp(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
