package com.plugins.opds.internal.model;

import java.util.List;

public record Feed(
        String id,
        String title,
        Kind kind,
        List<FeedLink> links,
        List<FeedEntry> entries) {

    public enum Kind {
        NAVIGATION("navigation"),
        ACQUISITION("acquisition");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        // Atom link type for links pointing at a feed of this kind
        public String linkType() {
            return "application/atom+xml;profile=opds-catalog;kind=" + value;
        }

        // Content-Type the feed itself is served with
        public String contentType() {
            return "application/xml;profile=opds-catalog;kind=" + value;
        }
    }
}
