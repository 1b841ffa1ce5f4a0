package com.plugins.opds.internal.model;

import java.time.Instant;
import java.util.List;

/**
 * One Atom entry. {@code author}, {@code issued}, {@code summary} and
 * {@code updated} are optional and omitted from the XML when null.
 */
public record FeedEntry(
        String id,
        String title,
        String author,
        String issued,
        String summary,
        Instant updated,
        List<FeedLink> links) {

    public static FeedEntry navigation(String id, String title, String summary, FeedLink link) {
        return new FeedEntry(id, title, null, null, summary, null, List.of(link));
    }
}
