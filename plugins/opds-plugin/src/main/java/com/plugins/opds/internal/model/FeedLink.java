package com.plugins.opds.internal.model;

public record FeedLink(String rel, String href, String type) {
}
