package com.fluxreader.common.model;

/**
 * Feed attribution of an entry. The API nests the category inside the feed.
 */
public record FeedRef(long id, String title, CategoryRef category) {}
