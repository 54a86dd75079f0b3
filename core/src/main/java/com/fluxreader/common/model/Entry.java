package com.fluxreader.common.model;

import com.google.gson.annotations.SerializedName;

/**
 * One article as returned by the feed server. The server owns every field,
 * local copies are projections of it.
 */
public class Entry {
    private long id;
    private String title;
    private String content;
    private String summary;
    private String url;
    @SerializedName("published_at")
    private String publishedAt;
    private EntryStatus status;
    private boolean starred;
    private FeedRef feed;

    public Entry() {
    }

    public Entry(long id, String title) {
        this.id = id;
        this.title = title;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getPublishedAt() { return publishedAt; }
    public void setPublishedAt(String publishedAt) { this.publishedAt = publishedAt; }

    public EntryStatus getStatus() { return status; }
    public void setStatus(EntryStatus status) { this.status = status; }

    public boolean isStarred() { return starred; }
    public void setStarred(boolean starred) { this.starred = starred; }

    public FeedRef getFeed() { return feed; }
    public void setFeed(FeedRef feed) { this.feed = feed; }

    public CategoryRef getCategory() {
        return feed != null ? feed.category() : null;
    }

    /**
     * Content to render offline: full content when present, summary otherwise.
     */
    public String getBestContent() {
        if (content != null && !content.isEmpty()) return content;
        return summary != null ? summary : "";
    }

    public String getDisplayTitle() {
        return title != null && !title.isBlank() ? title : "Untitled Entry";
    }

    @Override
    public String toString() {
        return "Entry{" + id + ", '" + title + "', " + status + (starred ? ", starred" : "") + "}";
    }
}
