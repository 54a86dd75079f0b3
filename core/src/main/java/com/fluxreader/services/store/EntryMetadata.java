package com.fluxreader.services.store;

import com.fluxreader.common.model.CategoryRef;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.common.model.FeedRef;
import com.fluxreader.common.util.TimeUtils;
import com.google.gson.annotations.SerializedName;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Side record stored next to a downloaded entry.
 * {@link #images} maps local file names to the URL they were fetched from.
 */
public class EntryMetadata {

    public record Ref(long id, String title) {
    }

    private long id;
    private String title;
    private String url;
    private EntryStatus status;
    private boolean starred;
    @SerializedName("published_at")
    private String publishedAt;
    private Ref feed;
    private Ref category;
    private Map<String, String> images = new LinkedHashMap<>();
    @SerializedName("last_updated")
    private String lastUpdated;

    public EntryMetadata() {
    }

    public static EntryMetadata fromEntry(Entry entry, Map<String, String> images) {
        EntryMetadata m = new EntryMetadata();
        m.id = entry.getId();
        m.title = entry.getTitle();
        m.url = entry.getUrl();
        m.status = entry.getStatus();
        m.starred = entry.isStarred();
        m.publishedAt = entry.getPublishedAt();
        FeedRef feed = entry.getFeed();
        if (feed != null) m.feed = new Ref(feed.id(), feed.title());
        CategoryRef category = entry.getCategory();
        if (category != null) m.category = new Ref(category.id(), category.title());
        if (images != null) m.images = new LinkedHashMap<>(images);
        m.touch();
        return m;
    }

    public void touch() {
        this.lastUpdated = TimeUtils.nowStamp();
    }

    public long getId() { return id; }
    public String getTitle() { return title; }
    public String getUrl() { return url; }

    public EntryStatus getStatus() { return status; }
    public void setStatus(EntryStatus status) { this.status = status; }

    public boolean isStarred() { return starred; }
    public void setStarred(boolean starred) { this.starred = starred; }

    public String getPublishedAt() { return publishedAt; }
    public Ref getFeed() { return feed; }
    public Ref getCategory() { return category; }

    public Map<String, String> getImages() {
        return images != null ? images : Map.of();
    }

    public String getLastUpdated() { return lastUpdated; }

    /**
     * Rebuilds a display entry from the stored projection. Content is not part of the metadata.
     */
    public Entry toEntry() {
        Entry entry = new Entry(id, title);
        entry.setUrl(url);
        entry.setStatus(status);
        entry.setStarred(starred);
        entry.setPublishedAt(publishedAt);
        if (feed != null || category != null) {
            CategoryRef cat = category != null ? new CategoryRef(category.id(), category.title()) : null;
            entry.setFeed(feed != null ? new FeedRef(feed.id(), feed.title(), cat) : new FeedRef(0, null, cat));
        }
        return entry;
    }

    public boolean isRead() {
        return status == EntryStatus.READ;
    }

    public EntryMetadata copy() {
        EntryMetadata m = new EntryMetadata();
        m.id = id;
        m.title = title;
        m.url = url;
        m.status = status;
        m.starred = starred;
        m.publishedAt = publishedAt;
        m.feed = feed;
        m.category = category;
        m.images = new LinkedHashMap<>(getImages());
        m.lastUpdated = lastUpdated;
        return m;
    }
}
