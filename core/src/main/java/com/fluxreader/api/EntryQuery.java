package com.fluxreader.api;

import com.fluxreader.common.model.EntryStatus;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Filter parameters for listing entries. Built with {@link #builder()}.
 */
public final class EntryQuery {
    private final EnumSet<EntryStatus> statuses;
    private final String order;
    private final String direction;
    private final Integer limit;
    private final Long feedId;
    private final Long categoryId;
    private final String search;
    private final Boolean starred;
    private final Long publishedBefore;
    private final Long publishedAfter;

    private EntryQuery(Builder b) {
        this.statuses = EnumSet.copyOf(b.statuses);
        this.order = b.order;
        this.direction = b.direction;
        this.limit = b.limit;
        this.feedId = b.feedId;
        this.categoryId = b.categoryId;
        this.search = b.search;
        this.starred = b.starred;
        this.publishedBefore = b.publishedBefore;
        this.publishedAfter = b.publishedAfter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<EntryStatus> getStatuses() {
        return EnumSet.copyOf(statuses);
    }

    public String getDirection() {
        return direction;
    }

    public Integer getLimit() {
        return limit;
    }

    public Long getFeedId() {
        return feedId;
    }

    public Long getCategoryId() {
        return categoryId;
    }

    public Boolean getStarred() {
        return starred;
    }

    public Long getPublishedBefore() {
        return publishedBefore;
    }

    public Long getPublishedAfter() {
        return publishedAfter;
    }

    /**
     * Renders the query string without the leading '?'.
     * A status set of exactly {unread, read} is the server default and is omitted.
     */
    public String toQueryString() {
        List<String> parts = new ArrayList<>();
        boolean defaultStatuses = statuses.equals(EnumSet.of(EntryStatus.UNREAD, EntryStatus.READ));
        if (!defaultStatuses) {
            for (EntryStatus s : statuses) {
                parts.add("status=" + s.wireName());
            }
        }
        add(parts, "order", order);
        add(parts, "direction", direction);
        add(parts, "limit", limit);
        add(parts, "feed_id", feedId);
        add(parts, "category_id", categoryId);
        add(parts, "search", search);
        add(parts, "starred", starred);
        add(parts, "published_before", publishedBefore);
        add(parts, "published_after", publishedAfter);
        return String.join("&", parts);
    }

    private static void add(List<String> parts, String key, Object value) {
        if (value == null) return;
        String text = value.toString();
        if (text.isEmpty()) return;
        parts.add(key + "=" + URLEncoder.encode(text, StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "EntryQuery{" + toQueryString() + "}";
    }

    public static final class Builder {
        private final EnumSet<EntryStatus> statuses = EnumSet.noneOf(EntryStatus.class);
        private String order;
        private String direction;
        private Integer limit;
        private Long feedId;
        private Long categoryId;
        private String search;
        private Boolean starred;
        private Long publishedBefore;
        private Long publishedAfter;

        private Builder() {
        }

        public Builder status(EntryStatus... values) {
            statuses.addAll(List.of(values));
            return this;
        }

        public Builder statuses(Set<EntryStatus> values) {
            statuses.addAll(values);
            return this;
        }

        public Builder order(String order) {
            this.order = order;
            return this;
        }

        public Builder direction(String direction) {
            this.direction = direction;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder feedId(Long feedId) {
            this.feedId = feedId;
            return this;
        }

        public Builder categoryId(Long categoryId) {
            this.categoryId = categoryId;
            return this;
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public Builder starred(Boolean starred) {
            this.starred = starred;
            return this;
        }

        public Builder publishedBefore(Long unixSeconds) {
            this.publishedBefore = unixSeconds;
            return this;
        }

        public Builder publishedAfter(Long unixSeconds) {
            this.publishedAfter = unixSeconds;
            return this;
        }

        public EntryQuery build() {
            return new EntryQuery(this);
        }
    }
}
