package com.fluxreader.common.model;

import com.google.gson.annotations.SerializedName;

/**
 * Server-side entry status as used by the Miniflux API.
 */
public enum EntryStatus {
    @SerializedName("unread") UNREAD("unread"),
    @SerializedName("read") READ("read"),
    @SerializedName("removed") REMOVED("removed");

    private final String wireName;

    EntryStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * The status a queued change is assumed to replace. Only used for diagnostics.
     */
    public EntryStatus opposite() {
        return this == READ ? UNREAD : READ;
    }

    public static EntryStatus fromWire(String value) {
        if (value == null) return null;
        for (EntryStatus s : values()) {
            if (s.wireName.equalsIgnoreCase(value.trim())) return s;
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
