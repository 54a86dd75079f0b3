package com.fluxreader.core.queue;

import com.google.gson.annotations.SerializedName;

/**
 * Desired starred value for one entry. Stored as a value, not as a toggle,
 * so replaying it is idempotent.
 */
public record PendingBookmarkChange(
        @SerializedName("entry_id") long entryId,
        boolean starred,
        long timestamp) {
}
