package com.fluxreader.core.queue;

import com.fluxreader.common.model.EntryStatus;
import com.google.gson.annotations.SerializedName;

/**
 * Desired status for one entry. {@code originalStatus} is kept for diagnostics only.
 */
public record PendingStatusChange(
        @SerializedName("entry_id") long entryId,
        @SerializedName("new_status") EntryStatus newStatus,
        @SerializedName("original_status") EntryStatus originalStatus,
        long timestamp) {
}
