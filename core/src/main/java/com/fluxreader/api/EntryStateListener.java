package com.fluxreader.api;

import com.fluxreader.common.model.EntryStatus;

/**
 * Told about status and bookmark changes so an open entry view can refresh its in-memory copy.
 */
public interface EntryStateListener {

    default void onStatusChanged(long entryId, EntryStatus status) {
    }

    default void onStarredChanged(long entryId, boolean starred) {
    }

    EntryStateListener NONE = new EntryStateListener() { };
}
