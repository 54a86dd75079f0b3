package com.fluxreader.services.sync;

public enum SyncDecision {
    /** "Later": keep the queue as it is. */
    DEFER,
    SYNC_NOW,
    /** "Delete Queue": drop every pending change. */
    DISCARD
}
