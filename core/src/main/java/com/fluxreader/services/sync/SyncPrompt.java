package com.fluxreader.services.sync;

import com.fluxreader.core.queue.QueueCounts;

/**
 * Asks the user what to do with pending changes.
 */
@FunctionalInterface
public interface SyncPrompt {

    SyncDecision ask(QueueCounts pending);

    SyncPrompt AUTO_CONFIRM = pending -> SyncDecision.SYNC_NOW;

    static String title(QueueCounts pending) {
        int total = pending.total();
        return total == 1 ? "Sync 1 pending change?" : String.format("Sync %d pending changes?", total);
    }
}
