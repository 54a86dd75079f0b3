package com.fluxreader.services.maintenance;

import com.fluxreader.core.config.Configuration;
import com.fluxreader.services.store.EntryMetadata;
import com.fluxreader.services.store.LocalEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides whether a downloaded entry is removed when the reader closes it.
 * Starred entries are never removed.
 */
public class AutoDeletePolicy {
    private static final Logger logger = LoggerFactory.getLogger(AutoDeletePolicy.class);

    private final Configuration config;
    private final LocalEntryStore store;

    public AutoDeletePolicy(Configuration config, LocalEntryStore store) {
        this.config = config;
        this.store = store;
    }

    public boolean shouldDelete(EntryMetadata metadata) {
        if (!config.autoDeleteReadOnClose || metadata == null) return false;
        return metadata.isRead() && !metadata.isStarred();
    }

    /**
     * @return true if the entry was deleted
     */
    public boolean onClose(long entryId) {
        Optional<EntryMetadata> metadata = store.loadMetadata(entryId);
        if (metadata.isEmpty() || !shouldDelete(metadata.get())) return false;
        logger.info("Auto-deleting read entry {} on close", entryId);
        return store.delete(entryId);
    }
}
