package com.fluxreader.services.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory mirror of entry metadata keyed by entry id.
 * <p>
 * Screens that read it {@link #acquire()} and {@link #release()} it; the contents are
 * dropped once the last holder releases. Writers always persist to disk before calling {@link #put}.
 */
public class EntryInfoCache {
    private static final Logger logger = LoggerFactory.getLogger(EntryInfoCache.class);

    private final Map<Long, EntryMetadata> entries = new ConcurrentHashMap<>();
    private final AtomicInteger holders = new AtomicInteger();

    public void acquire() {
        holders.incrementAndGet();
    }

    public void release() {
        int remaining = holders.updateAndGet(n -> Math.max(0, n - 1));
        if (remaining == 0) {
            logger.debug("Last holder released, dropping {} cached entries", entries.size());
            entries.clear();
        }
    }

    public int getHolderCount() {
        return holders.get();
    }

    public Optional<EntryMetadata> get(long entryId) {
        EntryMetadata m = entries.get(entryId);
        return m == null ? Optional.empty() : Optional.of(m.copy());
    }

    public void put(long entryId, EntryMetadata metadata) {
        entries.put(entryId, metadata.copy());
    }

    public void invalidate(long entryId) {
        entries.remove(entryId);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
