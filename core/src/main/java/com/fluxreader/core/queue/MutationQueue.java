package com.fluxreader.core.queue;

import com.fluxreader.common.model.EntryStatus;

import java.util.Collection;
import java.util.Map;

/**
 * Durable store for changes that have not reached the server yet.
 * <p>
 * Every operation loads the whole document, mutates it and writes it back in one piece.
 * At most one pending change exists per key; a later enqueue overwrites the earlier one.
 */
public interface MutationQueue {

    // --- Entry status ---

    void enqueueStatus(long entryId, EntryStatus newStatus);

    boolean removeStatus(long entryId);

    /**
     * Removes the given ids in one write, but only where the queued status is still {@code sentStatus},
     * so a newer change enqueued while the request was in flight survives.
     *
     * @return number of ids removed
     */
    int removeStatuses(Collection<Long> entryIds, EntryStatus sentStatus);

    Map<Long, PendingStatusChange> loadStatusQueue();

    boolean saveStatusQueue(Map<Long, PendingStatusChange> queue);

    boolean clearStatusQueue();

    // --- Feed / category "mark all as read" ---

    void enqueueCollection(CollectionKind kind, long id);

    boolean removeCollection(CollectionKind kind, long id);

    Map<Long, PendingCollectionOperation> loadCollectionQueue(CollectionKind kind);

    boolean clearCollectionQueue(CollectionKind kind);

    // --- Bookmarks ---

    void enqueueBookmark(long entryId, boolean starred);

    boolean removeBookmark(long entryId);

    Map<Long, PendingBookmarkChange> loadBookmarkQueue();

    boolean clearBookmarkQueue();

    QueueCounts getTotalQueueCount();
}
