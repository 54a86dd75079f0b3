package com.fluxreader.services.sync;

import com.fluxreader.api.ApiResult;
import com.fluxreader.api.EntryGateway;
import com.fluxreader.api.EntryStateListener;
import com.fluxreader.api.Notifier;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.core.queue.CollectionKind;
import com.fluxreader.core.queue.MutationQueue;
import com.fluxreader.core.queue.PendingBookmarkChange;
import com.fluxreader.core.queue.PendingCollectionOperation;
import com.fluxreader.core.queue.PendingStatusChange;
import com.fluxreader.core.queue.QueueCounts;
import com.fluxreader.services.store.LocalEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replays pending changes against the server.
 * <p>
 * Status changes go out as at most two bulk calls (one per target status). An id leaves the
 * queue only after the call carrying it succeeded; failures stay queued and are retried next time.
 * Network failures are not reported individually, only in the aggregate report.
 */
public class SyncReconciler {
    private static final Logger logger = LoggerFactory.getLogger(SyncReconciler.class);

    private final MutationQueue queue;
    private final EntryGateway gateway;
    private final LocalEntryStore store;
    private final Notifier notifier;
    private EntryStateListener stateListener = EntryStateListener.NONE;

    public SyncReconciler(MutationQueue queue, EntryGateway gateway, LocalEntryStore store, Notifier notifier) {
        this.queue = queue;
        this.gateway = gateway;
        this.store = store;
        this.notifier = notifier;
    }

    public void setStateListener(EntryStateListener stateListener) {
        this.stateListener = stateListener;
    }

    /**
     * Manual sync: reports "nothing to sync" when the queues are empty, otherwise asks first.
     */
    public SyncReport sync(SyncPrompt prompt) {
        QueueCounts counts = queue.getTotalQueueCount();
        if (counts.isEmpty()) {
            SyncReport report = SyncReport.of(SyncReport.Outcome.NOTHING_TO_SYNC);
            notifier.info(report.message());
            return report;
        }
        return confirmAndRun(counts, prompt);
    }

    /**
     * Called when the network comes back. Silent when there is nothing queued.
     */
    public SyncReport syncAfterReconnect(SyncPrompt prompt) {
        QueueCounts counts = queue.getTotalQueueCount();
        if (counts.isEmpty()) {
            return SyncReport.of(SyncReport.Outcome.NOTHING_TO_SYNC);
        }
        logger.info("Network available, {} pending changes", counts.total());
        return confirmAndRun(counts, prompt);
    }

    private SyncReport confirmAndRun(QueueCounts counts, SyncPrompt prompt) {
        logger.info("Pending: {} status, {} bookmark, {} feed, {} category",
                counts.status(), counts.bookmark(), counts.feed(), counts.category());
        SyncDecision decision = prompt.ask(counts);
        if (decision == SyncDecision.DISCARD) {
            return discardAll();
        }
        if (decision != SyncDecision.SYNC_NOW) {
            return SyncReport.of(SyncReport.Outcome.DEFERRED);
        }
        SyncReport report = drain();
        notify(report);
        return report;
    }

    /**
     * Drains every queue without asking.
     */
    public SyncReport drain() {
        Tally totals = new Tally();
        drainStatusQueue(totals);
        drainBookmarkQueue(totals);
        drainCollectionQueue(CollectionKind.FEED, totals);
        drainCollectionQueue(CollectionKind.CATEGORY, totals);
        SyncReport report = SyncReport.synced(totals.processed, totals.failed);
        logger.info("Sync finished: {}", report.message());
        return report;
    }

    private void drainStatusQueue(Tally totals) {
        Map<Long, PendingStatusChange> pending = queue.loadStatusQueue();
        if (pending.isEmpty()) return;

        List<Long> readIds = new ArrayList<>();
        List<Long> unreadIds = new ArrayList<>();
        for (PendingStatusChange change : pending.values()) {
            if (change.newStatus() == EntryStatus.READ) {
                readIds.add(change.entryId());
            } else if (change.newStatus() == EntryStatus.UNREAD) {
                unreadIds.add(change.entryId());
            }
        }
        pushStatusBatch(readIds, EntryStatus.READ, totals);
        pushStatusBatch(unreadIds, EntryStatus.UNREAD, totals);
    }

    private void pushStatusBatch(List<Long> ids, EntryStatus status, Tally totals) {
        if (ids.isEmpty()) return;
        ApiResult<Void> result = gateway.updateStatus(ids, status);
        if (!result.isOk()) {
            logger.warn("Bulk update to {} failed for {} entries: {}", status, ids.size(), result.getError());
            totals.failed += ids.size();
            return;
        }
        for (long id : ids) {
            store.updateStatus(id, status);
            stateListener.onStatusChanged(id, status);
        }
        queue.removeStatuses(ids, status);
        totals.processed += ids.size();
        logger.debug("Synced {} entries as {}", ids.size(), status);
    }

    /**
     * Bookmarks are stored as desired values, but the server only offers a toggle,
     * so the current server value is read first.
     */
    private void drainBookmarkQueue(Tally totals) {
        for (PendingBookmarkChange change : queue.loadBookmarkQueue().values()) {
            long id = change.entryId();
            ApiResult<Entry> current = gateway.getEntry(id);
            if (!current.isOk()) {
                totals.failed++;
                continue;
            }
            if (current.getValue().isStarred() != change.starred()) {
                ApiResult<Void> toggled = gateway.toggleBookmark(id);
                if (!toggled.isOk()) {
                    logger.warn("Bookmark sync failed for entry {}: {}", id, toggled.getError());
                    totals.failed++;
                    continue;
                }
            }
            store.updateStarred(id, change.starred());
            stateListener.onStarredChanged(id, change.starred());
            queue.removeBookmark(id);
            totals.processed++;
        }
    }

    private void drainCollectionQueue(CollectionKind kind, Tally totals) {
        for (PendingCollectionOperation op : queue.loadCollectionQueue(kind).values()) {
            if (!PendingCollectionOperation.MARK_ALL_READ.equals(op.operation())) continue;
            ApiResult<Void> result = kind == CollectionKind.FEED
                    ? gateway.markFeedAsRead(op.id())
                    : gateway.markCategoryAsRead(op.id());
            if (result.isOk()) {
                queue.removeCollection(kind, op.id());
                totals.processed++;
            } else {
                logger.warn("Failed to mark {} {} as read: {}", kind.label(), op.id(), result.getError());
                totals.failed++;
            }
        }
    }

    /**
     * Drops every pending change of every kind.
     */
    public SyncReport discardAll() {
        List<String> failedQueues = new ArrayList<>();
        if (!queue.clearStatusQueue()) failedQueues.add("status");
        if (!queue.clearBookmarkQueue()) failedQueues.add("bookmark");
        if (!queue.clearCollectionQueue(CollectionKind.FEED)) failedQueues.add("feed");
        if (!queue.clearCollectionQueue(CollectionKind.CATEGORY)) failedQueues.add("category");

        SyncReport report = failedQueues.isEmpty()
                ? SyncReport.of(SyncReport.Outcome.DISCARDED)
                : new SyncReport(SyncReport.Outcome.DISCARD_FAILED, 0, 0, List.copyOf(failedQueues));
        if (failedQueues.isEmpty()) {
            logger.info("All sync queues cleared");
            notifier.info(report.message());
        } else {
            logger.error("Failed to clear queues: {}", failedQueues);
            notifier.error(report.message());
        }
        return report;
    }

    private void notify(SyncReport report) {
        if (report.processed() == 0 && report.failed() > 0) {
            notifier.error(report.message());
        } else {
            notifier.info(report.message());
        }
    }

    private static final class Tally {
        int processed;
        int failed;
    }
}
