package com.fluxreader.services.sync;

import com.fluxreader.api.ApiResult;
import com.fluxreader.api.EntryGateway;
import com.fluxreader.api.EntryStateListener;
import com.fluxreader.api.Notifier;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.core.queue.CollectionKind;
import com.fluxreader.core.queue.MutationQueue;
import com.fluxreader.services.store.EntryMetadata;
import com.fluxreader.services.store.LocalEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * User-initiated status, bookmark and "mark all as read" changes.
 * The server is tried first; when it cannot be reached the change is applied locally and queued.
 */
public class EntryStatusService {
    private static final Logger logger = LoggerFactory.getLogger(EntryStatusService.class);

    private final EntryGateway gateway;
    private final MutationQueue queue;
    private final LocalEntryStore store;
    private final Notifier notifier;
    private final Configuration config;
    private final BackgroundStatusWorker worker;
    private EntryStateListener stateListener = EntryStateListener.NONE;

    public EntryStatusService(EntryGateway gateway, MutationQueue queue, LocalEntryStore store, Notifier notifier,
                              Configuration config, BackgroundStatusWorker worker) {
        this.gateway = gateway;
        this.queue = queue;
        this.store = store;
        this.notifier = notifier;
        this.config = config;
        this.worker = worker;
    }

    /** Only read and unread can be set by the reader and drained by the reconciler. */
    private static boolean isSettable(EntryStatus status) {
        return status == EntryStatus.READ || status == EntryStatus.UNREAD;
    }

    private StatusChangeResult rejectStatus(EntryStatus status) {
        String wire = status == null ? "none" : status.wireName();
        notifier.error("Cannot change status: unsupported status " + wire);
        return new StatusChangeResult(StatusChangeResult.Outcome.INVALID, "Unsupported status " + wire);
    }

    public void setStateListener(EntryStateListener stateListener) {
        this.stateListener = stateListener;
    }

    public StatusChangeResult changeEntryStatus(long entryId, EntryStatus status) {
        if (entryId <= 0) {
            notifier.error("Cannot change status: invalid entry ID");
            return new StatusChangeResult(StatusChangeResult.Outcome.INVALID, "Invalid entry ID");
        }
        if (!isSettable(status)) {
            return rejectStatus(status);
        }
        // an explicit change supersedes a pending auto-mark-as-read
        worker.cancel(entryId);

        ApiResult<Void> result = gateway.updateStatus(List.of(entryId), status);
        applyStatusLocally(entryId, status);
        if (result.isOk()) {
            queue.removeStatus(entryId);
            return new StatusChangeResult(StatusChangeResult.Outcome.SYNCED, "Entry marked as " + status.wireName());
        }

        logger.info("Status update for entry {} failed ({}), queueing", entryId, result.getError());
        queue.enqueueStatus(entryId, status);
        String message = "Marked as " + status.wireName() + " (will sync when online)";
        notifier.info(message);
        return new StatusChangeResult(StatusChangeResult.Outcome.QUEUED, message);
    }

    /**
     * Same as {@link #changeEntryStatus} for a selection, in one bulk call.
     */
    public StatusChangeResult changeEntriesStatus(List<Long> entryIds, EntryStatus status) {
        List<Long> ids = new ArrayList<>();
        if (entryIds != null) {
            for (Long id : entryIds) {
                if (id != null && id > 0 && !ids.contains(id)) ids.add(id);
            }
        }
        if (ids.isEmpty()) {
            notifier.error("Cannot change status: no valid entries selected");
            return new StatusChangeResult(StatusChangeResult.Outcome.INVALID, "No valid entries");
        }
        if (!isSettable(status)) {
            return rejectStatus(status);
        }
        ids.forEach(worker::cancel);

        ApiResult<Void> result = gateway.updateStatus(ids, status);
        ids.forEach(id -> applyStatusLocally(id, status));
        if (result.isOk()) {
            ids.forEach(queue::removeStatus);
            return new StatusChangeResult(StatusChangeResult.Outcome.SYNCED,
                    String.format("%d entries marked as %s", ids.size(), status.wireName()));
        }

        logger.info("Bulk status update for {} entries failed ({}), queueing", ids.size(), result.getError());
        ids.forEach(id -> queue.enqueueStatus(id, status));
        String message = String.format("%d entries marked as %s (will sync when online)", ids.size(), status.wireName());
        notifier.info(message);
        return new StatusChangeResult(StatusChangeResult.Outcome.QUEUED, message);
    }

    /**
     * Toggles using the locally stored starred flag as the current value.
     */
    public StatusChangeResult toggleBookmark(long entryId) {
        Optional<EntryMetadata> metadata = entryId > 0 ? store.loadMetadata(entryId) : Optional.empty();
        if (metadata.isEmpty()) {
            notifier.error("Cannot toggle bookmark: entry not available");
            return new StatusChangeResult(StatusChangeResult.Outcome.INVALID, "Entry not available locally");
        }
        return toggleBookmark(entryId, metadata.get().isStarred());
    }

    public StatusChangeResult toggleBookmark(long entryId, boolean currentlyStarred) {
        if (entryId <= 0) {
            notifier.error("Cannot toggle bookmark: invalid entry ID");
            return new StatusChangeResult(StatusChangeResult.Outcome.INVALID, "Invalid entry ID");
        }
        boolean desired = !currentlyStarred;
        ApiResult<Void> result = gateway.toggleBookmark(entryId);
        store.updateStarred(entryId, desired);
        stateListener.onStarredChanged(entryId, desired);
        if (result.isOk()) {
            queue.removeBookmark(entryId);
            return new StatusChangeResult(StatusChangeResult.Outcome.SYNCED, desired ? "Entry starred" : "Entry unstarred");
        }

        logger.info("Bookmark toggle for entry {} failed ({}), queueing", entryId, result.getError());
        queue.enqueueBookmark(entryId, desired);
        String message = (desired ? "Starred" : "Unstarred") + " (will sync when online)";
        notifier.info(message);
        return new StatusChangeResult(StatusChangeResult.Outcome.QUEUED, message);
    }

    public StatusChangeResult markCollectionAsRead(CollectionKind kind, long id) {
        String label = kind == CollectionKind.FEED ? "Feed" : "Category";
        if (id <= 0) {
            notifier.error("Cannot mark as read: invalid " + kind.label() + " ID");
            return new StatusChangeResult(StatusChangeResult.Outcome.INVALID, "Invalid " + kind.label() + " ID");
        }
        ApiResult<Void> result = kind == CollectionKind.FEED ? gateway.markFeedAsRead(id) : gateway.markCategoryAsRead(id);
        if (result.isOk()) {
            queue.removeCollection(kind, id);
            return new StatusChangeResult(StatusChangeResult.Outcome.SYNCED, label + " marked as read");
        }

        logger.info("Mark {} {} as read failed ({}), queueing", kind.label(), id, result.getError());
        queue.enqueueCollection(kind, id);
        String message = label + " marked as read (will sync when online)";
        notifier.info(message);
        return new StatusChangeResult(StatusChangeResult.Outcome.QUEUED, message);
    }

    /**
     * Mark-as-read on open. The local record and the queue are updated right away,
     * the server call runs on the background worker.
     */
    public StatusChangeResult autoMarkAsRead(long entryId) {
        if (entryId <= 0) {
            return new StatusChangeResult(StatusChangeResult.Outcome.INVALID, "Invalid entry ID");
        }
        if (!config.markAsReadOnOpen) {
            return new StatusChangeResult(StatusChangeResult.Outcome.SKIPPED, "Mark as read on open is disabled");
        }
        Optional<EntryMetadata> metadata = store.loadMetadata(entryId);
        if (metadata.isPresent() && metadata.get().isRead()) {
            logger.debug("Entry {} already read, skipping auto-mark", entryId);
            return new StatusChangeResult(StatusChangeResult.Outcome.SKIPPED, "Already read");
        }

        applyStatusLocally(entryId, EntryStatus.READ);
        queue.enqueueStatus(entryId, EntryStatus.READ);
        worker.submit(entryId, EntryStatus.READ, config.serverAddress, config.apiToken);
        logger.info("Auto-mark-as-read started for entry {}", entryId);
        return new StatusChangeResult(StatusChangeResult.Outcome.BACKGROUND, "Marked as read");
    }

    private void applyStatusLocally(long entryId, EntryStatus status) {
        store.updateStatus(entryId, status);
        stateListener.onStatusChanged(entryId, status);
    }
}
