package com.fluxreader.services.navigation;

import com.fluxreader.api.ApiResult;
import com.fluxreader.api.EntryGateway;
import com.fluxreader.api.EntryQuery;
import com.fluxreader.api.Notifier;
import com.fluxreader.common.model.EntriesPage;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.util.TimeUtils;
import com.fluxreader.core.workflow.DownloadOutcome;
import com.fluxreader.core.workflow.DownloadWorkflow;
import com.fluxreader.services.store.EntryMetadata;
import com.fluxreader.services.store.LocalEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Previous/next navigation from an open entry. Local copies are always preferred over a new download.
 */
public class EntryNavigator {
    private static final Logger logger = LoggerFactory.getLogger(EntryNavigator.class);

    private final EntryGateway gateway;
    private final LocalEntryStore store;
    private final NavigationCursor cursor;
    private final DownloadWorkflow workflow;
    private final Notifier notifier;

    public EntryNavigator(EntryGateway gateway, LocalEntryStore store, NavigationCursor cursor,
                          DownloadWorkflow workflow, Notifier notifier) {
        this.gateway = gateway;
        this.store = store;
        this.cursor = cursor;
        this.workflow = workflow;
        this.notifier = notifier;
    }

    public NavigationResult navigate(long currentEntryId, NavigationDirection direction, NavigationContext context) {
        if (currentEntryId <= 0) {
            notifier.error("Cannot navigate: missing entry ID");
            return NavigationResult.invalid("Missing entry ID");
        }
        NavigationContext scope = context != null ? context : NavigationContext.global();

        if (scope.isLocal()) {
            Long target = NavigationCursor.adjacentInList(scope.getOrderedEntryIds(), currentEntryId, direction);
            if (target == null) {
                return noMore("No " + direction.label() + " entry available in local files");
            }
            return openLocal(target, NavigationResult.Source.LOCAL_LIST, scope);
        }

        Optional<EntryMetadata> reference = store.loadMetadata(currentEntryId);
        Long publishedUnix = reference.map(EntryMetadata::getPublishedAt).map(TimeUtils::isoToUnix).orElse(null);
        if (publishedUnix == null) {
            logger.warn("No usable publish time for entry {}", currentEntryId);
            notifier.error("Cannot navigate: missing timestamp information");
            return NavigationResult.failed("Missing timestamp information");
        }

        EntryQuery query = cursor.buildQuery(reference.get(), publishedUnix, direction, scope);
        ApiResult<EntriesPage> page = gateway.getEntries(query);
        if (page.isOk()) {
            Entry target = page.getValue().first();
            if (target == null) {
                return noMore("No " + direction.label() + " entry available on server");
            }
            DownloadOutcome outcome = workflow.downloadAndOpen(target, scope);
            return NavigationResult.opened(target.getId(), NavigationResult.Source.SERVER, outcome);
        }

        logger.warn("Navigation search failed, falling back to local entries: {}", page.getError());
        Long localTarget = cursor.findAdjacentLocalId(currentEntryId, direction);
        if (localTarget == null) {
            return noMore("No " + direction.label() + " entry available in local files");
        }
        notifier.info("Found a local entry");
        return openLocal(localTarget, NavigationResult.Source.LOCAL_SCAN, scope);
    }

    private NavigationResult openLocal(long entryId, NavigationResult.Source source, NavigationContext scope) {
        Optional<EntryMetadata> metadata = store.loadMetadata(entryId);
        if (metadata.isEmpty() && !store.isDownloaded(entryId)) {
            logger.error("Failed to load metadata for entry {}", entryId);
            notifier.error("Failed to open target entry");
            return NavigationResult.failed("Missing metadata for entry " + entryId);
        }
        Entry entry = metadata.map(EntryMetadata::toEntry).orElseGet(() -> new Entry(entryId, null));
        DownloadOutcome outcome = workflow.downloadAndOpen(entry, scope);
        return NavigationResult.opened(entryId, source, outcome);
    }

    private NavigationResult noMore(String message) {
        notifier.info(message);
        return NavigationResult.noMore(message);
    }
}
