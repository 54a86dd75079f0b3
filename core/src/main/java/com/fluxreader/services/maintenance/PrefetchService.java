package com.fluxreader.services.maintenance;

import com.fluxreader.api.ApiResult;
import com.fluxreader.api.EntryGateway;
import com.fluxreader.api.EntryQuery;
import com.fluxreader.api.Notifier;
import com.fluxreader.common.model.EntriesPage;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.core.workflow.BatchDownloadWorkflow;
import com.fluxreader.core.workflow.BatchSummary;
import com.fluxreader.services.store.LocalEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Downloads the next few entries of a listing ahead of time so they are readable offline.
 */
public class PrefetchService {
    private static final Logger logger = LoggerFactory.getLogger(PrefetchService.class);

    public enum Source {
        UNREAD,
        STARRED
    }

    private final EntryGateway gateway;
    private final LocalEntryStore store;
    private final BatchDownloadWorkflow batch;
    private final Configuration config;
    private final Notifier notifier;

    public PrefetchService(EntryGateway gateway, LocalEntryStore store, BatchDownloadWorkflow batch,
                           Configuration config, Notifier notifier) {
        this.gateway = gateway;
        this.store = store;
        this.batch = batch;
        this.config = config;
        this.notifier = notifier;
    }

    public BatchSummary prefetch(Source source) {
        return prefetch(source, config.prefetchCount);
    }

    public BatchSummary prefetch(Source source, int count) {
        if (count <= 0) {
            logger.debug("Prefetch disabled (count {})", count);
            return batch.downloadAll(List.of());
        }
        ApiResult<EntriesPage> page = gateway.getEntries(queryFor(source));
        if (!page.isOk()) {
            notifier.error("Prefetch failed: " + page.getError().message());
            return batch.downloadAll(List.of());
        }

        List<Entry> pending = new ArrayList<>();
        for (Entry entry : page.getValue().getEntries()) {
            if (pending.size() >= count) break;
            if (entry.getId() > 0 && !store.isDownloaded(entry.getId())) {
                pending.add(entry);
            }
        }
        logger.info("Prefetching {} {} entries", pending.size(), source.name().toLowerCase());
        return batch.downloadAll(pending);
    }

    EntryQuery queryFor(Source source) {
        EntryQuery.Builder builder = EntryQuery.builder()
                .order(config.order)
                .direction(config.direction)
                .limit(config.limit);
        if (source == Source.STARRED) {
            builder.starred(true);
        } else {
            builder.status(EntryStatus.UNREAD);
        }
        return builder.build();
    }
}
