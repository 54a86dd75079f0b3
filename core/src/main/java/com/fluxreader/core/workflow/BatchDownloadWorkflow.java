package com.fluxreader.core.workflow;

import com.fluxreader.api.ApiResult;
import com.fluxreader.api.EntryGateway;
import com.fluxreader.common.model.Entry;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.services.store.LocalEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the {@link DownloadWorkflow} over several entries in order, sharing one {@link BatchState}.
 * A failed entry never stops the batch; only "cancel all" does.
 */
public class BatchDownloadWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(BatchDownloadWorkflow.class);

    private final DownloadWorkflow workflow;
    private final EntryGateway gateway;
    private final LocalEntryStore store;
    private final Configuration config;

    public BatchDownloadWorkflow(DownloadWorkflow workflow, EntryGateway gateway, LocalEntryStore store,
                                 Configuration config) {
        this.workflow = workflow;
        this.gateway = gateway;
        this.store = store;
        this.config = config;
    }

    public BatchSummary downloadAll(List<Entry> entries) {
        int total = entries.size();
        List<DownloadOutcome> outcomes = new ArrayList<>();
        if (total == 0) {
            return new BatchSummary(0, 0, 0, false, outcomes);
        }

        BatchState state = new BatchState(total);
        CheckpointThrottle throttle = new CheckpointThrottle(config.progressThrottleMs, workflow.getClock());
        CancellationToken token = workflow.getCancellationToken();
        int completed = 0;
        int failed = 0;

        for (int i = 0; i < total; i++) {
            Entry entry = entries.get(i);
            String title = entry != null ? entry.getDisplayTitle() : "Untitled Entry";
            state.moveTo(i + 1);
            workflow.getProgressListener().onProgress(DownloadPhase.PREPARING, total == 1
                    ? "Downloading: " + title
                    : String.format("Downloading %d/%d: %s", i + 1, total, title));

            if (throttle.due() && token.consume()) {
                CancellationRequest request = CancellationRequest.betweenEntries(title, state);
                CancellationChoice choice = workflow.getCancellationPrompt().ask(request);
                if (choice == CancellationChoice.CANCEL_ALL_ENTRIES) {
                    state.cancelAll();
                } else if (choice == CancellationChoice.SKIP_IMAGES_ALL) {
                    state.setSkipImagesForAll(true);
                } else if (choice == CancellationChoice.INCLUDE_IMAGES_ALL) {
                    state.setSkipImagesForAll(false);
                }
            }
            if (state.isCancelAll()) {
                return cancelled(total, completed, failed, outcomes);
            }

            DownloadOutcome outcome = workflow.run(refresh(entry), state);
            outcomes.add(outcome);
            if (state.isCancelAll()) {
                return cancelled(total, completed, failed, outcomes);
            }
            if (outcome.isAvailable()) {
                completed++;
            } else {
                failed++;
            }
        }

        BatchSummary summary = new BatchSummary(total, completed, failed, false, outcomes);
        logger.info(summary.message());
        return summary;
    }

    /**
     * Listings may carry truncated content, so the full entry is fetched by id first.
     * Best effort: the listing copy is used when the fetch fails.
     */
    private Entry refresh(Entry entry) {
        if (entry == null || entry.getId() <= 0 || gateway == null || store.isDownloaded(entry.getId())) {
            return entry;
        }
        ApiResult<Entry> full = gateway.getEntry(entry.getId());
        if (full.isOk() && !full.getValue().getBestContent().isEmpty()) {
            entry.setContent(full.getValue().getContent());
            entry.setSummary(full.getValue().getSummary());
        } else if (!full.isOk()) {
            logger.debug("Could not refresh entry {}: {}", entry.getId(), full.getError());
        }
        return entry;
    }

    private BatchSummary cancelled(int total, int completed, int failed, List<DownloadOutcome> outcomes) {
        BatchSummary summary = new BatchSummary(total, completed, failed, true, outcomes);
        logger.info(summary.message());
        return summary;
    }
}
