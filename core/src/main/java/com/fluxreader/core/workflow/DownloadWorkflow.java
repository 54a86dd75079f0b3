package com.fluxreader.core.workflow;

import com.fluxreader.api.EntryViewer;
import com.fluxreader.api.Notifier;
import com.fluxreader.common.model.Entry;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.core.pipeline.ContentPipeline;
import com.fluxreader.core.pipeline.DownloadSummary;
import com.fluxreader.core.pipeline.ImageDescriptor;
import com.fluxreader.core.pipeline.PreparedContent;
import com.fluxreader.core.pipeline.RenderedDocument;
import com.fluxreader.services.navigation.NavigationContext;
import com.fluxreader.services.store.EntryMetadata;
import com.fluxreader.services.store.LocalEntryStore;
import com.fluxreader.services.store.LocalStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Downloads one entry for offline reading: Preparing, Downloading (images), Processing, Completing.
 * <p>
 * Cancellation is cooperative. The UI sets the {@link CancellationToken}; the workflow looks at it
 * between phases and, throttled, between images, then asks the {@link CancellationPrompt}.
 * The HTML file is written last, so an entry only counts as downloaded once everything else is on disk.
 */
public class DownloadWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(DownloadWorkflow.class);

    private final LocalEntryStore store;
    private final ContentPipeline pipeline;
    private final Configuration config;
    private final Notifier notifier;

    private CancellationPrompt prompt = CancellationPrompt.ALWAYS_CONTINUE;
    private CancellationToken token = new CancellationToken();
    private ProgressListener progress = ProgressListener.NONE;
    private EntryViewer viewer;
    private LongSupplier clock = System::currentTimeMillis;

    private volatile DownloadPhase currentPhase = DownloadPhase.IDLE;

    public DownloadWorkflow(LocalEntryStore store, ContentPipeline pipeline, Configuration config, Notifier notifier) {
        this.store = store;
        this.pipeline = pipeline;
        this.config = config;
        this.notifier = notifier;
    }

    public void setCancellationPrompt(CancellationPrompt prompt) {
        this.prompt = prompt;
    }

    public void setCancellationToken(CancellationToken token) {
        this.token = token;
    }

    public CancellationToken getCancellationToken() {
        return token;
    }

    public void setProgressListener(ProgressListener progress) {
        this.progress = progress;
    }

    public void setViewer(EntryViewer viewer) {
        this.viewer = viewer;
    }

    public void setClock(LongSupplier clock) {
        this.clock = clock;
    }

    LongSupplier getClock() {
        return clock;
    }

    ProgressListener getProgressListener() {
        return progress;
    }

    CancellationPrompt getCancellationPrompt() {
        return prompt;
    }

    public DownloadPhase getCurrentPhase() {
        return currentPhase;
    }

    public DownloadOutcome download(Entry entry) {
        return run(entry, null);
    }

    /**
     * Downloads if needed, then hands the local document to the viewer.
     */
    public DownloadOutcome downloadAndOpen(Entry entry, NavigationContext context) {
        DownloadOutcome outcome = run(entry, null);
        if (outcome.isAvailable() && viewer != null) {
            viewer.open(outcome.entryId(), outcome.htmlFile().toPath(), context);
        }
        return outcome;
    }

    DownloadOutcome run(Entry entry, BatchState batch) {
        if (entry == null || entry.getId() <= 0) {
            long id = entry == null ? 0 : entry.getId();
            if (batch == null) notifier.error("Invalid entry: missing id");
            return DownloadOutcome.invalid(id, "Invalid entry");
        }
        long id = entry.getId();
        String title = entry.getDisplayTitle();

        if (store.isDownloaded(id)) {
            logger.debug("Entry {} already downloaded, opening local copy", id);
            return DownloadOutcome.alreadyDownloaded(id, store.getHtmlFile(id));
        }

        try {
            return runPhases(entry, title, batch);
        } finally {
            currentPhase = DownloadPhase.IDLE;
        }
    }

    private DownloadOutcome runPhases(Entry entry, String title, BatchState batch) {
        long id = entry.getId();

        // --- PREPARING ---
        currentPhase = DownloadPhase.PREPARING;
        progress.onProgress(currentPhase, "Downloading:\n" + title + "\n\nPreparing...");
        File entryDir;
        try {
            entryDir = store.createEntryDir(id);
        } catch (LocalStoreException e) {
            logger.error("Failed to prepare download for entry {}", id, e);
            if (batch == null) notifier.error("Failed to prepare download: " + e.getMessage());
            return DownloadOutcome.failed(id, e.getMessage());
        }
        logger.info("Starting download for entry {}: {}", id, title);

        if (batch == null && checkpoint(title, null) == PhaseResult.CANCELLED) {
            return abandon(id);
        }

        PreparedContent prepared = pipeline.prepare(entry);
        List<ImageDescriptor> images = prepared.getImages();

        // --- DOWNLOADING ---
        currentPhase = DownloadPhase.DOWNLOADING;
        boolean includeImages = config.includeImages && (batch == null || !batch.isSkipImagesForAll());
        if (includeImages && !images.isEmpty()) {
            if (downloadImages(entry, title, images, entryDir, batch) == PhaseResult.CANCELLED) {
                return abandon(id);
            }
            int downloaded = prepared.downloadedCount();
            if (downloaded < images.size()) {
                logger.warn("Entry {}: {} of {} images failed", id, images.size() - downloaded, images.size());
                progress.onProgress(currentPhase, String.format(
                        "Some images failed to download (%d/%d successful)%nContinuing with available images...",
                        downloaded, images.size()));
            }
        }

        // --- PROCESSING ---
        currentPhase = DownloadPhase.PROCESSING;
        progress.onProgress(currentPhase, "Downloading:\n" + title + "\n\nProcessing content...");
        if (checkpoint(title, batch) == PhaseResult.CANCELLED) {
            return abandon(id);
        }
        try {
            RenderedDocument document = pipeline.render(prepared, entryDir);
            store.saveMetadata(EntryMetadata.fromEntry(entry, document.images()));
            store.writeHtml(id, document.html());
        } catch (LocalStoreException e) {
            // downloaded images stay for a later recovery run
            logger.error("Failed to save entry {}", id, e);
            if (batch == null) notifier.error("Failed to save entry: " + e.getMessage());
            return DownloadOutcome.failed(id, e.getMessage());
        }

        // --- COMPLETING ---
        currentPhase = DownloadPhase.COMPLETING;
        String summary = DownloadSummary.describe(includeImages, images);
        progress.onProgress(currentPhase, "Download completed!\n\n" + summary);
        logger.info("Downloaded entry {} with {}/{} images", id, prepared.downloadedCount(), images.size());
        return DownloadOutcome.downloaded(id, store.getHtmlFile(id), images.size(), prepared.downloadedCount(), summary);
    }

    private PhaseResult downloadImages(Entry entry, String title, List<ImageDescriptor> images, File entryDir,
                                       BatchState batch) {
        CheckpointThrottle throttle = new CheckpointThrottle(config.progressThrottleMs, clock);
        int total = images.size();
        for (int i = 0; i < total; i++) {
            progress.onProgress(currentPhase, imageProgress(title, i + 1, total, batch));
            if (throttle.due()) {
                PhaseResult result = checkpoint(title, batch);
                if (result == PhaseResult.CANCELLED) return result;
                if (result == PhaseResult.SKIP_IMAGES) {
                    logger.info("Skipping remaining {} images of entry {}", total - i, entry.getId());
                    break;
                }
            }
            pipeline.materialize(images.get(i), entryDir.toPath(), entry.getUrl());
        }
        return PhaseResult.SUCCESS;
    }

    private static String imageProgress(String title, int current, int total, BatchState batch) {
        if (batch == null || batch.getTotalEntries() == 1) {
            return String.format("Downloading:%n%s%n%nDownloading %d/%d images", title, current, total);
        }
        return String.format("Downloading %d/%d:%n%s%n%nDownloading %d/%d images",
                batch.getCurrentIndex(), batch.getTotalEntries(), title, current, total);
    }

    /**
     * Consumes a pending cancel request and turns the user's answer into a phase result.
     */
    private PhaseResult checkpoint(String title, BatchState batch) {
        if (!token.consume()) return PhaseResult.SUCCESS;

        CancellationRequest request = CancellationRequest.forEntry(currentPhase, title, batch);
        CancellationChoice choice = prompt.ask(request);
        if (choice == null || !request.offers(choice)) return PhaseResult.SUCCESS;
        logger.debug("Cancellation choice in {}: {}", currentPhase, choice);

        switch (choice) {
            case CANCEL_ENTRY:
                return PhaseResult.CANCELLED;
            case CANCEL_ALL_ENTRIES:
                batch.cancelAll();
                return PhaseResult.CANCELLED;
            case CONTINUE_WITHOUT_IMAGES:
            case SKIP_IMAGES_CURRENT:
                return PhaseResult.SKIP_IMAGES;
            case SKIP_IMAGES_ALL:
                batch.setSkipImagesForAll(true);
                return PhaseResult.SKIP_IMAGES;
            case INCLUDE_IMAGES_ALL:
                batch.setSkipImagesForAll(false);
                return PhaseResult.SUCCESS;
            default:
                return PhaseResult.SUCCESS;
        }
    }

    private DownloadOutcome abandon(long entryId) {
        logger.info("Download of entry {} cancelled, cleaning up", entryId);
        store.delete(entryId);
        return DownloadOutcome.cancelled(entryId);
    }
}
