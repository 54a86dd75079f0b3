package com.fluxreader.core.workflow;

import com.fluxreader.common.model.Entry;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.core.pipeline.DefaultContentPipeline;
import com.fluxreader.core.pipeline.ImageDescriptor;
import com.fluxreader.services.store.EntryInfoCache;
import com.fluxreader.services.store.EntryPaths;
import com.fluxreader.services.store.LocalEntryStore;
import com.fluxreader.test.FakeGateway;
import com.fluxreader.test.FakeImageFetcher;
import com.fluxreader.test.RecordingNotifier;
import com.fluxreader.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for downloading several entries with shared decisions
 */
class BatchDownloadWorkflowTest extends TestBase {

    private Configuration config;
    private LocalEntryStore store;
    private FakeGateway gateway;
    private FakeImageFetcher fetcher;
    private DownloadWorkflow workflow;
    private BatchDownloadWorkflow batch;

    @BeforeEach
    void createBatch() {
        config = new Configuration();
        config.progressThrottleMs = 0;
        store = new LocalEntryStore(new EntryPaths(dir("miniflux")), new EntryInfoCache());
        gateway = new FakeGateway();
        fetcher = new FakeImageFetcher();
        build(fetcher);
    }

    private void build(FakeImageFetcher imageFetcher) {
        workflow = new DownloadWorkflow(store, new DefaultContentPipeline(imageFetcher), config, new RecordingNotifier());
        batch = new BatchDownloadWorkflow(workflow, gateway, store, config);
    }

    @Test
    void testAllEntriesDownloaded() {
        BatchSummary summary = batch.downloadAll(List.of(
                DownloadWorkflowTest.entryWithImages(1, 1),
                DownloadWorkflowTest.entryWithImages(2, 1)));

        assertEquals(2, summary.completed());
        assertEquals("All 2 entries downloaded successfully!", summary.message());
        assertEquals(List.of(1L, 2L), store.listEntryIds());
    }

    @Test
    void testEmptyBatch() {
        BatchSummary summary = batch.downloadAll(List.of());

        assertEquals("Nothing to download.", summary.message());
    }

    @Test
    void testCancelAllBetweenEntries() {
        workflow.getCancellationToken().requestCancel();
        List<CancellationRequest> asked = new ArrayList<>();
        workflow.setCancellationPrompt(request -> {
            asked.add(request);
            return CancellationChoice.CANCEL_ALL_ENTRIES;
        });

        BatchSummary summary = batch.downloadAll(List.of(
                DownloadWorkflowTest.entryWithImages(1, 1),
                DownloadWorkflowTest.entryWithImages(2, 1)));

        assertTrue(summary.cancelled());
        assertEquals("Batch download cancelled. Downloaded 0/2 entries.", summary.message());
        assertTrue(store.listEntryIds().isEmpty());
        assertEquals(1, asked.size());
        assertTrue(asked.get(0).offers(CancellationChoice.SKIP_IMAGES_ALL));
    }

    @Test
    void testCancelAllDuringImagesStopsBatch() {
        FakeImageFetcher interrupting = new FakeImageFetcher() {
            @Override
            public boolean fetch(ImageDescriptor image, Path entryDir, String entryUrl) {
                workflow.getCancellationToken().requestCancel();
                return super.fetch(image, entryDir, entryUrl);
            }
        };
        build(interrupting);
        workflow.setCancellationPrompt(request -> CancellationChoice.CANCEL_ALL_ENTRIES);

        BatchSummary summary = batch.downloadAll(List.of(
                DownloadWorkflowTest.entryWithImages(1, 3),
                DownloadWorkflowTest.entryWithImages(2, 3)));

        assertTrue(summary.cancelled());
        assertEquals(0, summary.completed());
        assertFalse(store.getEntryDir(1).exists(), "Interrupted entry is cleaned up");
        assertFalse(store.getEntryDir(2).exists(), "Later entries never start");
    }

    @Test
    void testSkipImagesForAllEntries() {
        workflow.getCancellationToken().requestCancel();
        workflow.setCancellationPrompt(request -> CancellationChoice.SKIP_IMAGES_ALL);

        BatchSummary summary = batch.downloadAll(List.of(
                DownloadWorkflowTest.entryWithImages(1, 2),
                DownloadWorkflowTest.entryWithImages(2, 2)));

        assertEquals(2, summary.completed());
        assertTrue(fetcher.fetched.isEmpty());
        assertTrue(store.isDownloaded(1));
        assertTrue(store.isDownloaded(2));
    }

    @Test
    void testRefreshUsesFullServerContent() {
        Entry full = gateway.add(9, "Full", "2024-01-01T00:00:00Z");
        full.setContent("<p>Full text</p><img src=\"https://img.example/full.jpg\">");
        Entry listed = new Entry(9, "Full");
        listed.setSummary("Short");

        BatchSummary summary = batch.downloadAll(List.of(listed));

        assertEquals(1, summary.completed());
        assertEquals(List.of(9L), gateway.entryFetches);
        assertEquals(List.of("https://img.example/full.jpg"), fetcher.fetched);
    }

    @Test
    void testFailedRefreshFallsBackToListing() {
        gateway.online = false;
        Entry listed = new Entry(10, "Offline");
        listed.setSummary("<p>Short</p>");

        BatchSummary summary = batch.downloadAll(List.of(listed, new Entry(-1, "broken")));

        assertEquals(1, summary.completed());
        assertEquals(1, summary.failed());
        assertEquals("Batch download completed: 1 successful, 1 failed.", summary.message());
        assertTrue(store.isDownloaded(10));
    }

    @Test
    void testDirectoryFailureOnlyAffectsThatEntry() throws Exception {
        Files.writeString(store.getPaths().getRoot().toPath().resolve("5"), "not a directory");

        BatchSummary summary = batch.downloadAll(List.of(
                DownloadWorkflowTest.entryWithImages(5, 1),
                DownloadWorkflowTest.entryWithImages(6, 1)));

        assertEquals(1, summary.completed());
        assertEquals(1, summary.failed());
        assertFalse(summary.cancelled());
        assertEquals(DownloadOutcome.Status.FAILED, summary.outcomes().get(0).status());
        assertTrue(store.isDownloaded(6), "The next entry still downloads");
        assertEquals("Batch download completed: 1 successful, 1 failed.", summary.message());
    }
}
