package com.fluxreader.core.workflow;

import com.fluxreader.common.model.Entry;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.core.pipeline.DefaultContentPipeline;
import com.fluxreader.core.pipeline.ImageDescriptor;
import com.fluxreader.services.navigation.NavigationContext;
import com.fluxreader.services.store.EntryInfoCache;
import com.fluxreader.services.store.EntryMetadata;
import com.fluxreader.services.store.EntryPaths;
import com.fluxreader.services.store.LocalEntryStore;
import com.fluxreader.test.FakeImageFetcher;
import com.fluxreader.test.RecordingNotifier;
import com.fluxreader.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the single entry download workflow
 */
class DownloadWorkflowTest extends TestBase {

    private Configuration config;
    private LocalEntryStore store;
    private FakeImageFetcher fetcher;
    private RecordingNotifier notifier;
    private DownloadWorkflow workflow;
    private final List<Long> opened = new ArrayList<>();

    @BeforeEach
    void createWorkflow() {
        config = new Configuration();
        config.progressThrottleMs = 0;
        store = new LocalEntryStore(new EntryPaths(dir("miniflux")), new EntryInfoCache());
        fetcher = new FakeImageFetcher();
        notifier = new RecordingNotifier();
        workflow = new DownloadWorkflow(store, new DefaultContentPipeline(fetcher), config, notifier);
        workflow.setViewer((id, html, context) -> opened.add(id));
    }

    static Entry entryWithImages(long id, int images) {
        Entry entry = new Entry(id, "Entry " + id);
        entry.setUrl("https://blog.example.com/posts/" + id);
        entry.setPublishedAt("2024-05-01T08:00:00Z");
        StringBuilder html = new StringBuilder("<p>Hello</p>");
        for (int i = 1; i <= images; i++) {
            html.append("<img src=\"/img/").append(id).append('-').append(i).append(".png\">");
        }
        entry.setContent(html.toString());
        return entry;
    }

    @Test
    void testDownloadWritesDocumentMetadataAndImages() throws Exception {
        DownloadOutcome outcome = workflow.download(entryWithImages(1, 2));

        assertEquals(DownloadOutcome.Status.DOWNLOADED, outcome.status());
        assertEquals(2, outcome.imagesDownloaded());
        assertEquals("All images downloaded successfully", outcome.message());
        assertTrue(store.isDownloaded(1));

        File dir = store.getEntryDir(1);
        assertTrue(new File(dir, "image_001.png").exists());
        assertTrue(new File(dir, "image_002.png").exists());
        String html = Files.readString(store.getHtmlFile(1).toPath(), StandardCharsets.UTF_8);
        assertTrue(html.contains("src=\"image_001.png\""), html);

        EntryMetadata metadata = store.loadMetadata(1).orElseThrow();
        assertEquals("https://blog.example.com/img/1-1.png", metadata.getImages().get("image_001.png"));
        assertEquals(DownloadPhase.IDLE, workflow.getCurrentPhase());
    }

    @Test
    void testReopenDoesNoWork() {
        workflow.downloadAndOpen(entryWithImages(2, 3), NavigationContext.global());
        int fetchesAfterFirst = fetcher.fetched.size();

        DownloadOutcome second = workflow.downloadAndOpen(entryWithImages(2, 3), NavigationContext.global());

        assertEquals(DownloadOutcome.Status.ALREADY_DOWNLOADED, second.status());
        assertEquals(fetchesAfterFirst, fetcher.fetched.size(), "No image fetched again");
        assertEquals(List.of(2L, 2L), opened, "Both calls open the local document");
    }

    @Test
    void testCancelEntryRemovesDirectory() {
        workflow.getCancellationToken().requestCancel();
        List<CancellationRequest> asked = new ArrayList<>();
        workflow.setCancellationPrompt(request -> {
            asked.add(request);
            return CancellationChoice.CANCEL_ENTRY;
        });

        DownloadOutcome outcome = workflow.downloadAndOpen(entryWithImages(3, 2), NavigationContext.global());

        assertEquals(DownloadOutcome.Status.CANCELLED, outcome.status());
        assertFalse(store.getEntryDir(3).exists(), "Partial download is removed");
        assertTrue(fetcher.fetched.isEmpty());
        assertTrue(opened.isEmpty());
        assertEquals(DownloadPhase.PREPARING, asked.get(0).phase());
        assertEquals(List.of(CancellationChoice.CANCEL_ENTRY, CancellationChoice.CONTINUE), asked.get(0).options());
    }

    @Test
    void testContinueWithoutImagesDuringDownload() {
        FakeImageFetcher interrupting = new FakeImageFetcher() {
            @Override
            public boolean fetch(ImageDescriptor image, Path entryDir, String entryUrl) {
                workflow.getCancellationToken().requestCancel();
                return super.fetch(image, entryDir, entryUrl);
            }
        };
        workflow = new DownloadWorkflow(store, new DefaultContentPipeline(interrupting), config, notifier);
        workflow.setCancellationPrompt(request -> {
            assertEquals(DownloadPhase.DOWNLOADING, request.phase());
            assertTrue(request.offers(CancellationChoice.RESUME));
            return CancellationChoice.CONTINUE_WITHOUT_IMAGES;
        });

        DownloadOutcome outcome = workflow.download(entryWithImages(4, 3));

        assertEquals(DownloadOutcome.Status.DOWNLOADED, outcome.status());
        assertEquals(1, interrupting.fetched.size(), "Remaining images are skipped");
        assertEquals("1 of 3 images downloaded", outcome.message());
        assertTrue(store.isDownloaded(4));
    }

    @Test
    void testImagesDisabledInSettings() {
        config.includeImages = false;

        DownloadOutcome outcome = workflow.download(entryWithImages(5, 3));

        assertTrue(fetcher.fetched.isEmpty());
        assertEquals("3 images found (skipped - disabled in settings)", outcome.message());
        assertEquals(3, store.loadMetadata(5).orElseThrow().getImages().size(), "Mapping kept for later recovery");
    }

    @Test
    void testFailedImageDoesNotFailEntry() {
        fetcher.failing.add("https://blog.example.com/img/6-2.png");

        DownloadOutcome outcome = workflow.download(entryWithImages(6, 2));

        assertTrue(outcome.isAvailable());
        assertEquals("1 of 2 images downloaded", outcome.message());
        assertFalse(new File(store.getEntryDir(6), "image_002.png").exists());
    }

    @Test
    void testEntryWithoutImages() {
        DownloadOutcome outcome = workflow.download(entryWithImages(7, 0));

        assertEquals("No images found in entry", outcome.message());
    }

    @Test
    void testInvalidEntry() {
        DownloadOutcome outcome = workflow.download(new Entry(0, "broken"));

        assertEquals(DownloadOutcome.Status.INVALID, outcome.status());
        assertEquals(1, notifier.errors.size());
        assertTrue(store.listEntryIds().isEmpty());
    }

    @Test
    void testSaveFailureKeepsDownloadedImages() throws Exception {
        File entryDir = store.createEntryDir(9);
        // a non-empty directory where the document goes cannot be replaced
        File blocked = new File(entryDir, EntryPaths.HTML_FILE);
        assertTrue(blocked.mkdirs());
        Files.writeString(new File(blocked, "keep.txt").toPath(), "x");

        DownloadOutcome outcome = workflow.downloadAndOpen(entryWithImages(9, 2), NavigationContext.global());

        assertEquals(DownloadOutcome.Status.FAILED, outcome.status());
        assertFalse(outcome.isAvailable());
        assertFalse(store.isDownloaded(9), "Entry must not count as downloaded");
        assertTrue(new File(entryDir, "image_001.png").exists(), "Images stay for a later recovery run");
        assertTrue(new File(entryDir, "image_002.png").exists());
        assertTrue(opened.isEmpty(), "Nothing is handed to the viewer");
        assertTrue(notifier.errors.get(0).startsWith("Failed to save entry"), notifier.errors.toString());
        assertEquals(DownloadPhase.IDLE, workflow.getCurrentPhase());
    }

    @Test
    void testDirectoryFailureAbandonsEntry() throws Exception {
        File root = store.getPaths().getRoot();
        Files.writeString(new File(root, "10").toPath(), "not a directory");

        DownloadOutcome outcome = workflow.download(entryWithImages(10, 1));

        assertEquals(DownloadOutcome.Status.FAILED, outcome.status());
        assertTrue(fetcher.fetched.isEmpty(), "No image is fetched without a directory");
        assertTrue(notifier.errors.get(0).startsWith("Failed to prepare download"), notifier.errors.toString());
    }
}
