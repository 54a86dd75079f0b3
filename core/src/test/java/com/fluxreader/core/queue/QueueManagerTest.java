package com.fluxreader.core.queue;

import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JSON-file backed mutation queue
 */
class QueueManagerTest extends TestBase {

    private File queueDir;
    private QueueManager queue;

    @BeforeEach
    void createQueue() {
        queueDir = new File(dataDir, "queue");
        queue = new QueueManager(queueDir);
    }

    @Test
    void testEnqueueSameStatusTwiceKeepsOneEntry() {
        queue.enqueueStatus(42, EntryStatus.READ);
        queue.enqueueStatus(42, EntryStatus.READ);

        Map<Long, PendingStatusChange> pending = queue.loadStatusQueue();
        assertEquals(1, pending.size(), "Only one pending change per entry");
        assertEquals(EntryStatus.READ, pending.get(42L).newStatus());
    }

    @Test
    void testLaterEnqueueOverwrites() {
        queue.enqueueStatus(42, EntryStatus.READ);
        queue.enqueueStatus(42, EntryStatus.UNREAD);

        Map<Long, PendingStatusChange> pending = queue.loadStatusQueue();
        assertEquals(1, pending.size());
        assertEquals(EntryStatus.UNREAD, pending.get(42L).newStatus(), "Last write wins");
        assertEquals(EntryStatus.READ, pending.get(42L).originalStatus(), "Original status is the opposite");
    }

    @Test
    void testQueueSurvivesNewInstance() {
        queue.enqueueStatus(7, EntryStatus.READ);
        queue.enqueueBookmark(8, true);
        queue.enqueueCollection(CollectionKind.FEED, 3);

        QueueManager reopened = new QueueManager(queueDir);
        QueueCounts counts = reopened.getTotalQueueCount();
        assertEquals(new QueueCounts(1, 1, 1, 0), counts);
        assertEquals(3, counts.total());
        assertTrue(reopened.loadBookmarkQueue().get(8L).starred());
    }

    @Test
    void testStatusFileUsesWireNames() throws Exception {
        queue.enqueueStatus(5, EntryStatus.UNREAD);

        String json = Files.readString(new File(queueDir, "status_queue.json").toPath(), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"new_status\": \"unread\""), json);
        assertTrue(json.contains("\"original_status\": \"read\""), json);
        assertTrue(json.contains("\"entry_id\": 5"), json);
    }

    @Test
    void testConditionalRemovalKeepsNewerChange() {
        queue.enqueueStatus(1, EntryStatus.READ);
        queue.enqueueStatus(2, EntryStatus.READ);
        // user flipped entry 2 back while the "read" call was in flight
        queue.enqueueStatus(2, EntryStatus.UNREAD);

        int removed = queue.removeStatuses(List.of(1L, 2L), EntryStatus.READ);

        assertEquals(1, removed);
        Map<Long, PendingStatusChange> pending = queue.loadStatusQueue();
        assertFalse(pending.containsKey(1L));
        assertEquals(EntryStatus.UNREAD, pending.get(2L).newStatus());
    }

    @Test
    void testRemoveStatusAndClear() {
        queue.enqueueStatus(1, EntryStatus.READ);
        queue.enqueueStatus(2, EntryStatus.READ);

        assertTrue(queue.removeStatus(1));
        assertEquals(1, queue.loadStatusQueue().size());

        assertTrue(queue.clearStatusQueue());
        assertTrue(queue.loadStatusQueue().isEmpty());
        assertFalse(new File(queueDir, "status_queue.json").exists(), "Clearing deletes the file");
        assertTrue(queue.clearStatusQueue(), "Clearing an absent queue succeeds");
    }

    @Test
    void testCollectionQueuesAreSeparate() {
        queue.enqueueCollection(CollectionKind.FEED, 10);
        queue.enqueueCollection(CollectionKind.CATEGORY, 10);
        queue.enqueueCollection(CollectionKind.CATEGORY, 10);

        assertEquals(1, queue.loadCollectionQueue(CollectionKind.FEED).size());
        assertEquals(1, queue.loadCollectionQueue(CollectionKind.CATEGORY).size());
        PendingCollectionOperation op = queue.loadCollectionQueue(CollectionKind.CATEGORY).get(10L);
        assertEquals(PendingCollectionOperation.MARK_ALL_READ, op.operation());

        assertTrue(queue.removeCollection(CollectionKind.FEED, 10));
        assertTrue(queue.loadCollectionQueue(CollectionKind.FEED).isEmpty());
        assertEquals(1, queue.loadCollectionQueue(CollectionKind.CATEGORY).size());
    }

    @Test
    void testCorruptFileIsTreatedAsEmpty() throws Exception {
        queueDir.mkdirs();
        Files.writeString(new File(queueDir, "status_queue.json").toPath(), "{not json", StandardCharsets.UTF_8);

        assertTrue(queue.loadStatusQueue().isEmpty());
        queue.enqueueStatus(9, EntryStatus.READ);
        assertEquals(1, queue.loadStatusQueue().size(), "Next write replaces the corrupt document");
    }

    @Test
    void testBookmarkQueueStoresDesiredValue() {
        queue.enqueueBookmark(3, true);
        queue.enqueueBookmark(3, false);

        Map<Long, PendingBookmarkChange> pending = queue.loadBookmarkQueue();
        assertEquals(1, pending.size());
        assertFalse(pending.get(3L).starred());
    }
}
