package com.fluxreader.services.maintenance;

import com.fluxreader.common.model.Entry;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.services.store.EntryInfoCache;
import com.fluxreader.services.store.EntryMetadata;
import com.fluxreader.services.store.EntryPaths;
import com.fluxreader.services.store.LocalEntryStore;
import com.fluxreader.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for close-time auto deletion
 */
class AutoDeletePolicyTest extends TestBase {

    private Configuration config;
    private LocalEntryStore store;
    private AutoDeletePolicy policy;

    @BeforeEach
    void createPolicy() {
        config = new Configuration();
        config.autoDeleteReadOnClose = true;
        store = new LocalEntryStore(new EntryPaths(dir("miniflux")), new EntryInfoCache());
        policy = new AutoDeletePolicy(config, store);
    }

    private void stored(long id, EntryStatus status, boolean starred) {
        Entry entry = new Entry(id, "E" + id);
        entry.setStatus(status);
        entry.setStarred(starred);
        store.createEntryDir(id);
        store.saveMetadata(EntryMetadata.fromEntry(entry, Map.of()));
        store.writeHtml(id, "<html></html>");
    }

    @Test
    void testReadEntryIsDeleted() {
        stored(1, EntryStatus.READ, false);

        assertTrue(policy.onClose(1));
        assertFalse(store.getEntryDir(1).exists());
    }

    @Test
    void testStarredEntryIsNeverDeleted() {
        for (EntryStatus status : EntryStatus.values()) {
            stored(2, status, true);
            assertFalse(policy.onClose(2), "Starred entry with status " + status);
            assertTrue(store.isDownloaded(2));
        }
    }

    @Test
    void testUnreadEntryIsKept() {
        stored(3, EntryStatus.UNREAD, false);

        assertFalse(policy.onClose(3));
        assertTrue(store.isDownloaded(3));
    }

    @Test
    void testDisabledSetting() {
        config.autoDeleteReadOnClose = false;
        stored(4, EntryStatus.READ, false);

        assertFalse(policy.onClose(4));
        assertTrue(store.isDownloaded(4));
    }

    @Test
    void testEntryWithoutMetadata() {
        assertFalse(policy.onClose(5));
        assertFalse(policy.shouldDelete(null));
    }
}
