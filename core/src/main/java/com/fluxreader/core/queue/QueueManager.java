package com.fluxreader.core.queue;

import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.common.util.FileUtils;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * JSON-file backed {@link MutationQueue}. One file per mutation kind inside the queue directory.
 * <p>
 * Several instances may point at the same directory (a background worker opens its own),
 * so every read-modify-write runs under a lock shared by all instances for that file.
 */
public class QueueManager implements MutationQueue {
    private static final Logger logger = LoggerFactory.getLogger(QueueManager.class);
    private static final Map<String, Object> FILE_LOCKS = new ConcurrentHashMap<>();

    private static final Type STATUS_TYPE = new TypeToken<LinkedHashMap<Long, PendingStatusChange>>() {}.getType();
    private static final Type COLLECTION_TYPE = new TypeToken<LinkedHashMap<Long, PendingCollectionOperation>>() {}.getType();
    private static final Type BOOKMARK_TYPE = new TypeToken<LinkedHashMap<Long, PendingBookmarkChange>>() {}.getType();

    private final File statusFile;
    private final File feedFile;
    private final File categoryFile;
    private final File bookmarkFile;
    private final Gson gson;

    public QueueManager(File queueDir) {
        if (!queueDir.exists() && !queueDir.mkdirs()) {
            logger.warn("Could not create queue directory {}", queueDir.getAbsolutePath());
        }
        this.statusFile = new File(queueDir, "status_queue.json");
        this.feedFile = new File(queueDir, "feed_queue.json");
        this.categoryFile = new File(queueDir, "category_queue.json");
        this.bookmarkFile = new File(queueDir, "bookmark_queue.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    // --- Entry status ---

    @Override
    public void enqueueStatus(long entryId, EntryStatus newStatus) {
        PendingStatusChange change = new PendingStatusChange(entryId, newStatus, newStatus.opposite(), nowSeconds());
        update(statusFile, STATUS_TYPE, (Map<Long, PendingStatusChange> q) -> q.put(entryId, change));
        logger.info("Queued status change: entry {} -> {}", entryId, newStatus);
    }

    @Override
    public boolean removeStatus(long entryId) {
        return update(statusFile, STATUS_TYPE, (Map<Long, PendingStatusChange> q) -> q.remove(entryId));
    }

    @Override
    public int removeStatuses(Collection<Long> entryIds, EntryStatus sentStatus) {
        int[] removed = {0};
        update(statusFile, STATUS_TYPE, (Map<Long, PendingStatusChange> q) -> {
            for (Long id : entryIds) {
                PendingStatusChange pending = q.get(id);
                if (pending != null && pending.newStatus() == sentStatus) {
                    q.remove(id);
                    removed[0]++;
                }
            }
        });
        return removed[0];
    }

    @Override
    public Map<Long, PendingStatusChange> loadStatusQueue() {
        synchronized (lockFor(statusFile)) {
            return read(statusFile, STATUS_TYPE);
        }
    }

    @Override
    public boolean saveStatusQueue(Map<Long, PendingStatusChange> queue) {
        synchronized (lockFor(statusFile)) {
            return write(statusFile, queue);
        }
    }

    @Override
    public boolean clearStatusQueue() {
        return clear(statusFile);
    }

    // --- Collections ---

    @Override
    public void enqueueCollection(CollectionKind kind, long id) {
        PendingCollectionOperation op = PendingCollectionOperation.markAllRead(kind, id);
        update(fileFor(kind), COLLECTION_TYPE, (Map<Long, PendingCollectionOperation> q) -> q.put(id, op));
        logger.info("Queued mark-all-read for {} {}", kind.label(), id);
    }

    @Override
    public boolean removeCollection(CollectionKind kind, long id) {
        return update(fileFor(kind), COLLECTION_TYPE, (Map<Long, PendingCollectionOperation> q) -> q.remove(id));
    }

    @Override
    public Map<Long, PendingCollectionOperation> loadCollectionQueue(CollectionKind kind) {
        File file = fileFor(kind);
        synchronized (lockFor(file)) {
            return read(file, COLLECTION_TYPE);
        }
    }

    @Override
    public boolean clearCollectionQueue(CollectionKind kind) {
        return clear(fileFor(kind));
    }

    // --- Bookmarks ---

    @Override
    public void enqueueBookmark(long entryId, boolean starred) {
        PendingBookmarkChange change = new PendingBookmarkChange(entryId, starred, nowSeconds());
        update(bookmarkFile, BOOKMARK_TYPE, (Map<Long, PendingBookmarkChange> q) -> q.put(entryId, change));
        logger.info("Queued bookmark change: entry {} -> starred={}", entryId, starred);
    }

    @Override
    public boolean removeBookmark(long entryId) {
        return update(bookmarkFile, BOOKMARK_TYPE, (Map<Long, PendingBookmarkChange> q) -> q.remove(entryId));
    }

    @Override
    public Map<Long, PendingBookmarkChange> loadBookmarkQueue() {
        synchronized (lockFor(bookmarkFile)) {
            return read(bookmarkFile, BOOKMARK_TYPE);
        }
    }

    @Override
    public boolean clearBookmarkQueue() {
        return clear(bookmarkFile);
    }

    @Override
    public QueueCounts getTotalQueueCount() {
        return new QueueCounts(
                loadStatusQueue().size(),
                loadBookmarkQueue().size(),
                loadCollectionQueue(CollectionKind.FEED).size(),
                loadCollectionQueue(CollectionKind.CATEGORY).size());
    }

    // --- Internals ---

    private File fileFor(CollectionKind kind) {
        return kind == CollectionKind.FEED ? feedFile : categoryFile;
    }

    private <V> boolean update(File file, Type type, Consumer<Map<Long, V>> mutation) {
        synchronized (lockFor(file)) {
            Map<Long, V> queue = read(file, type);
            mutation.accept(queue);
            return write(file, queue);
        }
    }

    private boolean clear(File file) {
        synchronized (lockFor(file)) {
            if (!file.exists()) return true;
            try {
                Files.delete(file.toPath());
                logger.info("Cleared queue {}", file.getName());
                return true;
            } catch (IOException e) {
                logger.error("Failed to clear queue {}", file.getName(), e);
                return false;
            }
        }
    }

    private <V> Map<Long, V> read(File file, Type type) {
        if (!file.exists()) return new LinkedHashMap<>();
        try (Reader r = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            Map<Long, V> loaded = gson.fromJson(r, type);
            return loaded != null ? loaded : new LinkedHashMap<>();
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load queue {}, treating it as empty", file.getName(), e);
            return new LinkedHashMap<>();
        }
    }

    private boolean write(File file, Map<Long, ?> queue) {
        try {
            FileUtils.writeAtomically(file.toPath(), gson.toJson(queue));
            return true;
        } catch (IOException e) {
            logger.error("Failed to save queue {}", file.getName(), e);
            return false;
        }
    }

    private static Object lockFor(File file) {
        String key;
        try {
            key = file.getCanonicalPath();
        } catch (IOException e) {
            key = file.getAbsolutePath();
        }
        return FILE_LOCKS.computeIfAbsent(key, k -> new Object());
    }

    private static long nowSeconds() {
        return System.currentTimeMillis() / 1000;
    }
}
