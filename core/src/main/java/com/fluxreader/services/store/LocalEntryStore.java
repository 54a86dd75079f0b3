package com.fluxreader.services.store;

import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.common.util.FileUtils;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;

/**
 * Downloaded entries on disk. Metadata writes go to disk first, then to the shared {@link EntryInfoCache}.
 */
public class LocalEntryStore {
    private static final Logger logger = LoggerFactory.getLogger(LocalEntryStore.class);

    private final EntryPaths paths;
    private final EntryInfoCache cache;
    private final Gson gson;

    public LocalEntryStore(EntryPaths paths, EntryInfoCache cache) {
        this.paths = paths;
        this.cache = cache;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        File root = paths.getRoot();
        if (!root.exists() && !root.mkdirs()) {
            logger.error("Cannot create download directory {}", root.getAbsolutePath());
        }
    }

    public EntryPaths getPaths() {
        return paths;
    }

    public EntryInfoCache getCache() {
        return cache;
    }

    public boolean isDownloaded(long entryId) {
        return paths.isDownloaded(entryId);
    }

    public File getHtmlFile(long entryId) {
        return paths.htmlFile(entryId);
    }

    public File getEntryDir(long entryId) {
        return paths.entryDir(entryId);
    }

    public List<Long> listEntryIds() {
        return paths.listEntryIds();
    }

    public File createEntryDir(long entryId) {
        File dir = paths.entryDir(entryId);
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new LocalStoreException("Cannot create directory " + dir.getAbsolutePath());
        }
        return dir;
    }

    public void writeHtml(long entryId, String html) {
        try {
            FileUtils.writeAtomically(paths.htmlFile(entryId).toPath(), html);
        } catch (IOException e) {
            throw new LocalStoreException("Cannot write HTML for entry " + entryId, e);
        }
    }

    public void saveMetadata(EntryMetadata metadata) {
        long id = metadata.getId();
        try {
            FileUtils.writeAtomically(paths.metadataFile(id).toPath(), gson.toJson(metadata));
        } catch (IOException e) {
            throw new LocalStoreException("Cannot write metadata for entry " + id, e);
        }
        cache.put(id, metadata);
    }

    public Optional<EntryMetadata> loadMetadata(long entryId) {
        Optional<EntryMetadata> cached = cache.get(entryId);
        if (cached.isPresent()) return cached;

        File file = paths.metadataFile(entryId);
        if (!file.isFile()) return Optional.empty();
        try (Reader r = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            EntryMetadata m = gson.fromJson(r, EntryMetadata.class);
            if (m == null) return Optional.empty();
            cache.put(entryId, m);
            return Optional.of(m);
        } catch (IOException | JsonParseException e) {
            logger.warn("Unreadable metadata for entry {}: {}", entryId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Local optimistic status update. Returns false when the entry is not stored locally.
     */
    public boolean updateStatus(long entryId, EntryStatus status) {
        Optional<EntryMetadata> loaded = loadMetadata(entryId);
        if (loaded.isEmpty()) return false;
        EntryMetadata m = loaded.get();
        m.setStatus(status);
        return persist(m);
    }

    public boolean updateStarred(long entryId, boolean starred) {
        Optional<EntryMetadata> loaded = loadMetadata(entryId);
        if (loaded.isEmpty()) return false;
        EntryMetadata m = loaded.get();
        m.setStarred(starred);
        return persist(m);
    }

    private boolean persist(EntryMetadata m) {
        m.touch();
        try {
            saveMetadata(m);
            return true;
        } catch (LocalStoreException e) {
            logger.error(e.getMessage(), e);
            return false;
        }
    }

    public boolean delete(long entryId) {
        boolean deleted = FileUtils.deleteRecursive(paths.entryDir(entryId));
        cache.invalidate(entryId);
        if (deleted) logger.info("Deleted local entry {}", entryId);
        return deleted;
    }

    /**
     * @return number of entry directories removed
     */
    public int clearAll() {
        int removed = 0;
        for (long id : listEntryIds()) {
            if (delete(id)) removed++;
        }
        cache.invalidateAll();
        logger.info("Cleared {} local entries", removed);
        return removed;
    }
}
