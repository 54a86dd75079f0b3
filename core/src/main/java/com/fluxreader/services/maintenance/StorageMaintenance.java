package com.fluxreader.services.maintenance;

import com.fluxreader.common.util.TimeUtils;
import com.fluxreader.core.pipeline.ImageDescriptor;
import com.fluxreader.core.pipeline.ImageFetcher;
import com.fluxreader.services.store.EntryMetadata;
import com.fluxreader.services.store.EntryPaths;
import com.fluxreader.services.store.LocalEntryStore;
import com.fluxreader.services.store.StorageStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Housekeeping over the download directory: statistics, image cleanup and recovery, age-based purge.
 */
public class StorageMaintenance {
    private static final Logger logger = LoggerFactory.getLogger(StorageMaintenance.class);

    /** Age thresholds offered for {@link #deleteOlderThan(int)}. */
    public static final Set<Integer> SUPPORTED_AGES = Set.of(7, 30, 90, 180);

    private final LocalEntryStore store;
    private Supplier<Instant> clock = Instant::now;

    public StorageMaintenance(LocalEntryStore store) {
        this.store = store;
    }

    public void setClock(Supplier<Instant> clock) {
        this.clock = clock;
    }

    public StorageStats stats() {
        int entries = 0;
        int images = 0;
        long total = 0;
        long imageBytes = 0;
        for (long id : store.listEntryIds()) {
            File dir = store.getEntryDir(id);
            File[] files = dir.listFiles(File::isFile);
            if (files == null) continue;
            entries++;
            for (File f : files) {
                total += f.length();
                if (isImageFile(f)) {
                    images++;
                    imageBytes += f.length();
                }
            }
        }
        return new StorageStats(entries, total, images, imageBytes);
    }

    /**
     * Removes every image file but keeps the HTML and metadata of each entry.
     *
     * @return number of files deleted
     */
    public int deleteAllImages() {
        int deleted = 0;
        for (long id : store.listEntryIds()) {
            File[] files = store.getEntryDir(id).listFiles(f -> f.isFile() && isImageFile(f));
            if (files == null) continue;
            for (File f : files) {
                if (f.delete()) {
                    deleted++;
                } else {
                    logger.warn("Could not delete image {}", f.getAbsolutePath());
                }
            }
        }
        logger.info("Deleted {} image files", deleted);
        return deleted;
    }

    /**
     * Re-fetches images listed in the metadata that are missing on disk.
     *
     * @return number of images recovered
     */
    public int recoverImages(ImageFetcher fetcher) {
        int recovered = 0;
        int missing = 0;
        for (long id : store.listEntryIds()) {
            Optional<EntryMetadata> metadata = store.loadMetadata(id);
            if (metadata.isEmpty()) continue;
            File dir = store.getEntryDir(id);
            for (Map.Entry<String, String> image : metadata.get().getImages().entrySet()) {
                if (new File(dir, image.getKey()).exists()) continue;
                missing++;
                ImageDescriptor descriptor = new ImageDescriptor(image.getValue(), null, image.getKey(), null, null);
                if (fetcher.fetch(descriptor, dir.toPath(), metadata.get().getUrl())) {
                    recovered++;
                } else {
                    logger.debug("Recovery failed for {} of entry {}: {}", image.getKey(), id, descriptor.getFailureReason());
                }
            }
        }
        logger.info("Recovered {} of {} missing images", recovered, missing);
        return recovered;
    }

    /**
     * Deletes entries published more than {@code days} days ago. Entries without a usable
     * publish date are aged by the modification time of their HTML file.
     *
     * @return number of entries deleted
     */
    public int deleteOlderThan(int days) {
        if (!SUPPORTED_AGES.contains(days)) {
            throw new IllegalArgumentException("Unsupported age: " + days + " days (use 7, 30, 90 or 180)");
        }
        long cutoff = clock.get().minus(days, ChronoUnit.DAYS).getEpochSecond();
        int deleted = 0;
        for (long id : store.listEntryIds()) {
            Long age = entryTimestamp(id);
            if (age != null && age < cutoff && store.delete(id)) {
                deleted++;
            }
        }
        logger.info("Deleted {} entries older than {} days", deleted, days);
        return deleted;
    }

    public int clearAll() {
        return store.clearAll();
    }

    public String describe() {
        StorageStats stats = stats();
        return stats + " in " + store.getPaths().getRoot().getAbsolutePath();
    }

    private Long entryTimestamp(long id) {
        Long published = store.loadMetadata(id)
                .map(EntryMetadata::getPublishedAt)
                .map(TimeUtils::dateToUnix)
                .orElse(null);
        if (published != null) return published;
        File html = store.getHtmlFile(id);
        return html.exists() ? html.lastModified() / 1000 : null;
    }

    private static boolean isImageFile(File f) {
        String name = f.getName();
        return !name.equals(EntryPaths.HTML_FILE) && !name.equals(EntryPaths.METADATA_FILE) && !name.endsWith(".tmp");
    }
}
