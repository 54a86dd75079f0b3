package com.fluxreader.core.workflow;

import java.io.File;

/**
 * Result of running the download workflow for one entry.
 */
public record DownloadOutcome(long entryId, Status status, File htmlFile, int imagesFound, int imagesDownloaded,
                              String message) {

    public enum Status {
        DOWNLOADED,
        ALREADY_DOWNLOADED,
        CANCELLED,
        FAILED,
        INVALID
    }

    public static DownloadOutcome downloaded(long entryId, File htmlFile, int found, int downloaded, String summary) {
        return new DownloadOutcome(entryId, Status.DOWNLOADED, htmlFile, found, downloaded, summary);
    }

    public static DownloadOutcome alreadyDownloaded(long entryId, File htmlFile) {
        return new DownloadOutcome(entryId, Status.ALREADY_DOWNLOADED, htmlFile, 0, 0, "Already downloaded");
    }

    public static DownloadOutcome cancelled(long entryId) {
        return new DownloadOutcome(entryId, Status.CANCELLED, null, 0, 0, "Download cancelled");
    }

    public static DownloadOutcome failed(long entryId, String message) {
        return new DownloadOutcome(entryId, Status.FAILED, null, 0, 0, message);
    }

    public static DownloadOutcome invalid(long entryId, String message) {
        return new DownloadOutcome(entryId, Status.INVALID, null, 0, 0, message);
    }

    /**
     * True when a complete local copy exists afterwards.
     */
    public boolean isAvailable() {
        return status == Status.DOWNLOADED || status == Status.ALREADY_DOWNLOADED;
    }
}
