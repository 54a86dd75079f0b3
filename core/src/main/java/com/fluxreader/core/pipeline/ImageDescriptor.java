package com.fluxreader.core.pipeline;

/**
 * One discovered image of an entry. Lives for a single pipeline run; only
 * {@link #getFilename()} and {@link #getSourceUrl()} end up in the entry metadata.
 */
public class ImageDescriptor {

    private final String sourceUrl;
    private final String highResUrl;
    private final String filename;
    private final Integer width;
    private final Integer height;

    // Status-Felder
    private boolean downloaded;
    private String failureReason;

    public ImageDescriptor(String sourceUrl, String highResUrl, String filename, Integer width, Integer height) {
        this.sourceUrl = sourceUrl;
        this.highResUrl = highResUrl;
        this.filename = filename;
        this.width = width;
        this.height = height;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getHighResUrl() {
        return highResUrl;
    }

    /**
     * The URL actually fetched: the high-resolution variant when one was found.
     */
    public String getDownloadUrl() {
        return highResUrl != null ? highResUrl : sourceUrl;
    }

    public String getFilename() {
        return filename;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public boolean isDownloaded() {
        return downloaded;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void markDownloaded() {
        this.downloaded = true;
        this.failureReason = null;
    }

    public void markFailed(String reason) {
        this.downloaded = false;
        this.failureReason = reason;
    }

    @Override
    public String toString() {
        return filename + " <- " + sourceUrl + (downloaded ? " [ok]" : failureReason != null ? " [" + failureReason + "]" : "");
    }
}
